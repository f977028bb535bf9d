/*
 * Copyright 2024 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.seismicqc.statistics;

import com.google.common.collect.ImmutableSet;

import java.util.Set;

/**
 * Root mean square of the present values; the usual amplitude measure of an offset bin. Use {@link ReducerFactory} for construction.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class RmsReducer extends BaseReducer {

    @Override
    public String getName() {
        return "rms";
    }

    @Override
    public Set<String> getAliases() {
        return ALIASES;
    }

    @Override
    protected double reducePresent(final double[] values) {
        double sumOfSquares = 0.0;
        for (final double value : values) {
            sumOfSquares += value * value;
        }
        return Math.sqrt(sumOfSquares / values.length);
    }

    /* package private */ RmsReducer() { }

    private static final Set<String> ALIASES = ImmutableSet.of("root_mean_square");
}
