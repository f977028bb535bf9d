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
 * Counts the present values. Use {@link ReducerFactory} for construction.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class CountReducer extends BaseReducer {

    @Override
    public String getName() {
        return "count";
    }

    @Override
    public Set<String> getAliases() {
        return ALIASES;
    }

    @Override
    protected double reducePresent(final double[] values) {
        return values.length;
    }

    @Override
    protected double reduceEmpty() {
        return 0.0;
    }

    /* package private */ CountReducer() { }

    private static final Set<String> ALIASES = ImmutableSet.of("n");
}
