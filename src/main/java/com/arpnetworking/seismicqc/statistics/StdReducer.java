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
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.Set;

/**
 * Population standard deviation of the present values. Use {@link ReducerFactory} for construction.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class StdReducer extends BaseReducer {

    @Override
    public String getName() {
        return "std";
    }

    @Override
    public Set<String> getAliases() {
        return ALIASES;
    }

    @Override
    protected double reducePresent(final double[] values) {
        return new StandardDeviation(false).evaluate(values);
    }

    /* package private */ StdReducer() { }

    private static final Set<String> ALIASES = ImmutableSet.of("stddev", "standard_deviation");
}
