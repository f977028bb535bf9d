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

import java.util.Set;

/**
 * Reduces a set of values to a single scalar. Input arrays may contain
 * {@code NaN} entries which mark missing values. Use {@link ReducerFactory}
 * to obtain instances.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public interface Reducer {

    /**
     * Accessor for the canonical name of the reducer.
     *
     * @return The name of the reducer.
     */
    String getName();

    /**
     * Accessor for any aliases of the reducer.
     *
     * @return The aliases of the reducer.
     */
    Set<String> getAliases();

    /**
     * Reduce the values.
     *
     * @param values The values to reduce; {@code NaN} entries are missing values.
     * @return The reduced value.
     */
    double reduce(double[] values);
}
