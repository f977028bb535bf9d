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

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.google.common.base.Preconditions;

import java.util.Collections;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Reducer backed by a caller supplied function. Unlike the built-in reducers
 * the function receives the raw values including {@code NaN} entries and is
 * responsible for its own treatment of missing values.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class CustomReducer implements Reducer {

    /**
     * Public constructor.
     *
     * @param name The name reported for this reducer.
     * @param function The reduction function.
     */
    public CustomReducer(final String name, final ToDoubleFunction<double[]> function) {
        Preconditions.checkArgument(!name.isEmpty(), "Custom reducer name cannot be empty");
        _name = name;
        _function = function;
    }

    @Override
    public String getName() {
        return _name;
    }

    @Override
    public Set<String> getAliases() {
        return Collections.emptySet();
    }

    @Override
    public double reduce(final double[] values) {
        return _function.applyAsDouble(values);
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("name", _name)
                .put("custom", true)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private final String _name;
    private final ToDoubleFunction<double[]> _function;
}
