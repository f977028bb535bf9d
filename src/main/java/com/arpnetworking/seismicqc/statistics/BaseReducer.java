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
import com.arpnetworking.seismicqc.utility.NanMath;
import com.arpnetworking.steno.LogValueMapFactory;

import java.util.Collections;
import java.util.Set;

/**
 * Base class for the built-in reducers. Missing values are dropped before
 * {@link #reducePresent(double[])} is invoked; an input with no present value
 * reduces to {@link #reduceEmpty()}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public abstract class BaseReducer implements Reducer {

    @Override
    public Set<String> getAliases() {
        return Collections.emptySet();
    }

    @Override
    public final double reduce(final double[] values) {
        final double[] present = NanMath.dropNan(values);
        if (present.length == 0) {
            return reduceEmpty();
        }
        return reducePresent(present);
    }

    /**
     * Reduce a non-empty array without missing values.
     *
     * @param values The present values.
     * @return The reduced value.
     */
    protected abstract double reducePresent(double[] values);

    /**
     * The result for an input without present values.
     *
     * @return {@code NaN} unless overridden.
     */
    protected double reduceEmpty() {
        return Double.NaN;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o != null && getClass().equals(o.getClass());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("name", getName())
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }
}
