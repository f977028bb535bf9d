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
package com.arpnetworking.seismicqc.models;

import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * One row of the long-form table comparing offset bin series: a single
 * gather's value in one offset bin, tagged with the series name.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
@Loggable
public final class SeriesPoint {

    /**
     * Public constructor.
     *
     * @param value The bin value.
     * @param offset The bin offset.
     * @param name The series name.
     */
    public SeriesPoint(final double value, final double offset, final String name) {
        _value = value;
        _offset = offset;
        _name = name;
    }

    public double getValue() {
        return _value;
    }

    public double getOffset() {
        return _offset;
    }

    public String getName() {
        return _name;
    }

    /**
     * Create a copy with the value shifted.
     *
     * @param shift The additive shift.
     * @return A new {@link SeriesPoint}.
     */
    public SeriesPoint shift(final double shift) {
        return new SeriesPoint(_value + shift, _offset, _name);
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        final SeriesPoint other = (SeriesPoint) object;
        return Double.compare(_value, other._value) == 0
                && Double.compare(_offset, other._offset) == 0
                && Objects.equal(_name, other._name);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_value, _offset, _name);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Value", _value)
                .add("Offset", _offset)
                .add("Name", _name)
                .toString();
    }

    private final double _value;
    private final double _offset;
    private final String _name;
}
