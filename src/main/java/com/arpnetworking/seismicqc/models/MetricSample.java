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
 * A single per-gather measurement located at survey coordinates.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
@Loggable
public final class MetricSample {

    /**
     * Public constructor.
     *
     * @param x The x coordinate.
     * @param y The y coordinate.
     * @param value The measured value.
     */
    public MetricSample(final double x, final double y, final double value) {
        _x = x;
        _y = y;
        _value = value;
    }

    public double getX() {
        return _x;
    }

    public double getY() {
        return _y;
    }

    public double getValue() {
        return _value;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        final MetricSample other = (MetricSample) object;
        return Double.compare(_x, other._x) == 0
                && Double.compare(_y, other._y) == 0
                && Double.compare(_value, other._value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_x, _y, _value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("X", _x)
                .add("Y", _y)
                .add("Value", _value)
                .toString();
    }

    private final double _x;
    private final double _y;
    private final double _value;
}
