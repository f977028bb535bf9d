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

/**
 * Lower and upper colour scale limits for rendering a grid on a diverging
 * scale centred on zero.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
@Loggable
public final class DisplayRange {

    /**
     * Public constructor.
     *
     * @param lower The lower limit.
     * @param upper The upper limit.
     */
    public DisplayRange(final double lower, final double upper) {
        _lower = lower;
        _upper = upper;
    }

    public double getLower() {
        return _lower;
    }

    public double getUpper() {
        return _upper;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Lower", _lower)
                .add("Upper", _upper)
                .toString();
    }

    private final double _lower;
    private final double _upper;
}
