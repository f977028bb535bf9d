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
 * Slope and intercept of a fitted line {@code y = slope * x + intercept}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
@Loggable
public final class LinearFit {

    /**
     * Public constructor.
     *
     * @param slope The slope.
     * @param intercept The intercept.
     */
    public LinearFit(final double slope, final double intercept) {
        _slope = slope;
        _intercept = intercept;
    }

    public double getSlope() {
        return _slope;
    }

    public double getIntercept() {
        return _intercept;
    }

    /**
     * Evaluate the line.
     *
     * @param x The abscissa.
     * @return {@code slope * x + intercept}
     */
    public double evaluate(final double x) {
        return x * _slope + _intercept;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Slope", _slope)
                .add("Intercept", _intercept)
                .toString();
    }

    private final double _slope;
    private final double _intercept;
}
