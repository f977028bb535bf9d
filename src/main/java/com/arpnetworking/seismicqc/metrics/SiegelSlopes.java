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
package com.arpnetworking.seismicqc.metrics;

import com.arpnetworking.seismicqc.models.LinearFit;
import com.google.common.base.Preconditions;
import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.Arrays;

/**
 * Repeated median (Siegel) estimator of a straight line. For every point the
 * median slope to all points with a different abscissa is taken; the fitted
 * slope is the median of those medians and the intercept is the median of
 * {@code y - slope * x}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class SiegelSlopes {

    /**
     * Fit {@code y = slope * x + intercept}.
     *
     * @param y The dependent values.
     * @param x The independent values.
     * @return The fitted line.
     */
    public static LinearFit fit(final double[] y, final double[] x) {
        Preconditions.checkArgument(
                y.length == x.length,
                "Lengths do not match; y=%s, x=%s",
                y.length,
                x.length);
        final Median median = new Median();
        final double[] pointSlopes = new double[x.length];
        int pointCount = 0;
        final double[] slopes = new double[x.length];
        for (int i = 0; i < x.length; ++i) {
            int slopeCount = 0;
            for (int j = 0; j < x.length; ++j) {
                final double dx = x[j] - x[i];
                if (dx != 0.0) {
                    slopes[slopeCount++] = (y[j] - y[i]) / dx;
                }
            }
            if (slopeCount > 0) {
                pointSlopes[pointCount++] = median.evaluate(slopes, 0, slopeCount);
            }
        }
        if (pointCount == 0) {
            throw new IllegalArgumentException(String.format(
                    "At least two distinct abscissae are required; points=%d",
                    x.length));
        }
        final double slope = median.evaluate(Arrays.copyOf(pointSlopes, pointCount));
        final double[] intercepts = new double[x.length];
        for (int i = 0; i < x.length; ++i) {
            intercepts[i] = y[i] - slope * x[i];
        }
        return new LinearFit(slope, median.evaluate(intercepts));
    }

    private SiegelSlopes() {}
}
