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

/**
 * Metrics over first break picking times and trace geometry.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class PickingMetrics {

    /**
     * Mean apparent velocity {@code offset / time} over the picks later than
     * {@link #MINIMUM_PICKING_TIME}.
     *
     * @param pickingTimes The picking time of every trace.
     * @param offsets The offset of every trace.
     * @return The mean velocity, or {@code NaN} if no pick qualifies.
     */
    public static double velocity(final double[] pickingTimes, final double[] offsets) {
        checkLength("offsets", offsets, pickingTimes.length);
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < pickingTimes.length; ++i) {
            if (pickingTimes[i] > MINIMUM_PICKING_TIME) {
                sum += offsets[i] / pickingTimes[i];
                ++count;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    /**
     * Residuals of a robust linear moveout fit. Geometry arrays hold either one
     * value per trace or a single value shared by all traces.
     *
     * @param pickingTimes The picking time of every trace.
     * @param offsets The offset of every trace.
     * @param receiverX The receiver X coordinates.
     * @param receiverY The receiver Y coordinates.
     * @param receiverElevation The receiver elevations.
     * @param sourceX The source X coordinates.
     * @param sourceY The source Y coordinates.
     * @param sourceElevation The source elevations.
     * @return Two values: the mean absolute residual of the fit and the mean
     * absolute time effect of the elevation difference.
     */
    public static double[] linearDiff(
            final double[] pickingTimes,
            final double[] offsets,
            final double[] receiverX,
            final double[] receiverY,
            final double[] receiverElevation,
            final double[] sourceX,
            final double[] sourceY,
            final double[] sourceElevation) {
        final int traces = pickingTimes.length;
        checkLength("offsets", offsets, traces);
        checkGeometry("receiverX", receiverX, traces);
        checkGeometry("receiverY", receiverY, traces);
        checkGeometry("receiverElevation", receiverElevation, traces);
        checkGeometry("sourceX", sourceX, traces);
        checkGeometry("sourceY", sourceY, traces);
        checkGeometry("sourceElevation", sourceElevation, traces);

        final LinearFit fit = SiegelSlopes.fit(pickingTimes, offsets);
        double residualSum = 0.0;
        double elevationSum = 0.0;
        for (int i = 0; i < traces; ++i) {
            final double dx = at(receiverX, i) - at(sourceX, i);
            final double dy = at(receiverY, i) - at(sourceY, i);
            final double dz = at(sourceElevation, i) - at(receiverElevation, i);
            final double distance = Math.sqrt(dx * dx + dy * dy + dz * dz);
            residualSum += Math.abs(fit.evaluate(offsets[i]) - pickingTimes[i]);
            elevationSum += Math.abs((offsets[i] - distance) * fit.getSlope());
        }
        return new double[] {residualSum / traces, elevationSum / traces};
    }

    private static double at(final double[] values, final int index) {
        return values.length == 1 ? values[0] : values[index];
    }

    private static void checkLength(final String name, final double[] values, final int expected) {
        if (values.length != expected) {
            throw new IllegalArgumentException(String.format(
                    "Length does not match trace count; field=%s, length=%d, traces=%d",
                    name,
                    values.length,
                    expected));
        }
    }

    private static void checkGeometry(final String name, final double[] values, final int traces) {
        if (values.length != 1) {
            checkLength(name, values, traces);
        }
    }

    private PickingMetrics() {}

    /**
     * Picks at or before this time are excluded from the velocity estimate.
     */
    public static final double MINIMUM_PICKING_TIME = 1.0;
}
