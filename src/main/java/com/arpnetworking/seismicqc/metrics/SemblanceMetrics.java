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

import com.google.common.base.Preconditions;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Spread metrics over a semblance matrix indexed {@code [time][scan]}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class SemblanceMetrics {

    /**
     * Largest per-column range: for every column the difference between its
     * maximum and minimum over all rows, then the maximum over columns.
     *
     * @param semblance The semblance matrix.
     * @return The spread.
     */
    public static double minmaxSpread(final double[][] semblance) {
        final int columns = checkShape(semblance);
        double spread = Double.NEGATIVE_INFINITY;
        for (int column = 0; column < columns; ++column) {
            double min = semblance[0][column];
            double max = semblance[0][column];
            for (int row = 1; row < semblance.length; ++row) {
                min = Math.min(min, semblance[row][column]);
                max = Math.max(max, semblance[row][column]);
            }
            spread = Math.max(spread, max - min);
        }
        return spread;
    }

    /**
     * Largest per-row variability: the population standard deviation of every
     * row, then the maximum over rows.
     *
     * @param semblance The semblance matrix.
     * @return The spread.
     */
    public static double stdSpread(final double[][] semblance) {
        checkShape(semblance);
        final StandardDeviation standardDeviation = new StandardDeviation(false);
        double spread = Double.NEGATIVE_INFINITY;
        for (final double[] row : semblance) {
            spread = Math.max(spread, standardDeviation.evaluate(row));
        }
        return spread;
    }

    private static int checkShape(final double[][] semblance) {
        Preconditions.checkArgument(semblance.length > 0, "Semblance has no rows");
        final int columns = semblance[0].length;
        Preconditions.checkArgument(columns > 0, "Semblance has no columns");
        for (final double[] row : semblance) {
            Preconditions.checkArgument(
                    row.length == columns,
                    "Semblance rows differ in length; expected=%s, actual=%s",
                    columns,
                    row.length);
        }
        return columns;
    }

    private SemblanceMetrics() {}
}
