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
package com.arpnetworking.seismicqc.utility;

import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.Arrays;

/**
 * Array helpers that treat {@code NaN} as a missing value.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class NanMath {

    /**
     * Copy of the values without any {@code NaN} entries.
     *
     * @param values The values.
     * @return The non-{@code NaN} values in their original order.
     */
    public static double[] dropNan(final double[] values) {
        return Arrays.stream(values).filter(value -> !Double.isNaN(value)).toArray();
    }

    /**
     * Mean ignoring {@code NaN} entries.
     *
     * @param values The values.
     * @return The mean, or {@code NaN} if no value is present.
     */
    public static double nanMean(final double[] values) {
        double sum = 0.0;
        int count = 0;
        for (final double value : values) {
            if (!Double.isNaN(value)) {
                sum += value;
                ++count;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    /**
     * Population standard deviation ignoring {@code NaN} entries.
     *
     * @param values The values.
     * @return The standard deviation, or {@code NaN} if no value is present.
     */
    public static double nanStd(final double[] values) {
        final double[] present = dropNan(values);
        if (present.length == 0) {
            return Double.NaN;
        }
        return new StandardDeviation(false).evaluate(present);
    }

    /**
     * Copy of the values with every exact zero replaced by {@code NaN}. Zero
     * marks "no data" in offset bin vectors and amplitude traces.
     *
     * @param values The values.
     * @return The masked copy.
     */
    public static double[] maskZeros(final double[] values) {
        final double[] masked = values.clone();
        for (int i = 0; i < masked.length; ++i) {
            if (masked[i] == 0.0) {
                masked[i] = Double.NaN;
            }
        }
        return masked;
    }

    /**
     * Replace a non-finite value by zero.
     *
     * @param value The value.
     * @return The value if finite, otherwise zero.
     */
    public static double finiteOrZero(final double value) {
        return Double.isFinite(value) ? value : 0.0;
    }

    private NanMath() {}
}
