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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import net.sf.oval.constraint.NotNull;

import java.util.Arrays;

/**
 * Summary of an offset bin matrix: the bins with a non-zero aggregate, their
 * offsets and averages, the polynomial approximation of the averages and any
 * requested diagnostics. Arrays are indexed by kept bin unless stated
 * otherwise and are copied on access.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class AvoSummary {

    /**
     * Indices of the kept bins in the source matrix.
     *
     * @return The bin indices.
     */
    public int[] getBinIndices() {
        return _binIndices.clone();
    }

    public double[] getBinOffsets() {
        return _binOffsets.clone();
    }

    public double[] getAverages() {
        return _averages.clone();
    }

    public double[] getApproximation() {
        return _approximation.clone();
    }

    /**
     * Polynomial coefficients in ascending order of power, empty when no bin
     * was kept.
     *
     * @return The coefficients.
     */
    public double[] getCoefficients() {
        return _coefficients.clone();
    }

    /**
     * The unmasked values of the kept bins, indexed {@code [kept bin][row]}.
     *
     * @return The per-bin values; zeros still mark missing data.
     */
    public double[][] getBinValues() {
        final double[][] copy = new double[_binValues.length][];
        for (int i = 0; i < _binValues.length; ++i) {
            copy[i] = _binValues[i].clone();
        }
        return copy;
    }

    /**
     * The averages to display: the approximation when {@code approximated}
     * is set, the raw averages otherwise.
     *
     * @param approximated Whether to display the approximation.
     * @return The displayed averages.
     */
    public double[] getDisplayedAverages(final boolean approximated) {
        return approximated ? getApproximation() : getAverages();
    }

    public int getRowCount() {
        return _rowCount;
    }

    public int getBinCount() {
        return _binIndices.length;
    }

    /**
     * Diagnostic values keyed by display name, in request order.
     *
     * @return The diagnostics.
     */
    public ImmutableMap<String, Double> getDiagnostics() {
        return _diagnostics;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("BinIndices", Arrays.toString(_binIndices))
                .add("Averages", Arrays.toString(_averages))
                .add("Coefficients", Arrays.toString(_coefficients))
                .add("RowCount", _rowCount)
                .add("Diagnostics", _diagnostics)
                .toString();
    }

    private AvoSummary(final Builder builder) {
        _binIndices = builder._binIndices;
        _binOffsets = builder._binOffsets;
        _averages = builder._averages;
        _approximation = builder._approximation;
        _coefficients = builder._coefficients;
        _binValues = builder._binValues;
        _rowCount = builder._rowCount;
        _diagnostics = builder._diagnostics;
    }

    private final int[] _binIndices;
    private final double[] _binOffsets;
    private final double[] _averages;
    private final double[] _approximation;
    private final double[] _coefficients;
    private final double[][] _binValues;
    private final int _rowCount;
    private final ImmutableMap<String, Double> _diagnostics;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link AvoSummary}. Arrays are not copied.
     */
    public static final class Builder extends OvalBuilder<AvoSummary> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(AvoSummary::new);
        }

        /**
         * Set the kept bin indices. Required. Cannot be null.
         *
         * @param value The bin indices.
         * @return This {@link Builder} instance.
         */
        public Builder setBinIndices(final int[] value) {
            _binIndices = value;
            return this;
        }

        /**
         * Set the kept bin offsets. Required. Cannot be null.
         *
         * @param value The bin offsets.
         * @return This {@link Builder} instance.
         */
        public Builder setBinOffsets(final double[] value) {
            _binOffsets = value;
            return this;
        }

        /**
         * Set the kept bin averages. Required. Cannot be null.
         *
         * @param value The averages.
         * @return This {@link Builder} instance.
         */
        public Builder setAverages(final double[] value) {
            _averages = value;
            return this;
        }

        /**
         * Set the approximation at the kept bin offsets. Required. Cannot be null.
         *
         * @param value The approximation.
         * @return This {@link Builder} instance.
         */
        public Builder setApproximation(final double[] value) {
            _approximation = value;
            return this;
        }

        /**
         * Set the polynomial coefficients, ascending by power. Required. Cannot be null.
         *
         * @param value The coefficients.
         * @return This {@link Builder} instance.
         */
        public Builder setCoefficients(final double[] value) {
            _coefficients = value;
            return this;
        }

        /**
         * Set the kept bin values indexed {@code [kept bin][row]}. Required. Cannot be null.
         *
         * @param value The bin values.
         * @return This {@link Builder} instance.
         */
        public Builder setBinValues(final double[][] value) {
            _binValues = value;
            return this;
        }

        /**
         * Set the number of matrix rows summarized. Required. Cannot be null.
         *
         * @param value The row count.
         * @return This {@link Builder} instance.
         */
        public Builder setRowCount(final Integer value) {
            _rowCount = value;
            return this;
        }

        /**
         * Set the diagnostics. Optional. Cannot be null. Defaults to an empty {@link ImmutableMap}.
         *
         * @param value The diagnostics keyed by display name.
         * @return This {@link Builder} instance.
         */
        public Builder setDiagnostics(final ImmutableMap<String, Double> value) {
            _diagnostics = value;
            return this;
        }

        @NotNull
        private int[] _binIndices;
        @NotNull
        private double[] _binOffsets;
        @NotNull
        private double[] _averages;
        @NotNull
        private double[] _approximation;
        @NotNull
        private double[] _coefficients;
        @NotNull
        private double[][] _binValues;
        @NotNull
        private Integer _rowCount;
        @NotNull
        private ImmutableMap<String, Double> _diagnostics = ImmutableMap.of();
    }
}
