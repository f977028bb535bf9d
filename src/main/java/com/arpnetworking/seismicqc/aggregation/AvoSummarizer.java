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
package com.arpnetworking.seismicqc.aggregation;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.seismicqc.models.AvoSummary;
import com.arpnetworking.seismicqc.models.BinSpecification;
import com.arpnetworking.seismicqc.models.OffsetBinMatrix;
import com.arpnetworking.seismicqc.statistics.Diagnostic;
import com.arpnetworking.seismicqc.statistics.DiagnosticContext;
import com.arpnetworking.seismicqc.statistics.Reducer;
import com.arpnetworking.seismicqc.utility.NanMath;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotNull;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import java.util.Arrays;
import java.util.Map;

/**
 * Summarizes an {@link OffsetBinMatrix} across all of its rows.
 *
 * <p>Every bin is reduced over the rows after zeros are masked as missing; a
 * non-finite result becomes zero and bins whose result is zero are dropped. A
 * polynomial of the configured degree is fitted to the kept bins by least
 * squares and evaluated at their offsets. The configured diagnostics are then
 * computed over the kept bins.</p>
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class AvoSummarizer {

    /**
     * Summarize a matrix.
     *
     * @param matrix The offset bin matrix.
     * @return The summary.
     */
    public AvoSummary summarize(final OffsetBinMatrix matrix) {
        final int binCount = matrix.getBinCount();
        final int[] keptBins = new int[binCount];
        final double[] keptAverages = new double[binCount];
        int kept = 0;
        for (int bin = 0; bin < binCount; ++bin) {
            final double average = NanMath.finiteOrZero(_reducer.reduce(NanMath.maskZeros(matrix.getColumn(bin))));
            if (average != 0.0) {
                keptBins[kept] = bin;
                keptAverages[kept] = average;
                ++kept;
            }
        }
        final int[] binIndices = Arrays.copyOf(keptBins, kept);
        final double[] averages = Arrays.copyOf(keptAverages, kept);
        final double[] offsets = new double[kept];
        final double[][] binValues = new double[kept][];
        final double[][] maskedBins = new double[kept][];
        for (int i = 0; i < kept; ++i) {
            offsets[i] = _binSpecification.getBinOffset(binIndices[i]);
            binValues[i] = matrix.getColumn(binIndices[i]);
            maskedBins[i] = NanMath.maskZeros(binValues[i]);
        }

        final AvoSummary.Builder summary = new AvoSummary.Builder()
                .setBinIndices(binIndices)
                .setBinOffsets(offsets)
                .setAverages(averages)
                .setBinValues(binValues)
                .setRowCount(matrix.getRowCount());
        if (kept == 0) {
            LOGGER.debug()
                    .setMessage("No bins with data to summarize")
                    .addData("rows", matrix.getRowCount())
                    .addData("bins", binCount)
                    .log();
            return summary
                    .setApproximation(new double[0])
                    .setCoefficients(new double[0])
                    .build();
        }

        final double[] coefficients = fitPolynomial(offsets, averages, _approximationDegree);
        final PolynomialFunction polynomial = new PolynomialFunction(coefficients);
        final double[] approximation = new double[kept];
        for (int i = 0; i < kept; ++i) {
            approximation[i] = polynomial.value(offsets[i]);
        }

        final DiagnosticContext context = new DiagnosticContext(averages, approximation, maskedBins);
        final Map<String, Double> diagnostics = Maps.newLinkedHashMap();
        for (final Diagnostic diagnostic : _diagnostics) {
            diagnostics.put(diagnostic.getDisplayName(), diagnostic.compute(context));
        }

        LOGGER.debug()
                .setMessage("Summarized offset bins")
                .addData("rows", matrix.getRowCount())
                .addData("bins", binCount)
                .addData("keptBins", kept)
                .addData("diagnostics", diagnostics)
                .log();
        return summary
                .setApproximation(approximation)
                .setCoefficients(coefficients)
                .setDiagnostics(ImmutableMap.copyOf(diagnostics))
                .build();
    }

    /**
     * Least squares polynomial fit of the Vandermonde system. The abscissae
     * are scaled to {@code [-1, 1]} before the decomposition. An
     * overdetermined or square system is solved by QR decomposition; with
     * fewer points than coefficients the minimum norm solution is taken from
     * the singular value decomposition.
     *
     * @param x The abscissae.
     * @param y The ordinates.
     * @param degree The polynomial degree.
     * @return The coefficients in ascending order of power.
     */
    static double[] fitPolynomial(final double[] x, final double[] y, final int degree) {
        double scale = 0.0;
        for (final double value : x) {
            scale = Math.max(scale, Math.abs(value));
        }
        if (scale == 0.0) {
            scale = 1.0;
        }
        final double[][] vandermonde = new double[x.length][degree + 1];
        for (int row = 0; row < x.length; ++row) {
            final double scaled = x[row] / scale;
            double power = 1.0;
            for (int column = 0; column <= degree; ++column) {
                vandermonde[row][column] = power;
                power *= scaled;
            }
        }
        final RealMatrix matrix = new Array2DRowRealMatrix(vandermonde, false);
        final DecompositionSolver solver = x.length < degree + 1
                ? new SingularValueDecomposition(matrix).getSolver()
                : new QRDecomposition(matrix).getSolver();
        final RealVector solution = solver.solve(new ArrayRealVector(y));
        final double[] coefficients = new double[degree + 1];
        double factor = 1.0;
        for (int power = 0; power <= degree; ++power) {
            coefficients[power] = solution.getEntry(power) / factor;
            factor *= scale;
        }
        return coefficients;
    }

    public int getApproximationDegree() {
        return _approximationDegree;
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("reducer", _reducer.getName())
                .put("approximationDegree", _approximationDegree)
                .put("diagnostics", _diagnostics.size())
                .put("binSpecification", _binSpecification)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private AvoSummarizer(final Builder builder) {
        _reducer = builder._reducer;
        _approximationDegree = builder._approximationDegree;
        _diagnostics = builder._diagnostics;
        _binSpecification = builder._binSpecification;
    }

    private final Reducer _reducer;
    private final int _approximationDegree;
    private final ImmutableList<Diagnostic> _diagnostics;
    private final BinSpecification _binSpecification;

    private static final Logger LOGGER = LoggerFactory.getLogger(AvoSummarizer.class);

    /**
     * Implementation of builder pattern for {@link AvoSummarizer}.
     *
     * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
     */
    public static final class Builder extends OvalBuilder<AvoSummarizer> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(AvoSummarizer::new);
        }

        /**
         * Set the reducer applied to each bin across rows. Required. Cannot be null.
         *
         * @param value The reducer.
         * @return This instance of {@link Builder}.
         */
        public Builder setReducer(final Reducer value) {
            _reducer = value;
            return this;
        }

        /**
         * Set the degree of the approximating polynomial. Optional. Defaults to 3.
         *
         * @param value The degree.
         * @return This instance of {@link Builder}.
         */
        public Builder setApproximationDegree(final Integer value) {
            _approximationDegree = value;
            return this;
        }

        /**
         * Set the diagnostics to compute. Optional. Defaults to none.
         *
         * @param value The diagnostics.
         * @return This instance of {@link Builder}.
         */
        public Builder setDiagnostics(final ImmutableList<Diagnostic> value) {
            _diagnostics = value;
            return this;
        }

        /**
         * Set the bin specification the matrix was built with. Required. Cannot be null.
         *
         * @param value The bin specification.
         * @return This instance of {@link Builder}.
         */
        public Builder setBinSpecification(final BinSpecification value) {
            _binSpecification = value;
            return this;
        }

        @NotNull
        private Reducer _reducer;
        @NotNull
        @Min(0)
        private Integer _approximationDegree = 3;
        @NotNull
        private ImmutableList<Diagnostic> _diagnostics = ImmutableList.of();
        @NotNull
        private BinSpecification _binSpecification;
    }
}
