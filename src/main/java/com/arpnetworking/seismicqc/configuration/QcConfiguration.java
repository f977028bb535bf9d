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
package com.arpnetworking.seismicqc.configuration;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.arpnetworking.seismicqc.metrics.GatherMetricRunner;
import com.arpnetworking.seismicqc.models.BinSpecification;
import com.arpnetworking.seismicqc.models.SampleWindow;
import com.arpnetworking.seismicqc.statistics.DiagnosticFactory;
import com.arpnetworking.seismicqc.statistics.ReducerFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Representation of QC run configuration.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class QcConfiguration {

    /**
     * Load configuration from a JSON file.
     *
     * @param file The configuration file.
     * @return The configuration.
     * @throws IOException if the file cannot be read or parsed.
     */
    public static QcConfiguration load(final File file) throws IOException {
        return OBJECT_MAPPER.readValue(file, Builder.class).build();
    }

    public double getGridBinSize() {
        return _gridBinSize;
    }

    public String getGridReducer() {
        return _gridReducer;
    }

    /**
     * The offset bins as configured by either a width or explicit edges.
     *
     * @return The bin specification.
     */
    public BinSpecification getBinSpecification() {
        if (_offsetBinWidth != null) {
            return BinSpecification.fixedWidth(_offsetBinWidth);
        }
        return BinSpecification.explicitEdges(_offsetBinEdges.stream().mapToDouble(Double::doubleValue).toArray());
    }

    public int getOffsetBinCount() {
        return _offsetBinCount;
    }

    public String getOffsetReducer() {
        return _offsetReducer;
    }

    /**
     * The sample window: around the horizon when a horizon file is set, the
     * fixed sample range when one is set, otherwise the whole trace.
     *
     * @return The sample window.
     */
    public SampleWindow getSampleWindow() {
        if (_horizonFile != null) {
            return SampleWindow.aroundHorizon(_horizonWindowLower, _horizonWindowUpper);
        }
        if (_sampleWindowStart != null) {
            return SampleWindow.fixed(_sampleWindowStart, _sampleWindowEnd);
        }
        return SampleWindow.full();
    }

    public Optional<File> getHorizonFile() {
        return Optional.ofNullable(_horizonFile);
    }

    public String getSummaryReducer() {
        return _summaryReducer;
    }

    public int getApproximationDegree() {
        return _approximationDegree;
    }

    public ImmutableList<String> getDiagnostics() {
        return _diagnostics;
    }

    public boolean getShowApproximation() {
        return _showApproximation;
    }

    public boolean getAlignSeriesMeans() {
        return _alignSeriesMeans;
    }

    public int getWorkerThreads() {
        return _workerThreads;
    }

    public GatherMetricRunner.FailurePolicy getGatherFailurePolicy() {
        return _gatherFailurePolicy;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("GridBinSize", _gridBinSize)
                .add("GridReducer", _gridReducer)
                .add("OffsetBinWidth", _offsetBinWidth)
                .add("OffsetBinEdges", _offsetBinEdges)
                .add("OffsetBinCount", _offsetBinCount)
                .add("OffsetReducer", _offsetReducer)
                .add("SampleWindowStart", _sampleWindowStart)
                .add("SampleWindowEnd", _sampleWindowEnd)
                .add("HorizonFile", _horizonFile)
                .add("HorizonWindowLower", _horizonWindowLower)
                .add("HorizonWindowUpper", _horizonWindowUpper)
                .add("SummaryReducer", _summaryReducer)
                .add("ApproximationDegree", _approximationDegree)
                .add("Diagnostics", _diagnostics)
                .add("ShowApproximation", _showApproximation)
                .add("AlignSeriesMeans", _alignSeriesMeans)
                .add("WorkerThreads", _workerThreads)
                .add("GatherFailurePolicy", _gatherFailurePolicy)
                .toString();
    }

    private QcConfiguration(final Builder builder) {
        _gridBinSize = builder._gridBinSize;
        _gridReducer = builder._gridReducer;
        _offsetBinWidth = builder._offsetBinWidth;
        _offsetBinEdges = builder._offsetBinEdges == null ? null : ImmutableList.copyOf(builder._offsetBinEdges);
        _offsetBinCount = builder._offsetBinCount;
        _offsetReducer = builder._offsetReducer;
        _sampleWindowStart = builder._sampleWindowStart;
        _sampleWindowEnd = builder._sampleWindowEnd;
        _horizonFile = builder._horizonFile;
        _horizonWindowLower = builder._horizonWindowLower;
        _horizonWindowUpper = builder._horizonWindowUpper;
        _summaryReducer = builder._summaryReducer;
        _approximationDegree = builder._approximationDegree;
        _diagnostics = ImmutableList.copyOf(builder._diagnostics);
        _showApproximation = builder._showApproximation;
        _alignSeriesMeans = builder._alignSeriesMeans;
        _workerThreads = builder._workerThreads;
        _gatherFailurePolicy = builder._gatherFailurePolicy;
    }

    private final double _gridBinSize;
    private final String _gridReducer;
    private final Double _offsetBinWidth;
    private final ImmutableList<Double> _offsetBinEdges;
    private final int _offsetBinCount;
    private final String _offsetReducer;
    private final Integer _sampleWindowStart;
    private final Integer _sampleWindowEnd;
    private final File _horizonFile;
    private final double _horizonWindowLower;
    private final double _horizonWindowUpper;
    private final String _summaryReducer;
    private final int _approximationDegree;
    private final ImmutableList<String> _diagnostics;
    private final boolean _showApproximation;
    private final boolean _alignSeriesMeans;
    private final int _workerThreads;
    private final GatherMetricRunner.FailurePolicy _gatherFailurePolicy;

    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.getInstance();
    private static final ReducerFactory REDUCER_FACTORY = new ReducerFactory();
    private static final DiagnosticFactory DIAGNOSTIC_FACTORY = new DiagnosticFactory();

    /**
     * Implementation of builder pattern for {@link QcConfiguration}.
     *
     * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
     */
    public static final class Builder extends OvalBuilder<QcConfiguration> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(QcConfiguration::new);
        }

        /**
         * The cell size of the metric grid. Optional. Defaults to 500.
         *
         * @param value The cell size.
         * @return This instance of {@link Builder}.
         */
        public Builder setGridBinSize(final Double value) {
            _gridBinSize = value;
            return this;
        }

        /**
         * The reducer of one metric grid cell. Optional. Defaults to mean.
         *
         * @param value The reducer name or alias.
         * @return This instance of {@link Builder}.
         */
        public Builder setGridReducer(final String value) {
            _gridReducer = value;
            return this;
        }

        /**
         * The width of fixed offset bins. Exactly one of this and the bin
         * edges must be set.
         *
         * @param value The bin width.
         * @return This instance of {@link Builder}.
         */
        public Builder setOffsetBinWidth(@Nullable final Double value) {
            _offsetBinWidth = value;
            return this;
        }

        /**
         * The start edges of explicit offset bins. Exactly one of this and the
         * bin width must be set.
         *
         * @param value The bin edges.
         * @return This instance of {@link Builder}.
         */
        public Builder setOffsetBinEdges(@Nullable final List<Double> value) {
            _offsetBinEdges = value;
            return this;
        }

        /**
         * The length of every offset bin vector. Required. Must be positive.
         *
         * @param value The vector length.
         * @return This instance of {@link Builder}.
         */
        public Builder setOffsetBinCount(final Integer value) {
            _offsetBinCount = value;
            return this;
        }

        /**
         * The reducer of the samples in one offset bin. Optional. Defaults to rms.
         *
         * @param value The reducer name or alias.
         * @return This instance of {@link Builder}.
         */
        public Builder setOffsetReducer(final String value) {
            _offsetReducer = value;
            return this;
        }

        /**
         * The first sample index of a fixed window. Optional; set together
         * with the end.
         *
         * @param value The inclusive start index.
         * @return This instance of {@link Builder}.
         */
        public Builder setSampleWindowStart(@Nullable final Integer value) {
            _sampleWindowStart = value;
            return this;
        }

        /**
         * The last sample index of a fixed window. Optional; set together
         * with the start.
         *
         * @param value The inclusive end index.
         * @return This instance of {@link Builder}.
         */
        public Builder setSampleWindowEnd(@Nullable final Integer value) {
            _sampleWindowEnd = value;
            return this;
        }

        /**
         * The horizon file. Optional. When set the sample window follows the
         * horizon and no fixed window may be set.
         *
         * @param value The horizon file.
         * @return This instance of {@link Builder}.
         */
        public Builder setHorizonFile(@Nullable final File value) {
            _horizonFile = value;
            return this;
        }

        /**
         * The time before the horizon included in the window. Optional. Defaults to 0.
         *
         * @param value The time before the horizon.
         * @return This instance of {@link Builder}.
         */
        public Builder setHorizonWindowLower(final Double value) {
            _horizonWindowLower = value;
            return this;
        }

        /**
         * The time after the horizon included in the window. Optional. Defaults to 0.
         *
         * @param value The time after the horizon.
         * @return This instance of {@link Builder}.
         */
        public Builder setHorizonWindowUpper(final Double value) {
            _horizonWindowUpper = value;
            return this;
        }

        /**
         * The reducer of one offset bin across gathers. Optional. Defaults to mean.
         *
         * @param value The reducer name or alias.
         * @return This instance of {@link Builder}.
         */
        public Builder setSummaryReducer(final String value) {
            _summaryReducer = value;
            return this;
        }

        /**
         * The degree of the approximating polynomial. Optional. Defaults to 3.
         *
         * @param value The degree.
         * @return This instance of {@link Builder}.
         */
        public Builder setApproximationDegree(final Integer value) {
            _approximationDegree = value;
            return this;
        }

        /**
         * The diagnostics of the offset summary. Optional. Defaults to none.
         *
         * @param value The diagnostic names or aliases.
         * @return This instance of {@link Builder}.
         */
        public Builder setDiagnostics(final List<String> value) {
            _diagnostics = value;
            return this;
        }

        /**
         * Whether persisted bin averages are the approximation. Optional. Defaults to false.
         *
         * @param value true to persist the approximation.
         * @return This instance of {@link Builder}.
         */
        public Builder setShowApproximation(final Boolean value) {
            _showApproximation = value;
            return this;
        }

        /**
         * Whether compared series are shifted to a common mean. Optional. Defaults to false.
         *
         * @param value true to align series means.
         * @return This instance of {@link Builder}.
         */
        public Builder setAlignSeriesMeans(final Boolean value) {
            _alignSeriesMeans = value;
            return this;
        }

        /**
         * The size of the worker pool. Optional. Defaults to the number of
         * available processors.
         *
         * @param value The number of worker threads.
         * @return This instance of {@link Builder}.
         */
        public Builder setWorkerThreads(final Integer value) {
            _workerThreads = value;
            return this;
        }

        /**
         * The handling of a gather whose metric fails. Optional. Defaults to ABORT.
         *
         * @param value The failure policy.
         * @return This instance of {@link Builder}.
         */
        public Builder setGatherFailurePolicy(final GatherMetricRunner.FailurePolicy value) {
            _gatherFailurePolicy = value;
            return this;
        }

        /**
         * Validate that a cell size is positive and finite.
         *
         * @param gridBinSize the configured cell size
         * @return true if the given value is valid
         */
        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        public boolean validateGridBinSize(final Double gridBinSize) {
            return gridBinSize > 0 && !gridBinSize.isInfinite();
        }

        /**
         * Validate that a reducer name is registered.
         *
         * @param reducer the configured reducer name
         * @return true if the given value is valid
         */
        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        public boolean validateReducer(final String reducer) {
            return REDUCER_FACTORY.tryGetReducer(reducer).isPresent();
        }

        /**
         * Validate that exactly one of bin width and bin edges is set and that
         * it describes valid bins.
         *
         * @param offsetBinWidth the configured bin width
         * @return true if the given value is valid
         */
        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        public boolean validateOffsetBins(@Nullable final Double offsetBinWidth) {
            if ((offsetBinWidth == null) == (_offsetBinEdges == null)) {
                return false;
            }
            if (offsetBinWidth != null) {
                return offsetBinWidth > 0 && !offsetBinWidth.isInfinite();
            }
            if (_offsetBinEdges.isEmpty() || _offsetBinEdges.contains(null)) {
                return false;
            }
            for (int i = 0; i < _offsetBinEdges.size(); ++i) {
                final double edge = _offsetBinEdges.get(i);
                if (!Double.isFinite(edge) || (i > 0 && edge <= _offsetBinEdges.get(i - 1))) {
                    return false;
                }
            }
            return true;
        }

        /**
         * Validate that the fixed window bounds are set together, ordered and
         * not combined with a horizon.
         *
         * @param sampleWindowStart the configured window start
         * @return true if the given value is valid
         */
        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        public boolean validateSampleWindow(@Nullable final Integer sampleWindowStart) {
            if (sampleWindowStart == null) {
                return _sampleWindowEnd == null;
            }
            return _sampleWindowEnd != null
                    && _horizonFile == null
                    && sampleWindowStart >= 0
                    && _sampleWindowEnd >= sampleWindowStart;
        }

        /**
         * Validate that all diagnostic names are registered.
         *
         * @param diagnostics the configured diagnostic names
         * @return true if the given value is valid
         */
        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        public boolean validateDiagnostics(final List<String> diagnostics) {
            return diagnostics.stream().allMatch(name -> name != null && DIAGNOSTIC_FACTORY.tryGetDiagnostic(name).isPresent());
        }

        @NotNull
        @ValidateWithMethod(methodName = "validateGridBinSize", parameterType = Double.class)
        private Double _gridBinSize = 500.0;
        @NotNull
        @NotEmpty
        @ValidateWithMethod(methodName = "validateReducer", parameterType = String.class)
        private String _gridReducer = "mean";
        @ValidateWithMethod(methodName = "validateOffsetBins", parameterType = Double.class, ignoreIfNull = false)
        private Double _offsetBinWidth;
        private List<Double> _offsetBinEdges;
        @NotNull
        @Min(1)
        private Integer _offsetBinCount;
        @NotNull
        @NotEmpty
        @ValidateWithMethod(methodName = "validateReducer", parameterType = String.class)
        private String _offsetReducer = "rms";
        @ValidateWithMethod(methodName = "validateSampleWindow", parameterType = Integer.class, ignoreIfNull = false)
        private Integer _sampleWindowStart;
        private Integer _sampleWindowEnd;
        private File _horizonFile;
        @NotNull
        @Min(0)
        private Double _horizonWindowLower = 0.0;
        @NotNull
        @Min(0)
        private Double _horizonWindowUpper = 0.0;
        @NotNull
        @NotEmpty
        @ValidateWithMethod(methodName = "validateReducer", parameterType = String.class)
        private String _summaryReducer = "mean";
        @NotNull
        @Min(0)
        private Integer _approximationDegree = 3;
        @NotNull
        @ValidateWithMethod(methodName = "validateDiagnostics", parameterType = List.class)
        private List<String> _diagnostics = ImmutableList.of();
        @NotNull
        private Boolean _showApproximation = false;
        @NotNull
        private Boolean _alignSeriesMeans = false;
        @NotNull
        @Min(1)
        private Integer _workerThreads = Runtime.getRuntime().availableProcessors();
        @NotNull
        private GatherMetricRunner.FailurePolicy _gatherFailurePolicy = GatherMetricRunner.FailurePolicy.ABORT;
    }
}
