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
import com.arpnetworking.seismicqc.horizon.HorizonTable;
import com.arpnetworking.seismicqc.models.BinSpecification;
import com.arpnetworking.seismicqc.models.GatherRecord;
import com.arpnetworking.seismicqc.models.OffsetBinMatrix;
import com.arpnetworking.seismicqc.models.SampleWindow;
import com.arpnetworking.seismicqc.statistics.Reducer;
import com.arpnetworking.seismicqc.utility.NanMath;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.IntStream;
import javax.annotation.Nullable;

/**
 * Reduces the amplitudes of a gather into a fixed-length vector with one cell
 * per offset bin.
 *
 * <p>Traces are sorted by offset and partitioned by the configured
 * {@link BinSpecification}. For every bin the samples inside the window are
 * reduced after exact zeros are masked as missing. A bin without traces, or
 * whose reduction is not finite, holds zero. Bins past the last boundary of a
 * gather also hold zero.</p>
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class OffsetBinner {

    /**
     * Compute the offset bin vector of a gather.
     *
     * @param gather The gather; must carry offsets and amplitudes, and inline,
     * crossline and sample interval when the window follows a horizon.
     * @return The vector, of length {@link #getVectorLength()}.
     */
    public double[] binGather(final GatherRecord gather) {
        final double[] rawOffsets = gather.getOffsets().orElseThrow(() -> missing(gather, "offsets"));
        final double[][] rawAmplitudes = gather.getAmplitudes().orElseThrow(() -> missing(gather, "amplitudes"));
        if (rawOffsets.length != rawAmplitudes.length) {
            throw new IllegalArgumentException(String.format(
                    "Offset and trace counts do not match; id=%d, offsets=%d, traces=%d",
                    gather.getId(),
                    rawOffsets.length,
                    rawAmplitudes.length));
        }
        final double[] vector = new double[_vectorLength];
        if (rawOffsets.length == 0) {
            return vector;
        }

        final int[] order = IntStream.range(0, rawOffsets.length)
                .boxed()
                .sorted(Comparator.comparingDouble(i -> rawOffsets[i]))
                .mapToInt(Integer::intValue)
                .toArray();
        final double[] offsets = new double[order.length];
        final double[][] amplitudes = new double[order.length][];
        for (int i = 0; i < order.length; ++i) {
            offsets[i] = rawOffsets[order[i]];
            amplitudes[i] = rawAmplitudes[order[i]];
        }

        final int sampleCount = Arrays.stream(amplitudes).mapToInt(trace -> trace.length).max().orElse(0);
        final int[] window = resolveWindow(gather, sampleCount);
        final double[] boundaries = _binSpecification.getBoundaries(offsets[offsets.length - 1]);
        final int binCount = Math.max(0, boundaries.length - 1);
        if (binCount > _vectorLength) {
            throw new IllegalArgumentException(String.format(
                    "Gather produces more bins than the vector holds; id=%d, bins=%d, vectorLength=%d",
                    gather.getId(),
                    binCount,
                    _vectorLength));
        }

        for (int bin = 0; bin < binCount; ++bin) {
            final double start = boundaries[bin];
            final double end = boundaries[bin + 1];
            final double[] values = collect(offsets, amplitudes, start, end, window);
            if (values == null) {
                continue;
            }
            vector[bin] = NanMath.finiteOrZero(_reducer.reduce(NanMath.maskZeros(values)));
        }

        LOGGER.trace()
                .setMessage("Binned gather")
                .addData("gatherId", gather.getId())
                .addData("bins", binCount)
                .addData("windowStart", window[0])
                .addData("windowEnd", window[1])
                .log();
        return vector;
    }

    /**
     * Bin a gather and append its vector to a matrix.
     *
     * @param gather The gather.
     * @param matrix The matrix to append to.
     */
    public void process(final GatherRecord gather, final OffsetBinMatrix matrix) {
        if (matrix.getBinCount() != _vectorLength) {
            throw new IllegalArgumentException(String.format(
                    "Matrix bin count does not match vector length; binCount=%d, vectorLength=%d",
                    matrix.getBinCount(),
                    _vectorLength));
        }
        matrix.append(binGather(gather));
    }

    /**
     * Bin every gather in iteration order.
     *
     * @param gathers The gathers.
     * @return A new matrix with one row per gather.
     */
    public OffsetBinMatrix processAll(final Iterable<GatherRecord> gathers) {
        final OffsetBinMatrix matrix = new OffsetBinMatrix(_vectorLength);
        for (final GatherRecord gather : gathers) {
            process(gather, matrix);
        }
        LOGGER.debug()
                .setMessage("Binned gathers")
                .addData("rows", matrix.getRowCount())
                .addData("binner", this)
                .log();
        return matrix;
    }

    public int getVectorLength() {
        return _vectorLength;
    }

    public BinSpecification getBinSpecification() {
        return _binSpecification;
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("binSpecification", _binSpecification)
                .put("sampleWindow", _sampleWindow)
                .put("reducer", _reducer.getName())
                .put("vectorLength", _vectorLength)
                .put("horizonEntries", _horizonTable.map(HorizonTable::size).orElse(0))
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    // Returns null when no trace falls in [start, end)
    private static double[] collect(
            final double[] offsets,
            final double[][] amplitudes,
            final double start,
            final double end,
            final int[] window) {
        int traceCount = 0;
        int valueCount = 0;
        for (int trace = 0; trace < offsets.length; ++trace) {
            if (offsets[trace] >= start && offsets[trace] < end) {
                ++traceCount;
                valueCount += windowLength(amplitudes[trace].length, window);
            }
        }
        if (traceCount == 0) {
            return null;
        }
        final double[] values = new double[valueCount];
        int index = 0;
        for (int trace = 0; trace < offsets.length; ++trace) {
            if (offsets[trace] >= start && offsets[trace] < end) {
                final int length = windowLength(amplitudes[trace].length, window);
                if (length > 0) {
                    System.arraycopy(amplitudes[trace], window[0], values, index, length);
                    index += length;
                }
            }
        }
        return values;
    }

    private static int windowLength(final int traceLength, final int[] window) {
        return Math.max(0, Math.min(window[1] + 1, traceLength) - window[0]);
    }

    // Inclusive [start, end] sample indices
    private int[] resolveWindow(final GatherRecord gather, final int sampleCount) {
        switch (_sampleWindow.getKind()) {
            case FIXED:
                return new int[] {_sampleWindow.getStart(), _sampleWindow.getEnd()};
            case HORIZON: {
                final int inline = gather.getInline().orElseThrow(() -> missing(gather, "inline"));
                final int crossline = gather.getCrossline().orElseThrow(() -> missing(gather, "crossline"));
                final double interval = gather.getSampleInterval().orElseThrow(() -> missing(gather, "sampleInterval"));
                final double time = _horizonTable.get().require(inline, crossline);
                return new int[] {
                    clamp((int) ((time - _sampleWindow.getLower()) / interval), sampleCount),
                    clamp((int) ((time + _sampleWindow.getUpper()) / interval), sampleCount),
                };
            }
            case FULL:
            default:
                return new int[] {0, Math.max(0, sampleCount - 1)};
        }
    }

    private static int clamp(final int index, final int sampleCount) {
        return Math.max(0, Math.min(index, sampleCount));
    }

    private static IllegalArgumentException missing(final GatherRecord gather, final String field) {
        return new IllegalArgumentException(String.format(
                "Gather is missing a required field; id=%d, field=%s",
                gather.getId(),
                field));
    }

    private OffsetBinner(final Builder builder) {
        _binSpecification = builder._binSpecification;
        _sampleWindow = builder._sampleWindow;
        _reducer = builder._reducer;
        _vectorLength = builder._vectorLength;
        _horizonTable = builder._horizonTable;
    }

    private final BinSpecification _binSpecification;
    private final SampleWindow _sampleWindow;
    private final Reducer _reducer;
    private final int _vectorLength;
    private final Optional<HorizonTable> _horizonTable;

    private static final Logger LOGGER = LoggerFactory.getLogger(OffsetBinner.class);

    /**
     * Implementation of builder pattern for {@link OffsetBinner}.
     *
     * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
     */
    public static final class Builder extends OvalBuilder<OffsetBinner> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(OffsetBinner::new);
        }

        /**
         * Set the bin specification. Required. Cannot be null.
         *
         * @param value The bin specification.
         * @return This instance of {@link Builder}.
         */
        public Builder setBinSpecification(final BinSpecification value) {
            _binSpecification = value;
            return this;
        }

        /**
         * Set the sample window. Optional. Defaults to the whole trace.
         *
         * @param value The sample window.
         * @return This instance of {@link Builder}.
         */
        public Builder setSampleWindow(final SampleWindow value) {
            _sampleWindow = value;
            return this;
        }

        /**
         * Set the reducer applied to the samples of one bin. Required. Cannot be null.
         *
         * @param value The reducer.
         * @return This instance of {@link Builder}.
         */
        public Builder setReducer(final Reducer value) {
            _reducer = value;
            return this;
        }

        /**
         * Set the length of every output vector. Required. Must be positive.
         *
         * @param value The vector length.
         * @return This instance of {@link Builder}.
         */
        public Builder setVectorLength(final Integer value) {
            _vectorLength = value;
            return this;
        }

        /**
         * Set the horizon. Required when the sample window follows a horizon.
         *
         * @param value The horizon.
         * @return This instance of {@link Builder}.
         */
        public Builder setHorizonTable(@Nullable final HorizonTable value) {
            _horizonTable = Optional.ofNullable(value);
            return this;
        }

        /**
         * Validate that a horizon is present when the window needs one.
         *
         * @param horizonTable the configured horizon
         * @return true if the given value is valid
         */
        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        public boolean validateHorizonTable(final Optional<HorizonTable> horizonTable) {
            return horizonTable.isPresent()
                    || _sampleWindow == null
                    || _sampleWindow.getKind() != SampleWindow.Kind.HORIZON;
        }

        @NotNull
        private BinSpecification _binSpecification;
        @NotNull
        private SampleWindow _sampleWindow = SampleWindow.full();
        @NotNull
        private Reducer _reducer;
        @NotNull
        @Min(1)
        private Integer _vectorLength;
        @ValidateWithMethod(methodName = "validateHorizonTable", parameterType = Optional.class)
        private Optional<HorizonTable> _horizonTable = Optional.empty();
    }
}
