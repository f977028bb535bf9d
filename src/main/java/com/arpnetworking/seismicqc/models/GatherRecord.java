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
import net.sf.oval.constraint.NotNull;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * The components of one gather consumed by the QC calculations. Every
 * component except the identifier is optional; a calculation that needs a
 * missing component fails for that gather. Arrays are shared with the caller
 * and must not be modified after the record is built.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class GatherRecord {

    public long getId() {
        return _id;
    }

    public Optional<Integer> getInline() {
        return Optional.ofNullable(_inline);
    }

    public Optional<Integer> getCrossline() {
        return Optional.ofNullable(_crossline);
    }

    public Optional<double[][]> getSemblance() {
        return Optional.ofNullable(_semblance);
    }

    public Optional<double[]> getPickingTimes() {
        return Optional.ofNullable(_pickingTimes);
    }

    public Optional<double[]> getOffsets() {
        return Optional.ofNullable(_offsets);
    }

    public Optional<double[][]> getAmplitudes() {
        return Optional.ofNullable(_amplitudes);
    }

    public Optional<Double> getSampleInterval() {
        return Optional.ofNullable(_sampleInterval);
    }

    public Optional<double[]> getReceiverX() {
        return Optional.ofNullable(_receiverX);
    }

    public Optional<double[]> getReceiverY() {
        return Optional.ofNullable(_receiverY);
    }

    public Optional<double[]> getReceiverElevation() {
        return Optional.ofNullable(_receiverElevation);
    }

    public Optional<double[]> getSourceX() {
        return Optional.ofNullable(_sourceX);
    }

    public Optional<double[]> getSourceY() {
        return Optional.ofNullable(_sourceY);
    }

    public Optional<double[]> getSourceElevation() {
        return Optional.ofNullable(_sourceElevation);
    }

    /**
     * The number of traces, taken from the offsets or else the amplitudes.
     *
     * @return The trace count, zero when neither component is present.
     */
    public int getTraceCount() {
        if (_offsets != null) {
            return _offsets.length;
        }
        return _amplitudes == null ? 0 : _amplitudes.length;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Id", _id)
                .add("Inline", _inline)
                .add("Crossline", _crossline)
                .add("Traces", getTraceCount())
                .add("SampleInterval", _sampleInterval)
                .toString();
    }

    private GatherRecord(final Builder builder) {
        _id = builder._id;
        _inline = builder._inline;
        _crossline = builder._crossline;
        _semblance = builder._semblance;
        _pickingTimes = builder._pickingTimes;
        _offsets = builder._offsets;
        _amplitudes = builder._amplitudes;
        _sampleInterval = builder._sampleInterval;
        _receiverX = builder._receiverX;
        _receiverY = builder._receiverY;
        _receiverElevation = builder._receiverElevation;
        _sourceX = builder._sourceX;
        _sourceY = builder._sourceY;
        _sourceElevation = builder._sourceElevation;
    }

    private final long _id;
    @Nullable
    private final Integer _inline;
    @Nullable
    private final Integer _crossline;
    @Nullable
    private final double[][] _semblance;
    @Nullable
    private final double[] _pickingTimes;
    @Nullable
    private final double[] _offsets;
    @Nullable
    private final double[][] _amplitudes;
    @Nullable
    private final Double _sampleInterval;
    @Nullable
    private final double[] _receiverX;
    @Nullable
    private final double[] _receiverY;
    @Nullable
    private final double[] _receiverElevation;
    @Nullable
    private final double[] _sourceX;
    @Nullable
    private final double[] _sourceY;
    @Nullable
    private final double[] _sourceElevation;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link GatherRecord}.
     */
    public static final class Builder extends OvalBuilder<GatherRecord> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(GatherRecord::new);
        }

        /**
         * Set the gather identifier. Required. Cannot be null.
         *
         * @param value The value.
         * @return This {@link Builder} instance.
         */
        public Builder setId(final Long value) {
            _id = value;
            return this;
        }

        /**
         * Set the inline number of the gather position. Optional. Can be null.
         *
         * @param value The value.
         * @return This {@link Builder} instance.
         */
        public Builder setInline(@Nullable final Integer value) {
            _inline = value;
            return this;
        }

        /**
         * Set the crossline number of the gather position. Optional. Can be null.
         *
         * @param value The value.
         * @return This {@link Builder} instance.
         */
        public Builder setCrossline(@Nullable final Integer value) {
            _crossline = value;
            return this;
        }

        /**
         * Set the semblance matrix indexed {@code [time][scan parameter]}. Optional. Can be null.
         *
         * @param value The value.
         * @return This {@link Builder} instance.
         */
        public Builder setSemblance(@Nullable final double[][] value) {
            _semblance = value;
            return this;
        }

        /**
         * Set the first break picking time of every trace. Optional. Can be null.
         *
         * @param value The value.
         * @return This {@link Builder} instance.
         */
        public Builder setPickingTimes(@Nullable final double[] value) {
            _pickingTimes = value;
            return this;
        }

        /**
         * Set the source to receiver offset of every trace. Optional. Can be null.
         *
         * @param value The value.
         * @return This {@link Builder} instance.
         */
        public Builder setOffsets(@Nullable final double[] value) {
            _offsets = value;
            return this;
        }

        /**
         * Set the raw amplitudes indexed {@code [trace][sample]}. Optional. Can be null.
         *
         * @param value The value.
         * @return This {@link Builder} instance.
         */
        public Builder setAmplitudes(@Nullable final double[][] value) {
            _amplitudes = value;
            return this;
        }

        /**
         * Set the time between two samples, in the unit of the horizon times. Optional. Can be null.
         *
         * @param value The value.
         * @return This {@link Builder} instance.
         */
        public Builder setSampleInterval(@Nullable final Double value) {
            _sampleInterval = value;
            return this;
        }

        /**
         * Set the receiver x coordinates, one per trace or a single value for all traces. Optional. Can be null.
         *
         * @param value The value.
         * @return This {@link Builder} instance.
         */
        public Builder setReceiverX(@Nullable final double[] value) {
            _receiverX = value;
            return this;
        }

        /**
         * Set the receiver y coordinates, one per trace or a single value for all traces. Optional. Can be null.
         *
         * @param value The value.
         * @return This {@link Builder} instance.
         */
        public Builder setReceiverY(@Nullable final double[] value) {
            _receiverY = value;
            return this;
        }

        /**
         * Set the receiver elevations, one per trace or a single value for all traces. Optional. Can be null.
         *
         * @param value The value.
         * @return This {@link Builder} instance.
         */
        public Builder setReceiverElevation(@Nullable final double[] value) {
            _receiverElevation = value;
            return this;
        }

        /**
         * Set the source x coordinates, one per trace or a single value for all traces. Optional. Can be null.
         *
         * @param value The value.
         * @return This {@link Builder} instance.
         */
        public Builder setSourceX(@Nullable final double[] value) {
            _sourceX = value;
            return this;
        }

        /**
         * Set the source y coordinates, one per trace or a single value for all traces. Optional. Can be null.
         *
         * @param value The value.
         * @return This {@link Builder} instance.
         */
        public Builder setSourceY(@Nullable final double[] value) {
            _sourceY = value;
            return this;
        }

        /**
         * Set the source elevations, one per trace or a single value for all traces. Optional. Can be null.
         *
         * @param value The value.
         * @return This {@link Builder} instance.
         */
        public Builder setSourceElevation(@Nullable final double[] value) {
            _sourceElevation = value;
            return this;
        }

        @NotNull
        private Long _id;
        @Nullable
        private Integer _inline;
        @Nullable
        private Integer _crossline;
        @Nullable
        private double[][] _semblance;
        @Nullable
        private double[] _pickingTimes;
        @Nullable
        private double[] _offsets;
        @Nullable
        private double[][] _amplitudes;
        @Nullable
        private Double _sampleInterval;
        @Nullable
        private double[] _receiverX;
        @Nullable
        private double[] _receiverY;
        @Nullable
        private double[] _receiverElevation;
        @Nullable
        private double[] _sourceX;
        @Nullable
        private double[] _sourceY;
        @Nullable
        private double[] _sourceElevation;
    }
}
