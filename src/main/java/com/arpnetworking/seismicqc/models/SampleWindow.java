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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Time window of the samples aggregated per offset bin.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class SampleWindow {

    /**
     * Window covering every sample.
     *
     * @return The full window.
     */
    public static SampleWindow full() {
        return FULL;
    }

    /**
     * Window between two sample indices, both inclusive.
     *
     * @param start The first sample index.
     * @param end The last sample index.
     * @return A new {@link SampleWindow}.
     */
    public static SampleWindow fixed(final int start, final int end) {
        Preconditions.checkArgument(start >= 0, "Window start cannot be negative; start=%s", start);
        Preconditions.checkArgument(end >= start, "Window end precedes start; start=%s, end=%s", start, end);
        return new SampleWindow(Kind.FIXED, start, end, 0, 0);
    }

    /**
     * Window from {@code lower} before to {@code upper} after the horizon time
     * of the gather's inline and crossline, in time units.
     *
     * @param lower The time before the horizon.
     * @param upper The time after the horizon.
     * @return A new {@link SampleWindow}.
     */
    public static SampleWindow aroundHorizon(final double lower, final double upper) {
        Preconditions.checkArgument(Double.isFinite(lower) && Double.isFinite(upper), "Horizon window must be finite");
        return new SampleWindow(Kind.HORIZON, 0, 0, lower, upper);
    }

    public Kind getKind() {
        return _kind;
    }

    public int getStart() {
        return _start;
    }

    public int getEnd() {
        return _end;
    }

    public double getLower() {
        return _lower;
    }

    public double getUpper() {
        return _upper;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Kind", _kind)
                .add("Start", _start)
                .add("End", _end)
                .add("Lower", _lower)
                .add("Upper", _upper)
                .toString();
    }

    private SampleWindow(final Kind kind, final int start, final int end, final double lower, final double upper) {
        _kind = kind;
        _start = start;
        _end = end;
        _lower = lower;
        _upper = upper;
    }

    private final Kind _kind;
    private final int _start;
    private final int _end;
    private final double _lower;
    private final double _upper;

    private static final SampleWindow FULL = new SampleWindow(Kind.FULL, 0, 0, 0, 0);

    /**
     * How the window bounds are obtained.
     */
    public enum Kind {
        /**
         * Every sample of the trace.
         */
        FULL,
        /**
         * Fixed sample indices.
         */
        FIXED,
        /**
         * Relative to the horizon time of the gather.
         */
        HORIZON
    }
}
