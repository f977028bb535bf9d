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

import java.util.Arrays;

/**
 * Partition of the offset axis into bins: either a fixed width starting at
 * zero or explicit, possibly irregular, bin start edges.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class BinSpecification {

    /**
     * Bins of a fixed width starting at zero.
     *
     * @param width The bin width; must be positive and finite.
     * @return A new {@link BinSpecification}.
     */
    public static BinSpecification fixedWidth(final double width) {
        if (!(width > 0) || Double.isInfinite(width)) {
            throw new IllegalArgumentException(String.format("Bin width must be positive and finite; width=%s", width));
        }
        return new BinSpecification(width, null);
    }

    /**
     * Bins starting at the given edges.
     *
     * @param edges The bin start edges; non-empty, finite and strictly increasing.
     * @return A new {@link BinSpecification}.
     */
    public static BinSpecification explicitEdges(final double... edges) {
        if (edges.length == 0) {
            throw new IllegalArgumentException("Bin edges cannot be empty");
        }
        for (int i = 0; i < edges.length; ++i) {
            if (!Double.isFinite(edges[i])) {
                throw new IllegalArgumentException(String.format("Bin edges must be finite; edge=%s", edges[i]));
            }
            if (i > 0 && edges[i] <= edges[i - 1]) {
                throw new IllegalArgumentException(
                        String.format("Bin edges must be strictly increasing; edges=%s", Arrays.toString(edges)));
            }
        }
        return new BinSpecification(null, edges.clone());
    }

    public boolean isFixedWidth() {
        return _width != null;
    }

    /**
     * Boundaries of the bins for a gather: bin {@code i} covers
     * {@code [boundaries[i], boundaries[i + 1])}. A fixed width yields
     * {@code 0, w, 2w, ...} below {@code maxOffset + w}; explicit edges yield the
     * edges below {@code maxOffset} followed by {@code maxOffset + 1}.
     *
     * @param maxOffset The largest offset of the gather.
     * @return The boundaries; there is one bin fewer than boundaries.
     */
    public double[] getBoundaries(final double maxOffset) {
        if (_width != null) {
            final double stop = maxOffset + _width;
            final int count = (int) Math.max(0, Math.ceil(stop / _width));
            final double[] boundaries = new double[count];
            for (int i = 0; i < count; ++i) {
                boundaries[i] = i * _width;
            }
            return boundaries;
        }
        final double[] below = Arrays.stream(_edges).filter(edge -> edge < maxOffset).toArray();
        final double[] boundaries = Arrays.copyOf(below, below.length + 1);
        boundaries[below.length] = maxOffset + 1;
        return boundaries;
    }

    /**
     * Offset representing a bin: its start.
     *
     * @param bin The bin index.
     * @return The bin start offset.
     */
    public double getBinOffset(final int bin) {
        if (_width != null) {
            return bin * _width;
        }
        Preconditions.checkElementIndex(bin, _edges.length, "bin");
        return _edges[bin];
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Width", _width)
                .add("Edges", _edges == null ? null : Arrays.toString(_edges))
                .toString();
    }

    private BinSpecification(final Double width, final double[] edges) {
        _width = width;
        _edges = edges;
    }

    private final Double _width;
    private final double[] _edges;
}
