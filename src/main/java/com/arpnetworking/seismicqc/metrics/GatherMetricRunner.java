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

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.seismicqc.models.GatherRecord;
import com.arpnetworking.seismicqc.utility.ParallelExecutor;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Runs a {@link GatherMetric} over a batch of gathers on a worker pool. Every
 * gather writes only its own slot of the output arrays.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class GatherMetricRunner {

    /**
     * Public constructor.
     *
     * @param executor The worker pool.
     * @param failurePolicy What to do when one gather fails.
     */
    public GatherMetricRunner(final ParallelExecutor executor, final FailurePolicy failurePolicy) {
        _executor = executor;
        _failurePolicy = failurePolicy;
    }

    /**
     * Run a metric with gathers placed at their list index.
     *
     * @param metric The metric.
     * @param gathers The gathers.
     * @return The outputs indexed {@code [output][position]}.
     */
    public double[][] run(final GatherMetric metric, final List<GatherRecord> gathers) {
        final int[] positions = new int[gathers.size()];
        for (int i = 0; i < positions.length; ++i) {
            positions[i] = i;
        }
        return run(metric, gathers, positions, gathers.size());
    }

    /**
     * Run a metric with gathers placed by a caller supplied mapping.
     *
     * @param metric The metric.
     * @param gathers The gathers.
     * @param positionOf Maps a gather to its output slot.
     * @param slots The length of every output array.
     * @return The outputs indexed {@code [output][position]}; slots no gather
     * maps to hold {@code NaN}.
     */
    public double[][] run(
            final GatherMetric metric,
            final List<GatherRecord> gathers,
            final ToIntFunction<GatherRecord> positionOf,
            final int slots) {
        final int[] positions = new int[gathers.size()];
        for (int i = 0; i < positions.length; ++i) {
            positions[i] = positionOf.applyAsInt(gathers.get(i));
        }
        return run(metric, gathers, positions, slots);
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("executor", _executor)
                .put("failurePolicy", _failurePolicy)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private double[][] run(
            final GatherMetric metric,
            final List<GatherRecord> gathers,
            final int[] positions,
            final int slots) {
        final BitSet used = new BitSet(slots);
        for (int i = 0; i < positions.length; ++i) {
            final int position = positions[i];
            if (position < 0 || position >= slots) {
                throw new IllegalArgumentException(String.format(
                        "Gather position out of range; gatherId=%d, position=%d, slots=%d",
                        gathers.get(i).getId(),
                        position,
                        slots));
            }
            if (used.get(position)) {
                throw new IllegalArgumentException(String.format(
                        "Gather position assigned twice; gatherId=%d, position=%d",
                        gathers.get(i).getId(),
                        position));
            }
            used.set(position);
        }

        final int outputCount = metric.getOutputNames().size();
        final double[][] outputs = new double[outputCount][slots];
        for (final double[] output : outputs) {
            Arrays.fill(output, Double.NaN);
        }

        LOGGER.debug()
                .setMessage("Running gather metric")
                .addData("metric", metric.getName())
                .addData("gathers", gathers.size())
                .addData("slots", slots)
                .log();
        _executor.forEachIndex(gathers.size(), index -> {
            final GatherRecord gather = gathers.get(index);
            final int position = positions[index];
            final double[] values;
            try {
                values = metric.compute(gather);
                if (values.length != outputCount) {
                    throw new IllegalStateException(String.format(
                            "Metric produced wrong number of values; expected=%d, actual=%d",
                            outputCount,
                            values.length));
                }
            } catch (final RuntimeException e) {
                final GatherMetricException failure = new GatherMetricException(gather.getId(), metric.getName(), e);
                if (_failurePolicy == FailurePolicy.ABORT) {
                    throw failure;
                }
                LOGGER.warn()
                        .setMessage("Gather metric failed; isolating gather")
                        .addData("gatherId", gather.getId())
                        .addData("metric", metric.getName())
                        .setThrowable(failure)
                        .log();
                return;
            }
            LOGGER.trace()
                    .setMessage("Computed gather metric")
                    .addData("gatherId", gather.getId())
                    .addData("metric", metric.getName())
                    .log();
            for (int output = 0; output < outputCount; ++output) {
                outputs[output][position] = values[output];
            }
        });
        return outputs;
    }

    private final ParallelExecutor _executor;
    private final FailurePolicy _failurePolicy;

    private static final Logger LOGGER = LoggerFactory.getLogger(GatherMetricRunner.class);

    /**
     * Handling of a gather whose metric cannot be computed.
     */
    public enum FailurePolicy {
        /**
         * Fail the whole batch.
         */
        ABORT,
        /**
         * Leave the gather's slots as {@code NaN} and continue.
         */
        ISOLATE
    }
}
