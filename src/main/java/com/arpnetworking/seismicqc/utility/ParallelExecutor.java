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

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.IntConsumer;

/**
 * Fixed size worker pool running independent index ranges. Every task writes
 * only to the output slots of its own index so no synchronization is
 * performed between tasks. A run is all-or-nothing: the first failing task
 * cancels the remaining ones and its exception is rethrown to the caller.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class ParallelExecutor implements AutoCloseable {

    /**
     * Public constructor.
     *
     * @param threads The number of worker threads; must be positive.
     */
    public ParallelExecutor(final int threads) {
        Preconditions.checkArgument(threads > 0, "Worker thread count must be positive; threads=%s", threads);
        _threads = threads;
        _executor = Executors.newFixedThreadPool(
                threads,
                new ThreadFactoryBuilder()
                        .setNameFormat("seismicqc-worker-%d")
                        .setDaemon(true)
                        .build());
    }

    /**
     * Run {@code task} once for every index in {@code [0, count)}.
     *
     * @param count The number of indices.
     * @param task The task to invoke with each index.
     */
    public void forEachIndex(final int count, final IntConsumer task) {
        Preconditions.checkArgument(count >= 0, "Index count cannot be negative; count=%s", count);
        final List<Future<?>> futures = Lists.newArrayListWithCapacity(count);
        for (int i = 0; i < count; ++i) {
            final int index = i;
            futures.add(_executor.submit(() -> task.accept(index)));
        }
        for (int i = 0; i < futures.size(); ++i) {
            try {
                futures.get(i).get();
            } catch (final InterruptedException e) {
                cancel(futures);
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for parallel tasks", e);
            } catch (final ExecutionException e) {
                cancel(futures);
                LOGGER.error()
                        .setMessage("Parallel task failed; aborting run")
                        .addData("index", i)
                        .addData("count", count)
                        .setThrowable(e.getCause())
                        .log();
                final Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw new IllegalStateException("Parallel task failed", cause);
            }
        }
    }

    public int getThreads() {
        return _threads;
    }

    @Override
    public void close() {
        _executor.shutdown();
        try {
            if (!_executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                _executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            _executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("threads", _threads)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private static void cancel(final List<Future<?>> futures) {
        for (final Future<?> future : futures) {
            future.cancel(true);
        }
    }

    private final int _threads;
    private final ExecutorService _executor;

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;
    private static final Logger LOGGER = LoggerFactory.getLogger(ParallelExecutor.class);
}
