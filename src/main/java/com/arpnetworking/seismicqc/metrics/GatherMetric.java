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

import com.arpnetworking.seismicqc.models.GatherRecord;
import com.google.common.collect.ImmutableList;

/**
 * A scalar computation over a single gather. Implementations are stateless
 * and safe to invoke concurrently.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public interface GatherMetric {

    /**
     * Accessor for the name of the metric.
     *
     * @return The name of the metric.
     */
    String getName();

    /**
     * The names of the values produced by {@link #compute(GatherRecord)}, in
     * order.
     *
     * @return The output names.
     */
    ImmutableList<String> getOutputNames();

    /**
     * Compute the metric.
     *
     * @param gather The gather.
     * @return One value per output name.
     */
    double[] compute(GatherRecord gather);
}
