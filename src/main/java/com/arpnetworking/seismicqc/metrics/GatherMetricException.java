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

/**
 * Thrown when a metric cannot be computed for one gather.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class GatherMetricException extends RuntimeException {

    /**
     * Public constructor.
     *
     * @param gatherId The identifier of the failed gather.
     * @param metricName The name of the failed metric.
     * @param cause The underlying failure.
     */
    public GatherMetricException(final long gatherId, final String metricName, final Throwable cause) {
        super(String.format("Gather metric failed; gatherId=%d, metric=%s", gatherId, metricName), cause);
        _gatherId = gatherId;
        _metricName = metricName;
    }

    public long getGatherId() {
        return _gatherId;
    }

    public String getMetricName() {
        return _metricName;
    }

    private final long _gatherId;
    private final String _metricName;

    private static final long serialVersionUID = 4096457123006735518L;
}
