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
package com.arpnetworking.seismicqc.statistics;

/**
 * Inputs available to a {@link Diagnostic}: the per-bin averages of the kept
 * bins, their polynomial approximation and the zero-masked per-bin data, one
 * row per kept bin and one column per gather. Arrays are shared, not copied.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class DiagnosticContext {

    /**
     * Public constructor.
     *
     * @param averages The per-bin averages.
     * @param approximation The approximation evaluated at the bin offsets.
     * @param maskedBins The masked per-bin data.
     */
    public DiagnosticContext(final double[] averages, final double[] approximation, final double[][] maskedBins) {
        _averages = averages;
        _approximation = approximation;
        _maskedBins = maskedBins;
    }

    public double[] getAverages() {
        return _averages;
    }

    public double[] getApproximation() {
        return _approximation;
    }

    public double[][] getMaskedBins() {
        return _maskedBins;
    }

    private final double[] _averages;
    private final double[] _approximation;
    private final double[][] _maskedBins;
}
