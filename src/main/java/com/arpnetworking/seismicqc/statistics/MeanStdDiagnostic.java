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

import com.arpnetworking.seismicqc.utility.NanMath;
import com.google.common.collect.ImmutableSet;

import java.util.Set;

/**
 * Mean over the kept bins of the per-bin population standard deviation,
 * ignoring missing values.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class MeanStdDiagnostic implements Diagnostic {

    @Override
    public String getName() {
        return "std";
    }

    @Override
    public String getDisplayName() {
        return "Mean std";
    }

    @Override
    public Set<String> getAliases() {
        return ALIASES;
    }

    @Override
    public double compute(final DiagnosticContext context) {
        final double[][] bins = context.getMaskedBins();
        if (bins.length == 0) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (final double[] bin : bins) {
            sum += NanMath.nanStd(bin);
        }
        return sum / bins.length;
    }

    /* package private */ MeanStdDiagnostic() { }

    private static final Set<String> ALIASES = ImmutableSet.of("mean_std");
}
