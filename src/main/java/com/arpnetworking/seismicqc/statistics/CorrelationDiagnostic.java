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

import com.google.common.collect.ImmutableSet;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

import java.util.Set;

/**
 * Pearson correlation coefficient between the bin averages and their
 * polynomial approximation. Fewer than two bins yield {@code NaN}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class CorrelationDiagnostic implements Diagnostic {

    @Override
    public String getName() {
        return "corr";
    }

    @Override
    public String getDisplayName() {
        return "Corr";
    }

    @Override
    public Set<String> getAliases() {
        return ALIASES;
    }

    @Override
    public double compute(final DiagnosticContext context) {
        if (context.getAverages().length < 2) {
            return Double.NaN;
        }
        return new PearsonsCorrelation().correlation(context.getAverages(), context.getApproximation());
    }

    /* package private */ CorrelationDiagnostic() { }

    private static final Set<String> ALIASES = ImmutableSet.of("correlation");
}
