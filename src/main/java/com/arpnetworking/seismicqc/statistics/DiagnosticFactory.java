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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Resolves AVO diagnostics by name or alias.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class DiagnosticFactory {

    /**
     * Get a diagnostic by name.
     *
     * @param name The name or alias of the desired diagnostic.
     * @return The {@link Diagnostic}.
     */
    public Diagnostic getDiagnostic(final String name) {
        final Optional<Diagnostic> diagnostic = tryGetDiagnostic(name);
        if (!diagnostic.isPresent()) {
            throw new IllegalArgumentException(String.format("Invalid diagnostic name; name=%s", name));
        }
        return diagnostic.get();
    }

    /**
     * Get a diagnostic by name.
     *
     * @param name The name or alias of the desired diagnostic.
     * @return The {@link Diagnostic} if one is registered under the name.
     */
    public Optional<Diagnostic> tryGetDiagnostic(final String name) {
        return Optional.ofNullable(DIAGNOSTICS_BY_NAME_AND_ALIAS.get(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * Resolve a list of diagnostic names.
     *
     * @param names The names or aliases.
     * @return The diagnostics in the order given.
     */
    public ImmutableList<Diagnostic> getDiagnostics(final List<String> names) {
        final ImmutableList.Builder<Diagnostic> diagnostics = ImmutableList.builder();
        for (final String name : names) {
            diagnostics.add(getDiagnostic(name));
        }
        return diagnostics.build();
    }

    /**
     * Wrap a caller supplied function as a {@link Diagnostic}.
     *
     * @param name The name reported for the diagnostic.
     * @param function Function of the masked per-bin data.
     * @return A new {@link CustomDiagnostic}.
     */
    public Diagnostic createCustomDiagnostic(final String name, final ToDoubleFunction<double[][]> function) {
        return new CustomDiagnostic(name, function);
    }

    private static final ImmutableMap<String, Diagnostic> DIAGNOSTICS_BY_NAME_AND_ALIAS;

    static {
        final ImmutableMap.Builder<String, Diagnostic> builder = ImmutableMap.builder();
        for (final Diagnostic diagnostic : ImmutableList.of(new MeanStdDiagnostic(), new CorrelationDiagnostic())) {
            builder.put(diagnostic.getName(), diagnostic);
            for (final String alias : diagnostic.getAliases()) {
                builder.put(alias, diagnostic);
            }
        }
        DIAGNOSTICS_BY_NAME_AND_ALIAS = builder.build();
    }
}
