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

import com.google.common.base.Preconditions;

import java.util.Collections;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Diagnostic backed by a caller supplied function over the masked per-bin
 * data of the kept bins.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class CustomDiagnostic implements Diagnostic {

    /**
     * Public constructor.
     *
     * @param name The name reported for this diagnostic.
     * @param function Function of the masked per-bin data.
     */
    public CustomDiagnostic(final String name, final ToDoubleFunction<double[][]> function) {
        Preconditions.checkArgument(!name.isEmpty(), "Custom diagnostic name cannot be empty");
        _name = name;
        _function = function;
    }

    @Override
    public String getName() {
        return _name;
    }

    @Override
    public String getDisplayName() {
        return _name;
    }

    @Override
    public Set<String> getAliases() {
        return Collections.emptySet();
    }

    @Override
    public double compute(final DiagnosticContext context) {
        return _function.applyAsDouble(context.getMaskedBins());
    }

    private final String _name;
    private final ToDoubleFunction<double[][]> _function;
}
