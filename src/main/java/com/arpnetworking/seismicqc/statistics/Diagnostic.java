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

import java.util.Set;

/**
 * Summary statistic computed over a fitted AVO distribution. Use
 * {@link DiagnosticFactory} to obtain instances.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public interface Diagnostic {

    /**
     * Accessor for the canonical name of the diagnostic.
     *
     * @return The name of the diagnostic.
     */
    String getName();

    /**
     * Accessor for the human readable label of the diagnostic.
     *
     * @return The display name.
     */
    String getDisplayName();

    /**
     * Accessor for any aliases of the diagnostic.
     *
     * @return The aliases of the diagnostic.
     */
    Set<String> getAliases();

    /**
     * Compute the diagnostic.
     *
     * @param context The fitted distribution.
     * @return The diagnostic value.
     */
    double compute(DiagnosticContext context);
}
