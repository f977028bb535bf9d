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
package com.arpnetworking.seismicqc.horizon;

/**
 * Thrown when a horizon has no time for a requested inline and crossline.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class HorizonLookupException extends RuntimeException {

    /**
     * Public constructor.
     *
     * @param inline The requested inline.
     * @param crossline The requested crossline.
     */
    public HorizonLookupException(final int inline, final int crossline) {
        super(String.format("No horizon time; inline=%d, crossline=%d", inline, crossline));
        _inline = inline;
        _crossline = crossline;
    }

    public int getInline() {
        return _inline;
    }

    public int getCrossline() {
        return _crossline;
    }

    private final int _inline;
    private final int _crossline;

    private static final long serialVersionUID = -3324961375720416518L;
}
