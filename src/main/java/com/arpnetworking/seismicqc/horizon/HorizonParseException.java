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
 * Thrown when a horizon file line cannot be parsed. Fatal for the whole load.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class HorizonParseException extends RuntimeException {

    /**
     * Public constructor.
     *
     * @param lineNumber The one based number of the offending line.
     * @param line The offending line.
     * @param reason Why the line was rejected.
     */
    public HorizonParseException(final int lineNumber, final String line, final String reason) {
        this(lineNumber, line, reason, null);
    }

    /**
     * Public constructor.
     *
     * @param lineNumber The one based number of the offending line.
     * @param line The offending line.
     * @param reason Why the line was rejected.
     * @param cause The underlying failure, may be null.
     */
    public HorizonParseException(final int lineNumber, final String line, final String reason, final Throwable cause) {
        super(String.format("Invalid horizon line; lineNumber=%d, reason=%s, line=%s", lineNumber, reason, line), cause);
        _lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return _lineNumber;
    }

    private final int _lineNumber;

    private static final long serialVersionUID = 6212580416120437761L;
}
