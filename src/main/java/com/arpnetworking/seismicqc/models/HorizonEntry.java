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
package com.arpnetworking.seismicqc.models;

import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * Reference time of a horizon at one inline and crossline.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
@Loggable
public final class HorizonEntry {

    /**
     * Public constructor.
     *
     * @param inline The inline number.
     * @param crossline The crossline number.
     * @param time The horizon time.
     */
    public HorizonEntry(final int inline, final int crossline, final double time) {
        _inline = inline;
        _crossline = crossline;
        _time = time;
    }

    public int getInline() {
        return _inline;
    }

    public int getCrossline() {
        return _crossline;
    }

    public double getTime() {
        return _time;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        final HorizonEntry other = (HorizonEntry) object;
        return _inline == other._inline
                && _crossline == other._crossline
                && Double.compare(_time, other._time) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_inline, _crossline, _time);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Inline", _inline)
                .add("Crossline", _crossline)
                .add("Time", _time)
                .toString();
    }

    private final int _inline;
    private final int _crossline;
    private final double _time;
}
