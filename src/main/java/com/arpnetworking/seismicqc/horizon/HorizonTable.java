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

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.seismicqc.models.HorizonEntry;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.Splitter;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Horizon times keyed by inline and crossline, parsed from a headerless ASCII
 * file with columns {@code INLINE CROSSLINE ... TIME}. Letters and colons are
 * treated as separators, blank lines are skipped and columns between the
 * crossline and the last column are ignored. The first line for an inline and
 * crossline wins.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class HorizonTable {

    /**
     * Load a horizon file.
     *
     * @param path The horizon file.
     * @return A new {@link HorizonTable}.
     * @throws IOException if the file cannot be read.
     */
    public static HorizonTable load(final Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            final HorizonTable table = parse(reader);
            LOGGER.info()
                    .setMessage("Loaded horizon")
                    .addData("path", path)
                    .addData("entries", table.size())
                    .log();
            return table;
        }
    }

    /**
     * Parse horizon text.
     *
     * @param reader Source of the horizon text.
     * @return A new {@link HorizonTable}.
     * @throws IOException if the reader fails.
     */
    public static HorizonTable parse(final Reader reader) throws IOException {
        final BufferedReader bufferedReader = reader instanceof BufferedReader
                ? (BufferedReader) reader
                : new BufferedReader(reader);
        final Table<Integer, Integer, Double> times = HashBasedTable.create();
        final ImmutableList.Builder<HorizonEntry> entries = ImmutableList.builder();
        int lineNumber = 0;
        String line = bufferedReader.readLine();
        while (line != null) {
            ++lineNumber;
            final Optional<HorizonEntry> entry = parseLine(lineNumber, line);
            if (entry.isPresent()) {
                final HorizonEntry horizonEntry = entry.get();
                if (times.contains(horizonEntry.getInline(), horizonEntry.getCrossline())) {
                    LOGGER.warn()
                            .setMessage("Ignoring duplicate horizon entry")
                            .addData("lineNumber", lineNumber)
                            .addData("entry", horizonEntry)
                            .log();
                } else {
                    times.put(horizonEntry.getInline(), horizonEntry.getCrossline(), horizonEntry.getTime());
                    entries.add(horizonEntry);
                }
            }
            line = bufferedReader.readLine();
        }
        return new HorizonTable(ImmutableTable.copyOf(times), entries.build());
    }

    /**
     * Parse horizon text held in memory.
     *
     * @param text The horizon text.
     * @return A new {@link HorizonTable}.
     */
    public static HorizonTable parse(final String text) {
        try {
            return parse(new StringReader(text));
        } catch (final IOException e) {
            throw new IllegalStateException("Reading from a string failed", e);
        }
    }

    /**
     * Horizon time at an inline and crossline.
     *
     * @param inline The inline.
     * @param crossline The crossline.
     * @return The time, if the horizon covers the position.
     */
    public Optional<Double> lookup(final int inline, final int crossline) {
        return Optional.ofNullable(_times.get(inline, crossline));
    }

    /**
     * Horizon time at an inline and crossline.
     *
     * @param inline The inline.
     * @param crossline The crossline.
     * @return The time.
     * @throws HorizonLookupException if the horizon does not cover the position.
     */
    public double require(final int inline, final int crossline) {
        final Double time = _times.get(inline, crossline);
        if (time == null) {
            throw new HorizonLookupException(inline, crossline);
        }
        return time;
    }

    /**
     * The retained entries in file order.
     *
     * @return The entries.
     */
    public ImmutableList<HorizonEntry> getEntries() {
        return _entries;
    }

    public int size() {
        return _entries.size();
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("entries", _entries.size())
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    private static Optional<HorizonEntry> parseLine(final int lineNumber, final String line) {
        final String cleaned = SEPARATOR_CHARACTERS.matcher(line).replaceAll(" ").trim();
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        final List<String> tokens = TOKEN_SPLITTER.splitToList(cleaned);
        if (tokens.size() < MINIMUM_TOKENS) {
            throw new HorizonParseException(
                    lineNumber,
                    line,
                    String.format("expected at least %d columns, found %d", MINIMUM_TOKENS, tokens.size()));
        }
        try {
            return Optional.of(new HorizonEntry(
                    Integer.parseInt(tokens.get(0)),
                    Integer.parseInt(tokens.get(1)),
                    Double.parseDouble(tokens.get(tokens.size() - 1))));
        } catch (final NumberFormatException e) {
            throw new HorizonParseException(lineNumber, line, "malformed number", e);
        }
    }

    private HorizonTable(final ImmutableTable<Integer, Integer, Double> times, final ImmutableList<HorizonEntry> entries) {
        _times = times;
        _entries = entries;
    }

    private final ImmutableTable<Integer, Integer, Double> _times;
    private final ImmutableList<HorizonEntry> _entries;

    private static final int MINIMUM_TOKENS = 3;
    private static final Pattern SEPARATOR_CHARACTERS = Pattern.compile("[a-zA-Z:]");
    private static final Splitter TOKEN_SPLITTER = Splitter.on(Pattern.compile("\\s+")).omitEmptyStrings();
    private static final Logger LOGGER = LoggerFactory.getLogger(HorizonTable.class);
}
