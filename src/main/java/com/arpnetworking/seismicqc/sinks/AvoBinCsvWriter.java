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
package com.arpnetworking.seismicqc.sinks;

import com.arpnetworking.logback.annotations.LogValue;
import com.arpnetworking.seismicqc.models.AvoSummary;
import com.arpnetworking.steno.LogValueMapFactory;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the kept bins of an {@link AvoSummary} as CSV with the columns
 * {@code bin, bin_avg, bin_avg_0, ..., bin_avg_{N-1}}: the bin offset, the
 * displayed average and the value of every matrix row in that bin.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class AvoBinCsvWriter {

    /**
     * Public constructor.
     *
     * @param approximated Whether {@code bin_avg} holds the polynomial
     * approximation instead of the raw averages.
     */
    public AvoBinCsvWriter(final boolean approximated) {
        _approximated = approximated;
    }

    /**
     * Write a summary to a file. A file name without exactly one dot gets
     * {@code .csv} appended.
     *
     * @param summary The summary.
     * @param target The target file.
     * @return The file written.
     * @throws IOException if the file cannot be written.
     */
    public Path write(final AvoSummary summary, final Path target) throws IOException {
        final Path file = resolveTarget(target);
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(summary, writer);
        }
        LOGGER.info()
                .setMessage("Wrote AVO bins")
                .addData("file", file)
                .addData("bins", summary.getBinCount())
                .addData("rows", summary.getRowCount())
                .log();
        return file;
    }

    /**
     * Write a summary.
     *
     * @param summary The summary.
     * @param writer The destination; not closed.
     * @throws IOException if writing fails.
     */
    public void write(final AvoSummary summary, final Writer writer) throws IOException {
        final int rows = summary.getRowCount();
        final String[] header = new String[rows + 2];
        header[0] = "bin";
        header[1] = "bin_avg";
        for (int row = 0; row < rows; ++row) {
            header[row + 2] = "bin_avg_" + row;
        }
        final double[] offsets = summary.getBinOffsets();
        final double[] averages = summary.getDisplayedAverages(_approximated);
        final double[][] binValues = summary.getBinValues();
        final CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.withHeader(header));
        for (int bin = 0; bin < offsets.length; ++bin) {
            final List<Object> record = Lists.newArrayListWithCapacity(rows + 2);
            record.add(offsets[bin]);
            record.add(averages[bin]);
            for (final double value : binValues[bin]) {
                record.add(value);
            }
            printer.printRecord(record);
        }
        printer.flush();
    }

    /**
     * Generate a Steno log compatible representation.
     *
     * @return Steno log compatible representation.
     */
    @LogValue
    public Object toLogValue() {
        return LogValueMapFactory.builder(this)
                .put("approximated", _approximated)
                .build();
    }

    @Override
    public String toString() {
        return toLogValue().toString();
    }

    static Path resolveTarget(final Path target) {
        final Path fileName = target.getFileName();
        if (fileName == null || DOT_SPLITTER.splitToList(fileName.toString()).size() == 2) {
            return target;
        }
        return target.resolveSibling(fileName + DEFAULT_EXTENSION);
    }

    private final boolean _approximated;

    private static final String DEFAULT_EXTENSION = ".csv";
    private static final Splitter DOT_SPLITTER = Splitter.on('.');
    private static final Logger LOGGER = LoggerFactory.getLogger(AvoBinCsvWriter.class);
}
