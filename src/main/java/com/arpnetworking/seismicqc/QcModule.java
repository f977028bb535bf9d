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
package com.arpnetworking.seismicqc;

import com.arpnetworking.seismicqc.aggregation.AvoSummarizer;
import com.arpnetworking.seismicqc.aggregation.MetricGridBuilder;
import com.arpnetworking.seismicqc.aggregation.OffsetBinner;
import com.arpnetworking.seismicqc.aggregation.SeriesComparison;
import com.arpnetworking.seismicqc.configuration.QcConfiguration;
import com.arpnetworking.seismicqc.horizon.HorizonTable;
import com.arpnetworking.seismicqc.metrics.GatherMetricRunner;
import com.arpnetworking.seismicqc.sinks.AvoBinCsvWriter;
import com.arpnetworking.seismicqc.statistics.DiagnosticFactory;
import com.arpnetworking.seismicqc.statistics.ReducerFactory;
import com.arpnetworking.seismicqc.utility.ParallelExecutor;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * Guice module wiring the QC components from a {@link QcConfiguration}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class QcModule extends AbstractModule {
    /**
     * Public constructor.
     *
     * @param configuration The configuration.
     */
    public QcModule(final QcConfiguration configuration) {
        _configuration = configuration;
    }

    @Override
    protected void configure() {
        bind(QcConfiguration.class).toInstance(_configuration);
        bind(ReducerFactory.class).in(Singleton.class);
        bind(DiagnosticFactory.class).in(Singleton.class);
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private ParallelExecutor provideParallelExecutor() {
        return new ParallelExecutor(_configuration.getWorkerThreads());
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private MetricGridBuilder provideMetricGridBuilder(
            final ParallelExecutor executor,
            final ReducerFactory reducerFactory) {
        return new MetricGridBuilder(
                executor,
                reducerFactory,
                _configuration.getGridBinSize(),
                _configuration.getGridReducer());
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private SeriesComparison provideSeriesComparison() {
        return new SeriesComparison(_configuration.getBinSpecification(), _configuration.getAlignSeriesMeans());
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private GatherMetricRunner provideGatherMetricRunner(final ParallelExecutor executor) {
        return new GatherMetricRunner(executor, _configuration.getGatherFailurePolicy());
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private OffsetBinner provideOffsetBinner(final ReducerFactory reducerFactory) {
        final Optional<File> horizonFile = _configuration.getHorizonFile();
        HorizonTable horizonTable = null;
        if (horizonFile.isPresent()) {
            try {
                horizonTable = HorizonTable.load(horizonFile.get().toPath());
            } catch (final IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        final OffsetBinner binner = new OffsetBinner.Builder()
                .setBinSpecification(_configuration.getBinSpecification())
                .setSampleWindow(_configuration.getSampleWindow())
                .setReducer(reducerFactory.getReducer(_configuration.getOffsetReducer()))
                .setVectorLength(_configuration.getOffsetBinCount())
                .setHorizonTable(horizonTable)
                .build();
        LOGGER.debug()
                .setMessage("Created offset binner")
                .addData("binner", binner)
                .log();
        return binner;
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private AvoSummarizer provideAvoSummarizer(
            final ReducerFactory reducerFactory,
            final DiagnosticFactory diagnosticFactory) {
        return new AvoSummarizer.Builder()
                .setReducer(reducerFactory.getReducer(_configuration.getSummaryReducer()))
                .setApproximationDegree(_configuration.getApproximationDegree())
                .setDiagnostics(diagnosticFactory.getDiagnostics(_configuration.getDiagnostics()))
                .setBinSpecification(_configuration.getBinSpecification())
                .build();
    }

    @Provides
    @Singleton
    @SuppressFBWarnings("UPM_UNCALLED_PRIVATE_METHOD") // Invoked reflectively by Guice
    private AvoBinCsvWriter provideAvoBinCsvWriter() {
        return new AvoBinCsvWriter(_configuration.getShowApproximation());
    }

    private final QcConfiguration _configuration;

    private static final Logger LOGGER = LoggerFactory.getLogger(QcModule.class);
}
