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
package com.arpnetworking.seismicqc.metrics;

import com.arpnetworking.seismicqc.models.GatherRecord;
import com.arpnetworking.seismicqc.test.TestBeanFactory;
import com.arpnetworking.seismicqc.utility.ParallelExecutor;
import com.google.common.collect.ImmutableList;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.MockitoAnnotations;

import java.util.List;

/**
 * Tests for the {@link GatherMetricRunner} class.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class GatherMetricRunnerTest {

    @Before
    public void setUp() {
        _mocks = MockitoAnnotations.openMocks(this);
        _executor = new ParallelExecutor(3);
        Mockito.doReturn("id_metric").when(_metric).getName();
        Mockito.doReturn(ImmutableList.of("twice", "negated")).when(_metric).getOutputNames();
        Mockito.doAnswer(invocation -> {
            final GatherRecord gather = invocation.getArgument(0);
            if (gather.getId() == FAILING_ID) {
                throw new IllegalStateException("broken gather");
            }
            return new double[] {2.0 * gather.getId(), -gather.getId()};
        }).when(_metric).compute(ArgumentMatchers.any(GatherRecord.class));
    }

    @After
    public void tearDown() throws Exception {
        _executor.close();
        _mocks.close();
    }

    @Test
    public void testRunByListIndex() {
        final List<GatherRecord> gathers = createGathers(10L, 11L, 12L);
        final double[][] outputs = new GatherMetricRunner(_executor, GatherMetricRunner.FailurePolicy.ABORT)
                .run(_metric, gathers);
        Assert.assertArrayEquals(new double[] {20.0, 22.0, 24.0}, outputs[0], 0.0);
        Assert.assertArrayEquals(new double[] {-10.0, -11.0, -12.0}, outputs[1], 0.0);
        Mockito.verify(_metric, Mockito.times(3)).compute(ArgumentMatchers.any(GatherRecord.class));
    }

    @Test
    public void testRunByPosition() {
        final List<GatherRecord> gathers = createGathers(10L, 11L, 12L);
        final double[][] outputs = new GatherMetricRunner(_executor, GatherMetricRunner.FailurePolicy.ABORT)
                .run(_metric, gathers, gather -> (int) (12L - gather.getId()), 4);
        Assert.assertEquals(24.0, outputs[0][0], 0.0);
        Assert.assertEquals(22.0, outputs[0][1], 0.0);
        Assert.assertEquals(20.0, outputs[0][2], 0.0);
        Assert.assertTrue(Double.isNaN(outputs[0][3]));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicatePosition() {
        new GatherMetricRunner(_executor, GatherMetricRunner.FailurePolicy.ABORT)
                .run(_metric, createGathers(10L, 11L), gather -> 0, 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPositionOutOfRange() {
        new GatherMetricRunner(_executor, GatherMetricRunner.FailurePolicy.ABORT)
                .run(_metric, createGathers(10L), gather -> 1, 1);
    }

    @Test
    public void testAbortOnFailure() {
        try {
            new GatherMetricRunner(_executor, GatherMetricRunner.FailurePolicy.ABORT)
                    .run(_metric, createGathers(10L, FAILING_ID, 12L));
            Assert.fail("Expected exception not thrown");
        } catch (final GatherMetricException e) {
            Assert.assertEquals(FAILING_ID, e.getGatherId());
            Assert.assertEquals("id_metric", e.getMetricName());
            Assert.assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }

    @Test
    public void testIsolateFailure() {
        final double[][] outputs = new GatherMetricRunner(_executor, GatherMetricRunner.FailurePolicy.ISOLATE)
                .run(_metric, createGathers(10L, FAILING_ID, 12L));
        Assert.assertEquals(20.0, outputs[0][0], 0.0);
        Assert.assertTrue(Double.isNaN(outputs[0][1]));
        Assert.assertTrue(Double.isNaN(outputs[1][1]));
        Assert.assertEquals(24.0, outputs[0][2], 0.0);
    }

    @Test
    public void testBuiltInMetrics() {
        final List<GatherRecord> gathers = ImmutableList.of(
                TestBeanFactory.createGather(),
                TestBeanFactory.createGather());
        final GatherMetricRunner runner = new GatherMetricRunner(_executor, GatherMetricRunner.FailurePolicy.ABORT);

        // Picks are 20 + offset / 2 for offsets 50, 100, ..., 400
        final double[][] linearDiff = runner.run(GatherMetrics.LINEAR_DIFF, gathers);
        Assert.assertEquals(2, linearDiff.length);
        Assert.assertEquals(0.0, linearDiff[0][0], 1e-9);
        Assert.assertEquals(0.0, linearDiff[1][1], 1e-9);

        final double[][] velocity = runner.run(GatherMetrics.VELOCITY, gathers);
        Assert.assertEquals(1, velocity.length);
        Assert.assertTrue(velocity[0][0] > 0.0 && velocity[0][0] < 2.0);

        final double[][] spread = runner.run(GatherMetrics.getMetric("minmax_spread"), gathers);
        Assert.assertTrue(spread[0][1] >= 0.0 && spread[0][1] <= 1.0);
    }

    @Test
    public void testMissingFieldFailsGather() {
        final GatherRecord gather = new GatherRecord.Builder().setId(FAILING_ID).build();
        try {
            new GatherMetricRunner(_executor, GatherMetricRunner.FailurePolicy.ABORT)
                    .run(GatherMetrics.STD_SPREAD, ImmutableList.of(gather));
            Assert.fail("Expected exception not thrown");
        } catch (final GatherMetricException e) {
            Assert.assertEquals("std_spread", e.getMetricName());
            Assert.assertTrue(e.getCause() instanceof IllegalArgumentException);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownMetric() {
        GatherMetrics.getMetric("semblance_peak");
    }

    private static List<GatherRecord> createGathers(final long... ids) {
        final ImmutableList.Builder<GatherRecord> gathers = ImmutableList.builder();
        for (final long id : ids) {
            gathers.add(new GatherRecord.Builder().setId(id).build());
        }
        return gathers.build();
    }

    @Mock
    private GatherMetric _metric;
    private AutoCloseable _mocks;
    private ParallelExecutor _executor;

    private static final long FAILING_ID = 99L;
}
