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
package com.arpnetworking.seismicqc.aggregation;

import com.arpnetworking.seismicqc.horizon.HorizonLookupException;
import com.arpnetworking.seismicqc.horizon.HorizonTable;
import com.arpnetworking.seismicqc.models.BinSpecification;
import com.arpnetworking.seismicqc.models.GatherRecord;
import com.arpnetworking.seismicqc.models.OffsetBinMatrix;
import com.arpnetworking.seismicqc.models.SampleWindow;
import com.arpnetworking.seismicqc.statistics.ReducerFactory;
import com.arpnetworking.seismicqc.test.TestBeanFactory;
import com.google.common.collect.ImmutableList;
import net.sf.oval.exception.ConstraintsViolatedException;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for the {@link OffsetBinner} class.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class OffsetBinnerTest {

    @Test
    public void testZeroAndMissingBins() {
        final GatherRecord gather = new GatherRecord.Builder()
                .setId(1L)
                .setOffsets(new double[] {25.0, 10.0, 0.0})
                .setAmplitudes(new double[][] {
                    {2.0, 2.0, 2.0, 2.0},
                    {0.0, 0.0, 0.0, 0.0},
                    {1.0, 0.0, -1.0, 0.0},
                })
                .build();
        final OffsetBinner binner = createBinnerBuilder("rms").build();
        Assert.assertArrayEquals(new double[] {1.0, 0.0, 2.0, 0.0, 0.0}, binner.binGather(gather), DELTA);
    }

    @Test
    public void testBinWithoutTraces() {
        final GatherRecord gather = new GatherRecord.Builder()
                .setId(1L)
                .setOffsets(new double[] {0.0, 25.0})
                .setAmplitudes(new double[][] {{3.0, 3.0}, {4.0, 4.0}})
                .build();
        final double[] vector = createBinnerBuilder("mean").build().binGather(gather);
        Assert.assertArrayEquals(new double[] {3.0, 0.0, 4.0, 0.0, 0.0}, vector, DELTA);
    }

    @Test
    public void testFixedWindowIsInclusive() {
        final GatherRecord gather = new GatherRecord.Builder()
                .setId(1L)
                .setOffsets(new double[] {5.0})
                .setAmplitudes(new double[][] {{1.0, 2.0, 3.0, 4.0}})
                .build();
        final double[] vector = createBinnerBuilder("mean")
                .setSampleWindow(SampleWindow.fixed(1, 2))
                .build()
                .binGather(gather);
        Assert.assertEquals(2.5, vector[0], DELTA);
    }

    @Test
    public void testFixedWindowPastTraceEnd() {
        final GatherRecord gather = new GatherRecord.Builder()
                .setId(1L)
                .setOffsets(new double[] {5.0})
                .setAmplitudes(new double[][] {{1.0, 2.0, 3.0, 4.0}})
                .build();
        Assert.assertEquals(3.5, createBinnerBuilder("mean")
                .setSampleWindow(SampleWindow.fixed(2, 10))
                .build()
                .binGather(gather)[0], DELTA);
        Assert.assertEquals(0.0, createBinnerBuilder("mean")
                .setSampleWindow(SampleWindow.fixed(6, 10))
                .build()
                .binGather(gather)[0], DELTA);
    }

    @Test
    public void testExplicitEdges() {
        final GatherRecord gather = new GatherRecord.Builder()
                .setId(1L)
                .setOffsets(new double[] {10.0, 25.0, 0.0})
                .setAmplitudes(new double[][] {{3.0}, {5.0}, {1.0}})
                .build();
        final double[] vector = createBinnerBuilder("mean")
                .setBinSpecification(BinSpecification.explicitEdges(0.0, 15.0, 100.0))
                .build()
                .binGather(gather);
        Assert.assertArrayEquals(new double[] {2.0, 5.0, 0.0, 0.0, 0.0}, vector, DELTA);
    }

    @Test
    public void testHorizonWindow() {
        final double[] trace = new double[20];
        for (int i = 0; i < trace.length; ++i) {
            trace[i] = i + 1;
        }
        final GatherRecord gather = new GatherRecord.Builder()
                .setId(1L)
                .setInline(5)
                .setCrossline(7)
                .setSampleInterval(10.0)
                .setOffsets(new double[] {5.0})
                .setAmplitudes(new double[][] {trace})
                .build();
        final OffsetBinner binner = createBinnerBuilder("mean")
                .setSampleWindow(SampleWindow.aroundHorizon(10.0, 10.0))
                .setHorizonTable(HorizonTable.parse("INLINE: 5 XLINE: 7 100.0\n"))
                .build();
        Assert.assertEquals(11.0, binner.binGather(gather)[0], DELTA);
    }

    @Test(expected = HorizonLookupException.class)
    public void testHorizonMiss() {
        final GatherRecord gather = TestBeanFactory.createGatherBuilder(3)
                .setInline(6)
                .setCrossline(7)
                .build();
        createBinnerBuilder("mean")
                .setVectorLength(20)
                .setSampleWindow(SampleWindow.aroundHorizon(10.0, 10.0))
                .setHorizonTable(HorizonTable.parse("5 7 100.0\n"))
                .build()
                .binGather(gather);
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testHorizonWindowRequiresHorizon() {
        createBinnerBuilder("mean")
                .setSampleWindow(SampleWindow.aroundHorizon(10.0, 10.0))
                .build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTooManyBins() {
        final GatherRecord gather = new GatherRecord.Builder()
                .setId(1L)
                .setOffsets(new double[] {0.0, 25.0})
                .setAmplitudes(new double[][] {{1.0}, {1.0}})
                .build();
        createBinnerBuilder("mean").setVectorLength(2).build().binGather(gather);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingAmplitudes() {
        createBinnerBuilder("mean").build().binGather(new GatherRecord.Builder()
                .setId(1L)
                .setOffsets(new double[] {1.0})
                .build());
    }

    @Test
    public void testProcessAllAppendsInOrder() {
        final GatherRecord first = new GatherRecord.Builder()
                .setId(2L)
                .setOffsets(new double[] {0.0, 5.0})
                .setAmplitudes(new double[][] {{4.0}, {4.0}})
                .build();
        final GatherRecord second = new GatherRecord.Builder()
                .setId(1L)
                .setOffsets(new double[] {12.0})
                .setAmplitudes(new double[][] {{-3.0}})
                .build();
        final OffsetBinner binner = createBinnerBuilder("abs_mean").build();
        final OffsetBinMatrix matrix = binner.processAll(ImmutableList.of(first, second));
        Assert.assertEquals(2, matrix.getRowCount());
        Assert.assertArrayEquals(new double[] {4.0, 0.0, 0.0, 0.0, 0.0}, matrix.getRow(0), DELTA);
        Assert.assertArrayEquals(new double[] {0.0, 3.0, 0.0, 0.0, 0.0}, matrix.getRow(1), DELTA);

        binner.process(first, matrix);
        Assert.assertEquals(3, matrix.getRowCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testProcessIntoMismatchedMatrix() {
        createBinnerBuilder("mean").build().process(TestBeanFactory.createGather(), new OffsetBinMatrix(3));
    }

    private static OffsetBinner.Builder createBinnerBuilder(final String reducer) {
        return new OffsetBinner.Builder()
                .setBinSpecification(BinSpecification.fixedWidth(10.0))
                .setReducer(REDUCER_FACTORY.getReducer(reducer))
                .setVectorLength(5);
    }

    private static final ReducerFactory REDUCER_FACTORY = new ReducerFactory();
    private static final double DELTA = 1e-12;
}
