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

import com.arpnetworking.seismicqc.models.BinGrid;
import com.arpnetworking.seismicqc.statistics.ReducerFactory;
import com.arpnetworking.seismicqc.utility.ParallelExecutor;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests for the {@link MetricGridBuilder} class.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class MetricGridBuilderTest {

    @Before
    public void setUp() {
        _executor = new ParallelExecutor(4);
        _builder = new MetricGridBuilder(_executor, new ReducerFactory());
    }

    @After
    public void tearDown() {
        _executor.close();
    }

    @Test
    public void testDiagonalGrid() {
        final MetricsMap map = MetricsMap.build(
                new double[][] {{0, 0}, {0, 0}, {1, 1}},
                new double[] {10, 20, 30});
        final BinGrid grid = _builder.build(map, 1.0);
        Assert.assertEquals(2, grid.getRowCount());
        Assert.assertEquals(2, grid.getColumnCount());
        Assert.assertEquals(10.0, grid.getValue(0, 0), 0.0);
        Assert.assertEquals(30.0, grid.getValue(1, 1), 0.0);
        Assert.assertTrue(grid.isEmpty(0, 1));
        Assert.assertTrue(grid.isEmpty(1, 0));
        Assert.assertEquals(0.0, grid.getXMin(), 0.0);
        Assert.assertEquals(1.0, grid.getXMax(), 0.0);
        Assert.assertEquals(0.0, grid.getYMin(), 0.0);
        Assert.assertEquals(1.0, grid.getYMax(), 0.0);
    }

    @Test
    public void testRowsFollowY() {
        final MetricsMap map = MetricsMap.build(
                new double[][] {{100, 10}, {105, 30}, {100, 25}},
                new double[] {1, 2, 3});
        final BinGrid grid = _builder.build(map, 10.0, "max");
        Assert.assertEquals(3, grid.getRowCount());
        Assert.assertEquals(2, grid.getColumnCount());
        Assert.assertEquals(1.0, grid.getValue(0, 0), 0.0);
        Assert.assertEquals(3.0, grid.getValue(1, 0), 0.0);
        Assert.assertEquals(2.0, grid.getValue(2, 0), 0.0);
        Assert.assertTrue(grid.isEmpty(0, 1));
    }

    @Test
    public void testCellMean() {
        final MetricsMap map = MetricsMap.build(
                new double[][] {{0, 0}, {4, 4}, {9.5, 0}, {10, 10}},
                new double[] {1, 2, 6, 100});
        final BinGrid grid = _builder.build(map, 10.0);
        Assert.assertEquals(3.0, grid.getValue(0, 0), 1e-12);
        Assert.assertEquals(100.0, grid.getValue(1, 1), 0.0);
    }

    @Test
    public void testEverySampleInExactlyOneCell() {
        final int count = 500;
        final double[][] coordinates = new double[count][];
        final double[] values = new double[count];
        for (int i = 0; i < count; ++i) {
            coordinates[i] = new double[] {(i * 37) % 211, (i * 53) % 199 + i / 250.0};
            values[i] = i;
        }
        final MetricsMap map = MetricsMap.build(coordinates, values);
        final BinGrid grid = _builder.build(map, 10.0, "count");
        double total = 0.0;
        for (int row = 0; row < grid.getRowCount(); ++row) {
            for (int column = 0; column < grid.getColumnCount(); ++column) {
                if (!grid.isEmpty(row, column)) {
                    total += grid.getValue(row, column);
                }
            }
        }
        Assert.assertEquals(map.size(), (int) total);
    }

    @Test
    public void testCustomReducer() {
        final MetricsMap map = MetricsMap.build(new double[][] {{0, 0}, {1, 1}}, new double[] {2, 3});
        final BinGrid grid = _builder.build(
                map,
                5.0,
                new ReducerFactory().createCustomReducer("product", cell -> {
                    double product = 1.0;
                    for (final double value : cell) {
                        product *= value;
                    }
                    return product;
                }));
        Assert.assertEquals(6.0, grid.getValue(0, 0), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownReducer() {
        _builder.build(MetricsMap.build(new double[][] {{0, 0}}, new double[] {1}), 1.0, "mode");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyMap() {
        _builder.build(MetricsMap.build(new double[0][], new double[0]), 1.0);
    }

    @Test
    public void testConfiguredDefaults() {
        final MetricGridBuilder builder = new MetricGridBuilder(_executor, new ReducerFactory(), 10.0, "max");
        Assert.assertEquals(10.0, builder.getDefaultBinSize(), 0.0);
        Assert.assertEquals("max", builder.getDefaultReducer().getName());
        final MetricsMap map = MetricsMap.build(
                new double[][] {{0, 0}, {4, 4}, {12, 0}},
                new double[] {1, 5, 7});
        final BinGrid grid = builder.build(map);
        Assert.assertEquals(3, grid.getColumnCount());
        Assert.assertEquals(5.0, grid.getValue(0, 0), 0.0);
        Assert.assertEquals(7.0, grid.getValue(0, 1), 0.0);
    }

    @Test
    public void testExplicitBinSizeKeepsDefaultReducer() {
        final MetricGridBuilder builder = new MetricGridBuilder(_executor, new ReducerFactory(), 10.0, "min");
        final BinGrid grid = builder.build(
                MetricsMap.build(new double[][] {{0, 0}, {15, 15}}, new double[] {3, 8}),
                100.0);
        Assert.assertEquals(2, grid.getColumnCount());
        Assert.assertEquals(3.0, grid.getValue(0, 0), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidDefaultReducer() {
        new MetricGridBuilder(_executor, new ReducerFactory(), 10.0, "mode");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidDefaultBinSize() {
        new MetricGridBuilder(_executor, new ReducerFactory(), -1.0, "mean");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveBinSize() {
        _builder.build(MetricsMap.build(new double[][] {{0, 0}}, new double[] {1}), 0.0);
    }

    private ParallelExecutor _executor;
    private MetricGridBuilder _builder;
}
