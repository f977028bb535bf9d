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

import net.sf.oval.exception.ConstraintsViolatedException;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for the {@link BinGrid} class.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class BinGridTest {

    @Test
    public void testDisplayRange() {
        final double[][] values = new double[1][101];
        for (int i = 0; i <= 100; ++i) {
            values[0][i] = i - 50.0;
        }
        final DisplayRange range = createGrid(values).getDisplayRange();
        Assert.assertEquals(-45.0, range.getLower(), 1e-9);
        Assert.assertEquals(45.0, range.getUpper(), 1e-9);
    }

    @Test
    public void testDisplayRangeClampedAroundZero() {
        final DisplayRange range = createGrid(new double[][] {{1.0, 2.0}, {3.0, Double.NaN}}).getDisplayRange();
        Assert.assertEquals(-1e-6, range.getLower(), 0.0);
        Assert.assertTrue(range.getUpper() > 2.0);
    }

    @Test
    public void testDisplayRangeWithoutValues() {
        final DisplayRange range = createGrid(new double[][] {{Double.NaN}}).getDisplayRange();
        Assert.assertEquals(-1e-6, range.getLower(), 0.0);
        Assert.assertEquals(1e-6, range.getUpper(), 0.0);
    }

    @Test
    public void testAccessors() {
        final BinGrid grid = createGrid(new double[][] {{1.0, Double.NaN}});
        Assert.assertEquals(1, grid.getRowCount());
        Assert.assertEquals(2, grid.getColumnCount());
        Assert.assertFalse(grid.isEmpty(0, 0));
        Assert.assertTrue(grid.isEmpty(0, 1));
        grid.getValues()[0][0] = 7.0;
        Assert.assertEquals(1.0, grid.getValue(0, 0), 0.0);
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testMissingExtent() {
        new BinGrid.Builder()
                .setValues(new double[][] {{1.0}})
                .setBinSize(1.0)
                .build();
    }

    private static BinGrid createGrid(final double[][] values) {
        return new BinGrid.Builder()
                .setValues(values)
                .setBinSize(1.0)
                .setXMin(0.0)
                .setXMax(1.0)
                .setYMin(0.0)
                .setYMax(1.0)
                .build();
    }
}
