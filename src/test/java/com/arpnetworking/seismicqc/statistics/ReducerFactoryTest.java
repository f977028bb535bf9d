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
package com.arpnetworking.seismicqc.statistics;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

/**
 * Tests for the {@link ReducerFactory} class and the built-in reducers.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class ReducerFactoryTest {

    @Test
    public void testLookupByNameAndAlias() {
        Assert.assertEquals("mean", FACTORY.getReducer("mean").getName());
        Assert.assertEquals("mean", FACTORY.getReducer("avg").getName());
        Assert.assertEquals("rms", FACTORY.getReducer("RMS").getName());
        Assert.assertEquals("abs_mean", FACTORY.getReducer("modulus").getName());
        Assert.assertEquals("median", FACTORY.getReducer("p50").getName());
        Assert.assertSame(FACTORY.getReducer("max"), FACTORY.getReducer("maximum"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidName() {
        FACTORY.getReducer("mode");
    }

    @Test
    public void testTryGetInvalidName() {
        Assert.assertFalse(FACTORY.tryGetReducer("mode").isPresent());
    }

    @Test
    public void testReducerNames() {
        Assert.assertTrue(FACTORY.getReducerNames().containsAll(Arrays.asList("mean", "min", "max", "rms", "count")));
    }

    @Test
    public void testBuiltInReducersIgnoreNan() {
        final double[] values = {1.0, Double.NaN, -3.0, 4.0};
        Assert.assertEquals(2.0 / 3.0, FACTORY.getReducer("mean").reduce(values), DELTA);
        Assert.assertEquals(-3.0, FACTORY.getReducer("min").reduce(values), DELTA);
        Assert.assertEquals(4.0, FACTORY.getReducer("max").reduce(values), DELTA);
        Assert.assertEquals(1.0, FACTORY.getReducer("median").reduce(values), DELTA);
        Assert.assertEquals(Math.sqrt(26.0 / 3.0), FACTORY.getReducer("rms").reduce(values), DELTA);
        Assert.assertEquals(8.0 / 3.0, FACTORY.getReducer("abs_mean").reduce(values), DELTA);
        Assert.assertEquals(2.0, FACTORY.getReducer("sum").reduce(values), DELTA);
        Assert.assertEquals(3.0, FACTORY.getReducer("count").reduce(values), DELTA);
    }

    @Test
    public void testPopulationStandardDeviation() {
        Assert.assertEquals(2.0, FACTORY.getReducer("std").reduce(new double[] {2, 4, 4, 4, 5, 5, 7, 9}), DELTA);
    }

    @Test
    public void testEmptyInput() {
        final double[] missing = {Double.NaN, Double.NaN};
        Assert.assertTrue(Double.isNaN(FACTORY.getReducer("mean").reduce(missing)));
        Assert.assertTrue(Double.isNaN(FACTORY.getReducer("rms").reduce(new double[0])));
        Assert.assertEquals(0.0, FACTORY.getReducer("count").reduce(missing), DELTA);
        Assert.assertEquals(0.0, FACTORY.getReducer("sum").reduce(missing), DELTA);
    }

    @Test
    public void testCustomReducerSeesRawValues() {
        final Reducer reducer = FACTORY.createCustomReducer("length", values -> values.length);
        Assert.assertEquals("length", reducer.getName());
        Assert.assertEquals(3.0, reducer.reduce(new double[] {1.0, Double.NaN, 2.0}), DELTA);
    }

    private static final ReducerFactory FACTORY = new ReducerFactory();
    private static final double DELTA = 1e-12;
}
