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
package com.arpnetworking.seismicqc.utility;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for the {@link NanMath} class.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public class NanMathTest {

    @Test
    public void testDropNan() {
        Assert.assertArrayEquals(
                new double[] {1.0, 3.0},
                NanMath.dropNan(new double[] {Double.NaN, 1.0, Double.NaN, 3.0}),
                0.0);
    }

    @Test
    public void testNanMean() {
        Assert.assertEquals(2.0, NanMath.nanMean(new double[] {1.0, Double.NaN, 3.0}), 1e-12);
        Assert.assertTrue(Double.isNaN(NanMath.nanMean(new double[] {Double.NaN})));
        Assert.assertTrue(Double.isNaN(NanMath.nanMean(new double[0])));
    }

    @Test
    public void testNanStdIsPopulation() {
        Assert.assertEquals(1.0, NanMath.nanStd(new double[] {1.0, Double.NaN, 3.0}), 1e-12);
        Assert.assertEquals(0.0, NanMath.nanStd(new double[] {4.0}), 0.0);
        Assert.assertTrue(Double.isNaN(NanMath.nanStd(new double[] {Double.NaN})));
    }

    @Test
    public void testMaskZeros() {
        final double[] values = {0.0, 2.0, -0.0, 5.0};
        final double[] masked = NanMath.maskZeros(values);
        Assert.assertTrue(Double.isNaN(masked[0]));
        Assert.assertEquals(2.0, masked[1], 0.0);
        Assert.assertTrue(Double.isNaN(masked[2]));
        Assert.assertEquals(5.0, masked[3], 0.0);
        Assert.assertEquals(0.0, values[0], 0.0);
    }

    @Test
    public void testFiniteOrZero() {
        Assert.assertEquals(0.0, NanMath.finiteOrZero(Double.NaN), 0.0);
        Assert.assertEquals(0.0, NanMath.finiteOrZero(Double.POSITIVE_INFINITY), 0.0);
        Assert.assertEquals(-2.5, NanMath.finiteOrZero(-2.5), 0.0);
    }
}
