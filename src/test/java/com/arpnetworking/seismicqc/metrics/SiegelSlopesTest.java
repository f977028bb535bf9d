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

import com.arpnetworking.seismicqc.models.LinearFit;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for the {@link SiegelSlopes} class.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class SiegelSlopesTest {

    @Test
    public void testExactLine() {
        final double[] x = {0.0, 1.0, 2.0, 3.0, 4.0};
        final double[] y = {1.0, 3.0, 5.0, 7.0, 9.0};
        final LinearFit fit = SiegelSlopes.fit(y, x);
        Assert.assertEquals(2.0, fit.getSlope(), DELTA);
        Assert.assertEquals(1.0, fit.getIntercept(), DELTA);
    }

    @Test
    public void testResistsOutlier() {
        final double[] x = {0.0, 1.0, 2.0, 3.0, 4.0, 5.0};
        final double[] y = {1.0, 3.0, 5.0, 7.0, 9.0, 100.0};
        final LinearFit fit = SiegelSlopes.fit(y, x);
        Assert.assertEquals(2.0, fit.getSlope(), DELTA);
        Assert.assertEquals(1.0, fit.getIntercept(), DELTA);
        Assert.assertEquals(21.0, fit.evaluate(10.0), DELTA);
    }

    @Test
    public void testRepeatedAbscissae() {
        final double[] x = {1.0, 1.0, 2.0, 2.0};
        final double[] y = {1.0, 1.0, 2.0, 2.0};
        final LinearFit fit = SiegelSlopes.fit(y, x);
        Assert.assertEquals(1.0, fit.getSlope(), DELTA);
        Assert.assertEquals(0.0, fit.getIntercept(), DELTA);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSingleAbscissa() {
        SiegelSlopes.fit(new double[] {1.0, 2.0}, new double[] {3.0, 3.0});
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMismatchedLengths() {
        SiegelSlopes.fit(new double[] {1.0, 2.0}, new double[] {3.0});
    }

    private static final double DELTA = 1e-12;
}
