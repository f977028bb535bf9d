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

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for the {@link SemblanceMetrics} class.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class SemblanceMetricsTest {

    @Test
    public void testMinmaxSpread() {
        Assert.assertEquals(6.0, SemblanceMetrics.minmaxSpread(SEMBLANCE), DELTA);
    }

    @Test
    public void testStdSpread() {
        Assert.assertEquals(2.5, SemblanceMetrics.stdSpread(SEMBLANCE), DELTA);
    }

    @Test
    public void testSingleRow() {
        final double[][] semblance = {{0.2, 0.6}};
        Assert.assertEquals(0.0, SemblanceMetrics.minmaxSpread(semblance), DELTA);
        Assert.assertEquals(0.2, SemblanceMetrics.stdSpread(semblance), DELTA);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmpty() {
        SemblanceMetrics.minmaxSpread(new double[0][]);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRagged() {
        SemblanceMetrics.stdSpread(new double[][] {{1.0, 2.0}, {3.0}});
    }

    private static final double[][] SEMBLANCE = {
        {1.0, 2.0},
        {3.0, 8.0},
        {2.0, 5.0},
    };
    private static final double DELTA = 1e-12;
}
