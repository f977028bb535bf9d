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

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for the {@link BinSpecification} class.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class BinSpecificationTest {

    @Test
    public void testFixedWidthBoundaries() {
        final BinSpecification specification = BinSpecification.fixedWidth(10.0);
        Assert.assertTrue(specification.isFixedWidth());
        Assert.assertArrayEquals(new double[] {0.0, 10.0, 20.0, 30.0}, specification.getBoundaries(25.0), 0.0);
        Assert.assertArrayEquals(new double[] {0.0, 10.0, 20.0}, specification.getBoundaries(20.0), 0.0);
        Assert.assertEquals(30.0, specification.getBinOffset(3), 0.0);
    }

    @Test
    public void testExplicitEdgeBoundaries() {
        final BinSpecification specification = BinSpecification.explicitEdges(0.0, 15.0, 100.0);
        Assert.assertFalse(specification.isFixedWidth());
        Assert.assertArrayEquals(new double[] {0.0, 15.0, 26.0}, specification.getBoundaries(25.0), 0.0);
        Assert.assertEquals(15.0, specification.getBinOffset(1), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroWidth() {
        BinSpecification.fixedWidth(0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNanWidth() {
        BinSpecification.fixedWidth(Double.NaN);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyEdges() {
        BinSpecification.explicitEdges();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnorderedEdges() {
        BinSpecification.explicitEdges(0.0, 20.0, 10.0);
    }
}
