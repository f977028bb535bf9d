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

import com.google.common.collect.ImmutableList;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for the {@link DiagnosticFactory} class and the built-in diagnostics.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class DiagnosticFactoryTest {

    @Test
    public void testLookup() {
        Assert.assertEquals("Mean std", FACTORY.getDiagnostic("std").getDisplayName());
        Assert.assertEquals("Mean std", FACTORY.getDiagnostic("mean_std").getDisplayName());
        Assert.assertEquals("Corr", FACTORY.getDiagnostic("correlation").getDisplayName());
        final ImmutableList<Diagnostic> diagnostics = FACTORY.getDiagnostics(ImmutableList.of("corr", "std"));
        Assert.assertEquals("corr", diagnostics.get(0).getName());
        Assert.assertEquals("std", diagnostics.get(1).getName());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidName() {
        FACTORY.getDiagnostic("variance");
    }

    @Test
    public void testMeanStd() {
        final DiagnosticContext context = new DiagnosticContext(
                new double[] {2.0, 3.0},
                new double[] {2.0, 3.0},
                new double[][] {{1.0, 3.0, Double.NaN}, {2.0, 2.0, 2.0}});
        Assert.assertEquals(0.5, FACTORY.getDiagnostic("std").compute(context), DELTA);
    }

    @Test
    public void testCorrelation() {
        final DiagnosticContext context = new DiagnosticContext(
                new double[] {1.0, 2.0, 3.0},
                new double[] {2.0, 4.0, 6.0},
                new double[3][1]);
        Assert.assertEquals(1.0, FACTORY.getDiagnostic("corr").compute(context), DELTA);
    }

    @Test
    public void testCorrelationSingleBin() {
        final DiagnosticContext context = new DiagnosticContext(new double[] {1.0}, new double[] {1.0}, new double[1][1]);
        Assert.assertTrue(Double.isNaN(FACTORY.getDiagnostic("corr").compute(context)));
    }

    @Test
    public void testCustomDiagnostic() {
        final Diagnostic diagnostic = FACTORY.createCustomDiagnostic("bins", bins -> bins.length);
        Assert.assertEquals("bins", diagnostic.getDisplayName());
        final DiagnosticContext context = new DiagnosticContext(new double[2], new double[2], new double[2][3]);
        Assert.assertEquals(2.0, diagnostic.compute(context), DELTA);
    }

    private static final DiagnosticFactory FACTORY = new DiagnosticFactory();
    private static final double DELTA = 1e-12;
}
