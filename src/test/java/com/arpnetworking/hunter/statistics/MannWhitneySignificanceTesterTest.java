/*
 * Copyright 2026 Inscope Metrics
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
package com.arpnetworking.hunter.statistics;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for the {@link MannWhitneySignificanceTester} class.
 *
 * @author Inscope Metrics
 */
public class MannWhitneySignificanceTesterTest {

    @Test
    public void testInterleaved() {
        final ComparativeStats stats = TESTER.compare(
                new double[]{1.0, 3.0, 5.0, 7.0, 9.0},
                new double[]{2.0, 4.0, 6.0, 8.0, 10.0});
        Assert.assertEquals(5.0, stats.getMean1(), 1e-12);
        Assert.assertEquals(6.0, stats.getMean2(), 1e-12);
        Assert.assertTrue(stats.getPValue() > 0.5);
    }

    @Test
    public void testSeparated() {
        final ComparativeStats stats = TESTER.compare(
                new double[]{1.0, 1.1, 0.9, 1.05, 0.95},
                new double[]{2.0, 2.1, 1.9, 2.05, 1.95});
        Assert.assertTrue(stats.getPValue() < 0.05);
    }

    @Test
    public void testDeterministic() {
        final double[] left = new double[]{1.0, 1.2, 0.8, 1.1};
        final double[] right = new double[]{1.5, 1.4, 1.6};
        Assert.assertEquals(TESTER.compare(left, right), TESTER.compare(left, right));
    }

    @Test
    public void testTwoPoints() {
        Assert.assertEquals(1.0, TESTER.compare(new double[]{1.0}, new double[]{2.0}).getPValue(), 0.0);
    }

    @Test(expected = InsufficientDataException.class)
    public void testEmptyRight() {
        TESTER.compare(new double[]{1.0}, new double[0]);
    }

    private static final SignificanceTester TESTER = new SignificanceTesterFactory().getTester("mannwhitney");
}
