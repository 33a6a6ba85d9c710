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
 * Tests for the {@link SignificanceTesterFactory} class.
 *
 * @author Inscope Metrics
 */
public class SignificanceTesterFactoryTest {

    @Test
    public void testGetByName() {
        Assert.assertTrue(FACTORY.getTester("ttest") instanceof TTestSignificanceTester);
        Assert.assertTrue(FACTORY.getTester("mannwhitney") instanceof MannWhitneySignificanceTester);
    }

    @Test
    public void testGetByAlias() {
        Assert.assertEquals(FACTORY.getTester("ttest"), FACTORY.getTester("student"));
        Assert.assertEquals(FACTORY.getTester("mannwhitney"), FACTORY.getTester("mann-whitney"));
    }

    @Test
    public void testCaseInsensitive() {
        Assert.assertEquals(FACTORY.getTester("ttest"), FACTORY.getTester(" T-Test "));
    }

    @Test
    public void testTryGetUnknown() {
        Assert.assertFalse(FACTORY.tryGetTester("bootstrap").isPresent());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testGetUnknown() {
        FACTORY.getTester("bootstrap");
    }

    @Test
    public void testNames() {
        Assert.assertEquals(2, FACTORY.getTesterNames().size());
        Assert.assertTrue(FACTORY.getTesterNames().contains("ttest"));
        Assert.assertTrue(FACTORY.getTesterNames().contains("mannwhitney"));
    }

    private static final SignificanceTesterFactory FACTORY = new SignificanceTesterFactory();
}
