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
package com.arpnetworking.hunter.model;

import net.sf.oval.exception.ConstraintsViolatedException;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for the {@link Metric} class.
 *
 * @author Inscope Metrics
 */
public class MetricTest {

    @Test
    public void testDefaults() {
        final Metric metric = new Metric.Builder().build();
        Assert.assertEquals(1, metric.getDirection());
        Assert.assertEquals(1.0, metric.getScale(), 0.0);
        Assert.assertEquals("", metric.getUnit());
    }

    @Test
    public void testLowerIsBetter() {
        final Metric metric = new Metric.Builder()
                .setDirection(-1)
                .setScale(0.001)
                .setUnit("s")
                .build();
        Assert.assertEquals(-1, metric.getDirection());
        Assert.assertEquals(0.001, metric.getScale(), 0.0);
        Assert.assertEquals("s", metric.getUnit());
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testInvalidDirection() {
        new Metric.Builder().setDirection(0).build();
    }

    @Test
    public void testEquality() {
        Assert.assertEquals(new Metric.Builder().setUnit("ms").build(), new Metric.Builder().setUnit("ms").build());
        Assert.assertNotEquals(new Metric.Builder().build(), new Metric.Builder().setDirection(-1).build());
    }
}
