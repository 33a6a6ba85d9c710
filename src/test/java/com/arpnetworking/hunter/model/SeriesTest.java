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

import com.arpnetworking.test.TestBeanFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.ImmutableLongArray;
import net.sf.oval.exception.ConstraintsViolatedException;
import org.junit.Assert;
import org.junit.Test;

import java.time.Instant;
import java.util.OptionalInt;

/**
 * Tests for the {@link Series} class.
 *
 * @author Inscope Metrics
 */
public class SeriesTest {

    @Test
    public void testBuild() {
        final Series series = new Series.Builder()
                .setTestName("throughput")
                .setTime(ImmutableLongArray.of(10, 20, 30))
                .setMetrics(ImmutableMap.of("ops", TestBeanFactory.createMetric(1)))
                .setData(ImmutableMap.of("ops", MetricData.of(1.0, null, 3.0)))
                .setAttributes(ImmutableMap.of("commit", ImmutableList.of("a", "b", "c")))
                .build();

        Assert.assertEquals("throughput", series.getTestName());
        Assert.assertFalse(series.getBranch().isPresent());
        Assert.assertEquals(3, series.length());
        Assert.assertEquals(ImmutableMap.of("commit", "b"), series.attributesAt(1));
        Assert.assertEquals(1, series.getMetric("ops").getDirection());
    }

    @Test
    public void testDefaultMetric() {
        final Series series = TestBeanFactory.createSeries("latency", 1.0, 2.0);
        final Metric metric = series.getMetric("latency");
        Assert.assertEquals(1, metric.getDirection());
        Assert.assertEquals(1.0, metric.getScale(), 0.0);
        Assert.assertEquals("", metric.getUnit());
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testTimeNotIncreasing() {
        new Series.Builder()
                .setTestName("test")
                .setTime(ImmutableLongArray.of(10, 20, 20))
                .build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testDataLengthMismatch() {
        TestBeanFactory.createSeriesBuilder(3)
                .setData(ImmutableMap.of("metric", MetricData.ofValues(1.0, 2.0)))
                .build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testAttributeLengthMismatch() {
        TestBeanFactory.createSeriesBuilder(2)
                .setAttributes(ImmutableMap.of("commit", ImmutableList.of("a", "b", "c")))
                .build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testMissingTestName() {
        new Series.Builder()
                .setTime(ImmutableLongArray.of(10))
                .build();
    }

    @Test
    public void testFindFirstNotEarlierThan() {
        final Series series = new Series.Builder()
                .setTestName("test")
                .setTime(ImmutableLongArray.of(100, 200, 300))
                .build();

        Assert.assertEquals(OptionalInt.of(0), series.findFirstNotEarlierThan(Instant.ofEpochSecond(50)));
        Assert.assertEquals(OptionalInt.of(1), series.findFirstNotEarlierThan(Instant.ofEpochSecond(200)));
        Assert.assertEquals(OptionalInt.of(2), series.findFirstNotEarlierThan(Instant.ofEpochSecond(200, 1)));
        Assert.assertFalse(series.findFirstNotEarlierThan(Instant.ofEpochSecond(301)).isPresent());
    }

    @Test
    public void testFindByAttribute() {
        final Series series = TestBeanFactory.createSeriesBuilder(4)
                .setAttributes(ImmutableMap.of("version", ImmutableList.of("1.0", "1.1", "1.0", "1.2")))
                .build();

        Assert.assertEquals(ImmutableList.of(0, 2), series.findByAttribute("version", "1.0"));
        Assert.assertTrue(series.findByAttribute("version", "2.0").isEmpty());
        Assert.assertTrue(series.findByAttribute("commit", "1.0").isEmpty());
    }
}
