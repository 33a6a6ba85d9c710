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
package com.arpnetworking.hunter.analysis;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.arpnetworking.hunter.configuration.AnalysisOptions;
import com.arpnetworking.hunter.model.AnalyzedSeries;
import com.arpnetworking.hunter.model.ChangePoint;
import com.arpnetworking.hunter.model.ChangePointGroup;
import com.arpnetworking.hunter.model.MetricData;
import com.arpnetworking.hunter.model.Series;
import com.arpnetworking.logback.StenoEncoder;
import com.arpnetworking.test.TestBeanFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.ImmutableLongArray;
import org.junit.Assert;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Tests for the {@link SeriesAnalyzer} class.
 *
 * @author Inscope Metrics
 */
public class SeriesAnalyzerTest {

    @Test
    public void testTwoSeriesStep() {
        final AnalyzedSeries analyzed = createStepSeries().analyze();
        final ImmutableList<ChangePointGroup> groups = analyzed.getChangePointsByTime();

        Assert.assertEquals(2, groups.size());
        Assert.assertEquals(4, groups.get(0).getIndex());
        Assert.assertEquals(1, groups.get(0).getChanges().size());
        final ChangePoint series2Change = groups.get(0).getChanges().get(0);
        Assert.assertEquals("series2", series2Change.getMetric());
        Assert.assertEquals(-11.0, series2Change.forwardChangePercent(), 0.5);

        Assert.assertEquals(6, groups.get(1).getIndex());
        Assert.assertEquals(1, groups.get(1).getChanges().size());
        final ChangePoint series1Change = groups.get(1).getChanges().get(0);
        Assert.assertEquals("series1", series1Change.getMetric());
        Assert.assertEquals(-49.0, series1Change.forwardChangePercent(), 1.0);

        Assert.assertEquals(ImmutableList.of(series1Change), analyzed.getChangePoints("series1"));
        Assert.assertEquals(ImmutableList.of(series2Change), analyzed.getChangePoints("series2"));
    }

    @Test
    public void testMinMagnitude() {
        final AnalysisOptions options = TestBeanFactory.createOptionsBuilder()
                .setMinMagnitude(0.2)
                .build();
        final ImmutableList<ChangePointGroup> groups = createStepSeries().analyze(options).getChangePointsByTime();

        Assert.assertEquals(1, groups.size());
        Assert.assertEquals(6, groups.get(0).getIndex());
        Assert.assertEquals("series1", groups.get(0).getChanges().get(0).getMetric());
        for (final ChangePointGroup group : groups) {
            for (final ChangePoint change : group.getChanges()) {
                Assert.assertTrue(change.magnitude() >= options.getMinMagnitude());
            }
        }
    }

    @Test
    public void testIdempotent() {
        final Series series = createStepSeries();
        final AnalysisOptions options = TestBeanFactory.createOptionsBuilder().build();
        Assert.assertEquals(
                series.analyze(options).getChangePointsByTime(),
                series.analyze(options).getChangePointsByTime());
    }

    @Test
    public void testParallelMatchesSequential() throws InterruptedException {
        final Series series = createStepSeries();
        final AnalysisOptions options = TestBeanFactory.createOptionsBuilder().build();
        final ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            final AnalyzedSeries parallel = new SeriesAnalyzer(options).analyze(series, executor);
            final AnalyzedSeries sequential = new SeriesAnalyzer(options).analyze(series);
            Assert.assertEquals(sequential.getChangePoints(), parallel.getChangePoints());
            Assert.assertEquals(sequential.getChangePointsByTime(), parallel.getChangePointsByTime());
        } finally {
            executor.shutdown();
            executor.awaitTermination(10, TimeUnit.SECONDS);
        }
    }

    @Test
    public void testGapsAreFilled() {
        final Series series = TestBeanFactory.createSeriesBuilder(11)
                .setData(ImmutableMap.of(
                        "series1",
                        MetricData.of(1.02, 0.95, null, 1.00, 1.12, 0.90, 0.50, null, 0.48, 0.48, 0.55)))
                .build();
        final AnalyzedSeries analyzed = series.analyze();

        Assert.assertEquals(1, analyzed.getChangePoints("series1").size());
        Assert.assertEquals(6, analyzed.getChangePoints("series1").get(0).getIndex());
    }

    @Test
    public void testAllGaps() {
        final Series series = TestBeanFactory.createSeriesBuilder(4)
                .setData(ImmutableMap.of("missing", MetricData.of(null, null, null, null)))
                .build();
        final AnalyzedSeries analyzed = series.analyze();

        Assert.assertTrue(analyzed.getChangePoints("missing").isEmpty());
        Assert.assertTrue(analyzed.getChangePointsByTime().isEmpty());
        Assert.assertTrue(analyzed.getMetricNames().contains("missing"));
    }

    @Test
    public void testEmptySeries() {
        final Series series = TestBeanFactory.createSeriesBuilder(0)
                .setData(ImmutableMap.of("metric", MetricData.ofValues()))
                .build();
        final AnalyzedSeries analyzed = series.analyze();

        Assert.assertEquals(0, analyzed.length());
        Assert.assertTrue(analyzed.getChangePoints("metric").isEmpty());
        Assert.assertTrue(analyzed.getChangePointsByTime().isEmpty());
    }

    @Test
    public void testTimesAndAttributes() {
        final Series step = createStepSeries();
        final Series series = new Series.Builder()
                .setTestName(step.getTestName())
                .setTime(ImmutableLongArray.of(10, 20, 30, 40, 50, 60, 70, 80, 90, 100, 110))
                .setData(step.getData())
                .setAttributes(ImmutableMap.of("commit", TestBeanFactory.createAttribute("c", 11)))
                .build();
        final ChangePointGroup group = series.analyze().getChangePointsByTime().get(1);

        Assert.assertEquals(70, group.getTime());
        Assert.assertEquals(60, group.getPrevTime());
        Assert.assertEquals("c6", group.getAttributes().get("commit"));
        Assert.assertEquals("c5", group.getPrevAttributes().get("commit"));
        Assert.assertEquals(70, group.getChanges().get(0).getTime());
    }

    @Test
    public void testAnalysisLogIsEncodable() {
        final Logger logger = (Logger) LoggerFactory.getLogger(SeriesAnalyzer.class);
        final LoggerContext context = logger.getLoggerContext();
        final ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.setContext(context);
        appender.start();
        logger.addAppender(appender);
        final StenoEncoder encoder = new StenoEncoder();
        encoder.setContext(context);
        encoder.start();
        try {
            createStepSeries().analyze();

            final List<ILoggingEvent> events = appender.list.stream()
                    .filter(event -> Level.INFO.equals(event.getLevel()))
                    .collect(Collectors.toList());
            Assert.assertEquals(1, events.size());
            final String encoded = new String(encoder.encode(events.get(0)), StandardCharsets.UTF_8);
            Assert.assertTrue(encoded, encoded.contains("Computing change points"));
            Assert.assertTrue(encoded, encoded.contains("\"branch\":\"main\""));
        } finally {
            logger.detachAppender(appender);
            appender.stop();
            encoder.stop();
        }
    }

    private static Series createStepSeries() {
        return TestBeanFactory.createSeries(
                "series1", SERIES_1,
                "series2", SERIES_2);
    }

    private static final double[] SERIES_1 = new double[]{
            1.02, 0.95, 0.99, 1.00, 1.12, 0.90, 0.50, 0.51, 0.48, 0.48, 0.55};
    private static final double[] SERIES_2 = new double[]{
            2.02, 2.03, 2.01, 2.04, 1.82, 1.85, 1.79, 1.81, 1.80, 1.76, 1.78};
}
