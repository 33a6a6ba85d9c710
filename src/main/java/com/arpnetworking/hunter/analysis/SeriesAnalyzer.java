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

import com.arpnetworking.hunter.configuration.AnalysisOptions;
import com.arpnetworking.hunter.model.AnalyzedSeries;
import com.arpnetworking.hunter.model.ChangePoint;
import com.arpnetworking.hunter.model.MetricData;
import com.arpnetworking.hunter.model.Series;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.MoreObjects;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.MoreExecutors;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Computes the change points of every metric of a series and groups them
 * by index. Metrics are independent of each other and may be analyzed
 * concurrently; grouping happens once all metrics are done.
 *
 * @author Inscope Metrics
 */
public final class SeriesAnalyzer {

    /**
     * Public constructor.
     *
     * @param options The analysis options.
     */
    public SeriesAnalyzer(final AnalysisOptions options) {
        _options = options;
        _detector = new ChangePointDetector(options);
    }

    /**
     * Analyze a series on the calling thread.
     *
     * @param series The series.
     * @return The {@link AnalyzedSeries}.
     */
    public AnalyzedSeries analyze(final Series series) {
        return analyze(series, MoreExecutors.directExecutor());
    }

    /**
     * Analyze a series, running the analysis of each metric on an executor.
     *
     * @param series The series.
     * @param executor The executor; its size bounds the parallelism.
     * @return The {@link AnalyzedSeries}.
     */
    public AnalyzedSeries analyze(final Series series, final Executor executor) {
        LOGGER.info()
                .setMessage("Computing change points")
                .addData("test", series.getTestName())
                .addData("branch", series.getBranch().orElse(null))
                .addData("points", series.length())
                .addData("metrics", series.getData().size())
                .log();

        final Map<String, CompletableFuture<ImmutableList<ChangePoint>>> futures = Maps.newLinkedHashMap();
        for (final Map.Entry<String, MetricData> entry : series.getData().entrySet()) {
            futures.put(
                    entry.getKey(),
                    CompletableFuture.supplyAsync(() -> analyzeMetric(series, entry.getKey(), entry.getValue()), executor));
        }

        final ImmutableMap.Builder<String, ImmutableList<ChangePoint>> changePoints = ImmutableMap.builder();
        for (final Map.Entry<String, CompletableFuture<ImmutableList<ChangePoint>>> entry : futures.entrySet()) {
            changePoints.put(entry.getKey(), join(entry.getValue()));
        }
        final ImmutableMap<String, ImmutableList<ChangePoint>> changePointsByMetric = changePoints.build();

        return new AnalyzedSeries.Builder()
                .setSeries(series)
                .setOptions(_options)
                .setChangePoints(changePointsByMetric)
                .setChangePointsByTime(ChangePointGrouper.group(series, changePointsByMetric))
                .build();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Options", _options)
                .toString();
    }

    private ImmutableList<ChangePoint> analyzeMetric(final Series series, final String metric, final MetricData data) {
        // Analyzing the unfilled values would shift the indexes
        final MetricData filled = MissingValueFiller.fill(data);
        if (filled.hasGaps()) {
            LOGGER.debug()
                    .setMessage("Skipping metric without values")
                    .addData("test", series.getTestName())
                    .addData("metric", metric)
                    .log();
            return ImmutableList.of();
        }
        return _detector.detect(metric, series.getTime(), filled.toArray());
    }

    private static <T> T join(final CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (final CompletionException e) {
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            Throwables.throwIfUnchecked(cause);
            throw new IllegalStateException("Metric analysis failed", cause);
        }
    }

    private final AnalysisOptions _options;
    private final ChangePointDetector _detector;

    private static final Logger LOGGER = LoggerFactory.getLogger(SeriesAnalyzer.class);
}
