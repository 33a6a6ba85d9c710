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

import com.arpnetworking.hunter.model.AnalyzedSeries;
import com.arpnetworking.hunter.model.SeriesComparison;
import com.arpnetworking.hunter.statistics.ComparativeStats;
import com.arpnetworking.hunter.statistics.SignificanceTester;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Range;

import java.util.OptionalInt;

/**
 * Compares two points of two analyzed series, e.g. a baseline and a target.
 * Each point is represented by the stable range of the metric around it so
 * that a single noisy run does not decide the outcome.
 *
 * @author Inscope Metrics
 */
public final class SeriesComparator {

    /**
     * Compare the last points of two series.
     *
     * @param series1 The baseline series.
     * @param series2 The target series.
     * @return The {@link SeriesComparison}.
     */
    public static SeriesComparison compare(final AnalyzedSeries series1, final AnalyzedSeries series2) {
        return compare(series1, OptionalInt.empty(), series2, OptionalInt.empty());
    }

    /**
     * Compare a point of one series to a point of another. The significance
     * tester configured for the first series is used for all metrics.
     *
     * @param series1 The baseline series.
     * @param index1 The baseline index; the last point if empty.
     * @param series2 The target series.
     * @param index2 The target index; the last point if empty.
     * @return The {@link SeriesComparison}.
     */
    public static SeriesComparison compare(
            final AnalyzedSeries series1,
            final OptionalInt index1,
            final AnalyzedSeries series2,
            final OptionalInt index2) {
        final int resolvedIndex1 = resolveIndex(series1, index1);
        final int resolvedIndex2 = resolveIndex(series2, index2);
        final SignificanceTester tester = series1.getOptions().createSignificanceTester();

        final ImmutableMap.Builder<String, ComparativeStats> stats = ImmutableMap.builder();
        for (final String metric : series1.getMetricNames()) {
            if (!series2.getMetricNames().contains(metric)) {
                continue;
            }
            final Range<Integer> range1 = series1.getStableRange(metric, resolvedIndex1);
            final Range<Integer> range2 = series2.getStableRange(metric, resolvedIndex2);
            final double[] values1 = series1.getData(metric).getPresentValues(range1.lowerEndpoint(), range1.upperEndpoint());
            final double[] values2 = series2.getData(metric).getPresentValues(range2.lowerEndpoint(), range2.upperEndpoint());
            if (values1.length == 0 || values2.length == 0) {
                LOGGER.debug()
                        .setMessage("Skipping metric without values in stable range")
                        .addData("metric", metric)
                        .addData("range1", range1.toString())
                        .addData("range2", range2.toString())
                        .log();
                continue;
            }
            stats.put(metric, tester.compare(values1, values2));
        }

        return new SeriesComparison.Builder()
                .setSeries1(series1)
                .setSeries2(series2)
                .setIndex1(resolvedIndex1)
                .setIndex2(resolvedIndex2)
                .setStats(stats.build())
                .build();
    }

    private static int resolveIndex(final AnalyzedSeries series, final OptionalInt index) {
        Preconditions.checkArgument(series.length() > 0, "Cannot compare an empty series; test=%s", series.getTestName());
        final int resolved = index.orElse(series.length() - 1);
        Preconditions.checkElementIndex(resolved, series.length(), "index");
        return resolved;
    }

    private SeriesComparator() {}

    private static final Logger LOGGER = LoggerFactory.getLogger(SeriesComparator.class);
}
