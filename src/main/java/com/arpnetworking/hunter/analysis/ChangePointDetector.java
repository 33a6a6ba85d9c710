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
import com.arpnetworking.hunter.model.ChangePoint;
import com.arpnetworking.hunter.statistics.SignificanceTester;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableLongArray;
import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * Finds the change points of a single metric.
 * <p>
 * The divisive search is quadratic in the length of the range searched and
 * tends to miss changes in the middle of long series with many changes.
 * Instead of searching the whole series, overlapping windows of
 * {@link AnalysisOptions#getWindowLen()} points are searched one after the
 * other at a relaxed significance level and the candidates found are
 * merged. The statistics of each candidate are then recomputed against its
 * neighbouring candidates across the whole series and the candidates are
 * pruned by the {@link ChangePointMerger}.
 * </p>
 *
 * @author Inscope Metrics
 */
public final class ChangePointDetector {

    /**
     * Public constructor.
     *
     * @param options The analysis options.
     */
    public ChangePointDetector(final AnalysisOptions options) {
        _options = options;
        _tester = options.createSignificanceTester();
        _merger = new ChangePointMerger(_tester, options.getMaxPValue(), options.getMinMagnitude());
    }

    /**
     * Find the change points of a metric.
     *
     * @param metric The metric name.
     * @param time The time axis of the series.
     * @param values The gap-free values of the metric, one per point in time.
     * @return The change points ordered by index.
     */
    public ImmutableList<ChangePoint> detect(final String metric, final ImmutableLongArray time, final double[] values) {
        Preconditions.checkArgument(
                time.length() == values.length,
                "Time and values differ in length; time=%s, values=%s",
                time.length(),
                values.length);
        if (values.length == 0) {
            return ImmutableList.of();
        }

        final IntSortedSet indexes;
        if (_options.isWindowed()) {
            indexes = searchWindows(metric, values);
        } else {
            indexes = new IntAVLTreeSet(
                    new DivisiveSplitter(_tester, _options.getMaxPValue()).split(values, 0, values.length));
        }
        final ImmutableList<ChangePoint> candidates = createChangePoints(metric, time, values, indexes);
        if (!_options.isWindowed()) {
            return candidates;
        }

        final ImmutableList<ChangePoint> changePoints = _merger.merge(candidates, values);
        LOGGER.debug()
                .setMessage("Pruned change point candidates")
                .addData("metric", metric)
                .addData("candidates", candidates.size())
                .addData("changePoints", changePoints.size())
                .log();
        return changePoints;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Options", _options)
                .add("Tester", _tester)
                .toString();
    }

    private IntSortedSet searchWindows(final String metric, final double[] values) {
        // Weak candidates are pruned later against the real threshold
        final double windowPValue = Math.min(1.0, WINDOW_PVALUE_RELAXATION * _options.getMaxPValue());
        final DivisiveSplitter splitter = new DivisiveSplitter(_tester, windowPValue);
        final int windowLen = _options.getWindowLen();
        final int step = Math.max(1, windowLen / 2);

        final IntSortedSet indexes = new IntAVLTreeSet();
        int start = 0;
        while (start < values.length) {
            final int end = Math.min(start + windowLen, values.length);
            final IntList found = splitter.split(values, start, end);
            LOGGER.trace()
                    .setMessage("Searched window")
                    .addData("metric", metric)
                    .addData("start", start)
                    .addData("end", end)
                    .addData("found", found)
                    .log();
            indexes.addAll(found);
            final int lastFound = found.isEmpty() ? 0 : found.getInt(found.size() - 1);
            start = Math.max(lastFound, start + step);
        }
        return indexes;
    }

    private ImmutableList<ChangePoint> createChangePoints(
            final String metric,
            final ImmutableLongArray time,
            final double[] values,
            final IntSortedSet indexes) {
        final int[] boundaries = indexes.toIntArray();
        final ImmutableList.Builder<ChangePoint> result = ImmutableList.builder();
        for (int i = 0; i < boundaries.length; ++i) {
            final int begin = i > 0 ? boundaries[i - 1] : 0;
            final int end = i + 1 < boundaries.length ? boundaries[i + 1] : values.length;
            result.add(new ChangePoint.Builder()
                    .setMetric(metric)
                    .setIndex(boundaries[i])
                    .setTime(time.get(boundaries[i]))
                    .setStats(_tester.compare(values, begin, boundaries[i], end))
                    .build());
        }
        return result.build();
    }

    private final AnalysisOptions _options;
    private final SignificanceTester _tester;
    private final ChangePointMerger _merger;

    private static final double WINDOW_PVALUE_RELAXATION = 10.0;
    private static final Logger LOGGER = LoggerFactory.getLogger(ChangePointDetector.class);
}
