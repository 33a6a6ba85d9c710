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

import com.arpnetworking.hunter.model.ChangePoint;
import com.arpnetworking.hunter.statistics.SignificanceTester;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Prunes weak change points of a metric bottom-up. While any candidate is
 * not significant the one with the largest p-value is removed; after that
 * the one with the smallest magnitude is removed until every candidate
 * exceeds the minimum magnitude. Removing a change point widens the ranges
 * compared by its neighbours, so their statistics are recomputed. On ties
 * the earliest candidate is removed.
 *
 * @author Inscope Metrics
 */
public final class ChangePointMerger {

    /**
     * Public constructor.
     *
     * @param tester The tester recomputing the statistics of neighbours.
     * @param maxPValue The largest p-value of a kept change point.
     * @param minMagnitude The magnitude a kept change point must exceed.
     */
    public ChangePointMerger(final SignificanceTester tester, final double maxPValue, final double minMagnitude) {
        _tester = tester;
        _maxPValue = maxPValue;
        _minMagnitude = minMagnitude;
    }

    /**
     * Prune the candidates of one metric.
     *
     * @param candidates The candidates ordered by strictly increasing index.
     * Their statistics must compare the ranges between adjacent candidates.
     * @param values The gap-free values of the metric.
     * @return The surviving change points ordered by index.
     */
    public ImmutableList<ChangePoint> merge(final List<ChangePoint> candidates, final double[] values) {
        final int count = candidates.size();
        final ChangePoint[] points = candidates.toArray(new ChangePoint[0]);
        // Live candidates form a doubly linked list over the array positions
        final int[] previous = new int[count];
        final int[] next = new int[count];
        for (int i = 0; i < count; ++i) {
            previous[i] = i - 1;
            next[i] = i + 1 < count ? i + 1 : NONE;
        }
        int head = count > 0 ? 0 : NONE;

        while (head != NONE) {
            int selected = NONE;
            double weakestPValue = _maxPValue;
            for (int i = head; i != NONE; i = next[i]) {
                final double pvalue = points[i].getStats().getPValue();
                if (pvalue > weakestPValue) {
                    weakestPValue = pvalue;
                    selected = i;
                }
            }

            if (selected == NONE) {
                double smallestMagnitude = Double.POSITIVE_INFINITY;
                for (int i = head; i != NONE; i = next[i]) {
                    final double magnitude = points[i].magnitude();
                    if (magnitude < smallestMagnitude) {
                        smallestMagnitude = magnitude;
                        selected = i;
                    }
                }
                if (smallestMagnitude > _minMagnitude) {
                    break;
                }
            }

            final int before = previous[selected];
            final int after = next[selected];
            if (before != NONE) {
                next[before] = after;
            } else {
                head = after;
            }
            if (after != NONE) {
                previous[after] = before;
            }
            LOGGER.trace()
                    .setMessage("Removed change point")
                    .addData("changePoint", points[selected])
                    .log();

            if (before != NONE) {
                points[before] = recompute(points, previous, next, before, values);
            }
            if (after != NONE) {
                points[after] = recompute(points, previous, next, after, values);
            }
        }

        final ImmutableList.Builder<ChangePoint> result = ImmutableList.builder();
        for (int i = head; i != NONE; i = next[i]) {
            result.add(points[i]);
        }
        return result.build();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Tester", _tester)
                .add("MaxPValue", _maxPValue)
                .add("MinMagnitude", _minMagnitude)
                .toString();
    }

    private ChangePoint recompute(
            final ChangePoint[] points,
            final int[] previous,
            final int[] next,
            final int position,
            final double[] values) {
        final int begin = previous[position] != NONE ? points[previous[position]].getIndex() : 0;
        final int end = next[position] != NONE ? points[next[position]].getIndex() : values.length;
        final ChangePoint point = points[position];
        return point.withStats(_tester.compare(values, begin, point.getIndex(), end));
    }

    private final SignificanceTester _tester;
    private final double _maxPValue;
    private final double _minMagnitude;

    private static final int NONE = -1;
    private static final Logger LOGGER = LoggerFactory.getLogger(ChangePointMerger.class);
}
