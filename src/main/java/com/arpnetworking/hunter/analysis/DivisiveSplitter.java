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

import com.arpnetworking.hunter.statistics.ComparativeStats;
import com.arpnetworking.hunter.statistics.SignificanceTester;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntComparators;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Divisive search for change points within a range of values. The split
 * maximizing the {@link EnergyStatistic} is kept if the tester finds the two
 * sides significantly different, and both sides are then searched
 * independently. A segment without a significant split is left whole.
 *
 * @author Inscope Metrics
 */
public final class DivisiveSplitter {

    /**
     * Public constructor.
     *
     * @param tester The tester deciding whether a split is significant.
     * @param maxPValue The largest p-value of an accepted split.
     */
    public DivisiveSplitter(final SignificanceTester tester, final double maxPValue) {
        _tester = tester;
        _maxPValue = maxPValue;
    }

    /**
     * Find the change points in {@code [begin, end)}.
     *
     * @param values The values; must not contain gaps.
     * @param begin The first index searched.
     * @param end One past the last index searched.
     * @return The indexes of the change points in ascending order.
     */
    public IntList split(final double[] values, final int begin, final int end) {
        Preconditions.checkPositionIndexes(begin, end, values.length);
        final IntArrayList result = new IntArrayList();
        final IntArrayList pending = new IntArrayList();
        pending.add(begin);
        pending.add(end);
        while (!pending.isEmpty()) {
            final int segmentEnd = pending.popInt();
            final int segmentBegin = pending.popInt();
            final int split = EnergyStatistic.findBestSplit(values, segmentBegin, segmentEnd);
            if (split == EnergyStatistic.NO_SPLIT) {
                continue;
            }
            final ComparativeStats stats = _tester.compare(values, segmentBegin, split, segmentEnd);
            if (stats.isSignificant(_maxPValue)) {
                result.add(split);
                pending.add(segmentBegin);
                pending.add(split);
                pending.add(split);
                pending.add(segmentEnd);
            }
        }
        result.sort(IntComparators.NATURAL_COMPARATOR);
        return result;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Tester", _tester)
                .add("MaxPValue", _maxPValue)
                .toString();
    }

    private final SignificanceTester _tester;
    private final double _maxPValue;
}
