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
import com.arpnetworking.hunter.model.ChangePointGroup;
import com.arpnetworking.hunter.model.Series;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Groups the change points of all metrics of a series by index.
 *
 * @author Inscope Metrics
 */
public final class ChangePointGrouper {

    /**
     * Group change points sharing an index. Within a group the changes keep
     * the order of the metrics in the input map.
     *
     * @param series The series the change points were found in.
     * @param changePoints The change points of each metric.
     * @return The groups ordered by index.
     */
    public static ImmutableList<ChangePointGroup> group(
            final Series series,
            final Map<String, ? extends List<ChangePoint>> changePoints) {
        final List<ChangePoint> changes = new ArrayList<>();
        for (final List<ChangePoint> metricChangePoints : changePoints.values()) {
            changes.addAll(metricChangePoints);
        }
        changes.sort(Comparator.comparingInt(ChangePoint::getIndex));

        final ImmutableList.Builder<ChangePointGroup> groups = ImmutableList.builder();
        int runStart = 0;
        while (runStart < changes.size()) {
            final int index = changes.get(runStart).getIndex();
            int runEnd = runStart + 1;
            while (runEnd < changes.size() && changes.get(runEnd).getIndex() == index) {
                ++runEnd;
            }
            // Splits leave at least two points on the left, so index zero is unreachable
            Preconditions.checkState(
                    index > 0,
                    "Change point without a preceding point; changePoint=%s",
                    changes.get(runStart));
            groups.add(new ChangePointGroup.Builder()
                    .setIndex(index)
                    .setTime(series.getTime().get(index))
                    .setPrevTime(series.getTime().get(index - 1))
                    .setAttributes(series.attributesAt(index))
                    .setPrevAttributes(series.attributesAt(index - 1))
                    .setChanges(ImmutableList.copyOf(changes.subList(runStart, runEnd)))
                    .build());
            runStart = runEnd;
        }
        return groups.build();
    }

    private ChangePointGrouper() {}
}
