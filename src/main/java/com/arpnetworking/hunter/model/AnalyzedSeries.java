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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.hunter.configuration.AnalysisOptions;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Range;
import com.google.common.primitives.ImmutableLongArray;
import net.sf.oval.constraint.NotNull;

import java.util.Optional;

/**
 * A {@link Series} together with the change points computed for it. Use
 * {@link Series#analyze(AnalysisOptions)} to create one; the analysis runs
 * once, eagerly, and the result never changes.
 *
 * @author Inscope Metrics
 */
@Loggable
public final class AnalyzedSeries {

    public Series getSeries() {
        return _series;
    }

    public AnalysisOptions getOptions() {
        return _options;
    }

    /**
     * The change points of each metric ordered by index.
     *
     * @return Metric name to change points.
     */
    public ImmutableMap<String, ImmutableList<ChangePoint>> getChangePoints() {
        return _changePoints;
    }

    /**
     * The change points of a metric ordered by index.
     *
     * @param metric The metric name.
     * @return The change points; empty for an unknown metric.
     */
    public ImmutableList<ChangePoint> getChangePoints(final String metric) {
        final ImmutableList<ChangePoint> changePoints = _changePoints.get(metric);
        return changePoints != null ? changePoints : ImmutableList.of();
    }

    /**
     * The change points of all metrics grouped by index, in ascending order.
     *
     * @return The groups.
     */
    public ImmutableList<ChangePointGroup> getChangePointsByTime() {
        return _changePointsByTime;
    }

    /**
     * The largest range around an index without change points of a metric.
     * The lower end is the nearest change point at or before the index, or
     * zero; the upper end is the nearest change point after the index, or
     * the length of the series.
     *
     * @param metric The metric name.
     * @param index The index.
     * @return The closed-open range of stable points.
     */
    public Range<Integer> getStableRange(final String metric, final int index) {
        int begin = 0;
        int end = length();
        for (final ChangePoint changePoint : getChangePoints(metric)) {
            if (changePoint.getIndex() <= index) {
                begin = changePoint.getIndex();
            } else {
                end = changePoint.getIndex();
                break;
            }
        }
        return Range.closedOpen(begin, end);
    }

    public String getTestName() {
        return _series.getTestName();
    }

    public Optional<String> getBranch() {
        return _series.getBranch();
    }

    public int length() {
        return _series.length();
    }

    public ImmutableLongArray getTime() {
        return _series.getTime();
    }

    /**
     * The original values of a metric, gaps included.
     *
     * @param metric The metric name.
     * @return The values.
     */
    public MetricData getData(final String metric) {
        final MetricData data = _series.getData().get(metric);
        if (data == null) {
            throw new IllegalArgumentException(String.format("Unknown metric; metric=%s", metric));
        }
        return data;
    }

    public ImmutableSet<String> getAttributeNames() {
        return _series.getAttributes().keySet();
    }

    public ImmutableMap<String, String> attributesAt(final int index) {
        return _series.attributesAt(index);
    }

    /**
     * The names of the metrics with data. This includes metrics without a
     * {@link Metric} description, which are analyzed as higher-is-better.
     *
     * @return The metric names.
     */
    public ImmutableSet<String> getMetricNames() {
        return _series.getData().keySet();
    }

    public Metric getMetric(final String name) {
        return _series.getMetric(name);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Series", _series)
                .add("Options", _options)
                .add("ChangePointsByTime", _changePointsByTime)
                .toString();
    }

    private AnalyzedSeries(final Builder builder) {
        _series = builder._series;
        _options = builder._options;
        _changePoints = builder._changePoints;
        _changePointsByTime = builder._changePointsByTime;
    }

    private final Series _series;
    private final AnalysisOptions _options;
    private final ImmutableMap<String, ImmutableList<ChangePoint>> _changePoints;
    private final ImmutableList<ChangePointGroup> _changePointsByTime;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link AnalyzedSeries}.
     */
    public static final class Builder extends OvalBuilder<AnalyzedSeries> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(AnalyzedSeries::new);
        }

        /**
         * Set the series. Required. Cannot be null.
         *
         * @param value The series.
         * @return This {@link Builder} instance.
         */
        public Builder setSeries(final Series value) {
            _series = value;
            return this;
        }

        /**
         * Set the options used for the analysis. Required. Cannot be null.
         *
         * @param value The options.
         * @return This {@link Builder} instance.
         */
        public Builder setOptions(final AnalysisOptions value) {
            _options = value;
            return this;
        }

        /**
         * Set the change points by metric. Required. Cannot be null.
         *
         * @param value The change points.
         * @return This {@link Builder} instance.
         */
        public Builder setChangePoints(final ImmutableMap<String, ImmutableList<ChangePoint>> value) {
            _changePoints = value;
            return this;
        }

        /**
         * Set the change point groups. Required. Cannot be null.
         *
         * @param value The change point groups.
         * @return This {@link Builder} instance.
         */
        public Builder setChangePointsByTime(final ImmutableList<ChangePointGroup> value) {
            _changePointsByTime = value;
            return this;
        }

        @NotNull
        private Series _series;
        @NotNull
        private AnalysisOptions _options;
        @NotNull
        private ImmutableMap<String, ImmutableList<ChangePoint>> _changePoints;
        @NotNull
        private ImmutableList<ChangePointGroup> _changePointsByTime;
    }
}
