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
import com.arpnetworking.hunter.statistics.ComparativeStats;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import net.sf.oval.constraint.NotNull;

/**
 * The result of comparing a point of one analyzed series with a point of
 * another, metric by metric.
 *
 * @author Inscope Metrics
 */
@Loggable
public final class SeriesComparison {

    public AnalyzedSeries getSeries1() {
        return _series1;
    }

    public AnalyzedSeries getSeries2() {
        return _series2;
    }

    public int getIndex1() {
        return _index1;
    }

    public int getIndex2() {
        return _index2;
    }

    /**
     * The statistics of each metric present in both series.
     *
     * @return Metric name to statistics.
     */
    public ImmutableMap<String, ComparativeStats> getStats() {
        return _stats;
    }

    /**
     * Whether the second series performs significantly worse than the first
     * on a metric, taking the direction of the metric into account.
     *
     * @param metric The metric name.
     * @return True if and only if the metric regressed.
     */
    public boolean isRegression(final String metric) {
        final ComparativeStats stats = _stats.get(metric);
        if (stats == null) {
            return false;
        }
        final int direction = _series1.getMetric(metric).getDirection();
        return stats.getMean2() * direction < stats.getMean1() * direction
                && stats.getPValue() < _series1.getOptions().getMaxPValue();
    }

    /**
     * The statistics of the metrics that regressed.
     *
     * @return Metric name to statistics.
     */
    public ImmutableMap<String, ComparativeStats> getRegressions() {
        return ImmutableMap.copyOf(Maps.filterKeys(_stats, this::isRegression));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Test1", _series1.getTestName())
                .add("Index1", _index1)
                .add("Test2", _series2.getTestName())
                .add("Index2", _index2)
                .add("Stats", _stats)
                .toString();
    }

    private SeriesComparison(final Builder builder) {
        _series1 = builder._series1;
        _series2 = builder._series2;
        _index1 = builder._index1;
        _index2 = builder._index2;
        _stats = builder._stats;
    }

    private final AnalyzedSeries _series1;
    private final AnalyzedSeries _series2;
    private final int _index1;
    private final int _index2;
    private final ImmutableMap<String, ComparativeStats> _stats;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link SeriesComparison}.
     */
    public static final class Builder extends OvalBuilder<SeriesComparison> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(SeriesComparison::new);
        }

        /**
         * Set the baseline series. Required. Cannot be null.
         *
         * @param value The series.
         * @return This {@link Builder} instance.
         */
        public Builder setSeries1(final AnalyzedSeries value) {
            _series1 = value;
            return this;
        }

        /**
         * Set the target series. Required. Cannot be null.
         *
         * @param value The series.
         * @return This {@link Builder} instance.
         */
        public Builder setSeries2(final AnalyzedSeries value) {
            _series2 = value;
            return this;
        }

        /**
         * Set the index into the baseline series. Required. Cannot be null.
         *
         * @param value The index.
         * @return This {@link Builder} instance.
         */
        public Builder setIndex1(final Integer value) {
            _index1 = value;
            return this;
        }

        /**
         * Set the index into the target series. Required. Cannot be null.
         *
         * @param value The index.
         * @return This {@link Builder} instance.
         */
        public Builder setIndex2(final Integer value) {
            _index2 = value;
            return this;
        }

        /**
         * Set the statistics by metric. Required. Cannot be null.
         *
         * @param value The statistics.
         * @return This {@link Builder} instance.
         */
        public Builder setStats(final ImmutableMap<String, ComparativeStats> value) {
            _stats = value;
            return this;
        }

        @NotNull
        private AnalyzedSeries _series1;
        @NotNull
        private AnalyzedSeries _series2;
        @NotNull
        private Integer _index1;
        @NotNull
        private Integer _index2;
        @NotNull
        private ImmutableMap<String, ComparativeStats> _stats;
    }
}
