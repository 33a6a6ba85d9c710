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
import com.google.common.base.Objects;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

/**
 * A change point of a single metric.
 *
 * @author Inscope Metrics
 */
@Loggable
public final class ChangePoint {

    public String getMetric() {
        return _metric;
    }

    /**
     * The index of the first point after the change.
     *
     * @return The index.
     */
    public int getIndex() {
        return _index;
    }

    /**
     * The time of the first point after the change in epoch seconds.
     *
     * @return The time.
     */
    public long getTime() {
        return _time;
    }

    public ComparativeStats getStats() {
        return _stats;
    }

    public double forwardChangePercent() {
        return _stats.forwardRelChange() * 100.0;
    }

    public double backwardChangePercent() {
        return _stats.backwardRelChange() * 100.0;
    }

    public double magnitude() {
        return _stats.magnitude();
    }

    /**
     * Create a copy of this change point with different statistics.
     *
     * @param stats The new statistics.
     * @return New {@link ChangePoint}.
     */
    public ChangePoint withStats(final ComparativeStats stats) {
        return new Builder()
                .setMetric(_metric)
                .setIndex(_index)
                .setTime(_time)
                .setStats(stats)
                .build();
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final ChangePoint other = (ChangePoint) object;

        return _index == other._index
                && _time == other._time
                && Objects.equal(_metric, other._metric)
                && Objects.equal(_stats, other._stats);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_metric, _index, _time, _stats);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Metric", _metric)
                .add("Index", _index)
                .add("Time", _time)
                .add("Stats", _stats)
                .toString();
    }

    private ChangePoint(final Builder builder) {
        _metric = builder._metric;
        _index = builder._index;
        _time = builder._time;
        _stats = builder._stats;
    }

    private final String _metric;
    private final int _index;
    private final long _time;
    private final ComparativeStats _stats;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link ChangePoint}.
     */
    public static final class Builder extends OvalBuilder<ChangePoint> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(ChangePoint::new);
        }

        /**
         * Set the metric name. Required. Cannot be null or empty.
         *
         * @param value The metric name.
         * @return This {@link Builder} instance.
         */
        public Builder setMetric(final String value) {
            _metric = value;
            return this;
        }

        /**
         * Set the index. Required. Cannot be negative.
         *
         * @param value The index.
         * @return This {@link Builder} instance.
         */
        public Builder setIndex(final Integer value) {
            _index = value;
            return this;
        }

        /**
         * Set the time. Required. Cannot be null.
         *
         * @param value The time in epoch seconds.
         * @return This {@link Builder} instance.
         */
        public Builder setTime(final Long value) {
            _time = value;
            return this;
        }

        /**
         * Set the statistics. Required. Cannot be null.
         *
         * @param value The statistics.
         * @return This {@link Builder} instance.
         */
        public Builder setStats(final ComparativeStats value) {
            _stats = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _metric;
        @NotNull
        @Min(0)
        private Integer _index;
        @NotNull
        private Long _time;
        @NotNull
        private ComparativeStats _stats;
    }
}
