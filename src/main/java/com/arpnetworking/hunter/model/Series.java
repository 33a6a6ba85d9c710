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
import com.arpnetworking.hunter.analysis.SeriesAnalyzer;
import com.arpnetworking.hunter.configuration.AnalysisOptions;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.ImmutableLongArray;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.Executor;
import javax.annotation.Nullable;

/**
 * The values of the metrics of all runs of a performance test, indexed by a
 * single time axis. Every data and attribute sequence has one entry per
 * point in time and the time axis is strictly increasing. Instances are
 * produced by importers and are immutable.
 *
 * @author Inscope Metrics
 */
@Loggable
public final class Series {

    public String getTestName() {
        return _testName;
    }

    public Optional<String> getBranch() {
        return _branch;
    }

    /**
     * The time of each point in epoch seconds.
     *
     * @return The time axis.
     */
    public ImmutableLongArray getTime() {
        return _time;
    }

    public ImmutableMap<String, Metric> getMetrics() {
        return _metrics;
    }

    public ImmutableMap<String, MetricData> getData() {
        return _data;
    }

    public ImmutableMap<String, ImmutableList<String>> getAttributes() {
        return _attributes;
    }

    public int length() {
        return _time.length();
    }

    /**
     * The description of a metric. Metrics with data but no description are
     * treated as higher-is-better.
     *
     * @param name The metric name.
     * @return The {@link Metric}.
     */
    public Metric getMetric(final String name) {
        final Metric metric = _metrics.get(name);
        return metric != null ? metric : DEFAULT_METRIC;
    }

    /**
     * The value of every attribute at a point.
     *
     * @param index The point.
     * @return Attribute name to value.
     */
    public ImmutableMap<String, String> attributesAt(final int index) {
        final ImmutableMap.Builder<String, String> result = ImmutableMap.builder();
        for (final Map.Entry<String, ImmutableList<String>> entry : _attributes.entrySet()) {
            result.put(entry.getKey(), entry.getValue().get(index));
        }
        return result.build();
    }

    /**
     * The first point at or after an instant.
     *
     * @param instant The instant.
     * @return The index of the point or empty if every point is earlier.
     */
    public OptionalInt findFirstNotEarlierThan(final Instant instant) {
        final long timestamp = instant.getEpochSecond() + (instant.getNano() > 0 ? 1 : 0);
        for (int i = 0; i < _time.length(); ++i) {
            if (_time.get(i) >= timestamp) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * The points where an attribute has a value.
     *
     * @param name The attribute name.
     * @param value The attribute value.
     * @return The indexes of the matching points in ascending order.
     */
    public ImmutableList<Integer> findByAttribute(final String name, final String value) {
        final ImmutableList<String> values = _attributes.get(name);
        if (values == null) {
            return ImmutableList.of();
        }
        final ImmutableList.Builder<Integer> result = ImmutableList.builder();
        for (int i = 0; i < values.size(); ++i) {
            if (value.equals(values.get(i))) {
                result.add(i);
            }
        }
        return result.build();
    }

    /**
     * Compute the change points of every metric with the default options.
     *
     * @return The {@link AnalyzedSeries}.
     */
    public AnalyzedSeries analyze() {
        return analyze(new AnalysisOptions.Builder().build());
    }

    /**
     * Compute the change points of every metric.
     *
     * @param options The analysis options.
     * @return The {@link AnalyzedSeries}.
     */
    public AnalyzedSeries analyze(final AnalysisOptions options) {
        return new SeriesAnalyzer(options).analyze(this);
    }

    /**
     * Compute the change points of every metric, analyzing the metrics
     * concurrently on an executor.
     *
     * @param options The analysis options.
     * @param executor The executor running the per-metric analysis.
     * @return The {@link AnalyzedSeries}.
     */
    public AnalyzedSeries analyze(final AnalysisOptions options, final Executor executor) {
        return new SeriesAnalyzer(options).analyze(this, executor);
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final Series other = (Series) object;

        return Objects.equal(_testName, other._testName)
                && Objects.equal(_branch, other._branch)
                && Objects.equal(_time, other._time)
                && Objects.equal(_metrics, other._metrics)
                && Objects.equal(_data, other._data)
                && Objects.equal(_attributes, other._attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_testName, _branch, _time, _metrics, _data, _attributes);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("TestName", _testName)
                .add("Branch", _branch)
                .add("Length", _time.length())
                .add("Metrics", _metrics)
                .add("Attributes", _attributes.keySet())
                .toString();
    }

    private Series(final Builder builder) {
        _testName = builder._testName;
        _branch = Optional.ofNullable(builder._branch);
        _time = builder._time;
        _metrics = builder._metrics;
        _data = builder._data;
        _attributes = builder._attributes;
    }

    private final String _testName;
    private final Optional<String> _branch;
    private final ImmutableLongArray _time;
    private final ImmutableMap<String, Metric> _metrics;
    private final ImmutableMap<String, MetricData> _data;
    private final ImmutableMap<String, ImmutableList<String>> _attributes;

    private static final Metric DEFAULT_METRIC = new Metric.Builder().build();

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link Series}.
     */
    public static final class Builder extends OvalBuilder<Series> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(Series::new);
        }

        /**
         * Set the test name. Required. Cannot be null or empty.
         *
         * @param value The test name.
         * @return This {@link Builder} instance.
         */
        public Builder setTestName(final String value) {
            _testName = value;
            return this;
        }

        /**
         * Set the branch. Optional. Can be null.
         *
         * @param value The branch.
         * @return This {@link Builder} instance.
         */
        public Builder setBranch(@Nullable final String value) {
            _branch = value;
            return this;
        }

        /**
         * Set the time axis in epoch seconds. Required. Cannot be null. Must
         * be strictly increasing.
         *
         * @param value The time axis.
         * @return This {@link Builder} instance.
         */
        public Builder setTime(final ImmutableLongArray value) {
            _time = value;
            return this;
        }

        /**
         * Set the metric descriptions. Optional. Cannot be null. Defaults to
         * an empty {@link ImmutableMap}.
         *
         * @param value The metric descriptions.
         * @return This {@link Builder} instance.
         */
        public Builder setMetrics(final ImmutableMap<String, Metric> value) {
            _metrics = value;
            return this;
        }

        /**
         * Set the metric values. Optional. Cannot be null. Every sequence
         * must be as long as the time axis. Defaults to an empty
         * {@link ImmutableMap}.
         *
         * @param value The metric values.
         * @return This {@link Builder} instance.
         */
        public Builder setData(final ImmutableMap<String, MetricData> value) {
            _data = value;
            return this;
        }

        /**
         * Set the attributes. Optional. Cannot be null. Every sequence must
         * be as long as the time axis. Defaults to an empty
         * {@link ImmutableMap}.
         *
         * @param value The attributes.
         * @return This {@link Builder} instance.
         */
        public Builder setAttributes(final ImmutableMap<String, ImmutableList<String>> value) {
            _attributes = value;
            return this;
        }

        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        private boolean validateTime(final ImmutableLongArray time) {
            for (int i = 1; i < time.length(); ++i) {
                if (time.get(i) <= time.get(i - 1)) {
                    return false;
                }
            }
            return true;
        }

        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        private boolean validateData(final ImmutableMap<String, MetricData> data) {
            if (_time == null) {
                return true;
            }
            return data.values().stream().allMatch(values -> values.size() == _time.length());
        }

        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        private boolean validateAttributes(final ImmutableMap<String, ImmutableList<String>> attributes) {
            if (_time == null) {
                return true;
            }
            return attributes.values().stream().allMatch(values -> values.size() == _time.length());
        }

        @NotNull
        @NotEmpty
        private String _testName;
        @Nullable
        private String _branch;
        @NotNull
        @ValidateWithMethod(methodName = "validateTime", parameterType = ImmutableLongArray.class)
        private ImmutableLongArray _time;
        @NotNull
        private ImmutableMap<String, Metric> _metrics = ImmutableMap.of();
        @NotNull
        @ValidateWithMethod(methodName = "validateData", parameterType = ImmutableMap.class)
        private ImmutableMap<String, MetricData> _data = ImmutableMap.of();
        @NotNull
        @ValidateWithMethod(methodName = "validateAttributes", parameterType = ImmutableMap.class)
        private ImmutableMap<String, ImmutableList<String>> _attributes = ImmutableMap.of();
    }
}
