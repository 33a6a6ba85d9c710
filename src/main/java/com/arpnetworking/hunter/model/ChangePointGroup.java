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
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.Size;

import java.util.Optional;

/**
 * The change points of all metrics that share an index.
 *
 * @author Inscope Metrics
 */
@Loggable
public final class ChangePointGroup {

    public int getIndex() {
        return _index;
    }

    public long getTime() {
        return _time;
    }

    public long getPrevTime() {
        return _prevTime;
    }

    public ImmutableMap<String, String> getAttributes() {
        return _attributes;
    }

    public ImmutableMap<String, String> getPrevAttributes() {
        return _prevAttributes;
    }

    public ImmutableList<ChangePoint> getChanges() {
        return _changes;
    }

    /**
     * The change of a metric in this group.
     *
     * @param metric The metric name.
     * @return The {@link ChangePoint} of the metric, if it changed here.
     */
    public Optional<ChangePoint> getChange(final String metric) {
        return _changes.stream().filter(change -> change.getMetric().equals(metric)).findFirst();
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final ChangePointGroup other = (ChangePointGroup) object;

        return _index == other._index
                && _time == other._time
                && _prevTime == other._prevTime
                && Objects.equal(_attributes, other._attributes)
                && Objects.equal(_prevAttributes, other._prevAttributes)
                && Objects.equal(_changes, other._changes);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_index, _time, _prevTime, _attributes, _prevAttributes, _changes);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Index", _index)
                .add("Time", _time)
                .add("PrevTime", _prevTime)
                .add("Attributes", _attributes)
                .add("PrevAttributes", _prevAttributes)
                .add("Changes", _changes)
                .toString();
    }

    private ChangePointGroup(final Builder builder) {
        _index = builder._index;
        _time = builder._time;
        _prevTime = builder._prevTime;
        _attributes = builder._attributes;
        _prevAttributes = builder._prevAttributes;
        _changes = builder._changes;
    }

    private final int _index;
    private final long _time;
    private final long _prevTime;
    private final ImmutableMap<String, String> _attributes;
    private final ImmutableMap<String, String> _prevAttributes;
    private final ImmutableList<ChangePoint> _changes;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link ChangePointGroup}.
     */
    public static final class Builder extends OvalBuilder<ChangePointGroup> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(ChangePointGroup::new);
        }

        /**
         * Set the index. Required. Must be positive.
         *
         * @param value The index.
         * @return This {@link Builder} instance.
         */
        public Builder setIndex(final Integer value) {
            _index = value;
            return this;
        }

        /**
         * Set the time of the point at the index. Required. Cannot be null.
         *
         * @param value The time in epoch seconds.
         * @return This {@link Builder} instance.
         */
        public Builder setTime(final Long value) {
            _time = value;
            return this;
        }

        /**
         * Set the time of the point before the index. Required. Cannot be null.
         *
         * @param value The time in epoch seconds.
         * @return This {@link Builder} instance.
         */
        public Builder setPrevTime(final Long value) {
            _prevTime = value;
            return this;
        }

        /**
         * Set the attributes at the index. Optional. Cannot be null.
         * Defaults to an empty {@link ImmutableMap}.
         *
         * @param value The attributes.
         * @return This {@link Builder} instance.
         */
        public Builder setAttributes(final ImmutableMap<String, String> value) {
            _attributes = value;
            return this;
        }

        /**
         * Set the attributes before the index. Optional. Cannot be null.
         * Defaults to an empty {@link ImmutableMap}.
         *
         * @param value The attributes.
         * @return This {@link Builder} instance.
         */
        public Builder setPrevAttributes(final ImmutableMap<String, String> value) {
            _prevAttributes = value;
            return this;
        }

        /**
         * Set the changes. Required. Cannot be null or empty.
         *
         * @param value The changes.
         * @return This {@link Builder} instance.
         */
        public Builder setChanges(final ImmutableList<ChangePoint> value) {
            _changes = value;
            return this;
        }

        @NotNull
        @Min(1)
        private Integer _index;
        @NotNull
        private Long _time;
        @NotNull
        private Long _prevTime;
        @NotNull
        private ImmutableMap<String, String> _attributes = ImmutableMap.of();
        @NotNull
        private ImmutableMap<String, String> _prevAttributes = ImmutableMap.of();
        @NotNull
        @Size(min = 1)
        private ImmutableList<ChangePoint> _changes;
    }
}
