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
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

/**
 * Describes how to interpret the values of a metric.
 *
 * @author Inscope Metrics
 */
@Loggable
public final class Metric {

    /**
     * {@code 1} if higher values are better and {@code -1} if lower values
     * are better.
     *
     * @return The direction of improvement.
     */
    public int getDirection() {
        return _direction;
    }

    public double getScale() {
        return _scale;
    }

    public String getUnit() {
        return _unit;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final Metric other = (Metric) object;

        return _direction == other._direction
                && Double.compare(_scale, other._scale) == 0
                && Objects.equal(_unit, other._unit);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_direction, _scale, _unit);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Direction", _direction)
                .add("Scale", _scale)
                .add("Unit", _unit)
                .toString();
    }

    private Metric(final Builder builder) {
        _direction = builder._direction;
        _scale = builder._scale;
        _unit = builder._unit;
    }

    private final int _direction;
    private final double _scale;
    private final String _unit;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link Metric}.
     */
    public static final class Builder extends OvalBuilder<Metric> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(Metric::new);
        }

        /**
         * Set the direction. Optional. Must be {@code 1} or {@code -1}.
         * Defaults to {@code 1}.
         *
         * @param value The direction.
         * @return This {@link Builder} instance.
         */
        public Builder setDirection(final Integer value) {
            _direction = value;
            return this;
        }

        /**
         * Set the scale. Optional. Cannot be null. Defaults to {@code 1.0}.
         *
         * @param value The scale.
         * @return This {@link Builder} instance.
         */
        public Builder setScale(final Double value) {
            _scale = value;
            return this;
        }

        /**
         * Set the unit. Optional. Cannot be null. Defaults to the empty string.
         *
         * @param value The unit.
         * @return This {@link Builder} instance.
         */
        public Builder setUnit(final String value) {
            _unit = value;
            return this;
        }

        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        private boolean validateDirection(final Integer direction) {
            return direction == 1 || direction == -1;
        }

        @NotNull
        @ValidateWithMethod(methodName = "validateDirection", parameterType = Integer.class)
        private Integer _direction = 1;
        @NotNull
        private Double _scale = 1.0;
        @NotNull
        private String _unit = "";
    }
}
