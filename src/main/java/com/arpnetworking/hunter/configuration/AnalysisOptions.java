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
package com.arpnetworking.hunter.configuration;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.arpnetworking.hunter.statistics.SignificanceTester;
import com.arpnetworking.hunter.statistics.SignificanceTesterFactory;
import com.arpnetworking.logback.annotations.Loggable;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.Range;
import net.sf.oval.constraint.ValidateWithMethod;

/**
 * Options controlling change point detection. Instances are immutable and
 * passed by value into every analysis.
 *
 * @author Inscope Metrics
 */
@Loggable
@JsonDeserialize(builder = AnalysisOptions.Builder.class)
public final class AnalysisOptions {
    /**
     * Create an {@link ObjectMapper} for analysis options.
     *
     * @return An {@link ObjectMapper} for analysis options.
     */
    public static ObjectMapper createObjectMapper() {
        return ObjectMapperFactory.getInstance();
    }

    /**
     * The number of points in each window searched for change points.
     *
     * @return The window length.
     */
    public int getWindowLen() {
        return _windowLen;
    }

    /**
     * The largest p-value of a change point that is reported.
     *
     * @return The maximum p-value.
     */
    public double getMaxPValue() {
        return _maxPValue;
    }

    /**
     * The smallest relative change of a change point that is reported.
     *
     * @return The minimum magnitude.
     */
    public double getMinMagnitude() {
        return _minMagnitude;
    }

    public String getSignificanceTester() {
        return _significanceTester;
    }

    /**
     * Whether to search overlapping windows and prune the candidates, as
     * opposed to a single divisive search over the whole series.
     *
     * @return True for the windowed search.
     */
    public boolean isWindowed() {
        return _windowed;
    }

    /**
     * Resolve the configured significance tester.
     *
     * @return The {@link SignificanceTester}.
     */
    public SignificanceTester createSignificanceTester() {
        return SIGNIFICANCE_TESTER_FACTORY.getTester(_significanceTester);
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final AnalysisOptions other = (AnalysisOptions) object;

        return _windowLen == other._windowLen
                && Double.compare(_maxPValue, other._maxPValue) == 0
                && Double.compare(_minMagnitude, other._minMagnitude) == 0
                && _windowed == other._windowed
                && Objects.equal(_significanceTester, other._significanceTester);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_windowLen, _maxPValue, _minMagnitude, _significanceTester, _windowed);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("WindowLen", _windowLen)
                .add("MaxPValue", _maxPValue)
                .add("MinMagnitude", _minMagnitude)
                .add("SignificanceTester", _significanceTester)
                .add("Windowed", _windowed)
                .toString();
    }

    private AnalysisOptions(final Builder builder) {
        _windowLen = builder._windowLen;
        _maxPValue = builder._maxPValue;
        _minMagnitude = builder._minMagnitude;
        _significanceTester = builder._significanceTester;
        _windowed = builder._windowed;
    }

    private final int _windowLen;
    private final double _maxPValue;
    private final double _minMagnitude;
    private final String _significanceTester;
    private final boolean _windowed;

    private static final SignificanceTesterFactory SIGNIFICANCE_TESTER_FACTORY = new SignificanceTesterFactory();

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link AnalysisOptions}.
     */
    @JsonPOJOBuilder(withPrefix = "set")
    public static final class Builder extends OvalBuilder<AnalysisOptions> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(AnalysisOptions::new);
        }

        /**
         * The number of points in each window. Optional. Must be between 2
         * and 5000 (inclusive); the upper bound caps the quadratic cost of
         * searching a window. Defaults to 50.
         *
         * @param value The window length.
         * @return This instance of {@link Builder}.
         */
        public Builder setWindowLen(final Integer value) {
            _windowLen = value;
            return this;
        }

        /**
         * The largest p-value of a reported change point. Optional. Must be
         * between 0 and 1 (inclusive). Defaults to 0.001.
         *
         * @param value The maximum p-value.
         * @return This instance of {@link Builder}.
         */
        public Builder setMaxPValue(final Double value) {
            _maxPValue = value;
            return this;
        }

        /**
         * The smallest magnitude of a reported change point. Optional.
         * Cannot be negative. Defaults to 0.0.
         *
         * @param value The minimum magnitude.
         * @return This instance of {@link Builder}.
         */
        public Builder setMinMagnitude(final Double value) {
            _minMagnitude = value;
            return this;
        }

        /**
         * The name or alias of the significance tester. Optional. Must be
         * known to {@link SignificanceTesterFactory}. Defaults to
         * {@code ttest}.
         *
         * @param value The tester name.
         * @return This instance of {@link Builder}.
         */
        public Builder setSignificanceTester(final String value) {
            _significanceTester = value;
            return this;
        }

        /**
         * Whether to search overlapping windows. When false the whole series
         * is searched at once at the maximum p-value and no candidates are
         * pruned, which is slower and may miss changes in the middle of long
         * series. Optional. Defaults to true.
         *
         * @param value Whether to search windows.
         * @return This instance of {@link Builder}.
         */
        public Builder setWindowed(final Boolean value) {
            _windowed = value;
            return this;
        }

        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        private boolean validateSignificanceTester(final String significanceTester) {
            return SIGNIFICANCE_TESTER_FACTORY.tryGetTester(significanceTester).isPresent();
        }

        @NotNull
        @Range(min = 2, max = 5000)
        private Integer _windowLen = 50;
        @NotNull
        @Range(min = 0.0, max = 1.0)
        private Double _maxPValue = 0.001;
        @NotNull
        @Min(0.0)
        private Double _minMagnitude = 0.0;
        @NotNull
        @NotEmpty
        @ValidateWithMethod(methodName = "validateSignificanceTester", parameterType = String.class)
        private String _significanceTester = "ttest";
        @NotNull
        private Boolean _windowed = Boolean.TRUE;
    }
}
