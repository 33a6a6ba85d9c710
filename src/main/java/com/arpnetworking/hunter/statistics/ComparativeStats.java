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
package com.arpnetworking.hunter.statistics;

import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * Summary of two adjacent sample sets: the mean and population standard
 * deviation of each side and the p-value of the hypothesis that both sides
 * come from the same distribution.
 *
 * @author Inscope Metrics
 */
@Loggable
public final class ComparativeStats {

    /**
     * Public constructor.
     *
     * @param mean1 The mean of the left samples.
     * @param mean2 The mean of the right samples.
     * @param std1 The standard deviation of the left samples.
     * @param std2 The standard deviation of the right samples.
     * @param pvalue The p-value of the comparison.
     */
    public ComparativeStats(
            final double mean1,
            final double mean2,
            final double std1,
            final double std2,
            final double pvalue) {
        _mean1 = mean1;
        _mean2 = mean2;
        _std1 = std1;
        _std2 = std2;
        _pvalue = pvalue;
    }

    public double getMean1() {
        return _mean1;
    }

    public double getMean2() {
        return _mean2;
    }

    public double getStd1() {
        return _std1;
    }

    public double getStd2() {
        return _std2;
    }

    public double getPValue() {
        return _pvalue;
    }

    /**
     * Relative change of the mean going from the left to the right samples.
     *
     * @return {@code mean2 / mean1 - 1}
     */
    public double forwardRelChange() {
        return _mean2 / _mean1 - 1.0;
    }

    /**
     * Relative change of the mean going from the right to the left samples.
     *
     * @return {@code mean1 / mean2 - 1}
     */
    public double backwardRelChange() {
        return _mean1 / _mean2 - 1.0;
    }

    /**
     * The size of the change regardless of its direction. Taking the larger
     * of the forward and backward changes makes a halving as large as a
     * doubling.
     *
     * @return The magnitude of the change.
     */
    public double magnitude() {
        return Math.max(Math.abs(forwardRelChange()), Math.abs(backwardRelChange()));
    }

    /**
     * Whether the p-value is at or below a threshold.
     *
     * @param threshold The maximum p-value considered significant.
     * @return True if and only if the difference is significant.
     */
    public boolean isSignificant(final double threshold) {
        return SignificanceTester.isSignificant(_pvalue, threshold);
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final ComparativeStats other = (ComparativeStats) object;

        return Double.compare(_mean1, other._mean1) == 0
                && Double.compare(_mean2, other._mean2) == 0
                && Double.compare(_std1, other._std1) == 0
                && Double.compare(_std2, other._std2) == 0
                && Double.compare(_pvalue, other._pvalue) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_mean1, _mean2, _std1, _std2, _pvalue);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Mean1", _mean1)
                .add("Mean2", _mean2)
                .add("Std1", _std1)
                .add("Std2", _std2)
                .add("PValue", _pvalue)
                .toString();
    }

    private final double _mean1;
    private final double _mean2;
    private final double _std1;
    private final double _std2;
    private final double _pvalue;
}
