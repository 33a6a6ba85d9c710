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

import com.google.common.base.MoreObjects;

import java.util.Collections;
import java.util.Set;

/**
 * Base class for testers. Computes the means and population standard
 * deviations of both sides and leaves the p-value to the subclass.
 *
 * @author Inscope Metrics
 */
public abstract class BaseSignificanceTester implements SignificanceTester {

    @Override
    public Set<String> getAliases() {
        return Collections.emptySet();
    }

    @Override
    public final ComparativeStats compare(final double[] left, final double[] right) {
        if (left.length == 0 || right.length == 0) {
            throw new InsufficientDataException(left.length, right.length);
        }
        final double mean1 = mean(left);
        final double mean2 = mean(right);
        final double std1 = standardDeviation(left, mean1);
        final double std2 = standardDeviation(right, mean2);
        final double pvalue;
        if (left.length + right.length <= 2) {
            pvalue = 1.0;
        } else {
            pvalue = computePValue(left, right, mean1, std1, mean2, std2);
        }
        return new ComparativeStats(mean1, mean2, std1, std2, pvalue);
    }

    @Override
    public boolean equals(final Object other) {
        return other != null && getClass().equals(other.getClass());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Name", getName())
                .add("Aliases", getAliases())
                .toString();
    }

    /**
     * Compute the two-sided p-value. Only invoked with non-empty sides and
     * at least three samples in total.
     *
     * @param left The left samples.
     * @param right The right samples.
     * @param mean1 The mean of the left samples.
     * @param std1 The population standard deviation of the left samples.
     * @param mean2 The mean of the right samples.
     * @param std2 The population standard deviation of the right samples.
     * @return The p-value in {@code [0, 1]}.
     */
    protected abstract double computePValue(
            double[] left,
            double[] right,
            double mean1,
            double std1,
            double mean2,
            double std2);

    static double mean(final double[] values) {
        double sum = 0.0;
        for (final double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    static double standardDeviation(final double[] values, final double mean) {
        if (values.length < 2) {
            return 0.0;
        }
        double sumOfSquares = 0.0;
        for (final double value : values) {
            final double delta = value - mean;
            sumOfSquares += delta * delta;
        }
        return Math.sqrt(sumOfSquares / values.length);
    }
}
