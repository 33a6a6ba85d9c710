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

import com.google.common.collect.ImmutableSet;
import org.apache.commons.math3.distribution.TDistribution;

import java.util.Set;

/**
 * Two-sided Student's t-test with pooled variance, computed from the means,
 * standard deviations and counts of both sides. Works well when the data
 * between change points is roughly normal, even with fewer than ten points.
 * Use {@link SignificanceTesterFactory} for construction.
 *
 * @author Inscope Metrics
 */
public final class TTestSignificanceTester extends BaseSignificanceTester {

    @Override
    public String getName() {
        return "ttest";
    }

    @Override
    public Set<String> getAliases() {
        return ALIASES;
    }

    @Override
    protected double computePValue(
            final double[] left,
            final double[] right,
            final double mean1,
            final double std1,
            final double mean2,
            final double std2) {
        final int n1 = left.length;
        final int n2 = right.length;
        final double degreesOfFreedom = n1 + n2 - 2;
        final double pooledVariance = ((n1 - 1) * std1 * std1 + (n2 - 1) * std2 * std2) / degreesOfFreedom;
        final double standardError = Math.sqrt(pooledVariance * (1.0 / n1 + 1.0 / n2));
        if (standardError == 0.0) {
            // Both sides are constant
            return Double.compare(mean1, mean2) == 0 ? 1.0 : 0.0;
        }
        final double t = Math.abs(mean1 - mean2) / standardError;
        final TDistribution distribution = new TDistribution(null, degreesOfFreedom);
        return Math.min(1.0, 2.0 * distribution.cumulativeProbability(-t));
    }

    TTestSignificanceTester() { }

    private static final ImmutableSet<String> ALIASES = ImmutableSet.of("t-test", "student");
}
