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
import org.apache.commons.math3.stat.inference.MannWhitneyUTest;

import java.util.Set;

/**
 * Two-sided Mann-Whitney U test. Does not assume normally distributed data
 * but relies on the normal approximation of the U statistic, so it should
 * only be used with at least 30 points per side. Use
 * {@link SignificanceTesterFactory} for construction.
 *
 * @author Inscope Metrics
 */
public final class MannWhitneySignificanceTester extends BaseSignificanceTester {

    @Override
    public String getName() {
        return "mannwhitney";
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
        return new MannWhitneyUTest().mannWhitneyUTest(left, right);
    }

    MannWhitneySignificanceTester() { }

    private static final ImmutableSet<String> ALIASES = ImmutableSet.of("mann-whitney", "u");
}
