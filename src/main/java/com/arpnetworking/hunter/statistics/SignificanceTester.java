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

import java.util.Arrays;
import java.util.Set;

/**
 * Decides whether two adjacent sample sets differ meaningfully. Use
 * {@link SignificanceTesterFactory} to look up an implementation.
 *
 * @author Inscope Metrics
 */
public interface SignificanceTester {

    /**
     * Accessor for the name of the tester.
     *
     * @return The name of the tester.
     */
    String getName();

    /**
     * Accessor for any aliases of the tester.
     *
     * @return The aliases of the tester.
     */
    Set<String> getAliases();

    /**
     * Compare two non-overlapping sample sets. Neither array is modified.
     *
     * @param left The samples before the split.
     * @param right The samples after the split.
     * @return The {@link ComparativeStats} of the two sample sets.
     * @throws InsufficientDataException if either sample set is empty.
     */
    ComparativeStats compare(double[] left, double[] right);

    /**
     * Compare the samples {@code [begin, split)} with {@code [split, end)}.
     *
     * @param values The samples.
     * @param begin The first index of the left samples.
     * @param split The first index of the right samples.
     * @param end One past the last index of the right samples.
     * @return The {@link ComparativeStats} of the two ranges.
     * @throws InsufficientDataException if either range is empty.
     */
    default ComparativeStats compare(final double[] values, final int begin, final int split, final int end) {
        return compare(
                Arrays.copyOfRange(values, begin, split),
                Arrays.copyOfRange(values, split, end));
    }

    /**
     * Whether a p-value is significant at a threshold.
     *
     * @param pvalue The p-value.
     * @param threshold The maximum p-value considered significant.
     * @return True if and only if {@code pvalue <= threshold}.
     */
    static boolean isSignificant(final double pvalue, final double threshold) {
        return pvalue <= threshold;
    }
}
