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
package com.arpnetworking.hunter.analysis;

/**
 * The energy distance statistic ("qhat") measuring how dissimilar the two
 * sides of a split are. For a split into {@code m} left and {@code n} right
 * points it is
 * <pre>
 *   m·n/(m+n) · ( 2/(m·n) · Σ|x-y| - 1/m² · Σ|x-x'| - 1/n² · Σ|y-y'| )
 * </pre>
 * where the first sum is over left-right pairs and the other two over
 * ordered pairs within each side.
 *
 * @author Inscope Metrics
 */
final class EnergyStatistic {

    /**
     * Find the split of {@code [begin, end)} maximizing qhat. Every split
     * leaves at least {@link #MIN_SEGMENT_LENGTH} points on each side. Runs
     * in time quadratic in the length of the segment.
     *
     * @param values The values.
     * @param begin The first index of the segment.
     * @param end One past the last index of the segment.
     * @return The index of the first point right of the best split, or
     * {@link #NO_SPLIT} if the segment is too short.
     */
    static int findBestSplit(final double[] values, final int begin, final int end) {
        if (end - begin < 2 * MIN_SEGMENT_LENGTH) {
            return NO_SPLIT;
        }

        // Start with every point on the right and move them left one at a time
        double withinLeft = 0.0;
        double withinRight = 0.0;
        double across = 0.0;
        for (int i = begin; i < end; ++i) {
            for (int j = i + 1; j < end; ++j) {
                withinRight += 2.0 * Math.abs(values[i] - values[j]);
            }
        }

        int bestSplit = NO_SPLIT;
        double bestQHat = Double.NEGATIVE_INFINITY;
        for (int split = begin + 1; split <= end - MIN_SEGMENT_LENGTH; ++split) {
            final int moved = split - 1;
            double toLeft = 0.0;
            for (int i = begin; i < moved; ++i) {
                toLeft += Math.abs(values[moved] - values[i]);
            }
            double toRight = 0.0;
            for (int j = split; j < end; ++j) {
                toRight += Math.abs(values[moved] - values[j]);
            }
            withinLeft += 2.0 * toLeft;
            withinRight -= 2.0 * toRight;
            across += toRight - toLeft;

            final int m = split - begin;
            final int n = end - split;
            if (m >= MIN_SEGMENT_LENGTH) {
                final double qhat = qhat(m, n, across, withinLeft, withinRight);
                if (qhat > bestQHat) {
                    bestQHat = qhat;
                    bestSplit = split;
                }
            }
        }
        return bestSplit;
    }

    static double qhat(
            final int m,
            final int n,
            final double across,
            final double withinLeft,
            final double withinRight) {
        final double mm = m;
        final double nn = n;
        return mm * nn / (mm + nn)
                * (2.0 * across / (mm * nn) - withinLeft / (mm * mm) - withinRight / (nn * nn));
    }

    static final int MIN_SEGMENT_LENGTH = 2;
    static final int NO_SPLIT = -1;

    private EnergyStatistic() {}
}
