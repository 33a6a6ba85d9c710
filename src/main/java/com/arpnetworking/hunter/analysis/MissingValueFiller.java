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

import com.arpnetworking.hunter.model.MetricData;

import java.util.BitSet;

/**
 * Repairs gaps in metric values.
 *
 * @author Inscope Metrics
 */
public final class MissingValueFiller {

    /**
     * Fill every gap with the nearest preceding value. Gaps before the first
     * value are filled with the first value. Data consisting only of gaps is
     * returned as is. The input is not modified.
     *
     * @param data The values with gaps.
     * @return The values without gaps, unless all are gaps.
     */
    public static MetricData fill(final MetricData data) {
        if (!data.hasGaps() || data.getPresentCount() == 0) {
            return data;
        }
        final double[] values = data.copyValues();
        final BitSet present = data.copyPresence();

        final int first = present.nextSetBit(0);
        for (int i = first + 1; i < values.length; ++i) {
            if (!present.get(i)) {
                values[i] = values[i - 1];
            }
        }
        for (int i = 0; i < first; ++i) {
            values[i] = values[first];
        }
        present.set(0, values.length);
        return MetricData.of(values, present);
    }

    private MissingValueFiller() {}
}
