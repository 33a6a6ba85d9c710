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

import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;
import javax.annotation.Nullable;

/**
 * An immutable sequence of metric values that may contain gaps. Values are
 * stored densely next to a bitmap marking which positions hold a value; the
 * value stored at a gap is meaningless and never exposed.
 *
 * @author Inscope Metrics
 */
@Loggable
public final class MetricData {

    /**
     * Create an instance from boxed values where {@code null} marks a gap.
     *
     * @param values The values.
     * @return New {@link MetricData}.
     */
    public static MetricData of(final Double... values) {
        return of(Arrays.asList(values));
    }

    /**
     * Create an instance from boxed values where {@code null} marks a gap.
     *
     * @param values The values.
     * @return New {@link MetricData}.
     */
    public static MetricData of(final List<Double> values) {
        final double[] dense = new double[values.size()];
        final BitSet present = new BitSet(values.size());
        for (int i = 0; i < dense.length; ++i) {
            @Nullable final Double value = values.get(i);
            if (value != null) {
                dense[i] = value;
                present.set(i);
            }
        }
        return new MetricData(dense, present);
    }

    /**
     * Create an instance without gaps.
     *
     * @param values The values.
     * @return New {@link MetricData}.
     */
    public static MetricData ofValues(final double... values) {
        final BitSet present = new BitSet(values.length);
        present.set(0, values.length);
        return new MetricData(values.clone(), present);
    }

    /**
     * Create an instance from values and a presence bitmap. Both are copied.
     *
     * @param values The values.
     * @param present The positions holding a value.
     * @return New {@link MetricData}.
     */
    public static MetricData of(final double[] values, final BitSet present) {
        Preconditions.checkArgument(
                present.length() <= values.length,
                "Presence bitmap longer than values; values=%s, bitmap=%s",
                values.length,
                present.length());
        return new MetricData(values.clone(), (BitSet) present.clone());
    }

    public int size() {
        return _values.length;
    }

    /**
     * Whether a position holds a value.
     *
     * @param index The position.
     * @return True if and only if the position is not a gap.
     */
    public boolean isPresent(final int index) {
        Preconditions.checkElementIndex(index, _values.length);
        return _present.get(index);
    }

    /**
     * The value at a position.
     *
     * @param index The position.
     * @return The value or empty for a gap.
     */
    public OptionalDouble get(final int index) {
        return isPresent(index) ? OptionalDouble.of(_values[index]) : OptionalDouble.empty();
    }

    public int getPresentCount() {
        return _present.cardinality();
    }

    public boolean hasGaps() {
        return _present.cardinality() < _values.length;
    }

    /**
     * The values in {@code [from, to)} skipping the gaps.
     *
     * @param from The first position, inclusive.
     * @param to The last position, exclusive.
     * @return The present values in order.
     */
    public double[] getPresentValues(final int from, final int to) {
        Preconditions.checkPositionIndexes(from, to, _values.length);
        final double[] result = new double[_present.get(from, to).cardinality()];
        int position = 0;
        for (int i = _present.nextSetBit(from); i >= 0 && i < to; i = _present.nextSetBit(i + 1)) {
            result[position++] = _values[i];
        }
        return result;
    }

    /**
     * A copy of the raw values; gaps hold arbitrary values.
     *
     * @return The raw values.
     */
    public double[] copyValues() {
        return _values.clone();
    }

    /**
     * A copy of the presence bitmap.
     *
     * @return The positions holding a value.
     */
    public BitSet copyPresence() {
        return (BitSet) _present.clone();
    }

    /**
     * The values as a dense array. Only valid without gaps.
     *
     * @return The values.
     * @throws IllegalStateException if there are gaps.
     */
    public double[] toArray() {
        Preconditions.checkState(!hasGaps(), "Cannot densify metric data with gaps");
        return _values.clone();
    }

    /**
     * The values as a list with {@code null} at each gap.
     *
     * @return The values.
     */
    public List<Double> toList() {
        final List<Double> result = new ArrayList<>(_values.length);
        for (int i = 0; i < _values.length; ++i) {
            result.add(_present.get(i) ? _values[i] : null);
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        return toList().equals(((MetricData) object).toList());
    }

    @Override
    public int hashCode() {
        return toList().hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Values", toList())
                .toString();
    }

    private MetricData(final double[] values, final BitSet present) {
        _values = values;
        _present = present;
    }

    private final double[] _values;
    private final BitSet _present;
}
