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

/**
 * Thrown when one side of a comparison has no samples.
 *
 * @author Inscope Metrics
 */
public final class InsufficientDataException extends RuntimeException {

    /**
     * Public constructor.
     *
     * @param leftCount The number of left samples.
     * @param rightCount The number of right samples.
     */
    public InsufficientDataException(final int leftCount, final int rightCount) {
        super(String.format(
                "Cannot compare empty sample sets; leftCount=%d, rightCount=%d",
                leftCount,
                rightCount));
        _leftCount = leftCount;
        _rightCount = rightCount;
    }

    public int getLeftCount() {
        return _leftCount;
    }

    public int getRightCount() {
        return _rightCount;
    }

    private final int _leftCount;
    private final int _rightCount;

    private static final long serialVersionUID = 4412876107593342611L;
}
