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

import com.arpnetworking.hunter.statistics.ComparativeStats;
import com.arpnetworking.hunter.statistics.SignificanceTester;
import com.arpnetworking.hunter.statistics.SignificanceTesterFactory;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.MockitoAnnotations;

/**
 * Tests for the {@link DivisiveSplitter} class.
 *
 * @author Inscope Metrics
 */
public class DivisiveSplitterTest {

    @Before
    public void setUp() {
        _mocks = MockitoAnnotations.openMocks(this);
    }

    @After
    public void tearDown() throws Exception {
        _mocks.close();
    }

    @Test
    public void testTwoSteps() {
        final double[] values = new double[]{
                1.0, 1.0, 1.0, 1.0, 1.0,
                5.0, 5.0, 5.0, 5.0, 5.0,
                9.0, 9.0, 9.0, 9.0, 9.0};
        final IntList found = new DivisiveSplitter(TTEST, 0.01).split(values, 0, values.length);
        Assert.assertEquals(new IntArrayList(new int[]{5, 10}), found);
    }

    @Test
    public void testConstant() {
        final double[] values = new double[]{3.0, 3.0, 3.0, 3.0, 3.0, 3.0, 3.0, 3.0};
        Assert.assertTrue(new DivisiveSplitter(TTEST, 0.01).split(values, 0, values.length).isEmpty());
    }

    @Test
    public void testOffsetWindow() {
        final double[] values = new double[]{
                100.0, 100.0, 100.0,
                1.0, 1.0, 1.0, 1.0, 2.0, 2.0, 2.0, 2.0,
                100.0};
        Assert.assertEquals(
                new IntArrayList(new int[]{7}),
                new DivisiveSplitter(TTEST, 0.01).split(values, 3, 11));
    }

    @Test
    public void testNotSignificant() {
        Mockito.when(_tester.compare(
                        ArgumentMatchers.any(double[].class),
                        ArgumentMatchers.anyInt(),
                        ArgumentMatchers.anyInt(),
                        ArgumentMatchers.anyInt()))
                .thenReturn(new ComparativeStats(1.0, 2.0, 0.0, 0.0, 0.5));
        final double[] values = new double[]{1.0, 1.0, 1.0, 2.0, 2.0, 2.0};

        Assert.assertTrue(new DivisiveSplitter(_tester, 0.01).split(values, 0, values.length).isEmpty());
        Mockito.verify(_tester).compare(values, 0, 3, 6);
        Mockito.verifyNoMoreInteractions(_tester);
    }

    @Test
    public void testShortSegmentNotTested() {
        new DivisiveSplitter(_tester, 0.01).split(new double[]{1.0, 5.0, 9.0}, 0, 3);
        Mockito.verifyNoInteractions(_tester);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testInvalidRange() {
        new DivisiveSplitter(TTEST, 0.01).split(new double[]{1.0, 2.0}, 0, 3);
    }

    @Mock
    private SignificanceTester _tester;
    private AutoCloseable _mocks;

    private static final SignificanceTester TTEST = new SignificanceTesterFactory().getTester("ttest");
}
