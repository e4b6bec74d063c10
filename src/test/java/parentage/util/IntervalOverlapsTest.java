/*
 * The MIT License
 *
 * Copyright (c) 2024 The Broad Institute
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package parentage.util;

import htsjdk.samtools.util.Interval;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class IntervalOverlapsTest {

    private static Interval i(final int start, final int end) {
        return new Interval("chr1", start, end);
    }

    @DataProvider(name = "mergeData")
    public Object[][] mergeData() {
        return new Object[][]{
                {Collections.emptyList(), 0, Collections.emptyList()},
                {Arrays.asList(i(1, 10), i(5, 20)), 0, Collections.singletonList(i(1, 20))},
                // book-ended intervals are joined with no gap
                {Arrays.asList(i(11, 20), i(1, 10)), 0, Collections.singletonList(i(1, 20))},
                {Arrays.asList(i(1, 10), i(12, 20)), 0, Arrays.asList(i(1, 10), i(12, 20))},
                {Arrays.asList(i(1, 10), i(12, 20)), 1, Collections.singletonList(i(1, 20))},
                {Arrays.asList(i(1, 10), i(21, 30)), 10, Collections.singletonList(i(1, 30))},
                {Arrays.asList(i(1, 10), i(22, 30)), 10, Arrays.asList(i(1, 10), i(22, 30))},
                {Arrays.asList(i(1, 100), i(20, 30)), 0, Collections.singletonList(i(1, 100))},
                {Arrays.asList(new Interval("chr2", 1, 10), i(5, 20)), 0, Arrays.asList(i(5, 20), new Interval("chr2", 1, 10))},
        };
    }

    @Test(dataProvider = "mergeData")
    public void testMerge(final List<Interval> intervals, final int gap, final List<Interval> expected) {
        Assert.assertEquals(IntervalOverlaps.merge(intervals, gap), expected);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNegativeGap() {
        IntervalOverlaps.merge(Collections.singletonList(i(1, 10)), -1);
    }

    @DataProvider(name = "asymmetricData")
    public Object[][] asymmetricData() {
        return new Object[][]{
                {Collections.singletonList(i(1, 100)), Collections.singletonList(i(1, 90)), 0.9},
                {Collections.singletonList(i(1, 90)), Collections.singletonList(i(1, 100)), 1.0},
                {Collections.singletonList(i(1, 100)), Collections.singletonList(i(201, 300)), 0.0},
                {Collections.singletonList(i(1, 100)), Arrays.asList(i(1, 20), i(81, 100)), 0.4},
                // overlapping intervals of the same collection are counted once
                {Arrays.asList(i(1, 100), i(51, 100)), Arrays.asList(i(1, 50), i(26, 50)), 0.5},
                {Collections.singletonList(i(1, 100)), Collections.singletonList(new Interval("chr2", 1, 100)), 0.0},
                {Collections.emptyList(), Collections.singletonList(i(1, 100)), 0.0},
                {Collections.singletonList(i(1, 100)), Collections.emptyList(), 0.0},
        };
    }

    @Test(dataProvider = "asymmetricData")
    public void testAsymmetricOverlap(final List<Interval> a, final List<Interval> b, final double expected) {
        Assert.assertEquals(IntervalOverlaps.asymmetricOverlap(a, b), expected);
    }

    @DataProvider(name = "symmetricData")
    public Object[][] symmetricData() {
        return new Object[][]{
                {Collections.singletonList(i(1, 100)), Collections.singletonList(i(1, 40)), 0.4},
                {Collections.singletonList(i(1, 40)), Collections.singletonList(i(1, 100)), 0.4},
                {Collections.singletonList(i(1, 100)), Collections.singletonList(i(51, 150)), 50 / 150.0},
                {Collections.singletonList(i(1, 100)), Collections.singletonList(i(1, 100)), 1.0},
                {Collections.singletonList(i(1, 100)), Collections.singletonList(i(101, 200)), 0.0},
                {Arrays.asList(i(1, 50), i(101, 150)), Arrays.asList(i(26, 125)), 50 / 150.0},
                {Collections.emptyList(), Collections.emptyList(), 0.0},
        };
    }

    @Test(dataProvider = "symmetricData")
    public void testSymmetricOverlap(final List<Interval> a, final List<Interval> b, final double expected) {
        Assert.assertEquals(IntervalOverlaps.symmetricOverlap(a, b), expected);
    }

    @Test
    public void testScoresAreReproducible() {
        final List<Interval> a = Arrays.asList(i(1, 37), i(101, 173));
        final List<Interval> b = Arrays.asList(i(20, 120), i(150, 400));
        Assert.assertEquals(Double.compare(IntervalOverlaps.asymmetricOverlap(a, b), IntervalOverlaps.asymmetricOverlap(a, b)), 0);
        Assert.assertEquals(Double.compare(IntervalOverlaps.symmetricOverlap(a, b), IntervalOverlaps.symmetricOverlap(b, a)), 0);
    }
}
