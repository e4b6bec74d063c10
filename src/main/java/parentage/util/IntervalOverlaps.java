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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Overlap metrics between collections of 1-based, closed genomic intervals.  Every metric first merges each
 * collection so that bases shared by several intervals of the same collection are counted once.
 *
 * Scores are computed from exact base counts with a single division, so equal inputs always produce equal doubles
 * and callers may compare them exactly.
 */
public final class IntervalOverlaps {

    private static final Comparator<Interval> GENOMIC_ORDER = Comparator.comparing(Interval::getContig)
            .thenComparingInt(Interval::getStart)
            .thenComparingInt(Interval::getEnd);

    private IntervalOverlaps() {}

    /**
     * Sorts the intervals and coalesces those that overlap or are separated by no more than {@code gap} bases.
     * A gap of 0 joins book-ended intervals.  Strand and names are not carried over.
     */
    public static List<Interval> merge(final Collection<Interval> intervals, final int gap) {
        if (gap < 0) throw new IllegalArgumentException("gap must be non-negative: " + gap);

        final List<Interval> sorted = new ArrayList<>(intervals);
        sorted.sort(GENOMIC_ORDER);

        final List<Interval> merged = new ArrayList<>(sorted.size());
        String contig = null;
        int start = 0;
        int end = 0;
        for (final Interval interval : sorted) {
            if (contig != null && contig.equals(interval.getContig()) && interval.getStart() - 1 - end <= gap) {
                end = Math.max(end, interval.getEnd());
            } else {
                if (contig != null) merged.add(new Interval(contig, start, end));
                contig = interval.getContig();
                start = interval.getStart();
                end = interval.getEnd();
            }
        }
        if (contig != null) merged.add(new Interval(contig, start, end));
        return merged;
    }

    /**
     * @return fraction of the bases of {@code a} that are also covered by {@code b}, or 0 if either is empty
     */
    public static double asymmetricOverlap(final Collection<Interval> a, final Collection<Interval> b) {
        final List<Interval> mergedA = merge(a, 0);
        final List<Interval> mergedB = merge(b, 0);
        final long totalA = totalLength(mergedA);
        if (totalA == 0 || mergedB.isEmpty()) return 0;
        return intersectionLength(mergedA, mergedB) / (double) totalA;
    }

    /**
     * @return Jaccard index of the bases covered by {@code a} and {@code b}, or 0 if either is empty
     */
    public static double symmetricOverlap(final Collection<Interval> a, final Collection<Interval> b) {
        final List<Interval> mergedA = merge(a, 0);
        final List<Interval> mergedB = merge(b, 0);
        if (mergedA.isEmpty() || mergedB.isEmpty()) return 0;
        final long intersection = intersectionLength(mergedA, mergedB);
        final long union = totalLength(mergedA) + totalLength(mergedB) - intersection;
        return intersection / (double) union;
    }

    /** Total number of bases in the intervals, which must not overlap each other. */
    static long totalLength(final List<Interval> merged) {
        long total = 0;
        for (final Interval interval : merged) {
            total += interval.getLengthOnReference();
        }
        return total;
    }

    /** Number of shared bases between two merged, genomically ordered lists. */
    static long intersectionLength(final List<Interval> mergedA, final List<Interval> mergedB) {
        long shared = 0;
        int i = 0;
        int j = 0;
        while (i < mergedA.size() && j < mergedB.size()) {
            final Interval a = mergedA.get(i);
            final Interval b = mergedB.get(j);
            final int contigOrder = a.getContig().compareTo(b.getContig());
            if (contigOrder < 0) {
                i++;
            } else if (contigOrder > 0) {
                j++;
            } else {
                final int overlapStart = Math.max(a.getStart(), b.getStart());
                final int overlapEnd = Math.min(a.getEnd(), b.getEnd());
                if (overlapEnd >= overlapStart) shared += overlapEnd - overlapStart + 1;
                if (a.getEnd() < b.getEnd()) i++;
                else j++;
            }
        }
        return shared;
    }
}
