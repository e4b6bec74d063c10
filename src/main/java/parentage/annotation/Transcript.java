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
package parentage.annotation;

import htsjdk.samtools.util.Interval;
import htsjdk.tribble.annotation.Strand;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable gene model of a single transcript.  Exons are held as 1-based, closed {@link Interval}s in the order they
 * were given; the sequence name of every exon is the transcript's chromosome.
 */
public class Transcript {
    private final String name;
    private final String geneName;
    private final String chromosomeName;
    private final Strand strand;
    private final List<Interval> exons;
    private final TranscriptSource source;

    public Transcript(final String name, final String geneName, final String chromosomeName, final Strand strand,
                      final List<Interval> exons, final TranscriptSource source) {
        this.name = Objects.requireNonNull(name, "name");
        this.geneName = Objects.requireNonNull(geneName, "geneName");
        this.chromosomeName = chromosomeName;
        this.strand = strand;
        this.exons = Collections.unmodifiableList(new ArrayList<>(exons));
        this.source = source;
    }

    /**
     * Converts a genePred row, whose exons are 0-based half-open, into a transcript.
     */
    public static Transcript fromGenePred(final GenePredRecord record, final TranscriptSource source) {
        final int[] starts = record.exonStarts().toArray();
        final int[] ends = record.exonEnds().toArray();
        final boolean negative = record.strand() == Strand.NEGATIVE;
        final List<Interval> exons = new ArrayList<>(record.exonCount());
        for (int i = 0; i < record.exonCount(); i++) {
            if (ends[i] <= starts[i]) {
                throw new AnnotationException(String.format("Exon %d of transcript %s has non-positive length (%d-%d)",
                        i, record.name(), starts[i], ends[i]));
            }
            exons.add(new Interval(record.chromosomeName(), starts[i] + 1, ends[i], negative, record.name()));
        }
        return new Transcript(record.name(), record.geneName(), record.chromosomeName(), record.strand(), exons, source);
    }

    public String getName() {
        return name;
    }

    /** The gene identifier, name2 in genePred terms. */
    public String getGeneName() {
        return geneName;
    }

    public String getChromosomeName() {
        return chromosomeName;
    }

    public Strand getStrand() {
        return strand;
    }

    public List<Interval> getExons() {
        return exons;
    }

    public TranscriptSource getSource() {
        return source;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final Transcript that = (Transcript) o;

        if (!name.equals(that.name)) return false;
        return source == that.source;
    }

    @Override
    public int hashCode() {
        int result = name.hashCode();
        result = 31 * result + (source != null ? source.hashCode() : 0);
        return result;
    }

    @Override
    public String toString() {
        return String.format("%s(%s, %s, %s, %d exons)", name, geneName, chromosomeName, source, exons.size());
    }
}
