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
import java.util.List;

/**
 * Builders for small transcripts on chr1, positive strand.
 */
public final class TranscriptTestUtils {
    public static final String CONTIG = "chr1";

    private TranscriptTestUtils() {}

    /**
     * @param halfOpenExons pairs of 0-based start and exclusive end, as in a genePred row
     */
    public static Transcript transcript(final String name, final String gene, final TranscriptSource source, final int... halfOpenExons) {
        if (halfOpenExons.length % 2 != 0) throw new IllegalArgumentException("exons must be start/end pairs");
        final List<Interval> exons = new ArrayList<>();
        for (int i = 0; i < halfOpenExons.length; i += 2) {
            exons.add(new Interval(CONTIG, halfOpenExons[i] + 1, halfOpenExons[i + 1]));
        }
        return new Transcript(name, gene, CONTIG, Strand.POSITIVE, exons, source);
    }

    public static Transcript denovo(final String name, final int... halfOpenExons) {
        return transcript(name, "aug_" + name, TranscriptSource.DENOVO, halfOpenExons);
    }

    public static Transcript filtered(final String name, final String gene, final int... halfOpenExons) {
        return transcript(name, gene, TranscriptSource.FILTERED_REFERENCE, halfOpenExons);
    }

    /** The unfiltered model of a filtered transcript, or of a transcript removed by filtering. */
    public static Transcript unfiltered(final Transcript transcript) {
        return new Transcript(transcript.getName(), transcript.getGeneName(), transcript.getChromosomeName(),
                transcript.getStrand(), transcript.getExons(), TranscriptSource.UNFILTERED_REFERENCE);
    }

    public static Transcript unfiltered(final String name, final String gene, final int... halfOpenExons) {
        return transcript(name, gene, TranscriptSource.UNFILTERED_REFERENCE, halfOpenExons);
    }
}
