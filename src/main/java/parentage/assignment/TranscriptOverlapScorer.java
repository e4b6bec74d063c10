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
package parentage.assignment;

import parentage.annotation.Transcript;
import parentage.annotation.TranscriptIndex;
import parentage.annotation.TranscriptSource;
import parentage.util.IntervalOverlaps;

import java.util.Collection;

/**
 * Scores how well a de novo transcript is covered by a set of reference transcripts.  Geometry always comes from the
 * unfiltered reference models, since filtered models may have been trimmed.
 */
public class TranscriptOverlapScorer {
    private final TranscriptIndex transcriptIndex;

    public TranscriptOverlapScorer(final TranscriptIndex transcriptIndex) {
        this.transcriptIndex = transcriptIndex;
    }

    /**
     * @return the largest fraction of the de novo transcript's exonic bases covered by any one of the named reference
     * transcripts, or 0 if there are none
     */
    public double bestOverlap(final Transcript denovo, final Collection<String> referenceTranscriptNames) {
        double bestOverlap = 0;
        for (final String name : referenceTranscriptNames) {
            final Transcript reference = transcriptIndex.require(TranscriptSource.UNFILTERED_REFERENCE, name);
            final double overlap = IntervalOverlaps.asymmetricOverlap(denovo.getExons(), reference.getExons());
            if (overlap > bestOverlap) {
                bestOverlap = overlap;
            }
        }
        return bestOverlap;
    }
}
