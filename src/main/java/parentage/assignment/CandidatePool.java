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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The reference genes and transcripts that remain candidates for one de novo transcript after exon conflicts have
 * been taken into account.
 */
public final class CandidatePool {
    private final boolean conflictsReported;
    private final SortedSet<String> candidateGenes;
    private final List<Transcript> candidateTranscripts;
    private final SortedSet<String> nonoverlappingGenes;

    CandidatePool(final boolean conflictsReported,
                  final Collection<String> candidateGenes,
                  final Collection<Transcript> candidateTranscripts,
                  final Collection<String> nonoverlappingGenes) {
        this.conflictsReported = conflictsReported;
        this.candidateGenes = Collections.unmodifiableSortedSet(new TreeSet<>(candidateGenes));
        this.candidateTranscripts = Collections.unmodifiableList(new ArrayList<>(candidateTranscripts));
        this.nonoverlappingGenes = Collections.unmodifiableSortedSet(new TreeSet<>(nonoverlappingGenes));
    }

    /** Whether the oracle reported any exon conflict for the de novo transcript. */
    public boolean isConflictsReported() {
        return conflictsReported;
    }

    public SortedSet<String> getCandidateGenes() {
        return candidateGenes;
    }

    /** Filtered reference transcripts left after removing those in conflict with the de novo transcript. */
    public List<Transcript> getCandidateTranscripts() {
        return candidateTranscripts;
    }

    /** Genes whose every filtered transcript conflicts with the de novo transcript. */
    public Set<String> getNonoverlappingGenes() {
        return nonoverlappingGenes;
    }
}
