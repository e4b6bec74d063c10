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
import parentage.cluster.Cluster;

import java.util.Collection;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Collects the genes, other than the assigned one, that also cover the de novo transcript well; a marker of possible
 * paralogy.  When exon conflicts were reported the pool is the genes of the remaining candidate transcripts, otherwise
 * it is the genes of the reference transcripts that were removed by filtering.
 */
public class AlternativeGeneCollector {
    private final TranscriptOverlapScorer scorer;
    private final double minDistance;

    public AlternativeGeneCollector(final TranscriptOverlapScorer scorer, final double minDistance) {
        this.scorer = scorer;
        this.minDistance = minDistance;
    }

    /**
     * @param assignedGene the gene the transcript was assigned to, or null
     * @return alternative gene names in sorted order, possibly empty
     */
    public SortedSet<String> collect(final Transcript denovo, final Cluster cluster, final CandidatePool pool, final String assignedGene) {
        final Collection<Transcript> source = pool.isConflictsReported() ?
                pool.getCandidateTranscripts() : cluster.getUnfilteredOnlyReferenceTranscripts();

        final SortedSet<String> pooledGenes = new TreeSet<>();
        for (final Transcript transcript : source) {
            pooledGenes.add(transcript.getGeneName());
        }
        if (assignedGene != null) pooledGenes.remove(assignedGene);

        final SortedSet<String> alternatives = new TreeSet<>();
        for (final String gene : pooledGenes) {
            if (scorer.bestOverlap(denovo, cluster.getReferenceGenes().transcriptsOf(gene)) > minDistance) {
                alternatives.add(gene);
            }
        }
        return alternatives;
    }
}
