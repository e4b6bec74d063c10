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

import htsjdk.samtools.util.Log;
import parentage.annotation.Transcript;
import parentage.cluster.Cluster;
import parentage.cluster.ExonConflict;
import parentage.cluster.GeneGroup;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Narrows the candidate genes of a de novo transcript using the exon conflicts reported for it.
 *
 * A cluster can be held together by a readthrough transcript, so a de novo transcript may share a cluster with genes
 * whose exons it does not overlap at all.  A gene is dropped only when every one of its filtered transcripts is in
 * conflict with the de novo transcript; a gene with at least one unconflicted transcript stays a candidate.
 */
public class ExonConflictResolver {
    private static final Log log = Log.getInstance(ExonConflictResolver.class);

    public CandidatePool resolve(final Cluster cluster, final Transcript denovo) {
        final GeneGroup filteredGenes = cluster.getFilteredGenes();
        final List<ExonConflict> conflicts = cluster.getExonConflicts(denovo.getName());
        if (conflicts.isEmpty()) {
            return new CandidatePool(false, filteredGenes.genes(), cluster.getFilteredReferenceTranscripts(), new TreeSet<>());
        }

        final GeneGroup referenceGenes = cluster.getReferenceGenes();
        final Set<String> conflictedTranscripts = new TreeSet<>();
        final Map<String, Set<String>> conflictedTranscriptsByGene = new TreeMap<>();
        final Set<String> denovoConflicts = new TreeSet<>();
        for (final ExonConflict conflict : conflicts) {
            final String name = conflict.getTranscriptName();
            final String gene = referenceGenes.geneOf(name);
            if (gene != null) {
                conflictedTranscripts.add(name);
                conflictedTranscriptsByGene.computeIfAbsent(gene, g -> new TreeSet<>()).add(name);
            } else {
                denovoConflicts.add(conflict.toString());
            }
        }
        if (!denovoConflicts.isEmpty()) {
            log.debug(String.format("%s: ignoring conflicts with non-reference transcripts %s", denovo.getName(), denovoConflicts));
        }

        final Set<String> nonoverlappingGenes = new TreeSet<>();
        for (final String gene : filteredGenes.genes()) {
            final Set<String> conflicted = conflictedTranscriptsByGene.get(gene);
            if (conflicted != null && conflicted.containsAll(filteredGenes.transcriptsOf(gene))) {
                nonoverlappingGenes.add(gene);
            }
        }

        final Set<String> candidateGenes = new TreeSet<>(filteredGenes.genes());
        candidateGenes.removeAll(nonoverlappingGenes);

        final List<Transcript> candidateTranscripts = new ArrayList<>();
        for (final Transcript transcript : cluster.getFilteredReferenceTranscripts()) {
            if (!conflictedTranscripts.contains(transcript.getName())) {
                candidateTranscripts.add(transcript);
            }
        }

        if (!nonoverlappingGenes.isEmpty()) {
            log.debug(String.format("%s: genes %s do not share exons with it", denovo.getName(), nonoverlappingGenes));
        }
        return new CandidatePool(true, candidateGenes, candidateTranscripts, nonoverlappingGenes);
    }
}
