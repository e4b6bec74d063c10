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

import htsjdk.samtools.util.Interval;
import parentage.annotation.Transcript;
import parentage.cluster.Cluster;
import parentage.util.IntervalOverlaps;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Decides the parent gene of a de novo transcript from its {@link CandidatePool}.
 *
 * <ul>
 *     <li>No candidate gene: unassigned, a putative novel locus.</li>
 *     <li>One candidate gene: assigned if the de novo transcript is covered by more than {@code minDistance} by one of
 *     the gene's transcripts, otherwise unassigned.</li>
 *     <li>Several candidate genes: see {@link #resolveMultipleGenes(Transcript, Collection)}.</li>
 * </ul>
 */
public class GeneResolutionEngine {
    /** Gap tolerance used when merging the exons of all transcripts of a gene. */
    static final int GENE_MERGE_GAP = 0;

    private final TranscriptOverlapScorer scorer;
    private final double minDistance;
    private final double tmJaccardDistance;

    public GeneResolutionEngine(final TranscriptOverlapScorer scorer, final double minDistance, final double tmJaccardDistance) {
        this.scorer = scorer;
        this.minDistance = minDistance;
        this.tmJaccardDistance = tmJaccardDistance;
    }

    public GeneResolution resolve(final Transcript denovo, final Cluster cluster, final CandidatePool pool) {
        final Collection<String> filteredGenes = cluster.getFilteredGenes().genes();
        final Collection<String> candidateGenes = pool.getCandidateGenes();

        if (!pool.isConflictsReported()) {
            if (filteredGenes.size() > 1) {
                return resolveMultipleGenes(denovo, cluster.getFilteredReferenceTranscripts());
            } else if (filteredGenes.size() == 1) {
                return resolveSingleGene(denovo, cluster, filteredGenes.iterator().next());
            }
            return GeneResolution.unassigned();
        }

        if (candidateGenes.isEmpty()) {
            return GeneResolution.unassigned();
        } else if (filteredGenes.size() == 1) {
            return resolveSingleGene(denovo, cluster, filteredGenes.iterator().next());
        } else if (!pool.getNonoverlappingGenes().isEmpty()) {
            if (candidateGenes.size() > 1) {
                return resolveMultipleGenes(denovo, pool.getCandidateTranscripts());
            }
            return resolveSingleGene(denovo, cluster, candidateGenes.iterator().next());
        }
        return resolveMultipleGenes(denovo, cluster.getFilteredReferenceTranscripts());
    }

    /**
     * Assigns the gene if any of its transcripts in the cluster covers more than {@code minDistance} of the de novo
     * transcript.
     */
    GeneResolution resolveSingleGene(final Transcript denovo, final Cluster cluster, final String gene) {
        final double overlap = scorer.bestOverlap(denovo, cluster.getReferenceGenes().transcriptsOf(gene));
        return overlap > minDistance ? GeneResolution.assigned(gene) : GeneResolution.unassigned();
    }

    /**
     * Resolves a de novo transcript that overlaps transcripts of more than one gene.
     *
     * If every pair of candidate genes overlaps with a Jaccard index above {@code tmJaccardDistance} the genes cannot
     * be told apart and the result is {@link ResolutionMethod#BAD_ANNOT_OR_TM}.  Otherwise each gene is scored by the
     * best coverage of the de novo transcript by one of its transcripts.  The top gene is {@link ResolutionMethod#RESCUED}
     * if it beats every lower score by at least {@code minDistance} and no other gene shares the top score; in every
     * other case the result is {@link ResolutionMethod#AMBIGUOUS_OR_FUSION}.
     */
    public GeneResolution resolveMultipleGenes(final Transcript denovo, final Collection<Transcript> candidateTranscripts) {
        final SortedMap<String, List<Transcript>> transcriptsByGene = new TreeMap<>();
        for (final Transcript transcript : candidateTranscripts) {
            transcriptsByGene.computeIfAbsent(transcript.getGeneName(), gene -> new ArrayList<>()).add(transcript);
        }

        final List<List<Transcript>> genes = new ArrayList<>(transcriptsByGene.values());
        boolean allOverlapping = true;
        for (int i = 0; i < genes.size() && allOverlapping; i++) {
            for (int j = i + 1; j < genes.size() && allOverlapping; j++) {
                allOverlapping = findHighestGeneJaccard(genes.get(i), genes.get(j)) > tmJaccardDistance;
            }
        }
        if (allOverlapping) {
            return GeneResolution.unassigned(ResolutionMethod.BAD_ANNOT_OR_TM);
        }

        final Map<String, Double> bestScores = new LinkedHashMap<>();
        for (final Map.Entry<String, List<Transcript>> gene : transcriptsByGene.entrySet()) {
            double best = 0;
            for (final Transcript transcript : gene.getValue()) {
                best = Math.max(best, IntervalOverlaps.asymmetricOverlap(denovo.getExons(), transcript.getExons()));
            }
            bestScores.put(gene.getKey(), best);
        }

        String highGene = null;
        double highScore = 0;
        for (final Map.Entry<String, Double> score : bestScores.entrySet()) {
            if (highGene == null || score.getValue() > highScore) {
                highGene = score.getKey();
                highScore = score.getValue();
            }
        }

        for (final double score : bestScores.values()) {
            if (score != highScore && highScore - score < minDistance) {
                return GeneResolution.unassigned(ResolutionMethod.AMBIGUOUS_OR_FUSION);
            }
        }

        // List.sort is stable, so the last entry is the last gene to reach the top score
        final List<Map.Entry<String, Double>> ranked = new ArrayList<>(bestScores.entrySet());
        ranked.sort(Map.Entry.comparingByValue(Comparator.naturalOrder()));
        final String best = ranked.get(ranked.size() - 1).getKey();
        if (!best.equals(highGene)) {
            return GeneResolution.unassigned(ResolutionMethod.AMBIGUOUS_OR_FUSION);
        }
        return GeneResolution.rescued(highGene);
    }

    /**
     * Jaccard index between the merged exonic footprints of two genes.
     */
    static double findHighestGeneJaccard(final Collection<Transcript> geneA, final Collection<Transcript> geneB) {
        return IntervalOverlaps.symmetricOverlap(footprint(geneA), footprint(geneB));
    }

    private static List<Interval> footprint(final Collection<Transcript> transcripts) {
        final List<Interval> exons = new ArrayList<>();
        for (final Transcript transcript : transcripts) {
            exons.addAll(transcript.getExons());
        }
        return IntervalOverlaps.merge(exons, GENE_MERGE_GAP);
    }
}
