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
import parentage.ParentageException;
import parentage.annotation.Transcript;
import parentage.annotation.TranscriptIndex;
import parentage.cluster.Cluster;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SortedSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Assigns every de novo transcript of a set of clusters to a parent gene.  Clusters share no state, so each one is
 * resolved independently and may be resolved on its own thread.
 */
public class ParentGeneAssigner {
    private static final Log log = Log.getInstance(ParentGeneAssigner.class);

    public static final double DEFAULT_MIN_DISTANCE = 0.4;
    public static final double DEFAULT_TM_JACCARD_DISTANCE = 0.25;

    private final ExonConflictResolver conflictResolver = new ExonConflictResolver();
    private final GeneResolutionEngine engine;
    private final AlternativeGeneCollector alternativeGeneCollector;

    public ParentGeneAssigner(final TranscriptIndex transcriptIndex, final double minDistance, final double tmJaccardDistance) {
        final TranscriptOverlapScorer scorer = new TranscriptOverlapScorer(transcriptIndex);
        this.engine = new GeneResolutionEngine(scorer, minDistance, tmJaccardDistance);
        this.alternativeGeneCollector = new AlternativeGeneCollector(scorer, minDistance);
    }

    /**
     * @return one record per de novo transcript of the cluster
     */
    public List<AssignmentRecord> assignCluster(final Cluster cluster) {
        final List<AssignmentRecord> records = new ArrayList<>(cluster.getDenovoTranscripts().size());
        for (final Transcript denovo : cluster.getDenovoTranscripts()) {
            records.add(assign(denovo, cluster));
        }
        return records;
    }

    AssignmentRecord assign(final Transcript denovo, final Cluster cluster) {
        final CandidatePool pool = conflictResolver.resolve(cluster, denovo);
        final GeneResolution resolution = engine.resolve(denovo, cluster, pool);
        final SortedSet<String> alternatives = alternativeGeneCollector.collect(denovo, cluster, pool, resolution.getAssignedGene());

        final ResolutionMethod method = alternatives.isEmpty() && isDemotable(resolution.getMethod()) ? null : resolution.getMethod();
        final AssignmentRecord record = new AssignmentRecord(denovo.getName(), resolution.getAssignedGene(), alternatives, method);
        log.debug("Cluster ", cluster.getId(), ": ", record);
        return record;
    }

    /**
     * Methods that only describe a choice among several genes, and mean nothing once no alternative gene is left.
     * {@link ResolutionMethod#BAD_ANNOT_OR_TM} describes the reference genes themselves and is always kept.
     */
    static boolean isDemotable(final ResolutionMethod method) {
        return method == ResolutionMethod.RESCUED || method == ResolutionMethod.AMBIGUOUS_OR_FUSION;
    }

    /**
     * Resolves all clusters, using up to {@code threads} threads.
     *
     * @return records sorted by transcript name
     */
    public List<AssignmentRecord> assignAll(final List<Cluster> clusters, final int threads) {
        final List<AssignmentRecord> records = new ArrayList<>();
        if (threads <= 1) {
            for (final Cluster cluster : clusters) {
                records.addAll(assignCluster(cluster));
            }
        } else {
            final ExecutorService executor = Executors.newFixedThreadPool(threads);
            try {
                final List<Future<List<AssignmentRecord>>> futures = new ArrayList<>(clusters.size());
                for (final Cluster cluster : clusters) {
                    futures.add(executor.submit(() -> assignCluster(cluster)));
                }
                for (final Future<List<AssignmentRecord>> future : futures) {
                    records.addAll(future.get());
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ParentageException("Interrupted while assigning parent genes", e);
            } catch (final ExecutionException e) {
                if (e.getCause() instanceof ParentageException) throw (ParentageException) e.getCause();
                throw new ParentageException("Failed to assign parent genes", e.getCause());
            } finally {
                executor.shutdownNow();
            }
        }
        records.sort(Comparator.comparing(AssignmentRecord::getTranscriptName));
        return records;
    }
}
