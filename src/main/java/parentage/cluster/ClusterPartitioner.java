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
package parentage.cluster;

import htsjdk.samtools.util.Log;
import parentage.annotation.Transcript;
import parentage.annotation.TranscriptIndex;
import parentage.annotation.TranscriptSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Turns the rows of a cluster table into {@link Cluster}s, resolving every transcript name against the
 * {@link TranscriptIndex}.  A name missing from the index means the table and the gene model files disagree, and
 * fails the partitioning.
 */
public class ClusterPartitioner {
    private static final Log log = Log.getInstance(ClusterPartitioner.class);

    private final TranscriptIndex transcriptIndex;

    public ClusterPartitioner(final TranscriptIndex transcriptIndex) {
        this.transcriptIndex = transcriptIndex;
    }

    /**
     * @return clusters with at least one de novo member, in ascending cluster id order
     */
    public List<Cluster> partition(final List<ClusterEntry> entries) {
        final SortedMap<Integer, List<ClusterEntry>> entriesByCluster = new TreeMap<>();
        for (final ClusterEntry entry : entries) {
            entriesByCluster.computeIfAbsent(entry.getClusterId(), id -> new ArrayList<>()).add(entry);
        }

        final List<Cluster> clusters = new ArrayList<>();
        int skipped = 0;
        for (final Map.Entry<Integer, List<ClusterEntry>> clusterEntries : entriesByCluster.entrySet()) {
            if (clusterEntries.getValue().stream().noneMatch(ClusterEntry::isDenovo)) {
                skipped++;
                continue;
            }
            clusters.add(makeCluster(clusterEntries.getKey(), clusterEntries.getValue()));
        }
        log.info(String.format("Partitioned %d clusters; skipped %d clusters without de novo transcripts", clusters.size(), skipped));
        return clusters;
    }

    private Cluster makeCluster(final int clusterId, final List<ClusterEntry> entries) {
        final Map<String, Transcript> denovo = new LinkedHashMap<>();
        final Map<String, Transcript> filtered = new LinkedHashMap<>();
        final Map<String, Transcript> unfilteredOnly = new LinkedHashMap<>();
        final Map<String, List<ExonConflict>> exonConflicts = new HashMap<>();

        for (final ClusterEntry entry : entries) {
            final String name = entry.getTranscriptName();
            if (entry.isDenovo()) {
                denovo.put(name, transcriptIndex.require(TranscriptSource.DENOVO, name));
                // only the first row reported for a transcript supplies its conflicts
                exonConflicts.putIfAbsent(name, entry.getExonConflicts());
            } else if (transcriptIndex.contains(TranscriptSource.FILTERED_REFERENCE, name)) {
                filtered.put(name, transcriptIndex.get(TranscriptSource.FILTERED_REFERENCE, name));
            } else {
                unfilteredOnly.put(name, transcriptIndex.require(TranscriptSource.UNFILTERED_REFERENCE, name));
            }
        }
        final Cluster cluster = new Cluster(clusterId, denovo.values(), filtered.values(), unfilteredOnly.values(), exonConflicts);
        log.debug(cluster);
        return cluster;
    }
}
