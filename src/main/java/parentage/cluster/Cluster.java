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

import parentage.annotation.Transcript;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * The transcripts grouped into one cluster, partitioned by where they came from.  Reference transcripts present in the
 * filtered set are held as their filtered models; the unfiltered-only list holds the reference transcripts that were
 * removed by filtering.
 */
public class Cluster {
    private final int id;
    private final List<Transcript> denovoTranscripts;
    private final List<Transcript> filteredReferenceTranscripts;
    private final List<Transcript> unfilteredOnlyReferenceTranscripts;
    private final Map<String, List<ExonConflict>> exonConflicts;
    private final GeneGroup filteredGenes;
    private final GeneGroup referenceGenes;

    public Cluster(final int id,
                   final Collection<Transcript> denovoTranscripts,
                   final Collection<Transcript> filteredReferenceTranscripts,
                   final Collection<Transcript> unfilteredOnlyReferenceTranscripts,
                   final Map<String, List<ExonConflict>> exonConflicts) {
        this.id = id;
        this.denovoTranscripts = sortedByName(denovoTranscripts);
        this.filteredReferenceTranscripts = sortedByName(filteredReferenceTranscripts);
        this.unfilteredOnlyReferenceTranscripts = sortedByName(unfilteredOnlyReferenceTranscripts);
        this.exonConflicts = Collections.unmodifiableMap(exonConflicts);

        this.filteredGenes = new GeneGroup(this.filteredReferenceTranscripts);
        final List<Transcript> allReference = new ArrayList<>(this.filteredReferenceTranscripts);
        allReference.addAll(this.unfilteredOnlyReferenceTranscripts);
        this.referenceGenes = new GeneGroup(allReference);
    }

    private static List<Transcript> sortedByName(final Collection<Transcript> transcripts) {
        final List<Transcript> sorted = new ArrayList<>(transcripts);
        sorted.sort(Comparator.comparing(Transcript::getName));
        return Collections.unmodifiableList(sorted);
    }

    public int getId() {
        return id;
    }

    public List<Transcript> getDenovoTranscripts() {
        return denovoTranscripts;
    }

    public List<Transcript> getFilteredReferenceTranscripts() {
        return filteredReferenceTranscripts;
    }

    public List<Transcript> getUnfilteredOnlyReferenceTranscripts() {
        return unfilteredOnlyReferenceTranscripts;
    }

    /** Genes of the filtered reference transcripts only. */
    public GeneGroup getFilteredGenes() {
        return filteredGenes;
    }

    /** Genes of every reference transcript in the cluster, filtered or not. */
    public GeneGroup getReferenceGenes() {
        return referenceGenes;
    }

    /** @return the conflicts reported for the de novo transcript, empty if none were reported */
    public List<ExonConflict> getExonConflicts(final String denovoTranscriptName) {
        return exonConflicts.getOrDefault(denovoTranscriptName, Collections.emptyList());
    }

    @Override
    public String toString() {
        return String.format("Cluster %d: %d de novo, %d filtered, %d unfiltered-only", id,
                denovoTranscripts.size(), filteredReferenceTranscripts.size(), unfilteredOnlyReferenceTranscripts.size());
    }
}
