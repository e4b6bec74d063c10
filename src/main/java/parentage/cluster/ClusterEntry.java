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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One row of the clustering result: the membership of a transcript in a cluster, and the transcripts that cluster
 * with it without sharing its exon structure.
 */
public final class ClusterEntry {
    private final int clusterId;
    private final String transcriptName;
    private final boolean denovo;
    private final List<ExonConflict> exonConflicts;

    public ClusterEntry(final int clusterId, final String transcriptName, final boolean denovo, final List<ExonConflict> exonConflicts) {
        this.clusterId = clusterId;
        this.transcriptName = transcriptName;
        this.denovo = denovo;
        this.exonConflicts = Collections.unmodifiableList(new ArrayList<>(exonConflicts));
    }

    public int getClusterId() {
        return clusterId;
    }

    public String getTranscriptName() {
        return transcriptName;
    }

    public boolean isDenovo() {
        return denovo;
    }

    /** Never null; empty when the oracle reported no conflicts. */
    public List<ExonConflict> getExonConflicts() {
        return exonConflicts;
    }

    @Override
    public String toString() {
        return "ClusterEntry{" + clusterId + ", " + transcriptName + (denovo ? ", denovo" : "") + ", conflicts=" + exonConflicts + '}';
    }
}
