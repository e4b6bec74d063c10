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

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Groups reference transcripts by gene: gene name to transcript names, and transcript name back to gene name.
 * Iteration order is sorted by name.
 */
public class GeneGroup {
    private final SortedMap<String, SortedSet<String>> transcriptsByGene = new TreeMap<>();
    private final Map<String, String> geneByTranscript = new TreeMap<>();

    public GeneGroup(final Collection<Transcript> transcripts) {
        for (final Transcript transcript : transcripts) {
            transcriptsByGene.computeIfAbsent(transcript.getGeneName(), gene -> new TreeSet<>()).add(transcript.getName());
            geneByTranscript.put(transcript.getName(), transcript.getGeneName());
        }
    }

    public Set<String> genes() {
        return Collections.unmodifiableSet(transcriptsByGene.keySet());
    }

    /** @return the transcripts of the gene, empty if the gene is not in this group */
    public Set<String> transcriptsOf(final String gene) {
        final SortedSet<String> transcripts = transcriptsByGene.get(gene);
        return transcripts == null ? Collections.emptySet() : Collections.unmodifiableSet(transcripts);
    }

    /** @return the gene of the transcript, or null if the transcript is not in this group */
    public String geneOf(final String transcriptName) {
        return geneByTranscript.get(transcriptName);
    }

    public int geneCount() {
        return transcriptsByGene.size();
    }

    @Override
    public String toString() {
        return transcriptsByGene.toString();
    }
}
