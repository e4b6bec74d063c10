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
import parentage.annotation.TranscriptTestUtils;
import parentage.cluster.Cluster;
import parentage.cluster.ExonConflict;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a single cluster together with the transcript index backing it.  Filtered transcripts are also added to the
 * unfiltered set, as they are in real projections.
 */
final class ClusterFixture {
    static final String REFERENCE_SOURCE = "unfiltered.gp";

    private final int id;
    private final List<Transcript> denovo = new ArrayList<>();
    private final List<Transcript> filtered = new ArrayList<>();
    private final List<Transcript> unfilteredOnly = new ArrayList<>();
    private final Map<String, List<ExonConflict>> exonConflicts = new HashMap<>();

    ClusterFixture() {
        this(1);
    }

    ClusterFixture(final int id) {
        this.id = id;
    }

    ClusterFixture denovo(final Transcript transcript, final String... conflictingTranscripts) {
        denovo.add(transcript);
        final List<ExonConflict> conflicts = new ArrayList<>();
        for (final String name : conflictingTranscripts) {
            conflicts.add(new ExonConflict(REFERENCE_SOURCE, name));
        }
        exonConflicts.put(transcript.getName(), conflicts);
        return this;
    }

    ClusterFixture filtered(final Transcript transcript) {
        filtered.add(transcript);
        return this;
    }

    ClusterFixture unfilteredOnly(final Transcript transcript) {
        unfilteredOnly.add(transcript);
        return this;
    }

    Transcript denovo(final String name) {
        return denovo.stream().filter(t -> t.getName().equals(name)).findFirst().get();
    }

    TranscriptIndex index() {
        final List<Transcript> unfiltered = new ArrayList<>();
        filtered.forEach(t -> unfiltered.add(TranscriptTestUtils.unfiltered(t)));
        unfiltered.addAll(unfilteredOnly);
        return new TranscriptIndex(filtered, unfiltered, denovo);
    }

    Cluster cluster() {
        return new Cluster(id, denovo, filtered, unfilteredOnly, exonConflicts);
    }
}
