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

import org.testng.Assert;
import org.testng.annotations.Test;
import parentage.ParentageException;
import parentage.annotation.Transcript;
import parentage.annotation.TranscriptIndex;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static parentage.annotation.TranscriptTestUtils.denovo;
import static parentage.annotation.TranscriptTestUtils.filtered;
import static parentage.annotation.TranscriptTestUtils.unfiltered;

public class ClusterPartitionerTest {

    private static List<String> names(final List<Transcript> transcripts) {
        return transcripts.stream().map(Transcript::getName).collect(Collectors.toList());
    }

    private final Transcript a1 = filtered("A1", "GA", 0, 100);
    private final Transcript a2 = filtered("A2", "GA", 0, 50);
    private final TranscriptIndex index = new TranscriptIndex(
            Arrays.asList(a1, a2),
            Arrays.asList(unfiltered(a1), unfiltered(a2), unfiltered("B1", "GB", 0, 80), unfiltered("Z1", "GZ", 500, 600)),
            Arrays.asList(denovo("D2", 0, 100), denovo("D1", 10, 90)));

    @Test
    public void testPartition() {
        final List<ClusterEntry> entries = Arrays.asList(
                new ClusterEntry(2, "Z1", false, Collections.emptyList()),
                new ClusterEntry(1, "B1", false, Collections.emptyList()),
                new ClusterEntry(1, "D2", true, Collections.singletonList(new ExonConflict("ref.gp", "A2"))),
                new ClusterEntry(1, "A2", false, Collections.emptyList()),
                new ClusterEntry(1, "A1", false, Collections.emptyList()),
                new ClusterEntry(1, "D1", true, Collections.emptyList()),
                new ClusterEntry(1, "D2", true, Collections.singletonList(new ExonConflict("ref.gp", "B1"))));

        final List<Cluster> clusters = new ClusterPartitioner(index).partition(entries);
        Assert.assertEquals(clusters.size(), 1);

        final Cluster cluster = clusters.get(0);
        Assert.assertEquals(cluster.getId(), 1);
        Assert.assertEquals(names(cluster.getDenovoTranscripts()), Arrays.asList("D1", "D2"));
        Assert.assertEquals(names(cluster.getFilteredReferenceTranscripts()), Arrays.asList("A1", "A2"));
        Assert.assertEquals(names(cluster.getUnfilteredOnlyReferenceTranscripts()), Collections.singletonList("B1"));
        Assert.assertEquals(cluster.getFilteredGenes().genes(), Collections.singleton("GA"));
        Assert.assertEquals(cluster.getReferenceGenes().geneCount(), 2);
        Assert.assertEquals(cluster.getReferenceGenes().geneOf("B1"), "GB");
        Assert.assertEquals(cluster.getExonConflicts("D2"), Collections.singletonList(new ExonConflict("ref.gp", "A2")));
        Assert.assertTrue(cluster.getExonConflicts("D1").isEmpty());
    }

    @Test
    public void testClustersAreOrderedById() {
        final List<ClusterEntry> entries = Arrays.asList(
                new ClusterEntry(9, "D1", true, Collections.emptyList()),
                new ClusterEntry(3, "D2", true, Collections.emptyList()));
        final List<Integer> ids = new ClusterPartitioner(index).partition(entries).stream()
                .map(Cluster::getId).collect(Collectors.toList());
        Assert.assertEquals(ids, Arrays.asList(3, 9));
    }

    @Test(expectedExceptions = ParentageException.class)
    public void testUnknownReferenceTranscript() {
        new ClusterPartitioner(index).partition(Arrays.asList(
                new ClusterEntry(1, "D1", true, Collections.emptyList()),
                new ClusterEntry(1, "X1", false, Collections.emptyList())));
    }

    @Test(expectedExceptions = ParentageException.class)
    public void testUnknownDenovoTranscript() {
        new ClusterPartitioner(index).partition(Collections.singletonList(
                new ClusterEntry(1, "D9", true, Collections.emptyList())));
    }
}
