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

import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import parentage.annotation.TranscriptIndex;
import parentage.annotation.TranscriptSource;
import parentage.cluster.Cluster;
import parentage.cluster.ClusterEntry;
import parentage.cluster.ClusterGenesExecutor;
import parentage.cluster.ClusterPartitioner;
import parentage.cluster.ClusterTableReader;
import parentage.cluster.ClusteringOracle;
import parentage.cmdline.CommandLineProgram;
import parentage.cmdline.programgroups.GeneAnnotationProgramGroup;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns de novo gene predictions to the projected reference gene they most likely derive from.
 */
@CommandLineProgramProperties(
        summary = AssignParentGenes.USAGE_SUMMARY + AssignParentGenes.USAGE_DETAILS,
        oneLineSummary = AssignParentGenes.USAGE_SUMMARY,
        programGroup = GeneAnnotationProgramGroup.class
)
public class AssignParentGenes extends CommandLineProgram {
    static final String USAGE_SUMMARY = "Assigns de novo transcripts to parent genes from projected reference annotations.  ";
    static final String USAGE_DETAILS = "The unfiltered reference projections and the de novo predictions are clustered by " +
            "exon overlap with UCSC clusterGenes (or a precomputed CLUSTER_TABLE is read).  Within each cluster, a de novo " +
            "transcript overlapping a single filtered reference gene by more than MIN_DISTANCE is assigned to it.  A " +
            "transcript overlapping several genes is rescued when one gene covers it better than every other by at least " +
            "MIN_DISTANCE; it is flagged badAnnotOrTm when all candidate genes overlap each other with a Jaccard index above " +
            "TM_JACCARD_DISTANCE, and ambiguousOrFusion otherwise.  Exon conflicts reported by the clustering remove genes " +
            "joined to the transcript only through a readthrough.  Genes of other well overlapping reference transcripts " +
            "are reported as alternatives." +
            "<h4>Usage example:</h4>" +
            "<pre>" +
            "java -jar parentage.jar AssignParentGenes \\<br />" +
            "      --FILTERED_TRANSMAP filtered.gp \\<br />" +
            "      --UNFILTERED_TRANSMAP unfiltered.gp \\<br />" +
            "      --DENOVO augustus_pb.gp \\<br />" +
            "      --OUTPUT parent_assignments.tsv" +
            "</pre>";

    private final Log log = Log.getInstance(AssignParentGenes.class);

    @Argument(shortName = "F", doc = "Extended genePred of projected reference transcripts that passed filtering.")
    public File FILTERED_TRANSMAP;

    @Argument(shortName = "U", doc = "Extended genePred of all projected reference transcripts, a superset of FILTERED_TRANSMAP.")
    public File UNFILTERED_TRANSMAP;

    @Argument(shortName = "D", doc = "Extended genePred of de novo transcripts.")
    public File DENOVO;

    @Argument(shortName = "O", doc = "The output table of parent gene assignments.")
    public File OUTPUT;

    @Argument(doc = "Precomputed clusterGenes table of UNFILTERED_TRANSMAP and DENOVO, run with -conflicted. " +
            "If not given, clusterGenes is run.", optional = true)
    public File CLUSTER_TABLE;

    @Argument(doc = "The clusterGenes executable.")
    public String CLUSTER_GENES_EXECUTABLE = ClusterGenesExecutor.DEFAULT_EXECUTABLE;

    @Argument(doc = "Minimum fraction of the de novo transcript covered by a gene for it to be assigned, and the minimum " +
            "margin by which the best of several genes must beat the others.")
    public double MIN_DISTANCE = ParentGeneAssigner.DEFAULT_MIN_DISTANCE;

    @Argument(doc = "Jaccard index above which two candidate reference genes are considered the same locus.")
    public double TM_JACCARD_DISTANCE = ParentGeneAssigner.DEFAULT_TM_JACCARD_DISTANCE;

    @Argument(doc = "Whether transcripts must be on the same strand to cluster together.")
    public boolean STRANDED = true;

    @Argument(doc = "Number of threads used to resolve clusters.")
    public int NUM_THREADS = 1;

    @Override
    protected String[] customCommandLineValidation() {
        final List<String> errors = new ArrayList<>();
        if (MIN_DISTANCE < 0 || MIN_DISTANCE > 1) {
            errors.add("MIN_DISTANCE must be between 0 and 1, was " + MIN_DISTANCE);
        }
        if (TM_JACCARD_DISTANCE < 0 || TM_JACCARD_DISTANCE > 1) {
            errors.add("TM_JACCARD_DISTANCE must be between 0 and 1, was " + TM_JACCARD_DISTANCE);
        }
        if (NUM_THREADS < 1) {
            errors.add("NUM_THREADS must be at least 1, was " + NUM_THREADS);
        }
        return errors.isEmpty() ? null : errors.toArray(new String[0]);
    }

    @Override
    protected int doWork() {
        IOUtil.assertFileIsReadable(FILTERED_TRANSMAP);
        IOUtil.assertFileIsReadable(UNFILTERED_TRANSMAP);
        IOUtil.assertFileIsReadable(DENOVO);
        IOUtil.assertFileIsWritable(OUTPUT);
        if (CLUSTER_TABLE != null) IOUtil.assertFileIsReadable(CLUSTER_TABLE);

        final TranscriptIndex transcriptIndex = TranscriptIndex.load(FILTERED_TRANSMAP.toPath(), UNFILTERED_TRANSMAP.toPath(), DENOVO.toPath());

        final Path clusterTable;
        if (CLUSTER_TABLE != null) {
            clusterTable = CLUSTER_TABLE.toPath();
        } else {
            final ClusteringOracle oracle = new ClusterGenesExecutor(CLUSTER_GENES_EXECUTABLE, TMP_DIR.get(0));
            clusterTable = oracle.cluster(UNFILTERED_TRANSMAP.toPath(), DENOVO.toPath(), STRANDED);
        }
        final List<ClusterEntry> entries = new ClusterTableReader(name -> transcriptIndex.contains(TranscriptSource.DENOVO, name))
                .read(clusterTable);
        log.info(String.format("Read %d cluster table rows", entries.size()));

        final List<Cluster> clusters = new ClusterPartitioner(transcriptIndex).partition(entries);
        final List<AssignmentRecord> records = new ParentGeneAssigner(transcriptIndex, MIN_DISTANCE, TM_JACCARD_DISTANCE)
                .assignAll(clusters, NUM_THREADS);

        AssignmentRecordWriter.write(OUTPUT, records);
        logSummary(records);
        return 0;
    }

    private void logSummary(final List<AssignmentRecord> records) {
        int assigned = 0;
        int unassigned = 0;
        final Map<ResolutionMethod, Integer> byMethod = new EnumMap<>(ResolutionMethod.class);
        for (final AssignmentRecord record : records) {
            if (record.getAssignedGene() != null) assigned++;
            else unassigned++;
            if (record.getResolutionMethod() != null) byMethod.merge(record.getResolutionMethod(), 1, Integer::sum);
        }
        log.info(String.format("Wrote %d assignments: %d assigned, %d unassigned", records.size(), assigned, unassigned));
        for (final Map.Entry<ResolutionMethod, Integer> count : byMethod.entrySet()) {
            log.info(String.format("  %s: %d", count.getKey(), count.getValue()));
        }
    }
}
