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

import htsjdk.samtools.SAMException;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.ProcessExecutor;
import parentage.ParentageException;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the UCSC {@code clusterGenes} program as the {@link ClusteringOracle}.
 * Blocks until the program is complete.
 */
public class ClusterGenesExecutor implements ClusteringOracle {
    private static final Log LOG = Log.getInstance(ClusterGenesExecutor.class);

    public static final String DEFAULT_EXECUTABLE = "clusterGenes";

    /** Bases of exon overlap ignored when clustering, absorbing noise at adjacent exon boundaries. */
    public static final int IGNORE_BASES = 10;

    private final String executable;
    private final File tmpDir;

    public ClusterGenesExecutor(final String executable, final File tmpDir) {
        this.executable = executable;
        this.tmpDir = tmpDir;
    }

    @Override
    public Path cluster(final Path unfilteredReference, final Path denovo, final boolean stranded) {
        final Path clusterTable;
        try {
            clusterTable = Files.createTempFile(tmpDir.toPath(), "clusterGenes.", ".tsv");
        } catch (final IOException e) {
            throw new ParentageException("Could not create temporary cluster table in " + tmpDir, e);
        }
        IOUtil.deleteOnExit(clusterTable);

        final String[] command = buildCommand(clusterTable, unfilteredReference, denovo, stranded);
        LOG.info(String.format("Clustering transcripts via command: %s", String.join(" ", command)));

        final ProcessExecutor.ExitStatusAndOutput result;
        try {
            result = ProcessExecutor.executeAndReturnInterleavedOutput(command);
        } catch (final SAMException e) {
            throw new ParentageException("Could not execute " + executable, e);
        }
        if (result.exitStatus != 0) {
            throw new ParentageException(String.format("%s exited with status %d: %s", executable, result.exitStatus, result.stdout));
        }
        return clusterTable;
    }

    String[] buildCommand(final Path clusterTable, final Path unfilteredReference, final Path denovo, final boolean stranded) {
        final List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("-ignoreBases=" + IGNORE_BASES);
        command.add("-conflicted");
        if (!stranded) command.add("-ignoreStrand");
        command.add(clusterTable.toAbsolutePath().toString());
        command.add("no");
        command.add(unfilteredReference.toAbsolutePath().toString());
        command.add(denovo.toAbsolutePath().toString());
        return command.toArray(new String[0]);
    }
}
