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
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;
import parentage.cmdline.CommandLineProgramTest;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class AssignParentGenesTest extends CommandLineProgramTest {
    private static final File TEST_DATA_DIR = new File("testdata/parentage/assignment");
    private static final File FILTERED = new File(TEST_DATA_DIR, "filtered.gp");
    private static final File UNFILTERED = new File(TEST_DATA_DIR, "unfiltered.gp");
    private static final File DENOVO = new File(TEST_DATA_DIR, "denovo.gp");
    private static final File CLUSTER_TABLE = new File(TEST_DATA_DIR, "clusters.tsv");
    private static final File EXPECTED = new File(TEST_DATA_DIR, "expected_assignments.tsv");

    @Override
    public String getCommandLineProgramName() {
        return AssignParentGenes.class.getSimpleName();
    }

    private List<String> baseArgs(final File output) {
        return new ArrayList<>(Arrays.asList(
                "--FILTERED_TRANSMAP", FILTERED.getAbsolutePath(),
                "--UNFILTERED_TRANSMAP", UNFILTERED.getAbsolutePath(),
                "--DENOVO", DENOVO.getAbsolutePath(),
                "--OUTPUT", output.getAbsolutePath()));
    }

    @DataProvider(name = "threads")
    public Object[][] threads() {
        return new Object[][]{{1}, {4}};
    }

    @Test(dataProvider = "threads")
    public void testWithClusterTable(final int threads) throws IOException {
        final File output = getTempOutputFile("assignments", ".tsv");
        final List<String> args = baseArgs(output);
        args.addAll(Arrays.asList("--CLUSTER_TABLE", CLUSTER_TABLE.getAbsolutePath(), "--NUM_THREADS", String.valueOf(threads)));

        Assert.assertEquals(runParentageCommandLine(args), 0);
        IOUtil.assertFilesEqual(output, EXPECTED);
    }

    @Test
    public void testWithClusterGenesExecutable() throws IOException {
        final File script = getTempOutputFile("fakeClusterGenes", ".sh");
        Files.write(script.toPath(), Arrays.asList("#!/bin/sh", "cp '" + CLUSTER_TABLE.getAbsolutePath() + "' \"$3\""),
                StandardCharsets.UTF_8);
        Assert.assertTrue(script.setExecutable(true));

        final File output = getTempOutputFile("assignments", ".tsv");
        final List<String> args = baseArgs(output);
        args.addAll(Arrays.asList("--CLUSTER_GENES_EXECUTABLE", script.getAbsolutePath()));

        Assert.assertEquals(runParentageCommandLine(args), 0);
        IOUtil.assertFilesEqual(output, EXPECTED);
    }

    @Test
    public void testStricterMinDistanceDropsWeakAssignments() throws IOException {
        final File output = getTempOutputFile("assignments", ".tsv");
        final List<String> args = baseArgs(output);
        args.addAll(Arrays.asList("--CLUSTER_TABLE", CLUSTER_TABLE.getAbsolutePath(), "--MIN_DISTANCE", "0.85"));

        Assert.assertEquals(runParentageCommandLine(args), 0);
        final List<String> lines = Files.readAllLines(output.toPath(), StandardCharsets.UTF_8);
        Assert.assertEquals(lines.get(0), String.join("\t", AssignmentRecordWriter.HEADER));
        // D1 is covered 0.9 by GA; D5 only 0.8 by GM
        Assert.assertEquals(lines.get(1), "D1\tGA\t\t");
        Assert.assertEquals(lines.get(5), "D5\t\t\t");
        Assert.assertEquals(lines.size(), 8);
    }

    @DataProvider(name = "invalidArguments")
    public Object[][] invalidArguments() {
        return new Object[][]{
                {"--MIN_DISTANCE", "1.5"},
                {"--TM_JACCARD_DISTANCE", "-0.1"},
                {"--NUM_THREADS", "0"},
        };
    }

    @Test(dataProvider = "invalidArguments")
    public void testInvalidArguments(final String name, final String value) throws IOException {
        final File output = getTempOutputFile("assignments", ".tsv");
        final List<String> args = baseArgs(output);
        args.addAll(Arrays.asList("--CLUSTER_TABLE", CLUSTER_TABLE.getAbsolutePath(), name, value));
        Assert.assertEquals(runParentageCommandLine(args), 1);
    }

    @Test
    public void testMissingRequiredArgument() {
        Assert.assertEquals(runParentageCommandLine(Arrays.asList("--DENOVO", DENOVO.getAbsolutePath())), 1);
    }
}
