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
package parentage.annotation;

import org.testng.Assert;
import org.testng.annotations.Test;
import parentage.ParentageException;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static parentage.annotation.TranscriptTestUtils.denovo;
import static parentage.annotation.TranscriptTestUtils.filtered;

public class TranscriptIndexTest {
    private static final File TEST_DATA_DIR = new File("testdata/parentage/assignment");

    @Test
    public void testLoad() {
        final TranscriptIndex index = TranscriptIndex.load(
                new File(TEST_DATA_DIR, "filtered.gp").toPath(),
                new File(TEST_DATA_DIR, "unfiltered.gp").toPath(),
                new File(TEST_DATA_DIR, "denovo.gp").toPath());

        Assert.assertEquals(index.size(TranscriptSource.FILTERED_REFERENCE), 11);
        Assert.assertEquals(index.size(TranscriptSource.UNFILTERED_REFERENCE), 15);
        Assert.assertEquals(index.size(TranscriptSource.DENOVO), 7);

        Assert.assertTrue(index.contains(TranscriptSource.UNFILTERED_REFERENCE, "E1"));
        Assert.assertFalse(index.contains(TranscriptSource.FILTERED_REFERENCE, "E1"));
        Assert.assertEquals(index.get(TranscriptSource.FILTERED_REFERENCE, "C1").getGeneName(), "GC");
        Assert.assertEquals(index.get(TranscriptSource.FILTERED_REFERENCE, "C1").getExons().size(), 2);
        Assert.assertNull(index.get(TranscriptSource.DENOVO, "A1"));
    }

    @Test(expectedExceptions = ParentageException.class)
    public void testRequireMissing() {
        final TranscriptIndex index = new TranscriptIndex(Collections.emptyList(), Collections.emptyList(),
                Collections.singletonList(denovo("D1", 0, 100)));
        index.require(TranscriptSource.DENOVO, "D2");
    }

    @Test(expectedExceptions = AnnotationException.class)
    public void testDuplicateName() {
        new TranscriptIndex(Arrays.asList(filtered("T1", "G1", 0, 10), filtered("T1", "G2", 0, 10)),
                Collections.emptyList(), Collections.emptyList());
    }

    @Test(expectedExceptions = AnnotationException.class)
    public void testMalformedFile() throws IOException {
        final Path bad = Files.createTempFile("malformed", ".gp");
        bad.toFile().deleteOnExit();
        Files.write(bad, Collections.singletonList("T1\tchr1\t+\t0\tten"), StandardCharsets.UTF_8);
        TranscriptIndex.load(bad, bad, bad);
    }

    @Test
    public void testCommentsAndBlankLinesAreSkipped() throws IOException {
        final Path genePred = Files.createTempFile("commented", ".gp");
        genePred.toFile().deleteOnExit();
        Files.write(genePred, Arrays.asList("# a comment", "", "T1\tchr1\t+\t0\t10\t0\t10\t1\t0,\t10,\t0\tG1"), StandardCharsets.UTF_8);
        final TranscriptIndex index = TranscriptIndex.load(genePred, genePred, genePred);
        Assert.assertEquals(index.size(TranscriptSource.DENOVO), 1);
    }
}
