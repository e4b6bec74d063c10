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
import parentage.ParentageException;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Writes assignment records as a tab-separated table with a header line.  Missing values are written as empty fields.
 */
public class AssignmentRecordWriter {
    private static final String COLUMN_DELIMITER = "\t";
    public static final String[] HEADER = {"TranscriptId", "AssignedGeneId", "AlternativeGeneIds", "ResolutionMethod"};

    public static void write(final File output, final List<AssignmentRecord> records) {
        try (final BufferedWriter writer = IOUtil.openFileForBufferedWriting(output)) {
            writer.write(String.join(COLUMN_DELIMITER, HEADER));
            writer.newLine();
            for (final AssignmentRecord record : records) {
                writer.write(String.join(COLUMN_DELIMITER,
                        record.getTranscriptName(),
                        orEmpty(record.getAssignedGene()),
                        orEmpty(record.getAlternativeGeneIds()),
                        record.getResolutionMethod() == null ? "" : record.getResolutionMethod().getLabel()));
                writer.newLine();
            }
        } catch (final IOException e) {
            throw new ParentageException("Could not write assignments to " + output, e);
        }
    }

    private static String orEmpty(final String value) {
        return value == null ? "" : value;
    }
}
