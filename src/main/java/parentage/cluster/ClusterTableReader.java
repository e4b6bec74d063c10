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

import htsjdk.samtools.util.IOUtil;
import org.apache.commons.lang3.StringUtils;
import parentage.ParentageException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Parses the tab-separated cluster table written by the clustering oracle.  Columns are located by header label:
 * {@value #CLUSTER_COLUMN} and {@value #TRANSCRIPT_COLUMN} are required, {@value #EXON_CONFLICTS_COLUMN} is optional.
 * Any row that cannot be parsed makes the whole table unusable.
 */
public class ClusterTableReader {
    public static final String CLUSTER_COLUMN = "#cluster";
    public static final String TRANSCRIPT_COLUMN = "gene";
    public static final String EXON_CONFLICTS_COLUMN = "exonConflicts";

    private static final String COLUMN_DELIMITER = "\t";
    private static final String CONFLICT_DELIMITER = ",";

    private final Predicate<String> isDenovo;

    /**
     * @param isDenovo decides from a transcript name whether the row belongs to a de novo transcript
     */
    public ClusterTableReader(final Predicate<String> isDenovo) {
        this.isDenovo = isDenovo;
    }

    public List<ClusterEntry> read(final Path clusterTable) {
        IOUtil.assertFileIsReadable(clusterTable);
        try (final BufferedReader reader = IOUtil.openFileForBufferedReading(clusterTable)) {
            final String headerLine = reader.readLine();
            if (headerLine == null) {
                throw new ParentageException("No header line found in cluster table " + clusterTable);
            }
            final Map<String, Integer> columnLabelIndices = new HashMap<>();
            final String[] columnLabels = headerLine.split(COLUMN_DELIMITER, -1);
            for (int i = 0; i < columnLabels.length; ++i) {
                columnLabelIndices.put(columnLabels[i], i);
            }
            final int clusterIndex = requireColumn(columnLabelIndices, CLUSTER_COLUMN, clusterTable);
            final int transcriptIndex = requireColumn(columnLabelIndices, TRANSCRIPT_COLUMN, clusterTable);
            final Integer conflictsIndex = columnLabelIndices.get(EXON_CONFLICTS_COLUMN);

            final List<ClusterEntry> entries = new ArrayList<>();
            int lineNumber = 1;
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (StringUtils.isBlank(line)) continue;
                final String[] fields = line.split(COLUMN_DELIMITER, -1);
                if (fields.length != columnLabels.length) {
                    throw new ParentageException(String.format("Line %d of %s has %d fields, expected %d",
                            lineNumber, clusterTable, fields.length, columnLabels.length));
                }
                final int clusterId;
                try {
                    clusterId = Integer.parseInt(fields[clusterIndex]);
                } catch (final NumberFormatException e) {
                    throw new ParentageException(String.format("Line %d of %s has a non-numeric cluster id '%s'",
                            lineNumber, clusterTable, fields[clusterIndex]), e);
                }
                final String transcriptName = fields[transcriptIndex];
                final List<ExonConflict> conflicts = conflictsIndex == null ?
                        Collections.emptyList() : parseConflicts(fields[conflictsIndex]);
                entries.add(new ClusterEntry(clusterId, transcriptName, isDenovo.test(transcriptName), conflicts));
            }
            return entries;
        } catch (final IOException e) {
            throw new ParentageException("Could not read cluster table " + clusterTable, e);
        }
    }

    /**
     * Splits a comma-separated conflict list.  Empty tokens, including the one after a trailing comma, are dropped.
     */
    static List<ExonConflict> parseConflicts(final String field) {
        final List<ExonConflict> conflicts = new ArrayList<>();
        if (StringUtils.isBlank(field)) return conflicts;
        for (final String token : field.split(CONFLICT_DELIMITER)) {
            final String trimmed = token.trim();
            if (!trimmed.isEmpty()) conflicts.add(ExonConflict.parse(trimmed));
        }
        return conflicts;
    }

    private static int requireColumn(final Map<String, Integer> columnLabelIndices, final String label, final Path clusterTable) {
        final Integer index = columnLabelIndices.get(label);
        if (index == null) {
            throw new ParentageException(String.format("Column %s not found in cluster table %s", label, clusterTable));
        }
        return index;
    }
}
