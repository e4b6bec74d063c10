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

import htsjdk.tribble.annotation.Strand;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Class represents one GenePred record. Both the basic ten column layout and the extended
 * layout (score, name2, ...) are accepted; for basic rows the gene name falls back to the transcript name.
 */
public class GenePredRecord {
    private static final String COLUMN_DELIMITER = "\t";
    private static final String COORDINATE_DELIMITER = ",";
    private static final int BASIC_COLUMN_COUNT = 10;
    private static final int NAME2_COLUMN = 11;
    /** genePred rows are always on a known strand. */
    private static final Set<String> STRANDS = new HashSet<>(Arrays.asList("+", "-"));

    /**
     * Name of transcript
     */
    private final String name;
    /**
     * Name of the gene the transcript belongs to
     */
    private final String geneName;
    /**
     * Chromosome name
     */
    private final String chromosomeName;
    /**
     * {@link Strand}
     */
    private final Strand strand;
    /**
     * Transcription start position
     */
    private final int transcriptStart;
    /**
     * Transcription end position
     */
    private final int transcriptEnd;
    /**
     * Number of exons
     */
    private final int exonCount;
    /**
     * Exon start positions, 0-based
     */
    private final int[] exonStarts;
    /**
     * Exon end positions, exclusive
     */
    private final int[] exonEnds;

    public GenePredRecord(String name, String geneName, String chromosomeName, Strand strand, int transcriptStart, int transcriptEnd, int exonCount, int[] exonStarts, int[] exonEnds) {
        this.name = name;
        this.geneName = geneName;
        this.chromosomeName = chromosomeName;
        this.strand = strand;
        this.transcriptStart = transcriptStart;
        this.transcriptEnd = transcriptEnd;
        this.exonCount = exonCount;
        this.exonStarts = exonStarts;
        this.exonEnds = exonEnds;
    }

    /**
     * @return the parsed record, or empty if the line does not have the columns of a genePred row
     */
    public static Optional<GenePredRecord> fromRow(final String line) {
        final String[] fields = line.split(COLUMN_DELIMITER);
        if (fields.length < BASIC_COLUMN_COUNT) {
            return Optional.empty();
        }
        if (!STRANDS.contains(fields[2])) {
            return Optional.empty();
        }
        try {
            final String name = fields[0];
            final String chromosomeName = fields[1];
            final Strand strand = Strand.decode(fields[2]);
            final int txStart = Integer.parseInt(fields[3]);
            final int txEnd = Integer.parseInt(fields[4]);
            final int exonCount = Integer.parseInt(fields[7]);
            final int[] exonStarts = Arrays.stream(fields[8].split(COORDINATE_DELIMITER))
                    .mapToInt(Integer::parseInt)
                    .toArray();
            final int[] exonEnds = Arrays.stream(fields[9].split(COORDINATE_DELIMITER))
                    .mapToInt(Integer::parseInt)
                    .toArray();
            if (exonStarts.length != exonCount || exonEnds.length != exonCount) {
                return Optional.empty();
            }
            final String geneName = fields.length > NAME2_COLUMN ? fields[NAME2_COLUMN] : name;
            return Optional.of(
                    new GenePredRecord(name, geneName, chromosomeName, strand, txStart, txEnd, exonCount, exonStarts, exonEnds)
            );
        } catch (final IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public String name() {
        return name;
    }

    public String geneName() {
        return geneName;
    }

    public String chromosomeName() {
        return chromosomeName;
    }

    public int exonCount() {
        return exonCount;
    }

    public IntStream exonStarts() {
        return Arrays.stream(exonStarts);
    }

    public IntStream exonEnds() {
        return Arrays.stream(exonEnds);
    }

    public int transcriptStart() {
        return transcriptStart;
    }

    public int transcriptEnd() {
        return transcriptEnd;
    }

    public Strand strand() {
        return strand;
    }
}
