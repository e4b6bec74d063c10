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

import parentage.ParentageException;

import java.util.Objects;

/**
 * One entry of an exon conflict list: a transcript, named together with the annotation set it came from, whose exons
 * conflict with those of the transcript the list belongs to.
 */
public final class ExonConflict {
    private static final char SEPARATOR = ':';

    private final String source;
    private final String transcriptName;

    public ExonConflict(final String source, final String transcriptName) {
        this.source = source;
        this.transcriptName = Objects.requireNonNull(transcriptName, "transcriptName");
    }

    /**
     * Parses a {@code source:transcriptName} token.  The source may itself contain ':', so the last one separates the two.
     */
    public static ExonConflict parse(final String token) {
        final int separator = token.lastIndexOf(SEPARATOR);
        if (separator < 0 || separator == token.length() - 1) {
            throw new ParentageException("Malformed exon conflict '" + token + "', expected source:transcriptId");
        }
        return new ExonConflict(token.substring(0, separator), token.substring(separator + 1));
    }

    public String getSource() {
        return source;
    }

    public String getTranscriptName() {
        return transcriptName;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final ExonConflict that = (ExonConflict) o;
        return Objects.equals(source, that.source) && transcriptName.equals(that.transcriptName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, transcriptName);
    }

    @Override
    public String toString() {
        return source + SEPARATOR + transcriptName;
    }
}
