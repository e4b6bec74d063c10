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

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The parent gene decision for one de novo transcript.
 *
 * <ul>
 *     <li>assigned gene, no method: the transcript matched a single gene.</li>
 *     <li>assigned gene, {@link ResolutionMethod#RESCUED}: chosen among several genes by a clear margin.</li>
 *     <li>no gene, a method: several genes and no safe choice.</li>
 *     <li>no gene, no method, no alternatives: a putative novel locus.</li>
 * </ul>
 */
public final class AssignmentRecord {
    private static final String ALTERNATIVE_DELIMITER = ",";

    private final String transcriptName;
    private final String assignedGene;
    private final SortedSet<String> alternativeGenes;
    private final ResolutionMethod resolutionMethod;

    public AssignmentRecord(final String transcriptName, final String assignedGene,
                            final Collection<String> alternativeGenes, final ResolutionMethod resolutionMethod) {
        this.transcriptName = Objects.requireNonNull(transcriptName);
        this.assignedGene = assignedGene;
        this.alternativeGenes = Collections.unmodifiableSortedSet(new TreeSet<>(alternativeGenes));
        this.resolutionMethod = resolutionMethod;
    }

    public String getTranscriptName() {
        return transcriptName;
    }

    /** @return the assigned gene, or null */
    public String getAssignedGene() {
        return assignedGene;
    }

    /** @return the sorted, comma-joined alternative genes, or null if there are none */
    public String getAlternativeGeneIds() {
        return alternativeGenes.isEmpty() ? null : String.join(ALTERNATIVE_DELIMITER, alternativeGenes);
    }

    /** @return the resolution method, or null */
    public ResolutionMethod getResolutionMethod() {
        return resolutionMethod;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final AssignmentRecord that = (AssignmentRecord) o;
        return transcriptName.equals(that.transcriptName)
                && Objects.equals(assignedGene, that.assignedGene)
                && alternativeGenes.equals(that.alternativeGenes)
                && resolutionMethod == that.resolutionMethod;
    }

    @Override
    public int hashCode() {
        return Objects.hash(transcriptName, assignedGene, alternativeGenes, resolutionMethod);
    }

    @Override
    public String toString() {
        return transcriptName + "\t" + assignedGene + "\t" + getAlternativeGeneIds() + "\t" + resolutionMethod;
    }
}
