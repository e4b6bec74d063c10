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

import java.util.Objects;

/**
 * Outcome of resolving a de novo transcript against its candidate genes.  Either field may be null; see
 * {@link AssignmentRecord} for the meaning of each combination.
 */
public final class GeneResolution {
    private static final GeneResolution UNASSIGNED = new GeneResolution(null, null);

    private final String assignedGene;
    private final ResolutionMethod method;

    private GeneResolution(final String assignedGene, final ResolutionMethod method) {
        this.assignedGene = assignedGene;
        this.method = method;
    }

    public static GeneResolution unassigned() {
        return UNASSIGNED;
    }

    public static GeneResolution unassigned(final ResolutionMethod method) {
        return new GeneResolution(null, method);
    }

    public static GeneResolution assigned(final String gene) {
        return new GeneResolution(Objects.requireNonNull(gene), null);
    }

    public static GeneResolution rescued(final String gene) {
        return new GeneResolution(Objects.requireNonNull(gene), ResolutionMethod.RESCUED);
    }

    /** @return the assigned gene, or null */
    public String getAssignedGene() {
        return assignedGene;
    }

    /** @return the resolution method, or null */
    public ResolutionMethod getMethod() {
        return method;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final GeneResolution that = (GeneResolution) o;
        return Objects.equals(assignedGene, that.assignedGene) && method == that.method;
    }

    @Override
    public int hashCode() {
        return Objects.hash(assignedGene, method);
    }

    @Override
    public String toString() {
        return "(" + assignedGene + ", " + method + ")";
    }
}
