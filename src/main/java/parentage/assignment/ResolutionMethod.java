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

/**
 * How an assignment that needed disambiguation between several candidate genes was decided.
 */
public enum ResolutionMethod {
    /** One candidate gene is supported by a clear margin over every other. */
    RESCUED("rescued"),
    /** The candidate genes overlap each other too much to be told apart; an annotation or projection problem. */
    BAD_ANNOT_OR_TM("badAnnotOrTm"),
    /** No candidate gene is clearly best; possibly a gene fusion. */
    AMBIGUOUS_OR_FUSION("ambiguousOrFusion");

    private final String label;

    ResolutionMethod(final String label) {
        this.label = label;
    }

    /** The name written to assignment tables. */
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
