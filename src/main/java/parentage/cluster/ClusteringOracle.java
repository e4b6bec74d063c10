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

import java.nio.file.Path;

/**
 * Groups transcripts whose exonic footprints overlap into clusters and reports, per transcript, the clustered
 * transcripts whose exons conflict with its own.
 */
public interface ClusteringOracle {

    /**
     * Clusters the union of the two gene model files.
     *
     * @param unfilteredReference genePred of all projected reference transcripts
     * @param denovo genePred of de novo transcripts
     * @param stranded whether transcripts on opposite strands are kept apart
     * @return a tab-separated cluster table readable by {@link ClusterTableReader}
     * @throws parentage.ParentageException if clustering fails; no partial result is ever returned
     */
    Path cluster(Path unfilteredReference, Path denovo, boolean stranded);
}
