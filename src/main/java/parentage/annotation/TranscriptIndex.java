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

import htsjdk.samtools.util.Log;
import parentage.ParentageException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Read-only lookup of transcripts by name, partitioned by {@link TranscriptSource}.  Safe for concurrent reads once
 * constructed.
 */
public class TranscriptIndex {
    private static final Log log = Log.getInstance(TranscriptIndex.class);

    private final Map<TranscriptSource, Map<String, Transcript>> transcriptsBySource = new EnumMap<>(TranscriptSource.class);

    public TranscriptIndex(final Collection<Transcript> filteredReference,
                           final Collection<Transcript> unfilteredReference,
                           final Collection<Transcript> denovo) {
        transcriptsBySource.put(TranscriptSource.FILTERED_REFERENCE, index(filteredReference, TranscriptSource.FILTERED_REFERENCE));
        transcriptsBySource.put(TranscriptSource.UNFILTERED_REFERENCE, index(unfilteredReference, TranscriptSource.UNFILTERED_REFERENCE));
        transcriptsBySource.put(TranscriptSource.DENOVO, index(denovo, TranscriptSource.DENOVO));
    }

    /**
     * Loads the three genePred files into an index.
     */
    public static TranscriptIndex load(final Path filteredReference, final Path unfilteredReference, final Path denovo) {
        final TranscriptIndex transcriptIndex = new TranscriptIndex(
                read(filteredReference, TranscriptSource.FILTERED_REFERENCE),
                read(unfilteredReference, TranscriptSource.UNFILTERED_REFERENCE),
                read(denovo, TranscriptSource.DENOVO));
        for (final TranscriptSource source : TranscriptSource.values()) {
            log.info(String.format("Loaded %d %s transcripts", transcriptIndex.size(source), source));
        }
        return transcriptIndex;
    }

    private static Collection<Transcript> read(final Path path, final TranscriptSource source) {
        try (final Stream<GenePredRecord> records = Reader.of(path, GenePredRecord::fromRow).records()) {
            return records.map(record -> Transcript.fromGenePred(record, source)).collect(Collectors.toList());
        } catch (final IOException e) {
            throw new ParentageException("Could not read gene models from " + path, e);
        }
    }

    private static Map<String, Transcript> index(final Collection<Transcript> transcripts, final TranscriptSource source) {
        final Map<String, Transcript> byName = new LinkedHashMap<>();
        for (final Transcript transcript : transcripts) {
            if (byName.put(transcript.getName(), transcript) != null) {
                throw new AnnotationException("Transcript " + transcript.getName() + " appears more than once in the " + source + " set");
            }
        }
        return Collections.unmodifiableMap(byName);
    }

    public boolean contains(final TranscriptSource source, final String name) {
        return transcriptsBySource.get(source).containsKey(name);
    }

    /**
     * @return the transcript, or null if the source holds no transcript of that name
     */
    public Transcript get(final TranscriptSource source, final String name) {
        return transcriptsBySource.get(source).get(name);
    }

    /**
     * @throws ParentageException if the source holds no transcript of that name
     */
    public Transcript require(final TranscriptSource source, final String name) {
        final Transcript transcript = get(source, name);
        if (transcript == null) {
            throw new ParentageException(String.format("Transcript %s is not present in the %s transcripts", name, source));
        }
        return transcript;
    }

    public int size(final TranscriptSource source) {
        return transcriptsBySource.get(source).size();
    }
}
