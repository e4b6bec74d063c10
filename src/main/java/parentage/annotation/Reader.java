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

import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Interface for receiving records from file as stream. Blank lines and lines starting with '#' are skipped.
 */
public interface Reader<T> {

    String COMMENT_PREFIX = "#";

    Path path();

    Function<String, Optional<T>> lineMapper();

    static <T> Reader<T> of(final Path path, final Function<String, Optional<T>> mapper) {
        return new Reader<T>() {
            @Override
            public Path path() {
                return path;
            }

            @Override
            public Function<String, Optional<T>> lineMapper() {
                return mapper;
            }
        };
    }

    /**
     * The returned stream holds the file open and must be closed by the caller.
     */
    default Stream<T> records() throws IOException {
        return Files.lines(path())
                .filter(line -> !StringUtils.isBlank(line) && !line.startsWith(COMMENT_PREFIX))
                .map(line -> lineMapper().apply(line)
                        .orElseThrow(() -> new AnnotationException(String.format("Unable to produce record from file %s: %s", path(), line))));
    }
}
