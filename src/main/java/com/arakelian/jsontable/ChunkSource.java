/*
 * Copyright 2012-2017 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.arakelian.jsontable;

import java.io.IOException;
import java.io.Reader;
import java.util.Iterator;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Supplies the text chunks consumed by a {@link CharReader}.
 */
@FunctionalInterface
public interface ChunkSource {
    /**
     * Pages a large text through a {@link Reader}, {@code pageSize} characters at a time. The
     * reader is consumed lazily and is not closed.
     */
    final class PagedReaderSource implements ChunkSource {
        private final Reader reader;

        private final int pageSize;

        private final char[] page;

        /** 1-based offset of the next page **/
        private long offset = 1;

        private PagedReaderSource(final Reader reader, final int pageSize) {
            this.reader = Preconditions.checkNotNull(reader);
            Preconditions.checkArgument(pageSize > 0, "pageSize must be positive");
            this.pageSize = pageSize;
            this.page = new char[pageSize];
        }

        @Override
        public String nextChunk() throws IOException {
            int length = 0;
            try {
                while (length < pageSize) {
                    final int n = reader.read(page, length, pageSize - length);
                    if (n == -1) {
                        break;
                    }
                    length += n;
                }
            } catch (final IOException e) {
                throw new IOException("Unable to read chunk (offset=" + offset + ", amount=" + pageSize + ")",
                        e);
            }
            if (length == 0) {
                return null;
            }
            offset += length;
            return new String(page, 0, length);
        }
    }

    public static ChunkSource of(final List<String> chunks) {
        final Iterator<String> it = ImmutableList.copyOf(chunks).iterator();
        return () -> it.hasNext() ? it.next() : null;
    }

    public static ChunkSource of(final Reader reader, final int pageSize) {
        return new PagedReaderSource(reader, pageSize);
    }

    public static ChunkSource of(final String text) {
        return of(ImmutableList.of(text));
    }

    /**
     * Returns the next chunk of text, or null when there are no more chunks. Chunks may be empty.
     *
     * @return next chunk of text, or null
     * @throws IOException
     *             if the underlying text cannot be read
     */
    public String nextChunk() throws IOException;
}
