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

import com.google.common.base.Preconditions;

/**
 * Presents a sequence of text chunks as a single stream of characters, tracking line, column and
 * absolute index.
 *
 * In line separated mode, a line break is assumed between two chunks (each chunk is a line of a
 * multi-line source). Otherwise chunks are simply concatenated, as when a large text is paged.
 */
public final class CharReader {
    public static CharReader of(final String text) {
        return new CharReader(ChunkSource.of(text), false);
    }

    /** supplies the chunks **/
    private final ChunkSource source;

    /** true if a line break is implied between chunks **/
    private final boolean lineSeparated;

    /** chunk currently being read **/
    private String chunk;

    /** position of next character in {@link #chunk} **/
    private int pos;

    /** true once the first chunk was fetched **/
    private boolean started;

    /** true if the source has no more chunks **/
    private boolean eof;

    /** characters pushed back; the last one is returned first **/
    private final StringBuilder putback = new StringBuilder();

    private int line = 1;

    private int column;

    private long index;

    public CharReader(final ChunkSource source, final boolean lineSeparated) {
        this.source = Preconditions.checkNotNull(source);
        this.lineSeparated = lineSeparated;
    }

    public int getColumn() {
        return column;
    }

    public long getIndex() {
        return index;
    }

    public int getLine() {
        return line;
    }

    public boolean isLineSeparated() {
        return lineSeparated;
    }

    /**
     * Returns the next character, or -1 at the end of all chunks.
     *
     * @return the next character, or -1 at the end of all chunks
     * @throws IOException
     *             if the next chunk cannot be obtained
     */
    public int read() throws IOException {
        final int ch;
        final int last = putback.length() - 1;
        if (last >= 0) {
            ch = putback.charAt(last);
            putback.setLength(last);
        } else {
            while (chunk == null || pos >= chunk.length()) {
                if (eof) {
                    return -1;
                }
                final String next = source.nextChunk();
                if (next == null) {
                    eof = true;
                    return -1;
                }
                if (started && lineSeparated) {
                    line++;
                    column = 0;
                }
                started = true;
                chunk = next;
                pos = 0;
            }
            ch = chunk.charAt(pos++);
        }

        if (ch == '\n') {
            line++;
            column = 0;
        } else {
            column++;
        }
        index++;
        return ch;
    }

    /**
     * Returns the next character which is not a space, tab, line feed or carriage return, or -1
     * at the end of input.
     *
     * @return the next non-whitespace character, or -1
     * @throws IOException
     *             if the next chunk cannot be obtained
     */
    public int readNonWhitespace() throws IOException {
        for (;;) {
            final int ch = read();
            switch (ch) {
            case ' ':
            case '\t':
            case '\n':
            case '\r':
                break;
            default:
                return ch;
            }
        }
    }

    @Override
    public String toString() {
        return "line " + line + ", col " + column;
    }

    /**
     * Pushes back the character that was just read. Only the most recently read character may be
     * unread; -1 is ignored.
     *
     * @param ch
     *            the character that was just read
     */
    public void unread(final int ch) {
        if (ch == -1) {
            return;
        }
        if (ch == '\n') {
            line--;
            column = 0;
        } else {
            column--;
        }
        index--;
        putback.append((char) ch);
    }
}
