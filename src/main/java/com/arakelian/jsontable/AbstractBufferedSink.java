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

/**
 * Sink which accumulates text and hands it to the destination in units of at most
 * {@link #BUFFER_LIMIT} characters.
 */
public abstract class AbstractBufferedSink implements JsonSink {
    /** Largest unit of text handed to the destination at once **/
    public static final int BUFFER_LIMIT = 32767;

    /** pending text **/
    private final StringBuilder buffer = new StringBuilder();

    protected final void clearBuffer() {
        buffer.setLength(0);
    }

    @Override
    public void flush() throws IOException {
        if (buffer.length() != 0) {
            write(buffer);
            buffer.setLength(0);
        }
    }

    @Override
    public void free() {
        buffer.setLength(0);
        buffer.trimToSize();
    }

    /**
     * Returns the number of characters waiting to be written.
     *
     * @return number of characters waiting to be written
     */
    public final int getBufferedLength() {
        return buffer.length();
    }

    /**
     * Returns the text waiting to be written.
     *
     * @return text waiting to be written
     */
    protected final CharSequence getBuffered() {
        return buffer;
    }

    @Override
    public final void print(final CharSequence text) throws IOException {
        final int length = text != null ? text.length() : 0;
        if (length == 0) {
            return;
        }

        if (buffer.length() + length <= BUFFER_LIMIT) {
            buffer.append(text);
            return;
        }

        if (buffer.length() != 0) {
            write(buffer);
            buffer.setLength(0);
        }
        if (length > BUFFER_LIMIT) {
            write(text);
        } else {
            buffer.append(text);
        }
    }

    /**
     * Hands a unit of text to the destination.
     *
     * @param text
     *            text to be written
     * @throws IOException
     *             if the destination cannot be written
     */
    protected abstract void write(CharSequence text) throws IOException;
}
