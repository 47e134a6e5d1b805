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
 * Destination of generated JSON or XML text.
 */
public interface JsonSink {
    /**
     * Writes any buffered text to the destination.
     *
     * @throws IOException
     *             if the destination cannot be written
     */
    public void flush() throws IOException;

    /**
     * Discards buffered text and releases any storage owned by this sink.
     */
    public void free();

    public void print(CharSequence text) throws IOException;

    /**
     * Writes the given text followed by a line feed.
     *
     * @param text
     *            text to write; may be null
     * @throws IOException
     *             if the destination cannot be written
     */
    public default void println(final CharSequence text) throws IOException {
        print(text);
        print("\n");
    }
}
