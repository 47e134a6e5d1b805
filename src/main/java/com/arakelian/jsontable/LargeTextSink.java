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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Buffered sink which accumulates its output into a {@link LargeText}. Storage for the large text
 * is only allocated once the buffer overflows or the value is requested, so short outputs can be
 * obtained cheaply with {@link #getValueIfSmall()}.
 */
public class LargeTextSink extends AbstractBufferedSink {
    private static final Logger LOGGER = LoggerFactory.getLogger(LargeTextSink.class);

    private final int initialCapacity;

    /** allocated on first write **/
    private StringBuilder text;

    private LargeText value;

    public LargeTextSink() {
        this(BUFFER_LIMIT);
    }

    public LargeTextSink(final int initialCapacity) {
        this.initialCapacity = initialCapacity;
    }

    @Override
    public void flush() {
        if (getBufferedLength() != 0) {
            write(getBuffered());
            clearBuffer();
        }
    }

    @Override
    public void free() {
        super.free();
        if (value != null) {
            value.free();
            value = null;
        }
        text = null;
    }

    /**
     * Flushes pending output and returns the accumulated large text, or null if nothing was ever
     * written.
     *
     * @return the accumulated large text, or null
     */
    public LargeText getValue() {
        flush();
        if (text == null) {
            return null;
        }
        if (value == null) {
            value = new LargeText(text);
        }
        return value;
    }

    /**
     * Returns the pending output if it has never overflowed into a large text, otherwise null.
     *
     * @return pending output if it fits in the buffer, otherwise null
     */
    public String getValueIfSmall() {
        return text == null ? getBuffered().toString() : null;
    }

    public boolean isAllocated() {
        return text != null;
    }

    @Override
    protected void write(final CharSequence chunk) {
        if (text == null) {
            text = new StringBuilder(Math.max(initialCapacity, chunk.length()));
            LOGGER.trace("Allocated large text (capacity={})", text.capacity());
        }
        text.append(chunk);
    }
}
