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

import com.google.common.base.Preconditions;
import com.google.common.io.CharSource;

/**
 * Owned handle to a large text value. Once {@link #free()} is called the text may no longer be
 * used.
 */
public final class LargeText {
    public static LargeText of(final CharSequence text) {
        return new LargeText(new StringBuilder(Preconditions.checkNotNull(text)));
    }

    /** null once freed **/
    private CharSequence content;

    LargeText(final CharSequence content) {
        this.content = Preconditions.checkNotNull(content);
    }

    public CharSource asCharSource() {
        return CharSource.wrap(content());
    }

    private CharSequence content() {
        Preconditions.checkState(content != null, "Large text has been freed");
        return content;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof LargeText)) {
            return false;
        }
        final LargeText other = (LargeText) obj;
        if (content == null || other.content == null) {
            return false;
        }
        return content.toString().contentEquals(other.content);
    }

    public void free() {
        content = null;
    }

    @Override
    public int hashCode() {
        return content != null ? content.toString().hashCode() : 0;
    }

    public boolean isFreed() {
        return content == null;
    }

    public int length() {
        return content().length();
    }

    public Reader openReader() throws IOException {
        return asCharSource().openStream();
    }

    /**
     * Returns up to {@code amount} characters starting at the zero-based {@code offset}.
     *
     * @param offset
     *            zero-based offset of first character
     * @param amount
     *            maximum number of characters
     * @return the requested characters; empty if offset is beyond the end
     */
    public String substring(final int offset, final int amount) {
        final CharSequence text = content();
        Preconditions.checkArgument(offset >= 0 && amount >= 0, "offset and amount must be non-negative");
        final int start = Math.min(offset, text.length());
        final int end = (int) Math.min((long) start + amount, text.length());
        return text.subSequence(start, end).toString();
    }

    @Override
    public String toString() {
        return content().toString();
    }
}
