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
import java.io.Writer;

import com.google.common.base.Preconditions;

/**
 * Buffered sink which writes to a response or console {@link Writer}. If the caller also writes
 * to the underlying writer directly, {@link #flush()} must be called first.
 */
public class WriterSink<W extends Writer> extends AbstractBufferedSink {
    private final W writer;

    public WriterSink(final W writer) {
        this.writer = Preconditions.checkNotNull(writer);
    }

    @Override
    public void flush() throws IOException {
        super.flush();
        writer.flush();
    }

    public final W getWriter() {
        return writer;
    }

    @Override
    protected void write(final CharSequence text) throws IOException {
        writer.append(text);
    }
}
