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
import java.io.StringWriter;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.google.common.base.Strings;

public class WriterSinkTest {
    @Test
    public void testBuffering() throws IOException {
        final StringWriter sw = new StringWriter();
        final WriterSink<StringWriter> sink = new WriterSink<>(sw);
        sink.print("a");
        sink.println("b");
        Assertions.assertEquals("", sw.toString());
        Assertions.assertEquals(3, sink.getBufferedLength());

        sink.flush();
        Assertions.assertEquals("ab\n", sw.toString());
        Assertions.assertEquals(0, sink.getBufferedLength());
        Assertions.assertSame(sw, sink.getWriter());
    }

    @Test
    public void testFree() throws IOException {
        final StringWriter sw = new StringWriter();
        final WriterSink<StringWriter> sink = new WriterSink<>(sw);
        sink.print("discarded");
        sink.free();
        sink.flush();
        Assertions.assertEquals("", sw.toString());
    }

    @Test
    public void testOverflow() throws IOException {
        final StringWriter sw = new StringWriter();
        final WriterSink<StringWriter> sink = new WriterSink<>(sw);
        final String full = Strings.repeat("x", AbstractBufferedSink.BUFFER_LIMIT);
        sink.print(full);
        Assertions.assertEquals("", sw.toString());

        // buffer is written before text that does not fit
        sink.print("y");
        Assertions.assertEquals(full, sw.toString());
        Assertions.assertEquals(1, sink.getBufferedLength());

        // text longer than the buffer is written directly
        final String huge = Strings.repeat("z", AbstractBufferedSink.BUFFER_LIMIT + 1);
        sink.print(huge);
        Assertions.assertEquals(full + "y" + huge, sw.toString());
        Assertions.assertEquals(0, sink.getBufferedLength());

        sink.print(null);
        sink.print("");
        Assertions.assertEquals(0, sink.getBufferedLength());
    }
}
