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

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Parse and output state of one logical session: the table of the most recently parsed document
 * and the single active output. Separate sessions use separate instances.
 */
public class JsonContext implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonContext.class);

    private final JsonParser parser;

    private final JsonValues values = new JsonValues();

    private JsonWriter<?> output;

    public JsonContext() {
        this(new JsonParser());
    }

    public JsonContext(final JsonParser parser) {
        this.parser = Preconditions.checkNotNull(parser);
    }

    /**
     * Releases the parsed values and the active output.
     */
    @Override
    public void close() {
        values.free();
        freeOutput();
    }

    /**
     * Discards the active output, including any text it has not yet written. Does nothing if no
     * output is active.
     */
    public void freeOutput() {
        if (output != null) {
            LOGGER.debug("Freeing output at level {}", output.getLevel());
            output.free();
            output = null;
        }
    }

    /**
     * Returns the text accumulated by the active large text output.
     *
     * @return accumulated text, or null if nothing was written
     * @throws IllegalStateException
     *             if the active output does not write to a large text
     */
    public LargeText getOutput() {
        final JsonSink sink = getWriter().getSink();
        Preconditions.checkState(sink instanceof LargeTextSink, "Output was not initialized for large text");
        return ((LargeTextSink) sink).getValue();
    }

    public JsonParser getParser() {
        return parser;
    }

    public JsonValues getValues() {
        return values;
    }

    /**
     * Returns the active output.
     *
     * @return active output
     * @throws IllegalStateException
     *             if no output was initialized
     */
    public JsonWriter<?> getWriter() {
        Preconditions.checkState(output != null, "Output has not been initialized");
        return output;
    }

    /**
     * Replaces the active output with one that accumulates text in memory. The HTTP header is
     * never written to a large text.
     *
     * @param options
     *            output options
     * @return the new output
     */
    public JsonWriter<LargeTextSink> initializeLargeTextOutput(final OutputOptions options) {
        final OutputOptions noHeader = ImmutableOutputOptions.builder() //
                .from(options) //
                .emitHeader(false) //
                .build();
        final JsonWriter<LargeTextSink> writer = new JsonWriter<>(
                new LargeTextSink(options.getInitialCapacity()), noHeader);
        replaceOutput(writer);
        return writer;
    }

    /**
     * Replaces the active output with one that writes to the given writer, typically an HTTP
     * response.
     *
     * @param writer
     *            destination
     * @param options
     *            output options
     * @return the new output
     */
    public <W extends Writer> JsonWriter<WriterSink<W>> initializeOutput(
            final W writer,
            final OutputOptions options) {
        final JsonWriter<WriterSink<W>> json = new JsonWriter<>(new WriterSink<>(writer), options);
        replaceOutput(json);
        return json;
    }

    public JsonValues parse(final List<String> chunks) throws IOException {
        parser.parse(values, new CharReader(ChunkSource.of(chunks), false));
        return values;
    }

    public JsonValues parse(final Reader reader) throws IOException {
        parser.parse(values, new CharReader(ChunkSource.of(reader, parser.getOptions().getPageSize()), false));
        return values;
    }

    public JsonValues parse(final String json) throws IOException {
        parser.parse(values, CharReader.of(json));
        return values;
    }

    public JsonQuery query() {
        return new JsonQuery(values);
    }

    private void replaceOutput(final JsonWriter<?> writer) {
        freeOutput();
        output = writer;
        LOGGER.debug("Initialized output {}", writer.getSink().getClass().getSimpleName());
    }
}
