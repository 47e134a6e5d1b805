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
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Node;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * Streaming JSON writer. Objects and arrays are opened and closed explicitly, and every value is
 * written to the {@link JsonSink} as soon as it is given, one value per line.
 *
 * Commas are inserted automatically. With a non-zero indent, each line at nesting level
 * {@code L} is padded to {@code L * indent} characters and a separating comma occupies the last
 * position of the padding.
 */
public class JsonWriter<S extends JsonSink> implements Closeable {
    private static enum Nesting {
        OPENED_ARRAY, OPENED_OBJECT, IN_ARRAY, IN_OBJECT;

        public boolean hasData() {
            return this == IN_ARRAY || this == IN_OBJECT;
        }

        public boolean isObject() {
            return this == OPENED_OBJECT || this == IN_OBJECT;
        }

        public Nesting written() {
            switch (this) {
            case OPENED_ARRAY:
                return IN_ARRAY;
            case OPENED_OBJECT:
                return IN_OBJECT;
            default:
                return this;
            }
        }
    }

    /** Strings longer than this are escaped and written in pieces of this size **/
    public static final int CHUNK_SIZE = 5460;

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonWriter.class);

    private static final OutputOptions NO_HEADER = ImmutableOutputOptions.builder() //
            .emitHeader(false) //
            .build();

    private final S sink;

    private final OutputOptions options;

    private Nesting[] nesting = new Nesting[32];

    private int level;

    /** True until the HTTP header was written **/
    private boolean headerPending;

    /** Placeholder values of row set links **/
    private final Links links = new Links();

    /**
     * Creates a writer without HTTP header and without indent.
     *
     * @param sink
     *            destination of the output
     */
    public JsonWriter(final S sink) {
        this(sink, NO_HEADER);
    }

    public JsonWriter(final S sink, final OutputOptions options) {
        this.sink = Preconditions.checkNotNull(sink);
        this.options = Preconditions.checkNotNull(options);
        this.headerPending = options.isEmitHeader();
    }

    private void checkOpen() {
        if (level == 0) {
            throw new IllegalStateException("No object or array is open");
        }
    }

    /**
     * Flushes the sink. Open objects and arrays are left open.
     */
    @Override
    public void close() throws IOException {
        sink.flush();
    }

    /**
     * Closes every open object and array, innermost first, and flushes the sink.
     *
     * @return this writer
     * @throws IOException
     *             if the sink cannot be written
     */
    public JsonWriter<S> closeAll() throws IOException {
        if (level != 0) {
            LOGGER.debug("Closing {} open level(s)", level);
        }
        while (level > 0) {
            final Nesting current = nesting[--level];
            sink.println(getIndent(false) + (current.isObject() ? "}" : "]"));
        }
        sink.flush();
        return this;
    }

    public JsonWriter<S> closeArray() throws IOException {
        return close(false);
    }

    private JsonWriter<S> close(final boolean object) throws IOException {
        if (level == 0 || nesting[level - 1].isObject() != object) {
            throw new IllegalStateException(
                    (object ? "closeObject" : "closeArray") + "() does not match the innermost open "
                            + (level == 0 ? "value" : nesting[level - 1].isObject() ? "object" : "array"));
        }
        level--;
        sink.println(getIndent(false) + (object ? "}" : "]"));
        if (level == 0) {
            sink.flush();
        }
        return this;
    }

    public JsonWriter<S> closeObject() throws IOException {
        return close(true);
    }

    private void dataWritten() {
        if (level > 0) {
            nesting[level - 1] = nesting[level - 1].written();
        }
    }

    private void finishLargeText(final LargeText value) throws IOException {
        for (int offset = 0, length = value.length(); offset < length; offset += CHUNK_SIZE) {
            sink.print(JsonStrings.escape(value.substring(offset, CHUNK_SIZE)));
        }
        sink.println("\"");
        dataWritten();
    }

    private void finishLongString(final String value) throws IOException {
        for (int offset = 0, length = value.length(); offset < length; offset += CHUNK_SIZE) {
            final StringBuilder buf = new StringBuilder(CHUNK_SIZE + 16);
            JsonStrings.escape(value, offset, Math.min(length, offset + CHUNK_SIZE), buf);
            sink.print(buf);
        }
        sink.println("\"");
        dataWritten();
    }

    public JsonWriter<S> flush() throws IOException {
        sink.flush();
        return this;
    }

    /**
     * Discards the nesting state and link placeholders and frees the sink.
     */
    public void free() {
        level = 0;
        links.clear();
        sink.free();
    }

    private String getIndent(final boolean comma) {
        if (level == 0) {
            return "";
        }
        final boolean separate = comma && nesting[level - 1].hasData();
        final int indent = options.getIndent();
        if (indent > 0) {
            final String pad = Strings.repeat(" ", level * indent);
            return separate ? pad.substring(1) + "," : pad;
        }
        return separate ? "," : "";
    }

    public int getLevel() {
        return level;
    }

    Links getLinks() {
        return links;
    }

    public OutputOptions getOptions() {
        return options;
    }

    public S getSink() {
        return sink;
    }

    private void increaseNesting(final Nesting value) throws IOException {
        if (level > 0) {
            dataWritten();
        } else if (headerPending) {
            headerPending = false;
            writeHeader();
        }
        if (level == nesting.length) {
            nesting = Arrays.copyOf(nesting, level * 2);
        }
        nesting[level++] = value;
    }

    public JsonWriter<S> openArray() throws IOException {
        return openArray(null);
    }

    public JsonWriter<S> openArray(@Nullable final String name) throws IOException {
        final String indent = getIndent(true);
        increaseNesting(Nesting.OPENED_ARRAY);
        sink.println(indent + (name != null ? JsonStrings.stringify(name) + ":[" : "["));
        return this;
    }

    public JsonWriter<S> openObject() throws IOException {
        return openObject(null);
    }

    public JsonWriter<S> openObject(@Nullable final String name) throws IOException {
        final String indent = getIndent(true);
        increaseNesting(Nesting.OPENED_OBJECT);
        sink.println(indent + (name != null ? JsonStrings.stringify(name) + ":{" : "{"));
        return this;
    }

    public JsonWriter<S> write(final Boolean value) throws IOException {
        return writeRaw(JsonStrings.stringify(value));
    }

    public JsonWriter<S> write(final Instant value) throws IOException {
        return write(value, JsonStrings.TIMESTAMP_FORMAT);
    }

    public JsonWriter<S> write(final Instant value, final DateTimeFormatter format) throws IOException {
        return writeRaw(JsonStrings.stringify(value != null ? value.atOffset(ZoneOffset.UTC) : null, format));
    }

    /**
     * Writes a subtree of a value table. Object members are written in document order; null
     * values are written as {@code null}.
     *
     * @param values
     *            value table
     * @param path
     *            path of the subtree, possibly containing placeholders
     * @param args
     *            placeholder arguments
     * @return this writer
     * @throws IOException
     *             if the sink cannot be written
     */
    public JsonWriter<S> write(final JsonValues values, final String path, final Object... args)
            throws IOException {
        writeValue(null, values, PathFormat.format(path, args));
        return this;
    }

    /**
     * Writes a large text as a string, escaped in pieces of {@link #CHUNK_SIZE} characters.
     *
     * @param value
     *            large text; may be null
     * @return this writer
     * @throws IOException
     *             if the sink cannot be written
     */
    public JsonWriter<S> write(final LargeText value) throws IOException {
        if (value == null) {
            return writeRaw("null");
        }
        writeRaw("\"", false);
        finishLargeText(value);
        return this;
    }

    public JsonWriter<S> write(final LocalDate value) throws IOException {
        return write(value, JsonStrings.DATE_FORMAT);
    }

    public JsonWriter<S> write(final LocalDate value, final DateTimeFormatter format) throws IOException {
        return writeRaw(JsonStrings.stringify(value != null ? value.atStartOfDay() : null, format));
    }

    public JsonWriter<S> write(final LocalDateTime value) throws IOException {
        return write(value, JsonStrings.TIMESTAMP_FORMAT);
    }

    public JsonWriter<S> write(final LocalDateTime value, final DateTimeFormatter format) throws IOException {
        return writeRaw(JsonStrings.stringify(value, format));
    }

    /**
     * Writes structured markup converted to JSON.
     *
     * @param node
     *            document or element; may be null
     * @return this writer
     * @throws IOException
     *             if the markup cannot be converted or the sink cannot be written
     * @see XmlToJson
     */
    public JsonWriter<S> write(final Node node) throws IOException {
        if (node == null) {
            return writeRaw("null");
        }
        checkOpen();
        sink.print(getIndent(true));
        writeXml(node);
        return this;
    }

    public JsonWriter<S> write(final Number value) throws IOException {
        return writeRaw(JsonStrings.stringify(value));
    }

    public JsonWriter<S> write(final OffsetDateTime value) throws IOException {
        return write(value, JsonStrings.TIMESTAMP_TZ_FORMAT);
    }

    public JsonWriter<S> write(final OffsetDateTime value, final DateTimeFormatter format) throws IOException {
        return writeRaw(JsonStrings.stringify(value, format));
    }

    /**
     * Writes the rows of a result set as an array of objects.
     *
     * @param rows
     *            result set, positioned before the first row
     * @return this writer
     * @throws IOException
     *             if the sink cannot be written
     * @throws SQLException
     *             if the result set cannot be read
     * @see RowSetWriter
     */
    public JsonWriter<S> write(final ResultSet rows) throws IOException, SQLException {
        new RowSetWriter(this).write(null, rows, null);
        return this;
    }

    public JsonWriter<S> write(final String value) throws IOException {
        if (value != null && value.length() > CHUNK_SIZE) {
            writeRaw("\"", false);
            finishLongString(value);
            return this;
        }
        return writeRaw(JsonStrings.stringify(value));
    }

    public JsonWriter<S> write(final String name, final Boolean value) throws IOException {
        return write(name, value, false);
    }

    public JsonWriter<S> write(final String name, final Boolean value, final boolean writeNull)
            throws IOException {
        if (value != null || writeNull) {
            writeRaw(name, JsonStrings.stringify(value));
        }
        return this;
    }

    public JsonWriter<S> write(final String name, final Instant value) throws IOException {
        return write(name, value, JsonStrings.TIMESTAMP_FORMAT, false);
    }

    public JsonWriter<S> write(
            final String name,
            final Instant value,
            final DateTimeFormatter format,
            final boolean writeNull) throws IOException {
        if (value != null || writeNull) {
            writeRaw(name, JsonStrings.stringify(value != null ? value.atOffset(ZoneOffset.UTC) : null, format));
        }
        return this;
    }

    public JsonWriter<S> write(final String name, final JsonValues values, final String path, final Object... args)
            throws IOException {
        writeValue(name, values, PathFormat.format(path, args));
        return this;
    }

    public JsonWriter<S> write(final String name, final LargeText value) throws IOException {
        return write(name, value, false);
    }

    public JsonWriter<S> write(final String name, final LargeText value, final boolean writeNull)
            throws IOException {
        if (value != null) {
            writeRawName(name);
            sink.print("\"");
            finishLargeText(value);
        } else if (writeNull) {
            writeRaw(name, "null");
        }
        return this;
    }

    public JsonWriter<S> write(final String name, final LocalDate value) throws IOException {
        return write(name, value, JsonStrings.DATE_FORMAT, false);
    }

    public JsonWriter<S> write(
            final String name,
            final LocalDate value,
            final DateTimeFormatter format,
            final boolean writeNull) throws IOException {
        if (value != null || writeNull) {
            writeRaw(name, JsonStrings.stringify(value != null ? value.atStartOfDay() : null, format));
        }
        return this;
    }

    public JsonWriter<S> write(final String name, final LocalDateTime value) throws IOException {
        return write(name, value, JsonStrings.TIMESTAMP_FORMAT, false);
    }

    public JsonWriter<S> write(
            final String name,
            final LocalDateTime value,
            final DateTimeFormatter format,
            final boolean writeNull) throws IOException {
        if (value != null || writeNull) {
            writeRaw(name, JsonStrings.stringify(value, format));
        }
        return this;
    }

    public JsonWriter<S> write(final String name, final Node node) throws IOException {
        return write(name, node, false);
    }

    public JsonWriter<S> write(final String name, final Node node, final boolean writeNull) throws IOException {
        if (node != null) {
            writeRawName(name);
            writeXml(node);
        } else if (writeNull) {
            writeRaw(name, "null");
        }
        return this;
    }

    public JsonWriter<S> write(final String name, final Number value) throws IOException {
        return write(name, value, false);
    }

    public JsonWriter<S> write(final String name, final Number value, final boolean writeNull) throws IOException {
        if (value != null || writeNull) {
            writeRaw(name, JsonStrings.stringify(value));
        }
        return this;
    }

    public JsonWriter<S> write(final String name, final OffsetDateTime value) throws IOException {
        return write(name, value, JsonStrings.TIMESTAMP_TZ_FORMAT, false);
    }

    public JsonWriter<S> write(
            final String name,
            final OffsetDateTime value,
            final DateTimeFormatter format,
            final boolean writeNull) throws IOException {
        if (value != null || writeNull) {
            writeRaw(name, JsonStrings.stringify(value, format));
        }
        return this;
    }

    public JsonWriter<S> write(final String name, final ResultSet rows) throws IOException, SQLException {
        new RowSetWriter(this).write(name, rows, null);
        return this;
    }

    public JsonWriter<S> write(final String name, final String value) throws IOException {
        return write(name, value, false);
    }

    /**
     * Writes a named string. Null is skipped unless {@code writeNull} is true; the empty string
     * is written as {@code ""}.
     *
     * @param name
     *            member name
     * @param value
     *            string value; may be null
     * @param writeNull
     *            true to write {@code null} for a null value
     * @return this writer
     * @throws IOException
     *             if the sink cannot be written
     */
    public JsonWriter<S> write(final String name, final String value, final boolean writeNull) throws IOException {
        if (value == null) {
            if (writeNull) {
                writeRaw(name, "null");
            }
        } else if (value.length() > CHUNK_SIZE) {
            writeRawName(name);
            sink.print("\"");
            finishLongString(value);
        } else {
            writeRaw(name, JsonStrings.stringify(value));
        }
        return this;
    }

    private void writeHeader() throws IOException {
        sink.println("Content-Type: application/json; charset=utf-8");
        switch (options.getCachePolicy()) {
        case ALLOW:
            sink.println("Cache-Control: max-age=0, private");
            break;
        case FORBID:
            sink.println("Cache-Control: no-cache");
            break;
        default:
            break;
        }
        final String etag = options.getEtag();
        if (etag != null) {
            sink.println("ETag: " + etag);
        }
        sink.println("");
    }

    /**
     * Writes an {@code items} array from the given result set, followed by a {@code links} array.
     * If no object is open, the output is enclosed in an object.
     *
     * @param items
     *            result set, positioned before the first row
     * @param itemLinks
     *            links written in every row, or null
     * @param links
     *            links written after the items, or null
     * @return this writer
     * @throws IOException
     *             if the sink cannot be written
     * @throws SQLException
     *             if the result set cannot be read
     */
    public JsonWriter<S> writeItems(
            final ResultSet items,
            @Nullable final List<Link> itemLinks,
            @Nullable final List<Link> links) throws IOException, SQLException {
        final boolean enclose = level == 0;
        if (enclose) {
            openObject();
        }
        new RowSetWriter(this).write("items", items, itemLinks);
        writeLinks(links);
        if (enclose) {
            closeObject();
        }
        return this;
    }

    /**
     * Writes a {@code links} array, with placeholders in each href replaced by the values of the
     * current row. Nothing is written if there are no links.
     *
     * @param links
     *            links to be written, or null
     * @return this writer
     * @throws IOException
     *             if the sink cannot be written
     */
    public JsonWriter<S> writeLinks(@Nullable final List<Link> links) throws IOException {
        if (links == null || links.isEmpty()) {
            return this;
        }
        openArray("links");
        for (final Link link : links) {
            openObject();
            write("href", this.links.substitute(link.getHref()));
            write("rel", link.getRel());
            write("templated", link.getTemplated());
            write("mediaType", link.getMediaType());
            write("method", link.getMethod());
            write("profile", link.getProfile());
            closeObject();
        }
        closeArray();
        return this;
    }

    public JsonWriter<S> writeNumbers(final Collection<? extends Number> values) throws IOException {
        openArray();
        for (final Number value : values) {
            write(value);
        }
        return closeArray();
    }

    public JsonWriter<S> writeNumbers(
            final String name,
            final Collection<? extends Number> values,
            final boolean writeNull) throws IOException {
        if (values != null && !values.isEmpty() || writeNull) {
            openArray(name);
            if (values != null) {
                for (final Number value : values) {
                    write(value);
                }
            }
            closeArray();
        }
        return this;
    }

    /**
     * Writes a complete, pre-formatted value.
     *
     * @param value
     *            JSON text, written without escaping
     * @return this writer
     * @throws IOException
     *             if the sink cannot be written
     */
    public JsonWriter<S> writeRaw(final CharSequence value) throws IOException {
        return writeRaw(value, true);
    }

    /**
     * Writes pre-formatted text, preceded by indent and separating comma.
     *
     * @param value
     *            JSON text, written without escaping
     * @param done
     *            true if the text completes a value; otherwise the caller writes the rest of it
     * @return this writer
     * @throws IOException
     *             if the sink cannot be written
     */
    public JsonWriter<S> writeRaw(final CharSequence value, final boolean done) throws IOException {
        checkOpen();
        sink.print(getIndent(true));
        if (done) {
            sink.println(value);
            dataWritten();
        } else {
            sink.print(value);
        }
        return this;
    }

    /**
     * Writes a member whose value is pre-formatted JSON text.
     *
     * @param name
     *            member name
     * @param value
     *            JSON text, written without escaping
     * @return this writer
     * @throws IOException
     *             if the sink cannot be written
     */
    public JsonWriter<S> writeRaw(final String name, final CharSequence value) throws IOException {
        writeRawName(name);
        sink.println(value);
        dataWritten();
        return this;
    }

    private void writeRawName(final String name) throws IOException {
        writeRaw(JsonStrings.stringify(Preconditions.checkNotNull(name)) + ":", false);
    }

    public JsonWriter<S> writeStrings(final Collection<String> values) throws IOException {
        openArray();
        for (final String value : values) {
            write(value);
        }
        return closeArray();
    }

    public JsonWriter<S> writeStrings(final String name, final Collection<String> values, final boolean writeNull)
            throws IOException {
        if (values != null && !values.isEmpty() || writeNull) {
            openArray(name);
            if (values != null) {
                for (final String value : values) {
                    write(value);
                }
            }
            closeArray();
        }
        return this;
    }

    private void writeValue(final String name, final JsonValues values, final String path) throws IOException {
        final JsonValue value = values.get(path);
        if (value == null) {
            throw new IllegalArgumentException("No value at path \"" + path + "\"");
        }

        switch (value.getKind()) {
        case NULL:
            if (name == null) {
                writeRaw("null");
            } else {
                writeRaw(name, "null");
            }
            break;
        case TRUE:
        case FALSE:
            final Boolean b = value.getKind() == JsonValue.Kind.TRUE;
            if (name == null) {
                write(b);
            } else {
                write(name, b);
            }
            break;
        case NUMBER:
            if (name == null) {
                write(value.getNumber());
            } else {
                write(name, value.getNumber());
            }
            break;
        case STRING:
            if (name == null) {
                write(value.getString());
            } else {
                write(name, value.getString());
            }
            break;
        case LARGE_TEXT:
            if (name == null) {
                write(value.getLargeText());
            } else {
                write(name, value.getLargeText());
            }
            break;
        case OBJECT:
            openObject(name);
            for (final String member : value.getMembers()) {
                final String child = JsonValues.ROOT.equals(path) ? member : path + "." + member;
                writeValue(JsonStrings.fromMemberName(member), values, child);
            }
            closeObject();
            break;
        case ARRAY:
            openArray(name);
            final String base = JsonValues.ROOT.equals(path) ? "" : path;
            for (int i = 1, count = value.getCount(); i <= count; i++) {
                writeValue(null, values, base + "[" + i + "]");
            }
            closeArray();
            break;
        default:
            throw new IllegalStateException("Unexpected value " + value);
        }
    }

    private void writeXml(final Node node) throws IOException {
        sink.print(XmlToJson.toJson(node));
        sink.print("\n");
        dataWritten();
    }
}
