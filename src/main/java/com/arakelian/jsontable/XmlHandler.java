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
import java.util.List;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

/**
 * Writes a parsed document as XML text. The document element is {@code <json>}, object members
 * become elements named after the member, and array elements become {@code <row>} elements.
 * Null values produce no element.
 */
public class XmlHandler implements ParseHandler {
    /** XML declaration which precedes the document **/
    public static final String PROLOG = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

    /** Element used for array elements **/
    public static final String ROW_TAG = "row";

    /** Escaper for element text **/
    public static final Escaper HTML_ESCAPER = Escapers.builder() //
            .addEscape('&', "&amp;") //
            .addEscape('"', "&quot;") //
            .addEscape('<', "&lt;") //
            .addEscape('>', "&gt;") //
            .addEscape('\'', "&#x27;") //
            .addEscape('/', "&#x2F;") //
            .build();

    /** Text is escaped in pieces of this many characters **/
    private static final int PIECE_SIZE = 4000;

    private static final Pattern INVALID_NAME_CHARS = Pattern.compile("[^\\p{Alnum}_-]");

    /**
     * Returns a valid XML element name for the given member name. A leading minus sign becomes an
     * underscore, as does every character other than a letter, digit, underscore or minus sign.
     *
     * @param name
     *            member name
     * @return element name
     */
    public static String fixXmlName(final String name) {
        final String fixed = name.startsWith("-") ? "_" + name.substring(1) : name;
        return INVALID_NAME_CHARS.matcher(fixed).replaceAll("_");
    }

    private final JsonSink sink;

    private boolean started;

    public XmlHandler(final JsonSink sink) {
        this.sink = Preconditions.checkNotNull(sink);
    }

    @Override
    public void endArray(final String path, final String name, final int count) throws IOException {
        endTag(path, name);
    }

    @Override
    public void endDocument() throws IOException {
        sink.print("</json>");
    }

    @Override
    public void endObject(final String path, final String name, final List<String> members) throws IOException {
        endTag(path, name);
    }

    private void endTag(final String path, final String name) throws IOException {
        final String tag = tag(path, name);
        if (tag != null) {
            sink.println("</" + tag + ">");
        }
    }

    /**
     * Completes the output. An empty document is written as an empty {@code <json>} element.
     *
     * @throws IOException
     *             if the sink cannot be written
     */
    public void finish() throws IOException {
        if (!started) {
            sink.print("<json></json>");
        }
        sink.flush();
    }

    @Override
    public void startArray(final String path, final String name) throws IOException {
        startTag(path, name);
    }

    @Override
    public void startDocument() throws IOException {
        started = true;
        sink.print("<json>");
    }

    @Override
    public void startObject(final String path, final String name) throws IOException {
        startTag(path, name);
    }

    private void startTag(final String path, final String name) throws IOException {
        final String tag = tag(path, name);
        if (tag != null) {
            sink.print("<" + tag + ">");
        }
    }

    @Nullable
    private String tag(final String path, final String name) {
        if (name != null) {
            return JsonStrings.isSimpleName(name) ? name : fixXmlName(name);
        }
        return JsonValues.ROOT.equals(path) ? null : ROW_TAG;
    }

    @Override
    public void value(final String path, final String name, final JsonValue value) throws IOException {
        switch (value.getKind()) {
        case NULL:
            break;
        case TRUE:
            writeValue(path, name, "true");
            break;
        case FALSE:
            writeValue(path, name, "false");
            break;
        case NUMBER:
            writeValue(path, name, JsonStrings.stringify(value.getNumber()));
            break;
        case STRING:
            writeValue(path, name, value.getString());
            break;
        case LARGE_TEXT:
            final LargeText text = value.getLargeText();
            try {
                startTag(path, name);
                for (int offset = 0, length = text.length(); offset < length; offset += PIECE_SIZE) {
                    sink.print(HTML_ESCAPER.escape(text.substring(offset, PIECE_SIZE)));
                }
                endTag(path, name);
            } finally {
                text.free();
            }
            break;
        default:
            throw new IllegalStateException("Unexpected scalar " + value);
        }
    }

    /**
     * Writes the XML declaration. Must be called before parsing starts.
     *
     * @throws IOException
     *             if the sink cannot be written
     */
    public void writeProlog() throws IOException {
        sink.println(PROLOG);
    }

    private void writeValue(final String path, final String name, final String text) throws IOException {
        startTag(path, name);
        for (int offset = 0, length = text.length(); offset < length; offset += PIECE_SIZE) {
            sink.print(HTML_ESCAPER.escape(text.substring(offset, Math.min(length, offset + PIECE_SIZE))));
        }
        endTag(path, name);
    }
}
