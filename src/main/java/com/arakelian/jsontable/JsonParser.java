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
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import com.arakelian.jsontable.JsonLexer.Symbol;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * Recursive descent parser which reports the structure of a JSON document to a
 * {@link ParseHandler}. The usual handler stores the document in a {@link JsonValues} table;
 * {@link XmlHandler} converts the document to XML instead.
 */
public class JsonParser {
    /**
     * State of a single parse.
     */
    private static final class Parse {
        private final JsonLexer lexer;

        private final ParseHandler handler;

        private Symbol symbol;

        private Parse(final JsonLexer lexer, final ParseHandler handler) {
            this.lexer = lexer;
            this.handler = handler;
        }

        private void eat(final Symbol expected) throws IOException {
            if (symbol != expected) {
                throw lexer.error("Expected \"" + expected + "\", seeing \"" + symbol + "\"");
            }
            symbol = lexer.next();
        }

        private void parseArray(final String path, final String name) throws IOException {
            final String base = (path == null ? "" : path) + "[";
            final String self = path == null ? JsonValues.ROOT : path;
            handler.startArray(self, name);
            eat(Symbol.BEGIN_ARRAY);

            int count = 0;
            if (symbol != Symbol.END_ARRAY) {
                parseValue(base + ++count + "]", null);
                while (symbol == Symbol.COMMA) {
                    eat(Symbol.COMMA);
                    if (symbol == Symbol.END_ARRAY) {
                        if (lexer.isStrict()) {
                            throw lexer.error("Strict JSON forbids dangling comma");
                        }
                        break;
                    }
                    parseValue(base + ++count + "]", null);
                }
            }

            eat(Symbol.END_ARRAY);
            handler.endArray(self, name, count);
        }

        private void parseDocument() throws IOException {
            symbol = lexer.next();
            switch (symbol) {
            case BEGIN_ARRAY:
                handler.startDocument();
                parseArray(null, null);
                break;
            case BEGIN_OBJECT:
                handler.startDocument();
                parseObject(null, null);
                break;
            case EOF:
                return;
            default:
                throw lexer.error("expected [ or {");
            }
            eat(Symbol.EOF);
            handler.endDocument();
        }

        private void parseObject(final String path, final String name) throws IOException {
            final String base = path == null ? "" : path + ".";
            final String self = path == null ? JsonValues.ROOT : path;
            // a repeated member name keeps its first position
            final ImmutableSet.Builder<String> members = ImmutableSet.builder();
            handler.startObject(self, name);
            eat(Symbol.BEGIN_OBJECT);

            if (symbol != Symbol.END_OBJECT) {
                members.add(parseMember(base));
                while (symbol == Symbol.COMMA) {
                    eat(Symbol.COMMA);
                    if (symbol == Symbol.END_OBJECT) {
                        if (lexer.isStrict()) {
                            throw lexer.error("Strict JSON forbids dangling comma");
                        }
                        break;
                    }
                    members.add(parseMember(base));
                }
            }

            eat(Symbol.END_OBJECT);
            handler.endObject(self, name, members.build().asList());
        }

        private String parseMember(final String base) throws IOException {
            if (symbol != Symbol.STRING) {
                throw lexer.error("Expected string (object member name)");
            }
            final String name;
            if (lexer.isLargeText()) {
                final LargeText text = lexer.takeLargeText();
                try {
                    name = text.toString();
                } finally {
                    text.free();
                }
            } else {
                name = lexer.getString();
            }
            final String member = JsonStrings.toMemberName(name);
            symbol = lexer.next();
            eat(Symbol.COLON);
            parseValue(base + member, name);
            return member;
        }

        private void parseValue(final String path, final String name) throws IOException {
            switch (symbol) {
            case BEGIN_ARRAY:
                parseArray(path, name);
                return;
            case BEGIN_OBJECT:
                parseObject(path, name);
                return;
            case FALSE:
                handler.value(path, name, JsonValue.FALSE);
                break;
            case TRUE:
                handler.value(path, name, JsonValue.TRUE);
                break;
            case NULL:
                handler.value(path, name, JsonValue.NULL);
                break;
            case NUMBER:
                handler.value(path, name, JsonValue.number(lexer.getNumber()));
                break;
            case STRING:
                if (lexer.isLargeText()) {
                    handler.value(path, name, JsonValue.largeText(lexer.takeLargeText()));
                } else {
                    handler.value(path, name, JsonValue.string(lexer.getString()));
                }
                break;
            default:
                throw lexer.error("Expected value (null, false, true, number, string)");
            }
            symbol = lexer.next();
        }
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonParser.class);

    private static final ParseOptions DEFAULT_OPTIONS = ImmutableParseOptions.builder().build();

    private static final ParseOptions LAX_OPTIONS = ImmutableParseOptions.builder().strict(false).build();

    public static JsonParser lax() {
        return new JsonParser(LAX_OPTIONS);
    }

    /**
     * Converts a JSON document to an XML document, with strictness given as {@code "Y"} or
     * {@code "N"}.
     *
     * @param json
     *            JSON document
     * @param strict
     *            {@code "Y"} for strict parsing, {@code "N"} for lax parsing
     * @return XML document
     * @throws IOException
     *             if the document is not valid
     */
    public static Document toXmlSql(final String json, final String strict) throws IOException {
        Preconditions.checkArgument("Y".equals(strict) || "N".equals(strict), "strict must be Y or N");
        final JsonParser parser = "Y".equals(strict) ? new JsonParser() : lax();
        return parser.toXml(json);
    }

    private final ParseOptions options;

    public JsonParser() {
        this(DEFAULT_OPTIONS);
    }

    public JsonParser(final ParseOptions options) {
        this.options = Preconditions.checkNotNull(options);
    }

    public ParseOptions getOptions() {
        return options;
    }

    /**
     * Parses the characters of the given reader, reporting the document structure to the given
     * handler.
     *
     * @param reader
     *            source of characters
     * @param handler
     *            receives the document structure
     * @throws IOException
     *             if the source cannot be read or is not valid JSON
     */
    public void parse(final CharReader reader, final ParseHandler handler) throws IOException {
        Preconditions.checkNotNull(handler);
        final JsonLexer lexer = new JsonLexer(reader, options.isStrict());
        try {
            new Parse(lexer, handler).parseDocument();
        } finally {
            lexer.free();
        }
    }

    /**
     * Replaces the contents of the given table with the document read from the given reader. On
     * failure the table is left empty.
     *
     * @param values
     *            table to be filled
     * @param reader
     *            source of characters
     * @throws IOException
     *             if the source cannot be read or is not valid JSON
     */
    public void parse(final JsonValues values, final CharReader reader) throws IOException {
        values.free();
        try {
            parse(reader, new ValueTableHandler(values));
        } catch (final IOException | RuntimeException e) {
            values.free();
            throw e;
        }
        LOGGER.debug("Parsed {} value(s), strict={}", values.size(), options.isStrict());
    }

    public JsonValues parse(final List<String> chunks) throws IOException {
        return parse(new CharReader(ChunkSource.of(chunks), false));
    }

    public JsonValues parse(final Reader reader) throws IOException {
        return parse(new CharReader(ChunkSource.of(reader, options.getPageSize()), false));
    }

    public JsonValues parse(final String json) throws IOException {
        return parse(CharReader.of(json));
    }

    private JsonValues parse(final CharReader reader) throws IOException {
        final JsonValues values = new JsonValues();
        parse(values, reader);
        return values;
    }

    /**
     * Parses a document given as a sequence of lines; a line break is implied between lines.
     *
     * @param lines
     *            lines of the document
     * @return table of values
     * @throws IOException
     *             if the document is not valid
     */
    public JsonValues parseLines(final List<String> lines) throws IOException {
        return parse(new CharReader(ChunkSource.of(lines), true));
    }

    public Document toXml(final List<String> chunks) throws IOException {
        return toDocument(toXmlString(chunks));
    }

    public Document toXml(final Reader reader) throws IOException {
        return toDocument(toXmlString(reader));
    }

    public Document toXml(final String json) throws IOException {
        return toDocument(toXmlString(json));
    }

    private Document toDocument(final String xml) throws IOException {
        try {
            final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            final DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (final ParserConfigurationException | SAXException e) {
            throw new IOException("Unable to build XML document", e);
        }
    }

    /**
     * Writes the XML form of the document read from the given reader to the given sink.
     *
     * @param reader
     *            source of characters
     * @param sink
     *            destination of XML text
     * @throws IOException
     *             if the source cannot be read or is not valid JSON
     */
    public void toXml(final CharReader reader, final JsonSink sink) throws IOException {
        final XmlHandler handler = new XmlHandler(sink);
        handler.writeProlog();
        parse(reader, handler);
        handler.finish();
    }

    public String toXmlString(final List<String> chunks) throws IOException {
        return toXmlString(new CharReader(ChunkSource.of(chunks), false));
    }

    public String toXmlString(final Reader reader) throws IOException {
        return toXmlString(new CharReader(ChunkSource.of(reader, options.getPageSize()), false));
    }

    public String toXmlString(final String json) throws IOException {
        return toXmlString(CharReader.of(json));
    }

    private String toXmlString(final CharReader reader) throws IOException {
        final StringWriter writer = new StringWriter();
        toXml(reader, new WriterSink<>(writer));
        return writer.toString();
    }
}
