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
import java.io.StringReader;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import javax.xml.parsers.DocumentBuilderFactory;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

public class JsonWriterTest {
    @FunctionalInterface
    public interface JsonTest {
        void execute(JsonWriter<WriterSink<StringWriter>> writer) throws IOException;
    }

    /** Logger **/
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonWriterTest.class);

    private static final String SAMPLE = "" + //
            "{\n" + //
            "    \"a\": 1,\n" + //
            "    \"b\": [true, null, \"s\"],\n" + //
            "    \"c\": {\"d e\": {}, \"q\\\"uote\": -0.5},\n" + //
            "    \"f\": []\n" + //
            "}";

    static Document parseXml(final String xml) throws Exception {
        return DocumentBuilderFactory.newInstance().newDocumentBuilder()
                .parse(new InputSource(new StringReader(xml)));
    }

    private void assertIllegalStateException(final JsonTest test) throws IOException {
        final StringWriter sw = new StringWriter();
        try (JsonWriter<WriterSink<StringWriter>> writer = new JsonWriter<>(new WriterSink<>(sw))) {
            Assertions.assertThrows(IllegalStateException.class, () -> {
                test.execute(writer);
                writer.flush();
                LOGGER.info("Supposed to be invalid: {}", sw.toString());
            });
        }
    }

    private String capture(final JsonTest test) throws IOException {
        return capture(ImmutableOutputOptions.builder().emitHeader(false).build(), test);
    }

    private String capture(final OutputOptions options, final JsonTest test) throws IOException {
        final StringWriter sw = new StringWriter();
        try (JsonWriter<WriterSink<StringWriter>> writer = new JsonWriter<>(new WriterSink<>(sw), options)) {
            test.execute(writer);
        }
        return sw.toString();
    }

    @Test
    public void testArraysOfScalars() throws IOException {
        Assertions.assertEquals(
                "{\n" //
                        + "\"tags\":[\n" //
                        + "\"a\"\n" //
                        + ",\"b\"\n" //
                        + "]\n" //
                        + ",\"nums\":[\n" //
                        + "1\n" //
                        + ",2.5\n" //
                        + "]\n" //
                        + ",\"none\":[\n" //
                        + "]\n" //
                        + "}\n", //
                capture(writer -> {
                    writer.openObject();
                    writer.writeStrings("tags", ImmutableList.of("a", "b"), false);
                    writer.writeNumbers("nums", ImmutableList.of(1, 2.5), false);
                    writer.writeStrings("empty", ImmutableList.of(), false);
                    writer.writeStrings("none", null, true);
                    writer.closeObject();
                }));

        Assertions.assertEquals("[\n[\n\"x\"\n]\n]\n", capture(writer -> {
            writer.openArray();
            writer.writeStrings(ImmutableList.of("x"));
            writer.closeArray();
        }));
    }

    @Test
    public void testCloseAll() throws IOException {
        final StringWriter sw = new StringWriter();
        final JsonWriter<WriterSink<StringWriter>> writer = new JsonWriter<>(new WriterSink<>(sw));
        writer.openObject();
        writer.openArray("a");
        writer.openObject();
        writer.write("k", Boolean.TRUE);
        Assertions.assertEquals(3, writer.getLevel());

        writer.closeAll();
        Assertions.assertEquals(0, writer.getLevel());
        Assertions.assertEquals("{\n\"a\":[\n{\n\"k\":true\n}\n]\n}\n", sw.toString());

        // nothing left to close
        writer.closeAll();
        Assertions.assertEquals("{\n\"a\":[\n{\n\"k\":true\n}\n]\n}\n", sw.toString());
    }

    @Test
    public void testCompact() throws IOException {
        Assertions.assertEquals("{\n\"a\":\"x\"\n,\"b\":1\n,\"c\":false\n}\n", capture(writer -> {
            writer.openObject();
            writer.write("a", "x");
            writer.write("b", 1);
            writer.write("c", Boolean.FALSE);
            writer.closeObject();
        }));
        Assertions.assertEquals("[\n]\n", capture(writer -> writer.openArray().closeArray()));
    }

    @Test
    public void testDates() throws IOException {
        final LocalDate date = LocalDate.of(2016, 12, 21);
        final LocalDateTime timestamp = LocalDateTime.of(2016, 12, 21, 16, 46, 39, 123456000);
        final OffsetDateTime tz = OffsetDateTime.of(timestamp, ZoneOffset.ofHours(-5));
        final Instant instant = tz.toInstant();

        Assertions.assertEquals(
                "{\n" //
                        + "\"d\":\"2016-12-21T00:00:00Z\"\n" //
                        + ",\"t\":\"2016-12-21T16:46:39.123456Z\"\n" //
                        + ",\"tz\":\"2016-12-21T16:46:39.123456-05:00\"\n" //
                        + ",\"i\":\"2016-12-21T21:46:39.123456Z\"\n" //
                        + ",\"f\":\"2016-12-21\"\n" //
                        + ",\"n\":null\n" //
                        + "}\n", //
                capture(writer -> {
                    writer.openObject();
                    writer.write("d", date);
                    writer.write("t", timestamp);
                    writer.write("tz", tz);
                    writer.write("i", instant);
                    writer.write("f", date, DateTimeFormatter.ISO_LOCAL_DATE, false);
                    writer.write("skipped", (LocalDate) null);
                    writer.write("n", (LocalDateTime) null, JsonStrings.TIMESTAMP_FORMAT, true);
                    writer.closeObject();
                }));
    }

    @Test
    public void testHeader() throws IOException {
        final OutputOptions forbid = ImmutableOutputOptions.builder().etag("\"v1\"").build();
        Assertions.assertEquals(
                "Content-Type: application/json; charset=utf-8\n" //
                        + "Cache-Control: no-cache\n" //
                        + "ETag: \"v1\"\n" //
                        + "\n" //
                        + "[\n]\n{\n}\n",
                capture(forbid, writer -> {
                    writer.openArray().closeArray();
                    writer.openObject().closeObject();
                }));

        final OutputOptions allow = ImmutableOutputOptions.builder().cachePolicy(OutputOptions.CachePolicy.ALLOW)
                .build();
        Assertions.assertEquals(
                "Content-Type: application/json; charset=utf-8\n" //
                        + "Cache-Control: max-age=0, private\n" //
                        + "\n" //
                        + "{\n}\n",
                capture(allow, writer -> writer.openObject().closeObject()));

        final OutputOptions omit = ImmutableOutputOptions.builder().cachePolicy(OutputOptions.CachePolicy.OMIT)
                .build();
        Assertions.assertEquals(
                "Content-Type: application/json; charset=utf-8\n\n{\n}\n",
                capture(omit, writer -> writer.openObject().closeObject()));
    }

    @Test
    public void testIndent() throws IOException {
        final OutputOptions options = ImmutableOutputOptions.builder().emitHeader(false).indent(2).build();
        Assertions.assertEquals(
                "{\n" //
                        + "  \"a\":\"x\"\n" //
                        + " ,\"list\":[\n" //
                        + "    1\n" //
                        + "   ,2\n" //
                        + "  ]\n" //
                        + " ,\"o\":{\n" //
                        + "  }\n" //
                        + "}\n", //
                capture(options, writer -> {
                    writer.openObject();
                    writer.write("a", "x");
                    writer.openArray("list");
                    writer.write(1);
                    writer.write(2);
                    writer.closeArray();
                    writer.openObject("o");
                    writer.closeObject();
                    writer.closeObject();
                }));
    }

    @Test
    public void testInvalidSequences() throws IOException {
        assertIllegalStateException(writer -> writer.closeObject());
        assertIllegalStateException(writer -> writer.closeArray());
        assertIllegalStateException(writer -> writer.openArray().closeObject());
        assertIllegalStateException(writer -> writer.openObject().closeArray());
        assertIllegalStateException(writer -> writer.write("x"));
        assertIllegalStateException(writer -> writer.write("a", "x"));
        assertIllegalStateException(writer -> writer.writeRaw("1"));
    }

    @Test
    public void testLargeText() throws IOException {
        final String text = Strings.repeat("é\"<\n", 5000);
        final String json = capture(writer -> {
            writer.openArray();
            writer.write(LargeText.of(text));
            writer.write((LargeText) null);
            writer.closeArray();
        });

        final JsonValues values = new JsonParser().parse(json);
        Assertions.assertEquals(JsonValue.Kind.LARGE_TEXT, values.get("[1]").getKind());
        Assertions.assertEquals(text, values.get("[1]").getLargeText().toString());
        Assertions.assertEquals(JsonValue.NULL, values.get("[2]"));
    }

    @Test
    public void testLinks() throws IOException {
        final Link self = Link.of("/items", "self");
        final Link edit = ImmutableLink.builder() //
                .href("/items/edit") //
                .rel("edit") //
                .templated(false) //
                .mediaType("application/json") //
                .method("PUT") //
                .profile("item") //
                .build();
        Assertions.assertEquals(
                "{\n" //
                        + "\"links\":[\n" //
                        + "{\n" //
                        + "\"href\":\"\\/items\"\n" //
                        + ",\"rel\":\"self\"\n" //
                        + "}\n" //
                        + ",{\n" //
                        + "\"href\":\"\\/items\\/edit\"\n" //
                        + ",\"rel\":\"edit\"\n" //
                        + ",\"templated\":false\n" //
                        + ",\"mediaType\":\"application\\/json\"\n" //
                        + ",\"method\":\"PUT\"\n" //
                        + ",\"profile\":\"item\"\n" //
                        + "}\n" //
                        + "]\n" //
                        + "}\n", //
                capture(writer -> {
                    writer.openObject();
                    writer.writeLinks(ImmutableList.of(self, edit));
                    writer.writeLinks(ImmutableList.of());
                    writer.writeLinks(null);
                    writer.closeObject();
                }));
    }

    @Test
    public void testLongString() throws IOException {
        final String text = Strings.repeat("ab\"cé\n", 10000);
        final String json = capture(writer -> {
            writer.openObject();
            writer.write("s", text);
            writer.write("after", 1);
            writer.closeObject();
        });
        Assertions.assertTrue(json.startsWith("{\n\"s\":\"ab\\\"c\\u00E9\\n"));

        final JsonQuery query = new JsonQuery(new JsonParser().parse(json));
        Assertions.assertEquals(text, query.getLargeText("s").toString());
        Assertions.assertEquals(BigDecimal.ONE, query.getNumber("after"));
    }

    @Test
    public void testNulls() throws IOException {
        Assertions.assertEquals("{\n\"s\":null\n,\"e\":\"\"\n,\"b\":null\n}\n", capture(writer -> {
            writer.openObject();
            writer.write("skipped", (String) null);
            writer.write("s", (String) null, true);
            writer.write("e", "");
            writer.write("skipped", (Number) null);
            writer.write("b", (Boolean) null, true);
            writer.closeObject();
        }));
        Assertions.assertEquals("[\nnull\n,null\n]\n", capture(writer -> {
            writer.openArray();
            writer.write((String) null);
            writer.write((Number) null);
            writer.closeArray();
        }));
    }

    @Test
    public void testRaw() throws IOException {
        Assertions.assertEquals("{\n\"x\":[1,2]\n,\"y\":{\"pre\":true}\n}\n", capture(writer -> {
            writer.openObject();
            writer.writeRaw("x", "[1,2]");
            writer.writeRaw("y", "{\"pre\":true}");
            writer.closeObject();
        }));
        Assertions.assertEquals("[\n{\"pre\":1}\n,2\n]\n", capture(writer -> {
            writer.openArray();
            writer.writeRaw("{\"pre\":1}");
            writer.writeRaw("2");
            writer.closeArray();
        }));
    }

    @Test
    public void testSubtree() throws IOException {
        final JsonValues values = new JsonParser().parse(SAMPLE);

        final String copy = capture(writer -> writer.write(values, "."));
        LOGGER.info("Copy: {}", copy);
        Assertions.assertEquals(values.asMap(), new JsonParser().parse(copy).asMap());

        Assertions.assertEquals("{\n\"copy\":[\ntrue\n,null\n,\"s\"\n]\n,\"q\\\"uote\":-0.5\n}\n", capture(writer -> {
            writer.openObject();
            writer.write("copy", values, "b");
            writer.write("q\"uote", values, "c.%s", JsonStrings.toMemberName("q\"uote"));
            writer.closeObject();
        }));

        Assertions.assertThrows(IllegalArgumentException.class, () -> capture(writer -> {
            writer.openArray();
            writer.write(values, "missing");
        }));
    }

    @Test
    public void testSubtreeWithDuplicateMembers() throws IOException {
        final JsonValues values = new JsonParser().parse("{\"a\":{\"x\":1},\"b\":[],\"a\":\"z\"}");
        Assertions.assertEquals("{\n\"a\":\"z\"\n,\"b\":[\n]\n}\n", capture(writer -> writer.write(values, ".")));
    }

    @Test
    public void testXml() throws Exception {
        final Document doc = parseXml("<r><a>1</a><b>text \"q\"</b></r>");
        Assertions.assertEquals("{\n\"doc\":{\"a\":1,\"b\":\"text \\\"q\\\"\"}\n,\"n\":1\n}\n", capture(writer -> {
            writer.openObject();
            writer.write("doc", doc);
            writer.write("n", 1);
            writer.closeObject();
        }));
        Assertions.assertEquals("[\n{\"a\":1,\"b\":\"text \\\"q\\\"\"}\n]\n", capture(writer -> {
            writer.openArray();
            writer.write(doc);
            writer.closeArray();
        }));
    }
}
