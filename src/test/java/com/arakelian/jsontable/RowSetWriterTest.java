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
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Proxy;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

public class RowSetWriterTest {
    @FunctionalInterface
    public interface RowSetTest {
        void execute(JsonWriter<WriterSink<StringWriter>> writer, ResultSet rows) throws IOException, SQLException;
    }

    /** Logger **/
    private static final Logger LOGGER = LoggerFactory.getLogger(RowSetWriterTest.class);

    private Connection connection;

    @BeforeEach
    public void createTables() throws SQLException {
        connection = DriverManager.getConnection("jdbc:h2:mem:" + UUID.randomUUID());
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("CREATE TABLE item (" //
                    + "id INT, name VARCHAR(50), price DECIMAL(10,2), created DATE, updated TIMESTAMP, " //
                    + "zoned TIMESTAMP WITH TIME ZONE, active BOOLEAN, flag VARCHAR(5), notes CLOB)");
            stmt.execute("INSERT INTO item VALUES (1, 'sword', 12.50, DATE '2016-12-21', " //
                    + "TIMESTAMP '2016-12-21 16:46:39.123456', " //
                    + "TIMESTAMP WITH TIME ZONE '2016-12-21 16:46:39+02:00', TRUE, 'TRUE', 'long notes')");
            stmt.execute("INSERT INTO item VALUES (2, NULL, NULL, NULL, NULL, NULL, NULL, 'no', NULL)");
            stmt.execute("CREATE TABLE tagged (id INT, tags VARCHAR(10) ARRAY)");
            stmt.execute("INSERT INTO tagged VALUES (1, ARRAY['a', 'b']), (2, ARRAY['c'])");
        }
    }

    /**
     * Returns a result set whose second call to {@link ResultSet#next()} fails.
     */
    private static ResultSet failAfterFirstRow(final ResultSet rows) {
        final AtomicInteger calls = new AtomicInteger();
        return (ResultSet) Proxy.newProxyInstance(
                RowSetWriterTest.class.getClassLoader(),
                new Class<?>[] { ResultSet.class },
                (proxy, method, args) -> {
                    if ("next".equals(method.getName()) && calls.incrementAndGet() > 1) {
                        throw new SQLException("Connection reset");
                    }
                    try {
                        return method.invoke(rows, args);
                    } catch (final InvocationTargetException e) {
                        throw e.getCause();
                    }
                });
    }

    @AfterEach
    public void dropTables() throws SQLException {
        connection.close();
    }

    private String query(final String sql, final RowSetTest test) throws IOException, SQLException {
        final StringWriter sw = new StringWriter();
        try (Statement stmt = connection.createStatement(); ResultSet rows = stmt.executeQuery(sql)) {
            try (JsonWriter<WriterSink<StringWriter>> writer = new JsonWriter<>(new WriterSink<>(sw))) {
                test.execute(writer, rows);
            }
        }
        LOGGER.info("{}: {}", sql, sw);
        return sw.toString();
    }

    @Test
    public void testColumnTypes() throws IOException, SQLException {
        final String json = query("SELECT * FROM item ORDER BY id", (writer, rows) -> {
            writer.openObject();
            writer.write("items", rows);
            writer.closeObject();
        });

        final JsonQuery query = new JsonQuery(new JsonParser().parse(json));
        Assertions.assertEquals(2, query.getCount("items").intValue());
        Assertions.assertEquals(
                ImmutableList.of("ID", "NAME", "PRICE", "CREATED", "UPDATED", "ZONED", "ACTIVE", "FLAG", "NOTES"),
                query.getMembers("items[1]"));
        Assertions.assertEquals(BigDecimal.ONE, query.getNumber("items[1].ID"));
        Assertions.assertEquals("sword", query.getString("items[1].NAME"));
        Assertions.assertEquals(new BigDecimal("12.5"), query.getNumber("items[1].PRICE"));
        Assertions.assertEquals("2016-12-21T00:00:00Z", query.getString("items[1].CREATED"));
        Assertions.assertEquals("2016-12-21T16:46:39.123456Z", query.getString("items[1].UPDATED"));
        Assertions.assertEquals("2016-12-21T16:46:39.000000+02:00", query.getString("items[1].ZONED"));
        Assertions.assertEquals(Boolean.TRUE, query.getBoolean("items[1].ACTIVE"));
        Assertions.assertEquals(Boolean.TRUE, query.getBoolean("items[1].FLAG"));
        Assertions.assertEquals("long notes", query.getString("items[1].NOTES"));

        // null columns are omitted
        Assertions.assertEquals(ImmutableList.of("ID", "FLAG"), query.getMembers("items[2]"));
        Assertions.assertEquals("no", query.getString("items[2].FLAG"));
    }

    @Test
    public void testEmptyStructuredRowSet() throws IOException, SQLException {
        final String json = query("SELECT * FROM tagged WHERE id > 10", (writer, rows) -> {
            writer.openObject();
            writer.write("rows", rows);
            writer.closeObject();
        });
        Assertions.assertEquals("{\n\"rows\":[\n]\n}\n", json);
    }

    @Test
    public void testItemsWithLinks() throws IOException, SQLException {
        final List<Link> itemLinks = ImmutableList.of(Link.of("/items/#ID#/#NAME#", "self"));
        final List<Link> links = ImmutableList.of(Link.of("/items", "collection"));

        final StringWriter sw = new StringWriter();
        final JsonWriter<WriterSink<StringWriter>> writer = new JsonWriter<>(new WriterSink<>(sw));
        try (Statement stmt = connection.createStatement();
                ResultSet rows = stmt.executeQuery("SELECT id, name FROM item ORDER BY id")) {
            writer.writeItems(rows, itemLinks, links);
        }
        Assertions.assertEquals(0, writer.getLevel());
        Assertions.assertTrue(writer.getLinks().getNames().isEmpty());

        final JsonQuery query = new JsonQuery(new JsonParser().parse(sw.toString()));
        Assertions.assertEquals(ImmutableList.of("items", "links"), query.getMembers("."));
        Assertions.assertEquals("/items/1/sword", query.getString("items[1].links[1].href"));
        Assertions.assertEquals("self", query.getString("items[1].links[1].rel"));
        Assertions.assertEquals("/items/2/", query.getString("items[2].links[1].href"));
        Assertions.assertEquals("/items", query.getString("links[1].href"));
        Assertions.assertEquals("collection", query.getString("links[1].rel"));
    }

    @Test
    public void testClobPlaceholder() throws IOException, SQLException {
        final List<Link> itemLinks = ImmutableList.of(Link.of("/notes?text=#NOTES#", "notes"));
        final String json = query("SELECT id, notes FROM item ORDER BY id", (writer, rows) -> {
            writer.writeItems(rows, itemLinks, null);
        });

        final JsonQuery query = new JsonQuery(new JsonParser().parse(json));
        Assertions.assertEquals("long notes", query.getString("items[1].NOTES"));
        Assertions.assertEquals("/notes?text=long notes", query.getString("items[1].links[1].href"));
        Assertions.assertEquals("/notes?text=", query.getString("items[2].links[1].href"));
    }

    @Test
    public void testFailedRowClearsPlaceholders() throws IOException, SQLException {
        final List<Link> itemLinks = ImmutableList.of(Link.of("/items/#ID#", "self"));
        final StringWriter sw = new StringWriter();
        final JsonWriter<WriterSink<StringWriter>> writer = new JsonWriter<>(new WriterSink<>(sw));
        try (Statement stmt = connection.createStatement();
                ResultSet rows = stmt.executeQuery("SELECT id FROM item ORDER BY id")) {
            final SQLException e = Assertions.assertThrows(
                    SQLException.class,
                    () -> writer.writeItems(failAfterFirstRow(rows), itemLinks, null));
            Assertions.assertEquals("Connection reset", e.getMessage());
        }
        Assertions.assertTrue(writer.getLinks().getNames().isEmpty());
        Assertions.assertEquals("/items/#ID#", writer.getLinks().substitute("/items/#ID#"));
    }

    @Test
    public void testItemsInsideOpenObject() throws IOException, SQLException {
        final String json = query("SELECT id FROM item WHERE id = 2", (writer, rows) -> {
            writer.openObject();
            writer.write("count", 1);
            writer.writeItems(rows, null, null);
            writer.closeObject();
        });
        Assertions.assertEquals("{\n\"count\":1\n,\"items\":[\n{\n\"ID\":2\n}\n]\n}\n", json);
    }

    @Test
    public void testStructuredColumns() throws IOException, SQLException {
        final String json = query("SELECT * FROM tagged ORDER BY id", (writer, rows) -> {
            writer.openObject();
            writer.write("rows", rows);
            writer.closeObject();
        });

        final JsonQuery query = new JsonQuery(new JsonParser().parse(json));
        Assertions.assertEquals(2, query.getCount("rows").intValue());
        Assertions.assertEquals(BigDecimal.ONE, query.getNumber("rows[1].ID"));
        Assertions.assertEquals(ImmutableList.of("a", "b"), query.getStringArray("rows[1].TAGS"));
        Assertions.assertEquals(ImmutableList.of("c"), query.getStringArray("rows[2].TAGS"));
        Assertions.assertEquals(JsonValue.Kind.ARRAY, query.getValue("rows[2].TAGS").getKind());
    }

    @Test
    public void testStructuredColumnsWithLinks() throws IOException, SQLException {
        final UnsupportedOperationException e = Assertions.assertThrows(
                UnsupportedOperationException.class,
                () -> query("SELECT * FROM tagged", (writer, rows) -> {
                    writer.writeItems(rows, ImmutableList.of(Link.of("/tagged/#ID#", "self")), null);
                }));
        Assertions.assertEquals(RowSetWriter.RESTRICTION, e.getMessage());
    }

    @Test
    public void testUnnamedRowSet() throws IOException, SQLException {
        final String json = query("SELECT id, flag FROM item ORDER BY id", (writer, rows) -> {
            writer.openArray();
            writer.write(rows);
            writer.closeArray();
        });
        Assertions.assertEquals(
                "[\n[\n{\n\"ID\":1\n,\"FLAG\":true\n}\n,{\n\"ID\":2\n,\"FLAG\":\"no\"\n}\n]\n]\n",
                json);
    }
}
