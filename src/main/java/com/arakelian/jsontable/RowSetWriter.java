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
import java.math.BigDecimal;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.sql.Struct;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.List;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.dom.DOMSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.common.io.CharStreams;

/**
 * Writes the rows of a {@link ResultSet} as a JSON array of objects, one member per non-null
 * column, named by the column label.
 *
 * If any column has a structured type (array, struct, ref cursor or Java object), the whole row
 * set is converted to markup and written through {@link XmlToJson}. That conversion does not
 * support links.
 */
final class RowSetWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(RowSetWriter.class);

    static final String RESTRICTION = "implementation restriction: nested type and cursor columns not supported";

    private static boolean isNumeric(final int type) {
        switch (type) {
        case Types.BIGINT:
        case Types.DECIMAL:
        case Types.DOUBLE:
        case Types.FLOAT:
        case Types.INTEGER:
        case Types.NUMERIC:
        case Types.REAL:
        case Types.SMALLINT:
        case Types.TINYINT:
            return true;
        default:
            return false;
        }
    }

    private static boolean isStructured(final int type) {
        switch (type) {
        case Types.ARRAY:
        case Types.JAVA_OBJECT:
        case Types.REF_CURSOR:
        case Types.STRUCT:
            return true;
        default:
            return false;
        }
    }

    private final JsonWriter<?> writer;

    RowSetWriter(final JsonWriter<?> writer) {
        this.writer = Preconditions.checkNotNull(writer);
    }

    private void appendColumn(final Document doc, final Element row, final String name, final Object value)
            throws SQLException {
        if (value == null) {
            return;
        }
        final Element column = doc.createElement(name);
        row.appendChild(column);
        if (value instanceof Array) {
            final Object[] elements = (Object[]) ((Array) value).getArray();
            for (final Object element : elements) {
                final Element item = doc.createElement(name + "_ROW");
                column.appendChild(item);
                if (element != null) {
                    item.setTextContent(toText(element));
                }
            }
        } else if (value instanceof Struct) {
            final Object[] attributes = ((Struct) value).getAttributes();
            for (int i = 0; i < attributes.length; i++) {
                if (attributes[i] != null) {
                    final Element attr = doc.createElement("ATTR_" + (i + 1));
                    attr.setTextContent(toText(attributes[i]));
                    column.appendChild(attr);
                }
            }
        } else if (value instanceof ResultSet) {
            appendRows(doc, column, (ResultSet) value);
        } else {
            column.setTextContent(toText(value));
        }
    }

    private int appendRows(final Document doc, final Element parent, final ResultSet rows) throws SQLException {
        final ResultSetMetaData meta = rows.getMetaData();
        final int columns = meta.getColumnCount();
        int count = 0;
        while (rows.next()) {
            final Element row = doc.createElement(parent.getParentNode() == doc ? "ROW" : parent.getTagName() + "_ROW");
            parent.appendChild(row);
            for (int i = 1; i <= columns; i++) {
                final Object value = readColumn(rows, meta.getColumnType(i), i);
                appendColumn(doc, row, XmlHandler.fixXmlName(meta.getColumnLabel(i)), value);
            }
            count++;
        }
        return count;
    }

    private Object readColumn(final ResultSet rows, final int type, final int column) throws SQLException {
        switch (type) {
        case Types.DATE:
            return rows.getObject(column, LocalDate.class);
        case Types.TIMESTAMP:
            return rows.getObject(column, LocalDateTime.class);
        case Types.TIMESTAMP_WITH_TIMEZONE:
            return rows.getObject(column, OffsetDateTime.class);
        default:
            return isNumeric(type) ? rows.getBigDecimal(column) : rows.getObject(column);
        }
    }

    private String toText(final Object value) {
        if (value instanceof LocalDate) {
            return JsonStrings.DATE_FORMAT.format(((LocalDate) value).atStartOfDay());
        }
        if (value instanceof LocalDateTime) {
            return JsonStrings.TIMESTAMP_FORMAT.format((LocalDateTime) value);
        }
        if (value instanceof OffsetDateTime) {
            return JsonStrings.TIMESTAMP_TZ_FORMAT.format((OffsetDateTime) value);
        }
        if (value instanceof Number) {
            return JsonStrings.stringify((Number) value);
        }
        return value.toString();
    }

    /**
     * Writes the rows of the given result set.
     *
     * @param name
     *            member name of the array, or null to write an array element
     * @param rows
     *            result set, positioned before the first row
     * @param links
     *            links written in every row, or null
     * @throws IOException
     *             if the output cannot be written
     * @throws SQLException
     *             if the result set cannot be read
     * @throws UnsupportedOperationException
     *             if links are given and a column has a structured type
     */
    void write(@Nullable final String name, final ResultSet rows, @Nullable final List<Link> links)
            throws IOException, SQLException {
        Preconditions.checkNotNull(rows);
        final ResultSetMetaData meta = rows.getMetaData();
        final int columns = meta.getColumnCount();
        for (int i = 1; i <= columns; i++) {
            if (isStructured(meta.getColumnType(i))) {
                if (links != null) {
                    throw new UnsupportedOperationException(RESTRICTION);
                }
                writeAsXml(name, rows);
                return;
            }
        }

        final Links placeholders = writer.getLinks();
        if (links != null) {
            placeholders.addPlaceholders(links);
        }
        try {
            final String[] labels = new String[columns + 1];
            final int[] types = new int[columns + 1];
            for (int i = 1; i <= columns; i++) {
                labels[i] = meta.getColumnLabel(i);
                types[i] = meta.getColumnType(i);
            }

            writer.openArray(name);
            int count = 0;
            while (rows.next()) {
                writer.openObject();
                for (int i = 1; i <= columns; i++) {
                    writeColumn(rows, i, labels[i], types[i], placeholders);
                }
                if (links != null) {
                    writer.writeLinks(links);
                }
                writer.closeObject();
                count++;
            }
            writer.closeArray();
            LOGGER.trace("Wrote {} row(s) of {} column(s)", count, columns);
        } finally {
            if (links != null) {
                placeholders.clear();
            }
        }
    }

    private void writeAsXml(final String name, final ResultSet rows) throws IOException, SQLException {
        final Document doc;
        try {
            final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            doc = factory.newDocumentBuilder().newDocument();
        } catch (final ParserConfigurationException e) {
            throw new IOException("Unable to create XML document", e);
        }
        final Element rowset = doc.createElement("ROWSET");
        doc.appendChild(rowset);
        final int count = appendRows(doc, rowset, rows);
        LOGGER.debug("Converted {} row(s) with structured columns to XML", count);

        if (count == 0) {
            writer.openArray(name);
            writer.closeArray();
        } else if (name != null) {
            writer.write(name, doc);
        } else {
            writer.write(doc);
        }
    }

    private void writeColumn(
            final ResultSet rows,
            final int column,
            final String label,
            final int type,
            final Links placeholders) throws IOException, SQLException {
        final boolean placeholder = placeholders.isPlaceholder(label);
        switch (type) {
        case Types.DATE: {
            final LocalDate value = rows.getObject(column, LocalDate.class);
            writer.write(label, value);
            if (placeholder) {
                placeholders.set(label, value != null ? toText(value) : null);
            }
            break;
        }
        case Types.TIMESTAMP: {
            final LocalDateTime value = rows.getObject(column, LocalDateTime.class);
            writer.write(label, value);
            if (placeholder) {
                placeholders.set(label, value != null ? toText(value) : null);
            }
            break;
        }
        case Types.TIMESTAMP_WITH_TIMEZONE: {
            final OffsetDateTime value = rows.getObject(column, OffsetDateTime.class);
            writer.write(label, value);
            if (placeholder) {
                placeholders.set(label, value != null ? toText(value) : null);
            }
            break;
        }
        case Types.BIT:
        case Types.BOOLEAN: {
            final boolean value = rows.getBoolean(column);
            final Boolean b = rows.wasNull() ? null : Boolean.valueOf(value);
            writer.write(label, b);
            if (placeholder) {
                placeholders.set(label, b != null ? b.toString() : null);
            }
            break;
        }
        case Types.CLOB:
        case Types.NCLOB: {
            String value = null;
            try (Reader reader = rows.getCharacterStream(column)) {
                if (reader != null) {
                    value = CharStreams.toString(reader);
                    writer.write(label, LargeText.of(value));
                }
            }
            if (placeholder) {
                placeholders.set(label, value);
            }
            break;
        }
        case Types.SQLXML: {
            final SQLXML xml = rows.getSQLXML(column);
            if (xml != null) {
                try {
                    final Node node = xml.getSource(DOMSource.class).getNode();
                    writer.write(label, node);
                } finally {
                    xml.free();
                }
            }
            break;
        }
        default:
            if (isNumeric(type)) {
                final BigDecimal value = rows.getBigDecimal(column);
                writer.write(label, value);
                if (placeholder) {
                    placeholders.set(label, value != null ? JsonStrings.stringify(value) : null);
                }
            } else {
                final String value = rows.getString(column);
                if (value != null && value.length() == 4 && Ascii.equalsIgnoreCase(value, "true")) {
                    writer.write(label, Boolean.TRUE);
                } else if (value != null && value.length() == 5 && Ascii.equalsIgnoreCase(value, "false")) {
                    writer.write(label, Boolean.FALSE);
                } else {
                    writer.write(label, value);
                }
                if (placeholder) {
                    placeholders.set(label, value);
                }
            }
            break;
        }
    }
}
