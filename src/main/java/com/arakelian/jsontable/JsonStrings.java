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

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;

/**
 * JSON string escaping and conversion of scalar values to JSON text.
 */
public final class JsonStrings {
    /** Format of DATE values **/
    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");

    /** Format of TIMESTAMP values, and TIMESTAMP WITH LOCAL TIME ZONE values after conversion to UTC **/
    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'");

    /** Format of TIMESTAMP WITH TIME ZONE values **/
    public static final DateTimeFormatter TIMESTAMP_TZ_FORMAT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSSxxx");

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    /** replacement for each ASCII character, or null if it is copied as is **/
    private static final String[] ESCAPES = new String[128];

    static {
        for (int ch = 0; ch < 32; ch++) {
            ESCAPES[ch] = unicode(ch);
        }
        ESCAPES[127] = unicode(127);
        ESCAPES['"'] = "\\\"";
        ESCAPES['\\'] = "\\u005C";
        ESCAPES['/'] = "\\/";
        ESCAPES['\b'] = "\\b";
        ESCAPES['\n'] = "\\n";
        ESCAPES['\r'] = "\\r";
        ESCAPES['\t'] = "\\t";
        for (final char ch : "&<>'`".toCharArray()) {
            ESCAPES[ch] = unicode(ch);
        }
    }

    /**
     * Returns the body of a JSON string literal (without quotes) for the given text. Quote,
     * solidus, backspace, line feed, carriage return and tab use short escapes; backslash, other
     * control characters, {@code & < > ' `} and every non-ASCII UTF-16 unit use {@code \}{@code uXXXX}.
     *
     * @param text
     *            text to escape; may be null
     * @return escaped text, empty if text is null
     */
    public static String escape(final CharSequence text) {
        if (text == null) {
            return "";
        }
        final StringBuilder buf = new StringBuilder(text.length() + 16);
        escape(text, 0, text.length(), buf);
        return buf.toString();
    }

    static void escape(final CharSequence text, final int start, final int end, final StringBuilder buf) {
        for (int i = start; i < end; i++) {
            final char ch = text.charAt(i);
            if (ch < 128) {
                final String esc = ESCAPES[ch];
                if (esc == null) {
                    buf.append(ch);
                } else {
                    buf.append(esc);
                }
            } else {
                buf.append(unicode(ch));
            }
        }
    }

    /**
     * Returns the member name for the given path form, reversing {@link #toMemberName(String)}.
     *
     * @param member
     *            member name as it appears in a path
     * @return member name
     */
    public static String fromMemberName(final String member) {
        if (member.length() >= 2 && member.charAt(0) == '"' && member.charAt(member.length() - 1) == '"') {
            return member.substring(1, member.length() - 1).replace("\\\"", "\"");
        }
        return member;
    }

    /**
     * Returns true if the name consists only of ASCII letters, digits and underscores, and may
     * therefore be used in a path or written as a member name without quoting.
     *
     * @param name
     *            member name
     * @return true if name is a simple name
     */
    public static boolean isSimpleName(final CharSequence name) {
        if (name == null || name.length() == 0) {
            return false;
        }
        for (int i = 0, length = name.length(); i < length; i++) {
            final char ch = name.charAt(i);
            if (!(ch >= 'a' && ch <= 'z' || ch >= 'A' && ch <= 'Z' || ch >= '0' && ch <= '9' || ch == '_')) {
                return false;
            }
        }
        return true;
    }

    public static String stringify(final BigDecimal value) {
        if (value == null) {
            return "null";
        }
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }

    public static String stringify(final Boolean value) {
        return value == null ? "null" : value.booleanValue() ? "true" : "false";
    }

    public static String stringify(final Instant value) {
        return value == null ? "null" : stringify(value.atOffset(ZoneOffset.UTC), TIMESTAMP_FORMAT);
    }

    public static String stringify(final LocalDate value) {
        return value == null ? "null" : stringify(value.atStartOfDay(), DATE_FORMAT);
    }

    public static String stringify(final LocalDateTime value) {
        return stringify(value, TIMESTAMP_FORMAT);
    }

    /**
     * Returns a numeric literal; NaN and infinite values become {@code null}.
     *
     * @param value
     *            number to convert
     * @return numeric literal or null
     */
    public static String stringify(final Number value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof BigDecimal) {
            return stringify((BigDecimal) value);
        }
        if (value instanceof Double || value instanceof Float) {
            final double d = value.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return "null";
            }
            return stringify(BigDecimal.valueOf(d));
        }
        return stringify(new BigDecimal(value.toString()));
    }

    public static String stringify(final OffsetDateTime value) {
        return stringify(value, TIMESTAMP_TZ_FORMAT);
    }

    public static String stringify(final String value) {
        if (value == null) {
            return "null";
        }
        return "\"" + escape(value) + "\"";
    }

    /**
     * Formats a date or time as a JSON string literal.
     *
     * @param value
     *            date or time to format; may be null
     * @param format
     *            formatter to use
     * @return string literal, or {@code null} if value is null
     */
    public static String stringify(final TemporalAccessor value, final DateTimeFormatter format) {
        if (value == null) {
            return "null";
        }
        return "\"" + escape(format.format(value)) + "\"";
    }

    /**
     * Returns the form of a member name used in paths: simple names are used as is, any other
     * name is enclosed in double quotes with embedded double quotes preceded by a backslash.
     *
     * @param name
     *            member name
     * @return member name as it appears in a path
     */
    public static String toMemberName(final String name) {
        if (isSimpleName(name)) {
            return name;
        }
        return "\"" + name.replace("\"", "\\\"") + "\"";
    }

    private static String unicode(final int ch) {
        return new String(new char[] { '\\', 'u', HEX[ch >> 12 & 0xF], HEX[ch >> 8 & 0xF], HEX[ch >> 4 & 0xF],
                HEX[ch & 0xF] });
    }

    private JsonStrings() {
        // utility class
    }
}
