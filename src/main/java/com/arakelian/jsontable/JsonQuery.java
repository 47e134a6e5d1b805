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
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Typed access to the values of a {@link JsonValues} table.
 *
 * Paths may contain placeholders which are replaced by arguments, see {@link PathFormat}. A path
 * that does not exist yields the given default value (or null); a value that cannot be converted
 * to the requested type raises a {@link JsonTypeException}.
 */
public final class JsonQuery {
    /**
     * Value selected by a path.
     */
    public final class Selection {
        private final String path;

        private final JsonValue value;

        private Selection(final String path) {
            this.path = path;
            this.value = values.get(path);
        }

        public boolean exists() {
            return value != null;
        }

        @Nullable
        public Boolean getBoolean() {
            return getBoolean(null);
        }

        @Nullable
        public Boolean getBoolean(@Nullable final Boolean defaultValue) {
            if (value == null) {
                return defaultValue;
            }
            switch (value.getKind()) {
            case NULL:
                return null;
            case TRUE:
                return Boolean.TRUE;
            case FALSE:
                return Boolean.FALSE;
            default:
                throw new JsonTypeException(path, value.getKind(), "boolean");
            }
        }

        /**
         * Returns the number of members of an object or elements of an array, or null if the path
         * does not exist.
         *
         * @return number of members or elements, or null
         */
        @Nullable
        public Integer getCount() {
            if (value == null) {
                return null;
            }
            if (!value.isContainer()) {
                throw new JsonTypeException(path, value.getKind(), "object or array");
            }
            return value.getCount();
        }

        @Nullable
        public LocalDateTime getDate() {
            return getDate(null, null, null);
        }

        /**
         * Returns a string value parsed as a date.
         *
         * @param defaultValue
         *            returned if the path does not exist
         * @param format
         *            format of the string; by default {@code yyyy-MM-dd'T'HH:mm:ss'Z'}, or an
         *            ISO-8601 timestamp with offset if a time zone is given
         * @param atTimeZone
         *            if given, the parsed value is converted to this time zone
         * @return date, or null
         */
        @Nullable
        public LocalDateTime getDate(
                @Nullable final LocalDateTime defaultValue,
                @Nullable final DateTimeFormatter format,
                @Nullable final ZoneId atTimeZone) {
            return getLocalDateTime(defaultValue, format, atTimeZone, JsonStrings.DATE_FORMAT);
        }

        @Nullable
        public LargeText getLargeText() {
            return getLargeText(null);
        }

        /**
         * Returns a scalar value as a large text. The returned text is owned by the table unless
         * it had to be created from a smaller value.
         *
         * @param defaultValue
         *            returned if the path does not exist
         * @return large text, or null
         */
        @Nullable
        public LargeText getLargeText(@Nullable final LargeText defaultValue) {
            if (value == null) {
                return defaultValue;
            }
            if (value.getKind() == JsonValue.Kind.LARGE_TEXT) {
                return value.getLargeText();
            }
            final String text = toText("large text");
            return text != null ? LargeText.of(text) : null;
        }

        private LocalDateTime getLocalDateTime(
                final LocalDateTime defaultValue,
                final DateTimeFormatter format,
                final ZoneId atTimeZone,
                final DateTimeFormatter defaultFormat) {
            if (value == null) {
                return defaultValue;
            }
            final String text = dateText();
            if (text == null) {
                return null;
            }
            try {
                if (atTimeZone == null) {
                    return LocalDateTime.parse(text, format != null ? format : defaultFormat);
                }
                return OffsetDateTime.parse(text, format != null ? format : TIMESTAMP_TZ_PARSER)
                        .atZoneSameInstant(atTimeZone).toLocalDateTime();
            } catch (final DateTimeParseException e) {
                throw new JsonTypeException(path, value.getKind(), "date \"" + text + "\"", e);
            }
        }

        @Nullable
        public List<String> getMembers() {
            if (value == null) {
                return null;
            }
            if (value.getKind() != JsonValue.Kind.OBJECT) {
                throw new JsonTypeException(path, value.getKind(), "object");
            }
            return value.getMembers();
        }

        @Nullable
        public BigDecimal getNumber() {
            return getNumber(null);
        }

        @Nullable
        public BigDecimal getNumber(@Nullable final BigDecimal defaultValue) {
            if (value == null) {
                return defaultValue;
            }
            return asNumber(path, value);
        }

        /**
         * Returns the elements of an array converted to numbers. A scalar is returned as a list
         * with one element; elements which are missing from the table are null.
         *
         * @return elements of the array, or null if the path does not exist
         */
        @Nullable
        public List<BigDecimal> getNumberArray() {
            if (value == null) {
                return null;
            }
            if (value.getKind() != JsonValue.Kind.ARRAY) {
                return Collections.singletonList(asNumber(path, value));
            }
            final List<BigDecimal> result = new ArrayList<>(value.getCount());
            for (int i = 1, count = value.getCount(); i <= count; i++) {
                final String element = elementPath(path, i);
                final JsonValue v = values.get(element);
                result.add(v != null ? asNumber(element, v) : null);
            }
            return result;
        }

        public String getPath() {
            return path;
        }

        @Nullable
        public String getString() {
            return getString(null);
        }

        @Nullable
        public String getString(@Nullable final String defaultValue) {
            if (value == null) {
                return defaultValue;
            }
            return asString(path, value);
        }

        /**
         * Returns the elements of an array converted to strings. A scalar is returned as a list
         * with one element; elements which are missing from the table are null.
         *
         * @return elements of the array, or null if the path does not exist
         */
        @Nullable
        public List<String> getStringArray() {
            if (value == null) {
                return null;
            }
            if (value.getKind() != JsonValue.Kind.ARRAY) {
                return Collections.singletonList(asString(path, value));
            }
            final List<String> result = new ArrayList<>(value.getCount());
            for (int i = 1, count = value.getCount(); i <= count; i++) {
                final String element = elementPath(path, i);
                final JsonValue v = values.get(element);
                result.add(v != null ? asString(element, v) : null);
            }
            return result;
        }

        @Nullable
        public LocalDateTime getTimestamp() {
            return getTimestamp(null, null, null);
        }

        @Nullable
        public LocalDateTime getTimestamp(
                @Nullable final LocalDateTime defaultValue,
                @Nullable final DateTimeFormatter format,
                @Nullable final ZoneId atTimeZone) {
            return getLocalDateTime(defaultValue, format, atTimeZone, TIMESTAMP_PARSER);
        }

        @Nullable
        public Instant getTimestampLtz() {
            return getTimestampLtz(null, null);
        }

        @Nullable
        public Instant getTimestampLtz(@Nullable final Instant defaultValue, @Nullable final DateTimeFormatter format) {
            if (value == null) {
                return defaultValue;
            }
            final OffsetDateTime timestamp = getTimestampTz(null, format);
            return timestamp != null ? timestamp.toInstant() : null;
        }

        @Nullable
        public OffsetDateTime getTimestampTz() {
            return getTimestampTz(null, null);
        }

        @Nullable
        public OffsetDateTime getTimestampTz(
                @Nullable final OffsetDateTime defaultValue,
                @Nullable final DateTimeFormatter format) {
            if (value == null) {
                return defaultValue;
            }
            final String text = dateText();
            if (text == null) {
                return null;
            }
            try {
                return OffsetDateTime.parse(text, format != null ? format : TIMESTAMP_TZ_PARSER);
            } catch (final DateTimeParseException e) {
                throw new JsonTypeException(path, value.getKind(), "timestamp \"" + text + "\"", e);
            }
        }

        @Nullable
        public JsonValue getValue() {
            return value;
        }

        private String dateText() {
            switch (value.getKind()) {
            case NULL:
                return null;
            case STRING:
                return value.getString();
            default:
                throw new JsonTypeException(path, value.getKind(), "date");
            }
        }

        private String toText(final String requested) {
            switch (value.getKind()) {
            case NULL:
                return null;
            case TRUE:
                return "true";
            case FALSE:
                return "false";
            case NUMBER:
                return JsonStrings.stringify(value.getNumber());
            case STRING:
                return value.getString();
            default:
                throw new JsonTypeException(path, value.getKind(), requested);
            }
        }

        @Override
        public String toString() {
            return path + "=" + value;
        }
    }

    /** Timestamp without offset, fraction optional **/
    static final DateTimeFormatter TIMESTAMP_PARSER = new DateTimeFormatterBuilder() //
            .appendPattern("yyyy-MM-dd'T'HH:mm:ss") //
            .optionalStart() //
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true) //
            .optionalEnd() //
            .appendLiteral('Z') //
            .toFormatter();

    /** Timestamp with offset or {@code Z}, fraction optional **/
    static final DateTimeFormatter TIMESTAMP_TZ_PARSER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private static String elementPath(final String path, final int index) {
        return (JsonValues.ROOT.equals(path) ? "" : path) + "[" + index + "]";
    }

    private static BigDecimal asNumber(final String path, final JsonValue value) {
        switch (value.getKind()) {
        case NULL:
            return null;
        case NUMBER:
            return value.getNumber();
        case STRING:
            try {
                return new BigDecimal(value.getString().trim());
            } catch (final NumberFormatException e) {
                throw new JsonTypeException(path, value.getKind(), "number", e);
            }
        default:
            throw new JsonTypeException(path, value.getKind(), "number");
        }
    }

    private static String asString(final String path, final JsonValue value) {
        switch (value.getKind()) {
        case NULL:
            return null;
        case TRUE:
            return "true";
        case FALSE:
            return "false";
        case NUMBER:
            return JsonStrings.stringify(value.getNumber());
        case STRING:
            return value.getString();
        default:
            throw new JsonTypeException(path, value.getKind(), "string");
        }
    }

    private final JsonValues values;

    public JsonQuery(final JsonValues values) {
        this.values = Preconditions.checkNotNull(values);
    }

    public boolean exists(final String path, final Object... args) {
        return select(path, args).exists();
    }

    /**
     * Returns the paths of values matching a pattern, see {@link PathSearch}.
     *
     * @param returnPath
     *            pattern of the paths to be returned
     * @param subpath
     *            pattern of a path below the returned path which must exist, or null
     * @param value
     *            pattern of the value at the subpath, or null
     * @return matching paths, in document order
     */
    public List<String> findPathsLike(
            final String returnPath,
            @Nullable final String subpath,
            @Nullable final String value) {
        return new PathSearch(values).findPathsLike(returnPath, subpath, value);
    }

    @Nullable
    public Boolean getBoolean(final String path, final Object... args) {
        return select(path, args).getBoolean();
    }

    @Nullable
    public Integer getCount(final String path, final Object... args) {
        return select(path, args).getCount();
    }

    @Nullable
    public LocalDateTime getDate(final String path, final Object... args) {
        return select(path, args).getDate();
    }

    @Nullable
    public LargeText getLargeText(final String path, final Object... args) {
        return select(path, args).getLargeText();
    }

    @Nullable
    public List<String> getMembers(final String path, final Object... args) {
        return select(path, args).getMembers();
    }

    @Nullable
    public BigDecimal getNumber(final String path, final Object... args) {
        return select(path, args).getNumber();
    }

    @Nullable
    public List<BigDecimal> getNumberArray(final String path, final Object... args) {
        return select(path, args).getNumberArray();
    }

    @Nullable
    public String getString(final String path, final Object... args) {
        return select(path, args).getString();
    }

    @Nullable
    public List<String> getStringArray(final String path, final Object... args) {
        return select(path, args).getStringArray();
    }

    @Nullable
    public LocalDateTime getTimestamp(final String path, final Object... args) {
        return select(path, args).getTimestamp();
    }

    @Nullable
    public Instant getTimestampLtz(final String path, final Object... args) {
        return select(path, args).getTimestampLtz();
    }

    @Nullable
    public OffsetDateTime getTimestampTz(final String path, final Object... args) {
        return select(path, args).getTimestampTz();
    }

    @Nullable
    public JsonValue getValue(final String path, final Object... args) {
        return select(path, args).getValue();
    }

    public JsonValues getValues() {
        return values;
    }

    /**
     * Selects the value at the given path, after substituting the given arguments.
     *
     * @param path
     *            path, possibly containing placeholders
     * @param args
     *            arguments
     * @return the selected value
     */
    public Selection select(final String path, final Object... args) {
        return new Selection(PathFormat.format(Preconditions.checkNotNull(path), args));
    }
}
