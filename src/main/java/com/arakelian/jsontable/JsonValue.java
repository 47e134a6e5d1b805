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
import java.util.List;
import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A single entry of a {@link JsonValues} table. Scalars carry their value; an object carries the
 * names of its members in document order, and an array carries its element count. Children of a
 * container are stored in the table under their own paths.
 */
public final class JsonValue {
    public enum Kind {
        NULL, TRUE, FALSE, NUMBER, STRING, OBJECT, ARRAY, LARGE_TEXT;
    }

    public static final JsonValue NULL = new JsonValue(Kind.NULL, null, null, null, ImmutableList.of(), 0);

    public static final JsonValue TRUE = new JsonValue(Kind.TRUE, null, null, null, ImmutableList.of(), 0);

    public static final JsonValue FALSE = new JsonValue(Kind.FALSE, null, null, null, ImmutableList.of(), 0);

    public static JsonValue array(final int count) {
        Preconditions.checkArgument(count >= 0, "count must be non-negative");
        return new JsonValue(Kind.ARRAY, null, null, null, ImmutableList.of(), count);
    }

    public static JsonValue largeText(final LargeText text) {
        return new JsonValue(Kind.LARGE_TEXT, null, null, Preconditions.checkNotNull(text), ImmutableList.of(),
                0);
    }

    public static JsonValue number(final BigDecimal number) {
        return new JsonValue(Kind.NUMBER, Preconditions.checkNotNull(number), null, null, ImmutableList.of(), 0);
    }

    public static JsonValue object(final List<String> members) {
        return new JsonValue(Kind.OBJECT, null, null, null, ImmutableList.copyOf(members), 0);
    }

    public static JsonValue of(final boolean value) {
        return value ? TRUE : FALSE;
    }

    public static JsonValue string(final String string) {
        return new JsonValue(Kind.STRING, null, Preconditions.checkNotNull(string), null, ImmutableList.of(), 0);
    }

    private final Kind kind;

    private final BigDecimal number;

    private final String string;

    private final LargeText largeText;

    /** member names, in the form used in paths **/
    private final ImmutableList<String> members;

    private final int count;

    private JsonValue(
            final Kind kind,
            final BigDecimal number,
            final String string,
            final LargeText largeText,
            final ImmutableList<String> members,
            final int count) {
        this.kind = kind;
        this.number = number;
        this.string = string;
        this.largeText = largeText;
        this.members = members;
        this.count = count;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof JsonValue)) {
            return false;
        }
        final JsonValue other = (JsonValue) obj;
        return kind == other.kind //
                && count == other.count //
                && (number == null ? other.number == null
                        : other.number != null && number.compareTo(other.number) == 0)
                && Objects.equals(string, other.string) //
                && Objects.equals(largeText, other.largeText) //
                && members.equals(other.members);
    }

    /**
     * Returns the element count of an array, or the member count of an object.
     *
     * @return element or member count
     */
    public int getCount() {
        return kind == Kind.OBJECT ? members.size() : count;
    }

    public Kind getKind() {
        return kind;
    }

    @Nullable
    public LargeText getLargeText() {
        return largeText;
    }

    public List<String> getMembers() {
        return members;
    }

    @Nullable
    public BigDecimal getNumber() {
        return number;
    }

    @Nullable
    public String getString() {
        return string;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, number != null ? number.stripTrailingZeros() : null, string, members, count);
    }

    public boolean isContainer() {
        return kind == Kind.OBJECT || kind == Kind.ARRAY;
    }

    public boolean isScalar() {
        return !isContainer();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this) //
                .omitNullValues() //
                .add("kind", kind) //
                .add("number", number) //
                .add("string", string) //
                .add("largeText", largeText != null ? largeText.isFreed() ? "<freed>" : largeText.length() : null) //
                .add("members", kind == Kind.OBJECT ? members : null) //
                .add("count", kind == Kind.ARRAY ? count : null) //
                .toString();
    }
}
