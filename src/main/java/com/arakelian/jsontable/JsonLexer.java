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
import java.math.BigDecimal;

import com.google.common.base.Preconditions;

/**
 * Converts the characters of a {@link CharReader} into JSON tokens.
 *
 * Numbers are recognized by a fixed grammar, {@code -?digit+(.digit+)?([eE][+-]?digit+)?}, and
 * never depend on locale settings. String literals longer than {@link #MAX_STRING_LENGTH}
 * characters are accumulated in a {@link LargeTextSink} and returned as a {@link LargeText}.
 */
public final class JsonLexer {
    public enum Symbol {
        EOF("<eof>"), //
        BEGIN_ARRAY("["), //
        BEGIN_OBJECT("{"), //
        END_ARRAY("]"), //
        END_OBJECT("}"), //
        COLON(":"), //
        COMMA(","), //
        FALSE("false"), //
        TRUE("true"), //
        NULL("null"), //
        NUMBER("<number>"), //
        STRING("<string>");

        private final String display;

        private Symbol(final String display) {
            this.display = display;
        }

        @Override
        public String toString() {
            return display;
        }
    }

    /** Longest string literal that is returned as a {@link String} **/
    public static final int MAX_STRING_LENGTH = 8190;

    private static String display(final int ch) {
        return ch == -1 ? "<eof>" : String.valueOf((char) ch);
    }

    private static boolean isDigit(final int ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isLiteralPart(final int ch) {
        return isLiteralStart(ch) || isDigit(ch);
    }

    private static boolean isLiteralStart(final int ch) {
        return ch >= 'a' && ch <= 'z' || ch >= 'A' && ch <= 'Z' || ch == '_';
    }

    private final CharReader reader;

    private final boolean strict;

    /** current token **/
    private Symbol symbol;

    /** text of current string token, if it was not spilled **/
    private String string;

    /** value of current number token **/
    private BigDecimal number;

    /** value of current string token, if it was spilled; owned by lexer until taken **/
    private LargeText largeText;

    private int line;

    private int column;

    private final StringBuilder buf = new StringBuilder();

    public JsonLexer(final CharReader reader, final boolean strict) {
        this.reader = Preconditions.checkNotNull(reader);
        this.strict = strict;
    }

    /**
     * Returns an exception positioned at the start of the current token.
     *
     * @param msg
     *            error message
     * @return exception positioned at the start of the current token
     */
    public JsonParseException error(final String msg) {
        return new JsonParseException(line, column, msg);
    }

    /**
     * Releases a spilled string that was not taken by the caller.
     */
    public void free() {
        if (largeText != null) {
            largeText.free();
            largeText = null;
        }
    }

    public int getColumn() {
        return column;
    }

    public int getLine() {
        return line;
    }

    @Nullable
    public BigDecimal getNumber() {
        return number;
    }

    @Nullable
    public String getString() {
        return string;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public boolean isLargeText() {
        return largeText != null;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Advances to the next token.
     *
     * @return the next token
     * @throws IOException
     *             if the input cannot be read or is not valid JSON
     */
    public Symbol next() throws IOException {
        free();
        string = null;
        number = null;

        final int ch = reader.readNonWhitespace();
        line = reader.getLine();
        column = reader.getColumn();

        switch (ch) {
        case -1:
            return symbol = Symbol.EOF;
        case '[':
            return symbol = Symbol.BEGIN_ARRAY;
        case ']':
            return symbol = Symbol.END_ARRAY;
        case '{':
            return symbol = Symbol.BEGIN_OBJECT;
        case '}':
            return symbol = Symbol.END_OBJECT;
        case ':':
            return symbol = Symbol.COLON;
        case ',':
            return symbol = Symbol.COMMA;
        case '"':
            readString();
            return symbol = Symbol.STRING;
        case '-':
            final int digit = reader.readNonWhitespace();
            if (!isDigit(digit)) {
                throw error("expected 0-9 after minus sign, not \"" + display(digit) + "\"");
            }
            readNumber("-", digit);
            return symbol = Symbol.NUMBER;
        default:
            if (isDigit(ch)) {
                readNumber("", ch);
                return symbol = Symbol.NUMBER;
            }
            if (isLiteralStart(ch)) {
                return symbol = readLiteral(ch);
            }
            throw error("Unexpected character \"" + display(ch) + "\"");
        }
    }

    /**
     * Returns the spilled value of the current string token and transfers its ownership to the
     * caller.
     *
     * @return spilled value of the current string token, or null
     */
    @Nullable
    public LargeText takeLargeText() {
        final LargeText text = largeText;
        largeText = null;
        return text;
    }

    @Override
    public String toString() {
        return symbol + " at line " + line + ", col " + column;
    }

    private int readHex() throws IOException {
        final StringBuilder hex = new StringBuilder(4);
        int code = 0;
        for (int i = 0; i < 4; i++) {
            final int ch = reader.read();
            if (ch == -1) {
                throw error("Unterminated quoted string");
            }
            hex.append((char) ch);
            code = code << 4 | Character.digit(ch, 16);
        }
        if (code < 0) {
            throw error("\"\\u" + hex + "\" is not a valid hex string");
        }
        return code;
    }

    private Symbol readLiteral(final int first) throws IOException {
        buf.setLength(0);
        buf.append((char) first);
        int ch;
        while (isLiteralPart(ch = reader.read())) {
            buf.append((char) ch);
        }
        switch (ch) {
        case ' ':
        case '\t':
        case '\n':
        case '\r':
            break;
        default:
            reader.unread(ch);
        }

        final String literal = buf.toString();
        switch (literal) {
        case "null":
            return Symbol.NULL;
        case "true":
            return Symbol.TRUE;
        case "false":
            return Symbol.FALSE;
        default:
            if (strict) {
                throw error("strict mode JSON parser does not allow unquoted literals");
            }
            string = literal;
            return Symbol.STRING;
        }
    }

    private void readNumber(final String sign, final int first) throws IOException {
        buf.setLength(0);
        buf.append(sign).append((char) first);

        // 1=integer digits, 2=after '.', 3=fraction digits, 4=after 'e', 5=after exponent sign,
        // 6=exponent digits
        int state = 1;
        for (;;) {
            final int ch = reader.read();
            final int next;
            switch (state) {
            case 1:
                next = isDigit(ch) ? 1 : ch == '.' ? 2 : ch == 'e' || ch == 'E' ? 4 : 0;
                break;
            case 2:
                next = isDigit(ch) ? 3 : -1;
                break;
            case 3:
                next = isDigit(ch) ? 3 : ch == 'e' || ch == 'E' ? 4 : 0;
                break;
            case 4:
                next = isDigit(ch) ? 6 : ch == '+' || ch == '-' ? 5 : -1;
                break;
            case 5:
            case 6:
                next = isDigit(ch) ? 6 : state == 6 ? 0 : -1;
                break;
            default:
                throw new IllegalStateException("Invalid number state " + state);
            }

            if (next == 0) {
                reader.unread(ch);
                try {
                    number = new BigDecimal(buf.toString());
                } catch (final NumberFormatException e) {
                    // exponent outside int range
                    throw error("Invalid number: " + buf);
                }
                return;
            }
            if (next == -1) {
                throw error("Invalid number: " + buf + (ch == -1 ? "" : String.valueOf((char) ch)));
            }
            buf.append((char) ch);
            state = next;
        }
    }

    private void readString() throws IOException {
        buf.setLength(0);
        LargeTextSink spill = null;
        try {
            for (;;) {
                int ch = reader.read();
                if (ch == -1) {
                    throw error("Unterminated quoted string");
                }
                if (ch == '"') {
                    break;
                }
                if (ch == '\\') {
                    ch = readEscape();
                }
                if (buf.length() >= MAX_STRING_LENGTH) {
                    if (spill == null) {
                        spill = new LargeTextSink();
                    }
                    spill.print(buf);
                    buf.setLength(0);
                }
                buf.append((char) ch);
            }

            if (spill == null) {
                string = buf.toString();
            } else {
                spill.print(buf);
                largeText = spill.getValue();
                spill = null;
            }
        } finally {
            if (spill != null) {
                spill.free();
            }
        }
    }

    /**
     * Decodes an escape sequence whose backslash was just read. A surrogate pair is returned as
     * the low surrogate after the high surrogate has been appended to the current string.
     */
    private int readEscape() throws IOException {
        final int ch = reader.read();
        switch (ch) {
        case '"':
        case '\\':
        case '/':
            return ch;
        case 'b':
            return '\b';
        case 'f':
            return '\f';
        case 'n':
            return '\n';
        case 'r':
            return '\r';
        case 't':
            return '\t';
        case 'u':
            final int code = readHex();
            if (!Character.isHighSurrogate((char) code)) {
                return code;
            }
            if (reader.read() != '\\' || reader.read() != 'u') {
                throw error("Expected \\u escape of low surrogate after high surrogate");
            }
            final int low = readHex();
            if (!Character.isLowSurrogate((char) low)) {
                throw error("Expected \\u escape of low surrogate after high surrogate");
            }
            buf.append((char) code);
            return low;
        case -1:
            throw error("Unterminated quoted string");
        default:
            throw error("Invalid escape sequence \\" + (char) ch);
        }
    }
}
