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

import static com.arakelian.jsontable.JsonLexer.Symbol.BEGIN_ARRAY;
import static com.arakelian.jsontable.JsonLexer.Symbol.BEGIN_OBJECT;
import static com.arakelian.jsontable.JsonLexer.Symbol.COLON;
import static com.arakelian.jsontable.JsonLexer.Symbol.COMMA;
import static com.arakelian.jsontable.JsonLexer.Symbol.END_ARRAY;
import static com.arakelian.jsontable.JsonLexer.Symbol.END_OBJECT;
import static com.arakelian.jsontable.JsonLexer.Symbol.EOF;
import static com.arakelian.jsontable.JsonLexer.Symbol.FALSE;
import static com.arakelian.jsontable.JsonLexer.Symbol.NULL;
import static com.arakelian.jsontable.JsonLexer.Symbol.NUMBER;
import static com.arakelian.jsontable.JsonLexer.Symbol.STRING;
import static com.arakelian.jsontable.JsonLexer.Symbol.TRUE;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.arakelian.jsontable.JsonLexer.Symbol;
import com.google.common.base.Strings;

public class JsonLexerTest {
    private static void assertError(final String json, final String message) {
        final JsonParseException e = Assertions.assertThrows(JsonParseException.class, () -> tokens(json, true));
        Assertions.assertTrue(
                e.getMessage().endsWith(message),
                () -> "Expected message ending with \"" + message + "\" but was \"" + e.getMessage() + "\"");
    }

    private static JsonLexer lexer(final String json, final boolean strict) {
        return new JsonLexer(CharReader.of(json), strict);
    }

    private static Object[] tokens(final String json, final boolean strict) throws IOException {
        final List<Object> tokens = new ArrayList<>();
        final JsonLexer lexer = lexer(json, strict);
        try {
            for (Symbol symbol = lexer.next(); symbol != EOF; symbol = lexer.next()) {
                tokens.add(symbol);
                switch (symbol) {
                case NUMBER:
                    tokens.add(lexer.getNumber());
                    break;
                case STRING:
                    tokens.add(lexer.isLargeText() ? lexer.takeLargeText().toString() : lexer.getString());
                    break;
                default:
                    break;
                }
            }
        } finally {
            lexer.free();
        }
        return tokens.toArray(new Object[tokens.size()]);
    }

    @Test
    public void testErrorPosition() {
        final JsonParseException e = Assertions.assertThrows(JsonParseException.class, () -> tokens("[1,\n  #]", true));
        Assertions.assertEquals(2, e.getLine());
        Assertions.assertEquals(3, e.getColumn());
    }

    @Test
    public void testEscapes() throws IOException {
        Assertions.assertArrayEquals(
                new Object[] { STRING, "\"\\/\b\f\n\r\t" },
                tokens("\"\\\"\\\\\\/\\b\\f\\n\\r\\t\"", true));
        Assertions.assertArrayEquals(new Object[] { STRING, "\u00e9A" }, tokens("\"\\u00E9\\u0041\"", true));

        // surrogate pair
        Assertions.assertArrayEquals(new Object[] { STRING, "\uD83D\uDE00" }, tokens("\"\\uD83D\\uDE00\"", true));
    }

    @Test
    public void testInvalidEscapes() {
        assertError("\"\\x\"", "Invalid escape sequence \\x");
        assertError("\"\\u12G4\"", "\"\\u12G4\" is not a valid hex string");
        assertError("\"\\uD83D\"", "Expected \\u escape of low surrogate after high surrogate");
        assertError("\"\\uD83D\\u0041\"", "Expected \\u escape of low surrogate after high surrogate");
        assertError("\"abc", "Unterminated quoted string");
    }

    @Test
    public void testExponentOverflow() {
        assertError("1e9999999999", "Invalid number: 1e9999999999");
        assertError("[-2.5E+2147483648]", "Invalid number: -2.5E+2147483648");
    }

    @Test
    public void testInvalidNumbers() {
        assertError("1.", "Invalid number: 1.");
        assertError("1.x", "Invalid number: 1.x");
        assertError("1e", "Invalid number: 1e");
        assertError("2e+", "Invalid number: 2e+");
        assertError("-x", "expected 0-9 after minus sign, not \"x\"");
        assertError(".5", "Unexpected character \".\"");
    }

    @Test
    public void testLargeString() throws IOException {
        final String text = Strings.repeat("0123456789", 5000);
        final JsonLexer lexer = lexer("\"" + text + "\"", true);
        Assertions.assertEquals(STRING, lexer.next());
        Assertions.assertTrue(lexer.isLargeText());
        Assertions.assertNull(lexer.getString());

        final LargeText value = lexer.takeLargeText();
        Assertions.assertFalse(lexer.isLargeText());
        Assertions.assertEquals(text.length(), value.length());
        Assertions.assertEquals(text, value.toString());
        Assertions.assertEquals(EOF, lexer.next());
    }

    @Test
    public void testLiterals() throws IOException {
        Assertions.assertArrayEquals(new Object[] { TRUE, FALSE, NULL }, tokens("true false\tnull", true));
        assertError("[undefined]", "strict mode JSON parser does not allow unquoted literals");
        assertError("True", "strict mode JSON parser does not allow unquoted literals");
        Assertions.assertArrayEquals(
                new Object[] { BEGIN_OBJECT, STRING, "a_1", COLON, NUMBER, BigDecimal.ONE, END_OBJECT },
                tokens("{a_1:1}", false));
    }

    @Test
    public void testNumbers() throws IOException {
        Assertions.assertArrayEquals(
                new Object[] { //
                        NUMBER, new BigDecimal("0"), //
                        NUMBER, new BigDecimal("-12"), //
                        NUMBER, new BigDecimal("3.25"), //
                        NUMBER, new BigDecimal("1e10"), //
                        NUMBER, new BigDecimal("-2.5E-3"), //
                        NUMBER, new BigDecimal("7e+2") },
                tokens("0 -12 3.25 1e10 -2.5E-3 7e+2", true));
    }

    @Test
    public void testStructure() throws IOException {
        Assertions.assertArrayEquals(
                new Object[] { BEGIN_ARRAY, BEGIN_OBJECT, STRING, "k", COLON, STRING, "", END_OBJECT, COMMA,
                        NUMBER, BigDecimal.ONE, END_ARRAY },
                tokens(" [ {\"k\" : \"\"} ,\n1 ] ", true));
    }

    @Test
    public void testSymbolDisplay() {
        Assertions.assertEquals("{", BEGIN_OBJECT.toString());
        Assertions.assertEquals("<eof>", EOF.toString());
        Assertions.assertEquals("<string>", STRING.toString());
    }
}
