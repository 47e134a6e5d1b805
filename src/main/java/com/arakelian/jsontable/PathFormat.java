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

/**
 * Substitutes arguments into a path template.
 *
 * <ul>
 * <li>{@code %s} and {@code %d} insert the next argument, starting with the first</li>
 * <li>{@code %0} to {@code %19} insert the argument at that index</li>
 * <li>any other character after {@code %} is copied without the {@code %}, so {@code %%} yields
 * a single {@code %}</li>
 * </ul>
 *
 * Missing or null arguments insert nothing, and an argument longer than {@link #MAX_LENGTH}
 * characters is shortened to {@code MAX_LENGTH - 1} characters followed by {@code ~}.
 */
public final class PathFormat {
    /** Longest argument inserted unchanged **/
    public static final int MAX_LENGTH = 1000;

    /**
     * Returns the template with its placeholders replaced by arguments. Without arguments the
     * template is returned unchanged.
     *
     * @param template
     *            path template
     * @param args
     *            arguments
     * @return path
     */
    public static String format(final String template, final Object... args) {
        if (template == null || args == null || args.length == 0) {
            return template;
        }

        final int length = template.length();
        final StringBuilder buf = new StringBuilder(length + 16);
        int next = 0;
        int start = 0;
        for (;;) {
            final int found = template.indexOf('%', start);
            if (found == -1) {
                buf.append(template, start, length);
                return buf.toString();
            }
            buf.append(template, start, found);
            if (found + 1 >= length) {
                return buf.toString();
            }

            final char code = template.charAt(found + 1);
            if (code == 's' || code == 'd') {
                buf.append(arg(args, next++));
                start = found + 2;
            } else if (code >= '0' && code <= '9') {
                int index = code - '0';
                start = found + 2;
                if (code == '1' && start < length) {
                    final char digit = template.charAt(start);
                    if (digit >= '0' && digit <= '9') {
                        index = 10 + digit - '0';
                        start++;
                    }
                }
                buf.append(arg(args, index));
            } else {
                buf.append(code);
                start = found + 2;
            }
        }
    }

    private static String arg(final Object[] args, final int index) {
        if (index >= args.length || args[index] == null) {
            return "";
        }
        final Object arg = args[index];
        final String text = arg instanceof BigDecimal ? ((BigDecimal) arg).toPlainString() : arg.toString();
        if (text.length() > MAX_LENGTH) {
            return text.substring(0, MAX_LENGTH - 1) + "~";
        }
        return text;
    }

    private PathFormat() {
        // utility class
    }
}
