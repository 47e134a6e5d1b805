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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.google.common.base.Strings;

public class PathFormatTest {
    @Test
    public void testExplicitIndexes() {
        Assertions.assertEquals("b.a", PathFormat.format("%1.%0", "a", "b"));
        final Object[] args = new Object[20];
        for (int i = 0; i < args.length; i++) {
            args[i] = "v" + i;
        }
        Assertions.assertEquals("v19/v10/v1x", PathFormat.format("%19/%10/%1x", args));
    }

    @Test
    public void testLongArgumentIsTruncated() {
        final String arg = Strings.repeat("a", PathFormat.MAX_LENGTH + 1);
        final String path = PathFormat.format("%s", arg);
        Assertions.assertEquals(PathFormat.MAX_LENGTH, path.length());
        Assertions.assertTrue(path.endsWith("a~"));

        final String exact = Strings.repeat("b", PathFormat.MAX_LENGTH);
        Assertions.assertEquals(exact, PathFormat.format("%s", exact));
    }

    @Test
    public void testMissingArguments() {
        Assertions.assertEquals("items[].", PathFormat.format("items[%d].%s", (Object) null));
        Assertions.assertEquals("a[1].", PathFormat.format("a[%d].%s", 1));
    }

    @Test
    public void testNoArguments() {
        Assertions.assertEquals("items[%d]", PathFormat.format("items[%d]"));
        Assertions.assertNull(PathFormat.format(null, "x"));
    }

    @Test
    public void testOtherCodes() {
        Assertions.assertEquals("100x", PathFormat.format("100%x", "ignored"));
        Assertions.assertEquals("50", PathFormat.format("50%", "ignored"));
        Assertions.assertEquals("a%b", PathFormat.format("a%%b", "ignored"));
    }

    @Test
    public void testSequentialArguments() {
        Assertions.assertEquals("items[3].name", PathFormat.format("items[%d].%s", 3, "name"));
        Assertions.assertEquals("x[2]", PathFormat.format("x[%d]", new BigDecimal("2")));
        Assertions.assertEquals("x[1E+3]", PathFormat.format("x[%s]", "1E+3"));
        Assertions.assertEquals("x[1000]", PathFormat.format("x[%s]", new BigDecimal("1E+3")));
    }
}
