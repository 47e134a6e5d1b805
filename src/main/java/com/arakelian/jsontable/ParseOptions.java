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

import org.immutables.value.Value;

import com.google.common.base.Preconditions;

@Value.Immutable(copy = false)
@Value.Style(get = { "is*", "get*" })
public abstract class ParseOptions {
    /** Default number of characters read from a large source at a time **/
    public static final int DEFAULT_PAGE_SIZE = 8191;

    @Value.Check
    protected void check() {
        Preconditions.checkState(getPageSize() > 0, "pageSize must be positive");
    }

    /**
     * Returns the number of characters read at a time when the source is a {@link java.io.Reader}.
     *
     * @return number of characters read at a time
     */
    @Value.Default
    public int getPageSize() {
        return DEFAULT_PAGE_SIZE;
    }

    /**
     * Returns true if the document must conform to RFC 8259. Lax parsing also accepts unquoted
     * string literals and a dangling comma before a closing bracket or brace.
     *
     * @return true if the document must conform to RFC 8259
     */
    @Value.Default
    public boolean isStrict() {
        return true;
    }
}
