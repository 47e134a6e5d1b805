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
public abstract class OutputOptions {
    /**
     * Caching instructions written in the HTTP header.
     */
    public enum CachePolicy {
        /** {@code Cache-Control: max-age=0, private} **/
        ALLOW,

        /** {@code Cache-Control: no-cache} **/
        FORBID,

        /** no cache header **/
        OMIT;
    }

    @Value.Check
    protected void check() {
        Preconditions.checkState(getIndent() >= 0, "indent must be non-negative");
        Preconditions.checkState(getInitialCapacity() > 0, "initialCapacity must be positive");
    }

    @Value.Default
    public CachePolicy getCachePolicy() {
        return CachePolicy.FORBID;
    }

    @Nullable
    public abstract String getEtag();

    /**
     * Returns the number of spaces each nesting level is indented by. With zero indent, values
     * are still written one per line but without leading spaces.
     *
     * @return number of spaces per nesting level
     */
    @Value.Default
    public int getIndent() {
        return 0;
    }

    /**
     * Returns the initial capacity of an in-memory large text output.
     *
     * @return initial capacity of an in-memory large text output
     */
    @Value.Default
    public int getInitialCapacity() {
        return AbstractBufferedSink.BUFFER_LIMIT;
    }

    /**
     * Returns true if an HTTP header is written before the first value.
     *
     * @return true if an HTTP header is written before the first value
     */
    @Value.Default
    public boolean isEmitHeader() {
        return true;
    }
}
