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
import java.util.List;

/**
 * Receives the structure of a JSON document from {@link JsonParser}.
 *
 * Every callback receives the path of the value (see {@link JsonValues}) and the member name
 * under which it appears in its parent object. The name is null for array elements and for the
 * root value, whose path is {@link JsonValues#ROOT}.
 */
public interface ParseHandler {
    /**
     * Called after the last element of an array.
     */
    public void endArray(String path, @Nullable String name, int count) throws IOException;

    /**
     * Called once the root value is complete and the end of input has been reached. Not called for
     * an empty document.
     */
    public default void endDocument() throws IOException {
        // nothing by default
    }

    /**
     * Called after the last member of an object.
     *
     * @param path
     *            path of the object
     * @param name
     *            member name of the object in its parent, or null
     * @param members
     *            names of the object members in path form, in document order
     * @throws IOException
     *             if the handler cannot process the object
     */
    public void endObject(String path, @Nullable String name, List<String> members) throws IOException;

    public void startArray(String path, @Nullable String name) throws IOException;

    /**
     * Called when the first token of a non-empty document has been read.
     */
    public default void startDocument() throws IOException {
        // nothing by default
    }

    public void startObject(String path, @Nullable String name) throws IOException;

    /**
     * Called for each scalar value. Ownership of a {@link JsonValue.Kind#LARGE_TEXT} value passes
     * to the handler, which must either retain or free it.
     *
     * @param path
     *            path of the value
     * @param name
     *            member name of the value in its parent, or null
     * @param value
     *            the value
     * @throws IOException
     *             if the handler cannot process the value
     */
    public void value(String path, @Nullable String name, JsonValue value) throws IOException;
}
