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

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Flat table of JSON values keyed by path, in document order. The root value is stored under
 * {@code "."}; members of the root object use their bare name, nested members use
 * {@code parent.member}, and array elements use {@code parent[i]} with 1-based indexes.
 *
 * Large text values are owned by the table and released by {@link #free()}.
 */
public final class JsonValues {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonValues.class);

    /** Path of the root value **/
    public static final String ROOT = ".";

    private final Map<String, JsonValue> values = new LinkedHashMap<>();

    public Map<String, JsonValue> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public void clear() {
        free();
    }

    public boolean containsPath(final String path) {
        return values.containsKey(path);
    }

    /**
     * Releases large texts owned by this table and removes every entry.
     */
    public void free() {
        int freed = 0;
        for (final JsonValue value : values.values()) {
            final LargeText text = value.getLargeText();
            if (text != null && !text.isFreed()) {
                text.free();
                freed++;
            }
        }
        if (freed != 0) {
            LOGGER.trace("Released {} large text value(s)", freed);
        }
        values.clear();
    }

    @Nullable
    public JsonValue get(final String path) {
        return values.get(path);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Set<String> paths() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public void put(final String path, final JsonValue value) {
        values.put(Preconditions.checkNotNull(path), Preconditions.checkNotNull(value));
    }

    /**
     * Removes the value at the given path together with every value below it, releasing their
     * large texts.
     *
     * @param path
     *            path of the value to remove
     * @return number of values removed
     */
    public int remove(final String path) {
        final JsonValue removed = values.remove(Preconditions.checkNotNull(path));
        if (removed == null) {
            return 0;
        }
        release(removed);

        int count = 1;
        if (removed.getKind() == JsonValue.Kind.OBJECT || removed.getKind() == JsonValue.Kind.ARRAY) {
            final String member = path + ".";
            final String element = path + "[";
            for (final Iterator<Map.Entry<String, JsonValue>> it = values.entrySet().iterator(); it.hasNext();) {
                final Map.Entry<String, JsonValue> e = it.next();
                if (e.getKey().startsWith(member) || e.getKey().startsWith(element)) {
                    release(e.getValue());
                    it.remove();
                    count++;
                }
            }
        }
        return count;
    }

    private static void release(final JsonValue value) {
        final LargeText text = value.getLargeText();
        if (text != null && !text.isFreed()) {
            text.free();
        }
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
