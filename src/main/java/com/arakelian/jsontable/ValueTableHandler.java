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

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Stores every value of a parsed document in a {@link JsonValues} table. Containers are entered
 * before their children so that the table lists values in document order.
 */
public class ValueTableHandler implements ParseHandler {
    private final JsonValues values;

    public ValueTableHandler(final JsonValues values) {
        this.values = Preconditions.checkNotNull(values);
    }

    @Override
    public void endArray(final String path, final String name, final int count) {
        values.put(path, JsonValue.array(count));
    }

    @Override
    public void endObject(final String path, final String name, final List<String> members) {
        values.put(path, JsonValue.object(members));
    }

    public JsonValues getValues() {
        return values;
    }

    /**
     * Drops the value of an earlier member with the same name, including its children.
     */
    private void replace(final String path, final JsonValue value) {
        values.remove(path);
        values.put(path, value);
    }

    @Override
    public void startArray(final String path, final String name) {
        replace(path, JsonValue.array(0));
    }

    @Override
    public void startObject(final String path, final String name) {
        replace(path, JsonValue.object(ImmutableList.of()));
    }

    @Override
    public void value(final String path, final String name, final JsonValue value) {
        replace(path, value);
    }
}
