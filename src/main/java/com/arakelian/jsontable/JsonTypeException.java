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

/**
 * Thrown when the value at a path cannot be returned as the requested type.
 */
public class JsonTypeException extends IllegalArgumentException {
    private final String path;

    private final JsonValue.Kind kind;

    public JsonTypeException(final String path, final JsonValue.Kind kind, final String requested) {
        this(path, kind, requested, null);
    }

    public JsonTypeException(
            final String path,
            final JsonValue.Kind kind,
            final String requested,
            final Throwable cause) {
        super("Value at \"" + path + "\" is " + kind + ", not " + requested, cause);
        this.path = path;
        this.kind = kind;
    }

    public JsonValue.Kind getKind() {
        return kind;
    }

    public String getPath() {
        return path;
    }
}
