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

/**
 * A hypermedia link. The {@code href} may contain {@code #COLUMN#} placeholders which are
 * replaced with column values of the current row when links are written per row.
 */
@Value.Immutable(copy = false)
public abstract class Link {
    public static Link of(final String href, final String rel) {
        return ImmutableLink.builder().href(href).rel(rel).build();
    }

    public abstract String getHref();

    @Nullable
    public abstract String getMediaType();

    @Nullable
    public abstract String getMethod();

    @Nullable
    public abstract String getProfile();

    public abstract String getRel();

    @Nullable
    public abstract Boolean getTemplated();
}
