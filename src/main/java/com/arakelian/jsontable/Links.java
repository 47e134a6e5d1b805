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

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Placeholder substitutions for link templates. Every {@code #NAME#} found in a link href
 * registers a placeholder, whose value is later set from the column of the same name.
 */
public final class Links {
    private static final Pattern PLACEHOLDER = Pattern.compile("#([^#]+)#");

    /** placeholder name to current value **/
    private final Map<String, String> values = new LinkedHashMap<>();

    /**
     * Registers the placeholders found in the hrefs of the given links.
     *
     * @param links
     *            link templates
     */
    public void addPlaceholders(final Collection<Link> links) {
        for (final Link link : links) {
            final Matcher m = PLACEHOLDER.matcher(link.getHref());
            while (m.find()) {
                values.putIfAbsent(m.group(1), null);
            }
        }
    }

    public void clear() {
        values.clear();
    }

    public Set<String> getNames() {
        return values.keySet();
    }

    public boolean isPlaceholder(final String name) {
        return values.containsKey(name);
    }

    /**
     * Sets the value of a registered placeholder; unknown names are ignored. A null value
     * replaces the placeholder with nothing.
     *
     * @param name
     *            placeholder name
     * @param value
     *            placeholder value
     */
    public void set(final String name, @Nullable final String value) {
        if (values.containsKey(name)) {
            values.put(name, value);
        }
    }

    public String substitute(final String href) {
        String result = href;
        for (final Map.Entry<String, String> e : values.entrySet()) {
            final String value = e.getValue();
            result = result.replace("#" + e.getKey() + "#", value != null ? value : "");
        }
        return result;
    }
}
