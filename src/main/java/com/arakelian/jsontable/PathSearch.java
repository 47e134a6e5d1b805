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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Finds the paths of a {@link JsonValues} table which match a pattern.
 *
 * Patterns use SQL {@code LIKE} syntax: {@code %} matches any sequence of characters and
 * {@code _} matches a single character. A pattern is split into parts at each {@code .},
 * {@code %} and {@code [}, and the table is searched from the root, descending only into the
 * children which match the most parts. For example, with the document
 * {@code {"items":[{"magical":true},{"magical":false}]}},
 * {@code findPathsLike("items[%]", ".magical", "true")} returns {@code items[1]}.
 */
public final class PathSearch {
    private static final Pattern PART_START = Pattern.compile("(\\[[^\\]]*|%|\\.)");

    private static final Splitter PART_SPLITTER = Splitter.on('|');

    /**
     * Returns true if the text matches the SQL {@code LIKE} pattern.
     *
     * @param text
     *            text to be matched
     * @param pattern
     *            pattern where {@code %} matches any sequence of characters and {@code _}
     *            matches a single character
     * @return true if the text matches the pattern
     */
    public static boolean like(final CharSequence text, final String pattern) {
        return toRegex(pattern).matcher(text).matches();
    }

    static List<String> split(final String query) {
        final String separated = PART_START.matcher(query).replaceAll("|$1").replace("||", "|");
        return PART_SPLITTER.splitToList(CharMatcher.is('|').trimFrom(separated));
    }

    static Pattern toRegex(final String pattern) {
        final StringBuilder regex = new StringBuilder(pattern.length() + 16);
        int start = 0;
        for (int i = 0, length = pattern.length(); i < length; i++) {
            final char ch = pattern.charAt(i);
            if (ch == '%' || ch == '_') {
                if (i > start) {
                    regex.append(Pattern.quote(pattern.substring(start, i)));
                }
                regex.append(ch == '%' ? ".*" : ".");
                start = i + 1;
            }
        }
        if (start < pattern.length()) {
            regex.append(Pattern.quote(pattern.substring(start)));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private final JsonValues values;

    /** cumulative pattern parts **/
    private List<Pattern> parts;

    /** number of parts which make up the return path **/
    private int returnIndex;

    @Nullable
    private Pattern valuePattern;

    /** candidate return path of the branch being searched **/
    @Nullable
    private String returnPath;

    private Set<String> found;

    public PathSearch(final JsonValues values) {
        this.values = Preconditions.checkNotNull(values);
    }

    private void appendPathsUnder(final String path, final int matchIndex) {
        boolean returnPathMatched = false;
        if (returnPath == null && matchIndex >= returnIndex) {
            returnPathMatched = true;
            returnPath = path;
        }

        final JsonValue current = values.get(path);
        if (current == null) {
            // empty table
            returnPath = null;
            return;
        }
        if (matchIndex == parts.size() && (valuePattern == null || valueMatches(current))) {
            if (returnPath != null) {
                found.add(returnPath);
            }
            returnPath = null;
            return;
        }

        final List<String> candidates = new ArrayList<>();
        final List<Integer> matches = new ArrayList<>();
        int maxMatch = 0;
        if (current.getKind() == JsonValue.Kind.ARRAY) {
            final String base = JsonValues.ROOT.equals(path) ? "" : path;
            for (int i = 1, count = current.getCount(); i <= count; i++) {
                maxMatch = addCandidate(base + "[" + i + "]", matchIndex, candidates, matches, maxMatch);
            }
        } else if (current.getKind() == JsonValue.Kind.OBJECT) {
            final String base = JsonValues.ROOT.equals(path) ? "" : path + ".";
            for (final String member : current.getMembers()) {
                maxMatch = addCandidate(base + member, matchIndex, candidates, matches, maxMatch);
            }
        }

        for (int i = 0; i < candidates.size(); i++) {
            if (matches.get(i) == maxMatch) {
                appendPathsUnder(candidates.get(i), maxMatch);
            }
        }

        if (returnPathMatched) {
            returnPath = null;
        }
    }

    private int addCandidate(
            final String path,
            final int parentMatchIndex,
            final List<String> candidates,
            final List<Integer> matches,
            final int maxMatch) {
        final int match = computeMatchIndex(path, parentMatchIndex);
        candidates.add(path);
        matches.add(match);
        return Math.max(maxMatch, match);
    }

    /**
     * Returns the number of pattern parts matched by the given path, given the number matched by
     * its parent.
     */
    private int computeMatchIndex(final String path, final int parentMatchIndex) {
        final int count = parts.size();
        final int next = parentMatchIndex + 1;
        final Pattern last = parts.get(count - 1);
        if (next < count && parts.get(next - 1).matcher(path).matches()) {
            return last.matcher(path).matches() ? count : next;
        } else if (next == count && last.matcher(path).matches()) {
            return count;
        }
        return parentMatchIndex;
    }

    /**
     * Returns the paths matching {@code returnPath} which have a descendant matching
     * {@code returnPath + subpath} whose value matches {@code value}.
     *
     * @param returnPath
     *            pattern of the paths to be returned
     * @param subpath
     *            pattern of a path below the returned path, or null
     * @param value
     *            pattern of the value of the descendant, or null to accept any value
     * @return matching paths, in document order and without duplicates
     */
    public List<String> findPathsLike(
            final String returnPath,
            @Nullable final String subpath,
            @Nullable final String value) {
        Preconditions.checkArgument(returnPath != null && returnPath.length() != 0, "returnPath is required");

        final List<String> split = new ArrayList<>(split(returnPath));
        returnIndex = split.size();
        if (subpath != null && subpath.length() != 0) {
            split.addAll(split(subpath));
        }

        final ImmutableList.Builder<Pattern> cumulative = ImmutableList.builder();
        final StringBuilder prefix = new StringBuilder();
        for (final String part : split) {
            prefix.append(part);
            cumulative.add(toRegex(prefix.toString()));
        }

        this.parts = cumulative.build();
        this.valuePattern = value != null ? toRegex(value) : null;
        this.returnPath = null;
        this.found = new LinkedHashSet<>();
        appendPathsUnder(JsonValues.ROOT, 0);
        return ImmutableList.copyOf(found);
    }

    private boolean valueMatches(final JsonValue current) {
        switch (current.getKind()) {
        case TRUE:
            return valuePattern.matcher("true").matches();
        case FALSE:
            return valuePattern.matcher("false").matches();
        case NUMBER:
            return valuePattern.matcher(JsonStrings.stringify(current.getNumber())).matches();
        case STRING:
            return valuePattern.matcher(current.getString()).matches();
        default:
            return false;
        }
    }
}
