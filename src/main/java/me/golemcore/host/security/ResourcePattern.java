package me.golemcore.host.security;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Glob-style resource pattern used by permission rules.
 *
 * <p>
 * {@code *} matches any run of characters, path separators included. Every
 * other character is literal and matching is case sensitive.
 *
 * <p>
 * Specificity is the length of the literal prefix before the first {@code *}.
 * Patterns without a wildcard are exact and rank above any wildcard pattern
 * with the same prefix length.
 *
 * @since 1.0
 */
public final class ResourcePattern {

    private static final char WILDCARD = '*';

    private final String pattern;
    private final int wildcardIndex;

    private ResourcePattern(String pattern) {
        this.pattern = pattern;
        this.wildcardIndex = pattern.indexOf(WILDCARD);
    }

    public static ResourcePattern of(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("Resource pattern must not be empty");
        }
        return new ResourcePattern(pattern);
    }

    public boolean isWildcard() {
        return wildcardIndex >= 0;
    }

    /**
     * Ranking key: twice the literal prefix length, plus one for exact patterns.
     */
    public int specificity() {
        if (!isWildcard()) {
            return pattern.length() * 2 + 1;
        }
        return wildcardIndex * 2;
    }

    public boolean matches(String resource) {
        if (resource == null) {
            return false;
        }
        if (!isWildcard()) {
            return pattern.equals(resource);
        }
        return globMatch(resource);
    }

    private boolean globMatch(String resource) {
        int p = 0;
        int r = 0;
        int starP = -1;
        int starR = 0;
        while (r < resource.length()) {
            if (p < pattern.length() && pattern.charAt(p) == WILDCARD) {
                starP = p++;
                starR = r;
            } else if (p < pattern.length() && pattern.charAt(p) == resource.charAt(r)) {
                p++;
                r++;
            } else if (starP >= 0) {
                p = starP + 1;
                r = ++starR;
            } else {
                return false;
            }
        }
        while (p < pattern.length() && pattern.charAt(p) == WILDCARD) {
            p++;
        }
        return p == pattern.length();
    }

    @Override
    public String toString() {
        return pattern;
    }
}
