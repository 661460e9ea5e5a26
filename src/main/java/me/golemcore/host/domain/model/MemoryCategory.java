package me.golemcore.host.domain.model;

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

import java.util.Locale;

/**
 * Classification of memory handles. Drives per-category quotas and the order
 * in which optimization reclaims handles.
 */
public enum MemoryCategory {

    SYSTEM, SHORT_TERM, WORKING, LONG_TERM, BACKGROUND;

    /**
     * Parses a category name, accepting {@code "Working"}, {@code "working"},
     * {@code "SHORT_TERM"}, {@code "short-term"} and {@code "ShortTerm"}.
     *
     * @throws IllegalArgumentException
     *             if the name does not denote a category
     */
    public static MemoryCategory fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Memory category is required");
        }
        String normalized = value.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        for (MemoryCategory category : values()) {
            if (category.name().equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown memory category: " + value);
    }
}
