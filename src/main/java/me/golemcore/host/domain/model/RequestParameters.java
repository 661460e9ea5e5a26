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

import me.golemcore.host.domain.exception.HostException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Typed read access to the loosely typed parameter map of a request. Every
 * conversion failure surfaces as {@code INVALID_ARGUMENT}.
 */
public final class RequestParameters {

    private final Map<String, Object> values;

    public RequestParameters(Map<String, Object> values) {
        this.values = values != null ? values : Map.of();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public String requireString(String key) {
        String value = optionalString(key, null);
        if (value == null || value.isBlank()) {
            throw HostException.invalidArgument("Parameter '" + key + "' is required");
        }
        return value;
    }

    public String optionalString(String key, String defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        throw HostException.invalidArgument("Parameter '" + key + "' must be a string");
    }

    public long requireLong(String key) {
        Object value = values.get(key);
        if (value == null) {
            throw HostException.invalidArgument("Parameter '" + key + "' is required");
        }
        if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            if (asDouble != Math.rint(asDouble)) {
                throw HostException.invalidArgument("Parameter '" + key + "' must be an integer");
            }
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                throw HostException.invalidArgument("Parameter '" + key + "' must be an integer");
            }
        }
        throw HostException.invalidArgument("Parameter '" + key + "' must be an integer");
    }

    public int optionalInt(String key, int defaultValue) {
        if (!values.containsKey(key) || values.get(key) == null) {
            return defaultValue;
        }
        long value = requireLong(key);
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw HostException.invalidArgument("Parameter '" + key + "' is out of range");
        }
        return (int) value;
    }

    public boolean requireBoolean(String key) {
        Object value = values.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text && ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text))) {
            return Boolean.parseBoolean(text);
        }
        throw HostException.invalidArgument("Parameter '" + key + "' must be a boolean");
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> optionalMap(String key) {
        Object value = values.get(key);
        if (value == null) {
            return new LinkedHashMap<>();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        throw HostException.invalidArgument("Parameter '" + key + "' must be an object");
    }

    /**
     * Reads a required string and converts it, mapping parser failures to
     * {@code INVALID_ARGUMENT}.
     */
    public <T> T require(String key, Function<String, T> parser) {
        String raw = requireString(key);
        try {
            return parser.apply(raw);
        } catch (IllegalArgumentException e) {
            throw HostException.invalidArgument(e.getMessage());
        }
    }

    public <T> T optional(String key, Function<String, T> parser, T defaultValue) {
        String raw = optionalString(key, null);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return parser.apply(raw);
        } catch (IllegalArgumentException e) {
            throw HostException.invalidArgument(e.getMessage());
        }
    }
}
