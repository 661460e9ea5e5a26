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
 * Process-wide security level. Declared from least to most strict; a higher
 * level only ever narrows the set of allowed requests.
 */
public enum SecurityLevel {

    LOW, STANDARD, HIGH, MAXIMUM;

    /**
     * Verdict used when no rule matches a request.
     */
    public PermissionEffect defaultEffect() {
        return compareTo(HIGH) >= 0 ? PermissionEffect.DENY : PermissionEffect.ALLOW;
    }

    /**
     * Whether wildcard ALLOW rules are honoured. At HIGH and above only
     * explicit grants count.
     */
    public boolean allowsWildcardGrants() {
        return compareTo(HIGH) < 0;
    }

    public static SecurityLevel fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Security level is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid security level: " + value, e);
        }
    }
}
