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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Built-in checks applied on top of the rule set at
 * {@link me.golemcore.host.domain.model.SecurityLevel#MAXIMUM}.
 *
 * <p>
 * The guard can only veto a request, never grant one:
 * <ul>
 * <li>{@code file} access under system locations ({@code /system},
 * {@code C:\Windows}) is denied</li>
 * <li>{@code file write} to executables ({@code .exe}, {@code .dll}) is
 * denied</li>
 * <li>{@code network connect} is limited to loopback targets and API
 * hosts</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@Slf4j
public class MaximumLevelGuard {

    private static final List<String> SYSTEM_PREFIXES = List.of("/system", "C:\\Windows");
    private static final List<String> EXECUTABLE_SUFFIXES = List.of(".exe", ".dll");
    private static final List<String> TRUSTED_NETWORK_MARKERS = List.of("localhost", "127.0.0.1", "api.");

    /**
     * Returns true if the request passes the guard.
     */
    public boolean permits(String resourceType, String operation, String resource) {
        String target = resource != null ? resource : "";
        if ("file".equals(resourceType)) {
            if (SYSTEM_PREFIXES.stream().anyMatch(target::startsWith)) {
                log.warn("[Security] Guard veto: system location {} {}", operation, target);
                return false;
            }
            String lower = target.toLowerCase(Locale.ROOT);
            if ("write".equals(operation) && EXECUTABLE_SUFFIXES.stream().anyMatch(lower::endsWith)) {
                log.warn("[Security] Guard veto: executable write {}", target);
                return false;
            }
            return true;
        }
        if ("network".equals(resourceType) && "connect".equals(operation)) {
            boolean trusted = TRUSTED_NETWORK_MARKERS.stream().anyMatch(target::contains);
            if (!trusted) {
                log.warn("[Security] Guard veto: untrusted network target {}", target);
            }
            return trusted;
        }
        return true;
    }
}
