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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A client-authenticated context bounding the memory handles it owns. Instances
 * held by the session table are mutated only under the table lock; callers
 * outside the table receive copies from {@link #snapshot()}.
 */
@Data
@Builder
public class HostSession {

    private String id;
    private Instant createdAt;
    private Instant lastActivityAt;

    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    @Builder.Default
    private SessionStatus status = SessionStatus.ACTIVE;

    @Builder.Default
    private Set<String> ownedHandles = new LinkedHashSet<>();

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }

    public HostSession snapshot() {
        return HostSession.builder()
                .id(id)
                .createdAt(createdAt)
                .lastActivityAt(lastActivityAt)
                .metadata(Map.copyOf(metadata))
                .status(status)
                .ownedHandles(Set.copyOf(ownedHandles))
                .build();
    }

    /**
     * Session lifecycle states.
     */
    public enum SessionStatus {
        ACTIVE, CLOSING, CLOSED
    }
}
