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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One entry of the security audit log. {@code verdict} is null when the request
 * failed before a policy decision was reached (unknown session, malformed
 * parameters).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEvent {

    public static final String OUTCOME_SUCCESS = "SUCCESS";

    private String id;
    private Instant timestamp;
    private String sessionId;
    private String requestId;
    private String requestType;
    private String resourceType;
    private String operation;
    private String resource;
    private PermissionEffect verdict;
    private String outcome;
    private String detail;
}
