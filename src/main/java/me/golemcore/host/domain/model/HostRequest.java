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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Request envelope sent by the agent. {@code type} is the wire tag resolved
 * through {@link RequestType}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HostRequest {

    private String id;

    @JsonProperty("request_type")
    private String type;

    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();

    private long timestamp;
}
