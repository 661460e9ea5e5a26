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

import java.util.List;
import java.util.Optional;

/**
 * Describes a tool and the named capabilities it exposes to the agent.
 */
@Data
@Builder(toBuilder = true)
public class ToolDescriptor {

    private String id;
    private String name;
    private String description;
    private String version;

    @Builder.Default
    private List<String> categories = List.of();

    @Builder.Default
    private List<ToolCapability> capabilities = List.of();

    private boolean enabled;

    public Optional<ToolCapability> capability(String capabilityName) {
        return capabilities.stream()
                .filter(capability -> capability.getName().equals(capabilityName))
                .findFirst();
    }

    public List<String> capabilityNames() {
        return capabilities.stream().map(ToolCapability::getName).toList();
    }
}
