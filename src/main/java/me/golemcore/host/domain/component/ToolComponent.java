package me.golemcore.host.domain.component;

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

import me.golemcore.host.domain.model.ToolDescriptor;
import me.golemcore.host.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Component representing a tool the agent can invoke through the host. A tool
 * exposes a descriptor listing its capabilities and executes one capability at
 * a time. Tools are discovered as Spring beans and are stateless from the
 * dispatcher's point of view.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool descriptor with its capabilities and parameter contracts.
     * The {@code enabled} flag of the returned descriptor is managed by the
     * registry.
     *
     * @return the tool descriptor
     */
    ToolDescriptor getDescriptor();

    /**
     * Executes a capability with the given parameters. Required parameters have
     * already been checked by the registry. Implementations report domain
     * failures through {@link ToolResult#failure(String)}; thrown exceptions
     * are wrapped by the registry.
     *
     * @param capability
     *            the capability name
     * @param parameters
     *            the execution parameters
     * @return a future containing the execution result
     */
    CompletableFuture<ToolResult> execute(String capability, Map<String, Object> parameters);

    /**
     * Returns the unique id of this tool.
     *
     * @return the tool id
     */
    default String getToolId() {
        return getDescriptor().getId();
    }
}
