package me.golemcore.host.domain.service;

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

import me.golemcore.host.domain.component.ToolComponent;
import me.golemcore.host.domain.exception.HostException;
import me.golemcore.host.domain.model.ErrorKind;
import me.golemcore.host.domain.model.ToolCapability;
import me.golemcore.host.domain.model.ToolDescriptor;
import me.golemcore.host.domain.model.ToolResult;
import me.golemcore.host.infrastructure.config.HostProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Catalog of tool components and the single entry point for invoking their
 * capabilities.
 *
 * <p>
 * Tools are collected from the Spring context. A tool can be disabled at
 * startup through {@code host.tools.disabled} or at runtime; a disabled tool
 * stays listed but cannot be invoked. Invocation waits at most
 * {@code host.tools.execution-timeout}; timeouts, thrown exceptions and failed
 * results all surface as {@code TOOL_EXECUTION_ERROR}.
 */
@Service
@Slf4j
public class ToolRegistryService {

    private static final String LOG_PREFIX = "[Tools]";

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();
    private final Set<String> disabled = ConcurrentHashMap.newKeySet();
    private final Duration executionTimeout;
    private final Clock clock;

    public ToolRegistryService(List<ToolComponent> toolComponents, HostProperties properties, Clock clock) {
        this.clock = clock;
        this.executionTimeout = properties.getTools().getExecutionTimeout();
        for (ToolComponent tool : toolComponents) {
            String toolId = tool.getToolId();
            if (tools.putIfAbsent(toolId, tool) != null) {
                throw new IllegalStateException("Duplicate tool id: " + toolId);
            }
        }
        disabled.addAll(properties.getTools().getDisabled());
        log.info("{} Registered {} tools: {}", LOG_PREFIX, tools.size(), tools.keySet());
    }

    public List<ToolDescriptor> list() {
        return tools.values().stream()
                .map(this::describe)
                .sorted(Comparator.comparing(ToolDescriptor::getId))
                .toList();
    }

    public ToolDescriptor describe(String toolId) {
        return describe(requireTool(toolId));
    }

    /**
     * Enables or disables a registered tool.
     *
     * @return the updated descriptor
     */
    public ToolDescriptor setEnabled(String toolId, boolean enabled) {
        ToolComponent tool = requireTool(toolId);
        if (enabled) {
            disabled.remove(toolId);
        } else {
            disabled.add(toolId);
        }
        log.info("{} Tool {} {}", LOG_PREFIX, toolId, enabled ? "enabled" : "disabled");
        return describe(tool);
    }

    public ToolResult invoke(String toolId, String capabilityName, Map<String, Object> parameters) {
        ToolComponent tool = requireTool(toolId);
        ToolDescriptor descriptor = describe(tool);
        if (!descriptor.isEnabled()) {
            throw HostException.toolNotFound("Tool " + toolId + " is disabled");
        }
        ToolCapability capability = descriptor.capability(capabilityName)
                .orElseThrow(() -> new HostException(ErrorKind.CAPABILITY_NOT_FOUND,
                        "Tool " + toolId + " has no capability " + capabilityName
                                + ". Available: " + descriptor.capabilityNames()));
        Map<String, Object> args = parameters != null ? parameters : Map.of();
        for (String required : capability.requiredParameterNames()) {
            if (args.get(required) == null) {
                throw HostException.invalidArgument("Missing required parameter '" + required + "' for "
                        + toolId + "." + capabilityName);
            }
        }

        log.debug("{} Invoking {}.{}", LOG_PREFIX, toolId, capabilityName);
        long start = clock.millis();
        ToolResult result;
        try {
            CompletableFuture<ToolResult> future = tool.execute(capabilityName, args);
            result = future.get(executionTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw executionError(toolId, capabilityName, "timed out after " + executionTimeout.toSeconds() + "s",
                    e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw executionError(toolId, capabilityName, cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw executionError(toolId, capabilityName, "interrupted", e);
        } catch (RuntimeException e) {
            throw executionError(toolId, capabilityName, e.getMessage(), e);
        }

        if (result == null) {
            throw executionError(toolId, capabilityName, "no result", null);
        }
        if (!result.isSuccess()) {
            throw new HostException(ErrorKind.TOOL_EXECUTION_ERROR, result.getError());
        }
        result.setToolId(toolId);
        result.setCapability(capabilityName);
        result.setExecutionTimeMs(clock.millis() - start);
        return result;
    }

    private ToolComponent requireTool(String toolId) {
        ToolComponent tool = toolId != null ? tools.get(toolId) : null;
        if (tool == null) {
            throw HostException.toolNotFound("No tool found for id " + toolId + ". Available tools: "
                    + tools.keySet().stream().sorted().toList());
        }
        return tool;
    }

    private ToolDescriptor describe(ToolComponent tool) {
        return tool.getDescriptor().toBuilder()
                .enabled(tool.isEnabled() && !disabled.contains(tool.getToolId()))
                .build();
    }

    private static HostException executionError(String toolId, String capability, String detail, Throwable cause) {
        log.warn("{} {}.{} failed: {}", LOG_PREFIX, toolId, capability, detail);
        return new HostException(ErrorKind.TOOL_EXECUTION_ERROR,
                "Tool " + toolId + "." + capability + " failed: " + detail, cause);
    }
}
