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

import java.util.Arrays;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed catalogue of request kinds the dispatcher understands. Each kind maps
 * its wire tag to the permission triple it is authorized against: the resource
 * type and operation are fixed, the resource is derived from the session id and
 * the request parameters.
 */
public enum RequestType {

    SESSIONS_CLOSE("sessions_close", "session", "close", (sessionId, params) -> sessionId),

    MEMORY_ALLOCATE("memory_allocate", "memory", "allocate",
            (sessionId, params) -> params.require("category", MemoryCategory::fromString).name()),

    MEMORY_RELEASE("memory_release", "memory", "release",
            (sessionId, params) -> params.requireString("handle_id")),

    MEMORY_ACCESS("memory_access", "memory", "access",
            (sessionId, params) -> params.requireString("handle_id")),

    MEMORY_OPTIMIZE("memory_optimize", "memory", "optimize",
            (sessionId, params) -> {
                OptimizationStrategy strategy = params.optional("strategy", OptimizationStrategy::fromString, null);
                return strategy != null ? strategy.name() : "default";
            }),

    MEMORY_STATUS("memory_status", "memory", "status", fixed("global")),

    SECURITY_SET_LEVEL("security_set_level", "security", "set_level",
            (sessionId, params) -> params.require("level", SecurityLevel::fromString).name()),

    SECURITY_ADD_PERMISSION("security_add_permission", "security", "add_permission",
            (sessionId, params) -> params.requireString("resource_type")),

    SECURITY_REMOVE_PERMISSION("security_remove_permission", "security", "remove_permission",
            (sessionId, params) -> params.requireString("resource_type")),

    SECURITY_CHECK("security_check", "security", "check",
            (sessionId, params) -> params.requireString("resource_type")),

    SECURITY_AUDIT("security_audit", "security", "audit", fixed("log")),

    TOOLS_LIST("tools_list", "tool", "list", fixed("catalog")),

    TOOLS_EXECUTE("tools_execute", "tool", "execute",
            (sessionId, params) -> params.requireString("tool_id")),

    TOOLS_SET_ENABLED("tools_set_enabled", "tool", "configure",
            (sessionId, params) -> params.requireString("tool_id")),

    SYSTEM_INFO("system_info", "system", "info", fixed("host")),

    SYSTEM_ECHO("system_echo", "system", "echo", fixed("host")),

    SYSTEM_SHUTDOWN("system_shutdown", "system", "shutdown", fixed("host"));

    private static final Map<String, RequestType> BY_TAG = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(RequestType::getTag, Function.identity()));

    private final String tag;
    private final String resourceType;
    private final String operation;
    private final BiFunction<String, RequestParameters, String> resourceResolver;

    RequestType(String tag, String resourceType, String operation,
            BiFunction<String, RequestParameters, String> resourceResolver) {
        this.tag = tag;
        this.resourceType = resourceType;
        this.operation = operation;
        this.resourceResolver = resourceResolver;
    }

    public String getTag() {
        return tag;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * Resolves the permission triple of a concrete request.
     *
     * @throws HostException
     *             with {@code INVALID_ARGUMENT} if a parameter the resource
     *             depends on is missing or malformed
     */
    public PermissionTriple triple(String sessionId, RequestParameters parameters) {
        return new PermissionTriple(resourceType, operation, resourceResolver.apply(sessionId, parameters));
    }

    public static RequestType fromTag(String tag) {
        RequestType type = tag != null ? BY_TAG.get(tag) : null;
        if (type == null) {
            throw HostException.invalidArgument("No handler found for request type " + tag);
        }
        return type;
    }

    private static BiFunction<String, RequestParameters, String> fixed(String resource) {
        return (sessionId, params) -> resource;
    }
}
