package me.golemcore.host.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.host.adapter.inbound.web.dto.SystemHealthResponse;
import me.golemcore.host.domain.model.MemoryStatus;
import me.golemcore.host.domain.service.FatalErrorHandler;
import me.golemcore.host.domain.service.MemoryRegistryService;
import me.golemcore.host.domain.service.PermissionPolicyService;
import me.golemcore.host.domain.service.RequestDispatcher;
import me.golemcore.host.domain.service.SessionTable;
import me.golemcore.host.infrastructure.config.HostProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.lang.management.ManagementFactory;

/**
 * System health and status endpoints.
 */
@RestController
@RequestMapping("/api/v1/system")
@RequiredArgsConstructor
public class SystemController {

    private final RequestDispatcher dispatcher;
    private final SessionTable sessionTable;
    private final MemoryRegistryService memoryRegistry;
    private final PermissionPolicyService permissionPolicy;
    private final FatalErrorHandler fatalErrorHandler;
    private final HostProperties properties;

    @GetMapping("/health")
    public Mono<ResponseEntity<SystemHealthResponse>> health() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        MemoryStatus memory = memoryRegistry.status();
        HostProperties.KernelProperties kernel = properties.getKernel();

        SystemHealthResponse response = SystemHealthResponse.builder()
                .status(status())
                .name(kernel.getName())
                .version(kernel.getVersion())
                .apiVersion(kernel.getApiVersion())
                .uptimeMs(uptimeMs)
                .securityLevel(permissionPolicy.getLevel().name())
                .liveSessions(sessionTable.size())
                .memory(SystemHealthResponse.MemoryUsage.builder()
                        .usedBytes(memory.getUsedBytes())
                        .quotaBytes(memory.getQuotaBytes())
                        .handleCount(memory.getHandleCount())
                        .build())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    private String status() {
        if (fatalErrorHandler.isFaulted()) {
            return "FAULTED";
        }
        return dispatcher.isRunning() ? "UP" : "STOPPED";
    }
}
