package me.golemcore.host.infrastructure.config;

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

import me.golemcore.host.domain.service.MemoryRegistryService;
import me.golemcore.host.domain.service.PermissionPolicyService;
import me.golemcore.host.domain.service.ToolRegistryService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;

/**
 * Shared infrastructure beans and the startup banner.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final HostProperties properties;
    private final PermissionPolicyService permissionPolicy;
    private final MemoryRegistryService memoryRegistry;
    private final ToolRegistryService toolRegistry;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        HostProperties.KernelProperties kernel = properties.getKernel();
        log.info("{} v{} (API {}) starting...", kernel.getName(), kernel.getVersion(), kernel.getApiVersion());
        log.info("Security Level: {}", permissionPolicy.getLevel());
        log.info("Memory Quota: {} bytes, default optimization {}", memoryRegistry.status().getQuotaBytes(),
                memoryRegistry.getDefaultStrategy());
        log.info("Tools: {}", toolRegistry.list().size());
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
    }
}
