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

import me.golemcore.host.domain.model.MemoryCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the host runtime, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code host.*} prefix:
 * <ul>
 * <li>{@link KernelProperties} - dispatcher identity and shutdown drain</li>
 * <li>{@link MemoryProperties} - global and per-category quotas, optimization
 * thresholds</li>
 * <li>{@link SecurityProperties} - initial security level and rule set, audit
 * retention</li>
 * <li>{@link ToolsProperties} - tool execution limits</li>
 * <li>{@link StorageProperties} - local workspace for persisted state</li>
 * </ul>
 *
 * <p>
 * Loaded once at startup; runtime changes go through the owning services.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "host")
@Data
public class HostProperties {

    private KernelProperties kernel = new KernelProperties();
    private MemoryProperties memory = new MemoryProperties();
    private SecurityProperties security = new SecurityProperties();
    private ToolsProperties tools = new ToolsProperties();
    private StorageProperties storage = new StorageProperties();

    @Data
    public static class KernelProperties {
        private String name = "GolemCore Host";
        private String version = "0.1.0";
        private String apiVersion = "1.0";
        private Duration shutdownDrainTimeout = Duration.ofSeconds(5);
        private boolean exitOnInvariantViolation = true;
    }

    // ==================== MEMORY ====================

    @Data
    public static class MemoryProperties {
        private long maxAllocationMb = 1024;
        private Map<MemoryCategory, Long> categoryQuotasMb = new EnumMap<>(MemoryCategory.class);
        private String optimizationStrategy = "balanced";
        private OptimizationProperties optimization = new OptimizationProperties();

        public long maxAllocationBytes() {
            return maxAllocationMb * 1024 * 1024;
        }

        /**
         * Quota of a category in bytes; categories without an explicit quota are
         * bounded only by the global quota.
         */
        public long categoryQuotaBytes(MemoryCategory category) {
            Long quotaMb = categoryQuotasMb.get(category);
            if (quotaMb == null) {
                return maxAllocationBytes();
            }
            return Math.min(quotaMb * 1024 * 1024, maxAllocationBytes());
        }
    }

    @Data
    public static class OptimizationProperties {
        private Duration aggressiveIdleThreshold = Duration.ofSeconds(60);
        private Duration balancedIdleThreshold = Duration.ofSeconds(300);
        private Duration conservativeIdleThreshold = Duration.ofSeconds(900);
        private double conservativePressureRatio = 0.9;
    }

    // ==================== SECURITY ====================

    @Data
    public static class SecurityProperties {
        private String level = "standard";
        private List<String> allowedOperations = new ArrayList<>();
        private List<RuleProperties> rules = new ArrayList<>();
        private int auditMaxEvents = 1000;
        private boolean auditPersistenceEnabled = true;
    }

    @Data
    public static class RuleProperties {
        private String resourceType;
        private String operation;
        private String resourcePattern = "*";
        private String effect = "allow";
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private Duration executionTimeout = Duration.ofSeconds(30);
        private List<String> disabled = new ArrayList<>();
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/host";
    }
}
