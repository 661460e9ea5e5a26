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

import me.golemcore.host.domain.exception.HostException;
import me.golemcore.host.domain.exception.InvariantViolationException;
import me.golemcore.host.domain.model.ErrorKind;
import me.golemcore.host.domain.model.MemoryCategory;
import me.golemcore.host.domain.model.MemoryHandle;
import me.golemcore.host.domain.model.MemoryStatus;
import me.golemcore.host.domain.model.OptimizationResult;
import me.golemcore.host.domain.model.OptimizationStrategy;
import me.golemcore.host.infrastructure.config.HostProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of live memory allocations with global and per-category quotas.
 *
 * <p>
 * All bookkeeping (handles, per-category usage, total usage) changes under one
 * lock, so a rejected allocation leaves usage untouched and a handle is released
 * at most once. Ownership by sessions is tracked by the session table; callers
 * that need both take the table lock first.
 *
 * <p>
 * Optimization reclaims idle handles by strategy:
 * <ul>
 * <li>AGGRESSIVE - background, short-term, working and long-term handles idle
 * for at least the aggressive threshold</li>
 * <li>BALANCED - background, short-term and working handles idle for at least
 * the balanced threshold</li>
 * <li>CONSERVATIVE - background and short-term handles idle for at least the
 * conservative threshold, only while the category is under pressure</li>
 * </ul>
 * SYSTEM handles are never reclaimed.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class MemoryRegistryService {

    private static final String LOG_PREFIX = "[Memory]";

    private static final Map<OptimizationStrategy, List<MemoryCategory>> RECLAIMABLE = Map.of(
            OptimizationStrategy.AGGRESSIVE, List.of(MemoryCategory.BACKGROUND, MemoryCategory.SHORT_TERM,
                    MemoryCategory.WORKING, MemoryCategory.LONG_TERM),
            OptimizationStrategy.BALANCED, List.of(MemoryCategory.BACKGROUND, MemoryCategory.SHORT_TERM,
                    MemoryCategory.WORKING),
            OptimizationStrategy.CONSERVATIVE, List.of(MemoryCategory.BACKGROUND, MemoryCategory.SHORT_TERM));

    private final HostProperties.MemoryProperties memoryProperties;
    private final Clock clock;
    private final long globalQuota;
    private final Map<MemoryCategory, Long> categoryQuotas = new EnumMap<>(MemoryCategory.class);
    private final OptimizationStrategy defaultStrategy;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, MemoryHandle> handles = new LinkedHashMap<>();
    private final Map<MemoryCategory, Long> categoryUsage = new EnumMap<>(MemoryCategory.class);
    private long totalUsage;

    public MemoryRegistryService(HostProperties properties, Clock clock) {
        this.memoryProperties = properties.getMemory();
        this.clock = clock;
        this.globalQuota = memoryProperties.maxAllocationBytes();
        if (globalQuota <= 0) {
            throw new IllegalStateException("host.memory.max-allocation-mb must be positive");
        }
        for (MemoryCategory category : MemoryCategory.values()) {
            categoryQuotas.put(category, memoryProperties.categoryQuotaBytes(category));
            categoryUsage.put(category, 0L);
        }
        this.defaultStrategy = OptimizationStrategy.fromString(memoryProperties.getOptimizationStrategy());
        log.info("{} Initialized with {} bytes global quota, default strategy {}", LOG_PREFIX, globalQuota,
                defaultStrategy);
    }

    /**
     * Stages a new allocation. The caller commits ownership to the session; on
     * failure it must {@link #release(String)} the returned handle.
     *
     * @throws HostException
     *             {@code INVALID_ARGUMENT} for a non-positive size,
     *             {@code QUOTA_EXCEEDED} when the category or global quota
     *             would be exceeded
     */
    public MemoryHandle allocate(String ownerSessionId, MemoryCategory category, long sizeBytes, String purpose) {
        if (category == null) {
            throw HostException.invalidArgument("Memory category is required");
        }
        if (sizeBytes <= 0) {
            throw HostException.invalidArgument("Allocation size must be positive: " + sizeBytes);
        }

        lock.lock();
        try {
            long categoryUsed = categoryUsage.get(category);
            long categoryQuota = categoryQuotas.get(category);
            if (sizeBytes > categoryQuota - categoryUsed) {
                throw new HostException(ErrorKind.QUOTA_EXCEEDED, String.format(
                        "Memory quota exceeded for category %s: requested %d, used %d, quota %d",
                        category, sizeBytes, categoryUsed, categoryQuota));
            }
            if (sizeBytes > globalQuota - totalUsage) {
                throw new HostException(ErrorKind.QUOTA_EXCEEDED, String.format(
                        "Global memory quota exceeded: requested %d, used %d, quota %d",
                        sizeBytes, totalUsage, globalQuota));
            }

            Instant now = clock.instant();
            MemoryHandle handle = MemoryHandle.builder()
                    .id(UUID.randomUUID().toString())
                    .ownerSessionId(ownerSessionId)
                    .category(category)
                    .sizeBytes(sizeBytes)
                    .purpose(purpose != null ? purpose : "")
                    .createdAt(now)
                    .lastAccessedAt(now)
                    .build();
            handles.put(handle.getId(), handle);
            categoryUsage.put(category, categoryUsed + sizeBytes);
            totalUsage += sizeBytes;

            log.debug("{} Allocated {} bytes in {} for session {}: {}", LOG_PREFIX, sizeBytes, category,
                    ownerSessionId, handle.getId());
            return handle.copy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases a handle and credits its size back to the quotas.
     *
     * @throws HostException
     *             {@code HANDLE_NOT_FOUND} if the handle is not live
     */
    public MemoryHandle release(String handleId) {
        lock.lock();
        try {
            MemoryHandle handle = handles.remove(handleId);
            if (handle == null) {
                throw HostException.handleNotFound(handleId);
            }
            credit(handle);
            log.debug("{} Released {} ({} bytes, {})", LOG_PREFIX, handleId, handle.getSizeBytes(),
                    handle.getCategory());
            return handle.copy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records an access, refreshing the handle's idle clock.
     */
    public MemoryHandle access(String handleId) {
        lock.lock();
        try {
            MemoryHandle handle = handles.get(handleId);
            if (handle == null) {
                throw HostException.handleNotFound(handleId);
            }
            handle.setLastAccessedAt(clock.instant());
            handle.setAccessCount(handle.getAccessCount() + 1);
            return handle.copy();
        } finally {
            lock.unlock();
        }
    }

    public Optional<MemoryHandle> find(String handleId) {
        lock.lock();
        try {
            return Optional.ofNullable(handles.get(handleId)).map(MemoryHandle::copy);
        } finally {
            lock.unlock();
        }
    }

    public OptimizationResult optimize() {
        return optimize(defaultStrategy);
    }

    /**
     * Reclaims idle handles per the strategy. The caller removes the reclaimed
     * ids from their owning sessions.
     */
    public OptimizationResult optimize(OptimizationStrategy strategy) {
        OptimizationStrategy effective = strategy != null ? strategy : defaultStrategy;
        Duration threshold = idleThreshold(effective);

        lock.lock();
        try {
            Instant now = clock.instant();
            List<String> reclaimed = new ArrayList<>();
            long bytesFreed = 0;

            for (MemoryCategory category : RECLAIMABLE.get(effective)) {
                List<MemoryHandle> candidates = handles.values().stream()
                        .filter(handle -> handle.getCategory() == category)
                        .filter(handle -> !Duration.between(handle.getLastAccessedAt(), now).minus(threshold)
                                .isNegative())
                        .sorted(Comparator.comparing(MemoryHandle::getLastAccessedAt))
                        .toList();

                for (MemoryHandle candidate : candidates) {
                    if (effective == OptimizationStrategy.CONSERVATIVE && !underPressure(category)) {
                        break;
                    }
                    handles.remove(candidate.getId());
                    credit(candidate);
                    reclaimed.add(candidate.getId());
                    bytesFreed += candidate.getSizeBytes();
                }
            }

            if (!reclaimed.isEmpty()) {
                log.info("{} {} optimization reclaimed {} handles, {} bytes", LOG_PREFIX, effective,
                        reclaimed.size(), bytesFreed);
            }
            return OptimizationResult.builder()
                    .strategy(effective)
                    .reclaimedHandles(List.copyOf(reclaimed))
                    .bytesFreed(bytesFreed)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public MemoryStatus status() {
        lock.lock();
        try {
            Map<MemoryCategory, MemoryStatus.CategoryUsage> categories = new EnumMap<>(MemoryCategory.class);
            for (MemoryCategory category : MemoryCategory.values()) {
                int count = (int) handles.values().stream()
                        .filter(handle -> handle.getCategory() == category)
                        .count();
                categories.put(category, MemoryStatus.CategoryUsage.builder()
                        .usedBytes(categoryUsage.get(category))
                        .quotaBytes(categoryQuotas.get(category))
                        .handleCount(count)
                        .build());
            }
            return MemoryStatus.builder()
                    .usedBytes(totalUsage)
                    .quotaBytes(globalQuota)
                    .handleCount(handles.size())
                    .categories(categories)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public OptimizationStrategy getDefaultStrategy() {
        return defaultStrategy;
    }

    private void credit(MemoryHandle handle) {
        long categoryUsed = categoryUsage.get(handle.getCategory()) - handle.getSizeBytes();
        long total = totalUsage - handle.getSizeBytes();
        if (categoryUsed < 0 || total < 0) {
            throw new InvariantViolationException(String.format(
                    "Memory usage would become negative releasing %s (%d bytes, %s)",
                    handle.getId(), handle.getSizeBytes(), handle.getCategory()));
        }
        categoryUsage.put(handle.getCategory(), categoryUsed);
        totalUsage = total;
    }

    private boolean underPressure(MemoryCategory category) {
        double ratio = memoryProperties.getOptimization().getConservativePressureRatio();
        return categoryUsage.get(category) >= categoryQuotas.get(category) * ratio;
    }

    private Duration idleThreshold(OptimizationStrategy strategy) {
        HostProperties.OptimizationProperties optimization = memoryProperties.getOptimization();
        return switch (strategy) {
            case AGGRESSIVE -> optimization.getAggressiveIdleThreshold();
            case BALANCED -> optimization.getBalancedIdleThreshold();
            case CONSERVATIVE -> optimization.getConservativeIdleThreshold();
        };
    }
}
