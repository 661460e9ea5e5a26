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
import me.golemcore.host.domain.model.PermissionEffect;
import me.golemcore.host.domain.model.PermissionRule;
import me.golemcore.host.domain.model.PermissionTriple;
import me.golemcore.host.domain.model.SecurityLevel;
import me.golemcore.host.infrastructure.config.HostProperties;
import me.golemcore.host.security.MaximumLevelGuard;
import me.golemcore.host.security.ResourcePattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Permission policy: an allow/deny rule set evaluated under the process-wide
 * {@link SecurityLevel}.
 *
 * <p>
 * Evaluation picks, among rules whose resource type and operation match
 * exactly and whose pattern matches the resource, the most specific pattern
 * (see {@link ResourcePattern#specificity()}); ties go to the most recently
 * added rule. Without a matching rule the level's default applies. At HIGH and
 * above wildcard grants are ignored, and MAXIMUM adds the
 * {@link MaximumLevelGuard} veto, so raising the level only ever narrows
 * access.
 *
 * <p>
 * The rule set and level are guarded by a read/write lock owned by this
 * service alone. Changes apply to evaluations that start after the change.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class PermissionPolicyService {

    private static final Map<String, List<PermissionRule>> OPERATION_SHORTHANDS = Map.of(
            "file_read", List.of(PermissionRule.allow("file", "read", "*")),
            "file_write", List.of(PermissionRule.allow("file", "write", "*")),
            "network_access", List.of(PermissionRule.allow("network", "connect", "*")),
            "tool_execution", List.of(PermissionRule.allow("tool", "execute", "*")));

    private final MaximumLevelGuard guard;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<CompiledRule> rules = new ArrayList<>();
    private long nextSequence = 1;
    private SecurityLevel level;

    public PermissionPolicyService(HostProperties properties, MaximumLevelGuard guard) {
        this.guard = guard;
        HostProperties.SecurityProperties security = properties.getSecurity();
        this.level = SecurityLevel.fromString(security.getLevel());
        log.info("[Security] Initializing permission policy with {} security level", level);

        for (String operation : security.getAllowedOperations()) {
            List<PermissionRule> expanded = OPERATION_SHORTHANDS.get(operation);
            if (expanded == null) {
                log.warn("[Security] Unknown operation shorthand: {}", operation);
                continue;
            }
            expanded.forEach(this::addRule);
        }
        for (HostProperties.RuleProperties rule : security.getRules()) {
            addRule(PermissionRule.builder()
                    .resourceType(rule.getResourceType())
                    .operation(rule.getOperation())
                    .resourcePattern(rule.getResourcePattern())
                    .effect(PermissionEffect.fromString(rule.getEffect()))
                    .build());
        }
    }

    public PermissionEffect evaluate(PermissionTriple triple) {
        return evaluate(triple.resourceType(), triple.operation(), triple.resource());
    }

    public PermissionEffect evaluate(String resourceType, String operation, String resource) {
        lock.readLock().lock();
        try {
            CompiledRule best = null;
            for (CompiledRule candidate : rules) {
                if (!candidate.appliesTo(resourceType, operation, resource)) {
                    continue;
                }
                if (candidate.isWildcardGrant() && !level.allowsWildcardGrants()) {
                    continue;
                }
                if (best == null || candidate.outranks(best)) {
                    best = candidate;
                }
            }

            PermissionEffect effect = best != null ? best.rule().getEffect() : level.defaultEffect();
            if (effect == PermissionEffect.ALLOW && level == SecurityLevel.MAXIMUM
                    && !guard.permits(resourceType, operation, resource)) {
                effect = PermissionEffect.DENY;
            }
            log.debug("[Security] {} {} {} -> {} (level={}, rule={})", resourceType, operation, resource,
                    effect, level, best != null ? best.rule().getResourcePattern() : "default");
            return effect;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Adds a rule. Re-adding a rule with the same target and effect replaces the
     * old one, making it the most recent.
     *
     * @return the stored rule with its sequence number
     */
    public PermissionRule addRule(PermissionRule rule) {
        validate(rule);
        ResourcePattern pattern = ResourcePattern.of(rule.getResourcePattern());
        lock.writeLock().lock();
        try {
            rules.removeIf(existing -> existing.rule().getEffect() == rule.getEffect()
                    && existing.rule().sameTarget(rule.getResourceType(), rule.getOperation(),
                            rule.getResourcePattern()));
            PermissionRule stored = rule.toBuilder().sequence(nextSequence++).build();
            rules.add(new CompiledRule(stored, pattern));
            log.info("[Security] Added {} rule: {} {} {}", stored.getEffect(), stored.getResourceType(),
                    stored.getOperation(), stored.getResourcePattern());
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every rule with the given target. Removing a rule that does not
     * exist is not an error.
     *
     * @return number of rules removed
     */
    public int removeRule(String resourceType, String operation, String resourcePattern) {
        lock.writeLock().lock();
        try {
            int before = rules.size();
            rules.removeIf(existing -> existing.rule().sameTarget(resourceType, operation, resourcePattern));
            int removed = before - rules.size();
            if (removed > 0) {
                log.info("[Security] Removed rule: {} {} {}", resourceType, operation, resourcePattern);
            } else {
                log.debug("[Security] No rule to remove: {} {} {}", resourceType, operation, resourcePattern);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return the previous level
     */
    public SecurityLevel setLevel(SecurityLevel newLevel) {
        if (newLevel == null) {
            throw HostException.invalidArgument("Security level is required");
        }
        lock.writeLock().lock();
        try {
            SecurityLevel previous = level;
            level = newLevel;
            log.info("[Security] Changing security level from {} to {}", previous, newLevel);
            return previous;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public SecurityLevel getLevel() {
        lock.readLock().lock();
        try {
            return level;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<PermissionRule> listRules() {
        lock.readLock().lock();
        try {
            return rules.stream()
                    .map(CompiledRule::rule)
                    .sorted(Comparator.comparingLong(PermissionRule::getSequence))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void validate(PermissionRule rule) {
        if (rule == null) {
            throw HostException.invalidArgument("Permission rule is required");
        }
        if (isBlank(rule.getResourceType()) || isBlank(rule.getOperation()) || isBlank(rule.getResourcePattern())) {
            throw HostException.invalidArgument("Permission rule needs resource type, operation and resource");
        }
        if (rule.getEffect() == null) {
            throw HostException.invalidArgument("Permission rule needs an effect");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record CompiledRule(PermissionRule rule, ResourcePattern pattern) {

        boolean appliesTo(String resourceType, String operation, String resource) {
            return rule.getResourceType().equals(resourceType)
                    && rule.getOperation().equals(operation)
                    && pattern.matches(resource);
        }

        boolean isWildcardGrant() {
            return rule.getEffect() == PermissionEffect.ALLOW && pattern.isWildcard();
        }

        boolean outranks(CompiledRule other) {
            int specificity = pattern.specificity();
            int otherSpecificity = other.pattern().specificity();
            if (specificity != otherSpecificity) {
                return specificity > otherSpecificity;
            }
            return rule.getSequence() > other.rule().getSequence();
        }
    }
}
