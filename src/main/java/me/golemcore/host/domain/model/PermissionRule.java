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

/**
 * A single allow or deny rule. The sequence number is assigned by the policy
 * when the rule is added and breaks specificity ties in favour of the most
 * recently added rule.
 */
@Data
@Builder(toBuilder = true)
public class PermissionRule {

    private String resourceType;
    private String operation;
    private String resourcePattern;

    @Builder.Default
    private PermissionEffect effect = PermissionEffect.ALLOW;

    private long sequence;

    public static PermissionRule allow(String resourceType, String operation, String resourcePattern) {
        return PermissionRule.builder()
                .resourceType(resourceType)
                .operation(operation)
                .resourcePattern(resourcePattern)
                .effect(PermissionEffect.ALLOW)
                .build();
    }

    public static PermissionRule deny(String resourceType, String operation, String resourcePattern) {
        return PermissionRule.builder()
                .resourceType(resourceType)
                .operation(operation)
                .resourcePattern(resourcePattern)
                .effect(PermissionEffect.DENY)
                .build();
    }

    /**
     * Whether this rule is keyed by the given resource type, operation and
     * pattern, regardless of its effect.
     */
    public boolean sameTarget(String type, String op, String pattern) {
        return resourceType.equals(type) && operation.equals(op) && resourcePattern.equals(pattern);
    }
}
