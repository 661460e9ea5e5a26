package me.golemcore.host.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of an optimization pass. An empty result is a normal outcome.
 */
@Data
@Builder
public class OptimizationResult {

    private OptimizationStrategy strategy;

    @Builder.Default
    private List<String> reclaimedHandles = List.of();

    private long bytesFreed;

    public static OptimizationResult empty(OptimizationStrategy strategy) {
        return OptimizationResult.builder().strategy(strategy).build();
    }
}
