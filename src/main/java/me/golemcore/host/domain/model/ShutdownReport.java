package me.golemcore.host.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of the shutdown drain. {@code stragglers} lists sessions still live
 * when the drain timeout elapsed.
 */
@Data
@Builder
public class ShutdownReport {

    @Builder.Default
    private List<CloseReport> closed = List.of();

    @Builder.Default
    private List<String> stragglers = List.of();

    private long elapsedMs;

    public boolean isComplete() {
        return stragglers.isEmpty();
    }
}
