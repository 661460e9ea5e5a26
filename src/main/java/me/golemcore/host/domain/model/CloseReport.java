package me.golemcore.host.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Result of closing a session: which handles were released and which releases
 * failed. A close with failures still ends in {@code CLOSED}.
 */
@Data
@Builder
public class CloseReport {

    private String sessionId;
    private HostSession.SessionStatus status;

    @Builder.Default
    private List<String> releasedHandles = List.of();

    @Builder.Default
    private List<ReleaseFailure> failures = List.of();

    public boolean isClean() {
        return failures.isEmpty();
    }

    @Data
    @Builder
    public static class ReleaseFailure {
        private String handleId;
        private ErrorKind errorKind;
        private String message;
    }
}
