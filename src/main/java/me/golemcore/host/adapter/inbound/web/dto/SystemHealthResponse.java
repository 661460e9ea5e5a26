package me.golemcore.host.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemHealthResponse {
    private String status;
    private String name;
    private String version;
    private String apiVersion;
    private long uptimeMs;
    private String securityLevel;
    private int liveSessions;
    private MemoryUsage memory;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MemoryUsage {
        private long usedBytes;
        private long quotaBytes;
        private int handleCount;
    }
}
