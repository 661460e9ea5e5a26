package me.golemcore.host.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSummaryDto {
    private String id;
    private String status;
    private String createdAt;
    private String lastActivityAt;
    private Map<String, String> metadata;
    private int ownedHandles;
}
