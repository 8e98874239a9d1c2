package com.proveground.matchengine.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantConfigResponse {

    private String tenantId;
    private int minScoreThreshold;
    private int maxResultsPerQuery;
    private boolean enableAthleticTransfer;
    // true while the tenant runs on engine defaults
    private boolean usingDefaults;
    private LocalDateTime updatedAt;
}
