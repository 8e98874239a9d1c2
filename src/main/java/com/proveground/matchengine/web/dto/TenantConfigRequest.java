package com.proveground.matchengine.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of a tenant's match settings; null fields keep their value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantConfigRequest {

    @Min(0)
    @Max(100)
    private Integer minScoreThreshold;

    @Min(1)
    @Max(200)
    private Integer maxResultsPerQuery;

    private Boolean enableAthleticTransfer;
}
