package com.proveground.matchengine.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Read-only view of the running engine configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineConfigResponse {

    private String weightsVersion;
    private Map<String, BigDecimal> weights;
    private int staleThresholdHours;
    private int batchSize;
    private int maxAttempts;
    private double weeklyCapacityHours;
}
