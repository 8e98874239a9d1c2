package com.proveground.matchengine.persistence;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One signal's contribution as stored in the score breakdown.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignalScore {

    private double score;
    private double weight;
    private boolean neutralFallback;
    private Map<String, Object> details;
}
