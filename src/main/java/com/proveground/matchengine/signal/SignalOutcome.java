package com.proveground.matchengine.signal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one signal evaluation, score in [0, 1].
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignalOutcome {

    public static final double NEUTRAL_SCORE = 0.5;

    private SignalType type;
    private double score;
    private boolean neutralFallback;
    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();

    public static SignalOutcome of(SignalType type, double score, Map<String, Object> details) {
        return SignalOutcome.builder()
                .type(type)
                .score(normalize(score))
                .neutralFallback(false)
                .details(details)
                .build();
    }

    /**
     * Neutral score used when the inputs needed by a signal are missing.
     */
    public static SignalOutcome neutral(SignalType type, String reason) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("fallbackReason", reason);
        return SignalOutcome.builder()
                .type(type)
                .score(NEUTRAL_SCORE)
                .neutralFallback(true)
                .details(details)
                .build();
    }

    /**
     * Clamp to [0, 1] and round to 4 decimals.
     */
    static double normalize(double score) {
        if (Double.isNaN(score)) {
            throw new IllegalArgumentException("Signal score is NaN");
        }
        double clamped = Math.max(0.0, Math.min(1.0, score));
        return BigDecimal.valueOf(clamped).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }
}
