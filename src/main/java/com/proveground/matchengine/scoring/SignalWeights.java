package com.proveground.matchengine.scoring;

import com.proveground.matchengine.signal.SignalType;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Versioned, immutable weight set. Weights are loaded once at startup; a
 * different version invalidates every cached score.
 */
public final class SignalWeights {

    private static final BigDecimal EPSILON = new BigDecimal("0.000001");

    private final String version;
    private final Map<SignalType, BigDecimal> weights;

    private SignalWeights(String version, Map<SignalType, BigDecimal> weights) {
        this.version = version;
        this.weights = Collections.unmodifiableMap(new EnumMap<>(weights));
    }

    /**
     * Validate and create a weight set.
     * @throws IllegalStateException if a signal is missing, a weight is negative
     *         or the weights do not sum to 1.0
     */
    public static SignalWeights of(String version, Map<SignalType, BigDecimal> weights) {
        if (version == null || version.isBlank()) {
            throw new IllegalStateException("Signal weights must carry a version");
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (SignalType type : SignalType.values()) {
            BigDecimal weight = weights.get(type);
            if (weight == null) {
                throw new IllegalStateException("Missing weight for signal " + type.getKey());
            }
            if (weight.signum() < 0) {
                throw new IllegalStateException("Negative weight for signal " + type.getKey() + ": " + weight);
            }
            sum = sum.add(weight);
        }
        if (sum.subtract(BigDecimal.ONE).abs().compareTo(EPSILON) > 0) {
            throw new IllegalStateException("Signal weights must sum to 1.0 but sum to " + sum.stripTrailingZeros().toPlainString());
        }
        return new SignalWeights(version, weights);
    }

    /**
     * Production defaults: skills 0.30, temporal 0.25, sustainability 0.15,
     * growth/trust/network 0.10 each.
     */
    public static SignalWeights defaults(String version) {
        Map<SignalType, BigDecimal> weights = new EnumMap<>(SignalType.class);
        weights.put(SignalType.SKILLS, new BigDecimal("0.30"));
        weights.put(SignalType.TEMPORAL, new BigDecimal("0.25"));
        weights.put(SignalType.SUSTAINABILITY, new BigDecimal("0.15"));
        weights.put(SignalType.GROWTH, new BigDecimal("0.10"));
        weights.put(SignalType.TRUST, new BigDecimal("0.10"));
        weights.put(SignalType.NETWORK, new BigDecimal("0.10"));
        return of(version, weights);
    }

    public String getVersion() {
        return version;
    }

    public BigDecimal weightOf(SignalType type) {
        return weights.get(type);
    }

    public Map<SignalType, BigDecimal> asMap() {
        return weights;
    }

    @Override
    public String toString() {
        return "SignalWeights{version=" + version + ", weights=" + weights + "}";
    }
}
