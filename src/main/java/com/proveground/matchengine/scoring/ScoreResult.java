package com.proveground.matchengine.scoring;

import com.proveground.matchengine.persistence.SignalScore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Composite score of one pair plus its breakdown.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreResult {

    private int compositeScore;
    // signal key -> score and weight, in evaluation order
    @Builder.Default
    private LinkedHashMap<String, SignalScore> signals = new LinkedHashMap<>();
    @Builder.Default
    private List<String> matchedSkills = new ArrayList<>();
    @Builder.Default
    private List<String> missingSkills = new ArrayList<>();
    private String weightsVersion;
    private long computationMs;

    public boolean usedNeutralFallback() {
        return signals.values().stream().anyMatch(SignalScore::isNeutralFallback);
    }
}
