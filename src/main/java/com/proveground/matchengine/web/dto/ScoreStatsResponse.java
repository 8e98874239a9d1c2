package com.proveground.matchengine.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreStatsResponse {

    @JsonProperty("total_scores")
    private long totalScores;

    @JsonProperty("stale_scores")
    private long staleScores;

    @JsonProperty("avg_score")
    private double avgScore;

    @JsonProperty("max_score")
    private int maxScore;

    @JsonProperty("min_score")
    private int minScore;

    @JsonProperty("avg_computation_ms")
    private double avgComputationMs;

    @JsonProperty("unique_students")
    private long uniqueStudents;

    @JsonProperty("unique_listings")
    private long uniqueListings;
}
