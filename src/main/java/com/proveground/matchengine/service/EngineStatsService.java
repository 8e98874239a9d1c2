package com.proveground.matchengine.service;

import com.proveground.matchengine.availability.AvailabilityWindowBuilder;
import com.proveground.matchengine.persistence.MatchScoreRepository;
import com.proveground.matchengine.persistence.ScoreStatsView;
import com.proveground.matchengine.queue.RecomputeQueueService;
import com.proveground.matchengine.queue.RecomputeWorker;
import com.proveground.matchengine.scoring.SignalWeights;
import com.proveground.matchengine.web.dto.EngineConfigResponse;
import com.proveground.matchengine.web.dto.EngineStatsResponse;
import com.proveground.matchengine.web.dto.ScoreStatsResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Admin dashboard figures: score cache aggregates, queue counts and the
 * running configuration.
 */
@Service
@RequiredArgsConstructor
public class EngineStatsService {

    private final MatchScoreRepository scoreRepository;
    private final RecomputeQueueService queueService;
    private final RecomputeWorker recomputeWorker;
    private final StalenessTracker stalenessTracker;
    private final AvailabilityWindowBuilder windowBuilder;
    private final SignalWeights signalWeights;

    public EngineStatsResponse getStats(String tenantId) {
        ScoreStatsView view = tenantId == null
                ? scoreRepository.aggregateAll()
                : scoreRepository.aggregateForTenant(tenantId);
        return new EngineStatsResponse(toResponse(view), queueService.getStats(tenantId));
    }

    public EngineConfigResponse getConfig() {
        Map<String, BigDecimal> weights = new LinkedHashMap<>();
        signalWeights.asMap().forEach((type, weight) -> weights.put(type.getKey(), weight));
        return EngineConfigResponse.builder()
                .weightsVersion(signalWeights.getVersion())
                .weights(weights)
                .staleThresholdHours(stalenessTracker.getStaleThresholdHours())
                .batchSize(recomputeWorker.getBatchSize())
                .maxAttempts(queueService.getMaxAttempts())
                .weeklyCapacityHours(windowBuilder.getWeeklyCapacity())
                .build();
    }

    private static ScoreStatsResponse toResponse(ScoreStatsView view) {
        if (view == null || view.getTotalScores() == null || view.getTotalScores() == 0) {
            return ScoreStatsResponse.builder().build();
        }
        return ScoreStatsResponse.builder()
                .totalScores(view.getTotalScores())
                .staleScores(orZero(view.getStaleScores()))
                .avgScore(round(view.getAvgScore()))
                .maxScore(view.getMaxScore() != null ? view.getMaxScore() : 0)
                .minScore(view.getMinScore() != null ? view.getMinScore() : 0)
                .avgComputationMs(round(view.getAvgComputationMs()))
                .uniqueStudents(orZero(view.getUniqueStudents()))
                .uniqueListings(orZero(view.getUniqueListings()))
                .build();
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }

    private static double round(Double value) {
        if (value == null) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
