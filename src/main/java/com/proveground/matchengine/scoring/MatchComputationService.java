package com.proveground.matchengine.scoring;

import com.google.common.base.Stopwatch;
import com.proveground.matchengine.persistence.MatchScoreEntity;
import com.proveground.matchengine.persistence.RecomputeQueueEntity.Reason;
import com.proveground.matchengine.service.ScoreStore;
import com.proveground.matchengine.signal.EvaluationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Computes and stores the score of one pair.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MatchComputationService {

    private final EvaluationContextLoader contextLoader;
    private final CompositeScorer compositeScorer;
    private final SignalWeights signalWeights;
    private final ScoreStore scoreStore;

    /**
     * Recompute the pair and upsert its score.
     * @return the stored score, or empty if the student or listing is gone
     */
    public Optional<MatchScoreEntity> compute(String studentId, String listingId, Reason reason) {
        Stopwatch stopwatch = Stopwatch.createStarted();

        Optional<EvaluationContext> context = contextLoader.load(studentId, listingId, LocalDate.now());
        if (context.isEmpty()) {
            log.info("Skipping pair {} / {}: student or listing no longer exists", studentId, listingId);
            return Optional.empty();
        }

        ScoreResult result = compositeScorer.evaluateAndScore(context.get(), signalWeights);
        result.setComputationMs(stopwatch.elapsed(TimeUnit.MILLISECONDS));

        MatchScoreEntity stored = scoreStore.upsert(studentId, listingId,
                context.get().getStudent().getTenantId(), result, reason);
        log.debug("Computed {} / {} -> {} in {}ms", studentId, listingId,
                result.getCompositeScore(), result.getComputationMs());
        return Optional.of(stored);
    }
}
