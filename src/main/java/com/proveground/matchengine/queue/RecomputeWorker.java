package com.proveground.matchengine.queue;

import com.proveground.matchengine.persistence.MatchScoreEntity;
import com.proveground.matchengine.persistence.RecomputeQueueEntity;
import com.proveground.matchengine.scoring.MatchComputationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Drains the recompute queue: claim, compute, settle.
 */
@Component
@Slf4j
public class RecomputeWorker {

    private final RecomputeQueueService queueService;
    private final MatchComputationService computationService;
    private final int batchSize;

    public RecomputeWorker(RecomputeQueueService queueService,
                           MatchComputationService computationService,
                           @Value("${matchengine.queue.batch-size:50}") int batchSize) {
        this.queueService = queueService;
        this.computationService = computationService;
        this.batchSize = batchSize;
    }

    /**
     * Process up to one batch of items.
     * @return number of items claimed
     */
    public int drain(String workerId) {
        int claimed = 0;
        while (claimed < batchSize) {
            Optional<RecomputeQueueEntity> next = queueService.claimNext(workerId);
            if (next.isEmpty()) {
                break;
            }
            process(next.get());
            claimed++;
        }
        if (claimed > 0) {
            log.info("Worker {} processed {} queue items", workerId, claimed);
        }
        return claimed;
    }

    /**
     * Recompute one claimed item and record the outcome on the queue.
     */
    public void process(RecomputeQueueEntity item) {
        try {
            Optional<MatchScoreEntity> score = computationService.compute(
                    item.getStudentId(), item.getListingId(), item.getReason());
            if (score.isPresent()) {
                queueService.markDone(item.getId(), item.getClaimedBy());
            } else {
                queueService.markDropped(item.getId(), item.getClaimedBy());
            }
        } catch (Exception e) {
            log.error("Error recomputing {} / {} (item {}): {}",
                    item.getStudentId(), item.getListingId(), item.getId(), e.getMessage(), e);
            queueService.markAttemptFailed(item.getId(), item.getClaimedBy(), e);
        }
    }

    public int getBatchSize() {
        return batchSize;
    }
}
