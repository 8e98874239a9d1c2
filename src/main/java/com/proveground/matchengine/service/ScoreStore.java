package com.proveground.matchengine.service;

import com.proveground.matchengine.persistence.MatchScoreEntity;
import com.proveground.matchengine.persistence.MatchScoreHistoryEntity;
import com.proveground.matchengine.persistence.MatchScoreHistoryRepository;
import com.proveground.matchengine.persistence.MatchScoreRepository;
import com.proveground.matchengine.persistence.RecomputeQueueEntity.Reason;
import com.proveground.matchengine.scoring.ScoreResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cache of computed scores, one row per (student, listing) pair.
 */
@Service
@Slf4j
public class ScoreStore {

    static final String REASON_INITIAL = "initial";

    private final MatchScoreRepository scoreRepository;
    private final MatchScoreHistoryRepository historyRepository;
    private final TransactionTemplate transactionTemplate;

    public ScoreStore(MatchScoreRepository scoreRepository,
                      MatchScoreHistoryRepository historyRepository,
                      PlatformTransactionManager transactionManager) {
        this.scoreRepository = scoreRepository;
        this.historyRepository = historyRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Write or overwrite the score of a pair and clear its stale flag.
     * Two workers inserting the same new pair race on the unique key; the
     * loser retries once as an update.
     */
    public MatchScoreEntity upsert(String studentId, String listingId, String tenantId,
                                   ScoreResult result, Reason reason) {
        try {
            return transactionTemplate.execute(status -> write(studentId, listingId, tenantId, result, reason));
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent insert of score {} / {}, retrying as update", studentId, listingId);
            return transactionTemplate.execute(status -> write(studentId, listingId, tenantId, result, reason));
        }
    }

    private MatchScoreEntity write(String studentId, String listingId, String tenantId,
                                   ScoreResult result, Reason reason) {
        Optional<MatchScoreEntity> existing = scoreRepository.findByStudentIdAndListingId(studentId, listingId);
        Integer previousScore = existing.map(MatchScoreEntity::getCompositeScore).orElse(null);

        MatchScoreEntity entity = existing.orElseGet(() -> MatchScoreEntity.builder()
                .studentId(studentId)
                .listingId(listingId)
                .build());
        entity.setTenantId(tenantId);
        entity.setCompositeScore(result.getCompositeScore());
        entity.setSignals(result.getSignals());
        entity.setMatchedSkills(new ArrayList<>(result.getMatchedSkills()));
        entity.setMissingSkills(new ArrayList<>(result.getMissingSkills()));
        entity.setWeightsVersion(result.getWeightsVersion());
        entity.setComputationMs(result.getComputationMs());
        entity.setComputedAt(LocalDateTime.now());
        entity.setStale(false);
        MatchScoreEntity saved = scoreRepository.saveAndFlush(entity);

        if (previousScore == null) {
            historyRepository.save(MatchScoreHistoryEntity.create(studentId, listingId, null,
                    result.getCompositeScore(), REASON_INITIAL));
        } else if (previousScore != result.getCompositeScore()) {
            historyRepository.save(MatchScoreHistoryEntity.create(studentId, listingId, previousScore,
                    result.getCompositeScore(), historyReason(reason)));
        }
        return saved;
    }

    public Optional<MatchScoreEntity> find(String studentId, String listingId) {
        return scoreRepository.findByStudentIdAndListingId(studentId, listingId);
    }

    /**
     * Scores of a listing at or above {@code minScore}, best first; equal
     * scores rank the older computation first.
     */
    public List<MatchScoreEntity> rankedForListing(String listingId, int minScore, int limit) {
        return scoreRepository.findRankedForListing(listingId, minScore, PageRequest.of(0, limit));
    }

    public List<MatchScoreEntity> rankedForStudent(String studentId, int minScore, int limit) {
        return scoreRepository.findRankedForStudent(studentId, minScore, PageRequest.of(0, limit));
    }

    public List<MatchScoreHistoryEntity> history(String studentId, String listingId) {
        return historyRepository.findByStudentIdAndListingIdOrderByIdAsc(studentId, listingId);
    }

    @Transactional
    public int deleteForStudent(String studentId) {
        historyRepository.deleteByStudent(studentId);
        return scoreRepository.deleteByStudent(studentId);
    }

    @Transactional
    public int deleteForListing(String listingId) {
        historyRepository.deleteByListing(listingId);
        return scoreRepository.deleteByListing(listingId);
    }

    private static String historyReason(Reason reason) {
        return reason != null ? reason.name().toLowerCase() : "recomputation";
    }
}
