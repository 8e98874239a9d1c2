package com.proveground.matchengine.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface RecomputeQueueRepository extends JpaRepository<RecomputeQueueEntity, Long> {

    Optional<RecomputeQueueEntity> findFirstByStudentIdAndListingIdAndStatus(String studentId, String listingId,
                                                                             RecomputeQueueEntity.Status status);

    @Query("SELECT q.id FROM RecomputeQueueEntity q WHERE q.status = :status AND q.availableAt <= :now " +
            "ORDER BY q.priority DESC, q.enqueuedAt ASC, q.id ASC")
    List<Long> findClaimableIds(@Param("status") RecomputeQueueEntity.Status status,
                                @Param("now") LocalDateTime now,
                                Pageable pageable);

    /**
     * Compare-and-set claim: succeeds only while the item is still pending.
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE RecomputeQueueEntity q SET q.status = :processing, q.claimedBy = :workerId, " +
            "q.leaseExpiresAt = :leaseUntil WHERE q.id = :id AND q.status = :pending")
    int claim(@Param("id") Long id,
              @Param("workerId") String workerId,
              @Param("leaseUntil") LocalDateTime leaseUntil,
              @Param("pending") RecomputeQueueEntity.Status pending,
              @Param("processing") RecomputeQueueEntity.Status processing);

    /**
     * Settle a claimed item; a worker whose claim was released or taken over
     * matches no row.
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE RecomputeQueueEntity q SET q.status = :outcome, q.processedAt = :now, " +
            "q.claimedBy = null, q.leaseExpiresAt = null " +
            "WHERE q.id = :id AND q.claimedBy = :workerId AND q.status = :processing")
    int settle(@Param("id") Long id,
               @Param("workerId") String workerId,
               @Param("outcome") RecomputeQueueEntity.Status outcome,
               @Param("processing") RecomputeQueueEntity.Status processing,
               @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE RecomputeQueueEntity q SET q.status = :outcome, q.attempts = :attempts, q.lastError = :lastError, " +
            "q.availableAt = :availableAt, q.processedAt = :processedAt, q.claimedBy = null, q.leaseExpiresAt = null " +
            "WHERE q.id = :id AND q.claimedBy = :workerId AND q.status = :processing")
    int recordFailure(@Param("id") Long id,
                      @Param("workerId") String workerId,
                      @Param("processing") RecomputeQueueEntity.Status processing,
                      @Param("outcome") RecomputeQueueEntity.Status outcome,
                      @Param("attempts") int attempts,
                      @Param("lastError") String lastError,
                      @Param("availableAt") LocalDateTime availableAt,
                      @Param("processedAt") LocalDateTime processedAt);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM RecomputeQueueEntity q WHERE q.status IN :terminal AND q.processedAt < :cutoff")
    int purgeProcessedBefore(@Param("terminal") Collection<RecomputeQueueEntity.Status> terminal,
                             @Param("cutoff") LocalDateTime cutoff);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE RecomputeQueueEntity q SET q.status = :pending, q.claimedBy = null, q.leaseExpiresAt = null " +
            "WHERE q.status = :processing AND q.leaseExpiresAt < :now")
    int releaseExpiredLeases(@Param("now") LocalDateTime now,
                             @Param("pending") RecomputeQueueEntity.Status pending,
                             @Param("processing") RecomputeQueueEntity.Status processing);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE RecomputeQueueEntity q SET q.status = :dropped, q.processedAt = :now " +
            "WHERE q.studentId = :studentId AND q.status = :pending")
    int dropPendingForStudent(@Param("studentId") String studentId,
                              @Param("now") LocalDateTime now,
                              @Param("pending") RecomputeQueueEntity.Status pending,
                              @Param("dropped") RecomputeQueueEntity.Status dropped);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE RecomputeQueueEntity q SET q.status = :dropped, q.processedAt = :now " +
            "WHERE q.listingId = :listingId AND q.status = :pending")
    int dropPendingForListing(@Param("listingId") String listingId,
                              @Param("now") LocalDateTime now,
                              @Param("pending") RecomputeQueueEntity.Status pending,
                              @Param("dropped") RecomputeQueueEntity.Status dropped);

    long countByStatus(RecomputeQueueEntity.Status status);

    long countByTenantIdAndStatus(String tenantId, RecomputeQueueEntity.Status status);

    long countByTenantId(String tenantId);
}
