package com.proveground.matchengine.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A (student, listing) pair waiting for its score to be recomputed.
 */
@Entity
@Table(name = "match_recompute_queue",
        indexes = {
                @Index(name = "idx_recompute_queue_claim", columnList = "status, priority, enqueued_at"),
                @Index(name = "idx_recompute_queue_pair", columnList = "student_id, listing_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecomputeQueueEntity {

    /**
     * Why the pair was queued. Targeted, user-triggered changes outrank
     * background refreshes.
     */
    public enum Reason {
        PROFILE_CHANGE(10),
        SCHEDULE_CHANGE(10),
        LISTING_CHANGE(7),
        TTL_EXPIRY(3),
        MANUAL(1);

        private final int defaultPriority;

        Reason(int defaultPriority) {
            this.defaultPriority = defaultPriority;
        }

        public int getDefaultPriority() {
            return defaultPriority;
        }
    }

    public enum Status {
        PENDING,
        PROCESSING,
        DONE,
        FAILED,
        /** Student or listing deleted before the item was processed. */
        DROPPED
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false, length = 64)
    private String studentId;

    @Column(name = "listing_id", nullable = false, length = 64)
    private String listingId;

    @Column(name = "tenant_id", length = 64)
    private String tenantId;

    @Column(name = "priority", nullable = false)
    private int priority;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 20)
    private Reason reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private Status status;

    @Column(name = "enqueued_at", nullable = false)
    private LocalDateTime enqueuedAt;

    // not claimable before this instant (retry backoff)
    @Column(name = "available_at", nullable = false)
    private LocalDateTime availableAt;

    @Column(name = "claimed_by", length = 100)
    private String claimedBy;

    @Column(name = "lease_expires_at")
    private LocalDateTime leaseExpiresAt;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    public static RecomputeQueueEntity create(String studentId, String listingId, String tenantId,
                                              Reason reason, int priority) {
        LocalDateTime now = LocalDateTime.now();
        return RecomputeQueueEntity.builder()
                .studentId(studentId)
                .listingId(listingId)
                .tenantId(tenantId)
                .reason(reason)
                .priority(priority)
                .status(Status.PENDING)
                .enqueuedAt(now)
                .availableAt(now)
                .attempts(0)
                .build();
    }
}
