package com.proveground.matchengine.queue;

import com.proveground.matchengine.persistence.RecomputeQueueEntity;
import com.proveground.matchengine.persistence.RecomputeQueueEntity.Reason;
import com.proveground.matchengine.persistence.RecomputeQueueEntity.Status;
import com.proveground.matchengine.persistence.RecomputeQueueRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Database-backed recompute queue. Items are claimed with a conditional
 * update from PENDING to PROCESSING so that no two workers hold the same
 * item; a claim carries a lease after which the item can be reclaimed.
 */
@Service
@Slf4j
public class RecomputeQueueService {

    private static final int CLAIM_CANDIDATES = 10;
    private static final int MAX_ERROR_LENGTH = 1000;
    private static final Set<Status> SETTLED = EnumSet.of(Status.DONE, Status.DROPPED, Status.FAILED);

    private final RecomputeQueueRepository repository;
    private final int maxAttempts;
    private final long baseBackoffSeconds;
    private final long maxBackoffSeconds;
    private final long leaseSeconds;
    private final int retentionDays;

    public RecomputeQueueService(
            RecomputeQueueRepository repository,
            @Value("${matchengine.queue.max-attempts:5}") int maxAttempts,
            @Value("${matchengine.queue.base-backoff-seconds:30}") long baseBackoffSeconds,
            @Value("${matchengine.queue.max-backoff-seconds:3600}") long maxBackoffSeconds,
            @Value("${matchengine.queue.lease-seconds:300}") long leaseSeconds,
            @Value("${matchengine.queue.retention-days:7}") int retentionDays) {
        this.repository = repository;
        this.maxAttempts = maxAttempts;
        this.baseBackoffSeconds = baseBackoffSeconds;
        this.maxBackoffSeconds = maxBackoffSeconds;
        this.leaseSeconds = leaseSeconds;
        this.retentionDays = retentionDays;
    }

    /**
     * Enqueue with the reason's default priority.
     */
    @Transactional
    public RecomputeQueueEntity enqueue(String studentId, String listingId, String tenantId, Reason reason) {
        return enqueue(studentId, listingId, tenantId, reason, reason.getDefaultPriority());
    }

    /**
     * Enqueue a pair. A pending item for the same pair is reused and its
     * priority raised if the new request outranks it.
     */
    @Transactional
    public RecomputeQueueEntity enqueue(String studentId, String listingId, String tenantId,
                                        Reason reason, int priority) {
        Optional<RecomputeQueueEntity> existing =
                repository.findFirstByStudentIdAndListingIdAndStatus(studentId, listingId, Status.PENDING);
        if (existing.isPresent()) {
            RecomputeQueueEntity item = existing.get();
            if (priority > item.getPriority()) {
                item.setPriority(priority);
                item.setReason(reason);
                log.debug("Raised priority of queued pair {} / {} to {}", studentId, listingId, priority);
                return repository.save(item);
            }
            return item;
        }
        return repository.save(RecomputeQueueEntity.create(studentId, listingId, tenantId, reason, priority));
    }

    /**
     * Enqueue many pairs in one transaction.
     * @return number of pairs submitted
     */
    @Transactional
    public int enqueueAll(Collection<MatchPair> pairs, Reason reason, int priority) {
        for (MatchPair pair : pairs) {
            enqueue(pair.getStudentId(), pair.getListingId(), pair.getTenantId(), reason, priority);
        }
        if (!pairs.isEmpty()) {
            log.info("Enqueued {} pairs for recompute (reason={}, priority={})", pairs.size(), reason, priority);
        }
        return pairs.size();
    }

    @Transactional
    public int enqueueAll(Collection<MatchPair> pairs, Reason reason) {
        return enqueueAll(pairs, reason, reason.getDefaultPriority());
    }

    /**
     * Claim the highest-priority, oldest available item for the given worker.
     */
    @Transactional
    public Optional<RecomputeQueueEntity> claimNext(String workerId) {
        LocalDateTime now = LocalDateTime.now();
        List<Long> candidates = repository.findClaimableIds(Status.PENDING, now, PageRequest.of(0, CLAIM_CANDIDATES));

        for (Long id : candidates) {
            int claimed = repository.claim(id, workerId, now.plusSeconds(leaseSeconds), Status.PENDING, Status.PROCESSING);
            if (claimed == 1) {
                log.debug("Worker {} claimed queue item {}", workerId, id);
                return repository.findById(id);
            }
        }
        return Optional.empty();
    }

    /**
     * Settle a claimed item as computed.
     * @return false when the worker no longer holds the claim
     */
    @Transactional
    public boolean markDone(Long id, String workerId) {
        return settle(id, workerId, Status.DONE);
    }

    /**
     * Student or listing no longer exists.
     */
    @Transactional
    public boolean markDropped(Long id, String workerId) {
        boolean settled = settle(id, workerId, Status.DROPPED);
        if (settled) {
            log.info("Dropped queue item {}", id);
        }
        return settled;
    }

    /**
     * Record a processing failure: back to PENDING with exponential backoff,
     * or FAILED once the attempt ceiling is reached.
     * @return false when the worker no longer holds the claim
     */
    @Transactional
    public boolean markAttemptFailed(Long id, String workerId, Exception error) {
        Optional<RecomputeQueueEntity> found = repository.findById(id);
        if (found.isEmpty() || found.get().getStatus() != Status.PROCESSING
                || !found.get().getClaimedBy().equals(workerId)) {
            log.warn("Worker {} no longer holds queue item {}, failure not recorded: {}",
                    workerId, id, error.getMessage());
            return false;
        }
        RecomputeQueueEntity item = found.get();
        int attempts = item.getAttempts() + 1;
        String lastError = truncate(error.getClass().getSimpleName() + ": " + error.getMessage());
        LocalDateTime now = LocalDateTime.now();

        int updated;
        if (attempts >= maxAttempts) {
            updated = repository.recordFailure(id, workerId, Status.PROCESSING, Status.FAILED, attempts, lastError,
                    item.getAvailableAt(), now);
            if (updated == 1) {
                log.error("Queue item {} ({} / {}) failed permanently after {} attempts: {}",
                        id, item.getStudentId(), item.getListingId(), attempts, error.getMessage());
            }
        } else {
            long delay = backoffSeconds(attempts);
            updated = repository.recordFailure(id, workerId, Status.PROCESSING, Status.PENDING, attempts, lastError,
                    now.plusSeconds(delay), null);
            if (updated == 1) {
                log.warn("Queue item {} failed (attempt {}/{}), retrying in {}s: {}",
                        id, attempts, maxAttempts, delay, error.getMessage());
            }
        }
        return updated == 1;
    }

    private boolean settle(Long id, String workerId, Status outcome) {
        int updated = repository.settle(id, workerId, outcome, Status.PROCESSING, LocalDateTime.now());
        if (updated == 0) {
            log.warn("Worker {} no longer holds queue item {}, {} not recorded", workerId, id, outcome);
            return false;
        }
        return true;
    }

    /**
     * Return items whose worker lease expired to the pending state.
     */
    @Transactional
    public int releaseExpiredLeases() {
        int released = repository.releaseExpiredLeases(LocalDateTime.now(), Status.PENDING, Status.PROCESSING);
        if (released > 0) {
            log.warn("Released {} queue items with expired leases", released);
        }
        return released;
    }

    /**
     * Delete settled items (done, dropped, failed) processed longer ago than
     * the retention window.
     */
    @Transactional
    public int purgeSettled() {
        LocalDateTime cutoff = LocalDateTime.now().minusDays(retentionDays);
        int purged = repository.purgeProcessedBefore(SETTLED, cutoff);
        if (purged > 0) {
            log.info("Purged {} settled queue items processed before {}", purged, cutoff);
        }
        return purged;
    }

    @Transactional
    public int dropForStudent(String studentId) {
        return repository.dropPendingForStudent(studentId, LocalDateTime.now(), Status.PENDING, Status.DROPPED);
    }

    @Transactional
    public int dropForListing(String listingId) {
        return repository.dropPendingForListing(listingId, LocalDateTime.now(), Status.PENDING, Status.DROPPED);
    }

    public QueueStats getStats(String tenantId) {
        if (tenantId == null) {
            return QueueStats.builder()
                    .pending(repository.countByStatus(Status.PENDING) + repository.countByStatus(Status.PROCESSING))
                    .processed(repository.countByStatus(Status.DONE))
                    .failed(repository.countByStatus(Status.FAILED))
                    .total(repository.count())
                    .build();
        }
        return QueueStats.builder()
                .pending(repository.countByTenantIdAndStatus(tenantId, Status.PENDING)
                        + repository.countByTenantIdAndStatus(tenantId, Status.PROCESSING))
                .processed(repository.countByTenantIdAndStatus(tenantId, Status.DONE))
                .failed(repository.countByTenantIdAndStatus(tenantId, Status.FAILED))
                .total(repository.countByTenantId(tenantId))
                .build();
    }

    public long getPendingCount() {
        return repository.countByStatus(Status.PENDING);
    }

    /**
     * base * 2^(attempts - 1), capped.
     */
    long backoffSeconds(int attempts) {
        int exponent = Math.min(Math.max(attempts - 1, 0), 30);
        long delay = baseBackoffSeconds * (1L << exponent);
        return Math.min(delay, maxBackoffSeconds);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
