package com.proveground.matchengine.service;

import com.proveground.matchengine.persistence.ListingEntity;
import com.proveground.matchengine.persistence.ListingRepository;
import com.proveground.matchengine.persistence.MatchScoreRepository;
import com.proveground.matchengine.persistence.RecomputeQueueEntity.Reason;
import com.proveground.matchengine.persistence.StudentEntity;
import com.proveground.matchengine.persistence.StudentRepository;
import com.proveground.matchengine.queue.MatchPair;
import com.proveground.matchengine.queue.RecomputeQueueService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flags cached scores as stale when their inputs change and queues the
 * affected pairs. Stale rows stay readable until recomputed.
 */
@Service
@Slf4j
public class StalenessTracker {

    private final MatchScoreRepository scoreRepository;
    private final StudentRepository studentRepository;
    private final ListingRepository listingRepository;
    private final CandidateResolver candidateResolver;
    private final RecomputeQueueService queueService;
    private final ScoreStore scoreStore;
    private final int staleThresholdHours;

    public StalenessTracker(MatchScoreRepository scoreRepository,
                            StudentRepository studentRepository,
                            ListingRepository listingRepository,
                            CandidateResolver candidateResolver,
                            RecomputeQueueService queueService,
                            ScoreStore scoreStore,
                            @Value("${matchengine.stale-threshold-hours:24}") int staleThresholdHours) {
        this.scoreRepository = scoreRepository;
        this.studentRepository = studentRepository;
        this.listingRepository = listingRepository;
        this.candidateResolver = candidateResolver;
        this.queueService = queueService;
        this.scoreStore = scoreStore;
        this.staleThresholdHours = staleThresholdHours;
    }

    /**
     * A student's profile, skills or schedule changed: stale their scores and
     * queue the student against every open listing they can see.
     * @return number of pairs queued
     */
    @Transactional
    public int onStudentChanged(String studentId, Reason reason) {
        int marked = scoreRepository.markStaleByStudent(studentId);

        Optional<StudentEntity> student = studentRepository.findById(studentId);
        if (student.isEmpty()) {
            log.warn("Change notified for unknown student {}, {} scores marked stale", studentId, marked);
            return 0;
        }

        List<MatchPair> pairs = new ArrayList<>();
        for (ListingEntity listing : candidateResolver.listingsFor(student.get())) {
            pairs.add(new MatchPair(studentId, listing.getId(), student.get().getTenantId()));
        }
        int queued = queueService.enqueueAll(pairs, reason);
        log.info("Student {} changed ({}): {} scores marked stale, {} pairs queued", studentId, reason, marked, queued);
        return queued;
    }

    /**
     * A listing's requirements changed: stale its scores and queue it against
     * every eligible student.
     * @return number of pairs queued
     */
    @Transactional
    public int onListingChanged(String listingId) {
        int marked = scoreRepository.markStaleByListing(listingId);

        Optional<ListingEntity> listing = listingRepository.findById(listingId);
        if (listing.isEmpty()) {
            log.warn("Change notified for unknown listing {}, {} scores marked stale", listingId, marked);
            return 0;
        }

        List<MatchPair> pairs = new ArrayList<>();
        for (StudentEntity student : candidateResolver.studentsFor(listing.get())) {
            pairs.add(new MatchPair(student.getId(), listingId, student.getTenantId()));
        }
        int queued = queueService.enqueueAll(pairs, Reason.LISTING_CHANGE);
        log.info("Listing {} changed: {} scores marked stale, {} pairs queued", listingId, marked, queued);
        return queued;
    }

    /**
     * Student deleted: unclaimed queue items are dropped and cached scores removed.
     */
    @Transactional
    public void onStudentDeleted(String studentId) {
        int dropped = queueService.dropForStudent(studentId);
        int deleted = scoreStore.deleteForStudent(studentId);
        log.info("Student {} deleted: {} queue items dropped, {} scores removed", studentId, dropped, deleted);
    }

    @Transactional
    public void onListingDeleted(String listingId) {
        int dropped = queueService.dropForListing(listingId);
        int deleted = scoreStore.deleteForListing(listingId);
        log.info("Listing {} deleted: {} queue items dropped, {} scores removed", listingId, dropped, deleted);
    }

    /**
     * Mark scores older than the TTL stale without queueing them.
     */
    @Transactional
    public int markExpired() {
        int marked = scoreRepository.markStaleComputedBefore(expiryCutoff());
        if (marked > 0) {
            log.info("Marked {} scores older than {}h as stale", marked, staleThresholdHours);
        }
        return marked;
    }

    /**
     * Mark expired scores stale and queue every stale pair for a TTL refresh.
     * @return number of pairs queued
     */
    @Transactional
    public int refreshExpired() {
        markExpired();
        return queueService.enqueueAll(scoreRepository.findStalePairs(), Reason.TTL_EXPIRY);
    }

    /**
     * Scores computed under another weight version are no longer comparable.
     * @return number of pairs queued
     */
    @Transactional
    public int invalidateOtherVersions(String currentVersion) {
        int marked = scoreRepository.markStaleWithOtherVersion(currentVersion);
        if (marked == 0) {
            return 0;
        }
        log.info("Weights version {} active: {} scores from other versions marked stale", currentVersion, marked);
        return queueService.enqueueAll(scoreRepository.findStalePairs(), Reason.MANUAL);
    }

    /**
     * Bulk refresh: stale TTL-expired scores, then queue every stale pair at
     * the lowest priority so targeted recomputation is never starved.
     * @param tenantId restrict to one tenant, or null for all
     * @return number of stale pairs queued
     */
    @Transactional
    public int recomputeAll(String tenantId) {
        markExpired();
        List<MatchPair> stale = tenantId == null
                ? scoreRepository.findStalePairs()
                : scoreRepository.findStalePairsForTenant(tenantId);
        int queued = queueService.enqueueAll(stale, Reason.MANUAL);
        log.info("Recompute-all requested (tenant={}): {} stale pairs queued", tenantId, queued);
        return queued;
    }

    public int getStaleThresholdHours() {
        return staleThresholdHours;
    }

    private LocalDateTime expiryCutoff() {
        return LocalDateTime.now().minusHours(staleThresholdHours);
    }
}
