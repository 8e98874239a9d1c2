package com.proveground.matchengine.service;

import com.proveground.matchengine.BaseIntegrationTest;
import com.proveground.matchengine.TestFixtures;
import com.proveground.matchengine.persistence.ListingEntity;
import com.proveground.matchengine.persistence.MatchScoreEntity;
import com.proveground.matchengine.persistence.RecomputeQueueEntity;
import com.proveground.matchengine.persistence.RecomputeQueueEntity.Reason;
import com.proveground.matchengine.persistence.TenantPartnerAccessEntity;
import com.proveground.matchengine.queue.RecomputeQueueService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for StalenessTracker.
 */
@DisplayName("StalenessTracker Tests")
class StalenessTrackerTest extends BaseIntegrationTest {

    @Autowired
    private StalenessTracker stalenessTracker;

    @Autowired
    private RecomputeQueueService queueService;

    @BeforeEach
    void setUp() {
        cleanDatabase();
    }

    private boolean isStale(String studentId, String listingId) {
        return scoreRepository.findByStudentIdAndListingId(studentId, listingId).orElseThrow().isStale();
    }

    @Nested
    @DisplayName("Change Notifications")
    class ChangeTests {

        @BeforeEach
        void seed() {
            studentRepository.save(TestFixtures.student("s1", "t1", "Java"));
            studentRepository.save(TestFixtures.student("s2", "t1", "SQL"));
            studentRepository.save(TestFixtures.student("s3", "t2", "Go"));
            listingRepository.save(TestFixtures.listing("l1", "t1", "Java"));
            listingRepository.save(TestFixtures.listing("l2", "t1", "SQL"));
            listingRepository.save(TestFixtures.listing("l3", "t2", "Go"));
            ListingEntity closed = TestFixtures.listing("l4", "t1", "Java");
            closed.setStatus(ListingEntity.Status.CLOSED);
            listingRepository.save(closed);

            storeScore("s1", "l1", "t1", 80, LocalDateTime.now());
            storeScore("s2", "l1", "t1", 60, LocalDateTime.now());
            storeScore("s1", "l4", "t1", 70, LocalDateTime.now());
        }

        @Test
        @DisplayName("Student change queues only that student's visible open listings")
        void shouldQueueOnlyChangedStudent() {
            int queued = stalenessTracker.onStudentChanged("s1", Reason.PROFILE_CHANGE);

            assertEquals(2, queued);
            List<RecomputeQueueEntity> items = queueRepository.findAll();
            assertThat(items).allMatch(item -> item.getStudentId().equals("s1"));
            assertThat(items).extracting(RecomputeQueueEntity::getListingId).containsExactlyInAnyOrder("l1", "l2");
            assertThat(items).allMatch(item -> item.getPriority() == 10);
        }

        @Test
        @DisplayName("Student change marks only that student's scores stale")
        void shouldMarkOnlyChangedStudentStale() {
            stalenessTracker.onStudentChanged("s1", Reason.SCHEDULE_CHANGE);

            assertTrue(isStale("s1", "l1"));
            assertTrue(isStale("s1", "l4"));
            assertFalse(isStale("s2", "l1"));
        }

        @Test
        @DisplayName("Private listing change queues students of its tenant")
        void shouldQueueTenantStudentsForListing() {
            int queued = stalenessTracker.onListingChanged("l1");

            assertEquals(2, queued);
            assertThat(queueRepository.findAll())
                    .extracting(RecomputeQueueEntity::getStudentId)
                    .containsExactlyInAnyOrder("s1", "s2");
            assertThat(queueRepository.findAll()).allMatch(item -> item.getPriority() == 7);
            assertTrue(isStale("s1", "l1"));
            assertTrue(isStale("s2", "l1"));
        }

        @Test
        @DisplayName("Network listing change reaches other tenants")
        void shouldQueueAllStudentsForNetworkListing() {
            ListingEntity listing = listingRepository.findById("l3").orElseThrow();
            listing.setVisibility(ListingEntity.Visibility.NETWORK);
            listingRepository.save(listing);

            assertEquals(3, stalenessTracker.onListingChanged("l3"));
        }

        @Test
        @DisplayName("Closed listing change stales scores but queues nothing")
        void shouldNotQueueClosedListing() {
            int queued = stalenessTracker.onListingChanged("l4");

            assertEquals(0, queued);
            assertTrue(isStale("s1", "l4"));
            assertEquals(0, queueRepository.count());
        }

        @Test
        @DisplayName("Unknown student queues nothing")
        void shouldIgnoreUnknownStudent() {
            assertEquals(0, stalenessTracker.onStudentChanged("ghost", Reason.PROFILE_CHANGE));
        }

        @Test
        @DisplayName("Student deletion removes scores and drops pending work")
        void shouldCleanUpDeletedStudent() {
            stalenessTracker.onStudentChanged("s1", Reason.PROFILE_CHANGE);

            stalenessTracker.onStudentDeleted("s1");

            assertTrue(scoreRepository.findByStudentIdAndListingId("s1", "l1").isEmpty());
            assertTrue(scoreRepository.findByStudentIdAndListingId("s2", "l1").isPresent());
            assertEquals(0, queueService.getPendingCount());
            assertThat(queueRepository.findAll())
                    .allMatch(item -> item.getStatus() == RecomputeQueueEntity.Status.DROPPED);
        }

        @Test
        @DisplayName("Listing deletion removes its scores")
        void shouldCleanUpDeletedListing() {
            stalenessTracker.onListingDeleted("l1");

            assertTrue(scoreRepository.findByStudentIdAndListingId("s1", "l1").isEmpty());
            assertTrue(scoreRepository.findByStudentIdAndListingId("s1", "l4").isPresent());
        }
    }

    @Nested
    @DisplayName("Partner Access to Private Listings")
    class PartnerAccessTests {

        @BeforeEach
        void seed() {
            studentRepository.save(TestFixtures.student("sA", "tA", "Java"));
            studentRepository.save(TestFixtures.student("sB", "tB", "Java"));
            studentRepository.save(TestFixtures.student("sC", "tC", "Java"));
            listingRepository.save(TestFixtures.listing("lA", "tA", "Java"));
        }

        private void grant(String tenantId, TenantPartnerAccessEntity.Relationship relationship, boolean active) {
            partnerAccessRepository.save(TenantPartnerAccessEntity.builder()
                    .tenantId(tenantId)
                    .partnerId("author-lA")
                    .relationship(relationship)
                    .active(active)
                    .build());
        }

        @Test
        @DisplayName("Listing change reaches students of a tenant with exclusive access to its author")
        void shouldQueueExclusivePartnerTenantForListing() {
            grant("tB", TenantPartnerAccessEntity.Relationship.EXCLUSIVE, true);

            int queued = stalenessTracker.onListingChanged("lA");

            assertEquals(2, queued);
            assertThat(queueRepository.findAll())
                    .extracting(RecomputeQueueEntity::getStudentId)
                    .containsExactlyInAnyOrder("sA", "sB");
            RecomputeQueueEntity partnerItem = queueRepository.findFirstByStudentIdAndListingIdAndStatus(
                    "sB", "lA", RecomputeQueueEntity.Status.PENDING).orElseThrow();
            assertEquals("tB", partnerItem.getTenantId());
        }

        @Test
        @DisplayName("Student of a preferred partner tenant is queued against the private listing")
        void shouldQueuePrivateListingForPreferredPartnerStudent() {
            grant("tB", TenantPartnerAccessEntity.Relationship.PREFERRED, true);

            int queued = stalenessTracker.onStudentChanged("sB", Reason.PROFILE_CHANGE);

            assertEquals(1, queued);
            assertEquals("lA", queueRepository.findAll().get(0).getListingId());
        }

        @Test
        @DisplayName("Network-level or inactive access does not open private listings")
        void shouldIgnoreNetworkAndInactiveAccess() {
            grant("tB", TenantPartnerAccessEntity.Relationship.NETWORK, true);
            grant("tC", TenantPartnerAccessEntity.Relationship.EXCLUSIVE, false);

            assertEquals(0, stalenessTracker.onStudentChanged("sB", Reason.PROFILE_CHANGE));
            assertEquals(0, stalenessTracker.onStudentChanged("sC", Reason.PROFILE_CHANGE));
            assertEquals(1, stalenessTracker.onListingChanged("lA"));
        }
    }

    @Nested
    @DisplayName("Expiry and Bulk Refresh")
    class RefreshTests {

        @Test
        @DisplayName("Scores older than the threshold become stale")
        void shouldMarkExpiredScores() {
            storeScore("s1", "l1", "t1", 80, LocalDateTime.now().minusHours(30));
            storeScore("s1", "l2", "t1", 80, LocalDateTime.now().minusHours(2));

            int marked = stalenessTracker.markExpired();

            assertEquals(1, marked);
            assertTrue(isStale("s1", "l1"));
            assertFalse(isStale("s1", "l2"));
            assertEquals(0, queueRepository.count());
        }

        @Test
        @DisplayName("TTL refresh queues expired pairs at low priority")
        void shouldRefreshExpired() {
            storeScore("s1", "l1", "t1", 80, LocalDateTime.now().minusHours(30));
            storeScore("s2", "l1", "t1", 80, LocalDateTime.now().minusHours(48));
            storeScore("s3", "l1", "t1", 80, LocalDateTime.now());

            int queued = stalenessTracker.refreshExpired();

            assertEquals(2, queued);
            assertThat(queueRepository.findAll()).allMatch(item -> item.getReason() == Reason.TTL_EXPIRY);
            assertThat(queueRepository.findAll()).allMatch(item -> item.getPriority() == 3);
        }

        @Test
        @DisplayName("Recompute-all queues every stale score")
        void shouldRecomputeAllStale() {
            for (int i = 0; i < 50; i++) {
                storeScore("s" + i, "l1", "t1", 50, LocalDateTime.now().minusDays(3));
            }
            long pendingBefore = queueService.getPendingCount();

            int queued = stalenessTracker.recomputeAll(null);

            assertEquals(50, queued);
            assertEquals(pendingBefore + 50, queueService.getPendingCount());
            assertThat(queueRepository.findAll()).allMatch(item -> item.getPriority() == 1);
        }

        @Test
        @DisplayName("Recompute-all can be limited to one tenant")
        void shouldRecomputeTenantOnly() {
            storeScore("s1", "l1", "t1", 50, LocalDateTime.now().minusDays(3));
            storeScore("s2", "l1", "t2", 50, LocalDateTime.now().minusDays(3));

            int queued = stalenessTracker.recomputeAll("t1");

            assertEquals(1, queued);
            RecomputeQueueEntity item = queueRepository.findAll().get(0);
            assertEquals("s1", item.getStudentId());
            assertEquals("l1", item.getListingId());
            assertEquals("t1", item.getTenantId());
        }

        @Test
        @DisplayName("Scores of another weights version are invalidated")
        void shouldInvalidateOtherVersions() {
            MatchScoreEntity old = storeScore("s1", "l1", "t1", 50, LocalDateTime.now());
            old.setWeightsVersion("v0");
            scoreRepository.save(old);
            storeScore("s2", "l1", "t1", 50, LocalDateTime.now());

            int queued = stalenessTracker.invalidateOtherVersions("test-v1");

            assertEquals(1, queued);
            assertTrue(isStale("s1", "l1"));
            assertFalse(isStale("s2", "l1"));
        }
    }
}
