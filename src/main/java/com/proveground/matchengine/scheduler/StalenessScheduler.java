package com.proveground.matchengine.scheduler;

import com.proveground.matchengine.queue.RecomputeQueueService;
import com.proveground.matchengine.service.StalenessTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * TTL refresh of old scores, recovery of abandoned queue claims and
 * retention of settled queue items.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "matchengine.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class StalenessScheduler {

    private final StalenessTracker stalenessTracker;
    private final RecomputeQueueService queueService;

    // Top of every hour
    @Scheduled(cron = "${matchengine.ttl.cron:0 0 * * * *}")
    public void refreshExpiredScores() {
        log.debug("TTL refresh triggered");

        try {
            int queued = stalenessTracker.refreshExpired();
            if (queued > 0) {
                log.info("TTL refresh queued {} stale pairs", queued);
            }
        } catch (Exception e) {
            log.error("Error during TTL refresh: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${matchengine.queue.lease-sweep-interval-ms:60000}")
    public void releaseExpiredLeases() {
        try {
            queueService.releaseExpiredLeases();
        } catch (Exception e) {
            log.error("Error releasing expired queue leases: {}", e.getMessage(), e);
        }
    }

    // 03:30 daily
    @Scheduled(cron = "${matchengine.queue.purge-cron:0 30 3 * * *}")
    public void purgeSettledQueueItems() {
        try {
            queueService.purgeSettled();
        } catch (Exception e) {
            log.error("Error purging settled queue items: {}", e.getMessage(), e);
        }
    }
}
