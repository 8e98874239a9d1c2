package com.proveground.matchengine.service;

import com.proveground.matchengine.scoring.SignalWeights;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * On startup, queues every score computed under a different weight version.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WeightsVersionListener {

    private final SignalWeights signalWeights;
    private final StalenessTracker stalenessTracker;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        try {
            int queued = stalenessTracker.invalidateOtherVersions(signalWeights.getVersion());
            if (queued > 0) {
                log.info("Queued {} pairs for recompute under weights version {}", queued, signalWeights.getVersion());
            }
        } catch (Exception e) {
            log.error("Error invalidating scores of previous weight versions: {}", e.getMessage(), e);
        }
    }
}
