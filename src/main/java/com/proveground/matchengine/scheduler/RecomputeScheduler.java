package com.proveground.matchengine.scheduler;

import com.proveground.matchengine.queue.RecomputeWorker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps up to {@code workers} queue drains running on the recompute executor.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "matchengine.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class RecomputeScheduler {

    private final RecomputeWorker worker;
    private final ThreadPoolTaskExecutor executor;
    private final int workers;
    private final AtomicInteger activeDrains = new AtomicInteger();
    private final AtomicInteger workerSequence = new AtomicInteger();

    public RecomputeScheduler(RecomputeWorker worker,
                              @Qualifier("recomputeExecutor") ThreadPoolTaskExecutor executor,
                              @Value("${matchengine.queue.workers:2}") int workers) {
        this.worker = worker;
        this.executor = executor;
        this.workers = workers;
    }

    @Scheduled(fixedDelayString = "${matchengine.queue.poll-interval-ms:5000}")
    public void dispatch() {
        while (activeDrains.get() < workers) {
            String workerId = "worker-" + workerSequence.incrementAndGet();
            activeDrains.incrementAndGet();
            try {
                executor.execute(() -> runDrain(workerId));
            } catch (TaskRejectedException e) {
                activeDrains.decrementAndGet();
                log.warn("Recompute executor rejected drain {}: {}", workerId, e.getMessage());
                return;
            }
        }
    }

    private void runDrain(String workerId) {
        try {
            worker.drain(workerId);
        } catch (Exception e) {
            log.error("Error during queue drain {}: {}", workerId, e.getMessage(), e);
        } finally {
            activeDrains.decrementAndGet();
        }
    }
}
