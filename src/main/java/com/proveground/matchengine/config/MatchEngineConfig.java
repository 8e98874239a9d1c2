package com.proveground.matchengine.config;

import com.proveground.matchengine.scoring.SignalWeights;
import com.proveground.matchengine.signal.SignalType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

@Configuration
@Slf4j
public class MatchEngineConfig {

    /**
     * Weight set loaded once at startup. Invalid weights fail the context.
     */
    @Bean
    public SignalWeights signalWeights(
            @Value("${matchengine.weights.version:v1}") String version,
            @Value("${matchengine.weights.skills:0.30}") BigDecimal skills,
            @Value("${matchengine.weights.temporal:0.25}") BigDecimal temporal,
            @Value("${matchengine.weights.sustainability:0.15}") BigDecimal sustainability,
            @Value("${matchengine.weights.growth:0.10}") BigDecimal growth,
            @Value("${matchengine.weights.trust:0.10}") BigDecimal trust,
            @Value("${matchengine.weights.network:0.10}") BigDecimal network) {
        Map<SignalType, BigDecimal> weights = new EnumMap<>(SignalType.class);
        weights.put(SignalType.SKILLS, skills);
        weights.put(SignalType.TEMPORAL, temporal);
        weights.put(SignalType.SUSTAINABILITY, sustainability);
        weights.put(SignalType.GROWTH, growth);
        weights.put(SignalType.TRUST, trust);
        weights.put(SignalType.NETWORK, network);

        SignalWeights signalWeights = SignalWeights.of(version, weights);
        log.info("Loaded {}", signalWeights);
        return signalWeights;
    }

    @Bean(name = "recomputeExecutor")
    public ThreadPoolTaskExecutor recomputeExecutor(@Value("${matchengine.queue.workers:2}") int workers) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(workers);
        executor.setThreadNamePrefix("recompute-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
