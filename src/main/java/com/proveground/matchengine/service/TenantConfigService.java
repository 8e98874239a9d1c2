package com.proveground.matchengine.service;

import com.proveground.matchengine.persistence.TenantMatchConfigEntity;
import com.proveground.matchengine.persistence.TenantMatchConfigRepository;
import com.proveground.matchengine.web.dto.TenantConfigRequest;
import com.proveground.matchengine.web.dto.TenantConfigResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Per-tenant match settings. Tenants without a stored row run on the
 * engine defaults.
 */
@Service
@Slf4j
public class TenantConfigService {

    private final TenantMatchConfigRepository repository;
    private final int defaultMinScore;
    private final int defaultMaxResults;

    public TenantConfigService(TenantMatchConfigRepository repository,
                               @Value("${matchengine.query.default-min-score:0}") int defaultMinScore,
                               @Value("${matchengine.query.default-max-results:500}") int defaultMaxResults) {
        this.repository = repository;
        this.defaultMinScore = defaultMinScore;
        this.defaultMaxResults = defaultMaxResults;
    }

    /**
     * Stored settings of the tenant, or an unsaved default row (null id).
     */
    public TenantMatchConfigEntity settingsFor(String tenantId) {
        if (tenantId == null) {
            return defaults(null);
        }
        return repository.findByTenantId(tenantId).orElseGet(() -> defaults(tenantId));
    }

    public boolean isAthleticTransferEnabled(String tenantId) {
        return settingsFor(tenantId).isAthleticTransferEnabled();
    }

    public TenantConfigResponse get(String tenantId) {
        return toResponse(settingsFor(tenantId));
    }

    @Transactional
    public TenantConfigResponse update(String tenantId, TenantConfigRequest request) {
        TenantMatchConfigEntity config = settingsFor(tenantId);
        if (request.getMinScoreThreshold() != null) {
            config.setMinScoreThreshold(request.getMinScoreThreshold());
        }
        if (request.getMaxResultsPerQuery() != null) {
            config.setMaxResultsPerQuery(request.getMaxResultsPerQuery());
        }
        if (request.getEnableAthleticTransfer() != null) {
            config.setAthleticTransferEnabled(request.getEnableAthleticTransfer());
        }
        config.setUpdatedAt(LocalDateTime.now());
        TenantMatchConfigEntity saved = repository.save(config);
        log.info("Match settings of tenant {} updated: minScore={}, maxResults={}, athleticTransfer={}",
                tenantId, saved.getMinScoreThreshold(), saved.getMaxResultsPerQuery(),
                saved.isAthleticTransferEnabled());
        return toResponse(saved);
    }

    private TenantMatchConfigEntity defaults(String tenantId) {
        return TenantMatchConfigEntity.builder()
                .tenantId(tenantId)
                .minScoreThreshold(defaultMinScore)
                .maxResultsPerQuery(defaultMaxResults)
                .athleticTransferEnabled(true)
                .build();
    }

    private static TenantConfigResponse toResponse(TenantMatchConfigEntity config) {
        return TenantConfigResponse.builder()
                .tenantId(config.getTenantId())
                .minScoreThreshold(config.getMinScoreThreshold())
                .maxResultsPerQuery(config.getMaxResultsPerQuery())
                .enableAthleticTransfer(config.isAthleticTransferEnabled())
                .usingDefaults(config.getId() == null)
                .updatedAt(config.getUpdatedAt())
                .build();
    }
}
