package com.proveground.matchengine.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Per-tenant tuning of ranked reads and athletic skill transfers.
 */
@Entity
@Table(name = "match_engine_config",
        uniqueConstraints = @UniqueConstraint(name = "uq_match_engine_config_tenant", columnNames = "tenant_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantMatchConfigEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    // scores below this are left out of ranked reads, 0 - 100
    @Column(name = "min_score_threshold", nullable = false)
    private int minScoreThreshold;

    @Column(name = "max_results_per_query", nullable = false)
    private int maxResultsPerQuery;

    @Column(name = "enable_athletic_transfer", nullable = false)
    private boolean athleticTransferEnabled;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
