package com.proveground.matchengine.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Cached compatibility score of one (student, listing) pair.
 */
@Entity
@Table(name = "match_scores",
        uniqueConstraints = @UniqueConstraint(name = "uq_match_scores_pair", columnNames = {"student_id", "listing_id"}),
        indexes = {
                @Index(name = "idx_match_scores_listing", columnList = "listing_id, composite_score"),
                @Index(name = "idx_match_scores_stale", columnList = "is_stale")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchScoreEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false, length = 64)
    private String studentId;

    @Column(name = "listing_id", nullable = false, length = 64)
    private String listingId;

    @Column(name = "tenant_id", length = 64)
    private String tenantId;

    @Column(name = "composite_score", nullable = false)
    private int compositeScore;

    // signal key -> breakdown, in evaluation order
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "signals")
    private Map<String, SignalScore> signals;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "matched_skills")
    private List<String> matchedSkills;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "missing_skills")
    private List<String> missingSkills;

    @Column(name = "is_stale", nullable = false)
    private boolean stale;

    @Column(name = "weights_version", length = 32)
    private String weightsVersion;

    @Column(name = "computed_at", nullable = false)
    private LocalDateTime computedAt;

    @Column(name = "computation_ms")
    private long computationMs;
}
