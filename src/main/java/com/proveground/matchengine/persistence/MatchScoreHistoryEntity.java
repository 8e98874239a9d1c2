package com.proveground.matchengine.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Audit trail of composite score changes.
 */
@Entity
@Table(name = "match_score_history")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchScoreHistoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false, length = 64)
    private String studentId;

    @Column(name = "listing_id", nullable = false, length = 64)
    private String listingId;

    // null for the first computation of a pair
    @Column(name = "old_score")
    private Integer oldScore;

    @Column(name = "new_score", nullable = false)
    private int newScore;

    @Column(name = "change_reason", length = 30)
    private String changeReason;

    @Column(name = "changed_at", nullable = false)
    private LocalDateTime changedAt;

    public static MatchScoreHistoryEntity create(String studentId, String listingId,
                                                 Integer oldScore, int newScore, String reason) {
        return MatchScoreHistoryEntity.builder()
                .studentId(studentId)
                .listingId(listingId)
                .oldScore(oldScore)
                .newScore(newScore)
                .changeReason(reason)
                .changedAt(LocalDateTime.now())
                .build();
    }
}
