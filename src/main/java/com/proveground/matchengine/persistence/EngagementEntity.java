package com.proveground.matchengine.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * A student's application to (and possibly work on) a listing.
 */
@Entity
@Table(name = "project_applications")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngagementEntity {

    public enum Status {
        APPLIED,
        ACCEPTED,
        ACTIVE,
        COMPLETED,
        WITHDRAWN,
        REJECTED;

        /** Currently consuming the student's time. */
        public boolean isOngoing() {
            return this == ACCEPTED || this == ACTIVE;
        }

        /** Counts towards the reliability history. */
        public boolean isCommitted() {
            return this == ACCEPTED || this == ACTIVE || this == COMPLETED || this == WITHDRAWN;
        }
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false, length = 64)
    private String studentId;

    @Column(name = "listing_id", nullable = false, length = 64)
    private String listingId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private Status status;

    @Column(name = "category")
    private String category;

    @Column(name = "hours_per_week")
    private Integer hoursPerWeek;

    // 1..5, set by the listing author after completion
    @Column(name = "rating")
    private Integer rating;

    @Column(name = "completed_on_time")
    private Boolean completedOnTime;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;
}
