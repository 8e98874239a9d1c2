package com.proveground.matchengine.persistence;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One schedule source of a student. A student may hold several active
 * entries at once; their effects on availability add up.
 */
@Entity
@Table(name = "student_schedules")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StudentScheduleEntity {

    public enum ScheduleType {
        SPORT,
        CUSTOM,
        WORK
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false, length = 64)
    private String studentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "schedule_type", nullable = false, length = 20)
    private ScheduleType scheduleType;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "sport_season_id")
    private SportSeasonEntity sportSeason;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "student_schedule_blocks", joinColumns = @JoinColumn(name = "schedule_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<ScheduleBlock> customBlocks = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "student_schedule_travel", joinColumns = @JoinColumn(name = "schedule_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<TravelConflict> travelConflicts = new ArrayList<>();

    // explicit override of committed hours for custom/work entries
    @Column(name = "available_hours_per_week")
    private Integer availableHoursPerWeek;

    @Column(name = "effective_start")
    private LocalDate effectiveStart;

    @Column(name = "effective_end")
    private LocalDate effectiveEnd;

    @Column(name = "is_active")
    private boolean active;

    @Column(name = "notes")
    private String notes;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    /**
     * Whether the effective window of this entry contains the given date.
     * Open bounds are unbounded.
     */
    public boolean isEffectiveOn(LocalDate date) {
        return (effectiveStart == null || !date.isBefore(effectiveStart))
                && (effectiveEnd == null || !date.isAfter(effectiveEnd));
    }

    public boolean intersects(LocalDate from, LocalDate to) {
        return (effectiveStart == null || !effectiveStart.isAfter(to))
                && (effectiveEnd == null || !effectiveEnd.isBefore(from));
    }
}
