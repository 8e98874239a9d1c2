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

/**
 * Catalog entry describing the weekly load of one sport season.
 */
@Entity
@Table(name = "sport_seasons")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SportSeasonEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "sport_name", nullable = false, length = 100)
    private String sportName;

    // regular, championship, off_season, preseason
    @Column(name = "season_type", nullable = false, length = 30)
    private String seasonType;

    @Column(name = "start_month", nullable = false)
    private int startMonth;

    @Column(name = "end_month", nullable = false)
    private int endMonth;

    @Column(name = "practice_hours_per_week")
    private int practiceHoursPerWeek;

    @Column(name = "competition_hours_per_week")
    private int competitionHoursPerWeek;

    @Column(name = "travel_days_per_month")
    private int travelDaysPerMonth;

    @Column(name = "intensity_level")
    private int intensityLevel;

    @Column(name = "division", length = 20)
    private String division;

    @Column(name = "notes")
    private String notes;

    /**
     * Whether the season covers the given month (1-12). Seasons may wrap
     * the year end, e.g. November to March.
     */
    public boolean isInSeason(int month) {
        if (startMonth <= endMonth) {
            return month >= startMonth && month <= endMonth;
        }
        return month >= startMonth || month <= endMonth;
    }

    public int getWeeklyHours() {
        return practiceHoursPerWeek + competitionHoursPerWeek;
    }
}
