package com.proveground.matchengine.availability;

import com.proveground.matchengine.persistence.ScheduleBlock;
import com.proveground.matchengine.persistence.SportSeasonEntity;
import com.proveground.matchengine.persistence.StudentScheduleEntity;
import com.proveground.matchengine.persistence.TravelConflict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Projects a student's schedule entries onto weekly availability windows.
 * Entries are additive: every active entry subtracts its commitment from
 * the weekly capacity.
 */
@Component
@Slf4j
public class AvailabilityWindowBuilder {

    private static final int DAYS_PER_WEEK = 7;

    private final double weeklyCapacity;
    private final double highThreshold;
    private final double mediumThreshold;

    public AvailabilityWindowBuilder(
            @Value("${matchengine.availability.weekly-capacity:40}") double weeklyCapacity,
            @Value("${matchengine.availability.high-threshold:30}") double highThreshold,
            @Value("${matchengine.availability.medium-threshold:15}") double mediumThreshold) {
        if (weeklyCapacity <= 0 || mediumThreshold > highThreshold) {
            throw new IllegalStateException("Invalid availability configuration: capacity=" + weeklyCapacity
                    + ", high=" + highThreshold + ", medium=" + mediumThreshold);
        }
        this.weeklyCapacity = weeklyCapacity;
        this.highThreshold = highThreshold;
        this.mediumThreshold = mediumThreshold;
    }

    /**
     * Build one window per ISO week touching [startDate, endDate].
     */
    public List<AvailabilityWindow> build(List<StudentScheduleEntity> schedules, LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null || endDate.isBefore(startDate)) {
            return List.of();
        }

        List<StudentScheduleEntity> active = schedules.stream()
                .filter(StudentScheduleEntity::isActive)
                .toList();

        List<AvailabilityWindow> windows = new ArrayList<>();
        LocalDate weekStart = startDate.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        while (!weekStart.isAfter(endDate)) {
            windows.add(buildWeek(active, weekStart));
            weekStart = weekStart.plusWeeks(1);
        }

        log.debug("Built {} availability windows from {} active schedules", windows.size(), active.size());
        return windows;
    }

    private AvailabilityWindow buildWeek(List<StudentScheduleEntity> schedules, LocalDate weekStart) {
        LocalDate weekEnd = weekStart.plusDays(DAYS_PER_WEEK - 1);
        double committed = 0.0;
        int sportTravelDays = 0;
        Set<LocalDate> travelDays = new HashSet<>();
        List<String> sportConflicts = new ArrayList<>();

        for (StudentScheduleEntity schedule : schedules) {
            if (!schedule.intersects(weekStart, weekEnd)) {
                continue;
            }

            switch (schedule.getScheduleType()) {
                case SPORT -> {
                    SportSeasonEntity season = schedule.getSportSeason();
                    if (season != null && isSeasonWeek(season, weekStart)) {
                        committed += season.getWeeklyHours();
                        sportTravelDays += proratedTravelDays(season, weekStart);
                        sportConflicts.add(season.getSportName());
                    }
                }
                case CUSTOM, WORK -> committed += customCommitment(schedule, weekStart);
            }

            for (TravelConflict travel : schedule.getTravelConflicts()) {
                for (LocalDate day = weekStart; !day.isAfter(weekEnd); day = day.plusDays(1)) {
                    if (travel.covers(day)) {
                        travelDays.add(day);
                    }
                }
            }
        }

        committed += travelDays.size() * (weeklyCapacity / DAYS_PER_WEEK);
        double available = round(Math.max(0.0, weeklyCapacity - committed));
        int travelCount = Math.min(DAYS_PER_WEEK, travelDays.size() + sportTravelDays);

        return AvailabilityWindow.builder()
                .weekStart(weekStart)
                .weekEnd(weekEnd)
                .availableHours(available)
                .totalCommittedHours(round(committed))
                .sportConflicts(sportConflicts)
                .travelConflicts(travelCount)
                .blockedDays(travelDays.size())
                .overallAvailability(classify(available, travelDays.size()))
                .build();
    }

    /**
     * Classify free hours. A week entirely spent travelling is unavailable
     * regardless of the remaining hour count.
     */
    public AvailabilityLevel classify(double availableHours, int explicitTravelDays) {
        if (availableHours <= 0.0 || explicitTravelDays >= DAYS_PER_WEEK) {
            return AvailabilityLevel.NONE;
        }
        if (availableHours >= highThreshold) {
            return AvailabilityLevel.HIGH;
        }
        if (availableHours >= mediumThreshold) {
            return AvailabilityLevel.MEDIUM;
        }
        return AvailabilityLevel.LOW;
    }

    public double getWeeklyCapacity() {
        return weeklyCapacity;
    }

    // The week belongs to the month of its Thursday, as ISO week numbering does.
    private boolean isSeasonWeek(SportSeasonEntity season, LocalDate weekStart) {
        return season.isInSeason(weekStart.plusDays(3).getMonthValue());
    }

    private int proratedTravelDays(SportSeasonEntity season, LocalDate weekStart) {
        if (season.getTravelDaysPerMonth() <= 0) {
            return 0;
        }
        int daysInMonth = weekStart.plusDays(3).lengthOfMonth();
        return (int) Math.round(season.getTravelDaysPerMonth() * (double) DAYS_PER_WEEK / daysInMonth);
    }

    private double customCommitment(StudentScheduleEntity schedule, LocalDate weekStart) {
        if (schedule.getAvailableHoursPerWeek() != null) {
            return Math.max(0.0, weeklyCapacity - schedule.getAvailableHoursPerWeek());
        }
        double hours = 0.0;
        for (ScheduleBlock block : schedule.getCustomBlocks()) {
            LocalDate day = weekStart.with(TemporalAdjusters.nextOrSame(block.getDayOfWeek()));
            if (schedule.isEffectiveOn(day)) {
                hours += block.getDurationHours();
            }
        }
        return hours;
    }

    private static double round(double hours) {
        return BigDecimal.valueOf(hours).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
