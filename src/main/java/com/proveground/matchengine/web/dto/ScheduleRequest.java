package com.proveground.matchengine.web.dto;

import com.proveground.matchengine.persistence.StudentScheduleEntity.ScheduleType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * New schedule entry for the calling student.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRequest {

    @NotNull
    private ScheduleType scheduleType;

    private Long sportSeasonId;

    @Valid
    @Builder.Default
    private List<Block> customBlocks = new ArrayList<>();

    @Min(0)
    @Max(168)
    private Integer availableHoursPerWeek;

    @Valid
    @Builder.Default
    private List<Travel> travelConflicts = new ArrayList<>();

    private LocalDate effectiveStart;

    private LocalDate effectiveEnd;

    @Builder.Default
    private Boolean active = Boolean.TRUE;

    private String notes;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Block {

        @NotNull
        private DayOfWeek day;

        @NotNull
        private LocalTime startTime;

        @NotNull
        private LocalTime endTime;

        private String label;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Travel {

        @NotNull
        private LocalDate startDate;

        @NotNull
        private LocalDate endDate;

        private String reason;
    }
}
