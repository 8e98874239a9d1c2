package com.proveground.matchengine.availability;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Free hours of a student during one ISO week (Monday to Sunday).
 * Derived from schedule entries on demand, never stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AvailabilityWindow {

    private LocalDate weekStart;
    private LocalDate weekEnd;
    private double availableHours;
    private double totalCommittedHours;
    @Builder.Default
    private List<String> sportConflicts = new ArrayList<>();
    // days away during the week, explicit trips plus prorated team travel
    private int travelConflicts;
    // days covered by explicit travel conflicts only
    private int blockedDays;
    private AvailabilityLevel overallAvailability;

    public boolean hasBlockedDays() {
        return blockedDays > 0;
    }
}
