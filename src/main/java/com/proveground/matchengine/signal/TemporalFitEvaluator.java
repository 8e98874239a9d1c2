package com.proveground.matchengine.signal;

import com.proveground.matchengine.availability.AvailabilityWindow;
import com.proveground.matchengine.availability.AvailabilityWindowBuilder;
import com.proveground.matchengine.persistence.ListingEntity;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mean free hours over the listing's duration against its required weekly
 * hours. Linear in the shortfall, saturating at 1.0. Explicit travel in the
 * first weeks of the listing multiplies the score by a penalty factor.
 */
@Component
public class TemporalFitEvaluator implements SignalEvaluator {

    private final AvailabilityWindowBuilder windowBuilder;
    private final int criticalWeeks;
    private final double travelPenalty;
    private final int defaultDurationWeeks;

    public TemporalFitEvaluator(
            AvailabilityWindowBuilder windowBuilder,
            @Value("${matchengine.temporal.critical-weeks:2}") int criticalWeeks,
            @Value("${matchengine.temporal.travel-penalty:0.2}") double travelPenalty,
            @Value("${matchengine.temporal.default-duration-weeks:12}") int defaultDurationWeeks) {
        this.windowBuilder = windowBuilder;
        this.criticalWeeks = criticalWeeks;
        this.travelPenalty = travelPenalty;
        this.defaultDurationWeeks = defaultDurationWeeks;
    }

    @Override
    public SignalType getType() {
        return SignalType.TEMPORAL;
    }

    @Override
    public SignalOutcome evaluate(EvaluationContext context) {
        ListingEntity listing = context.getListing();
        Integer required = listing.getHoursPerWeek();
        if (required == null || required <= 0) {
            return SignalOutcome.neutral(getType(), "listing has no weekly hour requirement");
        }

        LocalDate start = listing.getStartDate() != null ? listing.getStartDate() : context.getAsOf();
        LocalDate end = listing.getEndDate();
        if (end == null || end.isBefore(start)) {
            end = start.plusWeeks(defaultDurationWeeks).minusDays(1);
        }

        List<AvailabilityWindow> windows = windowBuilder.build(context.getSchedules(), start, end);
        double meanAvailable = windows.stream()
                .mapToDouble(AvailabilityWindow::getAvailableHours)
                .average()
                .orElse(windowBuilder.getWeeklyCapacity());

        double score = fitRatio(meanAvailable, required);
        boolean criticalTravel = windows.stream()
                .limit(criticalWeeks)
                .anyMatch(AvailabilityWindow::hasBlockedDays);
        if (criticalTravel) {
            score *= travelPenalty;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requiredHours", required);
        details.put("meanAvailableHours", BigDecimal.valueOf(meanAvailable).setScale(1, RoundingMode.HALF_UP));
        details.put("weeks", windows.size());
        details.put("criticalWeekTravel", criticalTravel);
        return SignalOutcome.of(getType(), score, details);
    }

    /**
     * 1.0 when available covers required, otherwise available / required.
     */
    static double fitRatio(double availableHours, int requiredHours) {
        if (availableHours >= requiredHours) {
            return 1.0;
        }
        return Math.max(0.0, availableHours) / requiredHours;
    }
}
