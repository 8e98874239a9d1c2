package com.proveground.matchengine.signal;

import com.proveground.matchengine.persistence.EngagementEntity;
import com.proveground.matchengine.persistence.SportSeasonEntity;
import com.proveground.matchengine.persistence.StudentScheduleEntity;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Burnout risk: total weekly commitment including this listing, number of
 * concurrent engagements and the intensity of in-season sports.
 */
@Component
public class SustainabilityEvaluator implements SignalEvaluator {

    private static final int MAX_SUSTAINABLE_HOURS = 50;
    private static final int MAX_CONCURRENT = 3;
    private static final int DEFAULT_ENGAGEMENT_HOURS = 10;
    private static final int DEFAULT_LISTING_HOURS = 15;

    @Override
    public SignalType getType() {
        return SignalType.SUSTAINABILITY;
    }

    @Override
    public SignalOutcome evaluate(EvaluationContext context) {
        List<EngagementEntity> ongoing = context.otherEngagements().stream()
                .filter(e -> e.getStatus() != null && e.getStatus().isOngoing())
                .toList();
        List<SportSeasonEntity> seasons = inSeasonSports(context);

        int engagementHours = ongoing.stream()
                .mapToInt(e -> e.getHoursPerWeek() != null ? e.getHoursPerWeek() : DEFAULT_ENGAGEMENT_HOURS)
                .sum();
        int sportHours = seasons.stream().mapToInt(SportSeasonEntity::getWeeklyHours).sum();
        Integer listingHours = context.getListing().getHoursPerWeek();
        int totalHours = engagementHours + sportHours
                + (listingHours != null ? listingHours : DEFAULT_LISTING_HOURS);

        int workloadScore = workloadScore(totalHours);
        int concurrentScore = concurrentScore(ongoing.size());
        int intensityScore = intensityScore(seasons.stream()
                .mapToInt(SportSeasonEntity::getIntensityLevel)
                .max()
                .orElse(0));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("totalCommittedHours", totalHours);
        details.put("engagementHours", engagementHours);
        details.put("sportHours", sportHours);
        details.put("concurrentEngagements", ongoing.size());
        details.put("workloadScore", workloadScore);
        details.put("concurrentScore", concurrentScore);
        details.put("intensityScore", intensityScore);

        double blended = workloadScore * 0.50 + concurrentScore * 0.30 + intensityScore * 0.20;
        return SignalOutcome.of(getType(), blended / 100.0, details);
    }

    static int workloadScore(int totalHours) {
        if (totalHours <= 30) {
            return 100;
        }
        if (totalHours <= 40) {
            return 85;
        }
        if (totalHours <= MAX_SUSTAINABLE_HOURS) {
            return 65;
        }
        int overload = totalHours - MAX_SUSTAINABLE_HOURS;
        return Math.max(10, 50 - overload * 3);
    }

    static int concurrentScore(int concurrent) {
        if (concurrent <= 1) {
            return 100;
        }
        if (concurrent == 2) {
            return 75;
        }
        if (concurrent <= MAX_CONCURRENT) {
            return 50;
        }
        return Math.max(10, 40 - (concurrent - MAX_CONCURRENT) * 15);
    }

    // 0 means no sport in season
    static int intensityScore(int maxIntensity) {
        if (maxIntensity <= 0) {
            return 100;
        }
        if (maxIntensity <= 2) {
            return 90;
        }
        if (maxIntensity == 3) {
            return 70;
        }
        if (maxIntensity == 4) {
            return 45;
        }
        return 25;
    }

    private List<SportSeasonEntity> inSeasonSports(EvaluationContext context) {
        int month = context.getAsOf().getMonthValue();
        return context.getSchedules().stream()
                .filter(StudentScheduleEntity::isActive)
                .filter(s -> s.getScheduleType() == StudentScheduleEntity.ScheduleType.SPORT)
                .filter(s -> s.isEffectiveOn(context.getAsOf()))
                .map(StudentScheduleEntity::getSportSeason)
                .filter(season -> season != null && season.isInSeason(month))
                .toList();
    }
}
