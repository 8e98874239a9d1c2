package com.proveground.matchengine.signal;

import com.proveground.matchengine.persistence.EngagementEntity;
import com.proveground.matchengine.persistence.ListingEntity;
import com.proveground.matchengine.persistence.StudentEntity;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Rewards a moderate skill stretch, new skills inside the student's declared
 * interests, category progression and academic headroom.
 */
@Component
public class GrowthTrajectoryEvaluator implements SignalEvaluator {

    private static final double IDEAL_GAP_MIN = 0.15;
    private static final double IDEAL_GAP_MAX = 0.45;

    @Override
    public SignalType getType() {
        return SignalType.GROWTH;
    }

    @Override
    public SignalOutcome evaluate(EvaluationContext context) {
        StudentEntity student = context.getStudent();
        ListingEntity listing = context.getListing();
        SkillMatch match = SkillMatch.of(student, listing);
        if (match.getRequiredCount() == 0) {
            return SignalOutcome.neutral(getType(), "listing has no required skills");
        }

        double gapRatio = (double) match.getMissing().size() / match.getRequiredCount();
        int gapScore = gapScore(gapRatio);
        int interestScore = interestScore(student.normalizedInterests(), match.getMissing(), listing.getCategory());
        int progressionScore = progressionScore(context.otherEngagements(), listing.getCategory());
        int capacityScore = capacityScore(student.getGpa());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("gapRatio", Math.round(gapRatio * 100) / 100.0);
        details.put("gapScore", gapScore);
        details.put("interestScore", interestScore);
        details.put("progressionScore", progressionScore);
        details.put("capacityScore", capacityScore);

        double blended = gapScore * 0.35 + interestScore * 0.25 + progressionScore * 0.20 + capacityScore * 0.20;
        return SignalOutcome.of(getType(), blended / 100.0, details);
    }

    static int gapScore(double gapRatio) {
        if (gapRatio >= IDEAL_GAP_MIN && gapRatio <= IDEAL_GAP_MAX) {
            return 100;
        }
        if (gapRatio < IDEAL_GAP_MIN) {
            // already knows nearly everything
            return (int) Math.round(60 + gapRatio * 200);
        }
        if (gapRatio <= 0.6) {
            return (int) Math.round(80 - (gapRatio - IDEAL_GAP_MAX) * 150);
        }
        return (int) Math.max(10, Math.round(50 - (gapRatio - 0.6) * 100));
    }

    /**
     * 100 when a new skill (or the listing's category) is one of the student's
     * interests, 30 when interests are declared but none is touched, 50 when
     * the student declared none.
     */
    static int interestScore(Set<String> interests, List<String> missingSkills, String category) {
        if (interests.isEmpty()) {
            return 50;
        }
        boolean newSkillOfInterest = missingSkills.stream()
                .map(skill -> skill.toLowerCase(Locale.ROOT))
                .anyMatch(interests::contains);
        boolean categoryOfInterest = category != null && interests.contains(category.trim().toLowerCase(Locale.ROOT));
        if (newSkillOfInterest || categoryOfInterest) {
            return 100;
        }
        return 30;
    }

    static int progressionScore(List<EngagementEntity> history, String category) {
        if (history.isEmpty() || category == null) {
            return 50;
        }
        List<EngagementEntity> inCategory = history.stream()
                .filter(e -> category.equalsIgnoreCase(e.getCategory()))
                .toList();
        long completedInCategory = inCategory.stream()
                .filter(e -> e.getStatus() == EngagementEntity.Status.COMPLETED
                        || e.getStatus() == EngagementEntity.Status.ACCEPTED)
                .count();

        if (inCategory.isEmpty()) {
            // new category
            return 80;
        }
        if (completedInCategory == 0) {
            return 55;
        }
        if (completedInCategory <= 2) {
            return 90;
        }
        return 60;
    }

    static int capacityScore(BigDecimal gpa) {
        if (gpa == null) {
            return 65;
        }
        double value = gpa.doubleValue();
        if (value >= 3.5) {
            return 95;
        }
        if (value >= 3.0) {
            return 80;
        }
        if (value >= 2.5) {
            return 60;
        }
        return 40;
    }
}
