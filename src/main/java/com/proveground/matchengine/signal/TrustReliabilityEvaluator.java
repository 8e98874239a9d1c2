package com.proveground.matchengine.signal;

import com.proveground.matchengine.persistence.EngagementEntity;
import com.proveground.matchengine.persistence.StudentEntity;
import org.springframework.stereotype.Component;

import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reliability from the student's engagement history. Small samples are
 * pulled toward the middle so one bad rating does not dominate.
 */
@Component
public class TrustReliabilityEvaluator implements SignalEvaluator {

    private static final int MIN_HISTORY = 3;
    private static final int MIN_RATINGS = 3;
    private static final int MAX_TENURE_DAYS = 365;
    private static final int NEUTRAL_FACTOR = 55;

    @Override
    public SignalType getType() {
        return SignalType.TRUST;
    }

    @Override
    public SignalOutcome evaluate(EvaluationContext context) {
        List<EngagementEntity> history = context.getEngagements().stream()
                .filter(e -> e.getStatus() != null && e.getStatus().isCommitted())
                .toList();
        if (history.isEmpty()) {
            return SignalOutcome.neutral(getType(), "no engagement history");
        }

        long completed = count(history, EngagementEntity.Status.COMPLETED);
        long withdrawn = count(history, EngagementEntity.Status.WITHDRAWN);
        long finished = completed + withdrawn;

        int completionScore = completionScore(completed, finished);
        int onTimeScore = onTimeScore(history);
        List<Integer> ratings = history.stream()
                .map(EngagementEntity::getRating)
                .filter(Objects::nonNull)
                .toList();
        int ratingScore = ratingScore(ratings);
        int tenureScore = tenureScore(context.getStudent(), context);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("completed", completed);
        details.put("withdrawn", withdrawn);
        details.put("ratingCount", ratings.size());
        details.put("completionScore", completionScore);
        details.put("onTimeScore", onTimeScore);
        details.put("ratingScore", ratingScore);
        details.put("tenureScore", tenureScore);

        double blended = completionScore * 0.35 + onTimeScore * 0.25 + ratingScore * 0.25 + tenureScore * 0.15;
        return SignalOutcome.of(getType(), blended / 100.0, details);
    }

    static int completionScore(long completed, long finished) {
        if (finished == 0) {
            return NEUTRAL_FACTOR;
        }
        if (finished < MIN_HISTORY) {
            return completed > 0 ? 75 : 50;
        }
        double rate = (double) completed / finished;
        if (rate >= 0.9) {
            return 100;
        }
        if (rate >= 0.75) {
            return 85;
        }
        if (rate >= 0.5) {
            return 65;
        }
        return 35;
    }

    static int onTimeScore(List<EngagementEntity> history) {
        List<Boolean> flags = history.stream()
                .filter(e -> e.getStatus() == EngagementEntity.Status.COMPLETED)
                .map(EngagementEntity::getCompletedOnTime)
                .filter(Objects::nonNull)
                .toList();
        if (flags.isEmpty()) {
            return 60;
        }
        double rate = flags.stream().filter(Boolean::booleanValue).count() / (double) flags.size();
        if (rate >= 0.9) {
            return 100;
        }
        if (rate >= 0.75) {
            return 80;
        }
        if (rate >= 0.5) {
            return 55;
        }
        return 30;
    }

    static int ratingScore(List<Integer> ratings) {
        if (ratings.isEmpty()) {
            return NEUTRAL_FACTOR;
        }
        double average = ratings.stream().mapToInt(Integer::intValue).average().orElse(0);
        int score;
        if (average >= 4.5) {
            score = 100;
        } else if (average >= 4.0) {
            score = 85;
        } else if (average >= 3.5) {
            score = 70;
        } else if (average >= 3.0) {
            score = 50;
        } else {
            score = 25;
        }
        if (ratings.size() < MIN_RATINGS) {
            score = (int) Math.round(score * 0.85 + NEUTRAL_FACTOR * 0.15);
        }
        return score;
    }

    // 30..70 over the first year on the platform
    private int tenureScore(StudentEntity student, EvaluationContext context) {
        if (student.getJoinedAt() == null) {
            return 30;
        }
        long days = Math.max(0, ChronoUnit.DAYS.between(student.getJoinedAt().toLocalDate(), context.getAsOf()));
        double factor = Math.min((double) days / MAX_TENURE_DAYS, 1.0);
        return (int) Math.round(30 + factor * 40);
    }

    private static long count(List<EngagementEntity> history, EngagementEntity.Status status) {
        return history.stream().filter(e -> e.getStatus() == status).count();
    }
}
