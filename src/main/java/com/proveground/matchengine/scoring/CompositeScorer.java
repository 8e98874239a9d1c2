package com.proveground.matchengine.scoring;

import com.proveground.matchengine.persistence.SignalScore;
import com.proveground.matchengine.signal.EvaluationContext;
import com.proveground.matchengine.signal.SignalEvaluator;
import com.proveground.matchengine.signal.SignalOutcome;
import com.proveground.matchengine.signal.SignalType;
import com.proveground.matchengine.signal.SkillsAlignmentEvaluator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one evaluator per signal type and combines the outcomes into a
 * 0-100 composite: round(100 * sum(score * weight)).
 */
@Component
@Slf4j
public class CompositeScorer {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Map<SignalType, SignalEvaluator> evaluators = new EnumMap<>(SignalType.class);

    public CompositeScorer(List<SignalEvaluator> evaluators) {
        for (SignalEvaluator evaluator : evaluators) {
            SignalEvaluator previous = this.evaluators.put(evaluator.getType(), evaluator);
            if (previous != null) {
                throw new IllegalStateException("Duplicate evaluator for signal " + evaluator.getType());
            }
        }
        for (SignalType type : SignalType.values()) {
            if (!this.evaluators.containsKey(type)) {
                throw new IllegalStateException("No evaluator registered for signal " + type);
            }
        }
        log.info("Composite scorer initialized with {} signal evaluators", this.evaluators.size());
    }

    /**
     * Evaluate all signals in declaration order.
     */
    public List<SignalOutcome> evaluate(EvaluationContext context) {
        List<SignalOutcome> outcomes = new ArrayList<>();
        for (SignalType type : SignalType.values()) {
            SignalOutcome outcome = evaluators.get(type).evaluate(context);
            if (outcome.isNeutralFallback()) {
                log.debug("Signal {} used neutral fallback for student {} / listing {}: {}",
                        type.getKey(), context.getStudent().getId(), context.getListing().getId(),
                        outcome.getDetails().get("fallbackReason"));
            }
            outcomes.add(outcome);
        }
        return outcomes;
    }

    /**
     * Combine outcomes with the given weights.
     */
    public ScoreResult score(List<SignalOutcome> outcomes, SignalWeights weights) {
        BigDecimal weighted = BigDecimal.ZERO;
        LinkedHashMap<String, SignalScore> breakdown = new LinkedHashMap<>();
        List<String> matched = new ArrayList<>();
        List<String> missing = new ArrayList<>();

        for (SignalOutcome outcome : outcomes) {
            BigDecimal weight = weights.weightOf(outcome.getType());
            weighted = weighted.add(BigDecimal.valueOf(outcome.getScore()).multiply(weight));
            breakdown.put(outcome.getType().getKey(), SignalScore.builder()
                    .score(outcome.getScore())
                    .weight(weight.doubleValue())
                    .neutralFallback(outcome.isNeutralFallback())
                    .details(outcome.getDetails())
                    .build());

            if (outcome.getType() == SignalType.SKILLS) {
                matched.addAll(skillList(outcome, SkillsAlignmentEvaluator.MATCHED_SKILLS));
                missing.addAll(skillList(outcome, SkillsAlignmentEvaluator.MISSING_SKILLS));
            }
        }

        int composite = weighted.multiply(HUNDRED).setScale(0, RoundingMode.HALF_UP).intValue();
        composite = Math.max(0, Math.min(100, composite));

        return ScoreResult.builder()
                .compositeScore(composite)
                .signals(breakdown)
                .matchedSkills(matched)
                .missingSkills(missing)
                .weightsVersion(weights.getVersion())
                .build();
    }

    public ScoreResult evaluateAndScore(EvaluationContext context, SignalWeights weights) {
        return score(evaluate(context), weights);
    }

    private static List<String> skillList(SignalOutcome outcome, String key) {
        Object value = outcome.getDetails().get(key);
        List<String> skills = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                skills.add(String.valueOf(item));
            }
        }
        return skills;
    }
}
