package com.proveground.matchengine.signal;

import com.proveground.matchengine.persistence.AthleticSkillMappingEntity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * matched / required. A listing without required skills fits everyone.
 * Missing skills the student's sport carries over are reported as athletic
 * transfers; they do not change the score.
 */
@Component
public class SkillsAlignmentEvaluator implements SignalEvaluator {

    public static final String MATCHED_SKILLS = "matchedSkills";
    public static final String MISSING_SKILLS = "missingSkills";
    public static final String ATHLETIC_TRANSFER_SKILLS = "athleticTransferSkills";

    @Override
    public SignalType getType() {
        return SignalType.SKILLS;
    }

    @Override
    public SignalOutcome evaluate(EvaluationContext context) {
        SkillMatch match = SkillMatch.of(context.getStudent(), context.getListing());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put(MATCHED_SKILLS, match.getMatched());
        details.put(MISSING_SKILLS, match.getMissing());
        details.put("requiredCount", match.getRequiredCount());
        details.put(ATHLETIC_TRANSFER_SKILLS, transfersFor(match.getMissing(), context.getAthleticTransfers()));

        if (match.getRequiredCount() == 0) {
            return SignalOutcome.of(getType(), 1.0, details);
        }
        double score = (double) match.getMatched().size() / match.getRequiredCount();
        return SignalOutcome.of(getType(), score, details);
    }

    /**
     * Strongest mapping per missing skill, in the order the listing names them.
     */
    static List<AthleticTransfer> transfersFor(List<String> missing, List<AthleticSkillMappingEntity> mappings) {
        List<AthleticTransfer> transfers = new ArrayList<>();
        if (mappings == null || mappings.isEmpty()) {
            return transfers;
        }
        Map<String, AthleticSkillMappingEntity> strongest = new LinkedHashMap<>();
        for (AthleticSkillMappingEntity mapping : mappings) {
            String key = mapping.getProfessionalSkill().trim().toLowerCase(Locale.ROOT);
            AthleticSkillMappingEntity current = strongest.get(key);
            if (current == null || mapping.getTransferStrength().compareTo(current.getTransferStrength()) > 0) {
                strongest.put(key, mapping);
            }
        }
        for (String skill : missing) {
            AthleticSkillMappingEntity mapping = strongest.get(skill.toLowerCase(Locale.ROOT));
            if (mapping != null) {
                transfers.add(AthleticTransfer.of(mapping));
            }
        }
        return transfers;
    }
}
