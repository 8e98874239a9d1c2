package com.proveground.matchengine.signal;

import com.proveground.matchengine.persistence.AthleticSkillMappingEntity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A required skill the student lacks by name but brings from their sport.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AthleticTransfer {

    private String professionalSkill;
    private double transferStrength;
    private String sourceSport;
    private String sourcePosition;
    private String skillCategory;

    public static AthleticTransfer of(AthleticSkillMappingEntity mapping) {
        return new AthleticTransfer(mapping.getProfessionalSkill(),
                mapping.getTransferStrength().doubleValue(),
                mapping.getSportName(),
                mapping.getPosition(),
                mapping.getSkillCategory());
    }
}
