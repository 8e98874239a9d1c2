package com.proveground.matchengine.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StudentSkill {

    @Column(name = "skill_name", nullable = false)
    private String name;

    @Column(name = "category")
    private String category;

    // 1 (beginner) .. 5 (expert)
    @Column(name = "proficiency_level")
    private Integer proficiencyLevel;

    public static StudentSkill of(String name) {
        return new StudentSkill(name, null, null);
    }
}
