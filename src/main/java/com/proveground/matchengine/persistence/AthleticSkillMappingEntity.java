package com.proveground.matchengine.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Professional skill an athlete of a sport (and optionally a position)
 * brings along, with how strongly it carries over.
 */
@Entity
@Table(name = "athletic_skill_mappings",
        indexes = {
                @Index(name = "idx_athletic_skill_mappings_sport", columnList = "sport_name"),
                @Index(name = "idx_athletic_skill_mappings_skill", columnList = "professional_skill")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AthleticSkillMappingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "sport_name", nullable = false, length = 100)
    private String sportName;

    // null applies to every position of the sport
    @Column(name = "position", length = 100)
    private String position;

    @Column(name = "professional_skill", nullable = false, length = 100)
    private String professionalSkill;

    // 0.00 - 1.00
    @Column(name = "transfer_strength", nullable = false, precision = 3, scale = 2)
    private BigDecimal transferStrength;

    @Column(name = "skill_category", nullable = false, length = 50)
    private String skillCategory;

    @Column(name = "description")
    private String description;
}
