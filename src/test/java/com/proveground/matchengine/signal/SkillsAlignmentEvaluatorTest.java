package com.proveground.matchengine.signal;

import com.proveground.matchengine.TestFixtures;
import com.proveground.matchengine.persistence.AthleticSkillMappingEntity;
import com.proveground.matchengine.persistence.ListingEntity;
import com.proveground.matchengine.persistence.StudentEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SkillsAlignmentEvaluator Tests")
class SkillsAlignmentEvaluatorTest {

    private final SkillsAlignmentEvaluator evaluator = new SkillsAlignmentEvaluator();

    private SignalOutcome evaluate(StudentEntity student, ListingEntity listing) {
        return evaluator.evaluate(EvaluationContext.builder()
                .student(student)
                .listing(listing)
                .asOf(LocalDate.of(2025, 9, 1))
                .build());
    }

    @Test
    @DisplayName("Two of three required skills scores two thirds")
    void twoOfThreeSkills() {
        SignalOutcome outcome = evaluate(
                TestFixtures.student("s1", "t1", "JavaScript", "React"),
                TestFixtures.listing("l1", "t1", "JavaScript", "React", "SQL"));

        assertThat(outcome.getScore()).isCloseTo(0.667, within(0.001));
        assertThat(outcome.getDetails().get(SkillsAlignmentEvaluator.MATCHED_SKILLS))
                .isEqualTo(List.of("JavaScript", "React"));
        assertThat(outcome.getDetails().get(SkillsAlignmentEvaluator.MISSING_SKILLS))
                .isEqualTo(List.of("SQL"));
        assertFalse(outcome.isNeutralFallback());
    }

    @Test
    @DisplayName("Matching ignores case and keeps the listing's spelling")
    void caseInsensitiveMatch() {
        SignalOutcome outcome = evaluate(
                TestFixtures.student("s1", "t1", "javascript", " PYTHON "),
                TestFixtures.listing("l1", "t1", "JavaScript", "Python"));

        assertEquals(1.0, outcome.getScore());
        assertThat(outcome.getDetails().get(SkillsAlignmentEvaluator.MATCHED_SKILLS))
                .isEqualTo(List.of("JavaScript", "Python"));
    }

    @Test
    @DisplayName("A listing without required skills fits everyone")
    void noRequiredSkillsScoresOne() {
        SignalOutcome outcome = evaluate(
                TestFixtures.student("s1", "t1"),
                TestFixtures.listing("l1", "t1"));

        assertEquals(1.0, outcome.getScore());
        assertFalse(outcome.isNeutralFallback());
    }

    @Test
    @DisplayName("Missing skills the student's sport carries over are reported, score unchanged")
    void athleticTransfersReported() {
        List<AthleticSkillMappingEntity> mappings = List.of(
                mapping("Football", "Quarterback", "Leadership", "0.95"),
                mapping("Football", null, "Leadership", "0.70"),
                mapping("Football", null, "Resilience", "0.90"),
                mapping("Football", null, "Work Ethic", "0.85"));

        SignalOutcome outcome = evaluator.evaluate(EvaluationContext.builder()
                .student(TestFixtures.student("s1", "t1", "Excel", "Resilience"))
                .listing(TestFixtures.listing("l1", "t1", "Excel", "leadership", "Resilience", "SQL"))
                .athleticTransfers(mappings)
                .asOf(LocalDate.of(2025, 9, 1))
                .build());

        assertEquals(0.5, outcome.getScore(), 1e-9);
        @SuppressWarnings("unchecked")
        List<AthleticTransfer> transfers =
                (List<AthleticTransfer>) outcome.getDetails().get(SkillsAlignmentEvaluator.ATHLETIC_TRANSFER_SKILLS);
        assertEquals(1, transfers.size());
        assertEquals("Leadership", transfers.get(0).getProfessionalSkill());
        assertEquals(0.95, transfers.get(0).getTransferStrength(), 1e-9);
        assertEquals("Quarterback", transfers.get(0).getSourcePosition());
    }

    @Test
    @DisplayName("Without mappings no transfers are reported")
    void noTransfersWithoutSport() {
        SignalOutcome outcome = evaluate(
                TestFixtures.student("s1", "t1", "Excel"),
                TestFixtures.listing("l1", "t1", "Leadership"));

        assertThat((List<?>) outcome.getDetails().get(SkillsAlignmentEvaluator.ATHLETIC_TRANSFER_SKILLS)).isEmpty();
    }

    private static AthleticSkillMappingEntity mapping(String sport, String position, String skill, String strength) {
        return AthleticSkillMappingEntity.builder()
                .sportName(sport)
                .position(position)
                .professionalSkill(skill)
                .transferStrength(new BigDecimal(strength))
                .skillCategory("Leadership")
                .build();
    }

    @Test
    @DisplayName("No overlap scores zero")
    void noOverlapScoresZero() {
        SignalOutcome outcome = evaluate(
                TestFixtures.student("s1", "t1", "Excel"),
                TestFixtures.listing("l1", "t1", "Go", "Kubernetes"));

        assertEquals(0.0, outcome.getScore());
    }
}
