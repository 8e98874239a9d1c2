package com.proveground.matchengine.signal;

import com.proveground.matchengine.TestFixtures;
import com.proveground.matchengine.persistence.EngagementEntity;
import com.proveground.matchengine.persistence.ListingEntity;
import com.proveground.matchengine.persistence.StudentEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GrowthTrajectoryEvaluator Tests")
class GrowthTrajectoryEvaluatorTest {

    private final GrowthTrajectoryEvaluator evaluator = new GrowthTrajectoryEvaluator();

    private SignalOutcome evaluate(StudentEntity student, ListingEntity listing) {
        return evaluator.evaluate(EvaluationContext.builder()
                .student(student)
                .listing(listing)
                .asOf(LocalDate.of(2025, 9, 1))
                .build());
    }

    @Test
    @DisplayName("A new skill inside the student's interests is rewarded")
    void newSkillOfInterestRewarded() {
        StudentEntity student = TestFixtures.student("s1", "t1", "JavaScript", "React");
        student.setInterests(Set.of("sql", "data"));

        SignalOutcome outcome = evaluate(student, TestFixtures.listing("l1", "t1", "JavaScript", "React", "SQL"));

        // gap 100, interest 100, progression 50, gpa 3.4 -> 80
        assertThat(outcome.getScore()).isCloseTo(0.86, within(0.0001));
        assertEquals(100, outcome.getDetails().get("interestScore"));
    }

    @Test
    @DisplayName("New skills outside declared interests score lower")
    void newSkillOutsideInterests() {
        StudentEntity student = TestFixtures.student("s1", "t1", "JavaScript", "React");
        student.setInterests(Set.of("design"));

        SignalOutcome withUnrelated = evaluate(student, TestFixtures.listing("l1", "t1", "JavaScript", "React", "SQL"));
        student.setInterests(Set.of("sql"));
        SignalOutcome withMatching = evaluate(student, TestFixtures.listing("l1", "t1", "JavaScript", "React", "SQL"));

        assertThat(withUnrelated.getScore()).isCloseTo(0.685, within(0.0001));
        assertTrue(withUnrelated.getScore() < withMatching.getScore());
    }

    @Test
    @DisplayName("A listing without required skills is neutral")
    void noRequiredSkillsIsNeutral() {
        SignalOutcome outcome = evaluate(TestFixtures.student("s1", "t1", "Java"), TestFixtures.listing("l1", "t1"));

        assertTrue(outcome.isNeutralFallback());
        assertEquals(0.5, outcome.getScore());
    }

    @Test
    @DisplayName("Skill gap sweet spot beats knowing everything and knowing nothing")
    void gapSweetSpot() {
        int sweetSpot = GrowthTrajectoryEvaluator.gapScore(0.33);
        assertEquals(100, sweetSpot);
        assertTrue(GrowthTrajectoryEvaluator.gapScore(0.0) < sweetSpot);
        assertTrue(GrowthTrajectoryEvaluator.gapScore(1.0) < GrowthTrajectoryEvaluator.gapScore(0.5));
        assertEquals(10, GrowthTrajectoryEvaluator.gapScore(1.0));
    }

    @Test
    @DisplayName("Category progression from history")
    void categoryProgression() {
        EngagementEntity completed = TestFixtures.engagement("s1", "x", EngagementEntity.Status.COMPLETED);
        EngagementEntity applied = TestFixtures.engagement("s1", "y", EngagementEntity.Status.APPLIED);

        assertEquals(50, GrowthTrajectoryEvaluator.progressionScore(List.of(), "Engineering"));
        assertEquals(80, GrowthTrajectoryEvaluator.progressionScore(List.of(completed), "Marketing"));
        assertEquals(55, GrowthTrajectoryEvaluator.progressionScore(List.of(applied), "Engineering"));
        assertEquals(90, GrowthTrajectoryEvaluator.progressionScore(List.of(completed, applied), "engineering"));
    }

    @Test
    @DisplayName("GPA capacity bands")
    void gpaBands() {
        assertEquals(65, GrowthTrajectoryEvaluator.capacityScore(null));
        assertEquals(95, GrowthTrajectoryEvaluator.capacityScore(new BigDecimal("3.80")));
        assertEquals(80, GrowthTrajectoryEvaluator.capacityScore(new BigDecimal("3.00")));
        assertEquals(60, GrowthTrajectoryEvaluator.capacityScore(new BigDecimal("2.70")));
        assertEquals(40, GrowthTrajectoryEvaluator.capacityScore(new BigDecimal("2.10")));
    }
}
