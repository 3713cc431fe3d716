package com.lyz.healthplan.service.safety.policy;

import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.safety.AssessmentStatus;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.model.safety.RiskFactor;
import com.lyz.healthplan.model.safety.RiskLevel;
import com.lyz.healthplan.model.safety.SafetyCheck;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class WeightedScoringPolicyTest {

    private final WeightedScoringPolicy policy = new WeightedScoringPolicy();

    private static final ScoringContext DIET = ScoringContext.builder()
            .planType(PlanType.DIET)
            .user(UserMetadata.builder().build())
            .build();

    private static RiskFactor risk(String factor, RiskLevel severity, String recommendation) {
        return RiskFactor.builder().factor(factor).category("physical").severity(severity)
                .description(factor).recommendation(recommendation).build();
    }

    @Test
    void no_checks_and_no_risks_scores_full_marks() {
        ScoreOutcome outcome = policy.score(Collections.emptyList(), Collections.emptyList(), DIET);
        assertEquals(100, outcome.getScore());
        assertTrue(outcome.isSafe());
        assertEquals(AssessmentStatus.PASSED, outcome.getStatus());
        assertEquals(RiskLevel.LOW, outcome.getRiskLevel());
        assertThat(outcome.getRecommendations()).isEmpty();
    }

    @Test
    void pass_rate_minus_penalties_drives_the_band() {
        List<SafetyCheck> checks = List.of(
                SafetyCheck.pass("calories_range", "ok"),
                SafetyCheck.fail("low_protein", "protein too low", RiskLevel.MODERATE));
        ScoreOutcome outcome = policy.score(checks, List.of(risk("low_protein", RiskLevel.MODERATE, "Add lean protein")), DIET);

        assertEquals(35, outcome.getScore());
        assertFalse(outcome.isSafe());
        assertEquals(AssessmentStatus.FAILED, outcome.getStatus());
        assertEquals(RiskLevel.VERY_HIGH, outcome.getRiskLevel());
        assertEquals(List.of("Add lean protein"), outcome.getRecommendations());
    }

    @Test
    void severe_risk_makes_plan_unsafe_even_above_threshold() {
        List<SafetyCheck> checks = List.of(SafetyCheck.pass("calories_range", "ok"));
        ScoreOutcome outcome = policy.score(checks, List.of(risk("excessive_duration", RiskLevel.HIGH, null)), DIET);

        assertEquals(70, outcome.getScore());
        assertFalse(outcome.isSafe());
        assertEquals(AssessmentStatus.WARNING, outcome.getStatus());
        assertEquals(RiskLevel.MODERATE, outcome.getRiskLevel());
    }

    @Test
    void score_is_rounded_half_up_and_banded() {
        List<SafetyCheck> checks = List.of(
                SafetyCheck.pass("a", "ok"),
                SafetyCheck.pass("b", "ok"),
                SafetyCheck.fail("c", "bad", RiskLevel.LOW));
        ScoreOutcome outcome = policy.score(checks, Collections.emptyList(), DIET);

        assertEquals(67, outcome.getScore());
        assertTrue(outcome.isSafe());
        assertEquals(AssessmentStatus.WARNING, outcome.getStatus());
    }

    @Test
    void score_is_clamped_at_zero() {
        List<RiskFactor> risks = List.of(
                risk("a", RiskLevel.VERY_HIGH, null),
                risk("b", RiskLevel.VERY_HIGH, null),
                risk("c", RiskLevel.VERY_HIGH, null));
        ScoreOutcome outcome = policy.score(Collections.emptyList(), risks, DIET);
        assertEquals(0, outcome.getScore());
        assertEquals(AssessmentStatus.FAILED, outcome.getStatus());
    }

    @Test
    void review_band_between_forty_and_sixty() {
        List<SafetyCheck> checks = List.of(SafetyCheck.pass("a", "ok"), SafetyCheck.fail("b", "bad", RiskLevel.LOW));
        ScoreOutcome outcome = policy.score(checks, List.of(risk("b", RiskLevel.LOW, null)), DIET);
        assertEquals(45, outcome.getScore());
        assertEquals(AssessmentStatus.REVIEW, outcome.getStatus());
        assertEquals(RiskLevel.HIGH, outcome.getRiskLevel());
        assertFalse(outcome.isSafe());
    }

    @Test
    void recommendations_are_deduplicated_and_extended_for_conditions_and_exercise() {
        ScoringContext context = ScoringContext.builder()
                .planType(PlanType.EXERCISE)
                .user(UserMetadata.builder().medicalConditions(List.of("diabetes", "hypertension")).build())
                .build();
        List<RiskFactor> risks = List.of(
                risk("a", RiskLevel.LOW, "Reduce session length"),
                risk("b", RiskLevel.LOW, "Reduce session length"),
                risk("c", RiskLevel.LOW, "Train indoors"));

        ScoreOutcome outcome = policy.score(Collections.emptyList(), risks, context);

        assertThat(outcome.getRecommendations()).containsExactly(
                "Reduce session length",
                "Train indoors",
                "Consult healthcare provider before starting due to: diabetes, hypertension",
                WeightedScoringPolicy.EXERCISE_REMINDERS.get(0),
                WeightedScoringPolicy.EXERCISE_REMINDERS.get(1),
                WeightedScoringPolicy.EXERCISE_REMINDERS.get(2));
    }
}
