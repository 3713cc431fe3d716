package com.lyz.healthplan.service.safety.rule;

import com.lyz.healthplan.model.dto.EnvironmentContext;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.model.safety.RiskFactor;
import com.lyz.healthplan.model.safety.RiskLevel;
import com.lyz.healthplan.model.vo.PlanCandidate;
import com.lyz.healthplan.service.safety.SafetyFindings;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentCheckerTest {

    private final EnvironmentChecker checker = new EnvironmentChecker();

    private static final PlanCandidate EXERCISE = PlanCandidate.builder().planType(PlanType.EXERCISE).build();
    private static final PlanCandidate DIET = PlanCandidate.builder().planType(PlanType.DIET).build();

    private static EnvironmentContext weather(String condition, Double temperature, String location) {
        return EnvironmentContext.builder()
                .weather(EnvironmentContext.Weather.builder().condition(condition).temperatureC(temperature).build())
                .location(location)
                .build();
    }

    private SafetyFindings run(PlanCandidate candidate, EnvironmentContext environment) {
        SafetyFindings findings = new SafetyFindings();
        checker.check(candidate, null, environment, findings);
        return findings;
    }

    private static List<String> factors(SafetyFindings findings) {
        return findings.getRiskFactors().stream().map(RiskFactor::getFactor).collect(Collectors.toList());
    }

    @Test
    void hot_outdoor_exercise_is_high_risk() {
        SafetyFindings findings = run(EXERCISE, weather("sunny", 38.0, "outdoor"));
        assertEquals(List.of("high_temperature_exercise"), factors(findings));
        assertEquals(RiskLevel.HIGH, findings.getRiskFactors().get(0).getSeverity());
        assertEquals("environmental", findings.getRiskFactors().get(0).getCategory());
    }

    @Test
    void indoor_exercise_skips_weather_risks() {
        assertTrue(run(EXERCISE, weather("rainy", 38.0, "Indoor")).isEmpty());
    }

    @Test
    void cold_and_rainy_weather_stack() {
        SafetyFindings findings = run(EXERCISE, weather("Rainy", 2.0, null));
        assertEquals(List.of("cold_temperature_exercise", "inclement_weather"), factors(findings));
        assertTrue(findings.getRiskFactors().stream().allMatch(rf -> rf.getSeverity() == RiskLevel.MODERATE));
    }

    @Test
    void missing_weather_defaults_to_mild_clear_day() {
        assertTrue(run(EXERCISE, null).isEmpty());
        assertTrue(run(EXERCISE, new EnvironmentContext()).isEmpty());
    }

    @Test
    void thresholds_are_exclusive() {
        assertTrue(run(EXERCISE, weather("clear", 35.0, null)).isEmpty());
        assertTrue(run(EXERCISE, weather("clear", 5.0, null)).isEmpty());
    }

    @Test
    void hot_weather_adds_hydration_note_for_diet() {
        SafetyFindings findings = run(DIET, weather("sunny", 32.0, null));
        assertEquals(1, findings.getChecks().size());
        assertEquals("hot_weather_hydration", findings.getChecks().get(0).getCheckName());
        assertTrue(findings.getChecks().get(0).isPassed());
        assertTrue(findings.getRiskFactors().isEmpty());

        assertTrue(run(DIET, weather("sunny", 25.0, null)).isEmpty());
    }
}
