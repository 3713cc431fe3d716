package com.lyz.healthplan.service.safety.rule;

import com.lyz.healthplan.config.SafetyProperties;
import com.lyz.healthplan.model.dto.EnvironmentContext;
import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.exercise.ExerciseItem;
import com.lyz.healthplan.model.exercise.ExercisePlan;
import com.lyz.healthplan.model.exercise.Intensity;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.model.safety.RiskFactor;
import com.lyz.healthplan.model.safety.RiskLevel;
import com.lyz.healthplan.model.safety.SafetyCheck;
import com.lyz.healthplan.model.vo.PlanCandidate;
import com.lyz.healthplan.service.safety.SafetyFindings;
import com.lyz.healthplan.service.safety.SafetyRuleChecker;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 运动规则检查：按运动水平的时长上限、休息日、HIIT 频次、强度与水平匹配
 */
@Component
@Order(20)
@RequiredArgsConstructor
public class ExerciseRuleChecker implements SafetyRuleChecker {

    public static final String BEGINNER = "beginner";
    public static final String INTERMEDIATE = "intermediate";
    public static final String ADVANCED = "advanced";

    private final SafetyProperties safetyProperties;

    @Override
    public void check(PlanCandidate candidate, UserMetadata user, EnvironmentContext environment, SafetyFindings findings) {
        if (candidate.getPlanType() != PlanType.EXERCISE || candidate.getPlan() == null) {
            return;
        }
        SafetyProperties.Exercise rules = safetyProperties.getRules().getExercise();
        ExercisePlan plan = candidate.getPlan();
        String level = resolveFitnessLevel(user);
        List<ExerciseItem> exercises = plan.allExercises();

        // 1. 时长上限
        int totalDuration = candidate.getTotalDurationMinutes() != null
                ? candidate.getTotalDurationMinutes() : plan.getTotalDurationMinutes();
        int maxDuration = maxDurationFor(level, rules);
        if (totalDuration > maxDuration) {
            RiskLevel severity = ADVANCED.equals(level) ? RiskLevel.MODERATE : RiskLevel.HIGH;
            findings.addCheck(SafetyCheck.fail("daily_duration",
                    String.format("Duration %dmin exceeds %s limit (%dmin)", totalDuration, level, maxDuration), severity));
            findings.addRisk(RiskFactor.builder()
                    .factor("excessive_duration")
                    .category("exercise")
                    .severity(severity)
                    .description(String.format("Total exercise time %dmin is excessive for %s", totalDuration, level))
                    .recommendation(String.format("Reduce daily duration to %dmin or less", maxDuration))
                    .build());
        } else {
            findings.addCheck(SafetyCheck.pass("daily_duration",
                    String.format("Duration %dmin is appropriate", totalDuration)));
        }

        // 2. 休息日
        int weeklyFrequency = plan.getWeeklyFrequency();
        if (weeklyFrequency > rules.getMaxWeeklySessions()) {
            findings.addCheck(SafetyCheck.fail("rest_days", "Exercise every day without rest", RiskLevel.MODERATE));
            findings.addRisk(RiskFactor.builder()
                    .factor("no_rest_days")
                    .category("exercise")
                    .severity(RiskLevel.MODERATE)
                    .description("No rest days scheduled in weekly plan")
                    .recommendation("Include at least 1-2 rest days per week")
                    .build());
        }

        // 3. HIIT 频次
        boolean hasHiit = exercises.stream().anyMatch(ex -> StringUtils.equalsIgnoreCase(ex.getType(), "hiit"));
        if (hasHiit && weeklyFrequency > rules.getMaxHiitWeeklyFrequency()) {
            findings.addRisk(RiskFactor.builder()
                    .factor("hiit_frequency")
                    .category("exercise")
                    .severity(RiskLevel.HIGH)
                    .description("HIIT sessions too frequent without adequate recovery")
                    .recommendation("Limit HIIT to 2-3 times per week with 48h rest")
                    .build());
        }

        // 4. 强度与运动水平
        boolean limitedLevel = BEGINNER.equals(level) || INTERMEDIATE.equals(level);
        List<String> intenseNames = exercises.stream()
                .filter(ex -> ex.getIntensity() != null && ex.getIntensity().isAtLeast(Intensity.HIGH))
                .map(ExerciseItem::getName)
                .collect(Collectors.toList());
        if (limitedLevel && !intenseNames.isEmpty()) {
            findings.addCheck(SafetyCheck.fail("intensity_level",
                    String.format("High intensity exercises for %s: %s", level, String.join(", ", intenseNames)),
                    RiskLevel.MODERATE));
            findings.addRisk(RiskFactor.builder()
                    .factor("high_intensity_for_level")
                    .category("exercise")
                    .severity(RiskLevel.MODERATE)
                    .description(String.format("%d high intensity exercise(s) planned for a %s user", intenseNames.size(), level))
                    .recommendation("Replace high intensity exercises with moderate alternatives")
                    .build());
        } else {
            findings.addCheck(SafetyCheck.pass("intensity_level", "Exercise intensity matches fitness level"));
        }
    }

    /**
     * 未填写时按 beginner 处理
     */
    private String resolveFitnessLevel(UserMetadata user) {
        if (user == null || StringUtils.isBlank(user.getFitnessLevel())) {
            return BEGINNER;
        }
        return user.getFitnessLevel().trim().toLowerCase();
    }

    private int maxDurationFor(String level, SafetyProperties.Exercise rules) {
        return switch (level) {
            case BEGINNER -> rules.getMaxDurationBeginner();
            case INTERMEDIATE -> rules.getMaxDurationIntermediate();
            case ADVANCED -> rules.getMaxDurationAdvanced();
            default -> rules.getMaxDurationDefault();
        };
    }
}
