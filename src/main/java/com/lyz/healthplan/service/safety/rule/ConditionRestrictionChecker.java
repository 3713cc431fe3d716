package com.lyz.healthplan.service.safety.rule;

import com.lyz.healthplan.model.dto.EnvironmentContext;
import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.exercise.ExerciseItem;
import com.lyz.healthplan.model.exercise.ExerciseSession;
import com.lyz.healthplan.model.food.ScaledFoodItem;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.model.safety.RiskFactor;
import com.lyz.healthplan.model.safety.RiskLevel;
import com.lyz.healthplan.model.vo.PlanCandidate;
import com.lyz.healthplan.service.safety.SafetyFindings;
import com.lyz.healthplan.service.safety.SafetyRuleChecker;
import com.lyz.healthplan.service.safety.matcher.ContentMatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 病症禁忌检查
 * 饮食扫描食物名称；运动扫描动作名称、类型与时段
 */
@Component
@Order(30)
@RequiredArgsConstructor
public class ConditionRestrictionChecker implements SafetyRuleChecker {

    private final ContentMatcher contentMatcher;

    @Override
    public void check(PlanCandidate candidate, UserMetadata user, EnvironmentContext environment, SafetyFindings findings) {
        if (user == null || !user.hasConditions() || candidate.getPlanType() == null) {
            return;
        }
        String content = flatten(candidate);
        for (String condition : user.getMedicalConditions()) {
            for (ConditionRestrictionTable.Restriction restriction :
                    ConditionRestrictionTable.restrictionsFor(condition, candidate.getPlanType())) {
                List<String> matched = contentMatcher.findMatches(content, restriction.getKeywords());
                if (matched.isEmpty()) {
                    continue;
                }
                String conditionName = restriction.getCondition();
                findings.addRisk(RiskFactor.builder()
                        .factor(restriction.factorName())
                        .category("medical")
                        .severity(RiskLevel.HIGH)
                        .description(String.format("Plan contains %s for %s (matched: %s)",
                                restriction.getDescription(), conditionName, String.join(", ", matched)))
                        .recommendation(String.format("Remove %s for %s management", restriction.getDescription(), conditionName))
                        .build());
            }
        }
    }

    String flatten(PlanCandidate candidate) {
        StringBuilder sb = new StringBuilder();
        if (candidate.getPlanType() == PlanType.DIET && candidate.getItems() != null) {
            for (ScaledFoodItem item : candidate.getItems()) {
                append(sb, item.getName());
            }
        }
        if (candidate.getPlanType() == PlanType.EXERCISE && candidate.getPlan() != null
                && candidate.getPlan().getSessions() != null) {
            for (Map.Entry<String, ExerciseSession> entry : candidate.getPlan().getSessions().entrySet()) {
                ExerciseSession session = entry.getValue();
                append(sb, entry.getKey());
                if (session == null) {
                    continue;
                }
                append(sb, session.getTimeOfDay());
                if (session.getExercises() != null) {
                    for (ExerciseItem item : session.getExercises()) {
                        append(sb, item.getName());
                        append(sb, item.getType());
                    }
                }
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    private void append(StringBuilder sb, String value) {
        if (value != null) {
            sb.append(value).append(" | ");
        }
    }
}
