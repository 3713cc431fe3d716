package com.lyz.healthplan.service.safety.rule;

import com.lyz.healthplan.model.dto.EnvironmentContext;
import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.model.safety.RiskFactor;
import com.lyz.healthplan.model.safety.RiskLevel;
import com.lyz.healthplan.model.safety.SafetyCheck;
import com.lyz.healthplan.model.vo.PlanCandidate;
import com.lyz.healthplan.service.safety.SafetyFindings;
import com.lyz.healthplan.service.safety.SafetyRuleChecker;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * 环境检查：温度与天气
 * 缺失天气时按 20°C、晴天处理；运动方案在室内时跳过
 */
@Component
@Order(40)
public class EnvironmentChecker implements SafetyRuleChecker {

    static final double HOT_EXERCISE_TEMPERATURE = 35.0;
    static final double COLD_EXERCISE_TEMPERATURE = 5.0;
    static final double HOT_DIET_TEMPERATURE = 30.0;

    @Override
    public void check(PlanCandidate candidate, UserMetadata user, EnvironmentContext environment, SafetyFindings findings) {
        EnvironmentContext env = environment != null ? environment : new EnvironmentContext();
        double temperature = env.resolveTemperature();
        String condition = env.resolveCondition();

        if (candidate.getPlanType() == PlanType.EXERCISE && !env.isIndoor()) {
            if (temperature > HOT_EXERCISE_TEMPERATURE) {
                findings.addRisk(RiskFactor.builder()
                        .factor("high_temperature_exercise")
                        .category("environmental")
                        .severity(RiskLevel.HIGH)
                        .description(String.format("High temperature (%.1f°C) increases heat stress risk", temperature))
                        .recommendation("Exercise indoors or in early morning/late evening")
                        .build());
            } else if (temperature < COLD_EXERCISE_TEMPERATURE) {
                findings.addRisk(RiskFactor.builder()
                        .factor("cold_temperature_exercise")
                        .category("environmental")
                        .severity(RiskLevel.MODERATE)
                        .description(String.format("Cold temperature (%.1f°C) increases cardiovascular strain", temperature))
                        .recommendation("Warm up thoroughly, dress in layers")
                        .build());
            }
            if ("rainy".equals(condition) || "icy".equals(condition)) {
                findings.addRisk(RiskFactor.builder()
                        .factor("inclement_weather")
                        .category("environmental")
                        .severity(RiskLevel.MODERATE)
                        .description(condition + " weather increases slip/fall risk")
                        .recommendation("Move exercise indoors or choose safe surfaces")
                        .build());
            }
        }

        if (candidate.getPlanType() == PlanType.DIET && temperature > HOT_DIET_TEMPERATURE) {
            findings.addCheck(SafetyCheck.pass("hot_weather_hydration", "Consider increased fluid intake for hot weather"));
        }
    }
}
