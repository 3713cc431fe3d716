package com.lyz.healthplan.config;

import com.lyz.healthplan.common.exception.PlanConfigurationException;
import com.lyz.healthplan.service.safety.matcher.ContentMatcherType;
import com.lyz.healthplan.service.safety.policy.ScoringPolicyType;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 安全评估配置（plan.safety.*）
 */
@Data
@ConfigurationProperties(prefix = "plan.safety")
public class SafetyProperties {

    /**
     * weighted / risk-gate / check-gate，必填
     */
    private String scoringPolicy;

    /**
     * keyword / word-boundary
     */
    private String contentMatcher = "keyword";

    private boolean semanticEnabled = true;

    private Rules rules = new Rules();

    @PostConstruct
    public void validate() {
        if (StringUtils.isBlank(scoringPolicy)) {
            throw new PlanConfigurationException("未配置评分策略 plan.safety.scoring-policy，可选值: weighted / risk-gate / check-gate");
        }
        ScoringPolicyType.fromCode(scoringPolicy);
        ContentMatcherType.fromCode(contentMatcher);
    }

    public ScoringPolicyType resolveScoringPolicy() {
        return ScoringPolicyType.fromCode(scoringPolicy);
    }

    public ContentMatcherType resolveContentMatcher() {
        return ContentMatcherType.fromCode(contentMatcher);
    }

    @Data
    public static class Rules {
        private Diet diet = new Diet();
        private Exercise exercise = new Exercise();
    }

    @Data
    public static class Diet {
        /**
         * 全天热量下限（单餐按餐次占比折算）
         */
        private double minCalories = 1200;
        private double maxCalories = 4000;
        private double singleMealCalories = 1500;
        private double minProteinRatio = 0.10;
        private double maxFatRatio = 0.40;
    }

    @Data
    public static class Exercise {
        private int maxDurationBeginner = 30;
        private int maxDurationIntermediate = 60;
        private int maxDurationAdvanced = 120;
        /**
         * 未识别的运动水平使用该上限
         */
        private int maxDurationDefault = 60;
        private int maxWeeklySessions = 7;
        private int maxHiitWeeklyFrequency = 3;
    }
}
