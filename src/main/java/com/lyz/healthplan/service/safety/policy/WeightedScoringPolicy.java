package com.lyz.healthplan.service.safety.policy;

import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.safety.AssessmentStatus;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.model.safety.RiskFactor;
import com.lyz.healthplan.model.safety.RiskLevel;
import com.lyz.healthplan.model.safety.SafetyCheck;
import com.lyz.healthplan.util.NumberUtil;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 加权评分
 * score = clamp(100 × 通过率 - Σ严重程度扣分, 0, 100)
 */
public class WeightedScoringPolicy implements ScoringPolicy {

    static final int SAFE_THRESHOLD = 60;

    static final List<String> EXERCISE_REMINDERS = List.of(
            "Start gradually and listen to your body",
            "Stay hydrated before, during, and after exercise",
            "Stop immediately if you experience pain or discomfort");

    @Override
    public ScoringPolicyType type() {
        return ScoringPolicyType.WEIGHTED;
    }

    @Override
    public ScoreOutcome score(List<SafetyCheck> checks, List<RiskFactor> riskFactors, ScoringContext context) {
        long passed = checks.stream().filter(SafetyCheck::isPassed).count();
        double base = checks.isEmpty() ? 100.0 : 100.0 * passed / checks.size();
        int penalty = 0;
        for (RiskFactor rf : riskFactors) {
            if (rf.getSeverity() != null) {
                penalty += rf.getSeverity().getPenalty();
            }
        }
        int score = NumberUtil.roundToInt(Math.max(0.0, Math.min(100.0, base - penalty)));
        boolean safe = score >= SAFE_THRESHOLD && !ScoringPolicy.hasSevereRisk(riskFactors);

        return ScoreOutcome.builder()
                .score(score)
                .safe(safe)
                .status(statusFor(score))
                .riskLevel(riskLevelFor(score))
                .recommendations(buildRecommendations(riskFactors, context))
                .build();
    }

    private AssessmentStatus statusFor(int score) {
        if (score >= 80) return AssessmentStatus.PASSED;
        if (score >= 60) return AssessmentStatus.WARNING;
        if (score >= 40) return AssessmentStatus.REVIEW;
        return AssessmentStatus.FAILED;
    }

    private RiskLevel riskLevelFor(int score) {
        if (score >= 80) return RiskLevel.LOW;
        if (score >= 60) return RiskLevel.MODERATE;
        if (score >= 40) return RiskLevel.HIGH;
        return RiskLevel.VERY_HIGH;
    }

    /**
     * 风险建议 + 就医提示 + 运动通用提醒，按首次出现顺序去重
     */
    private List<String> buildRecommendations(List<RiskFactor> riskFactors, ScoringContext context) {
        Set<String> recommendations = new LinkedHashSet<>();
        for (RiskFactor rf : riskFactors) {
            if (StringUtils.isNotBlank(rf.getRecommendation())) {
                recommendations.add(rf.getRecommendation());
            }
        }
        UserMetadata user = context != null ? context.getUser() : null;
        if (user != null && user.hasConditions()) {
            recommendations.add("Consult healthcare provider before starting due to: "
                    + String.join(", ", user.getMedicalConditions()));
        }
        if (context != null && context.getPlanType() == PlanType.EXERCISE) {
            recommendations.addAll(EXERCISE_REMINDERS);
        }
        return new ArrayList<>(recommendations);
    }
}
