package com.lyz.healthplan.service.safety.policy;

import com.lyz.healthplan.model.safety.RiskFactor;
import com.lyz.healthplan.model.safety.SafetyCheck;

import java.util.List;

/**
 * 评分策略，每个部署只启用一种（plan.safety.scoring-policy）
 */
public interface ScoringPolicy {

    ScoringPolicyType type();

    ScoreOutcome score(List<SafetyCheck> checks, List<RiskFactor> riskFactors, ScoringContext context);

    static boolean hasSevereRisk(List<RiskFactor> riskFactors) {
        return riskFactors.stream().anyMatch(rf -> rf.getSeverity() != null && rf.getSeverity().isSevere());
    }
}
