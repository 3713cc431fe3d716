package com.lyz.healthplan.service.safety.policy;

import com.lyz.healthplan.model.safety.RiskFactor;
import com.lyz.healthplan.model.safety.SafetyCheck;

import java.util.List;

/**
 * 检查闸门：任一检查项未通过即 0 分不通过，否则 100 分
 */
public class CheckGateScoringPolicy implements ScoringPolicy {

    @Override
    public ScoringPolicyType type() {
        return ScoringPolicyType.CHECK_GATE;
    }

    @Override
    public ScoreOutcome score(List<SafetyCheck> checks, List<RiskFactor> riskFactors, ScoringContext context) {
        boolean anyFailed = checks.stream().anyMatch(check -> !check.isPassed());
        return anyFailed ? GateOutcomes.failed() : GateOutcomes.passed();
    }
}
