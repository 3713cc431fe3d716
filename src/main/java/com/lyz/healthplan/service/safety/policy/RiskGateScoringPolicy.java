package com.lyz.healthplan.service.safety.policy;

import com.lyz.healthplan.model.safety.RiskFactor;
import com.lyz.healthplan.model.safety.SafetyCheck;

import java.util.List;

/**
 * 风险闸门：出现 high / very_high 风险因子即 0 分不通过，否则 100 分
 */
public class RiskGateScoringPolicy implements ScoringPolicy {

    @Override
    public ScoringPolicyType type() {
        return ScoringPolicyType.RISK_GATE;
    }

    @Override
    public ScoreOutcome score(List<SafetyCheck> checks, List<RiskFactor> riskFactors, ScoringContext context) {
        return ScoringPolicy.hasSevereRisk(riskFactors) ? GateOutcomes.failed() : GateOutcomes.passed();
    }
}
