package com.lyz.healthplan.service.safety;

import com.lyz.healthplan.model.safety.RiskFactor;
import com.lyz.healthplan.model.safety.SafetyCheck;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * 各信号源产出的检查项与风险因子汇总
 */
@Getter
public class SafetyFindings {

    private final List<SafetyCheck> checks = new ArrayList<>();
    private final List<RiskFactor> riskFactors = new ArrayList<>();

    public static SafetyFindings empty() {
        return new SafetyFindings();
    }

    public SafetyFindings addCheck(SafetyCheck check) {
        checks.add(check);
        return this;
    }

    public SafetyFindings addRisk(RiskFactor riskFactor) {
        riskFactors.add(riskFactor);
        return this;
    }

    public SafetyFindings merge(SafetyFindings other) {
        if (other != null) {
            checks.addAll(other.checks);
            riskFactors.addAll(other.riskFactors);
        }
        return this;
    }

    public boolean isEmpty() {
        return checks.isEmpty() && riskFactors.isEmpty();
    }
}
