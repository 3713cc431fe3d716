package com.lyz.healthplan.service.safety.policy;

import com.lyz.healthplan.model.safety.AssessmentStatus;
import com.lyz.healthplan.model.safety.RiskLevel;

import java.util.ArrayList;

/**
 * 闸门类策略共用的两种结果
 */
final class GateOutcomes {

    private GateOutcomes() {
    }

    static ScoreOutcome passed() {
        return ScoreOutcome.builder()
                .score(100)
                .safe(true)
                .status(AssessmentStatus.PASSED)
                .riskLevel(RiskLevel.LOW)
                .recommendations(new ArrayList<>())
                .build();
    }

    static ScoreOutcome failed() {
        return ScoreOutcome.builder()
                .score(0)
                .safe(false)
                .status(AssessmentStatus.FAILED)
                .riskLevel(RiskLevel.VERY_HIGH)
                .recommendations(new ArrayList<>())
                .build();
    }
}
