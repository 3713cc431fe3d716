package com.lyz.healthplan.service.safety.policy;

import com.lyz.healthplan.model.safety.AssessmentStatus;
import com.lyz.healthplan.model.safety.RiskLevel;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 评分策略的输出
 */
@Value
@Builder
public class ScoreOutcome {
    int score;
    boolean safe;
    AssessmentStatus status;
    RiskLevel riskLevel;
    List<String> recommendations;
}
