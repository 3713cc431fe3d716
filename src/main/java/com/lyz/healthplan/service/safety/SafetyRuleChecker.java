package com.lyz.healthplan.service.safety;

import com.lyz.healthplan.model.dto.EnvironmentContext;
import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.vo.PlanCandidate;

/**
 * 确定性安全检查（规则、病症禁忌、环境）
 * 实现类按方案类型自行决定是否参与，结果写入 findings
 */
public interface SafetyRuleChecker {

    void check(PlanCandidate candidate, UserMetadata user, EnvironmentContext environment, SafetyFindings findings);
}
