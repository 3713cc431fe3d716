package com.lyz.healthplan.service.safety.semantic;

import com.lyz.healthplan.model.dto.EnvironmentContext;
import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.vo.PlanCandidate;
import com.lyz.healthplan.service.safety.SafetyFindings;

/**
 * 外部语义评估信号
 * 失败、空结果或格式错误时返回空 findings；抛出的异常由 SafetyAssessor 兜底
 */
public interface SemanticAssessor {

    SafetyFindings assess(PlanCandidate candidate, UserMetadata user, EnvironmentContext environment, String domainContext);
}
