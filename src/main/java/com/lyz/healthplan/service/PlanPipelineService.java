package com.lyz.healthplan.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.lyz.healthplan.model.dto.HealthPlanRequestDTO;
import com.lyz.healthplan.model.dto.PlanGenerationRequestDTO;
import com.lyz.healthplan.model.dto.SafetyEvaluationRequestDTO;
import com.lyz.healthplan.model.safety.SafetyAssessment;
import com.lyz.healthplan.model.vo.GeneratedPlansVO;
import com.lyz.healthplan.model.vo.HealthPlanResultVO;
import com.lyz.healthplan.model.vo.PlanPipelineResult;

public interface PlanPipelineService {

    /**
     * 生成单餐饮食候选（默认 lunch）
     */
    PlanPipelineResult generateDietPlans(PlanGenerationRequestDTO request);

    PlanPipelineResult generateExercisePlans(PlanGenerationRequestDTO request);

    /**
     * 只生成不评估
     */
    GeneratedPlansVO generateDietOnly(PlanGenerationRequestDTO request);

    GeneratedPlansVO generateExerciseOnly(PlanGenerationRequestDTO request);

    /**
     * 对单个已有方案做安全评估
     */
    SafetyAssessment evaluateSafety(SafetyEvaluationRequestDTO request);

    /**
     * 饮食 + 运动联合生成，附综合评估并按最低分过滤
     */
    HealthPlanResultVO generateHealthPlans(HealthPlanRequestDTO request);

    /**
     * 最近一次运行结果：优先读缓存，其次读落盘文件；都没有返回 null
     */
    JsonNode getLatest(String planType, String mealType);
}
