package com.lyz.healthplan.service.generation;

import com.lyz.healthplan.model.dto.EnvironmentContext;
import com.lyz.healthplan.model.dto.PlanTarget;
import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.dto.UserRequirement;
import com.lyz.healthplan.model.food.MealType;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * 单次基础方案生成的输入
 * retrievalContext 为空表示尚未检索，由生成器负责检索并在结果中带回
 */
@Value
@Builder
@With
public class GenerationRequest {
    UserMetadata user;
    EnvironmentContext environment;
    UserRequirement requirement;
    MealType mealType;
    PlanTarget target;
    String retrievalContext;
}
