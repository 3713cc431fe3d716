package com.lyz.healthplan.model.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.lyz.healthplan.model.exercise.ExercisePlan;
import com.lyz.healthplan.model.food.MealType;
import com.lyz.healthplan.model.food.ScaledFoodItem;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.model.safety.SafetyAssessment;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * 候选方案（基础方案 × 变体 展开后的一条）
 * 饮食候选填充 items，运动候选填充 plan
 */
@Value
@Builder
@With
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlanCandidate {

    Integer id;

    PlanType planType;

    String variant;

    double scaleFactor;

    /**
     * 来源基础方案序号（从 1 开始）
     */
    int baseId;

    MealType mealType;

    List<ScaledFoodItem> items;

    ExercisePlan plan;

    Double totalCalories;

    Integer totalDurationMinutes;

    /**
     * 饮食：本餐目标热量；运动：目标消耗热量
     */
    Double target;

    /**
     * 相对目标的偏差百分比
     */
    Double deviation;

    @JsonProperty("_assessment")
    SafetyAssessment assessment;
}
