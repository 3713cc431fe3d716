package com.lyz.healthplan.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * 单次生成的目标聚合值
 * 饮食：全天/本餐目标热量；运动：目标消耗、单次时长、每周频次
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlanTarget {

    Integer dailyCalories;

    Integer mealCalories;

    Integer caloriesToBurn;

    Integer sessionDurationMinutes;

    Integer weeklyFrequency;

    Double bmr;

    Double tdee;
}
