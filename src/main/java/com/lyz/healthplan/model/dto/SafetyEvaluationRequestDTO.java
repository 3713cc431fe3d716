package com.lyz.healthplan.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.lyz.healthplan.model.exercise.ExercisePlan;
import com.lyz.healthplan.model.food.BaseFoodItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 单独评估一个已有方案
 * 饮食方案填 items（可带 meal_type），运动方案填 plan
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SafetyEvaluationRequestDTO {

    /**
     * diet / exercise
     */
    private String planType;

    private String mealType;

    @JsonAlias({"foods"})
    private List<BaseFoodItem> items;

    private ExercisePlan plan;

    @JsonAlias({"user_metadata"})
    private UserMetadata user;

    private EnvironmentContext environment;
}
