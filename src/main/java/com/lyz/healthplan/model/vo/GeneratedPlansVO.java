package com.lyz.healthplan.model.vo;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.lyz.healthplan.model.food.MealType;
import com.lyz.healthplan.model.safety.PlanType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 仅生成（未评估）的候选方案，可再逐个提交安全评估接口
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GeneratedPlansVO {

    PlanType planType;

    MealType mealType;

    List<PlanCandidate> plans;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime generatedAt;
}
