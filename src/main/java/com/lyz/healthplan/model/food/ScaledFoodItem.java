package com.lyz.healthplan.model.food;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * 变体中的食物条目（缩放后）
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScaledFoodItem {

    String name;
    double quantity;
    String unit;
    double caloriesPerUnit;
    double totalCalories;

    Double proteinGrams;
    Double fatGrams;
    Double carbsGrams;

    @JsonProperty("_variant")
    String variant;
}
