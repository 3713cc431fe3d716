package com.lyz.healthplan.model.food;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 基础食物条目（大模型生成的未缩放份量）
 * 兼容模型输出的 food_name / portion_number / portion_unit 字段名
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class BaseFoodItem {

    @JsonAlias({"food_name", "food"})
    private String name;

    @JsonAlias({"portion_number", "amount"})
    private double quantity;

    /**
     * 单位编码，见 {@link FoodUnit}；未知编码保留原文
     */
    @JsonAlias({"portion_unit"})
    private String unit;

    /**
     * 整份热量（优先）
     */
    private Double totalCalories;

    /**
     * 单位热量（旧格式，仅在 totalCalories 缺失时使用）
     */
    private Double caloriesPerUnit;

    // 可选宏量营养素 (g)，用于蛋白/脂肪供能比检查
    private Double proteinGrams;
    private Double fatGrams;
    private Double carbsGrams;

    /**
     * 整份热量：totalCalories 优先，其次 caloriesPerUnit × quantity，都缺失为 0
     */
    public double resolveTotalCalories() {
        if (totalCalories != null) {
            return totalCalories;
        }
        if (caloriesPerUnit != null) {
            return caloriesPerUnit * quantity;
        }
        return 0.0;
    }
}
