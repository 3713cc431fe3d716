package com.lyz.healthplan.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 用户本次的需求
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserRequirement {

    /**
     * weight_loss / muscle_building / weight_gain / cardio_improvement / flexibility /
     * endurance / general_fitness / maintenance
     */
    private String goal;

    private String intensity;

    private Integer durationMinutes;

    /**
     * 自由文本补充描述
     */
    private String query;
}
