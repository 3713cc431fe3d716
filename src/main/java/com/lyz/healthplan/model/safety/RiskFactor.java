package com.lyz.healthplan.model.safety;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * 风险因子
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RiskFactor {

    /**
     * 因子标识，如 extremely_low_calories / diabetes_avoid_high_sugar
     */
    String factor;

    /**
     * nutritional / physical / medical / environmental / semantic
     */
    String category;

    RiskLevel severity;

    String description;

    String recommendation;
}
