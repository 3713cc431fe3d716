package com.lyz.healthplan.model.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.lyz.healthplan.model.safety.RiskLevel;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 饮食 + 运动全部候选的综合评估
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CombinedAssessmentVO {

    /**
     * 全部评估分数的平均值（向下取整）
     */
    int overallScore;

    @JsonProperty("is_safe")
    boolean safe;

    /**
     * 只取 low / moderate / high 三档
     */
    RiskLevel riskLevel;

    List<String> recommendations;

    int totalAssessed;
}
