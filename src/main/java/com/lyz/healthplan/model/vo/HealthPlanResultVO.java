package com.lyz.healthplan.model.vo;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 饮食与运动联合生成结果
 * diet / exercise 未生成时为空
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthPlanResultVO {

    PlanPipelineResult diet;

    PlanPipelineResult exercise;

    CombinedAssessmentVO combinedAssessment;

    /**
     * 候选过滤使用的最低分
     */
    int minScore;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime generatedAt;
}
