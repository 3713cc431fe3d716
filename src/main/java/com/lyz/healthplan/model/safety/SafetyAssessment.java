package com.lyz.healthplan.model.safety;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 单个候选方案的安全评估结果（生成后不可变）
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SafetyAssessment {

    /**
     * 0-100
     */
    int score;

    @JsonProperty("is_safe")
    boolean safe;

    AssessmentStatus status;

    RiskLevel riskLevel;

    @Singular
    List<RiskFactor> riskFactors;

    @Singular
    List<SafetyCheck> safetyChecks;

    @Singular
    List<String> recommendations;

    @Singular
    List<String> warnings;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime assessedAt;
}
