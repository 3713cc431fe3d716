package com.lyz.healthplan.model.vo;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.lyz.healthplan.model.safety.SafetyAssessment;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 落盘的 JSON 结构：{all_plans, top_plans, assessments, generated_at}
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PlanArtifact {

    List<PlanCandidate> allPlans;

    List<PlanCandidate> topPlans;

    Map<Integer, SafetyAssessment> assessments;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime generatedAt;
}
