package com.lyz.healthplan.model.vo;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.lyz.healthplan.model.food.MealType;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.model.safety.SafetyAssessment;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 一次流水线运行的返回结果
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlanPipelineResult {

    PlanType planType;

    MealType mealType;

    List<PlanCandidate> allPlans;

    List<PlanCandidate> topPlans;

    Map<Integer, SafetyAssessment> assessments;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime generatedAt;

    /**
     * 落盘文件路径，写入失败时为空
     */
    String artifactPath;

    public PlanArtifact toArtifact() {
        return PlanArtifact.builder()
                .allPlans(allPlans)
                .topPlans(topPlans)
                .assessments(assessments)
                .generatedAt(generatedAt)
                .build();
    }
}
