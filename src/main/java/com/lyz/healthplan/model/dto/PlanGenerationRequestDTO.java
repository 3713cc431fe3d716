package com.lyz.healthplan.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 生成方案请求体
 * overrides 为空的字段使用 plan.pipeline.* 默认配置
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlanGenerationRequestDTO {

    private UserMetadata user;

    private EnvironmentContext environment;

    private UserRequirement requirement;

    /**
     * 仅饮食方案使用，默认 lunch
     */
    private String mealType;

    private Overrides overrides;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Overrides {
        private Integer basePlanCount;
        private Integer variantCount;
        private Double minScale;
        private Double maxScale;
        private Integer topK;
    }
}
