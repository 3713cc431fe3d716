package com.lyz.healthplan.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 饮食 + 运动联合生成请求
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class HealthPlanRequestDTO {

    private UserMetadata user;

    private EnvironmentContext environment;

    private UserRequirement requirement;

    private String mealType;

    private PlanGenerationRequestDTO.Overrides overrides;

    private boolean dietOnly;

    private boolean exerciseOnly;

    /**
     * 低于该分数的候选被过滤掉，默认 60，0 表示不过滤
     */
    private Integer minScore;

    public PlanGenerationRequestDTO toGenerationRequest() {
        return PlanGenerationRequestDTO.builder()
                .user(user)
                .environment(environment)
                .requirement(requirement)
                .mealType(mealType)
                .overrides(overrides)
                .build();
    }
}
