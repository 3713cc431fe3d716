package com.lyz.healthplan.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 用户画像
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserMetadata {

    private Integer age;

    /**
     * male / female
     */
    private String gender;

    @JsonAlias({"height"})
    private Double heightCm;

    @JsonAlias({"weight"})
    private Double weightKg;

    /**
     * beginner / intermediate / advanced
     */
    private String fitnessLevel;

    @Builder.Default
    private List<String> medicalConditions = new ArrayList<>();

    @Builder.Default
    private List<String> dietaryRestrictions = new ArrayList<>();

    public boolean hasConditions() {
        return medicalConditions != null && !medicalConditions.isEmpty();
    }
}
