package com.lyz.healthplan.model.exercise;

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
 * 运动时段（如 morning / evening）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExerciseSession {

    private String timeOfDay;

    @Builder.Default
    private List<ExerciseItem> exercises = new ArrayList<>();

    private int totalDurationMinutes;

    private int totalCaloriesBurned;

    private Intensity overallIntensity;
}
