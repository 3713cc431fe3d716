package com.lyz.healthplan.model.exercise;

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
 * 单个运动动作
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExerciseItem {

    private String name;

    /**
     * 运动类型：cardio / strength / flexibility / balance / hiit
     */
    @JsonAlias({"exercise_type"})
    private String type;

    @JsonAlias({"duration"})
    private int durationMinutes;

    private Intensity intensity;

    private int caloriesBurned;

    @Builder.Default
    private List<String> equipment = new ArrayList<>();

    @Builder.Default
    private List<String> targetMuscles = new ArrayList<>();

    @Builder.Default
    private List<String> instructions = new ArrayList<>();
}
