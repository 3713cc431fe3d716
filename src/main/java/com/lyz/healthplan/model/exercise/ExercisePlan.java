package com.lyz.healthplan.model.exercise;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 完整运动方案
 * 既用于大模型生成的基础方案，也用于缩放后的变体方案
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExercisePlan {

    private Integer id;

    private String title;

    /**
     * 按时段有序排列
     */
    @Builder.Default
    private LinkedHashMap<String, ExerciseSession> sessions = new LinkedHashMap<>();

    private int totalDurationMinutes;

    private int totalCaloriesBurned;

    /**
     * 每周建议训练次数
     */
    @Builder.Default
    private int weeklyFrequency = 3;

    private String progression;

    private String reasoning;

    @Builder.Default
    private List<String> safetyNotes = new ArrayList<>();

    /**
     * 遍历全部动作（按时段顺序）
     */
    public List<ExerciseItem> allExercises() {
        List<ExerciseItem> all = new ArrayList<>();
        if (sessions == null) {
            return all;
        }
        for (Map.Entry<String, ExerciseSession> entry : sessions.entrySet()) {
            ExerciseSession session = entry.getValue();
            if (session != null && session.getExercises() != null) {
                all.addAll(session.getExercises());
            }
        }
        return all;
    }
}
