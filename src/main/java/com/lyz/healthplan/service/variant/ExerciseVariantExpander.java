package com.lyz.healthplan.service.variant;

import com.lyz.healthplan.model.exercise.ExerciseItem;
import com.lyz.healthplan.model.exercise.ExercisePlan;
import com.lyz.healthplan.model.exercise.ExerciseSession;
import com.lyz.healthplan.model.exercise.Intensity;
import com.lyz.healthplan.util.NumberUtil;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 运动变体展开
 * 按系数缩放时长与消耗，并按系数方向调整强度
 */
@Component
public class ExerciseVariantExpander {

    /**
     * 单个动作的最短时长（分钟）
     */
    public static final int MIN_DURATION_MINUTES = 5;

    public LinkedHashMap<String, ExercisePlan> expand(ExercisePlan basePlan, int count,
                                                      double minScale, double maxScale) {
        return expand(basePlan, ScaleFactorSchedule.build(count, minScale, maxScale));
    }

    public LinkedHashMap<String, ExercisePlan> expand(ExercisePlan basePlan, List<VariantScale> scales) {
        LinkedHashMap<String, ExercisePlan> variants = new LinkedHashMap<>();
        for (VariantScale scale : scales) {
            variants.put(scale.getName(), scalePlan(basePlan, scale.getFactor(), scale.getName()));
        }
        return variants;
    }

    public ExercisePlan scalePlan(ExercisePlan basePlan, double factor, String variantName) {
        LinkedHashMap<String, ExerciseSession> sessions = new LinkedHashMap<>();
        int totalDuration = 0;
        int totalCalories = 0;
        if (basePlan.getSessions() != null) {
            for (Map.Entry<String, ExerciseSession> entry : basePlan.getSessions().entrySet()) {
                ExerciseSession scaled = scaleSession(entry.getValue(), factor);
                sessions.put(entry.getKey(), scaled);
                totalDuration += scaled.getTotalDurationMinutes();
                totalCalories += scaled.getTotalCaloriesBurned();
            }
        }
        String title = StringUtils.defaultString(basePlan.getTitle()) + " (" + variantName + ")";
        return basePlan.toBuilder()
                .title(title.trim())
                .sessions(sessions)
                .totalDurationMinutes(totalDuration)
                .totalCaloriesBurned(totalCalories)
                .safetyNotes(basePlan.getSafetyNotes() != null ? new ArrayList<>(basePlan.getSafetyNotes()) : new ArrayList<>())
                .build();
    }

    private ExerciseSession scaleSession(ExerciseSession session, double factor) {
        List<ExerciseItem> exercises = new ArrayList<>();
        int duration = 0;
        int calories = 0;
        Intensity overall = Intensity.LOW;
        if (session != null && session.getExercises() != null) {
            for (ExerciseItem item : session.getExercises()) {
                ExerciseItem scaled = scaleItem(item, factor);
                exercises.add(scaled);
                duration += scaled.getDurationMinutes();
                calories += scaled.getCaloriesBurned();
                if (scaled.getIntensity() != null) {
                    overall = Intensity.max(overall, scaled.getIntensity());
                }
            }
        }
        return ExerciseSession.builder()
                .timeOfDay(session != null ? session.getTimeOfDay() : null)
                .exercises(exercises)
                .totalDurationMinutes(duration)
                .totalCaloriesBurned(calories)
                .overallIntensity(overall)
                .build();
    }

    public ExerciseItem scaleItem(ExerciseItem item, double factor) {
        int duration = item.getDurationMinutes();
        int newDuration = Math.max(MIN_DURATION_MINUTES, NumberUtil.roundToInt(duration * factor));
        int newCalories = duration > 0
                ? NumberUtil.roundToInt((double) item.getCaloriesBurned() * newDuration / duration)
                : item.getCaloriesBurned();
        return item.toBuilder()
                .durationMinutes(newDuration)
                .caloriesBurned(newCalories)
                .intensity(remapIntensity(item.getIntensity(), factor))
                .equipment(copy(item.getEquipment()))
                .targetMuscles(copy(item.getTargetMuscles()))
                .instructions(copy(item.getInstructions()))
                .build();
    }

    /**
     * 系数 < 1 降一档（最低 low），= 1 不变，> 1 升一档（最高 very_high）
     */
    public Intensity remapIntensity(Intensity intensity, double factor) {
        if (intensity == null || factor == 1.0) {
            return intensity;
        }
        if (factor < 1.0) {
            return switch (intensity) {
                case VERY_HIGH -> Intensity.HIGH;
                case HIGH -> Intensity.MODERATE;
                case MODERATE, LOW -> Intensity.LOW;
            };
        }
        return switch (intensity) {
            case LOW -> Intensity.MODERATE;
            case MODERATE -> Intensity.HIGH;
            case HIGH, VERY_HIGH -> Intensity.VERY_HIGH;
        };
    }

    private List<String> copy(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }
}
