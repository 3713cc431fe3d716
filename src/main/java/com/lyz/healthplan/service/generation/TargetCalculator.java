package com.lyz.healthplan.service.generation;

import com.lyz.healthplan.model.dto.PlanTarget;
import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.dto.UserRequirement;
import com.lyz.healthplan.model.food.MealType;
import com.lyz.healthplan.util.NumberUtil;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 目标聚合值计算
 * 饮食基于 Mifflin-St Jeor 公式；运动按目标、运动水平与病症给出消耗/时长/频次
 */
@Component
public class TargetCalculator {

    private static final List<String> REDUCED_LOAD_CONDITIONS = List.of("heart_disease", "obesity", "arthritis");
    private static final double REDUCED_LOAD_FACTOR = 0.75;

    // ===== 饮食 =====

    public PlanTarget dietTarget(UserMetadata user, UserRequirement requirement, MealType mealType) {
        // 1. 基础数据与默认值
        double weight = user != null && user.getWeightKg() != null ? user.getWeightKg() : 70.0;
        double height = user != null && user.getHeightCm() != null ? user.getHeightCm() : 170.0;
        int age = user != null && user.getAge() != null ? user.getAge() : 30;
        boolean female = user != null && StringUtils.equalsIgnoreCase(StringUtils.trim(user.getGender()), "female");

        // 2. BMR (Mifflin-St Jeor)
        // Men: 10W + 6.25H - 5A + 5
        // Women: 10W + 6.25H - 5A - 161
        double bmr = (10 * weight) + (6.25 * height) - (5 * age);
        bmr += female ? -161 : 5;

        // 3. TDEE
        double tdee = bmr * activityMultiplier(user != null ? user.getFitnessLevel() : null);

        // 4. 按目标调整
        int daily = NumberUtil.roundToInt(adjustCaloriesByGoal(tdee, goalOf(requirement)));

        PlanTarget.PlanTargetBuilder builder = PlanTarget.builder()
                .dailyCalories(daily)
                .bmr(NumberUtil.round1(bmr))
                .tdee(NumberUtil.round1(tdee));
        if (mealType != null) {
            builder.mealCalories((int) (daily * mealType.getDailyShare()));
        }
        return builder.build();
    }

    private double activityMultiplier(String fitnessLevel) {
        return switch (normalize(fitnessLevel)) {
            case "beginner" -> 1.375;
            case "intermediate" -> 1.55;
            case "advanced" -> 1.725;
            default -> 1.2;
        };
    }

    private double adjustCaloriesByGoal(double tdee, String goal) {
        return switch (goal) {
            // 减脂：15% 热量缺口
            case "weight_loss" -> tdee * 0.85;
            // 增肌/增重：10% 盈余
            case "muscle_building", "weight_gain" -> tdee * 1.10;
            default -> tdee;
        };
    }

    // ===== 运动 =====

    public PlanTarget exerciseTarget(UserMetadata user, UserRequirement requirement) {
        String level = normalize(user != null ? user.getFitnessLevel() : null);
        String goal = goalOf(requirement);
        List<String> conditions = user != null && user.getMedicalConditions() != null
                ? user.getMedicalConditions() : List.of();

        int duration = requirement != null && requirement.getDurationMinutes() != null && requirement.getDurationMinutes() > 0
                ? requirement.getDurationMinutes()
                : sessionDuration(level, goal);

        return PlanTarget.builder()
                .caloriesToBurn(caloriesToBurn(goal, conditions))
                .sessionDurationMinutes(duration)
                .weeklyFrequency(weeklyFrequency(level, goal, conditions))
                .build();
    }

    int caloriesToBurn(String goal, List<String> conditions) {
        int base = switch (goal) {
            case "weight_loss", "endurance" -> 400;
            case "muscle_building" -> 200;
            case "cardio_improvement" -> 450;
            case "flexibility" -> 100;
            case "maintenance" -> 150;
            default -> 250;
        };
        boolean reduced = conditions.stream().map(this::normalize).anyMatch(REDUCED_LOAD_CONDITIONS::contains);
        return (int) (base * (reduced ? REDUCED_LOAD_FACTOR : 1.0));
    }

    int sessionDuration(String level, String goal) {
        int base = switch (level) {
            case "beginner" -> 20;
            case "intermediate" -> 40;
            case "advanced" -> 60;
            default -> 30;
        };
        double multiplier = switch (goal) {
            case "muscle_building" -> 0.85;
            case "cardio_improvement" -> 1.1;
            case "flexibility" -> 0.7;
            case "maintenance" -> 0.9;
            default -> 1.0;
        };
        return (int) (base * multiplier);
    }

    int weeklyFrequency(String level, String goal, List<String> conditions) {
        int frequency = switch (level) {
            case "intermediate" -> 4;
            case "advanced" -> 5;
            default -> 3;
        };
        frequency += switch (goal) {
            case "weight_loss", "cardio_improvement", "endurance" -> 1;
            case "maintenance" -> -1;
            default -> 0;
        };
        for (String condition : conditions) {
            String normalized = normalize(condition);
            if (normalized.contains("heart_disease")) {
                frequency = Math.max(1, frequency - 2);
            } else if (normalized.contains("obesity") || normalized.contains("arthritis")) {
                frequency = Math.max(1, frequency - 1);
            }
        }
        return Math.max(1, Math.min(7, frequency));
    }

    private String goalOf(UserRequirement requirement) {
        String goal = normalize(requirement != null ? requirement.getGoal() : null);
        return goal.isEmpty() ? "maintenance" : goal;
    }

    private String normalize(String value) {
        return StringUtils.defaultString(value).trim().toLowerCase().replace(' ', '_').replace('-', '_');
    }
}
