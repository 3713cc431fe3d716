package com.lyz.healthplan.service.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lyz.healthplan.model.dto.EnvironmentContext;
import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.food.FoodUnit;
import com.lyz.healthplan.model.vo.PlanCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Prompt 模板管理
 * System Prompt 约定输入协议与输出格式；User Prompt 为序列化后的 JSON 数据包
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PromptTemplates {

    private final ObjectMapper objectMapper;

    // ================= 饮食 =================

    public static final String DIET_SYSTEM_PROMPT = """
            你是一名专业的临床营养师。

            【输入协议】
            用户将提供一个 JSON 数据包：
            1. "profile": 用户画像（年龄、性别、身高体重、病症、饮食限制）。
            2. "meal": 本次需要生成的餐次及其目标热量 target_calories。
            3. "goal": 用户目标与补充说明。
            4. "environment": 季节与天气。
            5. "knowledge": 领域知识与禁忌（可能为空），必须严格遵守。

            【核心原则】
            1. 本餐总热量控制在 target_calories 的 ±10%% 以内。
            2. 份量使用标准单位，单位只能是 %s。
            3. 不得出现 knowledge 中列出的禁忌食物。

            【输出格式】
            请仅输出标准 JSON 数组（Array），不要包含任何解释文字：
            [
              {
                "food_name": "Oatmeal",
                "portion_number": 80,
                "portion_unit": "gram",
                "total_calories": 280,
                "protein_grams": 10,
                "fat_grams": 5,
                "carbs_grams": 48
              }
            ]
            """.formatted(FoodUnit.allowedCodes());

    public String renderDietPrompt(GenerationRequest request) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("profile", request.getUser());
        Map<String, Object> meal = new LinkedHashMap<>();
        meal.put("meal_type", request.getMealType() != null ? request.getMealType().getCode() : null);
        if (request.getTarget() != null) {
            meal.put("target_calories", request.getTarget().getMealCalories());
            meal.put("daily_calories", request.getTarget().getDailyCalories());
        }
        root.put("meal", meal);
        root.put("goal", request.getRequirement());
        root.put("environment", request.getEnvironment());
        root.put("knowledge", StringUtils.defaultString(request.getRetrievalContext()));
        return toJson(root);
    }

    // ================= 运动 =================

    public static final String EXERCISE_SYSTEM_PROMPT = """
            你是一名专业的体能训练专家。

            【输入协议】
            用户将提供一个 JSON 数据包：
            1. "profile": 用户画像（年龄、运动水平、病症）。
            2. "target": 目标消耗热量 calories_to_burn、单次时长 session_duration_minutes、每周频次 weekly_frequency。
            3. "goal": 用户目标与补充说明。
            4. "environment": 天气、季节与地点（indoor / outdoor）。
            5. "knowledge": 训练安全红线（可能为空），必须严格遵守。

            【核心原则】
            1. 总时长接近 session_duration_minutes，总消耗接近 calories_to_burn。
            2. 强度只能是 "low" / "moderate" / "high" / "very_high"。
            3. exercise_type 只能是 "cardio" / "strength" / "flexibility" / "balance" / "hiit"。

            【输出格式】
            请仅输出一个标准 JSON 对象（Object），不要包含任何解释文字：
            {
              "title": "计划标题",
              "sessions": {
                "morning": {
                  "time_of_day": "morning",
                  "exercises": [
                    {
                      "name": "Brisk Walking",
                      "exercise_type": "cardio",
                      "duration": 20,
                      "intensity": "moderate",
                      "calories_burned": 100,
                      "equipment": [],
                      "target_muscles": ["legs"],
                      "instructions": ["保持匀速"]
                    }
                  ],
                  "total_duration_minutes": 20,
                  "total_calories_burned": 100,
                  "overall_intensity": "moderate"
                }
              },
              "total_duration_minutes": 20,
              "total_calories_burned": 100,
              "weekly_frequency": 3,
              "progression": "进阶建议",
              "reasoning": "生成理由",
              "safety_notes": ["注意事项"]
            }
            """;

    public String renderExercisePrompt(GenerationRequest request) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("profile", request.getUser());
        root.put("target", request.getTarget());
        root.put("goal", request.getRequirement());
        root.put("environment", request.getEnvironment());
        root.put("knowledge", StringUtils.defaultString(request.getRetrievalContext()));
        return toJson(root);
    }

    // ================= 安全评估 =================

    public static final String SAFETY_SYSTEM_PROMPT = """
            你是一名健康方案安全评估专家，只返回合法 JSON。

            【任务】
            找出规则检查可能遗漏的安全问题：隐藏禁忌、不合理的进阶、营养缺乏、过度训练迹象、与环境不匹配。

            【输出格式】
            {
              "risk_factors": [
                {"factor": "标识", "category": "类别", "severity": "low|moderate|high|very_high",
                 "description": "描述", "recommendation": "建议"}
              ],
              "checks": [
                {"check_name": "检查项", "passed": true, "message": "说明"}
              ]
            }
            """;

    public String renderSafetyPrompt(PlanCandidate candidate, UserMetadata user, EnvironmentContext environment,
                                     String domainContext) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("plan_type", candidate.getPlanType() != null ? candidate.getPlanType().getCode() : null);
        root.put("profile", user);
        root.put("environment", environment);
        root.put("plan", candidate.withAssessment(null));
        root.put("knowledge", StringUtils.defaultString(domainContext));
        return toJson(root);
    }

    private String toJson(Map<String, Object> root) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            log.error("Prompt JSON 序列化失败", e);
            throw new IllegalStateException("Prompt JSON 序列化失败: " + e.getMessage(), e);
        }
    }
}
