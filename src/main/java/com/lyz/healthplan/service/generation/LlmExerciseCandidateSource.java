package com.lyz.healthplan.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lyz.healthplan.common.exception.CandidateGenerationException;
import com.lyz.healthplan.model.exercise.ExerciseItem;
import com.lyz.healthplan.model.exercise.ExercisePlan;
import com.lyz.healthplan.model.exercise.ExerciseSession;
import com.lyz.healthplan.model.exercise.Intensity;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.util.JsonBlockExtractor;
import com.lyz.healthplan.util.LlmChatClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * 调用大模型生成基础运动方案
 * 强度取值非法视为结构非法，整次生成失败
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmExerciseCandidateSource implements CandidateSource<ExercisePlan> {

    private static final double TEMPERATURE = 0.7;

    private final LlmChatClient llmChatClient;
    private final KnowledgeRetriever knowledgeRetriever;
    private final PromptTemplates promptTemplates;
    private final ObjectMapper objectMapper;

    @Override
    public GenerationResult<ExercisePlan> generate(GenerationRequest request) {
        String context = request.getRetrievalContext();
        if (context == null) {
            context = knowledgeRetriever.retrieve(request.getUser(), PlanType.EXERCISE);
        }
        GenerationRequest effective = request.withRetrievalContext(context);

        String raw;
        try {
            raw = llmChatClient.chat(PromptTemplates.EXERCISE_SYSTEM_PROMPT, promptTemplates.renderExercisePrompt(effective), TEMPERATURE);
        } catch (IllegalStateException e) {
            throw new CandidateGenerationException("运动方案生成调用失败: " + e.getMessage(), e);
        }
        ExercisePlan plan = parsePlan(raw);
        if (plan.getWeeklyFrequency() <= 0 && request.getTarget() != null && request.getTarget().getWeeklyFrequency() != null) {
            plan.setWeeklyFrequency(request.getTarget().getWeeklyFrequency());
        }
        return new GenerationResult<>(plan, context);
    }

    ExercisePlan parsePlan(String raw) {
        if (StringUtils.isBlank(raw)) {
            throw new CandidateGenerationException("大模型返回为空");
        }
        ExercisePlan plan;
        try {
            JsonNode root = objectMapper.readTree(JsonBlockExtractor.extract(raw));
            if (root == null || !root.isObject()) {
                throw new CandidateGenerationException("运动方案应为 JSON 对象");
            }
            plan = objectMapper.treeToValue(root, ExercisePlan.class);
        } catch (CandidateGenerationException e) {
            throw e;
        } catch (Exception e) {
            throw new CandidateGenerationException("运动方案结构非法: " + e.getMessage(), e);
        }
        if (plan == null || plan.getSessions() == null || plan.allExercises().isEmpty()) {
            throw new CandidateGenerationException("运动方案中没有任何动作");
        }
        for (ExerciseItem item : plan.allExercises()) {
            if (StringUtils.isBlank(item.getName()) || item.getIntensity() == null || item.getDurationMinutes() <= 0) {
                throw new CandidateGenerationException("运动动作缺少名称、强度或时长: " + item.getName());
            }
        }
        normalizeTotals(plan);
        return plan;
    }

    /**
     * 以动作明细为准重算时段与方案汇总
     */
    private void normalizeTotals(ExercisePlan plan) {
        int planDuration = 0;
        int planCalories = 0;
        for (ExerciseSession session : plan.getSessions().values()) {
            if (session == null || session.getExercises() == null) {
                continue;
            }
            int duration = 0;
            int calories = 0;
            Intensity overall = Intensity.LOW;
            for (ExerciseItem item : session.getExercises()) {
                duration += item.getDurationMinutes();
                calories += item.getCaloriesBurned();
                overall = Intensity.max(overall, item.getIntensity());
            }
            session.setTotalDurationMinutes(duration);
            session.setTotalCaloriesBurned(calories);
            session.setOverallIntensity(overall);
            planDuration += duration;
            planCalories += calories;
        }
        plan.setTotalDurationMinutes(planDuration);
        plan.setTotalCaloriesBurned(planCalories);
    }
}
