package com.lyz.healthplan.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.lyz.healthplan.config.PipelineProperties;
import com.lyz.healthplan.model.dto.EnvironmentContext;
import com.lyz.healthplan.model.dto.HealthPlanRequestDTO;
import com.lyz.healthplan.model.dto.PlanGenerationRequestDTO;
import com.lyz.healthplan.model.dto.SafetyEvaluationRequestDTO;
import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.dto.UserRequirement;
import com.lyz.healthplan.model.exercise.ExerciseItem;
import com.lyz.healthplan.model.exercise.ExercisePlan;
import com.lyz.healthplan.model.food.BaseFoodItem;
import com.lyz.healthplan.model.food.MealType;
import com.lyz.healthplan.model.food.ScaledFoodItem;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.model.safety.SafetyAssessment;
import com.lyz.healthplan.model.vo.GeneratedPlansVO;
import com.lyz.healthplan.model.vo.HealthPlanResultVO;
import com.lyz.healthplan.model.vo.PlanCandidate;
import com.lyz.healthplan.model.vo.PlanPipelineResult;
import com.lyz.healthplan.service.PlanPipelineService;
import com.lyz.healthplan.service.generation.GenerationRequest;
import com.lyz.healthplan.service.pipeline.CombinedAssessmentCalculator;
import com.lyz.healthplan.service.pipeline.DietPlanPipeline;
import com.lyz.healthplan.service.pipeline.ExercisePlanPipeline;
import com.lyz.healthplan.service.pipeline.LatestPlanCache;
import com.lyz.healthplan.service.pipeline.PipelineSettings;
import com.lyz.healthplan.service.pipeline.PlanArtifactStore;
import com.lyz.healthplan.service.safety.SafetyAssessor;
import com.lyz.healthplan.util.NumberUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class PlanPipelineServiceImpl implements PlanPipelineService {

    static final int DEFAULT_MIN_SCORE = 60;

    private final DietPlanPipeline dietPlanPipeline;
    private final ExercisePlanPipeline exercisePlanPipeline;
    private final PipelineProperties pipelineProperties;
    private final PlanArtifactStore artifactStore;
    private final LatestPlanCache latestPlanCache;
    private final SafetyAssessor safetyAssessor;
    private final CombinedAssessmentCalculator combinedAssessmentCalculator;

    @Override
    public PlanPipelineResult generateDietPlans(PlanGenerationRequestDTO request) {
        PlanGenerationRequestDTO body = request != null ? request : new PlanGenerationRequestDTO();
        MealType mealType = MealType.fromCode(body.getMealType());
        if (mealType == null) {
            mealType = MealType.LUNCH;
        }
        PipelineSettings settings = resolveSettings(body.getOverrides(), pipelineProperties.getDiet());
        log.info("开始生成饮食方案: mealType={}, B={}, V={}, K={}", mealType.getCode(),
                settings.getBasePlanCount(), settings.getVariantCount(), settings.getTopK());
        PlanPipelineResult result = dietPlanPipeline.run(toGenerationRequest(body, mealType), settings);
        latestPlanCache.put(result);
        return result;
    }

    @Override
    public PlanPipelineResult generateExercisePlans(PlanGenerationRequestDTO request) {
        PlanGenerationRequestDTO body = request != null ? request : new PlanGenerationRequestDTO();
        PipelineSettings settings = resolveSettings(body.getOverrides(), pipelineProperties.getExercise());
        log.info("开始生成运动方案: B={}, V={}, K={}",
                settings.getBasePlanCount(), settings.getVariantCount(), settings.getTopK());
        PlanPipelineResult result = exercisePlanPipeline.run(toGenerationRequest(body, null), settings);
        latestPlanCache.put(result);
        return result;
    }

    @Override
    public GeneratedPlansVO generateDietOnly(PlanGenerationRequestDTO request) {
        PlanGenerationRequestDTO body = request != null ? request : new PlanGenerationRequestDTO();
        MealType mealType = MealType.fromCode(body.getMealType());
        if (mealType == null) {
            mealType = MealType.LUNCH;
        }
        PipelineSettings settings = resolveSettings(body.getOverrides(), pipelineProperties.getDiet());
        log.info("仅生成饮食方案（不评估）: mealType={}, B={}, V={}", mealType.getCode(),
                settings.getBasePlanCount(), settings.getVariantCount());
        return dietPlanPipeline.generateOnly(toGenerationRequest(body, mealType), settings);
    }

    @Override
    public GeneratedPlansVO generateExerciseOnly(PlanGenerationRequestDTO request) {
        PlanGenerationRequestDTO body = request != null ? request : new PlanGenerationRequestDTO();
        PipelineSettings settings = resolveSettings(body.getOverrides(), pipelineProperties.getExercise());
        log.info("仅生成运动方案（不评估）: B={}, V={}", settings.getBasePlanCount(), settings.getVariantCount());
        return exercisePlanPipeline.generateOnly(toGenerationRequest(body, null), settings);
    }

    @Override
    public SafetyAssessment evaluateSafety(SafetyEvaluationRequestDTO request) {
        if (request == null) {
            throw new IllegalArgumentException("评估请求不能为空");
        }
        PlanType type = PlanType.fromCode(request.getPlanType());
        PlanCandidate candidate = type == PlanType.DIET ? toDietCandidate(request) : toExerciseCandidate(request);
        UserMetadata user = request.getUser() != null ? request.getUser() : new UserMetadata();
        EnvironmentContext environment = request.getEnvironment() != null ? request.getEnvironment() : new EnvironmentContext();
        SafetyAssessment assessment = safetyAssessor.assess(candidate, user, environment, null);
        log.info("单独评估完成: type={}, score={}, safe={}", type.getCode(), assessment.getScore(), assessment.isSafe());
        return assessment;
    }

    @Override
    public HealthPlanResultVO generateHealthPlans(HealthPlanRequestDTO request) {
        HealthPlanRequestDTO body = request != null ? request : new HealthPlanRequestDTO();
        if (body.isDietOnly() && body.isExerciseOnly()) {
            throw new IllegalArgumentException("diet_only 与 exercise_only 不能同时为 true");
        }
        int minScore = body.getMinScore() != null ? body.getMinScore() : DEFAULT_MIN_SCORE;
        if (minScore < 0 || minScore > 100) {
            throw new IllegalArgumentException("min_score 必须在 0-100 之间: " + minScore);
        }
        PlanGenerationRequestDTO generation = body.toGenerationRequest();

        PlanPipelineResult diet = body.isExerciseOnly() ? null : generateDietPlans(generation);
        PlanPipelineResult exercise = body.isDietOnly() ? null : generateExercisePlans(generation);

        // 综合评估基于过滤前的全部候选
        List<SafetyAssessment> assessments = new ArrayList<>();
        collectAssessments(diet, assessments);
        collectAssessments(exercise, assessments);
        HealthPlanResultVO result = HealthPlanResultVO.builder()
                .diet(combinedAssessmentCalculator.filterByScore(diet, minScore))
                .exercise(combinedAssessmentCalculator.filterByScore(exercise, minScore))
                .combinedAssessment(combinedAssessmentCalculator.combine(assessments))
                .minScore(minScore)
                .generatedAt(LocalDateTime.now())
                .build();
        log.info("联合方案生成完成: 评估 {} 个候选, overallScore={}, minScore={}", assessments.size(),
                result.getCombinedAssessment().getOverallScore(), minScore);
        return result;
    }

    @Override
    public JsonNode getLatest(String planType, String mealType) {
        PlanType type = PlanType.fromCode(planType);
        MealType meal = type == PlanType.DIET ? MealType.fromCode(mealType) : null;
        if (type == PlanType.DIET && meal == null) {
            meal = MealType.LUNCH;
        }
        JsonNode cached = latestPlanCache.get(type, meal);
        if (cached != null) {
            return cached;
        }
        return artifactStore.read(type, meal);
    }

    /**
     * 默认配置叠加请求覆盖值，并在生成前完成校验
     */
    PipelineSettings resolveSettings(PlanGenerationRequestDTO.Overrides overrides, PipelineProperties.ScaleRange range) {
        PlanGenerationRequestDTO.Overrides o = overrides != null ? overrides : new PlanGenerationRequestDTO.Overrides();
        return PipelineSettings.builder()
                .basePlanCount(o.getBasePlanCount() != null ? o.getBasePlanCount() : pipelineProperties.getBasePlanCount())
                .variantCount(o.getVariantCount() != null ? o.getVariantCount() : pipelineProperties.getVariantCount())
                .minScale(o.getMinScale() != null ? o.getMinScale() : range.getMinScale())
                .maxScale(o.getMaxScale() != null ? o.getMaxScale() : range.getMaxScale())
                .topK(o.getTopK() != null ? o.getTopK() : pipelineProperties.getTopK())
                .build()
                .validate();
    }

    private static void collectAssessments(PlanPipelineResult result, List<SafetyAssessment> sink) {
        if (result == null || result.getAssessments() == null) {
            return;
        }
        for (Map.Entry<Integer, SafetyAssessment> entry : result.getAssessments().entrySet()) {
            sink.add(entry.getValue());
        }
    }

    /**
     * 外部提交的饮食方案按原样评估，不做份量取整
     */
    private PlanCandidate toDietCandidate(SafetyEvaluationRequestDTO request) {
        if (request.getItems() == null || request.getItems().isEmpty()) {
            throw new IllegalArgumentException("饮食方案 items 不能为空");
        }
        List<ScaledFoodItem> items = new ArrayList<>();
        double total = 0.0;
        for (BaseFoodItem item : request.getItems()) {
            double calories = item.resolveTotalCalories();
            total += calories;
            items.add(ScaledFoodItem.builder()
                    .name(item.getName())
                    .quantity(item.getQuantity())
                    .unit(item.getUnit())
                    .caloriesPerUnit(item.getQuantity() > 0 ? NumberUtil.round2(calories / item.getQuantity()) : 0.0)
                    .totalCalories(NumberUtil.round1(calories))
                    .proteinGrams(item.getProteinGrams())
                    .fatGrams(item.getFatGrams())
                    .carbsGrams(item.getCarbsGrams())
                    .build());
        }
        return PlanCandidate.builder()
                .id(1)
                .planType(PlanType.DIET)
                .scaleFactor(1.0)
                .baseId(1)
                .mealType(MealType.fromCode(request.getMealType()))
                .items(items)
                .totalCalories(NumberUtil.round1(total))
                .build();
    }

    /**
     * 方案顶层合计缺失时用全部动作合计补齐
     */
    private PlanCandidate toExerciseCandidate(SafetyEvaluationRequestDTO request) {
        ExercisePlan plan = request.getPlan();
        if (plan == null) {
            throw new IllegalArgumentException("运动方案 plan 不能为空");
        }
        int duration = plan.getTotalDurationMinutes();
        int calories = plan.getTotalCaloriesBurned();
        if (duration <= 0) {
            calories = 0;
            for (ExerciseItem item : plan.allExercises()) {
                duration += item.getDurationMinutes();
                calories += item.getCaloriesBurned();
            }
        }
        return PlanCandidate.builder()
                .id(plan.getId() != null ? plan.getId() : 1)
                .planType(PlanType.EXERCISE)
                .scaleFactor(1.0)
                .baseId(1)
                .plan(plan)
                .totalCalories((double) calories)
                .totalDurationMinutes(duration)
                .build();
    }

    private GenerationRequest toGenerationRequest(PlanGenerationRequestDTO body, MealType mealType) {
        return GenerationRequest.builder()
                .user(body.getUser() != null ? body.getUser() : new UserMetadata())
                .environment(body.getEnvironment() != null ? body.getEnvironment() : new EnvironmentContext())
                .requirement(body.getRequirement() != null ? body.getRequirement() : new UserRequirement())
                .mealType(mealType)
                .build();
    }
}
