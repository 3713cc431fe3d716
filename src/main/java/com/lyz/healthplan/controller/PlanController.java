package com.lyz.healthplan.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.lyz.healthplan.common.Result;
import com.lyz.healthplan.model.dto.HealthPlanRequestDTO;
import com.lyz.healthplan.model.dto.PlanGenerationRequestDTO;
import com.lyz.healthplan.model.dto.SafetyEvaluationRequestDTO;
import com.lyz.healthplan.model.safety.SafetyAssessment;
import com.lyz.healthplan.model.vo.GeneratedPlansVO;
import com.lyz.healthplan.model.vo.HealthPlanResultVO;
import com.lyz.healthplan.model.vo.PlanPipelineResult;
import com.lyz.healthplan.service.PlanPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 健康方案候选接口
 */
@RestController
@RequestMapping("/api/plan")
@Slf4j
@RequiredArgsConstructor
public class PlanController {

    private final PlanPipelineService planPipelineService;

    /**
     * 生成单餐饮食候选并排序
     */
    @PostMapping("/diet")
    public Result<PlanPipelineResult> generateDiet(@RequestBody(required = false) PlanGenerationRequestDTO request) {
        PlanPipelineResult result = planPipelineService.generateDietPlans(request);
        return Result.success("生成成功", result);
    }

    /**
     * 生成运动候选并排序
     */
    @PostMapping("/exercise")
    public Result<PlanPipelineResult> generateExercise(@RequestBody(required = false) PlanGenerationRequestDTO request) {
        PlanPipelineResult result = planPipelineService.generateExercisePlans(request);
        return Result.success("生成成功", result);
    }

    @PostMapping("/diet/generate-only")
    public Result<GeneratedPlansVO> generateDietOnly(@RequestBody(required = false) PlanGenerationRequestDTO request) {
        return Result.success("生成成功", planPipelineService.generateDietOnly(request));
    }

    @PostMapping("/exercise/generate-only")
    public Result<GeneratedPlansVO> generateExerciseOnly(@RequestBody(required = false) PlanGenerationRequestDTO request) {
        return Result.success("生成成功", planPipelineService.generateExerciseOnly(request));
    }

    /**
     * 评估单个已有方案（不生成新方案）
     */
    @PostMapping("/safety/evaluate")
    public Result<SafetyAssessment> evaluateSafety(@RequestBody SafetyEvaluationRequestDTO request) {
        log.info("单独安全评估: planType={}", request.getPlanType());
        return Result.success("评估完成", planPipelineService.evaluateSafety(request));
    }

    /**
     * 饮食 + 运动联合生成
     */
    @PostMapping("/health")
    public Result<HealthPlanResultVO> generateHealth(@RequestBody(required = false) HealthPlanRequestDTO request) {
        return Result.success("生成成功", planPipelineService.generateHealthPlans(request));
    }

    /**
     * 最近一次运行结果
     */
    @GetMapping("/latest")
    public Result<JsonNode> getLatest(@RequestParam(name = "type") String type,
                                      @RequestParam(name = "mealType", required = false) String mealType) {
        log.info("获取最近一次方案结果: type={}, mealType={}", type, mealType);
        return Result.success("获取成功", planPipelineService.getLatest(type, mealType));
    }
}
