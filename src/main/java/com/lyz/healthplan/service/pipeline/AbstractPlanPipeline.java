package com.lyz.healthplan.service.pipeline;

import com.lyz.healthplan.model.dto.PlanTarget;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.model.safety.SafetyAssessment;
import com.lyz.healthplan.model.vo.GeneratedPlansVO;
import com.lyz.healthplan.model.vo.PlanCandidate;
import com.lyz.healthplan.model.vo.PlanPipelineResult;
import com.lyz.healthplan.service.generation.CandidateSource;
import com.lyz.healthplan.service.generation.GenerationRequest;
import com.lyz.healthplan.service.generation.GenerationResult;
import com.lyz.healthplan.service.safety.SafetyAssessor;
import com.lyz.healthplan.service.variant.ScaleFactorSchedule;
import com.lyz.healthplan.service.variant.VariantScale;
import com.lyz.healthplan.util.NumberUtil;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 候选方案流水线：生成 → 变体展开 → 逐个评估 → 排序 → 落盘
 *
 * @param <B> 基础方案类型
 */
@Slf4j
public abstract class AbstractPlanPipeline<B> {

    private static final Comparator<PlanCandidate> RANKING = Comparator
            .comparingInt((PlanCandidate c) -> c.getAssessment() != null ? c.getAssessment().getScore() : 0)
            .reversed()
            .thenComparingInt(PlanCandidate::getId);

    protected final CandidateSource<B> candidateSource;
    protected final SafetyAssessor safetyAssessor;
    protected final PlanArtifactStore artifactStore;

    protected AbstractPlanPipeline(CandidateSource<B> candidateSource, SafetyAssessor safetyAssessor,
                                   PlanArtifactStore artifactStore) {
        this.candidateSource = candidateSource;
        this.safetyAssessor = safetyAssessor;
        this.artifactStore = artifactStore;
    }

    protected abstract PlanType planType();

    /**
     * 本次生成的目标聚合值
     */
    protected abstract PlanTarget computeTarget(GenerationRequest request);

    /**
     * 把一个基础方案展开为各变体候选（id 由流水线统一分配）
     */
    protected abstract List<PlanCandidate> expand(B base, int baseId, List<VariantScale> scales, GenerationRequest request);

    /**
     * 相对目标的偏差百分比，目标为 0 时记 0
     */
    protected static double deviation(double total, double target) {
        if (target <= 0) {
            return 0.0;
        }
        return NumberUtil.round1((total - target) / target * 100);
    }

    /**
     * 仅生成并展开候选，不做安全评估、不落盘
     */
    public GeneratedPlansVO generateOnly(GenerationRequest request, PipelineSettings settings) {
        GeneratedCandidates generated = generateCandidates(request, settings);
        return GeneratedPlansVO.builder()
                .planType(planType())
                .mealType(request.getMealType())
                .plans(generated.getCandidates())
                .generatedAt(LocalDateTime.now())
                .build();
    }

    public PlanPipelineResult run(GenerationRequest request, PipelineSettings settings) {
        GeneratedCandidates generated = generateCandidates(request, settings);
        List<PlanCandidate> candidates = generated.getCandidates();
        String retrievalContext = generated.getRetrievalContext();
        String label = label(request);

        // ===== 4. 逐个评估 =====
        List<PlanCandidate> assessed = new ArrayList<>(candidates.size());
        Map<Integer, SafetyAssessment> assessments = new LinkedHashMap<>();
        for (PlanCandidate candidate : candidates) {
            SafetyAssessment assessment = safetyAssessor.assess(candidate, request.getUser(),
                    request.getEnvironment(), retrievalContext);
            assessed.add(candidate.withAssessment(assessment));
            assessments.put(candidate.getId(), assessment);
        }
        log.info("[{}] 安全评估完成: {} 个候选", label, assessed.size());

        // ===== 5-6. 排序取前 K =====
        List<PlanCandidate> ranked = new ArrayList<>(assessed);
        ranked.sort(RANKING);
        List<PlanCandidate> top = new ArrayList<>(ranked.subList(0, Math.min(settings.getTopK(), ranked.size())));
        if (!top.isEmpty()) {
            log.info("[{}] 排序完成: 最高分候选 id={}, score={}", label, top.get(0).getId(), top.get(0).getAssessment().getScore());
        }

        // ===== 7. 落盘 =====
        PlanPipelineResult result = PlanPipelineResult.builder()
                .planType(planType())
                .mealType(request.getMealType())
                .allPlans(assessed)
                .topPlans(top)
                .assessments(assessments)
                .generatedAt(LocalDateTime.now())
                .build();
        String artifactPath = artifactStore.write(result);
        return result.toBuilder().artifactPath(artifactPath).build();
    }

    private GeneratedCandidates generateCandidates(GenerationRequest request, PipelineSettings settings) {
        settings.validate();
        List<VariantScale> scales = ScaleFactorSchedule.build(settings.getVariantCount(),
                settings.getMinScale(), settings.getMaxScale());
        GenerationRequest effective = request.withTarget(computeTarget(request)).withRetrievalContext(null);
        String label = label(request);

        // ===== 1. 生成基础方案（检索上下文在多次调用间传递） =====
        List<B> bases = new ArrayList<>();
        String retrievalContext = null;
        for (int i = 1; i <= settings.getBasePlanCount(); i++) {
            try {
                GenerationResult<B> result = candidateSource.generate(effective.withRetrievalContext(retrievalContext));
                retrievalContext = result.getRetrievalContext();
                if (result.getCandidate() == null) {
                    log.warn("[{}] 第 {}/{} 次生成结果为空，跳过", label, i, settings.getBasePlanCount());
                    continue;
                }
                bases.add(result.getCandidate());
            } catch (RuntimeException e) {
                log.warn("[{}] 第 {}/{} 次生成失败，跳过: {}", label, i, settings.getBasePlanCount(), e.getMessage());
            }
        }
        log.info("[{}] 基础方案生成完成: 成功 {}/{}", label, bases.size(), settings.getBasePlanCount());

        // ===== 2-3. 变体展开并统一编号 =====
        List<PlanCandidate> candidates = new ArrayList<>();
        int nextId = 1;
        for (int baseIndex = 0; baseIndex < bases.size(); baseIndex++) {
            for (PlanCandidate candidate : expand(bases.get(baseIndex), baseIndex + 1, scales, effective)) {
                candidates.add(candidate.withId(nextId++));
            }
        }
        return new GeneratedCandidates(candidates, retrievalContext);
    }

    private String label(GenerationRequest request) {
        return planType().getCode() + (request.getMealType() != null ? "/" + request.getMealType().getCode() : "");
    }

    @Value
    private static class GeneratedCandidates {
        List<PlanCandidate> candidates;
        String retrievalContext;
    }
}
