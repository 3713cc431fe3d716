package com.lyz.healthplan.service.pipeline;

import com.lyz.healthplan.model.dto.PlanTarget;
import com.lyz.healthplan.model.exercise.ExercisePlan;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.model.vo.PlanCandidate;
import com.lyz.healthplan.service.generation.CandidateSource;
import com.lyz.healthplan.service.generation.GenerationRequest;
import com.lyz.healthplan.service.generation.TargetCalculator;
import com.lyz.healthplan.service.safety.SafetyAssessor;
import com.lyz.healthplan.service.variant.ExerciseVariantExpander;
import com.lyz.healthplan.service.variant.VariantScale;
import com.lyz.healthplan.util.NumberUtil;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 运动方案流水线
 */
@Component
public class ExercisePlanPipeline extends AbstractPlanPipeline<ExercisePlan> {

    private final ExerciseVariantExpander variantExpander;
    private final TargetCalculator targetCalculator;

    public ExercisePlanPipeline(CandidateSource<ExercisePlan> candidateSource,
                                SafetyAssessor safetyAssessor,
                                PlanArtifactStore artifactStore,
                                ExerciseVariantExpander variantExpander,
                                TargetCalculator targetCalculator) {
        super(candidateSource, safetyAssessor, artifactStore);
        this.variantExpander = variantExpander;
        this.targetCalculator = targetCalculator;
    }

    @Override
    protected PlanType planType() {
        return PlanType.EXERCISE;
    }

    @Override
    protected PlanTarget computeTarget(GenerationRequest request) {
        return targetCalculator.exerciseTarget(request.getUser(), request.getRequirement());
    }

    @Override
    protected List<PlanCandidate> expand(ExercisePlan base, int baseId, List<VariantScale> scales,
                                         GenerationRequest request) {
        Map<String, ExercisePlan> variants = variantExpander.expand(base, scales);
        PlanTarget target = request.getTarget();
        double targetCalories = target != null && target.getCaloriesToBurn() != null ? target.getCaloriesToBurn() : 0.0;
        List<PlanCandidate> candidates = new ArrayList<>();
        for (VariantScale scale : scales) {
            ExercisePlan plan = variants.get(scale.getName());
            double burned = plan.getTotalCaloriesBurned();
            candidates.add(PlanCandidate.builder()
                    .planType(PlanType.EXERCISE)
                    .variant(scale.getName())
                    .scaleFactor(NumberUtil.round(scale.getFactor(), 4))
                    .baseId(baseId)
                    .plan(plan)
                    .totalCalories(burned)
                    .totalDurationMinutes(plan.getTotalDurationMinutes())
                    .target(targetCalories)
                    .deviation(deviation(burned, targetCalories))
                    .build());
        }
        return candidates;
    }
}
