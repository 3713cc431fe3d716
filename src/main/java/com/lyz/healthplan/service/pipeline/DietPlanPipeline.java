package com.lyz.healthplan.service.pipeline;

import com.lyz.healthplan.model.dto.PlanTarget;
import com.lyz.healthplan.model.food.BaseFoodItem;
import com.lyz.healthplan.model.food.ScaledFoodItem;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.model.vo.PlanCandidate;
import com.lyz.healthplan.service.generation.CandidateSource;
import com.lyz.healthplan.service.generation.GenerationRequest;
import com.lyz.healthplan.service.generation.TargetCalculator;
import com.lyz.healthplan.service.safety.SafetyAssessor;
import com.lyz.healthplan.service.variant.DietVariantExpander;
import com.lyz.healthplan.service.variant.VariantScale;
import com.lyz.healthplan.util.NumberUtil;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 单餐饮食方案流水线
 */
@Component
public class DietPlanPipeline extends AbstractPlanPipeline<List<BaseFoodItem>> {

    private final DietVariantExpander variantExpander;
    private final TargetCalculator targetCalculator;

    public DietPlanPipeline(CandidateSource<List<BaseFoodItem>> candidateSource,
                            SafetyAssessor safetyAssessor,
                            PlanArtifactStore artifactStore,
                            DietVariantExpander variantExpander,
                            TargetCalculator targetCalculator) {
        super(candidateSource, safetyAssessor, artifactStore);
        this.variantExpander = variantExpander;
        this.targetCalculator = targetCalculator;
    }

    @Override
    protected PlanType planType() {
        return PlanType.DIET;
    }

    @Override
    protected PlanTarget computeTarget(GenerationRequest request) {
        return targetCalculator.dietTarget(request.getUser(), request.getRequirement(), request.getMealType());
    }

    @Override
    protected List<PlanCandidate> expand(List<BaseFoodItem> base, int baseId, List<VariantScale> scales,
                                         GenerationRequest request) {
        Map<String, List<ScaledFoodItem>> variants = variantExpander.expand(base, scales);
        double target = resolveTarget(request.getTarget());
        List<PlanCandidate> candidates = new ArrayList<>();
        for (VariantScale scale : scales) {
            List<ScaledFoodItem> items = variants.get(scale.getName());
            double total = NumberUtil.round1(items.stream().mapToDouble(ScaledFoodItem::getTotalCalories).sum());
            candidates.add(PlanCandidate.builder()
                    .planType(PlanType.DIET)
                    .variant(scale.getName())
                    .scaleFactor(NumberUtil.round(scale.getFactor(), 4))
                    .baseId(baseId)
                    .mealType(request.getMealType())
                    .items(items)
                    .totalCalories(total)
                    .target(target)
                    .deviation(deviation(total, target))
                    .build());
        }
        return candidates;
    }

    /**
     * 本餐目标优先，未指定餐次时用全天目标
     */
    private double resolveTarget(PlanTarget target) {
        if (target == null) {
            return 0.0;
        }
        if (target.getMealCalories() != null) {
            return target.getMealCalories();
        }
        return target.getDailyCalories() != null ? target.getDailyCalories() : 0.0;
    }
}
