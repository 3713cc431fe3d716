package com.lyz.healthplan.service.pipeline;

import com.lyz.healthplan.model.safety.RiskLevel;
import com.lyz.healthplan.model.safety.SafetyAssessment;
import com.lyz.healthplan.model.vo.CombinedAssessmentVO;
import com.lyz.healthplan.model.vo.PlanCandidate;
import com.lyz.healthplan.model.vo.PlanPipelineResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 联合评估：汇总饮食与运动候选的评估结果，并按最低分过滤候选
 */
@Component
public class CombinedAssessmentCalculator {

    static final String HIGH_RISK_NOTE = "Some plans have high risk. Review safety notes carefully.";
    static final String EMPTY_NOTE = "No candidates generated";

    private static final int SOURCE_ASSESSMENTS = 3;
    private static final int RECOMMENDATIONS_PER_SOURCE = 2;
    private static final int MAX_RECOMMENDATIONS = 5;

    public CombinedAssessmentVO combine(List<SafetyAssessment> assessments) {
        if (assessments == null || assessments.isEmpty()) {
            return CombinedAssessmentVO.builder()
                    .overallScore(100)
                    .safe(true)
                    .riskLevel(RiskLevel.LOW)
                    .recommendations(List.of(EMPTY_NOTE))
                    .totalAssessed(0)
                    .build();
        }

        int sum = 0;
        boolean allSafe = true;
        boolean anyHighRisk = false;
        for (SafetyAssessment assessment : assessments) {
            sum += assessment.getScore();
            allSafe &= assessment.isSafe();
            anyHighRisk |= assessment.getRiskLevel() != null && assessment.getRiskLevel().isSevere();
        }
        int overall = sum / assessments.size();

        Set<String> recommendations = new LinkedHashSet<>();
        if (anyHighRisk) {
            recommendations.add(HIGH_RISK_NOTE);
        }
        for (SafetyAssessment assessment : assessments.subList(0, Math.min(SOURCE_ASSESSMENTS, assessments.size()))) {
            List<String> own = assessment.getRecommendations();
            if (own != null) {
                recommendations.addAll(own.subList(0, Math.min(RECOMMENDATIONS_PER_SOURCE, own.size())));
            }
        }

        return CombinedAssessmentVO.builder()
                .overallScore(overall)
                .safe(allSafe)
                .riskLevel(overall >= 80 ? RiskLevel.LOW : overall >= 60 ? RiskLevel.MODERATE : RiskLevel.HIGH)
                .recommendations(recommendations.stream().limit(MAX_RECOMMENDATIONS).collect(Collectors.toList()))
                .totalAssessed(assessments.size())
                .build();
    }

    /**
     * 只保留评分不低于 minScore 的候选，assessments 同步裁剪
     */
    public PlanPipelineResult filterByScore(PlanPipelineResult result, int minScore) {
        if (result == null || minScore <= 0) {
            return result;
        }
        List<PlanCandidate> all = keep(result.getAllPlans(), minScore);
        Map<Integer, SafetyAssessment> assessments = new LinkedHashMap<>();
        for (PlanCandidate candidate : all) {
            assessments.put(candidate.getId(), candidate.getAssessment());
        }
        return result.toBuilder()
                .allPlans(all)
                .topPlans(keep(result.getTopPlans(), minScore))
                .assessments(assessments)
                .build();
    }

    private static List<PlanCandidate> keep(List<PlanCandidate> candidates, int minScore) {
        List<PlanCandidate> kept = new ArrayList<>();
        if (candidates == null) {
            return kept;
        }
        for (PlanCandidate candidate : candidates) {
            if (candidate.getAssessment() != null && candidate.getAssessment().getScore() >= minScore) {
                kept.add(candidate);
            }
        }
        return kept;
    }
}
