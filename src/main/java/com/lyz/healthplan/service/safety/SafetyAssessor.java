package com.lyz.healthplan.service.safety;

import com.lyz.healthplan.config.SafetyProperties;
import com.lyz.healthplan.model.dto.EnvironmentContext;
import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.safety.RiskFactor;
import com.lyz.healthplan.model.safety.SafetyAssessment;
import com.lyz.healthplan.model.vo.PlanCandidate;
import com.lyz.healthplan.service.safety.policy.ScoreOutcome;
import com.lyz.healthplan.service.safety.policy.ScoringContext;
import com.lyz.healthplan.service.safety.policy.ScoringPolicy;
import com.lyz.healthplan.service.safety.semantic.SemanticAssessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 安全评估入口
 * 汇总规则、病症禁忌、环境与语义四类信号后，交给当前生效的评分策略打分
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SafetyAssessor {

    private final List<SafetyRuleChecker> ruleCheckers;
    private final SemanticAssessor semanticAssessor;
    private final ScoringPolicy scoringPolicy;
    private final SafetyProperties safetyProperties;

    public SafetyAssessment assess(PlanCandidate candidate, UserMetadata user, EnvironmentContext environment,
                                   String domainContext) {
        SafetyFindings findings = SafetyFindings.empty();

        // 1. 确定性检查（规则 → 病症禁忌 → 环境）
        for (SafetyRuleChecker checker : ruleCheckers) {
            checker.check(candidate, user, environment, findings);
        }

        // 2. 语义信号，失败时不贡献结果
        if (safetyProperties.isSemanticEnabled()) {
            try {
                findings.merge(semanticAssessor.assess(candidate, user, environment, domainContext));
            } catch (RuntimeException e) {
                log.warn("候选方案 {} 语义评估失败，忽略该信号: {}", candidate.getId(), e.getMessage());
            }
        }

        // 3. 评分
        ScoringContext context = ScoringContext.builder()
                .planType(candidate.getPlanType())
                .user(user)
                .build();
        ScoreOutcome outcome = scoringPolicy.score(findings.getChecks(), findings.getRiskFactors(), context);

        List<String> warnings = findings.getRiskFactors().stream()
                .filter(rf -> rf.getSeverity() != null && rf.getSeverity().isSevere())
                .map(RiskFactor::getDescription)
                .collect(Collectors.toList());

        SafetyAssessment assessment = SafetyAssessment.builder()
                .score(outcome.getScore())
                .safe(outcome.isSafe())
                .status(outcome.getStatus())
                .riskLevel(outcome.getRiskLevel())
                .riskFactors(findings.getRiskFactors())
                .safetyChecks(findings.getChecks())
                .recommendations(outcome.getRecommendations())
                .warnings(warnings)
                .assessedAt(LocalDateTime.now())
                .build();
        log.debug("候选方案 {} 评估完成: policy={}, score={}, safe={}, risks={}",
                candidate.getId(), scoringPolicy.type().getCode(), assessment.getScore(), assessment.isSafe(),
                findings.getRiskFactors().size());
        return assessment;
    }
}
