package com.lyz.healthplan.service.safety.semantic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lyz.healthplan.model.dto.EnvironmentContext;
import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.safety.RiskFactor;
import com.lyz.healthplan.model.safety.RiskLevel;
import com.lyz.healthplan.model.safety.SafetyCheck;
import com.lyz.healthplan.model.vo.PlanCandidate;
import com.lyz.healthplan.service.generation.PromptTemplates;
import com.lyz.healthplan.service.safety.SafetyFindings;
import com.lyz.healthplan.util.JsonBlockExtractor;
import com.lyz.healthplan.util.LlmChatClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * 基于大模型的语义安全评估
 * 解析宽松：不合规的条目直接丢弃，整体失败时不贡献任何结果
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmSemanticAssessor implements SemanticAssessor {

    private static final double TEMPERATURE = 0.3;

    private final LlmChatClient llmChatClient;
    private final PromptTemplates promptTemplates;
    private final ObjectMapper objectMapper;

    @Override
    public SafetyFindings assess(PlanCandidate candidate, UserMetadata user, EnvironmentContext environment,
                                 String domainContext) {
        if (!llmChatClient.isConfigured()) {
            log.debug("未配置大模型，跳过语义评估, candidateId={}", candidate.getId());
            return SafetyFindings.empty();
        }
        try {
            String prompt = promptTemplates.renderSafetyPrompt(candidate, user, environment, domainContext);
            String raw = llmChatClient.chat(PromptTemplates.SAFETY_SYSTEM_PROMPT, prompt, TEMPERATURE);
            return parse(raw);
        } catch (Exception e) {
            log.warn("语义评估失败，忽略该信号, candidateId={}, reason={}", candidate.getId(), e.getMessage());
            return SafetyFindings.empty();
        }
    }

    SafetyFindings parse(String raw) {
        SafetyFindings findings = SafetyFindings.empty();
        if (StringUtils.isBlank(raw)) {
            return findings;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(JsonBlockExtractor.extract(raw));
        } catch (Exception e) {
            log.warn("语义评估结果不是合法 JSON，忽略: {}", e.getMessage());
            return findings;
        }
        if (root == null || !root.isObject()) {
            return findings;
        }
        for (JsonNode node : root.path("risk_factors")) {
            RiskFactor riskFactor = toRiskFactor(node);
            if (riskFactor != null) {
                findings.addRisk(riskFactor);
            }
        }
        JsonNode checks = root.has("checks") ? root.path("checks") : root.path("safety_checks");
        for (JsonNode node : checks) {
            SafetyCheck check = toCheck(node);
            if (check != null) {
                findings.addCheck(check);
            }
        }
        return findings;
    }

    private RiskFactor toRiskFactor(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String factor = StringUtils.trimToNull(node.path("factor").asText(null));
        RiskLevel severity = parseSeverity(node.path("severity"));
        if (factor == null || severity == null) {
            return null;
        }
        return RiskFactor.builder()
                .factor(factor)
                .category(StringUtils.defaultIfBlank(node.path("category").asText(null), "semantic"))
                .severity(severity)
                .description(StringUtils.defaultString(node.path("description").asText(null)))
                .recommendation(StringUtils.defaultString(node.path("recommendation").asText(null)))
                .build();
    }

    private SafetyCheck toCheck(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String checkName = StringUtils.trimToNull(node.path("check_name").asText(null));
        JsonNode passed = node.path("passed");
        if (checkName == null || !passed.isBoolean()) {
            return null;
        }
        return SafetyCheck.builder()
                .checkName(checkName)
                .passed(passed.booleanValue())
                .message(StringUtils.defaultString(node.path("message").asText(null)))
                .severity(node.has("severity") ? parseSeverity(node.path("severity")) : null)
                .build();
    }

    private RiskLevel parseSeverity(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        try {
            return RiskLevel.fromCode(node.asText());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
