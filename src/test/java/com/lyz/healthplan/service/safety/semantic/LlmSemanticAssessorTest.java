package com.lyz.healthplan.service.safety.semantic;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.model.safety.RiskFactor;
import com.lyz.healthplan.model.safety.RiskLevel;
import com.lyz.healthplan.model.safety.SafetyCheck;
import com.lyz.healthplan.model.vo.PlanCandidate;
import com.lyz.healthplan.service.generation.PromptTemplates;
import com.lyz.healthplan.service.safety.SafetyFindings;
import com.lyz.healthplan.util.LlmChatClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class LlmSemanticAssessorTest {

    private LlmChatClient llmChatClient;
    private PromptTemplates promptTemplates;
    private LlmSemanticAssessor assessor;

    private final PlanCandidate candidate = PlanCandidate.builder().id(7).planType(PlanType.DIET).build();
    private final UserMetadata user = UserMetadata.builder().age(40).build();

    @BeforeEach
    void setUp() {
        llmChatClient = mock(LlmChatClient.class);
        promptTemplates = mock(PromptTemplates.class);
        assessor = new LlmSemanticAssessor(llmChatClient, promptTemplates, new ObjectMapper());
        when(promptTemplates.renderSafetyPrompt(any(), any(), any(), any())).thenReturn("prompt");
    }

    @Test
    void unconfigured_client_contributes_nothing() {
        when(llmChatClient.isConfigured()).thenReturn(false);

        assertTrue(assessor.assess(candidate, user, null, "ctx").isEmpty());
        verify(llmChatClient, never()).chat(anyString(), anyString(), any());
    }

    @Test
    void valid_entries_are_kept_and_malformed_ones_dropped() {
        when(llmChatClient.isConfigured()).thenReturn(true);
        when(llmChatClient.chat(anyString(), anyString(), any())).thenReturn("""
                评估结果如下：
                ```json
                {
                  "risk_factors": [
                    {"factor": "hidden_sugar", "category": "medical", "severity": "high",
                     "description": "Sauce is high in sugar", "recommendation": "Use a sugar-free sauce"},
                    {"factor": "no_severity", "description": "missing severity"},
                    {"factor": "odd_severity", "severity": "extreme"},
                    {"severity": "low", "description": "missing factor"},
                    {"factor": "medium_alias", "severity": "medium"}
                  ],
                  "safety_checks": [
                    {"check_name": "allergen_scan", "passed": true, "message": "No allergens"},
                    {"check_name": "string_passed", "passed": "yes"},
                    {"passed": false}
                  ]
                }
                ```
                """);

        SafetyFindings findings = assessor.assess(candidate, user, null, "ctx");

        assertEquals(2, findings.getRiskFactors().size());
        RiskFactor sugar = findings.getRiskFactors().get(0);
        assertEquals("hidden_sugar", sugar.getFactor());
        assertEquals("medical", sugar.getCategory());
        assertEquals(RiskLevel.HIGH, sugar.getSeverity());
        RiskFactor medium = findings.getRiskFactors().get(1);
        assertEquals(RiskLevel.MODERATE, medium.getSeverity());
        assertEquals("semantic", medium.getCategory());

        assertEquals(1, findings.getChecks().size());
        SafetyCheck check = findings.getChecks().get(0);
        assertEquals("allergen_scan", check.getCheckName());
        assertTrue(check.isPassed());
        verify(promptTemplates).renderSafetyPrompt(candidate, user, null, "ctx");
    }

    @Test
    void client_failure_contributes_nothing() {
        when(llmChatClient.isConfigured()).thenReturn(true);
        when(llmChatClient.chat(anyString(), anyString(), any())).thenThrow(new IllegalStateException("timeout"));

        assertTrue(assessor.assess(candidate, user, null, null).isEmpty());
    }

    @Test
    void non_json_or_non_object_reply_contributes_nothing() {
        assertTrue(assessor.parse("I think this plan is fine.").isEmpty());
        assertTrue(assessor.parse("[{\"factor\": \"x\", \"severity\": \"high\"}]").isEmpty());
        assertTrue(assessor.parse("").isEmpty());
    }

    @Test
    void checks_key_is_also_accepted() {
        SafetyFindings findings = assessor.parse("{\"checks\": [{\"check_name\": \"portion\", \"passed\": false, \"severity\": \"low\"}]}");
        assertEquals(1, findings.getChecks().size());
        assertFalse(findings.getChecks().get(0).isPassed());
        assertEquals(RiskLevel.LOW, findings.getChecks().get(0).getSeverity());
    }
}
