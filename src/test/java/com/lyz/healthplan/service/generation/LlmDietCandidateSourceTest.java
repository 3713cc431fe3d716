package com.lyz.healthplan.service.generation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lyz.healthplan.common.exception.CandidateGenerationException;
import com.lyz.healthplan.model.dto.PlanTarget;
import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.food.BaseFoodItem;
import com.lyz.healthplan.model.food.MealType;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.util.LlmChatClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class LlmDietCandidateSourceTest {

    private static final String REPLY = """
            好的，这是您的午餐方案：
            ```json
            [
              {"food_name": "Brown Rice", "portion_number": 150, "portion_unit": "gram", "total_calories": 165},
              {"name": "Boiled Egg", "quantity": 2, "unit": "piece", "calories_per_unit": 78, "protein_grams": 12.6},
              {"quantity": 1, "unit": "cup", "total_calories": 30}
            ]
            ```
            """;

    private LlmChatClient llmChatClient;
    private KnowledgeRetriever knowledgeRetriever;
    private LlmDietCandidateSource source;

    private final UserMetadata user = UserMetadata.builder().age(30).medicalConditions(List.of("diabetes")).build();

    @BeforeEach
    void setUp() {
        llmChatClient = mock(LlmChatClient.class);
        knowledgeRetriever = mock(KnowledgeRetriever.class);
        ObjectMapper objectMapper = new ObjectMapper();
        source = new LlmDietCandidateSource(llmChatClient, knowledgeRetriever, new PromptTemplates(objectMapper), objectMapper);
    }

    private GenerationRequest request(String retrievalContext) {
        return GenerationRequest.builder()
                .user(user)
                .mealType(MealType.LUNCH)
                .target(PlanTarget.builder().dailyCalories(2000).mealCalories(700).build())
                .retrievalContext(retrievalContext)
                .build();
    }

    @Test
    void first_call_retrieves_context_and_returns_it() {
        when(knowledgeRetriever.retrieve(user, PlanType.DIET)).thenReturn("diabetes: High sugar foods");
        when(llmChatClient.chat(anyString(), anyString(), any())).thenReturn(REPLY);

        GenerationResult<List<BaseFoodItem>> result = source.generate(request(null));

        assertEquals("diabetes: High sugar foods", result.getRetrievalContext());
        List<BaseFoodItem> items = result.getCandidate();
        assertEquals(2, items.size());
        assertEquals("Brown Rice", items.get(0).getName());
        assertEquals(150.0, items.get(0).getQuantity());
        assertEquals("gram", items.get(0).getUnit());
        assertEquals(156.0, items.get(1).resolveTotalCalories());
        assertEquals(12.6, items.get(1).getProteinGrams());

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmChatClient).chat(eq(PromptTemplates.DIET_SYSTEM_PROMPT), prompt.capture(), any());
        assertThat(prompt.getValue()).contains("diabetes: High sugar foods").contains("\"target_calories\" : 700");
    }

    @Test
    void supplied_context_is_reused_without_retrieval() {
        when(llmChatClient.chat(anyString(), anyString(), any())).thenReturn(REPLY);

        GenerationResult<List<BaseFoodItem>> result = source.generate(request("cached"));

        assertEquals("cached", result.getRetrievalContext());
        verifyNoInteractions(knowledgeRetriever);
    }

    @Test
    void empty_context_counts_as_already_retrieved() {
        when(llmChatClient.chat(anyString(), anyString(), any())).thenReturn(REPLY);

        source.generate(request(""));

        verifyNoInteractions(knowledgeRetriever);
    }

    @Test
    void client_failure_becomes_generation_failure() {
        when(knowledgeRetriever.retrieve(any(), any())).thenReturn("");
        when(llmChatClient.chat(anyString(), anyString(), any())).thenThrow(new IllegalStateException("API key missing"));

        assertThrows(CandidateGenerationException.class, () -> source.generate(request(null)));
    }

    @Test
    void malformed_replies_are_rejected() {
        assertThrows(CandidateGenerationException.class, () -> source.parseItems(""));
        assertThrows(CandidateGenerationException.class, () -> source.parseItems("no json here"));
        assertThrows(CandidateGenerationException.class, () -> source.parseItems("{\"name\": \"Rice\"}"));
        assertThrows(CandidateGenerationException.class, () -> source.parseItems("[{\"quantity\": 100}]"));
    }

    @Test
    void bare_array_without_fence_is_accepted() {
        List<BaseFoodItem> items = source.parseItems("[{\"name\": \"Apple\", \"quantity\": 1, \"unit\": \"piece\", \"total_calories\": 95}]");
        assertEquals(1, items.size());
        assertEquals(95.0, items.get(0).getTotalCalories());
    }
}
