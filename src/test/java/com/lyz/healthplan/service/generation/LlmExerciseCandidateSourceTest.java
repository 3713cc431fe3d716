package com.lyz.healthplan.service.generation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lyz.healthplan.common.exception.CandidateGenerationException;
import com.lyz.healthplan.model.dto.PlanTarget;
import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.exercise.ExercisePlan;
import com.lyz.healthplan.model.exercise.ExerciseSession;
import com.lyz.healthplan.model.exercise.Intensity;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.util.LlmChatClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class LlmExerciseCandidateSourceTest {

    private static final String PLAN_JSON = """
            {
              "title": "Fat Burn Starter",
              "weekly_frequency": 4,
              "sessions": {
                "morning": {
                  "time_of_day": "07:00",
                  "exercises": [
                    {"name": "Brisk Walk", "exercise_type": "cardio", "duration": 20, "intensity": "moderate", "calories_burned": 120},
                    {"name": "Squat", "type": "strength", "duration_minutes": 10, "intensity": "High", "calories_burned": 70}
                  ],
                  "total_duration_minutes": 999
                },
                "evening": {
                  "exercises": [
                    {"name": "Stretch", "type": "flexibility", "duration_minutes": 10, "intensity": "low", "calories_burned": 25}
                  ]
                }
              },
              "total_duration_minutes": 5
            }
            """;

    private LlmChatClient llmChatClient;
    private KnowledgeRetriever knowledgeRetriever;
    private LlmExerciseCandidateSource source;

    @BeforeEach
    void setUp() {
        llmChatClient = mock(LlmChatClient.class);
        knowledgeRetriever = mock(KnowledgeRetriever.class);
        ObjectMapper objectMapper = new ObjectMapper();
        source = new LlmExerciseCandidateSource(llmChatClient, knowledgeRetriever, new PromptTemplates(objectMapper), objectMapper);
    }

    @Test
    void plan_is_parsed_and_totals_recomputed() {
        ExercisePlan plan = source.parsePlan("```json\n" + PLAN_JSON + "\n```");

        assertEquals("Fat Burn Starter", plan.getTitle());
        assertEquals(List.of("morning", "evening"), List.copyOf(plan.getSessions().keySet()));
        ExerciseSession morning = plan.getSessions().get("morning");
        assertEquals("cardio", morning.getExercises().get(0).getType());
        assertEquals(20, morning.getExercises().get(0).getDurationMinutes());
        assertEquals(Intensity.HIGH, morning.getExercises().get(1).getIntensity());
        assertEquals(30, morning.getTotalDurationMinutes());
        assertEquals(190, morning.getTotalCaloriesBurned());
        assertEquals(Intensity.HIGH, morning.getOverallIntensity());
        assertEquals(40, plan.getTotalDurationMinutes());
        assertEquals(215, plan.getTotalCaloriesBurned());
        assertEquals(4, plan.getWeeklyFrequency());
    }

    @Test
    void unknown_intensity_fails_generation() {
        String bad = PLAN_JSON.replace("\"moderate\"", "\"extreme\"");
        assertThrows(CandidateGenerationException.class, () -> source.parsePlan(bad));
    }

    @Test
    void plans_without_usable_exercises_are_rejected() {
        assertThrows(CandidateGenerationException.class, () -> source.parsePlan("{\"title\": \"Empty\", \"sessions\": {}}"));
        assertThrows(CandidateGenerationException.class, () -> source.parsePlan(
                "{\"sessions\": {\"morning\": {\"exercises\": [{\"name\": \"Walk\", \"intensity\": \"low\", \"duration\": 0}]}}}"));
        assertThrows(CandidateGenerationException.class, () -> source.parsePlan("[1, 2, 3]"));
    }

    @Test
    void missing_frequency_falls_back_to_target() {
        UserMetadata user = UserMetadata.builder().fitnessLevel("beginner").build();
        when(knowledgeRetriever.retrieve(user, PlanType.EXERCISE)).thenReturn("");
        when(llmChatClient.chat(anyString(), anyString(), any()))
                .thenReturn(PLAN_JSON.replace("\"weekly_frequency\": 4", "\"weekly_frequency\": 0"));

        GenerationResult<ExercisePlan> result = source.generate(GenerationRequest.builder()
                .user(user)
                .target(PlanTarget.builder().caloriesToBurn(300).weeklyFrequency(5).build())
                .build());

        assertEquals(5, result.getCandidate().getWeeklyFrequency());
        assertEquals("", result.getRetrievalContext());
        verify(llmChatClient).chat(eq(PromptTemplates.EXERCISE_SYSTEM_PROMPT), anyString(), any());
    }
}
