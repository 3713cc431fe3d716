package com.lyz.healthplan.service.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lyz.healthplan.config.PipelineProperties;
import com.lyz.healthplan.model.food.MealType;
import com.lyz.healthplan.model.food.ScaledFoodItem;
import com.lyz.healthplan.model.safety.AssessmentStatus;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.model.safety.RiskLevel;
import com.lyz.healthplan.model.safety.SafetyAssessment;
import com.lyz.healthplan.model.vo.PlanCandidate;
import com.lyz.healthplan.model.vo.PlanPipelineResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlanArtifactStoreTest {

    @TempDir
    Path tempDir;

    private PipelineProperties properties;
    private PlanArtifactStore store;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.setOutputDir(tempDir.resolve("output").toString());
        store = new PlanArtifactStore(properties, new ObjectMapper().findAndRegisterModules());
    }

    private static PlanPipelineResult dietResult() {
        SafetyAssessment assessment = SafetyAssessment.builder()
                .score(88).safe(true).status(AssessmentStatus.PASSED).riskLevel(RiskLevel.LOW)
                .recommendation("Drink water")
                .assessedAt(LocalDateTime.of(2026, 3, 1, 12, 0, 0))
                .build();
        PlanCandidate candidate = PlanCandidate.builder()
                .id(1).planType(PlanType.DIET).variant("Variant_2").scaleFactor(1.0).baseId(1)
                .mealType(MealType.DINNER)
                .items(List.of(ScaledFoodItem.builder().name("Tofu").quantity(200).unit("gram")
                        .caloriesPerUnit(0.76).totalCalories(152).variant("Variant_2").build()))
                .totalCalories(152.0).target(600.0).deviation(-74.7)
                .assessment(assessment)
                .build();
        Map<Integer, SafetyAssessment> assessments = new LinkedHashMap<>();
        assessments.put(1, assessment);
        return PlanPipelineResult.builder()
                .planType(PlanType.DIET)
                .mealType(MealType.DINNER)
                .allPlans(List.of(candidate))
                .topPlans(List.of(candidate))
                .assessments(assessments)
                .generatedAt(LocalDateTime.of(2026, 3, 1, 12, 0, 5))
                .build();
    }

    @Test
    void artifact_is_written_with_snake_case_layout() throws Exception {
        String path = store.write(dietResult());

        assertNotNull(path);
        assertTrue(path.endsWith("dinner_plan.json"));
        JsonNode json = new ObjectMapper().readTree(Path.of(path).toFile());
        assertEquals("2026-03-01T12:00:05", json.get("generated_at").asText());
        JsonNode plan = json.get("all_plans").get(0);
        assertEquals("Variant_2", plan.get("variant").asText());
        assertEquals("Variant_2", plan.get("items").get(0).get("_variant").asText());
        assertEquals("diet", plan.get("plan_type").asText());
        assertTrue(plan.get("_assessment").get("is_safe").asBoolean());
        assertEquals(88, json.get("assessments").get("1").get("score").asInt());
        assertEquals("passed", json.get("assessments").get("1").get("status").asText());
        assertEquals(1, json.get("top_plans").size());
    }

    @Test
    void read_returns_what_was_written() {
        store.write(dietResult());

        JsonNode json = store.read(PlanType.DIET, MealType.DINNER);

        assertNotNull(json);
        assertEquals(1, json.get("all_plans").size());
        assertNull(store.read(PlanType.DIET, MealType.BREAKFAST));
    }

    @Test
    void corrupt_file_reads_as_missing() throws Exception {
        Path path = store.resolvePath(PlanType.EXERCISE, null);
        Files.createDirectories(path.getParent());
        Files.writeString(path, "{not json");

        assertNull(store.read(PlanType.EXERCISE, null));
    }

    @Test
    void write_failure_is_logged_and_reported_as_null() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "I am a file");
        properties.setOutputDir(blocker.toString());

        assertNull(store.write(dietResult()));
    }

    @Test
    void file_names_follow_plan_and_meal_type() {
        assertEquals("diet_lunch_plan.json", PlanArtifactStore.fileName(PlanType.DIET, MealType.LUNCH));
        assertEquals("diet_plan.json", PlanArtifactStore.fileName(PlanType.DIET, null));
        assertEquals("exercise_plan.json", PlanArtifactStore.fileName(PlanType.EXERCISE, null));
    }
}
