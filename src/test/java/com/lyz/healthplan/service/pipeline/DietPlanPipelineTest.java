package com.lyz.healthplan.service.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lyz.healthplan.common.exception.CandidateGenerationException;
import com.lyz.healthplan.common.exception.PlanConfigurationException;
import com.lyz.healthplan.config.PipelineProperties;
import com.lyz.healthplan.config.SafetyProperties;
import com.lyz.healthplan.model.dto.EnvironmentContext;
import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.food.BaseFoodItem;
import com.lyz.healthplan.model.food.MealType;
import com.lyz.healthplan.model.safety.AssessmentStatus;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.model.safety.RiskLevel;
import com.lyz.healthplan.model.safety.SafetyAssessment;
import com.lyz.healthplan.model.vo.GeneratedPlansVO;
import com.lyz.healthplan.model.vo.PlanCandidate;
import com.lyz.healthplan.model.vo.PlanPipelineResult;
import com.lyz.healthplan.service.generation.CandidateSource;
import com.lyz.healthplan.service.generation.GenerationRequest;
import com.lyz.healthplan.service.generation.GenerationResult;
import com.lyz.healthplan.service.generation.TargetCalculator;
import com.lyz.healthplan.service.safety.SafetyAssessor;
import com.lyz.healthplan.service.safety.SafetyRuleChecker;
import com.lyz.healthplan.service.safety.matcher.KeywordContentMatcher;
import com.lyz.healthplan.service.safety.policy.WeightedScoringPolicy;
import com.lyz.healthplan.service.safety.rule.ConditionRestrictionChecker;
import com.lyz.healthplan.service.safety.rule.DietRuleChecker;
import com.lyz.healthplan.service.safety.rule.EnvironmentChecker;
import com.lyz.healthplan.service.safety.semantic.SemanticAssessor;
import com.lyz.healthplan.service.variant.DietVariantExpander;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DietPlanPipelineTest {

    @TempDir
    Path outputDir;

    private CandidateSource<List<BaseFoodItem>> source;
    private SafetyAssessor assessor;
    private DietPlanPipeline pipeline;
    private ObjectMapper objectMapper;

    private final UserMetadata user = UserMetadata.builder().fitnessLevel("beginner").build();

    private final List<BaseFoodItem> baseItems = List.of(
            BaseFoodItem.builder().name("Rice").quantity(100).unit("gram").totalCalories(200.0).build(),
            BaseFoodItem.builder().name("Chicken Breast").quantity(150).unit("gram").totalCalories(250.0).build());

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        source = mock(CandidateSource.class);
        assessor = mock(SafetyAssessor.class);
        objectMapper = new ObjectMapper().findAndRegisterModules();
        PipelineProperties properties = new PipelineProperties();
        properties.setOutputDir(outputDir.toString());
        pipeline = new DietPlanPipeline(source, assessor, new PlanArtifactStore(properties, objectMapper),
                new DietVariantExpander(), new TargetCalculator());
        when(assessor.assess(any(), any(), any(), any())).thenReturn(assessment(90));
    }

    private static SafetyAssessment assessment(int score) {
        return SafetyAssessment.builder()
                .score(score)
                .safe(score >= 60)
                .status(score >= 80 ? AssessmentStatus.PASSED : AssessmentStatus.WARNING)
                .riskLevel(RiskLevel.LOW)
                .build();
    }

    private GenerationRequest request() {
        return GenerationRequest.builder()
                .user(user)
                .environment(new EnvironmentContext())
                .mealType(MealType.LUNCH)
                .build();
    }

    private static PipelineSettings settings(int bases, int variants, int topK) {
        return PipelineSettings.builder()
                .basePlanCount(bases).variantCount(variants).minScale(0.8).maxScale(1.2).topK(topK).build();
    }

    private static List<Integer> ids(List<PlanCandidate> candidates) {
        return candidates.stream().map(PlanCandidate::getId).collect(Collectors.toList());
    }

    @Test
    void failed_base_is_skipped_and_remaining_variants_are_numbered() {
        when(source.generate(any()))
                .thenReturn(new GenerationResult<>(baseItems, "ctx"))
                .thenThrow(new CandidateGenerationException("model returned garbage"));

        PlanPipelineResult result = pipeline.run(request(), settings(2, 3, 3));

        assertEquals(3, result.getAllPlans().size());
        assertEquals(List.of(1, 2, 3), ids(result.getAllPlans()));
        assertThat(result.getAllPlans()).allMatch(c -> c.getBaseId() == 1);
        assertThat(result.getAllPlans()).extracting(PlanCandidate::getVariant)
                .containsExactly("Variant_1", "Variant_2", "Variant_3");
        assertEquals(3, result.getTopPlans().size());
        assertEquals(3, result.getAssessments().size());
        verify(source, times(2)).generate(any());
    }

    @Test
    void candidates_carry_totals_target_and_deviation() {
        when(source.generate(any())).thenReturn(new GenerationResult<>(baseItems, ""));

        PlanPipelineResult result = pipeline.run(request(), settings(1, 3, 3));

        PlanCandidate lite = result.getAllPlans().get(0);
        assertEquals(PlanType.DIET, lite.getPlanType());
        assertEquals(MealType.LUNCH, lite.getMealType());
        assertEquals(0.8, lite.getScaleFactor());
        assertEquals(360.0, lite.getTotalCalories());
        assertEquals(80.0, lite.getItems().get(0).getQuantity());

        PlanCandidate standard = result.getAllPlans().get(1);
        assertEquals(450.0, standard.getTotalCalories());
        assertEquals(778.0, standard.getTarget());
        assertEquals(-42.2, standard.getDeviation());
        assertNotNull(standard.getAssessment());
    }

    @Test
    void retrieval_context_is_threaded_between_generations_and_into_assessment() {
        when(source.generate(any()))
                .thenThrow(new CandidateGenerationException("timeout"))
                .thenReturn(new GenerationResult<>(baseItems, "diabetes: High sugar foods"))
                .thenReturn(new GenerationResult<>(baseItems, "diabetes: High sugar foods"));

        pipeline.run(request(), settings(3, 1, 3));

        ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(source, times(3)).generate(captor.capture());
        List<GenerationRequest> calls = captor.getAllValues();
        assertNull(calls.get(0).getRetrievalContext());
        assertNull(calls.get(1).getRetrievalContext());
        assertEquals("diabetes: High sugar foods", calls.get(2).getRetrievalContext());
        assertEquals(778, calls.get(0).getTarget().getMealCalories());

        verify(assessor, times(2)).assess(any(), eq(user), any(), eq("diabetes: High sugar foods"));
    }

    @Test
    void ranking_is_by_score_then_id_and_truncated_to_top_k() {
        when(source.generate(any())).thenReturn(new GenerationResult<>(baseItems, ""));
        Map<Integer, Integer> scores = Map.of(1, 80, 2, 90, 3, 80);
        when(assessor.assess(any(), any(), any(), any()))
                .thenAnswer(inv -> assessment(scores.get(inv.<PlanCandidate>getArgument(0).getId())));

        PlanPipelineResult result = pipeline.run(request(), settings(1, 3, 2));

        assertEquals(List.of(1, 2, 3), ids(result.getAllPlans()));
        assertEquals(List.of(2, 1), ids(result.getTopPlans()));
        assertEquals(90, result.getAssessments().get(2).getScore());
        assertEquals(80, result.getTopPlans().get(1).getAssessment().getScore());
    }

    @Test
    void all_failed_generations_still_write_an_empty_artifact() throws Exception {
        when(source.generate(any())).thenThrow(new CandidateGenerationException("down"));

        PlanPipelineResult result = pipeline.run(request(), settings(2, 3, 3));

        assertTrue(result.getAllPlans().isEmpty());
        assertTrue(result.getTopPlans().isEmpty());
        assertTrue(result.getAssessments().isEmpty());
        verifyNoInteractions(assessor);

        assertNotNull(result.getArtifactPath());
        File file = new File(result.getArtifactPath());
        assertEquals("diet_lunch_plan.json", file.getName());
        assertTrue(Files.exists(file.toPath()));
        JsonNode json = objectMapper.readTree(file);
        assertEquals(0, json.get("all_plans").size());
        assertEquals(0, json.get("top_plans").size());
        assertTrue(json.get("assessments").isEmpty());
        assertTrue(json.hasNonNull("generated_at"));
    }

    @Test
    void invalid_settings_fail_before_any_generation() {
        assertThrows(PlanConfigurationException.class, () -> pipeline.run(request(), settings(2, 0, 3)));
        assertThrows(PlanConfigurationException.class, () -> pipeline.run(request(), settings(0, 3, 3)));
        assertThrows(PlanConfigurationException.class, () -> pipeline.run(request(), settings(1, 3, 0)));
        verifyNoInteractions(source);
    }

    @Test
    void failing_semantic_source_does_not_abort_the_run() {
        SafetyProperties safetyProperties = new SafetyProperties();
        safetyProperties.setScoringPolicy("weighted");
        SemanticAssessor broken = (candidate, u, environment, context) -> {
            throw new RuntimeException("semantic backend down");
        };
        List<SafetyRuleChecker> checkers = List.of(new DietRuleChecker(safetyProperties),
                new ConditionRestrictionChecker(new KeywordContentMatcher()), new EnvironmentChecker());
        PipelineProperties properties = new PipelineProperties();
        properties.setOutputDir(outputDir.toString());
        DietPlanPipeline realPipeline = new DietPlanPipeline(source,
                new SafetyAssessor(checkers, broken, new WeightedScoringPolicy(), safetyProperties),
                new PlanArtifactStore(properties, objectMapper), new DietVariantExpander(), new TargetCalculator());
        when(source.generate(any())).thenReturn(new GenerationResult<>(baseItems, ""));

        PlanPipelineResult result = realPipeline.run(request(), settings(1, 3, 3));

        assertEquals(3, result.getAllPlans().size());
        assertEquals(3, result.getAssessments().size());
        assertThat(result.getAllPlans()).allMatch(c -> c.getAssessment() != null);
        assertNotNull(result.getArtifactPath());
    }

    @Test
    void generate_only_returns_numbered_candidates_without_assessment() {
        when(source.generate(any()))
                .thenReturn(new GenerationResult<>(baseItems, ""))
                .thenThrow(new CandidateGenerationException("empty"));

        GeneratedPlansVO generated = pipeline.generateOnly(request(), settings(2, 3, 1));

        assertEquals(PlanType.DIET, generated.getPlanType());
        assertEquals(MealType.LUNCH, generated.getMealType());
        assertEquals(List.of(1, 2, 3), ids(generated.getPlans()));
        assertNotNull(generated.getGeneratedAt());
        verifyNoInteractions(assessor);
        assertFalse(outputDir.resolve("diet_lunch_plan.json").toFile().exists());
    }
}
