package com.lyz.healthplan.service.safety.rule;

import com.lyz.healthplan.config.SafetyProperties;
import com.lyz.healthplan.model.dto.EnvironmentContext;
import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.food.MealType;
import com.lyz.healthplan.model.food.ScaledFoodItem;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.model.safety.RiskFactor;
import com.lyz.healthplan.model.safety.RiskLevel;
import com.lyz.healthplan.model.safety.SafetyCheck;
import com.lyz.healthplan.model.vo.PlanCandidate;
import com.lyz.healthplan.service.safety.SafetyFindings;
import com.lyz.healthplan.service.safety.SafetyRuleChecker;
import com.lyz.healthplan.util.NumberUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 饮食规则检查：热量区间、单餐上限、蛋白/脂肪供能比
 */
@Component
@Order(10)
@RequiredArgsConstructor
public class DietRuleChecker implements SafetyRuleChecker {

    private static final double PROTEIN_KCAL_PER_GRAM = 4.0;
    private static final double FAT_KCAL_PER_GRAM = 9.0;

    private final SafetyProperties safetyProperties;

    @Override
    public void check(PlanCandidate candidate, UserMetadata user, EnvironmentContext environment, SafetyFindings findings) {
        if (candidate.getPlanType() != PlanType.DIET) {
            return;
        }
        SafetyProperties.Diet rules = safetyProperties.getRules().getDiet();
        double totalCalories = resolveTotalCalories(candidate);
        MealType mealType = candidate.getMealType();

        // 单餐候选按餐次占比折算全天阈值
        double share = mealType != null ? mealType.getDailyShare() : 1.0;
        double floor = NumberUtil.round1(rules.getMinCalories() * share);
        double ceiling = NumberUtil.round1(rules.getMaxCalories() * share);
        String scope = mealType != null ? mealType.getCode() : "daily";

        if (totalCalories < floor) {
            findings.addCheck(SafetyCheck.fail("min_calories",
                    String.format("Calories too low for %s: %.1f < %.1f", scope, totalCalories, floor), RiskLevel.HIGH));
            findings.addRisk(RiskFactor.builder()
                    .factor("extremely_low_calories")
                    .category("nutritional")
                    .severity(RiskLevel.HIGH)
                    .description(String.format("Total calories %.1f is dangerously low", totalCalories))
                    .recommendation("Consult a dietitian for safe calorie targets")
                    .build());
        } else if (totalCalories > ceiling) {
            findings.addCheck(SafetyCheck.fail("max_calories",
                    String.format("Calories too high for %s: %.1f > %.1f", scope, totalCalories, ceiling), RiskLevel.MODERATE));
        } else {
            findings.addCheck(SafetyCheck.pass("calories_range", "Calorie intake within acceptable range"));
        }

        if (mealType != null && totalCalories > rules.getSingleMealCalories()) {
            findings.addCheck(SafetyCheck.fail("single_meal_calories",
                    String.format("Single meal calorie too high: %.1f > %.1f", totalCalories, rules.getSingleMealCalories()),
                    RiskLevel.LOW));
            findings.addRisk(RiskFactor.builder()
                    .factor("oversized_meal")
                    .category("nutritional")
                    .severity(RiskLevel.LOW)
                    .description(String.format("Single meal of %.1f kcal is oversized", totalCalories))
                    .recommendation("Split the meal or reduce portion sizes")
                    .build());
        }

        checkMacros(candidate.getItems(), totalCalories, rules, findings);
    }

    private void checkMacros(List<ScaledFoodItem> items, double totalCalories, SafetyProperties.Diet rules,
                             SafetyFindings findings) {
        if (items == null || items.isEmpty() || totalCalories <= 0) {
            return;
        }
        boolean hasProtein = false;
        boolean hasFat = false;
        double protein = 0;
        double fat = 0;
        for (ScaledFoodItem item : items) {
            if (item.getProteinGrams() != null) {
                hasProtein = true;
                protein += item.getProteinGrams();
            }
            if (item.getFatGrams() != null) {
                hasFat = true;
                fat += item.getFatGrams();
            }
        }
        if (hasProtein) {
            double proteinRatio = protein * PROTEIN_KCAL_PER_GRAM / totalCalories;
            if (proteinRatio < rules.getMinProteinRatio()) {
                findings.addRisk(RiskFactor.builder()
                        .factor("low_protein")
                        .category("nutritional")
                        .severity(RiskLevel.MODERATE)
                        .description(String.format("Protein ratio %.1f%% is below recommended minimum", proteinRatio * 100))
                        .recommendation("Include more protein-rich foods")
                        .build());
            }
        }
        if (hasFat) {
            double fatRatio = fat * FAT_KCAL_PER_GRAM / totalCalories;
            if (fatRatio > rules.getMaxFatRatio()) {
                findings.addRisk(RiskFactor.builder()
                        .factor("high_fat")
                        .category("nutritional")
                        .severity(RiskLevel.MODERATE)
                        .description(String.format("Fat ratio %.1f%% exceeds recommended maximum", fatRatio * 100))
                        .recommendation("Reduce high-fat foods")
                        .build());
            }
        }
    }

    private double resolveTotalCalories(PlanCandidate candidate) {
        if (candidate.getTotalCalories() != null) {
            return candidate.getTotalCalories();
        }
        double total = 0;
        if (candidate.getItems() != null) {
            for (ScaledFoodItem item : candidate.getItems()) {
                total += item.getTotalCalories();
            }
        }
        return total;
    }
}
