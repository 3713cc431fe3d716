package com.lyz.healthplan.service.variant;

import com.lyz.healthplan.model.food.BaseFoodItem;
import com.lyz.healthplan.model.food.FoodUnit;
import com.lyz.healthplan.model.food.ScaledFoodItem;
import com.lyz.healthplan.util.NumberUtil;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * 饮食变体展开
 * 按单位类型缩放份量，并保持单位热量不变
 */
@Component
public class DietVariantExpander {

    public LinkedHashMap<String, List<ScaledFoodItem>> expand(List<BaseFoodItem> items, int count,
                                                              double minScale, double maxScale) {
        return expand(items, ScaleFactorSchedule.build(count, minScale, maxScale));
    }

    public LinkedHashMap<String, List<ScaledFoodItem>> expand(List<BaseFoodItem> items, List<VariantScale> scales) {
        LinkedHashMap<String, List<ScaledFoodItem>> variants = new LinkedHashMap<>();
        for (VariantScale scale : scales) {
            List<ScaledFoodItem> scaled = new ArrayList<>();
            if (items != null) {
                for (BaseFoodItem item : items) {
                    scaled.add(scaleItem(item, scale.getFactor(), scale.getName()));
                }
            }
            variants.put(scale.getName(), scaled);
        }
        return variants;
    }

    public ScaledFoodItem scaleItem(BaseFoodItem item, double factor, String variantName) {
        double quantity = item.getQuantity();
        double rate = quantity > 0 ? item.resolveTotalCalories() / quantity : 0.0;
        double newQuantity = scaleQuantity(quantity, item.getUnit(), factor);
        double newTotal = NumberUtil.round1(rate * newQuantity);
        double newPerUnit = newQuantity > 0 ? NumberUtil.round2(newTotal / newQuantity) : 0.0;
        double ratio = quantity > 0 ? newQuantity / quantity : 0.0;

        return ScaledFoodItem.builder()
                .name(item.getName())
                .quantity(newQuantity)
                .unit(item.getUnit())
                .caloriesPerUnit(newPerUnit)
                .totalCalories(newTotal)
                .proteinGrams(scaleMacro(item.getProteinGrams(), ratio))
                .fatGrams(scaleMacro(item.getFatGrams(), ratio))
                .carbsGrams(scaleMacro(item.getCarbsGrams(), ratio))
                .variant(variantName)
                .build();
    }

    /**
     * 连续单位按一位小数取整；离散单位按步长取整且不小于一个步长；勺不缩放；未知单位按连续处理
     */
    public double scaleQuantity(double quantity, String unitCode, double factor) {
        FoodUnit unit = FoodUnit.fromCode(unitCode);
        FoodUnit.Scaling scaling = unit != null ? unit.getScaling() : FoodUnit.Scaling.CONTINUOUS;
        return switch (scaling) {
            case FIXED -> quantity;
            case DISCRETE -> snapToIncrement(quantity * factor, unit.getIncrement());
            default -> NumberUtil.round1(quantity * factor);
        };
    }

    private double snapToIncrement(double target, double increment) {
        double snapped = NumberUtil.roundToLong(target / increment) * increment;
        return Math.max(snapped, increment);
    }

    private Double scaleMacro(Double grams, double ratio) {
        if (grams == null) {
            return null;
        }
        return NumberUtil.round1(grams * ratio);
    }
}
