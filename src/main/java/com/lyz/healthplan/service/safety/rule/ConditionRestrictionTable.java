package com.lyz.healthplan.service.safety.rule;

import com.lyz.healthplan.model.safety.PlanType;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 病症禁忌表：病症 → 方案类型 → 禁忌项及其关键词
 */
public final class ConditionRestrictionTable {

    @Value
    public static class Restriction {
        String condition;
        PlanType planType;
        /**
         * 如 avoid_high_sugar，风险因子名为 condition_key
         */
        String key;
        String description;
        List<String> keywords;

        public String factorName() {
            return condition + "_" + key;
        }
    }

    private static final Map<String, List<Restriction>> TABLE = new LinkedHashMap<>();

    static {
        // ===== 糖尿病 =====
        register("diabetes", PlanType.DIET, "avoid_high_sugar", "High sugar foods",
                "sugar", "candy", "cake", "soda", "syrup", "honey", "dessert", "sweet", "chocolate", "cookie",
                "ice cream", "糖", "蛋糕", "甜点", "蜂蜜", "可乐");
        register("diabetes", PlanType.EXERCISE, "avoid_vigorous_exercise", "Vigorous exercise without glucose monitoring",
                "vigorous", "hiit", "sprint", "tabata");
        register("diabetes", PlanType.EXERCISE, "avoid_late_exercise", "Late night exercise (hypoglycemia risk)",
                "late night", "late_night", "midnight");

        // ===== 高血压 =====
        register("hypertension", PlanType.DIET, "avoid_high_sodium", "High sodium foods",
                "salt", "salty", "pickled", "pickle", "bacon", "ham", "sausage", "soy sauce", "cured",
                "instant noodle", "咸菜", "腊肉", "火腿", "香肠", "方便面");
        register("hypertension", PlanType.EXERCISE, "avoid_isometric", "Isometric exercises (heavy static holds)",
                "isometric", "plank hold", "wall sit", "static hold");
        register("hypertension", PlanType.EXERCISE, "avoid_valsalva", "Breath holding during heavy lifts",
                "1rm", "max lift", "powerlifting", "heavy deadlift", "breath hold");

        // ===== 心脏病 =====
        register("heart_disease", PlanType.EXERCISE, "avoid_high_intensity", "High intensity exercise",
                "hiit", "sprint", "burpee", "tabata", "interval sprint");

        // ===== 肥胖 / 关节炎：避免高冲击 =====
        register("obesity", PlanType.EXERCISE, "avoid_high_impact", "High impact exercises",
                "jump", "running", "sprint", "plyometric", "burpee", "box jump");
        register("arthritis", PlanType.EXERCISE, "avoid_high_impact", "Running, jumping",
                "jump", "running", "sprint", "plyometric", "burpee", "box jump");
    }

    private ConditionRestrictionTable() {
    }

    private static void register(String condition, PlanType planType, String key, String description, String... keywords) {
        List<String> lowered = new ArrayList<>(keywords.length);
        for (String keyword : keywords) {
            lowered.add(keyword.toLowerCase(Locale.ROOT));
        }
        TABLE.computeIfAbsent(condition, c -> new ArrayList<>())
                .add(new Restriction(condition, planType, key, description, Collections.unmodifiableList(lowered)));
    }

    /**
     * 病症名大小写不敏感，空格/连字符视为下划线
     */
    public static String normalizeCondition(String condition) {
        if (condition == null) {
            return "";
        }
        return condition.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
    }

    public static List<Restriction> restrictionsFor(String condition, PlanType planType) {
        List<Restriction> all = TABLE.getOrDefault(normalizeCondition(condition), Collections.emptyList());
        List<Restriction> matched = new ArrayList<>();
        for (Restriction restriction : all) {
            if (planType == null || restriction.getPlanType() == planType) {
                matched.add(restriction);
            }
        }
        return matched;
    }

    public static boolean isKnownCondition(String condition) {
        return TABLE.containsKey(normalizeCondition(condition));
    }
}
