package com.lyz.healthplan.model.food;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * 餐次及其占全天热量的比例
 */
public enum MealType {

    BREAKFAST("breakfast", 0.25),
    LUNCH("lunch", 0.35),
    DINNER("dinner", 0.30),
    SNACKS("snacks", 0.10);

    private final String code;
    private final double dailyShare;

    MealType(String code, double dailyShare) {
        this.code = code;
        this.dailyShare = dailyShare;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public double getDailyShare() {
        return dailyShare;
    }

    @JsonCreator
    public static MealType fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        if ("snack".equals(normalized)) {
            return SNACKS;
        }
        for (MealType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知餐次: " + code);
    }
}
