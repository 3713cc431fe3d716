package com.lyz.healthplan.model.safety;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * 风险等级（同时用作风险因子的严重程度）
 */
public enum RiskLevel {

    LOW("low", 5),
    MODERATE("moderate", 15),
    HIGH("high", 30),
    VERY_HIGH("very_high", 50);

    private final String code;
    /**
     * 加权评分中每个该级别风险因子的扣分
     */
    private final int penalty;

    RiskLevel(String code, int penalty) {
        this.code = code;
        this.penalty = penalty;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getPenalty() {
        return penalty;
    }

    public boolean isSevere() {
        return this == HIGH || this == VERY_HIGH;
    }

    @JsonCreator
    public static RiskLevel fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            throw new IllegalArgumentException("风险等级不能为空");
        }
        String normalized = code.trim().toLowerCase().replace(' ', '_').replace('-', '_');
        if ("medium".equals(normalized)) {
            return MODERATE;
        }
        for (RiskLevel level : values()) {
            if (level.code.equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("未知风险等级: " + code);
    }
}
