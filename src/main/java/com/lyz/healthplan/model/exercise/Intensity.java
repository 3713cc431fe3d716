package com.lyz.healthplan.model.exercise;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * 运动强度（有序：LOW < MODERATE < HIGH < VERY_HIGH）
 */
public enum Intensity {

    LOW("low"),
    MODERATE("moderate"),
    HIGH("high"),
    VERY_HIGH("very_high");

    private final String code;

    Intensity(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isAtLeast(Intensity other) {
        return this.ordinal() >= other.ordinal();
    }

    public static Intensity max(Intensity a, Intensity b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    @JsonCreator
    public static Intensity fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            throw new IllegalArgumentException("运动强度不能为空");
        }
        String normalized = code.trim().toLowerCase().replace(' ', '_').replace('-', '_');
        for (Intensity intensity : values()) {
            if (intensity.code.equals(normalized)) {
                return intensity;
            }
        }
        throw new IllegalArgumentException("未知运动强度: " + code);
    }
}
