package com.lyz.healthplan.model.safety;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * 方案类型
 */
public enum PlanType {

    DIET("diet"),
    EXERCISE("exercise");

    private final String code;

    PlanType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static PlanType fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            throw new IllegalArgumentException("方案类型不能为空");
        }
        for (PlanType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知方案类型: " + code + "，可选值 diet / exercise");
    }
}
