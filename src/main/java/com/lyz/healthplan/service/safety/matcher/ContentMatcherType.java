package com.lyz.healthplan.service.safety.matcher;

import com.lyz.healthplan.common.exception.PlanConfigurationException;
import org.apache.commons.lang3.StringUtils;

public enum ContentMatcherType {

    /**
     * 子串匹配
     */
    KEYWORD("keyword"),
    /**
     * 词边界匹配，避免 ham 命中 graham
     */
    WORD_BOUNDARY("word-boundary");

    private final String code;

    ContentMatcherType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static ContentMatcherType fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            throw new PlanConfigurationException("未配置内容匹配器 plan.safety.content-matcher，可选值: keyword / word-boundary");
        }
        String normalized = code.trim().toLowerCase().replace('_', '-');
        for (ContentMatcherType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        throw new PlanConfigurationException("未知内容匹配器: " + code + "，可选值: keyword / word-boundary");
    }
}
