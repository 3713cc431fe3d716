package com.lyz.healthplan.service.safety.policy;

import com.lyz.healthplan.common.exception.PlanConfigurationException;
import org.apache.commons.lang3.StringUtils;

public enum ScoringPolicyType {

    /**
     * 通过率 - 严重程度扣分，分档判定
     */
    WEIGHTED("weighted"),
    /**
     * 存在高风险因子即不通过
     */
    RISK_GATE("risk-gate"),
    /**
     * 存在未通过检查项即不通过
     */
    CHECK_GATE("check-gate");

    private final String code;

    ScoringPolicyType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static ScoringPolicyType fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            throw new PlanConfigurationException("未配置评分策略，可选值: weighted / risk-gate / check-gate");
        }
        String normalized = code.trim().toLowerCase().replace('_', '-');
        for (ScoringPolicyType type : values()) {
            if (type.code.equals(normalized)) {
                return type;
            }
        }
        throw new PlanConfigurationException("未知评分策略: " + code + "，可选值: weighted / risk-gate / check-gate");
    }
}
