package com.lyz.healthplan.model.safety;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * 单项安全检查结果
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SafetyCheck {

    String checkName;

    boolean passed;

    String message;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    RiskLevel severity;

    public static SafetyCheck pass(String checkName, String message) {
        return SafetyCheck.builder().checkName(checkName).passed(true).message(message).build();
    }

    public static SafetyCheck fail(String checkName, String message, RiskLevel severity) {
        return SafetyCheck.builder().checkName(checkName).passed(false).message(message).severity(severity).build();
    }
}
