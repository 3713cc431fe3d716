package com.lyz.healthplan.model.safety;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AssessmentStatus {

    PASSED("passed"),
    WARNING("warning"),
    REVIEW("review"),
    FAILED("failed");

    private final String code;

    AssessmentStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
