package com.lyz.healthplan.service.safety.policy;

import com.lyz.healthplan.common.exception.PlanConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScoringPolicyTypeTest {

    @Test
    void codes_are_parsed_leniently() {
        assertEquals(ScoringPolicyType.WEIGHTED, ScoringPolicyType.fromCode("Weighted"));
        assertEquals(ScoringPolicyType.RISK_GATE, ScoringPolicyType.fromCode("risk_gate"));
        assertEquals(ScoringPolicyType.CHECK_GATE, ScoringPolicyType.fromCode(" check-gate "));
    }

    @Test
    void missing_or_unknown_policy_is_a_configuration_error() {
        assertThrows(PlanConfigurationException.class, () -> ScoringPolicyType.fromCode(null));
        assertThrows(PlanConfigurationException.class, () -> ScoringPolicyType.fromCode(""));
        assertThrows(PlanConfigurationException.class, () -> ScoringPolicyType.fromCode("lenient"));
    }
}
