package com.lyz.healthplan.service.safety.policy;

import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.safety.PlanType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScoringContext {
    PlanType planType;
    UserMetadata user;
}
