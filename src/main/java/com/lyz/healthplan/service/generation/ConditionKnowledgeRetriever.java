package com.lyz.healthplan.service.generation;

import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.service.safety.rule.ConditionRestrictionTable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 基于病症禁忌表与饮食限制构建领域知识文本
 * 用户无病症且无饮食限制时返回空串
 */
@Slf4j
@Component
public class ConditionKnowledgeRetriever implements KnowledgeRetriever {

    @Override
    public String retrieve(UserMetadata user, PlanType planType) {
        if (user == null) {
            return "";
        }
        Set<String> forbidden = new LinkedHashSet<>();
        List<String> unknownConditions = new ArrayList<>();
        if (user.getMedicalConditions() != null) {
            for (String condition : user.getMedicalConditions()) {
                if (!ConditionRestrictionTable.isKnownCondition(condition)) {
                    unknownConditions.add(condition);
                    continue;
                }
                for (ConditionRestrictionTable.Restriction restriction :
                        ConditionRestrictionTable.restrictionsFor(condition, planType)) {
                    forbidden.add(restriction.getCondition() + ": " + restriction.getDescription()
                            + " (" + String.join(", ", restriction.getKeywords()) + ")");
                }
            }
        }
        List<String> dietaryRestrictions = planType == PlanType.DIET && user.getDietaryRestrictions() != null
                ? user.getDietaryRestrictions() : new ArrayList<>();

        if (forbidden.isEmpty() && dietaryRestrictions.isEmpty() && unknownConditions.isEmpty()) {
            return "";
        }

        StringBuilder sb = new StringBuilder();
        if (!forbidden.isEmpty()) {
            String label = planType == PlanType.DIET ? "饮食绝对禁忌" : "训练安全红线";
            sb.append(" - ").append(label).append("：").append(String.join("; ", forbidden)).append(";\n");
        }
        if (!dietaryRestrictions.isEmpty()) {
            sb.append(" - 饮食限制：").append(String.join(", ", dietaryRestrictions)).append(";\n");
        }
        if (!unknownConditions.isEmpty()) {
            sb.append(" - 其他健康状况（需谨慎）：").append(String.join(", ", unknownConditions)).append(";\n");
        }
        String context = StringUtils.stripEnd(sb.toString(), "\n");
        log.info("领域知识检索完成, planType={}, 禁忌{}条, 饮食限制{}条",
                planType.getCode(), forbidden.size(), dietaryRestrictions.size());
        return context;
    }
}
