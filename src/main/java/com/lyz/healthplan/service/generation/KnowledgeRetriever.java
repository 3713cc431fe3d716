package com.lyz.healthplan.service.generation;

import com.lyz.healthplan.model.dto.UserMetadata;
import com.lyz.healthplan.model.safety.PlanType;

/**
 * 领域知识检索，返回不透明的文本块（只拼进提示词，不做解析）
 */
public interface KnowledgeRetriever {

    String retrieve(UserMetadata user, PlanType planType);
}
