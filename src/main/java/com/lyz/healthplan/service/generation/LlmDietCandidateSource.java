package com.lyz.healthplan.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lyz.healthplan.common.exception.CandidateGenerationException;
import com.lyz.healthplan.model.food.BaseFoodItem;
import com.lyz.healthplan.model.safety.PlanType;
import com.lyz.healthplan.util.JsonBlockExtractor;
import com.lyz.healthplan.util.LlmChatClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 调用大模型生成单餐基础食物条目
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmDietCandidateSource implements CandidateSource<List<BaseFoodItem>> {

    private static final double TEMPERATURE = 0.7;

    private final LlmChatClient llmChatClient;
    private final KnowledgeRetriever knowledgeRetriever;
    private final PromptTemplates promptTemplates;
    private final ObjectMapper objectMapper;

    @Override
    public GenerationResult<List<BaseFoodItem>> generate(GenerationRequest request) {
        // 检索上下文只取一次，之后沿用调用方传回的值
        String context = request.getRetrievalContext();
        if (context == null) {
            context = knowledgeRetriever.retrieve(request.getUser(), PlanType.DIET);
        }
        GenerationRequest effective = request.withRetrievalContext(context);

        String raw;
        try {
            raw = llmChatClient.chat(PromptTemplates.DIET_SYSTEM_PROMPT, promptTemplates.renderDietPrompt(effective), TEMPERATURE);
        } catch (IllegalStateException e) {
            throw new CandidateGenerationException("饮食方案生成调用失败: " + e.getMessage(), e);
        }
        return new GenerationResult<>(parseItems(raw), context);
    }

    List<BaseFoodItem> parseItems(String raw) {
        if (StringUtils.isBlank(raw)) {
            throw new CandidateGenerationException("大模型返回为空");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(JsonBlockExtractor.extract(raw));
        } catch (Exception e) {
            throw new CandidateGenerationException("饮食方案不是合法 JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new CandidateGenerationException("饮食方案应为 JSON 数组");
        }
        List<BaseFoodItem> items = new ArrayList<>();
        for (int i = 0; i < root.size(); i++) {
            try {
                BaseFoodItem item = objectMapper.treeToValue(root.get(i), BaseFoodItem.class);
                if (item != null && StringUtils.isNotBlank(item.getName())) {
                    items.add(item);
                } else {
                    log.warn("第 {} 个食物条目缺少名称，已丢弃", i);
                }
            } catch (Exception e) {
                log.warn("第 {} 个食物条目解析失败，已丢弃: {}", i, e.getMessage());
            }
        }
        if (items.isEmpty()) {
            throw new CandidateGenerationException("饮食方案中没有有效的食物条目");
        }
        return items;
    }
}
