package com.lyz.healthplan.service.generation;

import lombok.Value;

/**
 * 基础方案 + 供下一次调用复用的检索上下文
 */
@Value
public class GenerationResult<T> {
    T candidate;
    String retrievalContext;
}
