package com.lyz.healthplan.service.generation;

import com.lyz.healthplan.common.exception.CandidateGenerationException;

/**
 * 基础方案生成边界
 *
 * @param <T> 饮食为食物条目列表，运动为完整运动方案
 */
public interface CandidateSource<T> {

    /**
     * @throws CandidateGenerationException 调用失败、输出为空或结构非法
     */
    GenerationResult<T> generate(GenerationRequest request);
}
