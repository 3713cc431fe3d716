package com.lyz.healthplan.common.exception;

/**
 * 基础方案生成失败（调用异常、空输出、结构非法、超时）
 * 流水线捕获后跳过该基础方案
 */
public class CandidateGenerationException extends RuntimeException {

    public CandidateGenerationException(String message) {
        super(message);
    }

    public CandidateGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
