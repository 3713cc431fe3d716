package com.lyz.healthplan.common.exception;

/**
 * 配置错误：评分策略/匹配器缺失或非法、缩放区间非法、数量参数小于 1
 * 继承 IllegalArgumentException，由全局异常处理器映射为 400
 */
public class PlanConfigurationException extends IllegalArgumentException {

    public PlanConfigurationException(String message) {
        super(message);
    }
}
