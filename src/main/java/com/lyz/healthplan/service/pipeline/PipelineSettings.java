package com.lyz.healthplan.service.pipeline;

import com.lyz.healthplan.common.exception.PlanConfigurationException;
import com.lyz.healthplan.service.variant.ScaleFactorSchedule;
import lombok.Builder;
import lombok.Value;

/**
 * 单次运行生效的参数（默认配置叠加请求覆盖值）
 */
@Value
@Builder
public class PipelineSettings {

    int basePlanCount;
    int variantCount;
    double minScale;
    double maxScale;
    int topK;

    /**
     * 在任何生成调用之前校验
     */
    public PipelineSettings validate() {
        if (basePlanCount < 1) {
            throw new PlanConfigurationException("基础方案数量必须 ≥ 1，当前: " + basePlanCount);
        }
        if (topK < 1) {
            throw new PlanConfigurationException("top_k 必须 ≥ 1，当前: " + topK);
        }
        ScaleFactorSchedule.validate(variantCount, minScale, maxScale);
        return this;
    }
}
