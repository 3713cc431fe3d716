package com.lyz.healthplan.config;

import com.lyz.healthplan.common.exception.PlanConfigurationException;
import com.lyz.healthplan.service.variant.ScaleFactorSchedule;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 流水线默认参数（plan.pipeline.*）
 */
@Data
@Slf4j
@ConfigurationProperties(prefix = "plan.pipeline")
public class PipelineProperties {

    /**
     * 每轮调用生成器的次数 B
     */
    private int basePlanCount = 3;

    /**
     * 每个基础方案展开的变体数 V
     */
    private int variantCount = 3;

    /**
     * 保留的最优方案数 K
     */
    private int topK = 3;

    private String outputDir = "output";

    private ScaleRange diet = new ScaleRange(0.8, 1.2);

    private ScaleRange exercise = new ScaleRange(0.7, 1.3);

    @Data
    public static class ScaleRange {
        private double minScale;
        private double maxScale;

        public ScaleRange() {
        }

        public ScaleRange(double minScale, double maxScale) {
            this.minScale = minScale;
            this.maxScale = maxScale;
        }
    }

    @PostConstruct
    public void validate() {
        if (basePlanCount < 1) {
            throw new PlanConfigurationException("plan.pipeline.base-plan-count 必须 ≥ 1，当前: " + basePlanCount);
        }
        if (topK < 1) {
            throw new PlanConfigurationException("plan.pipeline.top-k 必须 ≥ 1，当前: " + topK);
        }
        ScaleFactorSchedule.validate(variantCount, diet.getMinScale(), diet.getMaxScale());
        ScaleFactorSchedule.validate(variantCount, exercise.getMinScale(), exercise.getMaxScale());
        log.info("流水线配置加载完成: B={}, V={}, K={}, diet=[{}, {}], exercise=[{}, {}], outputDir={}",
                basePlanCount, variantCount, topK, diet.getMinScale(), diet.getMaxScale(),
                exercise.getMinScale(), exercise.getMaxScale(), outputDir);
    }
}
