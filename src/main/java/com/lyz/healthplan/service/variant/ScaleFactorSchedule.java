package com.lyz.healthplan.service.variant;

import com.lyz.healthplan.common.exception.PlanConfigurationException;
import com.lyz.healthplan.util.NumberUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 缩放系数序列
 * N=1 取区间中点；N=2 取两端；N≥3 两端包含的等距插值，最后一个系数严格等于 max
 */
public final class ScaleFactorSchedule {

    /**
     * 中间系数保留的小数位，消除插值误差（如 0.9999999999999999）
     */
    private static final int FACTOR_SCALE = 6;

    private ScaleFactorSchedule() {
    }

    public static List<VariantScale> build(int count, double minScale, double maxScale) {
        validate(count, minScale, maxScale);
        List<VariantScale> scales = new ArrayList<>(count);
        if (count == 1) {
            scales.add(new VariantScale(variantName(1), NumberUtil.round((minScale + maxScale) / 2.0, FACTOR_SCALE)));
            return Collections.unmodifiableList(scales);
        }
        double step = (maxScale - minScale) / (count - 1);
        for (int i = 0; i < count; i++) {
            double factor;
            if (i == 0) {
                factor = minScale;
            } else if (i == count - 1) {
                factor = maxScale;
            } else {
                factor = NumberUtil.round(minScale + step * i, FACTOR_SCALE);
            }
            scales.add(new VariantScale(variantName(i + 1), factor));
        }
        return Collections.unmodifiableList(scales);
    }

    public static void validate(int count, double minScale, double maxScale) {
        if (count < 1) {
            throw new PlanConfigurationException("变体数量必须 ≥ 1，当前: " + count);
        }
        if (minScale <= 0) {
            throw new PlanConfigurationException("min_scale 必须大于 0，当前: " + minScale);
        }
        if (minScale > maxScale) {
            throw new PlanConfigurationException("min_scale 不能大于 max_scale: " + minScale + " > " + maxScale);
        }
    }

    public static String variantName(int index) {
        return "Variant_" + index;
    }
}
