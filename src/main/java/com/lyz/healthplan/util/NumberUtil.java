package com.lyz.healthplan.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 数值工具，统一使用 HALF_UP 舍入
 */
public final class NumberUtil {

    private NumberUtil() {
    }

    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    public static double round1(double value) {
        return round(value, 1);
    }

    public static double round2(double value) {
        return round(value, 2);
    }

    public static long roundToLong(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0L;
        }
        return BigDecimal.valueOf(value).setScale(0, RoundingMode.HALF_UP).longValue();
    }

    public static int roundToInt(double value) {
        return (int) roundToLong(value);
    }
}
