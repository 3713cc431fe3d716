package com.lyz.healthplan.model.food;

import org.apache.commons.lang3.StringUtils;

/**
 * 食物份量单位
 * 连续单位直接按比例缩放，离散单位按固定步长取整，勺保持不变
 */
public enum FoodUnit {

    GRAM("gram", Scaling.CONTINUOUS, 0.0),
    ML("ml", Scaling.CONTINUOUS, 0.0),
    PIECE("piece", Scaling.DISCRETE, 0.5),
    SLICE("slice", Scaling.DISCRETE, 1.0),
    CUP("cup", Scaling.DISCRETE, 0.5),
    BOWL("bowl", Scaling.DISCRETE, 0.5),
    SPOON("spoon", Scaling.FIXED, 0.0);

    public enum Scaling {
        CONTINUOUS,
        DISCRETE,
        FIXED
    }

    private final String code;
    private final Scaling scaling;
    private final double increment;

    FoodUnit(String code, Scaling scaling, double increment) {
        this.code = code;
        this.scaling = scaling;
        this.increment = increment;
    }

    public String getCode() {
        return code;
    }

    public Scaling getScaling() {
        return scaling;
    }

    /**
     * 离散单位的最小步长，非离散单位为 0
     */
    public double getIncrement() {
        return increment;
    }

    /**
     * 按编码解析单位，未知单位返回 null（调用方按连续单位兜底）
     */
    public static FoodUnit fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        for (FoodUnit unit : values()) {
            if (unit.code.equals(normalized)) {
                return unit;
            }
        }
        return null;
    }

    public static String allowedCodes() {
        StringBuilder sb = new StringBuilder("[");
        for (FoodUnit unit : values()) {
            if (sb.length() > 1) sb.append(", ");
            sb.append('"').append(unit.code).append('"');
        }
        return sb.append(']').toString();
    }
}
