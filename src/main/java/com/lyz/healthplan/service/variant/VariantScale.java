package com.lyz.healthplan.service.variant;

import lombok.Value;

/**
 * 变体名称与缩放系数
 */
@Value
public class VariantScale {
    String name;
    double factor;
}
