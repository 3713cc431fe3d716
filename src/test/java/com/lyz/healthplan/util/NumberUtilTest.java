package com.lyz.healthplan.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NumberUtilTest {

    @Test
    void rounding_is_half_up() {
        assertEquals(0.3, NumberUtil.round1(0.25));
        assertEquals(2.68, NumberUtil.round2(2.675));
        assertEquals(3, NumberUtil.roundToInt(2.5));
        assertEquals(-42.2, NumberUtil.round1(-42.159));
        assertEquals(4L, NumberUtil.roundToLong(3.5));
    }

    @Test
    void floating_noise_does_not_leak_into_results() {
        assertEquals(21, NumberUtil.roundToInt(30 * 0.7));
        assertEquals(120.0, NumberUtil.round1(100 * 1.2));
    }

    @Test
    void non_finite_values_become_zero() {
        assertEquals(0.0, NumberUtil.round1(Double.NaN));
        assertEquals(0, NumberUtil.roundToInt(Double.POSITIVE_INFINITY));
    }
}
