package org.csu.astcalc.common.util;

import java.math.BigDecimal;

/**
 * 数值的显示格式：普通十进制写法，不使用科学计数法，整数不带 ".0"。
 * 例如 14, -670, 0.5, 0.0000026535933140836576。
 */
public final class NumberFormatter {

    private NumberFormatter() {
    }

    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == 0.0) {
            // BigDecimal 不区分正负零
            return (1 / value < 0) ? "-0" : "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
