package com.testflow.testflow_runner.variable;

import java.math.BigDecimal;

/** Text form of variable values and evaluation results: {@code 5.0 -> "5"}, {@code 2.50 -> "2.5"}. */
public final class ValueFormat {

    private ValueFormat() {
    }

    public static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                return d.toString();
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        return value.toString();
    }
}
