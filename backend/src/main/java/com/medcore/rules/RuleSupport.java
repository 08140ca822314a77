package com.medcore.rules;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Null-safe threshold tests and value formatting shared by the rule definitions.
 * An absent value never satisfies a threshold.
 */
final class RuleSupport {

    private RuleSupport() {
    }

    static boolean above(Optional<Double> value, double threshold) {
        return value.map(v -> v > threshold).orElse(false);
    }

    static boolean atLeast(Optional<Double> value, double threshold) {
        return value.map(v -> v >= threshold).orElse(false);
    }

    static boolean below(Optional<Double> value, double threshold) {
        return value.map(v -> v < threshold).orElse(false);
    }

    static boolean isTrue(Optional<Boolean> flag) {
        return flag.orElse(false);
    }

    static String format(Optional<Double> value) {
        return value.map(RuleSupport::format).orElse("--");
    }

    static String format(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
