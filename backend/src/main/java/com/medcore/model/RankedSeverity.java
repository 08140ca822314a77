package com.medcore.model;

import java.util.Comparator;
import java.util.function.Function;

/**
 * A severity level that can be placed in the canonical {@link SeverityBucket} order.
 */
public interface RankedSeverity {

    SeverityBucket bucket();

    /**
     * Orders items most severe first. Used with {@code List.sort}, which is stable,
     * so items of equal severity keep their original relative order. Items without
     * a severity sort last.
     */
    static <T> Comparator<T> mostSevereFirst(Function<T, ? extends RankedSeverity> severity) {
        return Comparator.comparingInt(item -> {
            RankedSeverity level = severity.apply(item);
            return level == null ? Integer.MAX_VALUE : level.bucket().rank();
        });
    }
}
