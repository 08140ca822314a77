package com.medcore.knowledge;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single reference to an immutable knowledge table.
 *
 * Readers call {@link #current()} once per evaluation and work on that instance
 * only, so a concurrent {@link #publish(Object)} is never observed half-applied.
 */
@Slf4j
public class KnowledgeSnapshotHolder<T> {

    private final String name;
    private final AtomicReference<T> current;

    public KnowledgeSnapshotHolder(String name, T initial) {
        this.name = name;
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, name + " must not be null"));
    }

    public T current() {
        return current.get();
    }

    /**
     * Swaps in a new snapshot and returns the one it replaced.
     */
    public T publish(T replacement) {
        Objects.requireNonNull(replacement, name + " must not be null");
        T previous = current.getAndSet(replacement);
        log.info("Published new {} snapshot", name);
        return previous;
    }

    public String getName() {
        return name;
    }
}
