package com.lazystream.core;

import java.util.Optional;

/**
 * Pull-based producer behind every stream stage.
 *
 * <p>{@link #next()} either yields the next element or signals exhaustion with {@link Optional#empty()}.
 * There is no separate has-more query; advancing is the only way to observe the sequence. Once a generator
 * returned empty it keeps returning empty.
 *
 * <p>Generators are not thread-safe. Elements are never {@code null}.
 */
public interface Generator<T> {

    /** Produce the next element, or empty when the sequence is exhausted. */
    Optional<T> next();

    /**
     * Independent generator positioned at this generator's construction state, not at its current position.
     * Copying an advanced skip or take stage gives one whose counters start over. Sources restart as far as
     * they can: a container copy starts again at its first element, but a supplier-backed source keeps calling
     * the same supplier and does not rewind whatever state that supplier holds.
     *
     * <p>Advancing the copy never affects this instance and vice versa. Streams only copy generators they never
     * advance, so through {@link Stream} a copy is always indistinguishable from the original.
     */
    Generator<T> copy();
}
