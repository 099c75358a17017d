package com.lazystream.core;

/**
 * Bounded-take descriptor. Kept apart from {@link Combinator} because it is the one stage that turns any
 * stream into a {@link FiniteStream}.
 */
public final class Take<T> {
    private final long limit;

    Take(long limit) {
        if (limit < 0) throw new IllegalArgumentException("take limit must be >= 0");
        this.limit = limit;
    }

    public long limit() { return limit; }

    Generator<T> wrap(Generator<T> upstream) {
        return new TakeGenerator<>(upstream, limit);
    }

    @Override
    public String toString() { return "take(" + limit + ")"; }
}
