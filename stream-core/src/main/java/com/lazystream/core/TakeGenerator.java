package com.lazystream.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Forwards at most {@code limit} upstream pulls. Every forwarded pull uses one unit of the quota, including a
 * pull that came back empty.
 */
public final class TakeGenerator<T> implements Generator<T> {
    private final Generator<T> upstream;
    private final long limit;
    private long pulled;

    public TakeGenerator(Generator<T> upstream, long limit) {
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.limit = limit;
    }

    @Override
    public Optional<T> next() {
        if (pulled >= limit) return Optional.empty();
        pulled++;
        return upstream.next();
    }

    @Override
    public Generator<T> copy() {
        return new TakeGenerator<>(upstream.copy(), limit);
    }
}
