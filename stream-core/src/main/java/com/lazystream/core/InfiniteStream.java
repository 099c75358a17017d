package com.lazystream.core;

import java.util.Objects;

/**
 * Stream with no known end. Only bounded terminals apply; {@link #pipe(Take)} is the way back to a
 * {@link FiniteStream}.
 */
public final class InfiniteStream<T> extends Stream<T> {

    InfiniteStream(String name, Generator<T> generator) {
        super(name, generator);
    }

    @Override
    public boolean isFinite() { return false; }

    @Override
    public InfiniteStream<T> copy() {
        return new InfiniteStream<>(name, generator.copy());
    }

    @Override
    public InfiniteStream<T> named(String name) {
        return new InfiniteStream<>(name, generator.copy());
    }

    public <R> InfiniteStream<R> pipe(Combinator<T, R> combinator) {
        Objects.requireNonNull(combinator, "combinator");
        return new InfiniteStream<>(name, combinator.wrap(generator.copy()));
    }

    public FiniteStream<T> pipe(Take<T> take) {
        Objects.requireNonNull(take, "take");
        return new FiniteStream<>(name, take.wrap(generator.copy()));
    }

    @Override
    public InfiniteStream<T> skip(long amount) {
        return pipe(Ops.<T>skip(amount));
    }

    @Override
    public FiniteStream<T> take(long limit) {
        return pipe(Ops.<T>take(limit));
    }
}
