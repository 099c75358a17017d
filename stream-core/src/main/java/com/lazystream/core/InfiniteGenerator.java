package com.lazystream.core;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/** Calls a zero-argument producer on every pull; never exhausted. */
public final class InfiniteGenerator<T> implements Generator<T> {
    private final Supplier<? extends T> producer;

    public InfiniteGenerator(Supplier<? extends T> producer) {
        this.producer = Objects.requireNonNull(producer, "producer");
    }

    @Override
    public Optional<T> next() {
        T value = producer.get();
        return Optional.of(Objects.requireNonNull(value, "producer returned null"));
    }

    @Override
    public Generator<T> copy() {
        return new InfiniteGenerator<>(producer);
    }
}
