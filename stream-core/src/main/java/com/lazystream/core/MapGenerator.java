package com.lazystream.core;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

public final class MapGenerator<T, R> implements Generator<R> {
    private final Generator<T> upstream;
    private final Function<? super T, ? extends R> transform;

    public MapGenerator(Generator<T> upstream, Function<? super T, ? extends R> transform) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.transform = Objects.requireNonNull(transform, "transform");
    }

    @Override
    public Optional<R> next() {
        Optional<T> value = upstream.next();
        if (value.isEmpty()) return Optional.empty();
        return Optional.of(Objects.requireNonNull(transform.apply(value.get()), "transform returned null"));
    }

    @Override
    public Generator<R> copy() {
        return new MapGenerator<>(upstream.copy(), transform);
    }
}
