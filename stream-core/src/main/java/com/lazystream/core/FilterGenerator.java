package com.lazystream.core;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

public final class FilterGenerator<T> implements Generator<T> {
    private final Generator<T> upstream;
    private final Predicate<? super T> predicate;

    public FilterGenerator(Generator<T> upstream, Predicate<? super T> predicate) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.predicate = Objects.requireNonNull(predicate, "predicate");
    }

    @Override
    public Optional<T> next() {
        Optional<T> candidate;
        do {
            candidate = upstream.next();
        } while (candidate.isPresent() && !predicate.test(candidate.get()));
        return candidate;
    }

    @Override
    public Generator<T> copy() {
        return new FilterGenerator<>(upstream.copy(), predicate);
    }
}
