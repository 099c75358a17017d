package com.lazystream.core;

import java.util.List;
import java.util.Objects;

/** Stream known to end. Accepts every terminal, including the ones that drain the whole sequence. */
public final class FiniteStream<T> extends Stream<T> {

    FiniteStream(String name, Generator<T> generator) {
        super(name, generator);
    }

    @Override
    public boolean isFinite() { return true; }

    @Override
    public FiniteStream<T> copy() {
        return new FiniteStream<>(name, generator.copy());
    }

    @Override
    public FiniteStream<T> named(String name) {
        return new FiniteStream<>(name, generator.copy());
    }

    /** Appends a combinator; the result is still finite. */
    public <R> FiniteStream<R> pipe(Combinator<T, R> combinator) {
        Objects.requireNonNull(combinator, "combinator");
        return new FiniteStream<>(name, combinator.wrap(generator.copy()));
    }

    public FiniteStream<T> pipe(Take<T> take) {
        Objects.requireNonNull(take, "take");
        return new FiniteStream<>(name, take.wrap(generator.copy()));
    }

    /** Applies a terminal that drains the stream. */
    public <R> R pipe(FiniteTerminal<T, R> terminal) {
        Objects.requireNonNull(terminal, "terminal");
        return evaluate(terminal.name(), terminal::evaluate);
    }

    @Override
    public FiniteStream<T> skip(long amount) {
        return pipe(Ops.<T>skip(amount));
    }

    @Override
    public FiniteStream<T> take(long limit) {
        return pipe(Ops.<T>take(limit));
    }

    public List<T> toList() {
        return pipe(Ops.<T>toList());
    }
}
