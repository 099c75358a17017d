package com.lazystream.core;

/**
 * Terminal descriptor accepted by every stream, finite or not. It must stop pulling on its own (a fixed count),
 * since the generator it receives may be unbounded.
 */
@FunctionalInterface
public interface Terminal<T, R> {
    /** @param generator a fresh copy of the stream's generator, owned by this evaluation */
    R evaluate(Generator<T> generator);

    /** Label used in logs and metric names. */
    default String name() { return "terminal"; }
}
