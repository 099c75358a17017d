package com.lazystream.core;

/**
 * Terminal descriptor that drains its generator to exhaustion. Only {@link FiniteStream} accepts it, so pointing
 * one at an {@link InfiniteStream} fails to compile.
 */
@FunctionalInterface
public interface FiniteTerminal<T, R> {
    /** @param generator a fresh copy of the stream's generator, owned by this evaluation */
    R evaluate(Generator<T> generator);

    /** Label used in logs and metric names. */
    default String name() { return "terminal"; }
}
