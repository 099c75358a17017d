package com.lazystream.core;

/**
 * Intermediate stage descriptor: wraps an upstream generator into a new one. Applying a combinator keeps the
 * finiteness of the stream it is applied to.
 *
 * @see Ops
 */
@FunctionalInterface
public interface Combinator<T, R> {
    /** @param upstream a private copy the returned generator owns exclusively */
    Generator<R> wrap(Generator<T> upstream);
}
