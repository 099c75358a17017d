package com.lazystream.core;

import com.lazystream.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Function;

/**
 * User-facing handle over one generator chain.
 *
 * <p>The subclass is the finiteness marker: {@link FiniteStream} or {@link InfiniteStream}. Stages are appended
 * with {@code pipe(...)}, which never advances this stream's generator. Combinators capture a copy of it and
 * terminals consume a fresh copy, so one stream can be evaluated any number of times.
 *
 * <p>Not thread-safe.
 */
public abstract sealed class Stream<T> permits FiniteStream, InfiniteStream {
    private static final Logger log = LoggerFactory.getLogger(Stream.class);

    static final String DEFAULT_NAME = "stream";

    /** Prototype chain; only ever copied, never pulled from. */
    final Generator<T> generator;
    final String name;

    Stream(String name, Generator<T> generator) {
        this.name = Objects.requireNonNull(name, "name");
        this.generator = Objects.requireNonNull(generator, "generator");
    }

    /** Whether this stream is known to be bounded. Fixed for the lifetime of the instance. */
    public abstract boolean isFinite();

    /** Independent stream over a copy of the same generator chain. */
    public abstract Stream<T> copy();

    /** Same chain under a different label for logs and metrics. */
    public abstract Stream<T> named(String name);

    /** Drops the first {@code amount} elements; see {@link Ops#skip}. */
    public abstract Stream<T> skip(long amount);

    public abstract FiniteStream<T> take(long limit);

    public String name() { return name; }

    /** Applies a terminal that is legal on any stream, such as {@link Ops#nth}. */
    public <R> R pipe(Terminal<T, R> terminal) {
        Objects.requireNonNull(terminal, "terminal");
        return evaluate(terminal.name(), terminal::evaluate);
    }

    <R> R evaluate(String operation, Function<Generator<T>, R> body) {
        var rec = Metrics.recorder();
        long t0 = System.nanoTime();
        try {
            R result = body.apply(generator.copy());
            long elapsed = System.nanoTime() - t0;
            rec.onTerminalSuccess(name, operation, elapsed);
            if (log.isDebugEnabled()) {
                log.debug("terminal '{}' on '{}' took {} us", operation, name, elapsed / 1_000);
            }
            return result;
        } catch (RuntimeException ex) {
            rec.onTerminalError(name, operation, ex);
            log.debug("terminal '{}' on '{}' failed", operation, name, ex);
            throw ex;
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
