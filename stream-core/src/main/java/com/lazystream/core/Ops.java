package com.lazystream.core;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Descriptors for {@code pipe(...)}: combinators, which produce a new stream, and terminals, which produce a
 * value or a side effect.
 *
 * <pre>{@code
 * FiniteStream<Integer> s = Streams.of(1, 2, 3, 4, 5);
 * List<List<Integer>> groups = s.pipe(Ops.group(3)).pipe(Ops.toList());   // [[1, 2, 3], [4, 5]]
 * int fourth = s.pipe(Ops.nth(3));                                         // 4
 * }</pre>
 *
 * Arguments are validated when the descriptor is created, not when it is applied.
 */
public final class Ops {
    public static final String DEFAULT_DELIMITER = " ";

    private Ops() {}

    // ---- combinators ----

    public static <T> Combinator<T, T> skip(long amount) {
        if (amount < 0) throw new IllegalArgumentException("skip amount must be >= 0");
        return upstream -> new SkipGenerator<>(upstream, amount);
    }

    /** Bounded take; the resulting stream is always finite. */
    public static <T> Take<T> take(long limit) {
        return new Take<>(limit);
    }

    /** Older name for {@link #take}. */
    public static <T> Take<T> get(long limit) {
        return take(limit);
    }

    public static <T> Combinator<T, T> filter(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return upstream -> new FilterGenerator<>(upstream, predicate);
    }

    public static <T> Combinator<T, List<T>> group(int size) {
        if (size <= 0) throw new IllegalArgumentException("group size must be > 0");
        return upstream -> new GroupGenerator<>(upstream, size);
    }

    public static <T, R> Combinator<T, R> map(Function<? super T, ? extends R> transform) {
        Objects.requireNonNull(transform, "transform");
        return upstream -> new MapGenerator<>(upstream, transform);
    }

    // ---- terminals ----

    /** Zero-based positional lookup. Legal on infinite streams too, it pulls at most {@code n + 1} times. */
    public static <T> Terminal<T, T> nth(long n) {
        if (n < 0) throw new IllegalArgumentException("index must be >= 0");
        return new NamedTerminal<T, T>("nth", gen -> {
            Optional<T> current = Optional.empty();
            long pulled = 0;
            while (pulled <= n && (current = gen.next()).isPresent()) {
                pulled++;
            }
            if (pulled <= n) throw StreamOperationException.insufficientElements("nth", n, pulled);
            return current.get();
        });
    }

    public static <T, A extends Appendable> FiniteTerminal<T, A> printTo(A sink) {
        return printTo(sink, DEFAULT_DELIMITER);
    }

    /** Writes the elements separated by {@code delimiter}; nothing at all for an empty stream. Returns the sink. */
    public static <T, A extends Appendable> FiniteTerminal<T, A> printTo(A sink, CharSequence delimiter) {
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(delimiter, "delimiter");
        return new NamedFiniteTerminal<T, A>("printTo", gen -> {
            try {
                Optional<T> value = gen.next();
                if (value.isPresent()) {
                    sink.append(String.valueOf(value.get()));
                    while ((value = gen.next()).isPresent()) {
                        sink.append(delimiter).append(String.valueOf(value.get()));
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException("printTo failed writing to sink", e);
            }
            return sink;
        });
    }

    /** Sum of numeric elements, added in the elements' own type. */
    public static <T extends Number> FiniteTerminal<T, T> sum() {
        return new NamedFiniteTerminal<T, T>("sum",
            gen -> Ops.<T, T>fold("sum", gen, Function.identity(), Numbers::add));
    }

    /** Left-to-right sum using the given addition. */
    public static <T> FiniteTerminal<T, T> sum(BinaryOperator<T> plus) {
        Objects.requireNonNull(plus, "plus");
        return new NamedFiniteTerminal<T, T>("sum", gen -> Ops.<T, T>fold("sum", gen, Function.identity(), plus));
    }

    /** Fold seeded with the first element itself, widened to the accumulator type. */
    public static <T extends U, U> FiniteTerminal<T, U> reduce(BiFunction<U, ? super T, U> accumulator) {
        Objects.requireNonNull(accumulator, "accumulator");
        return new NamedFiniteTerminal<T, U>("reduce",
            gen -> Ops.<T, U>fold("reduce", gen, first -> first, accumulator));
    }

    /** Fold seeded with {@code identity(first)}, then {@code accumulator} over every later element. */
    public static <T, U> FiniteTerminal<T, U> reduce(Function<? super T, ? extends U> identity,
                                                     BiFunction<? super U, ? super T, ? extends U> accumulator) {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(accumulator, "accumulator");
        return new NamedFiniteTerminal<T, U>("reduce",
            gen -> Ops.<T, U>fold("reduce", gen, identity, accumulator));
    }

    public static <T> FiniteTerminal<T, List<T>> toList() {
        return new NamedFiniteTerminal<T, List<T>>("toList", gen -> {
            List<T> out = new ArrayList<>();
            for (Optional<T> value; (value = gen.next()).isPresent(); ) {
                out.add(value.get());
            }
            return Collections.unmodifiableList(out);
        });
    }

    // ---- internal ----

    private static <T, U> U fold(String operation,
                                 Generator<T> gen,
                                 Function<? super T, ? extends U> identity,
                                 BiFunction<? super U, ? super T, ? extends U> accumulator) {
        Optional<T> value = gen.next();
        if (value.isEmpty()) throw StreamOperationException.emptySource(operation);
        U result = identity.apply(value.get());
        while ((value = gen.next()).isPresent()) {
            result = accumulator.apply(result, value.get());
        }
        return result;
    }

    private record NamedTerminal<T, R>(String name, Function<Generator<T>, R> body) implements Terminal<T, R> {
        @Override
        public R evaluate(Generator<T> generator) { return body.apply(generator); }
    }

    private record NamedFiniteTerminal<T, R>(String name, Function<Generator<T>, R> body)
        implements FiniteTerminal<T, R> {
        @Override
        public R evaluate(Generator<T> generator) { return body.apply(generator); }
    }
}
