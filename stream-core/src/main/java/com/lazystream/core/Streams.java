package com.lazystream.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Typed entry points for building streams. Each factory fixes the finiteness of the result in its return type.
 *
 * <pre>{@code
 * InfiniteStream<Integer> ones = Streams.generate(() -> 1);
 * List<Integer> five = ones.pipe(Ops.take(5)).pipe(Ops.toList());      // [1, 1, 1, 1, 1]
 * }</pre>
 */
public final class Streams {
    private Streams() {}

    /** Unbounded stream of {@code producer.get()} results. */
    public static <T> InfiniteStream<T> generate(Supplier<? extends T> producer) {
        return new InfiniteStream<>(Stream.DEFAULT_NAME, new InfiniteGenerator<>(producer));
    }

    /**
     * Materializes the half-open range {@code [first, last)} of one list. {@code first} is advanced to
     * {@code last}'s position.
     */
    public static <T> FiniteStream<T> range(ListIterator<? extends T> first, ListIterator<? extends T> last) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(last, "last");
        return new FiniteStream<>(Stream.DEFAULT_NAME,
            ContainerGenerator.copyOf(SourceResolver.<T>materialize(first, last)));
    }

    /** Reads {@code iterator} to its end now and streams what it produced. */
    public static <T> FiniteStream<T> drain(Iterator<? extends T> iterator) {
        Objects.requireNonNull(iterator, "iterator");
        List<T> values = new ArrayList<>();
        iterator.forEachRemaining(values::add);
        return new FiniteStream<>(Stream.DEFAULT_NAME, ContainerGenerator.adopt(values));
    }

    /** Copies {@code values}; later changes to the collection are not seen by the stream. */
    public static <T> FiniteStream<T> of(Collection<? extends T> values) {
        return new FiniteStream<>(Stream.DEFAULT_NAME, ContainerGenerator.copyOf(values));
    }

    /** Takes ownership of {@code values} without copying; the caller must not modify the list afterwards. */
    public static <T> FiniteStream<T> adopt(List<? extends T> values) {
        return new FiniteStream<>(Stream.DEFAULT_NAME, ContainerGenerator.adopt(values));
    }

    /** Streams an array literal, copying it. */
    public static <T> FiniteStream<T> ofArray(T[] values) {
        Objects.requireNonNull(values, "values");
        return new FiniteStream<>(Stream.DEFAULT_NAME, ContainerGenerator.copyOf(Arrays.asList(values)));
    }

    /** Streams the given values in argument order. */
    @SafeVarargs
    public static <T> FiniteStream<T> of(T first, T... rest) {
        PackGenerator<T> pack = new PackGenerator<>();
        pack.append(first);
        for (T value : rest) pack.append(value);
        return new FiniteStream<>(Stream.DEFAULT_NAME, pack);
    }

    /** Runtime-classified construction; see {@link SourceResolver}. */
    public static <T> Stream<T> resolve(Object... args) {
        return SourceResolver.resolve(Stream.DEFAULT_NAME, args);
    }
}
