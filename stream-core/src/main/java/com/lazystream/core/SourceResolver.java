package com.lazystream.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Picks a generator for dynamically typed source arguments, for callers that do not know the source shape at
 * compile time (configuration, scripting). Statically typed code should prefer the {@link Streams} factories.
 *
 * <p>Precedence follows {@link SourceKind} declaration order. A {@link Supplier} always wins over
 * {@link Iterable}: anything that produces values on demand is a producer, never a container.
 */
public final class SourceResolver {
    private static final Logger log = LoggerFactory.getLogger(SourceResolver.class);

    private SourceResolver() {}

    public static SourceKind classify(Object... args) {
        Objects.requireNonNull(args, "args");
        if (args.length == 0) throw new IllegalArgumentException("A stream source needs at least one argument");
        for (int i = 0; i < args.length; i++) {
            if (args[i] == null) throw new IllegalArgumentException("Source argument " + i + " is null");
        }

        if (args.length == 1) {
            Object only = args[0];
            if (only instanceof Supplier<?>) return SourceKind.INFINITE;
            if (only instanceof Collection<?>) return SourceKind.CONTAINER_COPY;
            if (only instanceof Iterable<?>) return SourceKind.CONTAINER_ADOPT;
            if (only.getClass().isArray()) return SourceKind.LITERAL;
            if (isSourceShaped(only)) {
                throw new IllegalArgumentException("A lone " + only.getClass().getName()
                    + " is not a source; pass two ListIterators or use Streams.drain");
            }
            return SourceKind.PACK;
        }
        if (args.length == 2 && args[0] instanceof ListIterator<?> && args[1] instanceof ListIterator<?>) {
            return SourceKind.RANGE;
        }

        Class<?> type = args[0].getClass();
        for (Object arg : args) {
            if (isSourceShaped(arg)) {
                throw new IllegalArgumentException(
                    "Only scalar values can form a pack, got " + arg.getClass().getName());
            }
            if (arg.getClass() != type) {
                throw new IllegalArgumentException("Pack values must share one type: "
                    + type.getName() + " vs " + arg.getClass().getName());
            }
        }
        return SourceKind.PACK;
    }

    /** Builds a stream for {@code args}; pattern-match on the result to reach finite-only terminals. */
    @SuppressWarnings("unchecked")
    public static <T> Stream<T> resolve(String name, Object... args) {
        SourceKind kind = classify(args);
        log.debug("stream '{}' resolved source as {}", name, kind);
        return switch (kind) {
            case INFINITE -> new InfiniteStream<>(name, new InfiniteGenerator<>((Supplier<T>) args[0]));
            case RANGE -> new FiniteStream<>(name,
                ContainerGenerator.copyOf(materialize((ListIterator<T>) args[0], (ListIterator<T>) args[1])));
            case CONTAINER_COPY -> new FiniteStream<>(name, ContainerGenerator.copyOf((Collection<T>) args[0]));
            case CONTAINER_ADOPT ->
                new FiniteStream<>(name, ContainerGenerator.adopt(readOnce((Iterable<T>) args[0])));
            case LITERAL -> new FiniteStream<>(name, ContainerGenerator.copyOf(arrayElements(args[0])));
            case PACK -> {
                PackGenerator<T> pack = new PackGenerator<>();
                for (Object arg : args) pack.append((T) arg);
                yield new FiniteStream<>(name, pack);
            }
        };
    }

    /** Reads {@code first} forward until it reaches the position of {@code last}. */
    static <T> List<T> materialize(ListIterator<? extends T> first, ListIterator<? extends T> last) {
        int end = last.nextIndex();
        if (first.nextIndex() > end) {
            throw new IllegalArgumentException("Range start " + first.nextIndex() + " is after its end " + end);
        }
        List<T> out = new ArrayList<>(end - first.nextIndex());
        while (first.nextIndex() < end && first.hasNext()) {
            out.add(first.next());
        }
        return out;
    }

    /** Iterables without a copy capability may only be traversable once, so they are read exactly once here. */
    private static <T> List<T> readOnce(Iterable<T> source) {
        List<T> out = new ArrayList<>();
        source.forEach(out::add);
        return out;
    }

    @SuppressWarnings("unchecked")
    private static <T> List<T> arrayElements(Object array) {
        int length = Array.getLength(array);
        List<T> out = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            out.add((T) Array.get(array, i));
        }
        return out;
    }

    private static boolean isSourceShaped(Object arg) {
        return arg instanceof Supplier<?> || arg instanceof Iterable<?> || arg instanceof Iterator<?>
            || arg.getClass().isArray();
    }
}
