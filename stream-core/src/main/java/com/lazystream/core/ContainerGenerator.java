package com.lazystream.core;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Walks an owned, materialized list front to back.
 *
 * <p>The owned list is never modified after construction, so copies share it and only get a fresh cursor.
 * The cursor is opened on the first pull; a generator that is only ever copied never touches the list.
 */
public final class ContainerGenerator<T> implements Generator<T> {
    private final List<? extends T> data;
    private Iterator<? extends T> cursor;

    private ContainerGenerator(List<? extends T> data) {
        this.data = data;
    }

    /** Copies the elements; later changes to {@code source} are not observed. */
    public static <T> ContainerGenerator<T> copyOf(Collection<? extends T> source) {
        Objects.requireNonNull(source, "source");
        return new ContainerGenerator<>(List.copyOf(source));
    }

    /** Takes ownership of {@code source} without copying it. The caller must not modify it afterwards. */
    public static <T> ContainerGenerator<T> adopt(List<? extends T> source) {
        return new ContainerGenerator<>(Objects.requireNonNull(source, "source"));
    }

    @Override
    public Optional<T> next() {
        if (cursor == null) cursor = data.iterator();
        if (!cursor.hasNext()) return Optional.empty();
        return Optional.of(cursor.next());
    }

    @Override
    public Generator<T> copy() {
        return new ContainerGenerator<>(data);
    }
}
