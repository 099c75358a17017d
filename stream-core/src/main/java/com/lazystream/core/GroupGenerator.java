package com.lazystream.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Batches consecutive upstream elements into lists of {@code size}. The last batch may be shorter; a batch is
 * never empty.
 */
public final class GroupGenerator<T> implements Generator<List<T>> {
    private final Generator<T> upstream;
    private final int size;

    public GroupGenerator(Generator<T> upstream, int size) {
        if (size <= 0) throw new IllegalArgumentException("group size must be > 0");
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.size = size;
    }

    @Override
    public Optional<List<T>> next() {
        Optional<T> first = upstream.next();
        if (first.isEmpty()) return Optional.empty();

        List<T> batch = new ArrayList<>(Math.min(size, 16));
        batch.add(first.get());
        while (batch.size() < size) {
            Optional<T> more = upstream.next();
            if (more.isEmpty()) break;
            batch.add(more.get());
        }
        return Optional.of(Collections.unmodifiableList(batch));
    }

    @Override
    public Generator<List<T>> copy() {
        return new GroupGenerator<>(upstream.copy(), size);
    }
}
