package com.lazystream.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Generator over a pack of individually supplied values, filled one element at a time.
 *
 * <p>Every {@link #append} rewinds the cursor, so the generator must only be read once the pack is complete.
 */
public final class PackGenerator<T> implements Generator<T> {
    private final List<T> values;
    private int cursor;

    public PackGenerator() {
        this(new ArrayList<>());
    }

    private PackGenerator(List<T> values) {
        this.values = values;
    }

    @SafeVarargs
    public static <T> PackGenerator<T> of(T... values) {
        PackGenerator<T> pack = new PackGenerator<>();
        for (T v : values) pack.append(v);
        return pack;
    }

    public PackGenerator<T> append(T value) {
        values.add(Objects.requireNonNull(value, "value"));
        cursor = 0;
        return this;
    }

    public int size() { return values.size(); }

    @Override
    public Optional<T> next() {
        if (cursor >= values.size()) return Optional.empty();
        return Optional.of(values.get(cursor++));
    }

    @Override
    public Generator<T> copy() {
        return new PackGenerator<>(new ArrayList<>(values));
    }
}
