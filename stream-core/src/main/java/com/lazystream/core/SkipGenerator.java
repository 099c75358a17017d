package com.lazystream.core;

import java.util.Objects;
import java.util.Optional;

/** Discards the first {@code amount} upstream elements on the first pull, then forwards. */
public final class SkipGenerator<T> implements Generator<T> {
    private final Generator<T> upstream;
    private final long amount;
    private boolean skipped;

    public SkipGenerator(Generator<T> upstream, long amount) {
        if (amount < 0) throw new IllegalArgumentException("amount must be >= 0");
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.amount = amount;
    }

    @Override
    public Optional<T> next() {
        if (!skipped) {
            skipped = true;
            long discarded = 0;
            while (discarded < amount && upstream.next().isPresent()) {
                discarded++;
            }
            if (discarded < amount) return Optional.empty();
        }
        return upstream.next();
    }

    @Override
    public Generator<T> copy() {
        return new SkipGenerator<>(upstream.copy(), amount);
    }
}
