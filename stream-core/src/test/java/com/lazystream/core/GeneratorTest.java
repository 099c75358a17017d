package com.lazystream.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class GeneratorTest {

    static <T> List<T> drain(Generator<T> gen) {
        List<T> out = new ArrayList<>();
        for (Optional<T> v; (v = gen.next()).isPresent(); ) out.add(v.get());
        return out;
    }

    @Test
    void containerStaysExhausted() {
        Generator<Integer> gen = ContainerGenerator.copyOf(List.of(1));

        assertEquals(Optional.of(1), gen.next());
        assertEquals(Optional.empty(), gen.next());
        assertEquals(Optional.empty(), gen.next());
    }

    @Test
    void copyOfAdvancedContainerRestartsIndependently() {
        Generator<Integer> gen = ContainerGenerator.copyOf(List.of(1, 2, 3));
        gen.next();

        Generator<Integer> copy = gen.copy();

        assertEquals(List.of(1, 2, 3), drain(copy));
        assertEquals(List.of(2, 3), drain(gen));
    }

    @Test
    void packAppendRewinds() {
        PackGenerator<String> pack = new PackGenerator<>();
        pack.append("a");
        pack.next();
        pack.append("b").append("c");

        assertEquals(3, pack.size());
        assertEquals(List.of("a", "b", "c"), drain(pack));
        assertEquals(List.of("a", "b", "c"), drain(pack.copy()));
    }

    @Test
    void skipPastTheEndSignalsEndOnFirstPull() {
        Generator<Integer> gen = new SkipGenerator<>(PackGenerator.of(1, 2, 3), 10);

        assertEquals(Optional.empty(), gen.next());
        assertEquals(Optional.empty(), gen.next());
    }

    @Test
    void skipExactlyTheLengthIsEmpty() {
        assertEquals(List.of(), drain(new SkipGenerator<>(PackGenerator.of(1, 2, 3), 3)));
    }

    @Test
    void takeUsesQuotaOnEveryForwardedPull() {
        Generator<Integer> gen = new TakeGenerator<>(new Stuttering(), 3);

        assertEquals(Optional.of(1), gen.next());
        assertEquals(Optional.empty(), gen.next());
        assertEquals(Optional.of(2), gen.next());
        assertEquals(Optional.empty(), gen.next());
    }

    @Test
    void takeZeroNeverTouchesUpstream() {
        Stuttering upstream = new Stuttering();
        Generator<Integer> gen = new TakeGenerator<>(upstream, 0);

        assertEquals(Optional.empty(), gen.next());
        assertEquals(0, upstream.calls);
    }

    @Test
    void groupReturnsShortBatchOnceThenEnds() {
        Generator<List<Integer>> gen = new GroupGenerator<>(PackGenerator.of(1, 2, 3, 4, 5), 3);

        assertEquals(Optional.of(List.of(1, 2, 3)), gen.next());
        assertEquals(Optional.of(List.of(4, 5)), gen.next());
        assertEquals(Optional.empty(), gen.next());
        assertEquals(Optional.empty(), gen.next());
    }

    @Test
    void filterSkipsUntilMatch() {
        Generator<Integer> gen = new FilterGenerator<>(PackGenerator.of(1, 3, 4, 5, 7), v -> v % 2 == 0);

        assertEquals(Optional.of(4), gen.next());
        assertEquals(Optional.empty(), gen.next());
    }

    @Test
    void combinatorCopiesRestartFromConstructionState() {
        Generator<Integer> gen = new MapGenerator<Integer, Integer>(
            new SkipGenerator<>(new TakeGenerator<>(PackGenerator.of(1, 2, 3, 4, 5), 4), 1), v -> v * 100);
        assertEquals(Optional.of(200), gen.next());

        Generator<Integer> copy = gen.copy();

        assertEquals(List.of(200, 300, 400), drain(copy));
        assertEquals(List.of(300, 400), drain(gen));
    }

    @Test
    void copyOfAdvancedTakeOverSupplierResetsQuotaButNotSupplier() {
        int[] counter = {0};
        Generator<Integer> gen = new TakeGenerator<>(new InfiniteGenerator<>(() -> ++counter[0]), 2);
        assertEquals(List.of(1, 2), drain(gen));

        Generator<Integer> copy = gen.copy();

        assertEquals(List.of(3, 4), drain(copy));
        assertEquals(Optional.empty(), gen.next());
    }

    @Test
    void infiniteGeneratorNeverEnds() {
        Generator<String> gen = new InfiniteGenerator<>(() -> "x");

        for (int i = 0; i < 100; i++) assertEquals(Optional.of("x"), gen.next());
    }

    /** Yields 1, then empty, then 2, then empty forever. */
    private static final class Stuttering implements Generator<Integer> {
        int calls;

        @Override
        public Optional<Integer> next() {
            calls++;
            switch (calls) {
                case 1: return Optional.of(1);
                case 3: return Optional.of(2);
                default: return Optional.empty();
            }
        }

        @Override
        public Generator<Integer> copy() { return new Stuttering(); }
    }
}
