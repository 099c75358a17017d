package com.lazystream.metrics;

import io.micrometer.core.instrument.MeterRegistry;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide recorder that every terminal evaluation reports to. Observability only: replacing it never
 * changes what a stream produces.
 */
public final class Metrics {
    private static final AtomicReference<MetricsRecorder> RECORDER =
        new AtomicReference<>(new SimpleMetricsRecorder());

    private Metrics() {}

    public static MetricsRecorder recorder() {
        return RECORDER.get();
    }

    /** Installs {@code recorder} and returns the one it replaced, so callers can put it back. */
    public static MetricsRecorder setRecorder(MetricsRecorder recorder) {
        return RECORDER.getAndSet(Objects.requireNonNull(recorder, "recorder"));
    }

    /** Drops everything recorded so far by installing a recorder on a fresh registry. */
    public static void reset() {
        RECORDER.set(new SimpleMetricsRecorder());
    }

    public static MeterRegistry registry() {
        return recorder().registry();
    }
}
