package com.lazystream.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer recorder. Meters are named {@code <prefix>.<stream>.terminal.<operation>.duration} (timer) and
 * {@code ...errors} (counter tagged with the exception's simple class name).
 */
public final class SimpleMetricsRecorder implements MetricsRecorder {
    public static final String DEFAULT_PREFIX = "lazystream.stream";

    private final MeterRegistry registry;
    private final String prefix;

    public SimpleMetricsRecorder() {
        this(new SimpleMeterRegistry());
    }

    public SimpleMetricsRecorder(MeterRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    public SimpleMetricsRecorder(MeterRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public void onTerminalSuccess(String stream, String operation, long nanos) {
        registry.timer(meterName(stream, operation, "duration")).record(nanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void onTerminalError(String stream, String operation, Throwable error) {
        registry.counter(meterName(stream, operation, "errors"), "exception", error.getClass().getSimpleName())
            .increment();
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    String meterName(String stream, String operation, String suffix) {
        return prefix + "." + stream + ".terminal." + operation + "." + suffix;
    }
}
