package com.lazystream.metrics;

import io.micrometer.core.instrument.MeterRegistry;

/** Receives one callback per terminal evaluation. */
public interface MetricsRecorder {

    /** {@code nanos} is the wall time of the whole terminal, pulls included. */
    void onTerminalSuccess(String stream, String operation, long nanos);

    /** Called with the exception the terminal is about to rethrow. */
    void onTerminalError(String stream, String operation, Throwable error);

    MeterRegistry registry();
}
