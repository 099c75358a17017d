package com.lazystream.core;

import java.util.Objects;

/** Runtime failure of a terminal operation. */
public final class StreamOperationException extends IllegalStateException {

  public enum Kind {
    /** Positional lookup past the last available element. */
    INSUFFICIENT_ELEMENTS,
    /** Operation needs at least one element and the stream had none. */
    EMPTY_SOURCE
  }

  private final Kind kind;
  private final String operation;

  public StreamOperationException(Kind kind, String operation, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.operation = Objects.requireNonNull(operation, "operation");
  }

  static StreamOperationException insufficientElements(String operation, long requested, long available) {
    return new StreamOperationException(Kind.INSUFFICIENT_ELEMENTS, operation,
        "Stream doesn't contain enough elements to perform operation '" + operation
            + "' (requested index " + requested + ", available " + available + ")");
  }

  static StreamOperationException emptySource(String operation) {
    return new StreamOperationException(Kind.EMPTY_SOURCE, operation,
        "Operation '" + operation + "' cannot be performed on empty stream");
  }

  public Kind kind() { return kind; }
  public String operation() { return operation; }
}
