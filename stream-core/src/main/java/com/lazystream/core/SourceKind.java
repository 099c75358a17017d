package com.lazystream.core;

/** How a source argument is turned into a generator, in resolution precedence order. */
public enum SourceKind {
  /** Zero-argument producer; unbounded. */
  INFINITE(false),
  /** Pair of list iterators delimiting {@code [first, last)}. */
  RANGE(true),
  /** Collection copied into owned storage. */
  CONTAINER_COPY(true),
  /** Other iterable, read once at construction into storage the stream owns. */
  CONTAINER_ADOPT(true),
  /** Array literal. */
  LITERAL(true),
  /** Individually supplied values of one type. */
  PACK(true);

  private final boolean finite;

  SourceKind(boolean finite) { this.finite = finite; }

  public boolean finite() { return finite; }
}
