package com.excsn.treepath.core;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Scoped access to a resolved node. Use with try-with-resources; closing releases whatever the accessor
 * acquired and is safe to call more than once.
 */
public final class NodeHandle<H> implements AutoCloseable {

  private final H _value;
  private final Closeable _release;
  private boolean _closed;

  private NodeHandle(H value, Closeable release) {
    _value = value;
    _release = release;
  }

  /**
   * Handle over a node that needs no teardown.
   */
  public static <H> NodeHandle<H> of(H value) {
    return new NodeHandle<>(value, null);
  }

  public static <H extends Closeable> NodeHandle<H> closing(H value) {
    return new NodeHandle<>(value, value);
  }

  public H get() {

    if (_closed) {
      throw new IllegalStateException("Handle is closed");
    }

    return _value;
  }

  public boolean isClosed() {
    return _closed;
  }

  @Override
  public void close() {

    if (_closed) {
      return;
    }

    _closed = true;

    if (_release == null) {
      return;
    }

    try {
      _release.close();
    } catch (IOException e) {
      throw new UncheckedIOException("Could not release node handle", e);
    }
  }
}
