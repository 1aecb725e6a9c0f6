package com.excsn.treepath.core.exceptions;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Raised when a segment sequence cannot be applied to a backing tree.
 *
 * The failing segment is the first one that could not be applied; parts holds the segments that
 * resolved successfully before it.
 */
public abstract class ResolutionException extends TreePathException {

  private final Object _segment;
  private final List<Object> _parts;

  protected ResolutionException(String message, Object segment, List<?> parts) {
    super(message);
    _segment = segment;
    _parts = ImmutableList.copyOf(parts);
  }

  public Object getSegment() {
    return _segment;
  }

  public List<Object> getParts() {
    return _parts;
  }
}
