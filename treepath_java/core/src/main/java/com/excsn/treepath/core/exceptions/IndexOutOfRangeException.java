package com.excsn.treepath.core.exceptions;

import java.util.List;

public class IndexOutOfRangeException extends ResolutionException {

  private final int _length;

  public IndexOutOfRangeException(int index, int length, List<?> parts) {
    super("Index " + index + " is out of range for sequence of length " + length + " under " + parts, index, parts);
    _length = length;
  }

  public int getLength() {
    return _length;
  }
}
