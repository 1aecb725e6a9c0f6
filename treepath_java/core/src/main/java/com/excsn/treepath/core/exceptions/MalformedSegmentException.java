package com.excsn.treepath.core.exceptions;

public class MalformedSegmentException extends TreePathException {

  public MalformedSegmentException(String message) {
    super(message);
  }
}
