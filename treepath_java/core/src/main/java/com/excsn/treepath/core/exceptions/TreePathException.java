package com.excsn.treepath.core.exceptions;

/**
 * Root of every failure raised while building or resolving tree paths.
 */
public class TreePathException extends RuntimeException {

  public TreePathException(String message) {
    super(message);
  }

  public TreePathException(String message, Throwable cause) {
    super(message, cause);
  }
}
