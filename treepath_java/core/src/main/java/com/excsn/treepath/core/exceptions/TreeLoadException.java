package com.excsn.treepath.core.exceptions;

public class TreeLoadException extends TreePathException {

  public TreeLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
