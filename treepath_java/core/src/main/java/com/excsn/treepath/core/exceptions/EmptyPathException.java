package com.excsn.treepath.core.exceptions;

public class EmptyPathException extends TreePathException {

  public EmptyPathException(String operation) {
    super(operation + " requires a non-empty path");
  }
}
