package com.excsn.treepath.core.exceptions;

public class InvalidCacheSizeException extends TreePathException {

  public InvalidCacheSizeException(int maxSize) {
    super("Cache max size must be a positive integer, got " + maxSize);
  }
}
