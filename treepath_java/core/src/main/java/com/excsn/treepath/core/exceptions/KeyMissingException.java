package com.excsn.treepath.core.exceptions;

import java.util.List;

public class KeyMissingException extends ResolutionException {

  public KeyMissingException(Object segment, List<?> parts) {
    super("Key `" + segment + "` does not exist under " + parts, segment, parts);
  }

  public KeyMissingException(String message, Object segment, List<?> parts) {
    super(message, segment, parts);
  }
}
