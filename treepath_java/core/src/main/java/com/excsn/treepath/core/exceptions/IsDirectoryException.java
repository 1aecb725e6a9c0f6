package com.excsn.treepath.core.exceptions;

import java.util.List;

public class IsDirectoryException extends ResolutionException {

  public IsDirectoryException(Object segment, List<?> parts) {
    super("Entry " + parts + " is a directory and has no byte content", segment, parts);
  }
}
