package com.excsn.treepath.core.exceptions;

import java.util.List;

public class NotIndexableException extends ResolutionException {

  public NotIndexableException(Object segment, List<?> parts, String nodeType) {
    super("Cannot descend into " + nodeType + " node at " + parts + " with `" + segment + "`", segment, parts);
  }

  /**
   * For enumeration of a node that has no children.
   */
  public NotIndexableException(List<?> parts, String nodeType) {
    super("Node at " + parts + " of type " + nodeType + " has no children", null, parts);
  }
}
