package com.excsn.treepath.core.exceptions;

public class PathMismatchException extends TreePathException {

  public PathMismatchException(String path, String base) {
    super("`" + path + "` is not in the subpath of `" + base + "`");
  }
}
