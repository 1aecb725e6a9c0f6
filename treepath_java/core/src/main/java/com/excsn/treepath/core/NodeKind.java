package com.excsn.treepath.core;

public enum NodeKind {
  MAPPING,
  SEQUENCE,
  SCALAR,
  FILE,
  DIRECTORY,
  SYMLINK,
  OTHER,
  MISSING
}
