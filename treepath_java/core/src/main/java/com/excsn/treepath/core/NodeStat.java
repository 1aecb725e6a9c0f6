package com.excsn.treepath.core;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * Small metadata record for a node. Size is the number of children for in-memory containers, the text length
 * for text scalars and the byte size for files; null when it has no meaning for the node (directories included).
 */
public final class NodeStat {

  public static final NodeStat MISSING = new NodeStat(false, NodeKind.MISSING, null);

  public final boolean exists;
  public final NodeKind kind;
  public final Long size;

  public NodeStat(boolean exists, NodeKind kind, Long size) {
    this.exists = exists;
    this.kind = kind;
    this.size = size;
  }

  public static NodeStat of(NodeKind kind, Long size) {
    return new NodeStat(true, kind, size);
  }

  @Override
  public boolean equals(Object other) {

    if (this == other) {
      return true;
    }

    if (!(other instanceof NodeStat)) {
      return false;
    }

    var otherStat = (NodeStat) other;

    return exists == otherStat.exists && kind == otherStat.kind && Objects.equal(size, otherStat.size);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(exists, kind, size);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
      .add("exists", exists)
      .add("kind", kind)
      .add("size", size)
      .toString();
  }
}
