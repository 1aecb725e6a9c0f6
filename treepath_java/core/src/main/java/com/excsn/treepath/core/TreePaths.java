package com.excsn.treepath.core;

import java.io.Closeable;
import java.nio.file.Path;

/**
 * Entry points for the common cases. Use {@link TreePathBuilder} for telemetry or cache tuning.
 */
public final class TreePaths {

  private TreePaths() {}

  public static BoundPath<Object, Object> fromLookup(Object tree) {
    return TreePathBuilder.builder().lookup(tree);
  }

  public static BoundPath<Object, Object> fromLookup(Object tree, char separator) {
    return TreePathBuilder.builder().setSeparator(separator).lookup(tree);
  }

  public static BoundPath<byte[], Closeable> fromPath(Path baseDirectory) {
    return TreePathBuilder.builder().filesystem(baseDirectory);
  }

  public static BoundPath<byte[], Closeable> fromPath(Path baseDirectory, char separator) {
    return TreePathBuilder.builder().setSeparator(separator).filesystem(baseDirectory);
  }

  public static BoundPath<Object, Object> fromYaml(String document) {
    return TreePathBuilder.builder().yaml(document);
  }

  public static BoundPath<Object, Object> fromJson(String document) {
    return TreePathBuilder.builder().json(document);
  }

  /**
   * @return the lookup accessor behind a path made by {@link #fromLookup}, for cache control
   * @throws IllegalArgumentException if the path is bound to another accessor
   */
  public static LookupAccessor lookupAccessor(BoundPath<?, ?> path) {

    if (!(path.accessor() instanceof LookupAccessor)) {
      throw new IllegalArgumentException("Path `" + path + "` is not bound to a lookup accessor");
    }

    return (LookupAccessor) path.accessor();
  }
}
