package com.excsn.treepath.core;

import com.excsn.treepath.core.exceptions.ResolutionException;
import com.google.common.collect.Maps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Resolves segment sequences against one backend root.
 *
 * Implementations hold only the root (and whatever they need to reach it); they never keep state tied to a
 * single path. Every method takes the full list of parts from the root.
 *
 * @param <V> type of resolved values
 * @param <H> type exposed by scoped handles from {@link #open(List)}
 */
public interface NodeAccessor<V, H> {

  /**
   * Never throws for a path that does not resolve.
   */
  boolean exists(List<?> parts);

  /**
   * @throws ResolutionException for the first segment that cannot be applied
   */
  V resolve(List<?> parts);

  /**
   * Child keys of the node at parts, in backend order.
   *
   * @throws ResolutionException if parts does not resolve to a node with children
   */
  List<Object> keys(List<?> parts);

  /**
   * @return {@link NodeStat#MISSING} when parts does not resolve
   */
  NodeStat stat(List<?> parts);

  NodeHandle<H> open(List<?> parts);

  default List<Map.Entry<Object, V>> items(List<?> parts) {

    var keys = keys(parts);
    var items = new ArrayList<Map.Entry<Object, V>>(keys.size());

    for (var key : keys) {
      items.add(Maps.immutableEntry(key, resolve(_childParts(parts, key))));
    }

    return Collections.unmodifiableList(items);
  }

  default List<V> values(List<?> parts) {

    var keys = keys(parts);
    var values = new ArrayList<V>(keys.size());

    for (var key : keys) {
      values.add(resolve(_childParts(parts, key)));
    }

    return Collections.unmodifiableList(values);
  }

  /**
   * Never throws for a missing child or a parent that does not resolve.
   */
  default boolean contains(List<?> parts, Object key) {
    return exists(_childParts(parts, key));
  }

  default int size(List<?> parts) {
    return keys(parts).size();
  }

  default boolean isTraversable(List<?> parts) {

    try {
      keys(parts);
      return true;
    } catch (ResolutionException e) {
      return false;
    }
  }

  /**
   * @throws ResolutionException if parts does not resolve
   */
  default void validate(List<?> parts) {
    resolve(parts);
  }

  private static List<Object> _childParts(List<?> parts, Object key) {

    var childParts = new ArrayList<Object>(parts.size() + 1);
    childParts.addAll(parts);
    childParts.add(key);

    return childParts;
  }
}
