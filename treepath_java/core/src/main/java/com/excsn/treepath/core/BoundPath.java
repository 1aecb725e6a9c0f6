package com.excsn.treepath.core;

import com.excsn.treepath.core.exceptions.KeyMissingException;
import com.excsn.treepath.core.exceptions.MalformedSegmentException;
import com.excsn.treepath.core.exceptions.ResolutionException;
import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * A {@link TreePath} attached to a {@link NodeAccessor}.
 *
 * Bound paths never hold a reference into the tree, every read goes back to the accessor with the full parts
 * list. Composition keeps the same accessor instance, so all paths derived from one root share its state
 * (including the lookup cache).
 */
public final class BoundPath<V, H> implements Iterable<BoundPath<V, H>> {

  private final NodeAccessor<V, H> _accessor;
  private final TreePath _path;

  private BoundPath(NodeAccessor<V, H> accessor, TreePath path) {
    _accessor = accessor;
    _path = path;
  }

  public static <V, H> BoundPath<V, H> of(NodeAccessor<V, H> accessor) {
    return of(accessor, PathParser.DEFAULT_SEPARATOR);
  }

  public static <V, H> BoundPath<V, H> of(NodeAccessor<V, H> accessor, char separator) {
    return of(accessor, TreePath.withSeparator(separator));
  }

  public static <V, H> BoundPath<V, H> of(NodeAccessor<V, H> accessor, TreePath path) {

    Preconditions.checkNotNull(accessor, "accessor is null");
    Preconditions.checkNotNull(path, "path is null");

    return new BoundPath<>(accessor, path);
  }

  public TreePath path() {
    return _path;
  }

  public List<Object> parts() {
    return _path.parts();
  }

  public NodeAccessor<V, H> accessor() {
    return _accessor;
  }

  public String name() {
    return _path.name();
  }

  public BoundPath<V, H> join(Object... segments) {
    return _rebind(_path.join(segments));
  }

  /**
   * Joins and asserts that the result resolves.
   *
   * @throws KeyMissingException if the joined path does not exist
   */
  public BoundPath<V, H> strictJoin(Object key) {

    var joined = join(key);

    if (!_accessor.exists(joined.parts())) {
      throw new KeyMissingException(key, parts());
    }

    return joined;
  }

  public BoundPath<V, H> parent() {
    return _rebind(_path.parent());
  }

  public V readValue() {
    return _accessor.resolve(parts());
  }

  public boolean exists() {
    return _accessor.exists(parts());
  }

  public V get(Object key) {
    return get(key, null);
  }

  /**
   * Reads the child at key, falling back to defaultValue when it does not resolve. A malformed key or an I/O failure
   * still throws.
   */
  public V get(Object key, V defaultValue) {

    var child = join(key);

    try {
      return child.readValue();
    } catch (ResolutionException e) {
      return defaultValue;
    }
  }

  public boolean contains(Object key) {
    return join(key).exists();
  }

  public List<Object> keys() {
    return _accessor.keys(parts());
  }

  public List<Map.Entry<Object, V>> items() {
    return _accessor.items(parts());
  }

  public List<V> values() {
    return _accessor.values(parts());
  }

  /**
   * @return one bound path per child key, in accessor order
   */
  public List<BoundPath<V, H>> children() {

    var keys = keys();
    var children = new ArrayList<BoundPath<V, H>>(keys.size());

    for (var key : keys) {

      if (!PathParser.isSegment(key)) {
        throw new MalformedSegmentException("Child key `" + key + "` under `" + _path + "` is not a text or integer segment");
      }

      // Keys reported by the accessor are used verbatim, text keys containing the separator are not split.
      children.add(_rebind(_path.child(key)));
    }

    return children;
  }

  @Override
  public Iterator<BoundPath<V, H>> iterator() {
    return children().iterator();
  }

  public int size() {
    return _accessor.size(parts());
  }

  public boolean isTraversable() {
    return _accessor.isTraversable(parts());
  }

  public NodeStat stat() {
    return _accessor.stat(parts());
  }

  public NodeHandle<H> open() {
    return _accessor.open(parts());
  }

  @Override
  public String toString() {
    return _path.toString();
  }

  @Override
  public boolean equals(Object other) {

    if (this == other) {
      return true;
    }

    if (!(other instanceof BoundPath)) {
      return false;
    }

    var otherPath = (BoundPath<?, ?>) other;

    return _accessor == otherPath._accessor && _path.equals(otherPath._path);
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(_accessor) + _path.hashCode();
  }

  private BoundPath<V, H> _rebind(TreePath path) {
    return new BoundPath<>(_accessor, path);
  }
}
