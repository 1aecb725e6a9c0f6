package com.excsn.treepath.core;

import com.excsn.treepath.core.exceptions.IndexOutOfRangeException;
import com.excsn.treepath.core.exceptions.InvalidCacheSizeException;
import com.excsn.treepath.core.exceptions.KeyMissingException;
import com.excsn.treepath.core.exceptions.NotIndexableException;
import com.excsn.treepath.core.exceptions.ResolutionException;
import com.excsn.treepath.core.telemetry.Logger;
import com.excsn.treepath.core.telemetry.StatsRecorder;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Accessor over an in-memory tree of {@link Map}s and {@link List}s.
 *
 * The root is fixed for the lifetime of the accessor; to point at a different tree, construct a new accessor.
 * Resolved nodes are memoized per accessor instance in a bounded least-recently-used cache keyed by the full
 * parts list, and the cache is not invalidated if the tree is mutated behind the accessor's back.
 *
 * Not thread safe. Callers sharing an instance across threads must synchronize externally.
 */
public class LookupAccessor implements NodeAccessor<Object, Object> {

  public static final int DEFAULT_CACHE_MAX_SIZE = 128;

  private final Object _root;
  private final Logger _logger;
  private final StatsRecorder _statsRecorder;
  private LruCache<List<Object>, Object> _cache;

  public LookupAccessor(Object root) {
    this(root, Logger.NOOP, StatsRecorder.NOOP);
  }

  public LookupAccessor(Object root, Logger logger, StatsRecorder statsRecorder) {
    _root = root;
    _logger = logger;
    _statsRecorder = statsRecorder;
    _cache = new LruCache<>(DEFAULT_CACHE_MAX_SIZE);
  }

  public Object root() {
    return _root;
  }

  @Override
  public boolean exists(List<?> parts) {

    try {
      _walk(parts);
      return true;
    } catch (ResolutionException e) {
      return false;
    }
  }

  @Override
  public Object resolve(List<?> parts) {

    _statsRecorder.recordCounterIncrement(StatsRecorder.GROUP_TAGS, "resolve_attempts");

    if (_cache == null) {
      return _walk(parts);
    }

    List<Object> key = ImmutableList.copyOf(parts);

    if (_cache.containsKey(key)) {
      _statsRecorder.recordCounterIncrement(StatsRecorder.GROUP_TAGS, "cache_hits");
      return _cache.get(key);
    }

    _statsRecorder.recordCounterIncrement(StatsRecorder.GROUP_TAGS, "cache_misses");

    var node = _walk(parts);
    var evictionsBefore = _cache.evictions();
    _cache.put(key, node);

    if (_cache.evictions() != evictionsBefore) {
      _statsRecorder.recordCounterIncrement(StatsRecorder.GROUP_TAGS, "cache_evictions");
    }
    _statsRecorder.recordGauge(StatsRecorder.GROUP_TAGS, "cache_size", _cache.size());

    return node;
  }

  @Override
  public List<Object> keys(List<?> parts) {

    var node = resolve(parts);

    if (node instanceof Map) {
      return Collections.unmodifiableList(new ArrayList<Object>(((Map<?, ?>) node).keySet()));
    }

    if (node instanceof List) {

      var length = ((List<?>) node).size();
      var indices = new ArrayList<Object>(length);

      for (var index = 0; index < length; index++) {
        indices.add(index);
      }

      return indices;
    }

    throw new NotIndexableException(parts, _typeName(node));
  }

  @Override
  public NodeStat stat(List<?> parts) {

    Object node;
    try {
      node = _walk(parts);
    } catch (ResolutionException e) {
      return NodeStat.MISSING;
    }

    if (node instanceof Map) {
      return NodeStat.of(NodeKind.MAPPING, (long) ((Map<?, ?>) node).size());
    }

    if (node instanceof List) {
      return NodeStat.of(NodeKind.SEQUENCE, (long) ((List<?>) node).size());
    }

    if (node instanceof CharSequence) {
      return NodeStat.of(NodeKind.SCALAR, (long) ((CharSequence) node).length());
    }

    return NodeStat.of(NodeKind.SCALAR, null);
  }

  @Override
  public NodeHandle<Object> open(List<?> parts) {
    return NodeHandle.of(resolve(parts));
  }

  @Override
  public boolean isTraversable(List<?> parts) {

    try {
      var node = _walk(parts);
      return node instanceof Map || node instanceof List;
    } catch (ResolutionException e) {
      return false;
    }
  }

  public boolean isCacheEnabled() {
    return _cache != null;
  }

  /**
   * @return capacity of the cache, 0 while disabled
   */
  public int cacheMaxSize() {
    return _cache == null ? 0 : _cache.maxSize();
  }

  public int cacheSize() {
    return _cache == null ? 0 : _cache.size();
  }

  /**
   * @return cached keys ordered from least to most recently used
   */
  public List<List<Object>> cachedKeys() {
    return _cache == null ? List.of() : _cache.keys();
  }

  public void clearCache() {

    if (_cache != null) {
      _cache.clear();
    }
    _logger.debug("Cleared lookup cache");
  }

  public void disableCache() {

    if (_cache != null) {
      _cache.clear();
    }
    _cache = null;
    _logger.debug("Disabled lookup cache");
  }

  public void enableCache() {
    enableCache(DEFAULT_CACHE_MAX_SIZE);
  }

  /**
   * Starts over with an empty cache of the given capacity.
   *
   * @throws InvalidCacheSizeException if maxSize is not positive
   */
  public void enableCache(int maxSize) {

    if (maxSize <= 0) {
      throw new InvalidCacheSizeException(maxSize);
    }

    if (_cache != null) {
      _cache.clear();
    }
    _cache = new LruCache<>(maxSize);
    _logger.debug("Enabled lookup cache with max size " + maxSize);
  }

  private Object _walk(List<?> parts) {

    var node = _root;

    for (var index = 0; index < parts.size(); index++) {
      node = _child(node, parts.get(index), parts.subList(0, index));
    }

    return node;
  }

  private static Object _child(Object node, Object segment, List<?> resolvedParts) {

    if (node instanceof Map) {

      var map = (Map<?, ?>) node;

      try {
        if (map.containsKey(segment)) {
          return map.get(segment);
        }
      } catch (ClassCastException | NullPointerException e) {
        // Sorted or null-hostile maps reject keys of a foreign type outright.
        throw new KeyMissingException(segment, resolvedParts);
      }

      throw new KeyMissingException(segment, resolvedParts);
    }

    if (node instanceof List) {

      var list = (List<?>) node;

      if (!(segment instanceof Integer)) {
        throw new KeyMissingException("Sequence under " + resolvedParts + " cannot be indexed with text key `"
          + segment + "`", segment, resolvedParts);
      }

      var index = (int) (Integer) segment;

      if (index < 0 || index >= list.size()) {
        throw new IndexOutOfRangeException(index, list.size(), resolvedParts);
      }

      return list.get(index);
    }

    throw new NotIndexableException(segment, resolvedParts, _typeName(node));
  }

  private static String _typeName(Object node) {
    return node == null ? "null" : node.getClass().getSimpleName();
  }
}
