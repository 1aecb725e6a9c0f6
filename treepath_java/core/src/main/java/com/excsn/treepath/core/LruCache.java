package com.excsn.treepath.core;

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded map evicting strictly in least-recently-used order. Values may be null. Not thread safe.
 */
final class LruCache<K, V> {

  private final int _maxSize;
  private final LinkedHashMap<K, V> _entries;
  private long _evictions;

  LruCache(int maxSize) {

    Preconditions.checkArgument(maxSize > 0, "maxSize must be positive");

    _maxSize = maxSize;
    _entries = new LinkedHashMap<>(Math.min(maxSize, 64), 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {

        if (size() <= _maxSize) {
          return false;
        }

        _evictions++;
        return true;
      }
    };
  }

  /**
   * Does not refresh recency.
   */
  boolean containsKey(K key) {
    return _entries.containsKey(key);
  }

  /**
   * Marks the entry most recently used.
   */
  V get(K key) {
    return _entries.get(key);
  }

  void put(K key, V value) {
    _entries.put(key, value);
  }

  void clear() {
    _entries.clear();
  }

  int size() {
    return _entries.size();
  }

  int maxSize() {
    return _maxSize;
  }

  long evictions() {
    return _evictions;
  }

  /**
   * @return keys ordered from least to most recently used
   */
  List<K> keys() {
    return new ArrayList<>(_entries.keySet());
  }
}
