package com.excsn.treepath.core;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.util.List;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class LruCacheTest {

  @Test
  public void overflowEvictsEldest() {

    var cache = new LruCache<String, Integer>(3);

    cache.put("a", 1);
    cache.put("b", 2);
    cache.put("c", 3);
    cache.put("d", 4);

    Assertions.assertEquals(List.of("b", "c", "d"), cache.keys());
    Assertions.assertEquals(1, cache.evictions());
  }

  @Test
  public void getRefreshesButContainsKeyDoesNot() {

    var cache = new LruCache<String, Integer>(2);

    cache.put("a", 1);
    cache.put("b", 2);

    Assertions.assertTrue(cache.containsKey("a"));
    Assertions.assertEquals(List.of("a", "b"), cache.keys());

    Assertions.assertEquals(1, cache.get("a"));
    Assertions.assertEquals(List.of("b", "a"), cache.keys());

    cache.put("c", 3);
    Assertions.assertEquals(List.of("a", "c"), cache.keys());
  }

  @Test
  public void storesNullValues() {

    var cache = new LruCache<String, Integer>(1);

    cache.put("a", null);

    Assertions.assertTrue(cache.containsKey("a"));
    Assertions.assertNull(cache.get("a"));
  }

  @Test
  public void rejectsNonPositiveSize() {

    Assertions.assertThrows(IllegalArgumentException.class, () -> new LruCache<String, Integer>(0));
  }
}
