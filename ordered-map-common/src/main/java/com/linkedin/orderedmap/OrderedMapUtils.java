package com.linkedin.orderedmap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


public final class OrderedMapUtils {
  private OrderedMapUtils() {
  }

  /**
   * Appends {@code value} to the list held under {@code key}, creating the list if the key is absent. The key keeps
   * the position of its first append.
   *
   * The list previously stored under the key is not mutated: a new list with the value appended replaces it, so
   * unmodifiable lists are accepted.
   *
   * @return {@code map}, for chaining
   */
  public static <K, V> OrderedMap<K, List<V>> appendMultiMap(OrderedMap<K, List<V>> map, K key, V value) {
    List<V> existing = map.get(key);
    List<V> values;
    if (existing != null) {
      values = new ArrayList<>(existing.size() + 1);
      values.addAll(existing);
    } else {
      values = new ArrayList<>(1);
    }
    values.add(value);
    map.set(key, values);
    return map;
  }

  /**
   * @return a {@link LinkedHashMap} snapshot of {@code map}, iterating in the same order
   */
  public static <K, V> LinkedHashMap<K, V> toLinkedHashMap(OrderedMap<K, V> map) {
    LinkedHashMap<K, V> result = new LinkedHashMap<>(ArrayOrderedMap.hashMapCapacityFor(map.size()));
    for (Map.Entry<K, V> entry: map.allFromFront()) {
      result.put(entry.getKey(), entry.getValue());
    }
    return result;
  }
}
