package com.linkedin.orderedmap;

import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;


/**
 * Static factories for {@link OrderedMap}. Unless a config says otherwise, maps are {@link ArrayOrderedMap}s.
 */
public final class OrderedMaps {
  private static final Logger LOGGER = LogManager.getLogger(OrderedMaps.class);

  private OrderedMaps() {
  }

  public static <K, V> OrderedMap<K, V> newOrderedMap() {
    return new ArrayOrderedMap<>();
  }

  /**
   * Creates a map with enough pre-allocated space to hold the specified number of elements.
   *
   * @throws IllegalArgumentException if the capacity is negative
   */
  public static <K, V> OrderedMap<K, V> newOrderedMapWithCapacity(int capacity) {
    return new ArrayOrderedMap<>(capacity);
  }

  /**
   * Creates a map holding the given elements, in order. A key appearing more than once keeps the position of its
   * first occurrence and the value of its last.
   */
  @SafeVarargs
  public static <K, V> OrderedMap<K, V> newOrderedMapWithElements(Element<K, V>... elements) {
    OrderedMap<K, V> map = newOrderedMapWithCapacity(elements.length);
    for (Element<K, V> element: elements) {
      map.set(element.getKey(), element.getValue());
    }
    return map;
  }

  /**
   * Same as {@link #newOrderedMapWithElements(Element[])}, for any source of entries such as another
   * {@link OrderedMap} or the entry set of a {@link java.util.LinkedHashMap}.
   */
  public static <K, V> OrderedMap<K, V> newOrderedMapWithElements(
      Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
    OrderedMap<K, V> map = newOrderedMap();
    for (Map.Entry<? extends K, ? extends V> entry: entries) {
      map.set(entry.getKey(), entry.getValue());
    }
    return map;
  }

  /**
   * Creates an empty map using the strategy and capacity of {@code config}.
   */
  public static <K, V> OrderedMap<K, V> newOrderedMap(OrderedMapConfig config) {
    LOGGER.debug("Creating ordered map with {}", config);
    return config.getOrderingStrategy().newMap(config.getInitialCapacity());
  }
}
