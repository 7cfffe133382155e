package com.linkedin.orderedmap;

import java.util.function.IntFunction;


/**
 * How an {@link OrderedMap} keeps track of the order of its keys.
 */
public enum OrderingStrategy {
  /**
   * Keys are kept in an array; removal and renaming scan it linearly. See {@link ArrayOrderedMap}.
   */
  ARRAY_SCAN(ArrayOrderedMap::new),

  /**
   * Keys are kept in a doubly linked list indexed by key. See {@link LinkedOrderedMap}.
   */
  LINKED_INDEX(LinkedOrderedMap::new);

  private final IntFunction<OrderedMap<?, ?>> constructor;

  OrderingStrategy(IntFunction<OrderedMap<?, ?>> constructor) {
    this.constructor = constructor;
  }

  @SuppressWarnings("unchecked")
  <K, V> OrderedMap<K, V> newMap(int initialCapacity) {
    return (OrderedMap<K, V>) constructor.apply(initialCapacity);
  }
}
