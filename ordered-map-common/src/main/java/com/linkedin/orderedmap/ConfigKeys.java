package com.linkedin.orderedmap;

public class ConfigKeys {
  private ConfigKeys() {
  }

  /**
   * Name of the {@link OrderingStrategy} used by {@link OrderedMaps#newOrderedMap(OrderedMapConfig)}.
   * Case-insensitive. Defaults to {@link OrderingStrategy#ARRAY_SCAN}.
   */
  public static final String ORDERED_MAP_ORDERING_STRATEGY = "ordered.map.ordering.strategy";

  /**
   * Number of keys new maps reserve room for. Must not be negative. Defaults to 0.
   */
  public static final String ORDERED_MAP_INITIAL_CAPACITY = "ordered.map.initial.capacity";
}
