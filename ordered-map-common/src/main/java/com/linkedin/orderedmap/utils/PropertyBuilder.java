package com.linkedin.orderedmap.utils;

import java.util.Properties;


/**
 * Fluent way to construct {@link OrderedMapProperties}. A key put twice keeps its last value.
 */
public class PropertyBuilder {
  private final Properties props = new Properties();

  public PropertyBuilder put(String key, Object value) {
    props.put(key, value.toString());
    return this;
  }

  public OrderedMapProperties build() {
    return new OrderedMapProperties(this.props);
  }
}
