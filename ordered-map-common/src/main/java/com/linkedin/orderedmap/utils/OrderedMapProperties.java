package com.linkedin.orderedmap.utils;

import com.linkedin.orderedmap.exceptions.ConfigurationException;
import com.linkedin.orderedmap.exceptions.UndefinedPropertyException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.Set;


/**
 * An immutable bag of string properties with typed accessors. Use {@link PropertyBuilder} to create one.
 */
public class OrderedMapProperties {
  private static final OrderedMapProperties EMPTY = new OrderedMapProperties(Collections.emptyMap());

  private final Map<String, String> props;

  public OrderedMapProperties(Properties properties) {
    Map<String, String> tmpProps = new HashMap<>(properties.size());
    for (Map.Entry<Object, Object> e: properties.entrySet()) {
      tmpProps.put(e.getKey().toString(), e.getValue() == null ? null : e.getValue().toString());
    }
    props = Collections.unmodifiableMap(tmpProps);
  }

  public OrderedMapProperties(Map<String, String> properties) {
    props = Collections.unmodifiableMap(new HashMap<>(properties));
  }

  public static OrderedMapProperties empty() {
    return EMPTY;
  }

  public Set<String> keySet() {
    return props.keySet();
  }

  public boolean containsKey(String k) {
    return props.containsKey(k);
  }

  public Map<String, String> getAsMap() {
    return props;
  }

  private String get(String key) {
    if (props.containsKey(key)) {
      return props.get(key);
    }
    throw new UndefinedPropertyException(key);
  }

  public String getString(String key, String defaultValue) {
    if (containsKey(key)) {
      return get(key);
    } else {
      return defaultValue;
    }
  }

  public String getString(String key) {
    return get(key);
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    if (containsKey(key)) {
      return "true".equalsIgnoreCase(get(key));
    } else {
      return defaultValue;
    }
  }

  public boolean getBoolean(String key) {
    return "true".equalsIgnoreCase(get(key));
  }

  public int getInt(String name, int defaultValue) {
    if (containsKey(name)) {
      return getInt(name);
    } else {
      return defaultValue;
    }
  }

  public int getInt(String name) {
    String value = get(name);
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Property '" + name + "' is not an integer: " + value, e);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    OrderedMapProperties that = (OrderedMapProperties) o;

    return props.equals(that.props);
  }

  @Override
  public int hashCode() {
    return this.props.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("{");
    boolean first = true;
    for (String key: props.keySet().stream().sorted().toArray(String[]::new)) {
      if (!first) {
        builder.append(", ");
      }
      first = false;
      builder.append(key).append(": ").append(props.get(key));
    }
    return builder.append("}").toString();
  }
}
