package com.linkedin.orderedmap;

import java.util.Map;
import java.util.Objects;


/**
 * An immutable key/value pair. It is the input of
 * {@link OrderedMaps#newOrderedMapWithElements(Element[])} and the item yielded by the paired traversals of an
 * {@link OrderedMap}.
 *
 * @param <K> the type of the key
 * @param <V> the type of the value
 */
public final class Element<K, V> implements Map.Entry<K, V> {
  private final K key;
  private final V value;

  /**
   * Static factory method that, unlike the constructor, performs generic inference:
   *
   * <pre>{@code
   * Element<String, Integer> element = Element.create("a", 1);
   * }</pre>
   */
  public static <K, V> Element<K, V> create(K key, V value) {
    return new Element<>(key, value);
  }

  public Element(K key, V value) {
    this.key = key;
    this.value = value;
  }

  @Override
  public K getKey() {
    return key;
  }

  @Override
  public V getValue() {
    return value;
  }

  /**
   * Elements are snapshots; write through {@link OrderedMap#set(Object, Object)} instead.
   */
  @Override
  public V setValue(V value) {
    throw new UnsupportedOperationException("Element is immutable, use OrderedMap.set() to update a value");
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(key) ^ Objects.hashCode(value);
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (o instanceof Map.Entry) {
      Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
      return Objects.equals(key, e.getKey()) && Objects.equals(value, e.getValue());
    }
    return false;
  }

  @Override
  public String toString() {
    return key + "=" + value;
  }
}
