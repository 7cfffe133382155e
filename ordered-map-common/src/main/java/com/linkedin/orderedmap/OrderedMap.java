package com.linkedin.orderedmap;

import java.util.Iterator;
import java.util.Map;


/**
 * A map which remembers the order in which its keys were first inserted. The concept is similar to
 * {@link java.util.LinkedHashMap} in insertion-order mode, with a few differences in the contract:
 *
 * - {@link #set(Object, Object)} reports whether the key is new instead of returning the previous value.
 * - Keys can be renamed in place with {@link #replaceKey(Object, Object)}.
 * - The map can be traversed from either end, lazily, through {@link #allFromFront()} and {@link #allFromBack()}.
 *
 * Overwriting the value of an existing key never moves it. The "back" of the map is therefore the most recently
 * <i>inserted</i> key, not the most recently written one.
 *
 * None of the operations signal failure through exceptions. Absence is reported as {@code null} (or a caller
 * supplied default) and mutations report what they did through their boolean result.
 *
 * <p><strong>Note that implementations are not synchronized.</strong> If several threads share an instance and at
 * least one of them mutates it, access must be synchronized externally. Iterators do not detect concurrent
 * modification: a traversal which overlaps with a {@code set}, {@code delete} or {@code replaceKey} may skip or
 * repeat entries, but it does not throw.
 *
 * @param <K> the type of keys maintained by this map
 * @param <V> the type of mapped values
 */
public interface OrderedMap<K, V> extends Iterable<Map.Entry<K, V>> {
  /**
   * @return the value associated with the key, or {@code null} if the key is absent. Use {@link #has(Object)} to
   *         tell an absent key apart from a key mapped to {@code null}.
   */
  V get(K key);

  /**
   * @return the value associated with the key if it is present (even if that value is {@code null}), otherwise
   *         {@code defaultValue}. The default is not stored.
   */
  V getOrDefault(K key, V defaultValue);

  boolean has(K key);

  /**
   * Sets or replaces the value for a key. A new key is appended at the back of the map, while an existing key keeps
   * its position.
   *
   * @return true if the key was new, false if an existing value was replaced (even by an equal value)
   */
  boolean set(K key, V value);

  /**
   * Renames {@code originalKey} to {@code newKey}, keeping both its value and its position.
   *
   * @return true if the key was renamed, false if {@code originalKey} is absent or {@code newKey} is already present
   *         (which would overwrite another entry). The map is left untouched when false is returned.
   */
  boolean replaceKey(K originalKey, K newKey);

  /**
   * @return true if the key was present and has been removed
   */
  boolean delete(K key);

  int size();

  default boolean isEmpty() {
    return size() == 0;
  }

  /**
   * Returns a new map of the same kind, holding the same entries in the same order. Keys and values are shared with
   * this map, the internal structures are not.
   *
   * Calling this while another thread writes to this map may yield a map which misses or repeats entries.
   */
  OrderedMap<K, V> copy();

  /**
   * Same as {@link #allFromFront()}.
   */
  default Iterable<Map.Entry<K, V>> all() {
    return allFromFront();
  }

  /**
   * @return a lazy view yielding all entries starting at the front (oldest inserted key). Each call to
   *         {@link Iterable#iterator()} starts a new pass.
   */
  Iterable<Map.Entry<K, V>> allFromFront();

  /**
   * @return a lazy view yielding all entries starting at the back (most recently inserted key)
   */
  Iterable<Map.Entry<K, V>> allFromBack();

  /**
   * @return a lazy view of the keys, starting at the front
   */
  Iterable<K> keys();

  /**
   * @return a lazy view of the values, starting at the front
   */
  Iterable<V> values();

  @Override
  default Iterator<Map.Entry<K, V>> iterator() {
    return allFromFront().iterator();
  }
}
