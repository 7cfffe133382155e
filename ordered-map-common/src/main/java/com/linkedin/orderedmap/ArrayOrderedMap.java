package com.linkedin.orderedmap;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;


/**
 * An {@link OrderedMap} composed of a {@link HashMap} holding the entries and an {@link ArrayList} keeping track of
 * the insertion order of the keys. The performance of the various operations should be as follows:
 *
 * - get, has and set are constant-time, like HashMap.
 * - Iteration walks the list and looks each key up in the map.
 * - delete and replaceKey are O(N), since they need to find the key in the list with a linear scan.
 *
 * See {@link LinkedOrderedMap} for a variant with constant-time removal.
 *
 * <p><strong>Note that this implementation is not synchronized.</strong>
 */
public class ArrayOrderedMap<K, V> extends AbstractOrderedMap<K, V> {
  private final Map<K, V> store;
  private final List<K> order;

  public ArrayOrderedMap() {
    this.store = new HashMap<>();
    this.order = new ArrayList<>();
  }

  /**
   * @param initialCapacity the number of keys to reserve room for
   * @throws IllegalArgumentException if the initial capacity is negative
   */
  public ArrayOrderedMap(int initialCapacity) {
    if (initialCapacity < 0) {
      throw new IllegalArgumentException("Illegal initial capacity: " + initialCapacity);
    }
    this.store = new HashMap<>(hashMapCapacityFor(initialCapacity));
    this.order = new ArrayList<>(initialCapacity);
  }

  /**
   * @return a HashMap capacity which holds {@code expectedSize} entries without rehashing
   */
  static int hashMapCapacityFor(int expectedSize) {
    return (int) Math.min((long) Math.ceil(expectedSize / 0.75d), Integer.MAX_VALUE);
  }

  @Override
  public V get(K key) {
    return store.get(key);
  }

  @Override
  public V getOrDefault(K key, V defaultValue) {
    return store.getOrDefault(key, defaultValue);
  }

  @Override
  public boolean has(K key) {
    return store.containsKey(key);
  }

  @Override
  public boolean set(K key, V value) {
    boolean alreadyExists = store.containsKey(key);
    store.put(key, value);
    if (alreadyExists) {
      return false;
    }
    order.add(key);
    return true;
  }

  @Override
  public boolean replaceKey(K originalKey, K newKey) {
    if (!store.containsKey(originalKey) || store.containsKey(newKey)) {
      return false;
    }
    V value = store.remove(originalKey);
    store.put(newKey, value);
    order.set(order.indexOf(originalKey), newKey);
    return true;
  }

  @Override
  public boolean delete(K key) {
    if (!store.containsKey(key)) {
      return false;
    }
    int index = order.indexOf(key);
    order.remove(index);
    store.remove(key);
    return true;
  }

  @Override
  public int size() {
    return order.size();
  }

  @Override
  public ArrayOrderedMap<K, V> copy() {
    ArrayOrderedMap<K, V> copy = new ArrayOrderedMap<>(size());
    for (K key: order) {
      copy.set(key, store.get(key));
    }
    return copy;
  }

  /**
   * The iterators address the key list by index and are not fail-fast. A concurrent shrink ends the traversal
   * early.
   */
  @Override
  protected Iterator<Map.Entry<K, V>> frontIterator() {
    return new Iterator<Map.Entry<K, V>>() {
      private int cursor = 0;

      @Override
      public boolean hasNext() {
        return cursor < order.size();
      }

      @Override
      public Map.Entry<K, V> next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        K key = order.get(cursor++);
        return new Element<>(key, store.get(key));
      }
    };
  }

  @Override
  protected Iterator<Map.Entry<K, V>> backIterator() {
    return new Iterator<Map.Entry<K, V>>() {
      private int cursor = order.size() - 1;

      @Override
      public boolean hasNext() {
        return Math.min(cursor, order.size() - 1) >= 0;
      }

      @Override
      public Map.Entry<K, V> next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        cursor = Math.min(cursor, order.size() - 1);
        K key = order.get(cursor--);
        return new Element<>(key, store.get(key));
      }
    };
  }
}
