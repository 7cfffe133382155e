package com.linkedin.orderedmap;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;


/**
 * An {@link OrderedMap} where each key maps to a node of an intrusive doubly linked list, the list defining the
 * iteration order. It behaves exactly like {@link ArrayOrderedMap}, but trades some memory per entry to make
 * {@link #delete(Object)} and {@link #replaceKey(Object, Object)} constant-time.
 *
 * <p><strong>Note that this implementation is not synchronized.</strong>
 */
public class LinkedOrderedMap<K, V> extends AbstractOrderedMap<K, V> {
  /**
   * Unlinked nodes keep their outgoing pointers so that an iterator parked on them can still move forward.
   */
  static final class Node<K, V> {
    K key;
    V value;
    Node<K, V> prev;
    Node<K, V> next;
    boolean removed;

    Node(K key, V value, Node<K, V> prev) {
      this.key = key;
      this.value = value;
      this.prev = prev;
    }
  }

  private final Map<K, Node<K, V>> index;
  private Node<K, V> head;
  private Node<K, V> tail;

  public LinkedOrderedMap() {
    this.index = new HashMap<>();
  }

  /**
   * @param initialCapacity the number of keys to reserve room for
   * @throws IllegalArgumentException if the initial capacity is negative
   */
  public LinkedOrderedMap(int initialCapacity) {
    if (initialCapacity < 0) {
      throw new IllegalArgumentException("Illegal initial capacity: " + initialCapacity);
    }
    this.index = new HashMap<>(ArrayOrderedMap.hashMapCapacityFor(initialCapacity));
  }

  @Override
  public V get(K key) {
    Node<K, V> node = index.get(key);
    return node == null ? null : node.value;
  }

  @Override
  public V getOrDefault(K key, V defaultValue) {
    Node<K, V> node = index.get(key);
    return node == null ? defaultValue : node.value;
  }

  @Override
  public boolean has(K key) {
    return index.containsKey(key);
  }

  @Override
  public boolean set(K key, V value) {
    Node<K, V> node = index.get(key);
    if (node != null) {
      node.value = value;
      return false;
    }
    node = new Node<>(key, value, tail);
    if (tail == null) {
      head = node;
    } else {
      tail.next = node;
    }
    tail = node;
    index.put(key, node);
    return true;
  }

  @Override
  public boolean replaceKey(K originalKey, K newKey) {
    Node<K, V> node = index.get(originalKey);
    if (node == null || index.containsKey(newKey)) {
      return false;
    }
    index.remove(originalKey);
    node.key = newKey;
    index.put(newKey, node);
    return true;
  }

  @Override
  public boolean delete(K key) {
    Node<K, V> node = index.remove(key);
    if (node == null) {
      return false;
    }
    if (node.prev == null) {
      head = node.next;
    } else {
      node.prev.next = node.next;
    }
    if (node.next == null) {
      tail = node.prev;
    } else {
      node.next.prev = node.prev;
    }
    node.removed = true;
    return true;
  }

  @Override
  public int size() {
    return index.size();
  }

  @Override
  public LinkedOrderedMap<K, V> copy() {
    LinkedOrderedMap<K, V> copy = new LinkedOrderedMap<>(size());
    for (Node<K, V> node = head; node != null; node = node.next) {
      copy.set(node.key, node.value);
    }
    return copy;
  }

  @Override
  protected Iterator<Map.Entry<K, V>> frontIterator() {
    return new NodeIterator(head, true);
  }

  @Override
  protected Iterator<Map.Entry<K, V>> backIterator() {
    return new NodeIterator(tail, false);
  }

  private final class NodeIterator implements Iterator<Map.Entry<K, V>> {
    private final boolean forward;
    private Node<K, V> cursor;

    NodeIterator(Node<K, V> start, boolean forward) {
      this.cursor = start;
      this.forward = forward;
    }

    private Node<K, V> step(Node<K, V> node) {
      return forward ? node.next : node.prev;
    }

    @Override
    public boolean hasNext() {
      while (cursor != null && cursor.removed) {
        cursor = step(cursor);
      }
      return cursor != null;
    }

    @Override
    public Map.Entry<K, V> next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      Node<K, V> node = cursor;
      cursor = step(node);
      return new Element<>(node.key, node.value);
    }
  }
}
