package com.linkedin.orderedmap;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;


/**
 * Skeleton shared by the {@link OrderedMap} implementations. Subclasses provide the two directional iterators and
 * the views, equality and string rendering are derived from them.
 */
public abstract class AbstractOrderedMap<K, V> implements OrderedMap<K, V> {
  /**
   * @return a new iterator over the entries, oldest inserted key first
   */
  protected abstract Iterator<Map.Entry<K, V>> frontIterator();

  /**
   * @return a new iterator over the entries, most recently inserted key first
   */
  protected abstract Iterator<Map.Entry<K, V>> backIterator();

  @Override
  public Iterable<Map.Entry<K, V>> allFromFront() {
    return this::frontIterator;
  }

  @Override
  public Iterable<Map.Entry<K, V>> allFromBack() {
    return this::backIterator;
  }

  @Override
  public Iterable<K> keys() {
    return () -> new ProjectingIterator<>(frontIterator(), Map.Entry::getKey);
  }

  @Override
  public Iterable<V> values() {
    return () -> new ProjectingIterator<>(frontIterator(), Map.Entry::getValue);
  }

  /**
   * Two ordered maps are equal when they hold equal entries in the same order, regardless of their implementation.
   */
  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof OrderedMap)) {
      return false;
    }
    OrderedMap<?, ?> other = (OrderedMap<?, ?>) o;
    if (size() != other.size()) {
      return false;
    }
    Iterator<Map.Entry<K, V>> mine = frontIterator();
    Iterator<? extends Map.Entry<?, ?>> theirs = other.iterator();
    while (mine.hasNext() && theirs.hasNext()) {
      if (!Objects.equals(mine.next(), theirs.next())) {
        return false;
      }
    }
    return !mine.hasNext() && !theirs.hasNext();
  }

  @Override
  public int hashCode() {
    int result = 1;
    for (Map.Entry<K, V> entry: allFromFront()) {
      result = 31 * result + entry.hashCode();
    }
    return result;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("{");
    Iterator<Map.Entry<K, V>> iterator = frontIterator();
    while (iterator.hasNext()) {
      Map.Entry<K, V> entry = iterator.next();
      builder.append(entry.getKey() == this ? "(this Map)" : entry.getKey());
      builder.append('=');
      builder.append(entry.getValue() == this ? "(this Map)" : entry.getValue());
      if (iterator.hasNext()) {
        builder.append(", ");
      }
    }
    return builder.append('}').toString();
  }

  /**
   * Projects each entry as it is pulled, never ahead of {@link Iterator#next()}.
   */
  private static final class ProjectingIterator<E, O> implements Iterator<O> {
    private final Iterator<E> entries;
    private final Function<E, O> projection;

    ProjectingIterator(Iterator<E> entries, Function<E, O> projection) {
      this.entries = entries;
      this.projection = projection;
    }

    @Override
    public boolean hasNext() {
      return entries.hasNext();
    }

    @Override
    public O next() {
      return projection.apply(entries.next());
    }
  }
}
