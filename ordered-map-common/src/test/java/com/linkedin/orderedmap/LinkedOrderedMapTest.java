package com.linkedin.orderedmap;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.testng.annotations.Test;


public class LinkedOrderedMapTest {
  @Test
  public void testIteratorSkipsEntriesDeletedAheadOfIt() {
    LinkedOrderedMap<String, Integer> map = new LinkedOrderedMap<>();
    map.set("a", 1);
    map.set("b", 2);
    map.set("c", 3);
    map.set("d", 4);

    Iterator<Map.Entry<String, Integer>> iterator = map.iterator();
    assertEquals(iterator.next().getKey(), "a");
    map.delete("b");
    map.delete("c");
    assertTrue(iterator.hasNext());
    assertEquals(iterator.next().getKey(), "d");
    assertFalse(iterator.hasNext());
  }

  @Test
  public void testIteratorParkedOnDeletedEntryMovesOn() {
    LinkedOrderedMap<String, Integer> map = new LinkedOrderedMap<>();
    map.set("a", 1);
    map.set("b", 2);
    map.set("c", 3);

    Iterator<Map.Entry<String, Integer>> iterator = map.allFromBack().iterator();
    assertEquals(iterator.next().getKey(), "c");
    // The iterator now points at "b".
    map.delete("b");
    assertEquals(iterator.next().getKey(), "a");
    assertFalse(iterator.hasNext());
  }

  @Test
  public void testRenameIsVisibleToInFlightIterator() {
    LinkedOrderedMap<String, Integer> map = new LinkedOrderedMap<>();
    map.set("a", 1);
    map.set("b", 2);

    Iterator<String> keys = map.keys().iterator();
    assertEquals(keys.next(), "a");
    map.replaceKey("b", "x");
    assertEquals(keys.next(), "x");
  }

  @Test
  public void testInsertAfterDrainingTheMap() {
    LinkedOrderedMap<String, Integer> map = new LinkedOrderedMap<>(4);
    map.set("a", 1);
    map.delete("a");
    map.set("b", 2);
    map.set("c", 3);

    List<String> keys = new ArrayList<>();
    map.keys().forEach(keys::add);
    assertEquals(keys, Arrays.asList("b", "c"));
  }

  @Test
  public void testNegativeCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new LinkedOrderedMap<String, Integer>(-1));
  }
}
