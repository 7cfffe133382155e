package com.linkedin.orderedmap;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.testng.annotations.Test;


public class OrderedMapsTest {
  private static <K, V> List<K> keysOf(OrderedMap<K, V> map) {
    List<K> keys = new ArrayList<>();
    map.keys().forEach(keys::add);
    return keys;
  }

  @Test
  public void testDefaultFactoriesUseArrayScan() {
    assertTrue(OrderedMaps.newOrderedMap() instanceof ArrayOrderedMap);
    assertTrue(OrderedMaps.newOrderedMapWithCapacity(16) instanceof ArrayOrderedMap);
    assertTrue(OrderedMaps.newOrderedMapWithCapacity(16).isEmpty());
    assertThrows(IllegalArgumentException.class, () -> OrderedMaps.newOrderedMapWithCapacity(-1));
  }

  @Test
  public void testNewOrderedMapWithElements() {
    OrderedMap<String, Integer> map = OrderedMaps.newOrderedMapWithElements(
        Element.create("b", 2),
        Element.create("a", 1),
        Element.create("b", 3));

    assertEquals(keysOf(map), Arrays.asList("b", "a"));
    assertEquals((int) map.get("b"), 3, "A repeated key should keep its last value");
    assertEquals(map.size(), 2);

    assertTrue(OrderedMaps.<String, Integer>newOrderedMapWithElements().isEmpty());
  }

  @Test
  public void testNewOrderedMapWithEntries() {
    Map<String, Integer> source = new LinkedHashMap<>();
    source.put("x", 1);
    source.put("y", 2);
    OrderedMap<String, Integer> fromJdkMap = OrderedMaps.newOrderedMapWithElements(source.entrySet());
    assertEquals(keysOf(fromJdkMap), Arrays.asList("x", "y"));

    OrderedMap<String, Integer> fromOrderedMap = OrderedMaps.newOrderedMapWithElements(fromJdkMap);
    assertEquals(fromOrderedMap, fromJdkMap);
  }

  @Test
  public void testNewOrderedMapFromConfig() {
    OrderedMap<String, Integer> linked = OrderedMaps.newOrderedMap(
        new OrderedMapConfig.Builder().setOrderingStrategy(OrderingStrategy.LINKED_INDEX)
            .setInitialCapacity(128)
            .build());
    assertTrue(linked instanceof LinkedOrderedMap);

    OrderedMap<String, Integer> defaults = OrderedMaps.newOrderedMap(OrderedMapConfig.defaultConfig());
    assertTrue(defaults instanceof ArrayOrderedMap);
  }
}
