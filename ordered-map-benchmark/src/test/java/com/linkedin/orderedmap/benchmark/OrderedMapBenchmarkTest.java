package com.linkedin.orderedmap.benchmark;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNotSame;
import static org.testng.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;


public class OrderedMapBenchmarkTest {
  private static final int MAP_SIZE = 100;

  @DataProvider
  Object[][] orderingStrategies() {
    return new Object[][] { { "ARRAY_SCAN" }, { "LINKED_INDEX" } };
  }

  private static OrderedMapBenchmark newBenchmark(String orderingStrategy) {
    OrderedMapBenchmark benchmark = new OrderedMapBenchmark();
    benchmark.orderingStrategy = orderingStrategy;
    benchmark.mapSize = MAP_SIZE;
    benchmark.setUp();
    return benchmark;
  }

  private static int positionOf(OrderedMapBenchmark.DeleteState state) {
    List<String> keys = new ArrayList<>();
    state.map.keys().forEach(keys::add);
    return keys.indexOf(state.middleKey);
  }

  @Test(dataProvider = "orderingStrategies")
  public void testDeleteAlwaysHitsTheMiddleKey(String orderingStrategy) {
    OrderedMapBenchmark benchmark = newBenchmark(orderingStrategy);
    OrderedMapBenchmark.DeleteState state = new OrderedMapBenchmark.DeleteState();

    for (int invocation = 0; invocation < 3; invocation++) {
      state.setUp(benchmark);
      assertEquals(state.map.size(), MAP_SIZE);
      assertEquals(positionOf(state), MAP_SIZE / 2, "Invocation " + invocation + " does not delete from the middle");

      assertTrue(benchmark.deleteFromMiddle(state));
      assertEquals(state.map.size(), MAP_SIZE - 1);
    }
  }

  @Test(dataProvider = "orderingStrategies")
  public void testDeleteLeavesSharedMapUntouched(String orderingStrategy) {
    OrderedMapBenchmark benchmark = newBenchmark(orderingStrategy);
    OrderedMapBenchmark.DeleteState first = new OrderedMapBenchmark.DeleteState();
    first.setUp(benchmark);
    benchmark.deleteFromMiddle(first);

    OrderedMapBenchmark.DeleteState second = new OrderedMapBenchmark.DeleteState();
    second.setUp(benchmark);
    assertNotSame(second.map, first.map);
    assertEquals(positionOf(second), MAP_SIZE / 2);
  }
}
