package com.linkedin.orderedmap.benchmark;

import com.linkedin.orderedmap.OrderedMap;
import com.linkedin.orderedmap.OrderedMapConfig;
import com.linkedin.orderedmap.OrderedMaps;
import com.linkedin.orderedmap.OrderingStrategy;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.profile.GCProfiler;
import org.openjdk.jmh.results.RunResult;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.OptionsBuilder;


/**
 * Compares the {@link OrderingStrategy} implementations of {@link OrderedMap} with each other and with a
 * {@link LinkedHashMap} baseline. Run {@link #main(String[])} to get both timings and, through the
 * {@link GCProfiler}, allocation counts per operation.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 2)
@Warmup(iterations = 2)
@Measurement(iterations = 3)
public class OrderedMapBenchmark {
  private static final Logger LOGGER = LogManager.getLogger(OrderedMapBenchmark.class);
  private static final String KEY_PREFIX = "key_";

  @Param({ "ARRAY_SCAN", "LINKED_INDEX" })
  protected String orderingStrategy;

  @Param({ "100", "10000" })
  protected int mapSize;

  private String[] keys;
  private OrderedMap<String, Integer> populatedMap;
  private LinkedHashMap<String, Integer> populatedBaseline;

  @Setup(Level.Trial)
  public void setUp() {
    keys = new String[mapSize];
    for (int i = 0; i < mapSize; i++) {
      keys[i] = KEY_PREFIX + i;
    }
    populatedMap = newMap();
    populatedBaseline = new LinkedHashMap<>();
    for (int i = 0; i < mapSize; i++) {
      populatedMap.set(keys[i], i);
      populatedBaseline.put(keys[i], i);
    }
  }

  private OrderedMap<String, Integer> newMap() {
    return OrderedMaps.newOrderedMap(
        new OrderedMapConfig.Builder().setOrderingStrategy(OrderingStrategy.valueOf(orderingStrategy)).build());
  }

  @Benchmark
  public OrderedMap<String, Integer> setNewKeys() {
    OrderedMap<String, Integer> map = newMap();
    for (int i = 0; i < keys.length; i++) {
      map.set(keys[i], i);
    }
    return map;
  }

  @Benchmark
  public void get(Blackhole bh) {
    for (String key: keys) {
      bh.consume(populatedMap.get(key));
    }
  }

  /**
   * Holds a fresh copy of the populated map for every invocation, so the deleted key always sits in the middle of
   * the order.
   */
  @State(Scope.Thread)
  public static class DeleteState {
    OrderedMap<String, Integer> map;
    String middleKey;

    @Setup(Level.Invocation)
    public void setUp(OrderedMapBenchmark benchmark) {
      map = benchmark.populatedMap.copy();
      middleKey = benchmark.keys[benchmark.keys.length / 2];
    }
  }

  @Benchmark
  public boolean deleteFromMiddle(DeleteState state) {
    return state.map.delete(state.middleKey);
  }

  @Benchmark
  public void iterateFromFront(Blackhole bh) {
    for (Map.Entry<String, Integer> entry: populatedMap.allFromFront()) {
      bh.consume(entry.getValue());
    }
  }

  @Benchmark
  public LinkedHashMap<String, Integer> baselineSetNewKeys() {
    LinkedHashMap<String, Integer> map = new LinkedHashMap<>();
    for (int i = 0; i < keys.length; i++) {
      map.put(keys[i], i);
    }
    return map;
  }

  @Benchmark
  public void baselineIterate(Blackhole bh) {
    for (Map.Entry<String, Integer> entry: populatedBaseline.entrySet()) {
      bh.consume(entry.getValue());
    }
  }

  public static void main(String[] args) throws RunnerException {
    org.openjdk.jmh.runner.options.Options opt =
        new OptionsBuilder().include(OrderedMapBenchmark.class.getSimpleName()).addProfiler(GCProfiler.class)
        .build();
    Collection<RunResult> results = new Runner(opt).run();
    for (RunResult result: results) {
      LOGGER.info(
          "{} {}: {} {}",
          result.getParams().getBenchmark(),
          result.getParams(),
          result.getPrimaryResult().getScore(),
          result.getPrimaryResult().getScoreUnit());
    }
  }
}
