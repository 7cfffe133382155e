package com.linkedin.orderedmap;

import static com.linkedin.orderedmap.ConfigKeys.ORDERED_MAP_INITIAL_CAPACITY;
import static com.linkedin.orderedmap.ConfigKeys.ORDERED_MAP_ORDERING_STRATEGY;

import com.linkedin.orderedmap.exceptions.ConfigurationException;
import com.linkedin.orderedmap.utils.OrderedMapProperties;
import java.util.Arrays;
import java.util.Locale;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;


/**
 * Settings used by {@link OrderedMaps} to create maps. Build one with {@link Builder}, either through its setters or
 * from {@link OrderedMapProperties} using the keys in {@link ConfigKeys}.
 */
public class OrderedMapConfig {
  private static final Logger LOGGER = LogManager.getLogger(OrderedMapConfig.class);

  public static final OrderingStrategy DEFAULT_ORDERING_STRATEGY = OrderingStrategy.ARRAY_SCAN;
  public static final int DEFAULT_INITIAL_CAPACITY = 0;

  private final OrderingStrategy orderingStrategy;
  private final int initialCapacity;

  private OrderedMapConfig(Builder builder) {
    this.orderingStrategy = builder.orderingStrategy;
    this.initialCapacity = builder.initialCapacity;
  }

  public static OrderedMapConfig defaultConfig() {
    return new Builder().build();
  }

  public OrderingStrategy getOrderingStrategy() {
    return orderingStrategy;
  }

  public int getInitialCapacity() {
    return initialCapacity;
  }

  @Override
  public String toString() {
    return "OrderedMapConfig{orderingStrategy=" + orderingStrategy + ", initialCapacity=" + initialCapacity + "}";
  }

  public static class Builder {
    private OrderingStrategy orderingStrategy = null;
    private int initialCapacity = DEFAULT_INITIAL_CAPACITY;

    public Builder setOrderingStrategy(OrderingStrategy orderingStrategy) {
      this.orderingStrategy = orderingStrategy;
      return this;
    }

    public Builder setInitialCapacity(int initialCapacity) {
      this.initialCapacity = initialCapacity;
      return this;
    }

    /**
     * Reads the keys of {@link ConfigKeys} which are present in {@code properties}. Absent keys leave the current
     * builder values untouched.
     *
     * @throws ConfigurationException if a present value cannot be parsed
     */
    public Builder extractAndSetValues(OrderedMapProperties properties) {
      if (properties.containsKey(ORDERED_MAP_ORDERING_STRATEGY)) {
        setOrderingStrategy(parseOrderingStrategy(properties.getString(ORDERED_MAP_ORDERING_STRATEGY)));
      }
      if (properties.containsKey(ORDERED_MAP_INITIAL_CAPACITY)) {
        setInitialCapacity(properties.getInt(ORDERED_MAP_INITIAL_CAPACITY));
      }
      return this;
    }

    private static OrderingStrategy parseOrderingStrategy(String configValue) {
      if (configValue == null) {
        throw new ConfigurationException("Config '" + ORDERED_MAP_ORDERING_STRATEGY + "' must not be null");
      }
      try {
        return OrderingStrategy.valueOf(configValue.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        LOGGER.warn("Rejecting ordering strategy '{}'", configValue);
        throw new ConfigurationException(
            "Unrecognized ordering strategy: " + configValue + ", expected one of "
                + Arrays.toString(OrderingStrategy.values()),
            e);
      }
    }

    private void checkAndSetDefaults() {
      if (orderingStrategy == null) {
        LOGGER.info("Ordering strategy is not set. Defaulting to {}", DEFAULT_ORDERING_STRATEGY);
        setOrderingStrategy(DEFAULT_ORDERING_STRATEGY);
      }
      if (initialCapacity < 0) {
        LOGGER.warn("Rejecting negative initial capacity {}", initialCapacity);
        throw new ConfigurationException(
            "Config '" + ORDERED_MAP_INITIAL_CAPACITY + "' must not be negative, got: " + initialCapacity);
      }
    }

    public OrderedMapConfig build() {
      checkAndSetDefaults();
      return new OrderedMapConfig(this);
    }
  }
}
