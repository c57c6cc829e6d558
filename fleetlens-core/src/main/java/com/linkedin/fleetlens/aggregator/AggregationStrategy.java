/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.aggregator;

import com.linkedin.fleetlens.common.config.ConfigDef;
import com.linkedin.fleetlens.common.config.ConfigException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;


/**
 * The strategies to combine a list of anomaly scores into one score.
 *
 * <ul>
 *   <li>{@link #MAX}: the highest score.</li>
 *   <li>{@link #MEAN}: the arithmetic mean.</li>
 *   <li>{@link #WEIGHTED}: the mean weighted by metric. Only node level inputs carry a metric name, higher levels
 *   combine like {@link #MAX}.</li>
 *   <li>{@link #P95}: the 95th percentile with linear interpolation.</li>
 * </ul>
 */
public enum AggregationStrategy {
  MAX("max"), MEAN("mean"), WEIGHTED("weighted"), P95("p95");

  private static final List<AggregationStrategy> CACHED_VALUES = Collections.unmodifiableList(Arrays.asList(values()));
  public static final ConfigDef.ValidString VALIDATOR =
      ConfigDef.ValidString.in(MAX.value(), MEAN.value(), WEIGHTED.value(), P95.value());
  private final String _value;

  AggregationStrategy(String value) {
    _value = value;
  }

  /**
   * @return The name of this strategy in configs and JSON.
   */
  public String value() {
    return _value;
  }

  /**
   * @param value The name of a strategy.
   * @return The strategy with the given name.
   * @throws ConfigException If no strategy has the given name.
   */
  public static AggregationStrategy forValue(String value) {
    for (AggregationStrategy strategy : CACHED_VALUES) {
      if (strategy._value.equals(value)) {
        return strategy;
      }
    }
    throw new ConfigException("aggregation.strategy", value, "Unknown aggregation strategy, valid values are "
                                                             + VALIDATOR);
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<AggregationStrategy> cachedValues() {
    return CACHED_VALUES;
  }
}
