/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.config;

import com.linkedin.fleetlens.aggregator.AggregationStrategy;
import com.linkedin.fleetlens.common.config.AbstractConfig;
import com.linkedin.fleetlens.common.config.ConfigDef;
import com.linkedin.fleetlens.common.config.ConfigException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.linkedin.fleetlens.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.fleetlens.common.config.ConfigDef.Range.atLeastOrUnset;
import static com.linkedin.fleetlens.common.config.ConfigDef.Range.between;


/**
 * The configuration for the FleetLens analysis pipeline.
 */
public class FleetLensConfig extends AbstractConfig {
  private static final ConfigDef CONFIG;

  public static final String WINDOW_MODE_POINTS = "points";
  public static final String WINDOW_MODE_DURATION = "duration";

  /**
   * <code>window.mode</code>
   */
  public static final String WINDOW_MODE_CONFIG = "window.mode";
  private static final String WINDOW_MODE_DOC = "How metric series are sliced into windows. \"points\" slices by a fixed "
      + "number of data points, \"duration\" slices by a fixed wall-clock duration.";

  /**
   * <code>window.size.points</code>
   */
  public static final String WINDOW_SIZE_POINTS_CONFIG = "window.size.points";
  private static final String WINDOW_SIZE_POINTS_DOC = "The number of data points in each window when window.mode is "
      + "\"points\".";

  /**
   * <code>window.stride.points</code>
   */
  public static final String WINDOW_STRIDE_POINTS_CONFIG = "window.stride.points";
  private static final String WINDOW_STRIDE_POINTS_DOC = "The number of data points to advance between two consecutive "
      + "windows. Defaults to window.size.points, i.e. non-overlapping windows. A stride smaller than the window size "
      + "produces overlapping windows.";

  /**
   * <code>window.duration.ms</code>
   */
  public static final String WINDOW_DURATION_MS_CONFIG = "window.duration.ms";
  private static final String WINDOW_DURATION_MS_DOC = "The time span in milliseconds covered by each window when "
      + "window.mode is \"duration\".";

  /**
   * <code>window.stride.ms</code>
   */
  public static final String WINDOW_STRIDE_MS_CONFIG = "window.stride.ms";
  private static final String WINDOW_STRIDE_MS_DOC = "The time in milliseconds to advance between two consecutive "
      + "windows. Defaults to window.duration.ms.";

  /**
   * <code>window.include.partial</code>
   */
  public static final String WINDOW_INCLUDE_PARTIAL_CONFIG = "window.include.partial";
  private static final String WINDOW_INCLUDE_PARTIAL_DOC = "Whether to emit windows that are shorter than the "
      + "configured window size at the end of a series. When disabled, a series shorter than one window is rejected.";

  /**
   * <code>anomaly.score.threshold</code>
   */
  public static final String ANOMALY_SCORE_THRESHOLD_CONFIG = "anomaly.score.threshold";
  private static final String ANOMALY_SCORE_THRESHOLD_DOC = "The minimum engine-supplied anomaly score for a window "
      + "to be classified. Windows scored below this threshold are labeled normal.";

  /**
   * <code>spike.zscore.threshold</code>
   */
  public static final String SPIKE_ZSCORE_THRESHOLD_CONFIG = "spike.zscore.threshold";
  private static final String SPIKE_ZSCORE_THRESHOLD_DOC = "A window is a spike if the value farthest from the window "
      + "mean deviates from it by more than this many sample standard deviations.";

  /**
   * <code>spike.min.points</code>
   */
  public static final String SPIKE_MIN_POINTS_CONFIG = "spike.min.points";
  private static final String SPIKE_MIN_POINTS_DOC = "The minimum number of points for the spike rule to apply.";

  /**
   * <code>trend.relative.threshold</code>
   */
  public static final String TREND_RELATIVE_THRESHOLD_CONFIG = "trend.relative.threshold";
  private static final String TREND_RELATIVE_THRESHOLD_DOC = "A window is a trend if the mean of its second half "
      + "differs from the mean of its first half by more than this ratio of the first half mean. The ratio itself is "
      + "used as an absolute threshold when the first half mean is zero.";

  /**
   * <code>trend.min.points</code>
   */
  public static final String TREND_MIN_POINTS_CONFIG = "trend.min.points";
  private static final String TREND_MIN_POINTS_DOC = "The minimum number of points for the trend rule to apply.";

  /**
   * <code>seasonal.min.points</code>
   */
  public static final String SEASONAL_MIN_POINTS_CONFIG = "seasonal.min.points";
  private static final String SEASONAL_MIN_POINTS_DOC = "The minimum number of points for the seasonal rule to apply.";

  /**
   * <code>seasonal.min.mean.crossings</code>
   */
  public static final String SEASONAL_MIN_MEAN_CROSSINGS_CONFIG = "seasonal.min.mean.crossings";
  private static final String SEASONAL_MIN_MEAN_CROSSINGS_DOC = "The minimum number of times consecutive values must "
      + "cross the window mean for the window to be considered seasonal.";

  /**
   * <code>node.aggregation.strategy</code>
   */
  public static final String NODE_AGGREGATION_STRATEGY_CONFIG = "node.aggregation.strategy";
  private static final String NODE_AGGREGATION_STRATEGY_DOC = "The strategy used to combine the per-metric anomaly "
      + "scores of a node into a node score. One of max, mean, weighted, p95.";

  /**
   * <code>cluster.aggregation.strategy</code>
   */
  public static final String CLUSTER_AGGREGATION_STRATEGY_CONFIG = "cluster.aggregation.strategy";
  private static final String CLUSTER_AGGREGATION_STRATEGY_DOC = "The strategy used to combine node scores into a "
      + "cluster score. One of max, mean, weighted, p95. Node scores carry no metric weights, so weighted combines "
      + "like max at this level.";

  /**
   * <code>tenant.aggregation.strategy</code>
   */
  public static final String TENANT_AGGREGATION_STRATEGY_CONFIG = "tenant.aggregation.strategy";
  private static final String TENANT_AGGREGATION_STRATEGY_DOC = "The strategy used to combine cluster scores into a "
      + "tenant score. One of max, mean, weighted, p95. Cluster scores carry no metric weights, so weighted combines "
      + "like max at this level.";

  /**
   * <code>node.aggregation.metric.weights</code>
   */
  public static final String NODE_AGGREGATION_METRIC_WEIGHTS_CONFIG = "node.aggregation.metric.weights";
  private static final String NODE_AGGREGATION_METRIC_WEIGHTS_DOC = "A comma separated list of metric:weight pairs "
      + "used by the weighted node aggregation strategy, e.g. cpu_usage:2.0,memory_used:1.0. Metrics without a weight "
      + "count with weight 1.0.";

  /**
   * <code>aggregation.num.threads</code>
   */
  public static final String AGGREGATION_NUM_THREADS_CONFIG = "aggregation.num.threads";
  private static final String AGGREGATION_NUM_THREADS_DOC = "The number of threads used to aggregate independent "
      + "nodes, clusters and tenants concurrently. 1 aggregates on the calling thread.";

  /**
   * <code>anomaly.detection.engines</code>
   */
  public static final String ANOMALY_DETECTION_ENGINES_CONFIG = "anomaly.detection.engines";
  private static final String ANOMALY_DETECTION_ENGINES_DOC = "A list of AnomalyDetectionEngine class names to "
      + "register at startup. Each engine is instantiated with its no-argument constructor and configured with the "
      + "original configs.";

  static {
    CONFIG = new ConfigDef()
        .define(WINDOW_MODE_CONFIG,
                ConfigDef.Type.STRING,
                WINDOW_MODE_POINTS,
                ConfigDef.ValidString.in(WINDOW_MODE_POINTS, WINDOW_MODE_DURATION),
                WINDOW_MODE_DOC)
        .define(WINDOW_SIZE_POINTS_CONFIG,
                ConfigDef.Type.INT,
                100,
                atLeast(1),
                WINDOW_SIZE_POINTS_DOC)
        .define(WINDOW_STRIDE_POINTS_CONFIG,
                ConfigDef.Type.INT,
                null,
                atLeastOrUnset(1),
                WINDOW_STRIDE_POINTS_DOC)
        .define(WINDOW_DURATION_MS_CONFIG,
                ConfigDef.Type.LONG,
                3_600_000L,
                atLeast(1),
                WINDOW_DURATION_MS_DOC)
        .define(WINDOW_STRIDE_MS_CONFIG,
                ConfigDef.Type.LONG,
                null,
                atLeastOrUnset(1),
                WINDOW_STRIDE_MS_DOC)
        .define(WINDOW_INCLUDE_PARTIAL_CONFIG,
                ConfigDef.Type.BOOLEAN,
                false,
                WINDOW_INCLUDE_PARTIAL_DOC)
        .define(ANOMALY_SCORE_THRESHOLD_CONFIG,
                ConfigDef.Type.DOUBLE,
                0.5,
                between(0.0, 1.0),
                ANOMALY_SCORE_THRESHOLD_DOC)
        .define(SPIKE_ZSCORE_THRESHOLD_CONFIG,
                ConfigDef.Type.DOUBLE,
                2.0,
                atLeast(0.0),
                SPIKE_ZSCORE_THRESHOLD_DOC)
        .define(SPIKE_MIN_POINTS_CONFIG,
                ConfigDef.Type.INT,
                3,
                atLeast(2),
                SPIKE_MIN_POINTS_DOC)
        .define(TREND_RELATIVE_THRESHOLD_CONFIG,
                ConfigDef.Type.DOUBLE,
                0.05,
                atLeast(0.0),
                TREND_RELATIVE_THRESHOLD_DOC)
        .define(TREND_MIN_POINTS_CONFIG,
                ConfigDef.Type.INT,
                4,
                atLeast(2),
                TREND_MIN_POINTS_DOC)
        .define(SEASONAL_MIN_POINTS_CONFIG,
                ConfigDef.Type.INT,
                6,
                atLeast(2),
                SEASONAL_MIN_POINTS_DOC)
        .define(SEASONAL_MIN_MEAN_CROSSINGS_CONFIG,
                ConfigDef.Type.INT,
                3,
                atLeast(1),
                SEASONAL_MIN_MEAN_CROSSINGS_DOC)
        .define(NODE_AGGREGATION_STRATEGY_CONFIG,
                ConfigDef.Type.STRING,
                AggregationStrategy.MAX.value(),
                AggregationStrategy.VALIDATOR,
                NODE_AGGREGATION_STRATEGY_DOC)
        .define(CLUSTER_AGGREGATION_STRATEGY_CONFIG,
                ConfigDef.Type.STRING,
                AggregationStrategy.MAX.value(),
                AggregationStrategy.VALIDATOR,
                CLUSTER_AGGREGATION_STRATEGY_DOC)
        .define(TENANT_AGGREGATION_STRATEGY_CONFIG,
                ConfigDef.Type.STRING,
                AggregationStrategy.MAX.value(),
                AggregationStrategy.VALIDATOR,
                TENANT_AGGREGATION_STRATEGY_DOC)
        .define(NODE_AGGREGATION_METRIC_WEIGHTS_CONFIG,
                ConfigDef.Type.LIST,
                "",
                (name, value) -> parseMetricWeights(name, (List<?>) value),
                NODE_AGGREGATION_METRIC_WEIGHTS_DOC)
        .define(AGGREGATION_NUM_THREADS_CONFIG,
                ConfigDef.Type.INT,
                1,
                atLeast(1),
                AGGREGATION_NUM_THREADS_DOC)
        .define(ANOMALY_DETECTION_ENGINES_CONFIG,
                ConfigDef.Type.LIST,
                "",
                ANOMALY_DETECTION_ENGINES_DOC);
  }

  public FleetLensConfig(Map<?, ?> originals) {
    this(originals, true);
  }

  public FleetLensConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
  }

  /**
   * @return The config definition, e.g. to render documentation.
   */
  public static ConfigDef configDef() {
    return CONFIG;
  }

  /**
   * @param key One of the aggregation strategy configs.
   * @return The aggregation strategy configured for the given key.
   */
  public AggregationStrategy aggregationStrategy(String key) {
    return AggregationStrategy.forValue(getString(key));
  }

  /**
   * @return Metric name to weight map parsed from {@link #NODE_AGGREGATION_METRIC_WEIGHTS_CONFIG}, in the configured
   * order.
   */
  public Map<String, Double> metricWeights() {
    return parseMetricWeights(NODE_AGGREGATION_METRIC_WEIGHTS_CONFIG, getList(NODE_AGGREGATION_METRIC_WEIGHTS_CONFIG));
  }

  private static Map<String, Double> parseMetricWeights(String name, List<?> entries) {
    if (entries == null || entries.isEmpty()) {
      return Collections.emptyMap();
    }
    Map<String, Double> weights = new LinkedHashMap<>();
    for (Object entry : entries) {
      String pair = String.valueOf(entry);
      int separator = pair.lastIndexOf(':');
      if (separator <= 0 || separator == pair.length() - 1) {
        throw new ConfigException(name, pair, "Expected a metric:weight pair.");
      }
      String metric = pair.substring(0, separator).trim();
      double weight;
      try {
        weight = Double.parseDouble(pair.substring(separator + 1).trim());
      } catch (NumberFormatException e) {
        throw new ConfigException(name, pair, "Weight is not a number.");
      }
      if (weight < 0.0 || Double.isNaN(weight) || Double.isInfinite(weight)) {
        throw new ConfigException(name, pair, "Weight must be a finite non-negative number.");
      }
      if (weights.put(metric, weight) != null) {
        throw new ConfigException(name, pair, "Metric " + metric + " has more than one weight.");
      }
    }
    return weights;
  }
}
