/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static com.linkedin.fleetlens.FleetLensUtils.ensureValidString;
import static com.linkedin.fleetlens.FleetLensUtils.utcDateFor;
import static com.linkedin.fleetlens.common.utils.Utils.validateNotNull;


/**
 * The complete time series of one metric of one node, e.g. the cpu_usage of node-042 in cluster prod-us-east of
 * tenant acme-corp.
 * <p>
 * Timestamps are epoch milliseconds and are expected to be non-decreasing. The ordering is not enforced here; the
 * ingestion layer validates it before handing the series over.
 */
public final class MetricSeries {
  private final NodeEntity _node;
  private final String _metricName;
  private final long[] _timestamps;
  private final double[] _values;
  private final Map<String, String> _metadata;

  public MetricSeries(String tenantId, String clusterId, String nodeId, String metricName, long[] timestamps,
                      double[] values) {
    this(tenantId, clusterId, nodeId, metricName, timestamps, values, Collections.emptyMap());
  }

  /**
   * @param tenantId The tenant that owns the node.
   * @param clusterId The cluster of the node.
   * @param nodeId The node that reported the metric.
   * @param metricName The name of the metric, e.g. cpu_usage.
   * @param timestamps Observation times in epoch milliseconds.
   * @param values Observed values, one per timestamp.
   * @param metadata Additional tags for filtering and context.
   */
  public MetricSeries(String tenantId, String clusterId, String nodeId, String metricName, long[] timestamps,
                      double[] values, Map<String, String> metadata) {
    _node = new NodeEntity(tenantId, clusterId, nodeId);
    _metricName = ensureValidString("metricName", metricName);
    validateNotNull(timestamps, "Timestamps cannot be null.");
    validateNotNull(values, "Values cannot be null.");
    if (timestamps.length != values.length) {
      throw new IllegalArgumentException(String.format("Timestamp and value count mismatch: %d timestamps vs %d values",
                                                       timestamps.length, values.length));
    }
    if (timestamps.length == 0) {
      throw new IllegalArgumentException("Metric series must contain at least one data point.");
    }
    _timestamps = timestamps.clone();
    _values = values.clone();
    _metadata = metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(metadata));
  }

  public NodeEntity node() {
    return _node;
  }

  public String tenantId() {
    return _node.tenantId();
  }

  public String clusterId() {
    return _node.clusterId();
  }

  public String nodeId() {
    return _node.nodeId();
  }

  public String metricName() {
    return _metricName;
  }

  /**
   * @return Number of observations in this series.
   */
  public int length() {
    return _timestamps.length;
  }

  public long timestamp(int index) {
    return _timestamps[index];
  }

  public double value(int index) {
    return _values[index];
  }

  /**
   * @param fromIndex Start index, inclusive.
   * @param toIndex End index, exclusive.
   * @return A copy of the timestamps in the given index range.
   */
  public long[] timestamps(int fromIndex, int toIndex) {
    return Arrays.copyOfRange(_timestamps, fromIndex, toIndex);
  }

  /**
   * @param fromIndex Start index, inclusive.
   * @param toIndex End index, exclusive.
   * @return A copy of the values in the given index range.
   */
  public double[] values(int fromIndex, int toIndex) {
    return Arrays.copyOfRange(_values, fromIndex, toIndex);
  }

  /**
   * @return A copy of all values.
   */
  public double[] values() {
    return _values.clone();
  }

  public long startTimeMs() {
    return _timestamps[0];
  }

  public long endTimeMs() {
    return _timestamps[_timestamps.length - 1];
  }

  public Map<String, String> metadata() {
    return _metadata;
  }

  @Override
  public String toString() {
    return String.format("MetricSeries[%s/%s, points=%d, %s to %s]", _node, _metricName, length(),
                         utcDateFor(startTimeMs()), utcDateFor(endTimeMs()));
  }
}
