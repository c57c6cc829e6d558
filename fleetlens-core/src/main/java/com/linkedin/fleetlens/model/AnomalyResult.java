/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static com.linkedin.fleetlens.FleetLensUtils.ensureUnitInterval;
import static com.linkedin.fleetlens.FleetLensUtils.ensureValidString;
import static com.linkedin.fleetlens.FleetLensUtils.utcDateFor;
import static com.linkedin.fleetlens.common.utils.Utils.validateNotNull;


/**
 * The anomaly verdict for one window of one metric series. The anomaly score is supplied by the detection engine;
 * the anomaly type and explanation are resolved by the classifier afterwards.
 * <p>
 * The identity of a result (tenant, cluster, node, metric) never changes once created. Anomaly scores are comparable
 * across metrics and nodes, which is what makes them rankable.
 */
public class AnomalyResult {
  private final NodeEntity _node;
  private final String _metricName;
  private final long _windowStartMs;
  private final long _windowEndMs;
  private final double _anomalyScore;
  private final Double _magnitude;
  private final long _detectionTimeMs;
  private final Map<String, Object> _engineMetadata;
  private AnomalyType _anomalyType;
  private String _explanation;

  public AnomalyResult(String tenantId,
                       String clusterId,
                       String nodeId,
                       String metricName,
                       long windowStartMs,
                       long windowEndMs,
                       double anomalyScore,
                       String anomalyLabel) {
    this(tenantId, clusterId, nodeId, metricName, windowStartMs, windowEndMs, anomalyScore, anomalyLabel, null,
         System.currentTimeMillis(), null);
  }

  /**
   * @param tenantId Tenant of the analyzed node.
   * @param clusterId Cluster of the analyzed node.
   * @param nodeId The analyzed node.
   * @param metricName The analyzed metric.
   * @param windowStartMs Start of the analyzed time range.
   * @param windowEndMs End of the analyzed time range.
   * @param anomalyScore Strength of the anomaly in [0, 1], 1 being the strongest.
   * @param anomalyLabel One of spike, trend, seasonal, normal.
   * @param magnitude Estimated severity in [0, 1], {@code null} if unknown.
   * @param detectionTimeMs When the verdict was computed.
   * @param engineMetadata Engine-specific metadata for debugging, {@code null} if none.
   */
  public AnomalyResult(String tenantId,
                       String clusterId,
                       String nodeId,
                       String metricName,
                       long windowStartMs,
                       long windowEndMs,
                       double anomalyScore,
                       String anomalyLabel,
                       Double magnitude,
                       long detectionTimeMs,
                       Map<String, Object> engineMetadata) {
    _node = new NodeEntity(tenantId, clusterId, nodeId);
    _metricName = ensureValidString("metricName", metricName);
    if (windowEndMs < windowStartMs) {
      throw new IllegalArgumentException(String.format("Window end %d is before window start %d.", windowEndMs,
                                                       windowStartMs));
    }
    _windowStartMs = windowStartMs;
    _windowEndMs = windowEndMs;
    _anomalyScore = ensureUnitInterval("anomalyScore", anomalyScore);
    _anomalyType = AnomalyType.forLabel(anomalyLabel);
    _magnitude = magnitude == null ? null : ensureUnitInterval("magnitude", magnitude);
    _detectionTimeMs = detectionTimeMs;
    _engineMetadata = engineMetadata == null ? Collections.emptyMap()
                                             : Collections.unmodifiableMap(new HashMap<>(engineMetadata));
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

  public long windowStartMs() {
    return _windowStartMs;
  }

  public long windowEndMs() {
    return _windowEndMs;
  }

  public double anomalyScore() {
    return _anomalyScore;
  }

  /**
   * @return Estimated severity in [0, 1], or {@code null} if the engine did not provide one.
   */
  public Double magnitude() {
    return _magnitude;
  }

  public long detectionTimeMs() {
    return _detectionTimeMs;
  }

  public Map<String, Object> engineMetadata() {
    return _engineMetadata;
  }

  public synchronized AnomalyType anomalyType() {
    return _anomalyType;
  }

  public String anomalyLabel() {
    return anomalyType().label();
  }

  /**
   * @return Human-readable explanation, or {@code null} if the result has not been classified.
   */
  public synchronized String explanation() {
    return _explanation;
  }

  /**
   * @return {@code true} if this result is marked as an actual anomaly, i.e. its type is not {@link AnomalyType#NORMAL}.
   */
  public boolean isAnomaly() {
    return anomalyType() != AnomalyType.NORMAL;
  }

  /**
   * Record the classification of this result.
   *
   * @param anomalyType The resolved anomaly type.
   * @param explanation The rendered explanation.
   */
  public synchronized void setClassification(AnomalyType anomalyType, String explanation) {
    _anomalyType = validateNotNull(anomalyType, "Anomaly type cannot be null.");
    _explanation = explanation;
  }

  @Override
  public String toString() {
    return String.format("AnomalyResult[%s/%s, %s to %s, score=%.3f, label=%s]", _node, _metricName,
                         utcDateFor(_windowStartMs), utcDateFor(_windowEndMs), _anomalyScore, anomalyLabel());
  }
}
