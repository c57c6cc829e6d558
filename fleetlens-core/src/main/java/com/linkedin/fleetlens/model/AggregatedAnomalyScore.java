/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.model;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.linkedin.fleetlens.aggregator.AggregationStrategy;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.linkedin.fleetlens.FleetLensUtils.ensureUnitInterval;
import static com.linkedin.fleetlens.FleetLensUtils.utcDateFor;
import static com.linkedin.fleetlens.common.utils.Utils.validateNotNull;


/**
 * The anomaly score of one entity of the fleet hierarchy, combined from the scores one level below it. Each
 * hierarchy level has its own subclass, so the identity fields that exist at a level are always present.
 *
 * @param <E> The entity the score is aggregated for.
 */
public abstract class AggregatedAnomalyScore<E extends Entity<?>> {
  private static final Gson GSON = new GsonBuilder().serializeNulls().create();
  private final E _entity;
  private final AggregationStrategy _strategy;
  private final double _aggregateScore;
  private final int _numMetricsAnalyzed;
  private final int _numAnomaliesDetected;
  private final long _timestampMs;

  protected AggregatedAnomalyScore(E entity,
                                   AggregationStrategy strategy,
                                   double aggregateScore,
                                   int numMetricsAnalyzed,
                                   int numAnomaliesDetected,
                                   long timestampMs) {
    _entity = validateNotNull(entity, "Entity cannot be null.");
    _strategy = validateNotNull(strategy, "Aggregation strategy cannot be null.");
    _aggregateScore = ensureUnitInterval("aggregateScore", aggregateScore);
    if (numMetricsAnalyzed < 0 || numAnomaliesDetected < 0) {
      throw new IllegalArgumentException(String.format("Counts cannot be negative (metrics analyzed: %d, anomalies "
                                                       + "detected: %d).", numMetricsAnalyzed, numAnomaliesDetected));
    }
    _numMetricsAnalyzed = numMetricsAnalyzed;
    _numAnomaliesDetected = numAnomaliesDetected;
    _timestampMs = timestampMs;
  }

  /**
   * @return The hierarchy level of this score: node, cluster or tenant.
   */
  public abstract String level();

  public E entity() {
    return _entity;
  }

  public String tenantId() {
    return _entity.tenantId();
  }

  public AggregationStrategy strategy() {
    return _strategy;
  }

  public double aggregateScore() {
    return _aggregateScore;
  }

  /**
   * @return The number of direct inputs that were combined into this score.
   */
  public int numMetricsAnalyzed() {
    return _numMetricsAnalyzed;
  }

  public int numAnomaliesDetected() {
    return _numAnomaliesDetected;
  }

  public long timestampMs() {
    return _timestampMs;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> structure = new LinkedHashMap<>();
    structure.put("level", level());
    structure.put("tenantId", tenantId());
    addIdentity(structure);
    structure.put("aggregationStrategy", _strategy.value());
    structure.put("aggregateScore", _aggregateScore);
    structure.put("numMetricsAnalyzed", _numMetricsAnalyzed);
    structure.put("numAnomaliesDetected", _numAnomaliesDetected);
    structure.put("timestamp", utcDateFor(_timestampMs));
    return structure;
  }

  /**
   * Add the identity fields below the tenant level to the given JSON structure.
   *
   * @param structure The JSON structure to populate.
   */
  protected abstract void addIdentity(Map<String, Object> structure);

  /**
   * @return The JSON encoding of {@link #getJsonStructure()}.
   */
  public String toJson() {
    return GSON.toJson(getJsonStructure());
  }

  @Override
  public String toString() {
    return String.format("%s[%s, %s=%.3f, metrics=%d, anomalies=%d]", getClass().getSimpleName(), _entity,
                         _strategy.value(), _aggregateScore, _numMetricsAnalyzed, _numAnomaliesDetected);
  }
}
