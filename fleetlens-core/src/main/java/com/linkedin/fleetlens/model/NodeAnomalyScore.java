/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.model;

import com.linkedin.fleetlens.aggregator.AggregationStrategy;
import java.util.Map;


/**
 * The anomaly score of a node, combined from the per-metric anomaly results of the node.
 */
public final class NodeAnomalyScore extends AggregatedAnomalyScore<NodeEntity> {

  public NodeAnomalyScore(NodeEntity node,
                          AggregationStrategy strategy,
                          double aggregateScore,
                          int numMetricsAnalyzed,
                          int numAnomaliesDetected,
                          long timestampMs) {
    super(node, strategy, aggregateScore, numMetricsAnalyzed, numAnomaliesDetected, timestampMs);
  }

  @Override
  public String level() {
    return "node";
  }

  public String clusterId() {
    return entity().clusterId();
  }

  public String nodeId() {
    return entity().nodeId();
  }

  @Override
  protected void addIdentity(Map<String, Object> structure) {
    structure.put("clusterId", entity().clusterId());
    structure.put("nodeId", entity().nodeId());
  }
}
