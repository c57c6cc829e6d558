/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.model;

import com.linkedin.fleetlens.aggregator.AggregationStrategy;
import java.util.Map;


/**
 * The anomaly score of a cluster, combined from the node scores of the cluster.
 */
public final class ClusterAnomalyScore extends AggregatedAnomalyScore<ClusterEntity> {

  public ClusterAnomalyScore(ClusterEntity cluster,
                             AggregationStrategy strategy,
                             double aggregateScore,
                             int numMetricsAnalyzed,
                             int numAnomaliesDetected,
                             long timestampMs) {
    super(cluster, strategy, aggregateScore, numMetricsAnalyzed, numAnomaliesDetected, timestampMs);
  }

  @Override
  public String level() {
    return "cluster";
  }

  public String clusterId() {
    return entity().clusterId();
  }

  @Override
  protected void addIdentity(Map<String, Object> structure) {
    structure.put("clusterId", entity().clusterId());
  }
}
