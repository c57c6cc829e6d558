/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.aggregator;

import com.linkedin.fleetlens.model.ClusterAnomalyScore;
import com.linkedin.fleetlens.model.TenantAnomalyScore;
import com.linkedin.fleetlens.model.TenantEntity;
import java.util.List;


/**
 * Combines the cluster scores of a tenant into the score of the tenant.
 */
public class TenantAnomalyAggregator
    extends AbstractAnomalyAggregator<ClusterAnomalyScore, TenantEntity, TenantAnomalyScore> {

  public TenantAnomalyAggregator(AggregationStrategy strategy) {
    super(strategy);
  }

  /**
   * @param scores The cluster scores.
   * @param topN The number of clusters to keep, {@code null} or non-positive to keep all of them.
   * @return The cluster scores sorted by aggregate score, highest first. Ties keep their input order.
   */
  public List<ClusterAnomalyScore> rankClusters(List<ClusterAnomalyScore> scores, Integer topN) {
    return rank(scores, topN);
  }

  @Override
  protected String level() {
    return "tenant";
  }

  @Override
  protected TenantEntity parentOf(ClusterAnomalyScore input) {
    return input.entity().group();
  }

  @Override
  protected double combine(List<ClusterAnomalyScore> inputs) {
    return combineUnweighted(inputs.stream().mapToDouble(ClusterAnomalyScore::aggregateScore).toArray());
  }

  @Override
  protected int numAnomalies(List<ClusterAnomalyScore> inputs) {
    return inputs.stream().mapToInt(ClusterAnomalyScore::numAnomaliesDetected).sum();
  }

  @Override
  protected TenantAnomalyScore newScore(TenantEntity parent,
                                        double score,
                                        int numMetricsAnalyzed,
                                        int numAnomaliesDetected,
                                        long timestampMs) {
    return new TenantAnomalyScore(parent, _strategy, score, numMetricsAnalyzed, numAnomaliesDetected, timestampMs);
  }
}
