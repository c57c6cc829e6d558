/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.aggregator;

import com.linkedin.fleetlens.model.ClusterAnomalyScore;
import com.linkedin.fleetlens.model.ClusterEntity;
import com.linkedin.fleetlens.model.NodeAnomalyScore;
import java.util.List;


/**
 * Combines the node scores of a cluster into the score of the cluster. The anomaly count of the cluster is the sum of
 * the anomaly counts of its nodes.
 */
public class ClusterAnomalyAggregator
    extends AbstractAnomalyAggregator<NodeAnomalyScore, ClusterEntity, ClusterAnomalyScore> {

  public ClusterAnomalyAggregator(AggregationStrategy strategy) {
    super(strategy);
  }

  /**
   * Rank node scores for top-K views, e.g. the most anomalous nodes of a cluster.
   *
   * @param scores The node scores.
   * @param topN The number of nodes to keep, {@code null} or non-positive to keep all of them.
   * @return The node scores sorted by aggregate score, highest first. Ties keep their input order.
   */
  public List<NodeAnomalyScore> rankNodes(List<NodeAnomalyScore> scores, Integer topN) {
    return rank(scores, topN);
  }

  @Override
  protected String level() {
    return "cluster";
  }

  @Override
  protected ClusterEntity parentOf(NodeAnomalyScore input) {
    return input.entity().group();
  }

  @Override
  protected double combine(List<NodeAnomalyScore> inputs) {
    return combineUnweighted(inputs.stream().mapToDouble(NodeAnomalyScore::aggregateScore).toArray());
  }

  @Override
  protected int numAnomalies(List<NodeAnomalyScore> inputs) {
    return inputs.stream().mapToInt(NodeAnomalyScore::numAnomaliesDetected).sum();
  }

  @Override
  protected ClusterAnomalyScore newScore(ClusterEntity parent,
                                         double score,
                                         int numMetricsAnalyzed,
                                         int numAnomaliesDetected,
                                         long timestampMs) {
    return new ClusterAnomalyScore(parent, _strategy, score, numMetricsAnalyzed, numAnomaliesDetected, timestampMs);
  }
}
