/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.aggregator;

import com.linkedin.fleetlens.model.AnomalyResult;
import com.linkedin.fleetlens.model.NodeAnomalyScore;
import com.linkedin.fleetlens.model.NodeEntity;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * Combines the per-metric anomaly results of a node into the score of the node. With the
 * {@link AggregationStrategy#WEIGHTED} strategy each result is weighted by the weight of its metric, metrics without
 * a configured weight count with {@link #DEFAULT_METRIC_WEIGHT}.
 */
public class NodeAnomalyAggregator extends AbstractAnomalyAggregator<AnomalyResult, NodeEntity, NodeAnomalyScore> {
  public static final double DEFAULT_METRIC_WEIGHT = 1.0;
  private final Map<String, Double> _metricWeights;

  public NodeAnomalyAggregator(AggregationStrategy strategy) {
    this(strategy, null);
  }

  /**
   * @param strategy The aggregation strategy.
   * @param metricWeights Metric name to weight map used by the weighted strategy, {@code null} for no weights.
   */
  public NodeAnomalyAggregator(AggregationStrategy strategy, Map<String, Double> metricWeights) {
    super(strategy);
    if (metricWeights == null) {
      _metricWeights = Collections.emptyMap();
    } else {
      metricWeights.forEach((metric, weight) -> {
        if (weight == null || weight < 0.0 || Double.isNaN(weight)) {
          throw new IllegalArgumentException(String.format("Invalid weight %s for metric %s.", weight, metric));
        }
      });
      _metricWeights = Collections.unmodifiableMap(new LinkedHashMap<>(metricWeights));
    }
  }

  public Map<String, Double> metricWeights() {
    return _metricWeights;
  }

  @Override
  protected String level() {
    return "node";
  }

  @Override
  protected NodeEntity parentOf(AnomalyResult input) {
    return input.node();
  }

  @Override
  protected double combine(List<AnomalyResult> inputs) {
    double[] scores = new double[inputs.size()];
    for (int i = 0; i < scores.length; i++) {
      scores[i] = inputs.get(i).anomalyScore();
    }
    if (_strategy != AggregationStrategy.WEIGHTED) {
      return combineUnweighted(scores);
    }
    double[] weights = new double[inputs.size()];
    for (int i = 0; i < weights.length; i++) {
      weights[i] = _metricWeights.getOrDefault(inputs.get(i).metricName(), DEFAULT_METRIC_WEIGHT);
    }
    return AggregationFunctions.weightedMean(scores, weights);
  }

  @Override
  protected int numAnomalies(List<AnomalyResult> inputs) {
    int numAnomalies = 0;
    for (AnomalyResult result : inputs) {
      if (result.isAnomaly()) {
        numAnomalies++;
      }
    }
    return numAnomalies;
  }

  @Override
  protected NodeAnomalyScore newScore(NodeEntity parent,
                                      double score,
                                      int numMetricsAnalyzed,
                                      int numAnomaliesDetected,
                                      long timestampMs) {
    return new NodeAnomalyScore(parent, _strategy, score, numMetricsAnalyzed, numAnomaliesDetected, timestampMs);
  }
}
