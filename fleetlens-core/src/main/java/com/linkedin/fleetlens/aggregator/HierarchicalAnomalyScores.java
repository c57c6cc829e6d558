/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.aggregator;

import com.linkedin.fleetlens.model.ClusterAnomalyScore;
import com.linkedin.fleetlens.model.ClusterEntity;
import com.linkedin.fleetlens.model.NodeAnomalyScore;
import com.linkedin.fleetlens.model.NodeEntity;
import com.linkedin.fleetlens.model.TenantAnomalyScore;
import com.linkedin.fleetlens.model.TenantEntity;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * The scores of all hierarchy levels computed from one list of anomaly results. Each map is in the order the entities
 * were first encountered in the results.
 */
public final class HierarchicalAnomalyScores {
  private final Map<NodeEntity, NodeAnomalyScore> _nodeScores;
  private final Map<ClusterEntity, ClusterAnomalyScore> _clusterScores;
  private final Map<TenantEntity, TenantAnomalyScore> _tenantScores;

  HierarchicalAnomalyScores(Map<NodeEntity, NodeAnomalyScore> nodeScores,
                            Map<ClusterEntity, ClusterAnomalyScore> clusterScores,
                            Map<TenantEntity, TenantAnomalyScore> tenantScores) {
    _nodeScores = Collections.unmodifiableMap(new LinkedHashMap<>(nodeScores));
    _clusterScores = Collections.unmodifiableMap(new LinkedHashMap<>(clusterScores));
    _tenantScores = Collections.unmodifiableMap(new LinkedHashMap<>(tenantScores));
  }

  public Map<NodeEntity, NodeAnomalyScore> nodeScores() {
    return _nodeScores;
  }

  public Map<ClusterEntity, ClusterAnomalyScore> clusterScores() {
    return _clusterScores;
  }

  public Map<TenantEntity, TenantAnomalyScore> tenantScores() {
    return _tenantScores;
  }

  /**
   * @param cluster A cluster.
   * @param topN The number of nodes to return, {@code null} or non-positive for all of them.
   * @return The most anomalous nodes of the given cluster, highest score first.
   */
  public List<NodeAnomalyScore> topNodes(ClusterEntity cluster, Integer topN) {
    List<NodeAnomalyScore> scores = new ArrayList<>();
    for (NodeAnomalyScore score : _nodeScores.values()) {
      if (score.entity().group().equals(cluster)) {
        scores.add(score);
      }
    }
    return AbstractAnomalyAggregator.rank(scores, topN);
  }

  /**
   * @param tenant A tenant.
   * @param topN The number of clusters to return, {@code null} or non-positive for all of them.
   * @return The most anomalous clusters of the given tenant, highest score first.
   */
  public List<ClusterAnomalyScore> topClusters(TenantEntity tenant, Integer topN) {
    List<ClusterAnomalyScore> scores = new ArrayList<>();
    for (ClusterAnomalyScore score : _clusterScores.values()) {
      if (score.entity().group().equals(tenant)) {
        scores.add(score);
      }
    }
    return AbstractAnomalyAggregator.rank(scores, topN);
  }
}
