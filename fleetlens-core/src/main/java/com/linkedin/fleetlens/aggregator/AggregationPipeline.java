/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.aggregator;

import com.linkedin.fleetlens.common.FleetLensThreadFactory;
import com.linkedin.fleetlens.config.FleetLensConfig;
import com.linkedin.fleetlens.exception.IdentityMismatchException;
import com.linkedin.fleetlens.exception.InsufficientDataException;
import com.linkedin.fleetlens.model.AggregatedAnomalyScore;
import com.linkedin.fleetlens.model.AnomalyResult;
import com.linkedin.fleetlens.model.ClusterAnomalyScore;
import com.linkedin.fleetlens.model.ClusterEntity;
import com.linkedin.fleetlens.model.Entity;
import com.linkedin.fleetlens.model.NodeAnomalyScore;
import com.linkedin.fleetlens.model.NodeEntity;
import com.linkedin.fleetlens.model.TenantAnomalyScore;
import com.linkedin.fleetlens.model.TenantEntity;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.fleetlens.common.utils.Utils.validateNotNull;
import static com.linkedin.fleetlens.config.FleetLensConfig.AGGREGATION_NUM_THREADS_CONFIG;
import static com.linkedin.fleetlens.config.FleetLensConfig.CLUSTER_AGGREGATION_STRATEGY_CONFIG;
import static com.linkedin.fleetlens.config.FleetLensConfig.NODE_AGGREGATION_STRATEGY_CONFIG;
import static com.linkedin.fleetlens.config.FleetLensConfig.TENANT_AGGREGATION_STRATEGY_CONFIG;


/**
 * Rolls per-metric anomaly results up the fleet hierarchy: results are grouped by node and aggregated into node
 * scores, node scores are grouped by cluster and aggregated into cluster scores, and cluster scores are grouped by
 * tenant and aggregated into tenant scores.
 * <p>
 * The groups of a level are independent of each other. With more than one thread the groups of a level are
 * aggregated concurrently; the output is the same as with a single thread. The pipeline owns its thread pool, so
 * it should be closed when no longer used.
 */
public class AggregationPipeline implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(AggregationPipeline.class);
  private final NodeAnomalyAggregator _nodeAggregator;
  private final ClusterAnomalyAggregator _clusterAggregator;
  private final TenantAnomalyAggregator _tenantAggregator;
  private final ExecutorService _executor;

  /**
   * Create a single threaded pipeline.
   *
   * @param nodeAggregator The node level aggregator.
   * @param clusterAggregator The cluster level aggregator.
   * @param tenantAggregator The tenant level aggregator.
   */
  public AggregationPipeline(NodeAnomalyAggregator nodeAggregator,
                             ClusterAnomalyAggregator clusterAggregator,
                             TenantAnomalyAggregator tenantAggregator) {
    this(nodeAggregator, clusterAggregator, tenantAggregator, 1);
  }

  public AggregationPipeline(NodeAnomalyAggregator nodeAggregator,
                             ClusterAnomalyAggregator clusterAggregator,
                             TenantAnomalyAggregator tenantAggregator,
                             int numThreads) {
    _nodeAggregator = validateNotNull(nodeAggregator, "Node aggregator cannot be null.");
    _clusterAggregator = validateNotNull(clusterAggregator, "Cluster aggregator cannot be null.");
    _tenantAggregator = validateNotNull(tenantAggregator, "Tenant aggregator cannot be null.");
    if (numThreads < 1) {
      throw new IllegalArgumentException("The number of aggregation threads must be at least 1, got " + numThreads);
    }
    _executor = numThreads > 1
                ? Executors.newFixedThreadPool(numThreads, new FleetLensThreadFactory("AnomalyAggregator", true))
                : null;
  }

  /**
   * @param config The FleetLens config.
   * @return A pipeline with the strategies, metric weights and thread count of the given config.
   */
  public static AggregationPipeline fromConfig(FleetLensConfig config) {
    return new AggregationPipeline(
        new NodeAnomalyAggregator(config.aggregationStrategy(NODE_AGGREGATION_STRATEGY_CONFIG), config.metricWeights()),
        new ClusterAnomalyAggregator(config.aggregationStrategy(CLUSTER_AGGREGATION_STRATEGY_CONFIG)),
        new TenantAnomalyAggregator(config.aggregationStrategy(TENANT_AGGREGATION_STRATEGY_CONFIG)),
        config.getInt(AGGREGATION_NUM_THREADS_CONFIG));
  }

  /**
   * @param results Per-metric anomaly results of any number of nodes, must not be empty.
   * @return The node scores, in the order the nodes first appear in the results.
   */
  public Map<NodeEntity, NodeAnomalyScore> aggregateNodes(List<AnomalyResult> results)
      throws InsufficientDataException, IdentityMismatchException {
    return aggregateNodes(results, System.currentTimeMillis());
  }

  public Map<NodeEntity, NodeAnomalyScore> aggregateNodes(List<AnomalyResult> results, long timestampMs)
      throws InsufficientDataException, IdentityMismatchException {
    return aggregateByKey(results, AnomalyResult::node, _nodeAggregator, timestampMs);
  }

  /**
   * @param nodeScores Node scores of any number of clusters, must not be empty.
   * @return The cluster scores, in the order the clusters first appear in the node scores.
   */
  public Map<ClusterEntity, ClusterAnomalyScore> aggregateClusters(List<NodeAnomalyScore> nodeScores)
      throws InsufficientDataException, IdentityMismatchException {
    return aggregateClusters(nodeScores, System.currentTimeMillis());
  }

  public Map<ClusterEntity, ClusterAnomalyScore> aggregateClusters(List<NodeAnomalyScore> nodeScores, long timestampMs)
      throws InsufficientDataException, IdentityMismatchException {
    return aggregateByKey(nodeScores, score -> score.entity().group(), _clusterAggregator, timestampMs);
  }

  /**
   * @param clusterScores Cluster scores of any number of tenants, must not be empty.
   * @return The tenant scores, in the order the tenants first appear in the cluster scores.
   */
  public Map<TenantEntity, TenantAnomalyScore> aggregateTenants(List<ClusterAnomalyScore> clusterScores)
      throws InsufficientDataException, IdentityMismatchException {
    return aggregateTenants(clusterScores, System.currentTimeMillis());
  }

  public Map<TenantEntity, TenantAnomalyScore> aggregateTenants(List<ClusterAnomalyScore> clusterScores,
                                                                long timestampMs)
      throws InsufficientDataException, IdentityMismatchException {
    return aggregateByKey(clusterScores, score -> score.entity().group(), _tenantAggregator, timestampMs);
  }

  /**
   * Aggregate the given results through all the levels of the hierarchy, stamping every score with the current time.
   *
   * @param results Per-metric anomaly results, must not be empty.
   * @return The scores of every level.
   */
  public HierarchicalAnomalyScores aggregate(List<AnomalyResult> results)
      throws InsufficientDataException, IdentityMismatchException {
    return aggregate(results, System.currentTimeMillis());
  }

  /**
   * Aggregate the given results through all the levels of the hierarchy.
   *
   * @param results Per-metric anomaly results, must not be empty.
   * @param timestampMs The time every score is stamped with, in epoch milliseconds.
   * @return The scores of every level.
   */
  public HierarchicalAnomalyScores aggregate(List<AnomalyResult> results, long timestampMs)
      throws InsufficientDataException, IdentityMismatchException {
    Map<NodeEntity, NodeAnomalyScore> nodeScores = aggregateNodes(results, timestampMs);
    Map<ClusterEntity, ClusterAnomalyScore> clusterScores =
        aggregateClusters(new ArrayList<>(nodeScores.values()), timestampMs);
    Map<TenantEntity, TenantAnomalyScore> tenantScores =
        aggregateTenants(new ArrayList<>(clusterScores.values()), timestampMs);
    LOG.debug("Aggregated {} anomaly results into {} node, {} cluster and {} tenant scores.", results.size(),
              nodeScores.size(), clusterScores.size(), tenantScores.size());
    return new HierarchicalAnomalyScores(nodeScores, clusterScores, tenantScores);
  }

  private <I, E extends Entity<?>, S extends AggregatedAnomalyScore<E>> Map<E, S> aggregateByKey(
      List<I> inputs,
      Function<I, E> keyFunction,
      AbstractAnomalyAggregator<I, E, S> aggregator,
      long timestampMs) throws InsufficientDataException, IdentityMismatchException {
    if (inputs == null || inputs.isEmpty()) {
      throw new InsufficientDataException(String.format("Cannot aggregate %s scores without any input.",
                                                        aggregator.level()));
    }
    Map<E, List<I>> groups = new LinkedHashMap<>();
    for (I input : inputs) {
      groups.computeIfAbsent(keyFunction.apply(input), k -> new ArrayList<>()).add(input);
    }
    Map<E, S> scores = new LinkedHashMap<>();
    if (_executor == null) {
      for (Map.Entry<E, List<I>> entry : groups.entrySet()) {
        scores.put(entry.getKey(), aggregator.aggregate(entry.getValue(), timestampMs));
      }
      return scores;
    }

    Map<E, Future<S>> futures = new LinkedHashMap<>();
    for (Map.Entry<E, List<I>> entry : groups.entrySet()) {
      List<I> group = entry.getValue();
      futures.put(entry.getKey(), _executor.submit(() -> aggregator.aggregate(group, timestampMs)));
    }
    try {
      for (Map.Entry<E, Future<S>> entry : futures.entrySet()) {
        scores.put(entry.getKey(), entry.getValue().get());
      }
    } catch (InterruptedException e) {
      futures.values().forEach(future -> future.cancel(true));
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while aggregating anomaly scores.", e);
    } catch (ExecutionException e) {
      futures.values().forEach(future -> future.cancel(true));
      Throwable cause = e.getCause();
      if (cause instanceof InsufficientDataException) {
        throw (InsufficientDataException) cause;
      } else if (cause instanceof IdentityMismatchException) {
        throw (IdentityMismatchException) cause;
      } else if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new IllegalStateException("Failed to aggregate anomaly scores.", cause);
    }
    return scores;
  }

  @Override
  public void close() {
    if (_executor != null) {
      _executor.shutdownNow();
    }
  }
}
