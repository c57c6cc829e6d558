/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.model;

import com.linkedin.fleetlens.aggregator.AggregationStrategy;
import java.util.Map;


/**
 * The anomaly score of a tenant, combined from the cluster scores of the tenant.
 */
public final class TenantAnomalyScore extends AggregatedAnomalyScore<TenantEntity> {

  public TenantAnomalyScore(TenantEntity tenant,
                            AggregationStrategy strategy,
                            double aggregateScore,
                            int numMetricsAnalyzed,
                            int numAnomaliesDetected,
                            long timestampMs) {
    super(tenant, strategy, aggregateScore, numMetricsAnalyzed, numAnomaliesDetected, timestampMs);
  }

  @Override
  public String level() {
    return "tenant";
  }

  @Override
  protected void addIdentity(Map<String, Object> structure) {
    // Tenant is the top level.
  }
}
