/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.model;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.linkedin.fleetlens.aggregator.AggregationStrategy;
import com.linkedin.fleetlens.exception.OutOfRangeValueException;
import java.util.Map;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class AggregatedAnomalyScoreTest {

  @Test
  public void testJsonCarriesOnlyTheIdentityOfItsLevel() {
    NodeAnomalyScore node = new NodeAnomalyScore(new NodeEntity("t", "c", "n"), AggregationStrategy.P95, 0.5, 4, 1, 0L);
    JsonObject nodeJson = JsonParser.parseString(node.toJson()).getAsJsonObject();
    assertEquals("node", nodeJson.get("level").getAsString());
    assertEquals("n", nodeJson.get("nodeId").getAsString());
    assertEquals("c", nodeJson.get("clusterId").getAsString());
    assertEquals("p95", nodeJson.get("aggregationStrategy").getAsString());
    assertEquals("1970-01-01T00:00:00Z", nodeJson.get("timestamp").getAsString());

    ClusterAnomalyScore cluster =
        new ClusterAnomalyScore(new ClusterEntity("t", "c"), AggregationStrategy.MAX, 0.5, 4, 1, 0L);
    JsonObject clusterJson = JsonParser.parseString(cluster.toJson()).getAsJsonObject();
    assertTrue(clusterJson.has("clusterId"));
    assertFalse(clusterJson.has("nodeId"));

    TenantAnomalyScore tenant = new TenantAnomalyScore(new TenantEntity("t"), AggregationStrategy.MEAN, 0.5, 1, 0, 0L);
    Map<String, Object> tenantJson = tenant.getJsonStructure();
    assertFalse(tenantJson.containsKey("clusterId"));
    assertEquals("t", tenantJson.get("tenantId"));
  }

  @Test
  public void testInvalidScores() {
    assertThrows(OutOfRangeValueException.class,
                 () -> new TenantAnomalyScore(new TenantEntity("t"), AggregationStrategy.MAX, 1.01, 1, 0, 0L));
    assertThrows(IllegalArgumentException.class,
                 () -> new TenantAnomalyScore(new TenantEntity("t"), AggregationStrategy.MAX, 0.5, -1, 0, 0L));
  }

  @Test
  public void testExplanationJson() {
    AnomalyExplanation explanation =
        new AnomalyExplanation(AnomalyType.TREND, 10.0, 12.0, 20.0, 0.8, 0.75, "rising", Map.of("direction", "up"));
    Map<String, Object> json = explanation.getJsonStructure();
    assertEquals("trend", json.get("anomalyType"));
    assertEquals(Boolean.TRUE, json.get("critical"));
    assertEquals(Map.of("direction", "up"), json.get("context"));
    assertFalse(new AnomalyExplanation(AnomalyType.NORMAL).isCritical());
  }
}
