/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.aggregator;

import com.linkedin.fleetlens.common.config.ConfigException;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class AggregationFunctionsTest {
  private static final double DELTA = 1E-9;

  @Test
  public void testMaxAndMean() {
    assertEquals(0.8, AggregationFunctions.max(new double[]{0.8, 0.3}), DELTA);
    assertEquals(0.55, AggregationFunctions.mean(new double[]{0.8, 0.3}), DELTA);
  }

  @Test
  public void testPercentileInterpolates() {
    assertEquals(48.0, AggregationFunctions.percentile(new double[]{10, 20, 30, 40, 50}, 95), DELTA);
    assertEquals(48.0, AggregationFunctions.percentile(new double[]{50, 30, 10, 40, 20}, 95), DELTA);
    assertEquals(30.0, AggregationFunctions.percentile(new double[]{10, 20, 30, 40, 50}, 50), DELTA);
    assertEquals(7.0, AggregationFunctions.percentile(new double[]{7}, 95), DELTA);
    assertEquals(50.0, AggregationFunctions.percentile(new double[]{10, 20, 30, 40, 50}, 100), DELTA);
    assertEquals(10.0, AggregationFunctions.percentile(new double[]{30, 10, 50}, 0), DELTA);
    assertEquals(0.425, AggregationFunctions.percentile(new double[]{0.1, 0.2, 0.3, 0.4, 0.5, 0.6}, 65), DELTA);
  }

  @Test
  public void testPercentileIsMonotonic() {
    double[] scores = {0.1, 0.4, 0.2};
    double previous = AggregationFunctions.percentile(scores, 95);
    for (double added = 0.5; added <= 1.0; added += 0.1) {
      double[] larger = new double[scores.length + 1];
      System.arraycopy(scores, 0, larger, 0, scores.length);
      larger[scores.length] = added;
      double current = AggregationFunctions.percentile(larger, 95);
      assertTrue(current >= previous);
      scores = larger;
      previous = current;
    }
  }

  @Test
  public void testWeightedMean() {
    assertEquals(0.7, AggregationFunctions.weightedMean(new double[]{0.9, 0.5}, new double[]{1.0, 1.0}), DELTA);
    assertEquals(0.8, AggregationFunctions.weightedMean(new double[]{0.9, 0.5}, new double[]{3.0, 1.0}), DELTA);
    assertEquals(0.0, AggregationFunctions.weightedMean(new double[]{0.9, 0.5}, new double[]{0.0, 0.0}), DELTA);
    assertThrows(IllegalArgumentException.class,
                 () -> AggregationFunctions.weightedMean(new double[]{0.9}, new double[]{1.0, 1.0}));
  }

  @Test
  public void testEmptyInput() {
    assertThrows(IllegalArgumentException.class, () -> AggregationFunctions.max(new double[0]));
    assertThrows(IllegalArgumentException.class, () -> AggregationFunctions.percentile(new double[0], 95));
    assertThrows(IllegalArgumentException.class, () -> AggregationFunctions.percentile(new double[]{1}, 101));
  }

  @Test
  public void testStrategyNames() {
    for (AggregationStrategy strategy : AggregationStrategy.cachedValues()) {
      assertEquals(strategy, AggregationStrategy.forValue(strategy.value()));
    }
    assertThrows(ConfigException.class, () -> AggregationStrategy.forValue("median"));
  }
}
