/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.aggregator;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;


/**
 * The functions behind the aggregation strategies. All of them require a non-empty array of scores.
 */
public final class AggregationFunctions {
  public static final double P95 = 95.0;

  private AggregationFunctions() {

  }

  public static double max(double[] scores) {
    ensureNotEmpty(scores);
    return StatUtils.max(scores);
  }

  public static double mean(double[] scores) {
    ensureNotEmpty(scores);
    return StatUtils.mean(scores);
  }

  /**
   * @param scores The scores.
   * @param weights The weight of each score, same length as the scores.
   * @return The weighted mean of the scores, 0 if the weights add up to 0.
   */
  public static double weightedMean(double[] scores, double[] weights) {
    ensureNotEmpty(scores);
    if (weights.length != scores.length) {
      throw new IllegalArgumentException(String.format("Got %d weights for %d scores.", weights.length, scores.length));
    }
    double weightedSum = 0.0;
    double totalWeight = 0.0;
    for (int i = 0; i < scores.length; i++) {
      weightedSum += scores[i] * weights[i];
      totalWeight += weights[i];
    }
    return totalWeight == 0.0 ? 0.0 : weightedSum / totalWeight;
  }

  /**
   * The percentile of the scores, interpolating linearly between the two closest ranks (estimation type R-7). The
   * 0th percentile is the minimum.
   *
   * @param scores The scores, in any order.
   * @param percentile The percentile in [0, 100].
   * @return The percentile of the scores.
   */
  public static double percentile(double[] scores, double percentile) {
    ensureNotEmpty(scores);
    if (percentile < 0.0 || percentile > 100.0 || Double.isNaN(percentile)) {
      throw new IllegalArgumentException("Percentile " + percentile + " is not in [0, 100].");
    }
    // Percentile only accepts (0, 100].
    if (percentile == 0.0) {
      return StatUtils.min(scores);
    }
    return new Percentile().withEstimationType(Percentile.EstimationType.R_7).evaluate(scores, percentile);
  }

  private static void ensureNotEmpty(double[] scores) {
    if (scores == null || scores.length == 0) {
      throw new IllegalArgumentException("Cannot aggregate an empty list of scores.");
    }
  }
}
