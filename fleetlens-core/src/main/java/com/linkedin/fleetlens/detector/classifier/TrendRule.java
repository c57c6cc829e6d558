/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.detector.classifier;

import com.linkedin.fleetlens.model.AnomalyType;
import java.util.Map;


/**
 * A window is a trend if the mean of its second half moves away from the mean of its first half by more than
 * {@code max(relativeThreshold * |firstHalfMean|, relativeThreshold)}. The first half holds the first
 * {@code floor(n / 2)} points, the second half the rest.
 */
public class TrendRule implements ClassificationRule {
  public static final double DEFAULT_RELATIVE_THRESHOLD = 0.05;
  public static final int DEFAULT_MIN_POINTS = 4;
  public static final String DIRECTION = "direction";
  public static final String UP = "up";
  public static final String DOWN = "down";
  private final double _relativeThreshold;
  private final int _minPoints;

  public TrendRule() {
    this(DEFAULT_RELATIVE_THRESHOLD, DEFAULT_MIN_POINTS);
  }

  public TrendRule(double relativeThreshold, int minPoints) {
    _relativeThreshold = relativeThreshold;
    // Both halves must hold at least one point.
    _minPoints = Math.max(2, minPoints);
  }

  @Override
  public AnomalyType anomalyType() {
    return AnomalyType.TREND;
  }

  @Override
  public RuleMatch evaluate(WindowStatistics stats) {
    int n = stats.size();
    if (n < _minPoints) {
      return null;
    }
    int mid = n / 2;
    double firstHalfMean = stats.mean(0, mid);
    double secondHalfMean = stats.mean(mid, n - mid);
    double diff = secondHalfMean - firstHalfMean;
    double threshold = Math.max(_relativeThreshold * Math.abs(firstHalfMean), _relativeThreshold);
    if (Math.abs(diff) > threshold) {
      return new RuleMatch(AnomalyType.TREND, Map.of(DIRECTION, diff > 0 ? UP : DOWN));
    }
    return null;
  }
}
