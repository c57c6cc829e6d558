/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.detector.classifier;

import com.linkedin.fleetlens.model.AnomalyType;
import java.util.Map;


/**
 * A window is a spike if the value farthest from the window mean has a z-score above the threshold, i.e.
 * {@code |observed - baseline| / stdev > zScoreThreshold}. Windows with too few points or zero variance are
 * never spikes.
 */
public class SpikeRule implements ClassificationRule {
  public static final double DEFAULT_Z_SCORE_THRESHOLD = 2.0;
  public static final int DEFAULT_MIN_POINTS = 3;
  public static final String Z_SCORE = "z_score";
  private final double _zScoreThreshold;
  private final int _minPoints;

  public SpikeRule() {
    this(DEFAULT_Z_SCORE_THRESHOLD, DEFAULT_MIN_POINTS);
  }

  public SpikeRule(double zScoreThreshold, int minPoints) {
    _zScoreThreshold = zScoreThreshold;
    _minPoints = minPoints;
  }

  @Override
  public AnomalyType anomalyType() {
    return AnomalyType.SPIKE;
  }

  @Override
  public RuleMatch evaluate(WindowStatistics stats) {
    if (stats.size() < _minPoints || stats.standardDeviation() == 0.0) {
      return null;
    }
    double zScore = Math.abs(stats.observed() - stats.baseline()) / stats.standardDeviation();
    return zScore > _zScoreThreshold ? new RuleMatch(AnomalyType.SPIKE, Map.of(Z_SCORE, zScore)) : null;
  }
}
