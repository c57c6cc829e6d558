/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.detector.classifier;

import com.linkedin.fleetlens.model.AnomalyType;
import java.util.Map;


/**
 * A window is seasonal if consecutive values cross the window mean often enough to look cyclic. A crossing is a
 * strict sign change of {@code value - mean} between two consecutive points; points exactly on the mean do not count.
 */
public class SeasonalRule implements ClassificationRule {
  public static final int DEFAULT_MIN_POINTS = 6;
  public static final int DEFAULT_MIN_MEAN_CROSSINGS = 3;
  public static final String MEAN_CROSSINGS = "mean_crossings";
  private final int _minPoints;
  private final int _minMeanCrossings;

  public SeasonalRule() {
    this(DEFAULT_MIN_POINTS, DEFAULT_MIN_MEAN_CROSSINGS);
  }

  public SeasonalRule(int minPoints, int minMeanCrossings) {
    _minPoints = minPoints;
    _minMeanCrossings = minMeanCrossings;
  }

  @Override
  public AnomalyType anomalyType() {
    return AnomalyType.SEASONAL;
  }

  @Override
  public RuleMatch evaluate(WindowStatistics stats) {
    if (stats.size() < _minPoints) {
      return null;
    }
    int crossings = meanCrossings(stats);
    return crossings >= _minMeanCrossings ? new RuleMatch(AnomalyType.SEASONAL, Map.of(MEAN_CROSSINGS, crossings)) : null;
  }

  static int meanCrossings(WindowStatistics stats) {
    double mean = stats.baseline();
    int crossings = 0;
    for (int i = 1; i < stats.size(); i++) {
      if ((stats.value(i - 1) - mean) * (stats.value(i) - mean) < 0) {
        crossings++;
      }
    }
    return crossings;
  }
}
