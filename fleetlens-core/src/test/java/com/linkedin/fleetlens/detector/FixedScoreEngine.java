/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.detector;

import com.linkedin.fleetlens.model.AnomalyResult;
import com.linkedin.fleetlens.model.MetricSeries;
import com.linkedin.fleetlens.window.TimeWindow;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;


/**
 * A test engine that scores every window with the same configured score, and rejects series shorter than the
 * configured minimum length.
 */
public class FixedScoreEngine implements AnomalyDetectionEngine {
  public static final String SCORE_CONFIG = "fixed.score.engine.score";
  public static final String MIN_LENGTH_CONFIG = "fixed.score.engine.min.length";
  private double _score = 0.9;
  private int _minLength = 1;

  public FixedScoreEngine() {

  }

  public FixedScoreEngine(double score) {
    _score = score;
  }

  @Override
  public void configure(Map<String, ?> configs) {
    Object score = configs.get(SCORE_CONFIG);
    if (score != null) {
      _score = Double.parseDouble(score.toString());
    }
    Object minLength = configs.get(MIN_LENGTH_CONFIG);
    if (minLength != null) {
      _minLength = Integer.parseInt(minLength.toString());
    }
  }

  @Override
  public List<AnomalyResult> detect(MetricSeries series, List<TimeWindow> windows) {
    List<AnomalyResult> results = new ArrayList<>(windows.size());
    for (TimeWindow window : windows) {
      results.add(new AnomalyResult(series.tenantId(), series.clusterId(), series.nodeId(), series.metricName(),
                                    window.startTimeMs(), window.endTimeMs(), _score, "normal"));
    }
    return results;
  }

  @Override
  public String explain(MetricSeries series, AnomalyResult result) {
    return String.format(Locale.ROOT, "%s scored %.2f in %s: %s", name(), result.anomalyScore(), series.metricName(),
                         result.explanation());
  }

  @Override
  public boolean validateInput(MetricSeries series) {
    return series.length() >= _minLength;
  }

  @Override
  public String name() {
    return "fixed";
  }

  public double score() {
    return _score;
  }
}
