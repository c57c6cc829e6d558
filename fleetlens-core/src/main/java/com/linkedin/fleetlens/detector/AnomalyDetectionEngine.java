/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.detector;

import com.linkedin.fleetlens.common.FleetLensConfigurable;
import com.linkedin.fleetlens.exception.FleetLensException;
import com.linkedin.fleetlens.model.AnomalyResult;
import com.linkedin.fleetlens.model.MetricSeries;
import com.linkedin.fleetlens.window.TimeWindow;
import java.util.List;
import java.util.Map;


/**
 * An interface to plug in anomaly detection engines. An engine scores the windows of a metric series; labeling and
 * explaining the scored windows is left to the classifier.
 * <p>
 * Engines registered through {@link com.linkedin.fleetlens.config.FleetLensConfig#ANOMALY_DETECTION_ENGINES_CONFIG}
 * are instantiated by reflection and must have a public no-argument constructor.
 */
public interface AnomalyDetectionEngine extends FleetLensConfigurable {

  /**
   * Score each of the given windows of the series.
   *
   * @param series The analyzed series.
   * @param windows The windows of the series to score.
   * @return One anomaly result per window, in window order, with the anomaly score populated.
   * @throws FleetLensException If the engine fails to score the windows.
   */
  List<AnomalyResult> detect(MetricSeries series, List<TimeWindow> windows) throws FleetLensException;

  /**
   * Describe a result of a previous {@link #detect(MetricSeries, List)} call for display. By default this is the
   * explanation the classifier wrote to the result, which is empty until the result is classified.
   *
   * @param series The series the result was detected in.
   * @param result The result to explain.
   * @return A human readable explanation of the result.
   */
  default String explain(MetricSeries series, AnomalyResult result) {
    return result.explanation();
  }

  /**
   * @param series A series to analyze.
   * @return {@code true} if this engine can analyze the given series. By default any non-empty series is accepted.
   */
  default boolean validateInput(MetricSeries series) {
    return series != null && series.length() > 0;
  }

  /**
   * @return The name of this engine, the simple class name by default.
   */
  default String name() {
    return getClass().getSimpleName();
  }

  default String version() {
    return "1.0.0";
  }

  @Override
  default void configure(Map<String, ?> configs) {

  }
}
