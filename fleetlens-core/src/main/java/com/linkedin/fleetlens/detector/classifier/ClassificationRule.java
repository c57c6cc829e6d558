/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.detector.classifier;

import com.linkedin.fleetlens.model.AnomalyType;


/**
 * A statistical test that recognizes one anomaly type in a window already flagged as anomalous. Rules are stateless
 * and evaluated in a fixed precedence order by {@link AnomalyClassifier}.
 */
public interface ClassificationRule {

  /**
   * @return The anomaly type this rule recognizes.
   */
  AnomalyType anomalyType();

  /**
   * @param stats Statistics of the window values.
   * @return The match if the window shows this rule's anomaly type, {@code null} otherwise.
   */
  RuleMatch evaluate(WindowStatistics stats);
}
