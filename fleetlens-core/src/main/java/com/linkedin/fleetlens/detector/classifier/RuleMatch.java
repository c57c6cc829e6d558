/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.detector.classifier;

import com.linkedin.fleetlens.model.AnomalyType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.linkedin.fleetlens.common.utils.Utils.validateNotNull;


/**
 * The outcome of a classification rule that fired: the anomaly type and the evidence that made it fire.
 */
public final class RuleMatch {
  private final AnomalyType _anomalyType;
  private final Map<String, Object> _context;

  public RuleMatch(AnomalyType anomalyType, Map<String, Object> context) {
    _anomalyType = validateNotNull(anomalyType, "Anomaly type cannot be null.");
    _context = context == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public AnomalyType anomalyType() {
    return _anomalyType;
  }

  public Map<String, Object> context() {
    return _context;
  }

  @Override
  public String toString() {
    return _anomalyType + _context.toString();
  }
}
