/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.linkedin.fleetlens.common.utils.Utils.validateNotNull;


/**
 * Why a window looks the way it does: its anomaly type, the statistics backing the verdict and a human-readable
 * description. Produced per classification call.
 */
public final class AnomalyExplanation {
  public static final double CRITICAL_SEVERITY_THRESHOLD = 0.7;
  public static final double CRITICAL_CONFIDENCE_THRESHOLD = 0.6;
  private static final double DEFAULT_CONFIDENCE = 0.5;

  private final AnomalyType _anomalyType;
  private final Double _baselineValue;
  private final Double _observedValue;
  private final Double _deviationPercent;
  private final double _confidence;
  private final double _severity;
  private final String _description;
  private final Map<String, Object> _additionalContext;

  /**
   * An explanation without statistics, used when there is nothing to analyze.
   *
   * @param anomalyType The anomaly type.
   */
  public AnomalyExplanation(AnomalyType anomalyType) {
    this(anomalyType, null, null, null, DEFAULT_CONFIDENCE, DEFAULT_CONFIDENCE, "", null);
  }

  /**
   * @param anomalyType The resolved anomaly type.
   * @param baselineValue The window mean.
   * @param observedValue The value that deviates most from the baseline.
   * @param deviationPercent Relative deviation of the observed value from the baseline, in percent.
   * @param confidence Confidence in the verdict, the upstream anomaly score.
   * @param severity Severity of the anomaly, the upstream magnitude if known.
   * @param description Human-readable description.
   * @param additionalContext Rule specific context, e.g. the direction of a trend.
   */
  public AnomalyExplanation(AnomalyType anomalyType,
                            Double baselineValue,
                            Double observedValue,
                            Double deviationPercent,
                            double confidence,
                            double severity,
                            String description,
                            Map<String, Object> additionalContext) {
    _anomalyType = validateNotNull(anomalyType, "Anomaly type cannot be null.");
    _baselineValue = baselineValue;
    _observedValue = observedValue;
    _deviationPercent = deviationPercent;
    _confidence = confidence;
    _severity = severity;
    _description = description == null ? "" : description;
    _additionalContext = additionalContext == null ? Collections.emptyMap()
                                                   : Collections.unmodifiableMap(new LinkedHashMap<>(additionalContext));
  }

  /**
   * @param description The rendered description.
   * @return A copy of this explanation with the given description.
   */
  public AnomalyExplanation withDescription(String description) {
    return new AnomalyExplanation(_anomalyType, _baselineValue, _observedValue, _deviationPercent, _confidence,
                                  _severity, description, _additionalContext);
  }

  public AnomalyType anomalyType() {
    return _anomalyType;
  }

  public Double baselineValue() {
    return _baselineValue;
  }

  public Double observedValue() {
    return _observedValue;
  }

  public Double deviationPercent() {
    return _deviationPercent;
  }

  public double confidence() {
    return _confidence;
  }

  public double severity() {
    return _severity;
  }

  public String description() {
    return _description;
  }

  public Map<String, Object> additionalContext() {
    return _additionalContext;
  }

  /**
   * @return {@code true} if the anomaly is both severe and confidently detected.
   */
  public boolean isCritical() {
    return _severity >= CRITICAL_SEVERITY_THRESHOLD && _confidence >= CRITICAL_CONFIDENCE_THRESHOLD;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> structure = new LinkedHashMap<>();
    structure.put("anomalyType", _anomalyType.label());
    structure.put("baselineValue", _baselineValue);
    structure.put("observedValue", _observedValue);
    structure.put("deviationPercent", _deviationPercent);
    structure.put("confidence", _confidence);
    structure.put("severity", _severity);
    structure.put("critical", isCritical());
    structure.put("description", _description);
    if (!_additionalContext.isEmpty()) {
      structure.put("context", _additionalContext);
    }
    return structure;
  }

  @Override
  public String toString() {
    return String.format("AnomalyExplanation[%s, baseline=%s, observed=%s, deviation=%s%%, confidence=%.2f, severity=%.2f]",
                         _anomalyType, _baselineValue, _observedValue, _deviationPercent, _confidence, _severity);
  }
}
