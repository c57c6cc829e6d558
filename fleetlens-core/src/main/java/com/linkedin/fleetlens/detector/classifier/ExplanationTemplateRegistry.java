/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.detector.classifier;

import com.linkedin.fleetlens.model.AnomalyType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static com.linkedin.fleetlens.common.utils.Utils.validateNotNull;


/**
 * The explanation templates by anomaly type. A registry is immutable once built, so a single instance can be shared
 * by concurrent classifications. Custom templates are registered through {@link Builder} before the registry is
 * handed to a classifier.
 */
public final class ExplanationTemplateRegistry {
  static final String SPIKE_TEMPLATE = "Spike detected: value jumped to {{observed}} ({{deviation_percent}}% deviation "
                                       + "from baseline {{baseline}}). This represents a sudden, temporary abnormality.";
  static final String TREND_TEMPLATE = "Trend detected: metric shows sustained directional change ({{direction}}). "
                                       + "Current peak {{observed}} deviates {{deviation_percent}}% from expected "
                                       + "{{baseline}}.";
  static final String SEASONAL_TEMPLATE = "Seasonal anomaly: cycle deviation detected. Value {{observed}} breaks "
                                          + "expected pattern (baseline {{baseline}}, {{deviation_percent}}% off).";
  static final String NORMAL_TEMPLATE = "No anomaly detected. Value {{observed}} is within normal range.";
  static final String GENERIC_TEMPLATE = "Anomaly detected.";
  private static final ExplanationTemplateRegistry DEFAULT = builder().build();

  private final Map<AnomalyType, ExplanationTemplate> _templates;
  private final Map<AnomalyType, ExplanationTemplate> _genericTemplates;

  private ExplanationTemplateRegistry(Map<AnomalyType, ExplanationTemplate> templates) {
    _templates = Collections.unmodifiableMap(new EnumMap<>(templates));
    _genericTemplates = new EnumMap<>(AnomalyType.class);
    for (AnomalyType anomalyType : AnomalyType.cachedValues()) {
      if (!_templates.containsKey(anomalyType)) {
        _genericTemplates.put(anomalyType, new ExplanationTemplate(anomalyType, GENERIC_TEMPLATE));
      }
    }
  }

  /**
   * @return The registry with the built-in templates.
   */
  public static ExplanationTemplateRegistry defaultRegistry() {
    return DEFAULT;
  }

  /**
   * @return A builder pre-populated with the built-in templates.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @param anomalyType The anomaly type.
   * @return The template registered for the given type, or a generic template if there is none.
   */
  public ExplanationTemplate template(AnomalyType anomalyType) {
    ExplanationTemplate template = _templates.get(anomalyType);
    return template != null ? template : _genericTemplates.get(anomalyType);
  }

  public Map<AnomalyType, ExplanationTemplate> templates() {
    return _templates;
  }

  public static final class Builder {
    private final Map<AnomalyType, ExplanationTemplate> _templates = new EnumMap<>(AnomalyType.class);

    private Builder() {
      register(AnomalyType.SPIKE, SPIKE_TEMPLATE);
      register(AnomalyType.TREND, TREND_TEMPLATE);
      register(AnomalyType.SEASONAL, SEASONAL_TEMPLATE);
      register(AnomalyType.NORMAL, NORMAL_TEMPLATE);
    }

    /**
     * Register a template, replacing any template previously registered for the same type.
     *
     * @param anomalyType The anomaly type.
     * @param template The Mustache template text.
     * @return This builder.
     */
    public Builder register(AnomalyType anomalyType, String template) {
      validateNotNull(anomalyType, "Anomaly type cannot be null.");
      _templates.put(anomalyType, new ExplanationTemplate(anomalyType, template));
      return this;
    }

    /**
     * Remove the template of the given type, so that the generic template is used instead.
     *
     * @param anomalyType The anomaly type.
     * @return This builder.
     */
    public Builder unregister(AnomalyType anomalyType) {
      _templates.remove(anomalyType);
      return this;
    }

    public ExplanationTemplateRegistry build() {
      return new ExplanationTemplateRegistry(_templates);
    }
  }
}
