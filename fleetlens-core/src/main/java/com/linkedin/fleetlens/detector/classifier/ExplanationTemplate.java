/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.detector.classifier;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheException;
import com.linkedin.fleetlens.model.AnomalyExplanation;
import com.linkedin.fleetlens.model.AnomalyType;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.fleetlens.common.utils.Utils.validateNotNull;


/**
 * A Mustache template that renders the description of an explanation. Templates may refer to
 * <ul>
 *   <li>{@code {{baseline}}} and {@code {{observed}}}, formatted with two decimals,</li>
 *   <li>{@code {{deviation_percent}}}, formatted with one decimal,</li>
 *   <li>{@code {{type}}}, the anomaly label,</li>
 *   <li>any key of the explanation context, e.g. {@code {{direction}}} for trends.</li>
 * </ul>
 * Values are rendered without HTML escaping. A template that cannot be compiled or rendered falls back to its raw
 * text. A compiled template is immutable and
 * can be rendered concurrently.
 */
public final class ExplanationTemplate {
  private static final Logger LOG = LoggerFactory.getLogger(ExplanationTemplate.class);
  public static final String BASELINE = "baseline";
  public static final String OBSERVED = "observed";
  public static final String DEVIATION_PERCENT = "deviation_percent";
  public static final String TYPE = "type";
  private final AnomalyType _anomalyType;
  private final String _template;
  private final Mustache _mustache;

  public ExplanationTemplate(AnomalyType anomalyType, String template) {
    _anomalyType = validateNotNull(anomalyType, "Anomaly type cannot be null.");
    _template = validateNotNull(template, "Template cannot be null.");
    _mustache = compile(anomalyType, template);
  }

  private static Mustache compile(AnomalyType anomalyType, String template) {
    try {
      return new PlainTextMustacheFactory().compile(new StringReader(template), anomalyType.label());
    } catch (MustacheException e) {
      LOG.warn("Failed to compile the {} explanation template, it will be rendered as raw text: {}", anomalyType,
               e.getMessage());
      return null;
    }
  }

  public AnomalyType anomalyType() {
    return _anomalyType;
  }

  public String template() {
    return _template;
  }

  /**
   * @param explanation The explanation to describe.
   * @return The rendered description, or the raw template text if rendering fails.
   */
  public String render(AnomalyExplanation explanation) {
    if (_mustache == null) {
      return _template;
    }
    try {
      StringWriter writer = new StringWriter();
      _mustache.execute(writer, scope(explanation)).flush();
      return writer.toString();
    } catch (MustacheException | IOException e) {
      LOG.warn("Failed to render the {} explanation template, falling back to raw text.", _anomalyType, e);
      return _template;
    }
  }

  private static Map<String, Object> scope(AnomalyExplanation explanation) {
    Map<String, Object> scope = new HashMap<>(explanation.additionalContext());
    scope.put(BASELINE, format("%.2f", explanation.baselineValue()));
    scope.put(OBSERVED, format("%.2f", explanation.observedValue()));
    scope.put(DEVIATION_PERCENT, format("%.1f", explanation.deviationPercent()));
    scope.put(TYPE, explanation.anomalyType().label());
    return scope;
  }

  private static String format(String format, Double value) {
    return value == null ? null : String.format(Locale.ROOT, format, value);
  }

  @Override
  public String toString() {
    return _anomalyType + ": " + _template;
  }

  /**
   * Descriptions are plain text, so values are written as is instead of HTML escaped.
   */
  private static final class PlainTextMustacheFactory extends DefaultMustacheFactory {
    @Override
    public void encode(String value, Writer writer) {
      try {
        writer.write(value);
      } catch (IOException e) {
        throw new MustacheException("Failed to write " + value, e);
      }
    }
  }
}
