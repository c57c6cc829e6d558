/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.detector.classifier;

import com.linkedin.fleetlens.config.FleetLensConfig;
import com.linkedin.fleetlens.model.AnomalyExplanation;
import com.linkedin.fleetlens.model.AnomalyResult;
import com.linkedin.fleetlens.model.AnomalyType;
import com.linkedin.fleetlens.model.MetricSeries;
import com.linkedin.fleetlens.window.TimeWindow;
import com.linkedin.fleetlens.window.WindowData;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.fleetlens.FleetLensUtils.ensureUnitInterval;
import static com.linkedin.fleetlens.common.utils.Utils.validateNotNull;
import static com.linkedin.fleetlens.config.FleetLensConfig.ANOMALY_SCORE_THRESHOLD_CONFIG;
import static com.linkedin.fleetlens.config.FleetLensConfig.SEASONAL_MIN_MEAN_CROSSINGS_CONFIG;
import static com.linkedin.fleetlens.config.FleetLensConfig.SEASONAL_MIN_POINTS_CONFIG;
import static com.linkedin.fleetlens.config.FleetLensConfig.SPIKE_MIN_POINTS_CONFIG;
import static com.linkedin.fleetlens.config.FleetLensConfig.SPIKE_ZSCORE_THRESHOLD_CONFIG;
import static com.linkedin.fleetlens.config.FleetLensConfig.TREND_MIN_POINTS_CONFIG;
import static com.linkedin.fleetlens.config.FleetLensConfig.TREND_RELATIVE_THRESHOLD_CONFIG;


/**
 * Labels scored anomaly results as spike, trend, seasonal or normal and explains the verdict.
 * <p>
 * A result whose anomaly score is below the score threshold is normal. Otherwise the rules are evaluated in order
 * and the first one that fires decides the type. If no rule fires the result is still an anomaly according to its
 * score, and it is labeled as a spike with {@code fallback=true} in the explanation context.
 * <p>
 * A classifier holds no mutable state and can be shared by concurrent callers, as long as they do not classify the
 * same {@link AnomalyResult} at the same time.
 */
public class AnomalyClassifier {
  private static final Logger LOG = LoggerFactory.getLogger(AnomalyClassifier.class);
  public static final double DEFAULT_ANOMALY_SCORE_THRESHOLD = 0.5;
  public static final String FALLBACK = "fallback";
  private final double _anomalyScoreThreshold;
  private final List<ClassificationRule> _rules;
  private final ExplanationTemplateRegistry _templates;

  /**
   * Create a classifier with the default thresholds, rules and templates.
   */
  public AnomalyClassifier() {
    this(DEFAULT_ANOMALY_SCORE_THRESHOLD, defaultRules(), ExplanationTemplateRegistry.defaultRegistry());
  }

  /**
   * @param anomalyScoreThreshold Results scored below this threshold are normal.
   * @param rules The classification rules, in evaluation order.
   * @param templates The explanation templates.
   */
  public AnomalyClassifier(double anomalyScoreThreshold,
                           List<ClassificationRule> rules,
                           ExplanationTemplateRegistry templates) {
    _anomalyScoreThreshold = ensureUnitInterval("anomalyScoreThreshold", anomalyScoreThreshold);
    _rules = Collections.unmodifiableList(new ArrayList<>(validateNotNull(rules, "Rules cannot be null.")));
    _templates = validateNotNull(templates, "Templates cannot be null.");
  }

  /**
   * @param config The FleetLens config.
   * @param templates The explanation templates.
   * @return A classifier with the thresholds of the given config.
   */
  public static AnomalyClassifier fromConfig(FleetLensConfig config, ExplanationTemplateRegistry templates) {
    List<ClassificationRule> rules = Arrays.asList(
        new SpikeRule(config.getDouble(SPIKE_ZSCORE_THRESHOLD_CONFIG), config.getInt(SPIKE_MIN_POINTS_CONFIG)),
        new TrendRule(config.getDouble(TREND_RELATIVE_THRESHOLD_CONFIG), config.getInt(TREND_MIN_POINTS_CONFIG)),
        new SeasonalRule(config.getInt(SEASONAL_MIN_POINTS_CONFIG), config.getInt(SEASONAL_MIN_MEAN_CROSSINGS_CONFIG)));
    return new AnomalyClassifier(config.getDouble(ANOMALY_SCORE_THRESHOLD_CONFIG), rules, templates);
  }

  public static AnomalyClassifier fromConfig(FleetLensConfig config) {
    return fromConfig(config, ExplanationTemplateRegistry.defaultRegistry());
  }

  static List<ClassificationRule> defaultRules() {
    return Arrays.asList(new SpikeRule(), new TrendRule(), new SeasonalRule());
  }

  /**
   * Classify the given result against all the values of the series.
   *
   * @param series The analyzed series.
   * @param result The result to classify, updated in place with the resolved label and description.
   * @return The explanation of the verdict.
   */
  public AnomalyExplanation classify(MetricSeries series, AnomalyResult result) {
    validateNotNull(series, "Metric series cannot be null.");
    return classify(series.values(), result);
  }

  /**
   * Classify the given result against the values of the window it was scored on.
   *
   * @param series The source series of the window.
   * @param window The window the result was scored on.
   * @param result The result to classify, updated in place with the resolved label and description.
   * @return The explanation of the verdict.
   */
  public AnomalyExplanation classify(MetricSeries series, TimeWindow window, AnomalyResult result) {
    validateNotNull(series, "Metric series cannot be null.");
    validateNotNull(window, "Window cannot be null.");
    if (window.endIndex() > series.length()) {
      throw new IllegalArgumentException(String.format("%s is out of the bounds of %s.", window, series));
    }
    return classify(series.values(window.startIndex(), window.endIndex()), result);
  }

  /**
   * Classify the given result against the data of a window.
   *
   * @param windowData The window data.
   * @param result The result to classify, updated in place with the resolved label and description.
   * @return The explanation of the verdict.
   */
  public AnomalyExplanation classify(WindowData windowData, AnomalyResult result) {
    validateNotNull(windowData, "Window data cannot be null.");
    return classify(windowData.values(), result);
  }

  /**
   * Classify every result of the given list against the whole series, in order.
   *
   * @param series The analyzed series.
   * @param results The results to classify.
   * @return The explanations, one per result.
   */
  public List<AnomalyExplanation> classifyBatch(MetricSeries series, List<AnomalyResult> results) {
    validateNotNull(series, "Metric series cannot be null.");
    validateNotNull(results, "Results cannot be null.");
    List<AnomalyExplanation> explanations = new ArrayList<>(results.size());
    for (AnomalyResult result : results) {
      explanations.add(classify(series, result));
    }
    return explanations;
  }

  private AnomalyExplanation classify(double[] values, AnomalyResult result) {
    validateNotNull(result, "Anomaly result cannot be null.");
    if (values.length == 0) {
      AnomalyExplanation explanation = describe(new AnomalyExplanation(AnomalyType.NORMAL));
      result.setClassification(AnomalyType.NORMAL, explanation.description());
      return explanation;
    }
    WindowStatistics stats = new WindowStatistics(values);
    RuleMatch match = resolve(stats, result.anomalyScore());
    double severity = result.magnitude() != null ? result.magnitude() : result.anomalyScore();
    AnomalyExplanation explanation = describe(new AnomalyExplanation(match.anomalyType(),
                                                                     stats.baseline(),
                                                                     stats.observed(),
                                                                     stats.deviationPercent(),
                                                                     result.anomalyScore(),
                                                                     severity,
                                                                     null,
                                                                     match.context()));
    result.setClassification(match.anomalyType(), explanation.description());
    LOG.debug("Classified {} as {} with context {}.", result, match.anomalyType(), match.context());
    return explanation;
  }

  private RuleMatch resolve(WindowStatistics stats, double anomalyScore) {
    if (anomalyScore < _anomalyScoreThreshold) {
      return new RuleMatch(AnomalyType.NORMAL, null);
    }
    for (ClassificationRule rule : _rules) {
      RuleMatch match = rule.evaluate(stats);
      if (match != null) {
        return match;
      }
    }
    Map<String, Object> context = new LinkedHashMap<>();
    context.put(FALLBACK, true);
    return new RuleMatch(AnomalyType.SPIKE, context);
  }

  private AnomalyExplanation describe(AnomalyExplanation explanation) {
    return explanation.withDescription(_templates.template(explanation.anomalyType()).render(explanation));
  }

  public double anomalyScoreThreshold() {
    return _anomalyScoreThreshold;
  }

  public List<ClassificationRule> rules() {
    return _rules;
  }
}
