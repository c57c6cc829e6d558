/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.detector;

import com.linkedin.fleetlens.aggregator.AggregationPipeline;
import com.linkedin.fleetlens.aggregator.HierarchicalAnomalyScores;
import com.linkedin.fleetlens.config.FleetLensConfig;
import com.linkedin.fleetlens.detector.classifier.AnomalyClassifier;
import com.linkedin.fleetlens.exception.FleetLensException;
import com.linkedin.fleetlens.model.AnomalyResult;
import com.linkedin.fleetlens.model.MetricSeries;
import com.linkedin.fleetlens.window.TimeWindow;
import com.linkedin.fleetlens.window.WindowExtractor;
import com.linkedin.fleetlens.window.WindowExtractors;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.fleetlens.common.utils.Utils.validateNotNull;


/**
 * Runs the analysis of metric series end to end: the series is sliced into windows, the windows are scored by a
 * detection engine, each scored window is classified against its own values, and the results can be rolled up the
 * fleet hierarchy.
 */
public class FleetAnomalyAnalyzer implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(FleetAnomalyAnalyzer.class);
  private final EngineRegistry _engineRegistry;
  private final WindowExtractor _windowExtractor;
  private final AnomalyClassifier _classifier;
  private final AggregationPipeline _aggregationPipeline;

  public FleetAnomalyAnalyzer(EngineRegistry engineRegistry,
                              WindowExtractor windowExtractor,
                              AnomalyClassifier classifier,
                              AggregationPipeline aggregationPipeline) {
    _engineRegistry = validateNotNull(engineRegistry, "Engine registry cannot be null.");
    _windowExtractor = validateNotNull(windowExtractor, "Window extractor cannot be null.");
    _classifier = validateNotNull(classifier, "Classifier cannot be null.");
    _aggregationPipeline = validateNotNull(aggregationPipeline, "Aggregation pipeline cannot be null.");
  }

  /**
   * Create an analyzer whose components are all configured by the given config, with the engines listed in
   * {@link FleetLensConfig#ANOMALY_DETECTION_ENGINES_CONFIG}.
   *
   * @param config The FleetLens config.
   * @return The analyzer.
   * @throws FleetLensException If an engine cannot be instantiated.
   */
  public static FleetAnomalyAnalyzer fromConfig(FleetLensConfig config) throws FleetLensException {
    return new FleetAnomalyAnalyzer(EngineRegistry.fromConfig(config),
                                    WindowExtractors.create(config),
                                    AnomalyClassifier.fromConfig(config),
                                    AggregationPipeline.fromConfig(config));
  }

  /**
   * Analyze one series with the given engine.
   *
   * @param series The series to analyze.
   * @param engineName The name of a registered engine.
   * @return The classified results, one per window.
   * @throws FleetLensException If the engine is unknown or rejects the series, if the series is too short for the
   * configured windows, or if the engine fails.
   */
  public List<AnomalyResult> analyze(MetricSeries series, String engineName) throws FleetLensException {
    validateNotNull(series, "Metric series cannot be null.");
    AnomalyDetectionEngine engine = _engineRegistry.engine(engineName);
    if (!engine.validateInput(series)) {
      throw new FleetLensException(String.format("Engine %s rejected %s.", engineName, series));
    }
    List<TimeWindow> windows = _windowExtractor.extract(series);
    List<AnomalyResult> results = engine.detect(series, windows);
    if (results == null || results.size() != windows.size()) {
      throw new FleetLensException(String.format("Engine %s returned %s results for %d windows of %s.", engineName,
                                                 results == null ? "no" : results.size(), windows.size(), series));
    }
    for (int i = 0; i < windows.size(); i++) {
      _classifier.classify(series, windows.get(i), results.get(i));
    }
    LOG.debug("Engine {} analyzed {} windows of {}.", engineName, windows.size(), series);
    return results;
  }

  /**
   * Analyze all the given series with the given engine and roll the results up the fleet hierarchy.
   *
   * @param series The series to analyze, must not be empty.
   * @param engineName The name of a registered engine.
   * @return The scores of every hierarchy level.
   * @throws FleetLensException If any series cannot be analyzed or the results cannot be aggregated.
   */
  public HierarchicalAnomalyScores analyzeFleet(List<MetricSeries> series, String engineName)
      throws FleetLensException {
    validateNotNull(series, "Metric series cannot be null.");
    List<AnomalyResult> results = new ArrayList<>();
    for (MetricSeries s : series) {
      results.addAll(analyze(s, engineName));
    }
    HierarchicalAnomalyScores scores = _aggregationPipeline.aggregate(results);
    LOG.info("Analyzed {} series into {} anomaly results across {} nodes with engine {}.", series.size(),
             results.size(), scores.nodeScores().size(), engineName);
    return scores;
  }

  /**
   * @param series The series the result was detected in.
   * @param result A result of {@link #analyze(MetricSeries, String)} with the same engine.
   * @param engineName The name of a registered engine.
   * @return The explanation of the engine for the given result.
   * @throws FleetLensException If the engine is unknown.
   */
  public String explain(MetricSeries series, AnomalyResult result, String engineName) throws FleetLensException {
    validateNotNull(series, "Metric series cannot be null.");
    validateNotNull(result, "Anomaly result cannot be null.");
    return _engineRegistry.engine(engineName).explain(series, result);
  }

  public EngineRegistry engineRegistry() {
    return _engineRegistry;
  }

  @Override
  public void close() {
    _aggregationPipeline.close();
  }
}
