/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.detector;

import com.linkedin.fleetlens.aggregator.AggregationPipeline;
import com.linkedin.fleetlens.aggregator.AggregationStrategy;
import com.linkedin.fleetlens.aggregator.ClusterAnomalyAggregator;
import com.linkedin.fleetlens.aggregator.HierarchicalAnomalyScores;
import com.linkedin.fleetlens.aggregator.NodeAnomalyAggregator;
import com.linkedin.fleetlens.aggregator.TenantAnomalyAggregator;
import com.linkedin.fleetlens.config.FleetLensConfig;
import com.linkedin.fleetlens.detector.classifier.AnomalyClassifier;
import com.linkedin.fleetlens.exception.FleetLensException;
import com.linkedin.fleetlens.exception.InsufficientDataException;
import com.linkedin.fleetlens.model.AnomalyResult;
import com.linkedin.fleetlens.model.ClusterEntity;
import com.linkedin.fleetlens.model.MetricSeries;
import com.linkedin.fleetlens.model.NodeEntity;
import com.linkedin.fleetlens.model.TenantEntity;
import com.linkedin.fleetlens.window.PointWindowExtractor;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.Test;

import static com.linkedin.fleetlens.FleetLensUnitTestUtils.CLUSTER;
import static com.linkedin.fleetlens.FleetLensUnitTestUtils.CPU_USAGE;
import static com.linkedin.fleetlens.FleetLensUnitTestUtils.MEMORY_USAGE;
import static com.linkedin.fleetlens.FleetLensUnitTestUtils.TENANT;
import static com.linkedin.fleetlens.FleetLensUnitTestUtils.series;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class FleetAnomalyAnalyzerTest {
  private static final double DELTA = 1E-9;
  // A spike window followed by a flat window.
  private static final double[] VALUES = {50, 50, 50, 50, 50, 95, 7, 7, 7, 7, 7, 7};

  private static FleetAnomalyAnalyzer analyzer(AnomalyDetectionEngine engine) {
    return new FleetAnomalyAnalyzer(EngineRegistry.builder().register(engine.name(), engine).build(),
                                    new PointWindowExtractor(6, null, false),
                                    new AnomalyClassifier(),
                                    new AggregationPipeline(new NodeAnomalyAggregator(AggregationStrategy.MAX),
                                                            new ClusterAnomalyAggregator(AggregationStrategy.MAX),
                                                            new TenantAnomalyAggregator(AggregationStrategy.MAX)));
  }

  @Test
  public void testAnalyzeClassifiesEachWindow() throws FleetLensException {
    try (FleetAnomalyAnalyzer analyzer = analyzer(new FixedScoreEngine(0.9))) {
      List<AnomalyResult> results = analyzer.analyze(series(VALUES), "fixed");
      assertEquals(2, results.size());
      assertEquals("spike", results.get(0).anomalyLabel());
      assertNotNull(results.get(0).explanation());
      // Nothing stands out in the flat window, the high score still makes it a spike.
      assertEquals("spike", results.get(1).anomalyLabel());
      assertEquals(results.get(1).windowStartMs(), series(VALUES).timestamp(6));
    }
  }

  @Test
  public void testExplain() throws FleetLensException {
    MetricSeries series = series(VALUES);
    try (FleetAnomalyAnalyzer analyzer = analyzer(new FixedScoreEngine(0.9))) {
      AnomalyResult result = analyzer.analyze(series, "fixed").get(0);
      assertEquals("fixed scored 0.90 in " + series.metricName() + ": " + result.explanation(),
                   analyzer.explain(series, result, "fixed"));
      assertThrows(FleetLensException.class, () -> analyzer.explain(series, result, "unknown"));
    }
    AnomalyDetectionEngine plain = (s, windows) -> new FixedScoreEngine(0.9).detect(s, windows);
    try (FleetAnomalyAnalyzer analyzer = analyzer(plain)) {
      AnomalyResult result = analyzer.analyze(series, plain.name()).get(0);
      assertTrue(result.explanation().startsWith("Spike detected"));
      assertEquals(result.explanation(), analyzer.explain(series, result, plain.name()));
    }
  }

  @Test
  public void testLowScoresAreNormal() throws FleetLensException {
    try (FleetAnomalyAnalyzer analyzer = analyzer(new FixedScoreEngine(0.2))) {
      for (AnomalyResult result : analyzer.analyze(series(VALUES), "fixed")) {
        assertEquals("normal", result.anomalyLabel());
      }
    }
  }

  @Test
  public void testAnalyzeFleet() throws FleetLensException {
    List<MetricSeries> fleet = Arrays.asList(series(TENANT, CLUSTER, "n1", CPU_USAGE, VALUES),
                                             series(TENANT, CLUSTER, "n1", MEMORY_USAGE, VALUES),
                                             series(TENANT, CLUSTER, "n2", CPU_USAGE, VALUES));
    try (FleetAnomalyAnalyzer analyzer = analyzer(new FixedScoreEngine(0.75))) {
      HierarchicalAnomalyScores scores = analyzer.analyzeFleet(fleet, "fixed");
      assertEquals(2, scores.nodeScores().size());
      assertEquals(4, scores.nodeScores().get(new NodeEntity(TENANT, CLUSTER, "n1")).numMetricsAnalyzed());
      assertEquals(0.75, scores.clusterScores().get(new ClusterEntity(TENANT, CLUSTER)).aggregateScore(), DELTA);
      assertEquals(6, scores.tenantScores().get(new TenantEntity(TENANT)).numAnomaliesDetected());
    }
  }

  @Test
  public void testFailures() {
    FixedScoreEngine picky = new FixedScoreEngine();
    picky.configure(Map.of(FixedScoreEngine.MIN_LENGTH_CONFIG, "100"));
    try (FleetAnomalyAnalyzer analyzer = analyzer(picky)) {
      assertThrows(FleetLensException.class, () -> analyzer.analyze(series(VALUES), "fixed"));
      assertThrows(FleetLensException.class, () -> analyzer.analyze(series(VALUES), "unknown"));
    }
    try (FleetAnomalyAnalyzer analyzer = analyzer(new FixedScoreEngine())) {
      assertThrows(InsufficientDataException.class, () -> analyzer.analyze(series(1, 2, 3), "fixed"));
      assertThrows(InsufficientDataException.class, () -> analyzer.analyzeFleet(Collections.emptyList(), "fixed"));
    }
  }

  @Test
  public void testEngineReturningWrongNumberOfResults() {
    AnomalyDetectionEngine broken = (series, windows) -> Collections.emptyList();
    try (FleetAnomalyAnalyzer analyzer = analyzer(broken)) {
      assertThrows(FleetLensException.class, () -> analyzer.analyze(series(VALUES), broken.name()));
    }
  }

  @Test
  public void testFromConfig() throws FleetLensException {
    FleetLensConfig config = new FleetLensConfig(Map.of(FleetLensConfig.ANOMALY_DETECTION_ENGINES_CONFIG,
                                                        FixedScoreEngine.class.getName(),
                                                        FleetLensConfig.WINDOW_SIZE_POINTS_CONFIG, "4",
                                                        FleetLensConfig.WINDOW_INCLUDE_PARTIAL_CONFIG, "true"), false);
    try (FleetAnomalyAnalyzer analyzer = FleetAnomalyAnalyzer.fromConfig(config)) {
      assertEquals(3, analyzer.analyze(series(VALUES), "fixed").size());
      assertEquals(4, analyzer.analyze(series(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13), "fixed").size());
    }
  }
}
