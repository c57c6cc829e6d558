/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.detector;

import com.linkedin.fleetlens.common.config.ConfigException;
import com.linkedin.fleetlens.config.FleetLensConfig;
import com.linkedin.fleetlens.exception.FleetLensException;
import java.util.Arrays;
import java.util.Map;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class EngineRegistryTest {

  @Test
  public void testRegisterAndLookup() throws FleetLensException {
    FixedScoreEngine low = new FixedScoreEngine(0.1);
    FixedScoreEngine high = new FixedScoreEngine(0.9);
    EngineRegistry registry = EngineRegistry.builder().register("low", low).register("high", high).build();

    assertSame(low, registry.engine("low"));
    assertSame(high, registry.engine("high"));
    assertEquals(Arrays.asList("low", "high"), Arrays.asList(registry.names().toArray()));
    FleetLensException e = assertThrows(FleetLensException.class, () -> registry.engine("prophet"));
    assertTrue(e.getMessage().contains("low, high"));
  }

  @Test
  public void testDuplicateName() {
    EngineRegistry.Builder builder = EngineRegistry.builder().register("fixed", new FixedScoreEngine());
    assertThrows(ConfigException.class, () -> builder.register("fixed", new FixedScoreEngine()));
    assertThrows(IllegalArgumentException.class, () -> builder.register("", new FixedScoreEngine()));
  }

  @Test
  public void testFromConfig() throws FleetLensException {
    FleetLensConfig config = new FleetLensConfig(Map.of(FleetLensConfig.ANOMALY_DETECTION_ENGINES_CONFIG,
                                                        FixedScoreEngine.class.getName(),
                                                        FixedScoreEngine.SCORE_CONFIG, "0.3"), false);
    EngineRegistry registry = EngineRegistry.fromConfig(config);
    assertEquals(1, registry.names().size());
    AnomalyDetectionEngine engine = registry.engine("fixed");
    assertEquals(0.3, ((FixedScoreEngine) engine).score(), 0.0);
    assertTrue(EngineRegistry.fromConfig(new FleetLensConfig(Map.of(), false)).isEmpty());
  }

  @Test
  public void testUnknownEngineClass() {
    FleetLensConfig config = new FleetLensConfig(Map.of(FleetLensConfig.ANOMALY_DETECTION_ENGINES_CONFIG,
                                                        "com.linkedin.fleetlens.detector.NoSuchEngine"), false);
    assertThrows(FleetLensException.class, () -> EngineRegistry.fromConfig(config));
  }
}
