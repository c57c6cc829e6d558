/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.detector;

import com.linkedin.fleetlens.common.config.ConfigException;
import com.linkedin.fleetlens.config.FleetLensConfig;
import com.linkedin.fleetlens.exception.FleetLensException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.fleetlens.FleetLensUtils.ensureValidString;
import static com.linkedin.fleetlens.common.utils.Utils.validateNotNull;
import static com.linkedin.fleetlens.config.FleetLensConfig.ANOMALY_DETECTION_ENGINES_CONFIG;


/**
 * The anomaly detection engines available for analysis, by name. The table is built once at startup and does not
 * change afterwards.
 */
public final class EngineRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(EngineRegistry.class);
  private final Map<String, AnomalyDetectionEngine> _engines;

  private EngineRegistry(Map<String, AnomalyDetectionEngine> engines) {
    _engines = Collections.unmodifiableMap(new LinkedHashMap<>(engines));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Create a registry with the engines listed in {@link FleetLensConfig#ANOMALY_DETECTION_ENGINES_CONFIG}, each
   * registered under its {@link AnomalyDetectionEngine#name()}.
   *
   * @param config The FleetLens config.
   * @return The engine registry.
   * @throws FleetLensException If an engine class cannot be instantiated.
   */
  public static EngineRegistry fromConfig(FleetLensConfig config) throws FleetLensException {
    Builder builder = builder();
    for (AnomalyDetectionEngine engine : config.getConfiguredInstances(ANOMALY_DETECTION_ENGINES_CONFIG,
                                                                       AnomalyDetectionEngine.class)) {
      builder.register(engine.name(), engine);
    }
    return builder.build();
  }

  /**
   * @param name The name of an engine.
   * @return The engine registered under the given name.
   * @throws FleetLensException If no engine is registered under the given name.
   */
  public AnomalyDetectionEngine engine(String name) throws FleetLensException {
    AnomalyDetectionEngine engine = _engines.get(name);
    if (engine == null) {
      throw new FleetLensException(String.format("Unknown anomaly detection engine '%s'. Available engines: [%s]",
                                                 name, String.join(", ", _engines.keySet())));
    }
    return engine;
  }

  public Set<String> names() {
    return _engines.keySet();
  }

  public boolean isEmpty() {
    return _engines.isEmpty();
  }

  public static final class Builder {
    private final Map<String, AnomalyDetectionEngine> _engines = new LinkedHashMap<>();

    private Builder() {

    }

    /**
     * @param name The name to register the engine under.
     * @param engine The engine.
     * @return This builder.
     * @throws ConfigException If another engine is already registered under the same name.
     */
    public Builder register(String name, AnomalyDetectionEngine engine) {
      ensureValidString("engine name", name);
      validateNotNull(engine, "Engine cannot be null.");
      if (_engines.containsKey(name)) {
        throw new ConfigException(ANOMALY_DETECTION_ENGINES_CONFIG, name, "An engine is already registered under "
                                                                          + "this name.");
      }
      _engines.put(name, engine);
      LOG.info("Registered anomaly detection engine {} (version {}) as {}.", engine.getClass().getName(),
               engine.version(), name);
      return this;
    }

    public EngineRegistry build() {
      return new EngineRegistry(_engines);
    }
  }
}
