/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.window;

import com.linkedin.fleetlens.config.FleetLensConfig;

import static com.linkedin.fleetlens.config.FleetLensConfig.WINDOW_DURATION_MS_CONFIG;
import static com.linkedin.fleetlens.config.FleetLensConfig.WINDOW_INCLUDE_PARTIAL_CONFIG;
import static com.linkedin.fleetlens.config.FleetLensConfig.WINDOW_MODE_CONFIG;
import static com.linkedin.fleetlens.config.FleetLensConfig.WINDOW_MODE_DURATION;
import static com.linkedin.fleetlens.config.FleetLensConfig.WINDOW_SIZE_POINTS_CONFIG;
import static com.linkedin.fleetlens.config.FleetLensConfig.WINDOW_STRIDE_MS_CONFIG;
import static com.linkedin.fleetlens.config.FleetLensConfig.WINDOW_STRIDE_POINTS_CONFIG;


/**
 * Creates the window extractor selected by {@link FleetLensConfig#WINDOW_MODE_CONFIG}.
 */
public final class WindowExtractors {

  private WindowExtractors() {

  }

  /**
   * @param config The FleetLens config.
   * @return A point based extractor in "points" mode, a duration based extractor in "duration" mode.
   */
  public static WindowExtractor create(FleetLensConfig config) {
    boolean includePartialWindows = config.getBoolean(WINDOW_INCLUDE_PARTIAL_CONFIG);
    if (WINDOW_MODE_DURATION.equals(config.getString(WINDOW_MODE_CONFIG))) {
      return new DurationWindowExtractor(config.getLong(WINDOW_DURATION_MS_CONFIG), config.getLong(WINDOW_STRIDE_MS_CONFIG),
                                         includePartialWindows);
    }
    return new PointWindowExtractor(config.getInt(WINDOW_SIZE_POINTS_CONFIG), config.getInt(WINDOW_STRIDE_POINTS_CONFIG),
                                    includePartialWindows);
  }
}
