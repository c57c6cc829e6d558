/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.window;

import com.linkedin.fleetlens.exception.InsufficientDataException;
import com.linkedin.fleetlens.model.MetricSeries;
import java.util.List;
import java.util.Map;

import static com.linkedin.fleetlens.common.utils.Utils.validateNotNull;


/**
 * Slices a metric series into windows for batch analysis. Extraction is deterministic: the same series and
 * configuration always yield the same windows.
 */
public interface WindowExtractor {

  /**
   * Extract all windows of the given series, in order.
   *
   * @param series The series to slice.
   * @return The windows, numbered from 1.
   * @throws InsufficientDataException If the series is too short for the configured windows.
   */
  List<TimeWindow> extract(MetricSeries series) throws InsufficientDataException;

  /**
   * @return The extractor configuration, for logging and debugging.
   */
  Map<String, Object> config();

  /**
   * Materialize the timestamps and values of a window previously extracted from the given series.
   *
   * @param series The source series of the window.
   * @param window The window.
   * @return The data of the window.
   */
  default WindowData windowData(MetricSeries series, TimeWindow window) {
    validateNotNull(series, "Metric series cannot be null.");
    validateNotNull(window, "Window cannot be null.");
    if (window.endIndex() > series.length()) {
      throw new IllegalArgumentException(String.format("%s is out of the bounds of %s.", window, series));
    }
    return new WindowData(window, series.timestamps(window.startIndex(), window.endIndex()),
                          series.values(window.startIndex(), window.endIndex()));
  }
}
