/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.window;

import com.linkedin.fleetlens.common.config.ConfigException;
import com.linkedin.fleetlens.exception.InsufficientDataException;
import com.linkedin.fleetlens.model.MetricSeries;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.fleetlens.common.utils.Utils.validateNotNull;


/**
 * Extracts windows with a fixed number of points. Starting at index 0, each window covers
 * {@code [start, start + windowSizePoints)} clipped to the series length, and the start advances by
 * {@code stridePoints}. A stride smaller than the window size produces overlapping windows.
 * <p>
 * For a series of length L >= W with partial windows disabled, this yields {@code floor((L - W) / S) + 1} windows
 * of exactly W points, where W is the window size and S the stride.
 */
public class PointWindowExtractor implements WindowExtractor {
  private static final Logger LOG = LoggerFactory.getLogger(PointWindowExtractor.class);
  private final int _windowSizePoints;
  private final int _stridePoints;
  private final boolean _includePartialWindows;

  /**
   * @param windowSizePoints Number of points per window.
   * @param stridePoints Number of points to advance between windows, {@code null} for non-overlapping windows.
   * @param includePartialWindows Whether to include windows with fewer than windowSizePoints points at the end of
   *                              the series.
   */
  public PointWindowExtractor(int windowSizePoints, Integer stridePoints, boolean includePartialWindows) {
    if (windowSizePoints <= 0) {
      throw new ConfigException("windowSizePoints", windowSizePoints, "Window size must be positive.");
    }
    int stride = stridePoints == null ? windowSizePoints : stridePoints;
    if (stride <= 0) {
      throw new ConfigException("stridePoints", stride, "Stride must be positive.");
    }
    _windowSizePoints = windowSizePoints;
    _stridePoints = stride;
    _includePartialWindows = includePartialWindows;
  }

  @Override
  public List<TimeWindow> extract(MetricSeries series) throws InsufficientDataException {
    validateNotNull(series, "Metric series cannot be null.");
    int seriesLength = series.length();

    if (seriesLength < _windowSizePoints) {
      if (_includePartialWindows && seriesLength > 0) {
        return Collections.singletonList(new TimeWindow(0, seriesLength, series.startTimeMs(), series.endTimeMs(), 1));
      }
      throw new InsufficientDataException(String.format("%s has %d points but the window size is %d. Consider "
                                                        + "including partial windows.", series, seriesLength,
                                                        _windowSizePoints));
    }

    List<TimeWindow> windows = new ArrayList<>();
    int sequenceNumber = 1;
    for (int start = 0; start < seriesLength; start += _stridePoints) {
      int end = Math.min(start + _windowSizePoints, seriesLength);
      if (end - start == _windowSizePoints || _includePartialWindows) {
        windows.add(new TimeWindow(start, end, series.timestamp(start), series.timestamp(end - 1), sequenceNumber++));
      }
      if (start > seriesLength - _stridePoints) {
        // The next start would overflow or pass the end of the series.
        break;
      }
    }
    LOG.debug("Extracted {} windows of {} points with stride {} from {}.", windows.size(), _windowSizePoints,
              _stridePoints, series);
    return windows;
  }

  public int windowSizePoints() {
    return _windowSizePoints;
  }

  public int stridePoints() {
    return _stridePoints;
  }

  public boolean includePartialWindows() {
    return _includePartialWindows;
  }

  /**
   * @return {@code true} if consecutive windows share points.
   */
  public boolean isOverlapping() {
    return _stridePoints < _windowSizePoints;
  }

  @Override
  public Map<String, Object> config() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put("window_size_points", _windowSizePoints);
    config.put("stride_points", _stridePoints);
    config.put("include_partial_windows", _includePartialWindows);
    config.put("is_overlapping", isOverlapping());
    return config;
  }
}
