/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.window;

import com.linkedin.fleetlens.common.config.ConfigException;
import com.linkedin.fleetlens.model.MetricSeries;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.fleetlens.common.utils.Utils.validateNotNull;


/**
 * Extracts windows covering a fixed wall-clock duration, which suits irregular sampling and calendar based analysis.
 * <p>
 * A time cursor starts at the first timestamp and advances by the stride. For each cursor position the window holds
 * the points with timestamp in {@code [cursor, cursor + windowDurationMs)}. Ranges without any point produce no
 * window. Extraction stops once the cursor reaches the last timestamp.
 */
public class DurationWindowExtractor implements WindowExtractor {
  private static final Logger LOG = LoggerFactory.getLogger(DurationWindowExtractor.class);
  private final long _windowDurationMs;
  private final long _strideMs;
  private final boolean _includePartialWindows;

  /**
   * @param windowDurationMs Duration covered by each window.
   * @param strideMs Time to advance between windows, {@code null} for non-overlapping windows.
   * @param includePartialWindows Reported in {@link #config()}. Every non-empty time range is emitted regardless.
   */
  public DurationWindowExtractor(long windowDurationMs, Long strideMs, boolean includePartialWindows) {
    if (windowDurationMs <= 0) {
      throw new ConfigException("windowDurationMs", windowDurationMs, "Window duration must be positive.");
    }
    long stride = strideMs == null ? windowDurationMs : strideMs;
    if (stride <= 0) {
      throw new ConfigException("strideMs", stride, "Stride must be positive.");
    }
    _windowDurationMs = windowDurationMs;
    _strideMs = stride;
    _includePartialWindows = includePartialWindows;
  }

  @Override
  public List<TimeWindow> extract(MetricSeries series) {
    validateNotNull(series, "Metric series cannot be null.");
    List<TimeWindow> windows = new ArrayList<>();
    int sequenceNumber = 1;
    long lastTimestamp = series.endTimeMs();

    long cursor = series.startTimeMs();
    while (cursor < lastTimestamp) {
      long cursorEnd = saturatedAdd(cursor, _windowDurationMs);
      int startIndex = firstIndexAtOrAfter(series, cursor);
      int endIndex = firstIndexAtOrAfter(series, cursorEnd);
      if (startIndex < endIndex) {
        windows.add(new TimeWindow(startIndex, endIndex, series.timestamp(startIndex), series.timestamp(endIndex - 1),
                                   sequenceNumber++));
      }
      if (cursor > Long.MAX_VALUE - _strideMs) {
        break;
      }
      cursor += _strideMs;
    }
    LOG.debug("Extracted {} windows of {} ms with stride {} ms from {}.", windows.size(), _windowDurationMs, _strideMs,
              series);
    return windows;
  }

  /**
   * @return The first index whose timestamp is at or after the target, or the series length if there is none.
   */
  private static int firstIndexAtOrAfter(MetricSeries series, long target) {
    int low = 0;
    int high = series.length();
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (series.timestamp(mid) < target) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }

  private static long saturatedAdd(long a, long b) {
    return a > Long.MAX_VALUE - b ? Long.MAX_VALUE : a + b;
  }

  public long windowDurationMs() {
    return _windowDurationMs;
  }

  public long strideMs() {
    return _strideMs;
  }

  public boolean includePartialWindows() {
    return _includePartialWindows;
  }

  public boolean isOverlapping() {
    return _strideMs < _windowDurationMs;
  }

  @Override
  public Map<String, Object> config() {
    Map<String, Object> config = new LinkedHashMap<>();
    config.put("window_duration_ms", _windowDurationMs);
    config.put("stride_ms", _strideMs);
    config.put("include_partial_windows", _includePartialWindows);
    config.put("is_overlapping", isOverlapping());
    return config;
  }
}
