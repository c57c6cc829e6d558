/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.window;

import java.util.Objects;

import static com.linkedin.fleetlens.FleetLensUtils.utcDateFor;


/**
 * A slice of a metric series used as the unit of anomaly analysis. A window does not hold any data; it refers back
 * into its source series by index range and must not outlive it.
 */
public final class TimeWindow {
  private final int _startIndex;
  private final int _endIndex;
  private final long _startTimeMs;
  private final long _endTimeMs;
  private final int _sequenceNumber;

  /**
   * @param startIndex Starting index in the source series, inclusive.
   * @param endIndex Ending index in the source series, exclusive.
   * @param startTimeMs Timestamp of the first point in the window.
   * @param endTimeMs Timestamp of the last point in the window.
   * @param sequenceNumber 1-based position of this window among the windows of its series.
   */
  public TimeWindow(int startIndex, int endIndex, long startTimeMs, long endTimeMs, int sequenceNumber) {
    if (startIndex < 0 || endIndex <= startIndex) {
      throw new IllegalArgumentException(String.format("Invalid window index range [%d, %d).", startIndex, endIndex));
    }
    _startIndex = startIndex;
    _endIndex = endIndex;
    _startTimeMs = startTimeMs;
    _endTimeMs = endTimeMs;
    _sequenceNumber = sequenceNumber;
  }

  public int startIndex() {
    return _startIndex;
  }

  public int endIndex() {
    return _endIndex;
  }

  public long startTimeMs() {
    return _startTimeMs;
  }

  public long endTimeMs() {
    return _endTimeMs;
  }

  public int sequenceNumber() {
    return _sequenceNumber;
  }

  /**
   * @return Number of points in this window.
   */
  public int size() {
    return _endIndex - _startIndex;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeWindow)) {
      return false;
    }
    TimeWindow that = (TimeWindow) o;
    return _startIndex == that._startIndex && _endIndex == that._endIndex && _startTimeMs == that._startTimeMs
           && _endTimeMs == that._endTimeMs && _sequenceNumber == that._sequenceNumber;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_startIndex, _endIndex, _startTimeMs, _endTimeMs, _sequenceNumber);
  }

  @Override
  public String toString() {
    return String.format("TimeWindow(#%d, points=%d, %s to %s)", _sequenceNumber, size(), utcDateFor(_startTimeMs),
                         utcDateFor(_endTimeMs));
  }
}
