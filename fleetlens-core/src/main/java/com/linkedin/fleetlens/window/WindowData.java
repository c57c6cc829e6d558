/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.window;

import static com.linkedin.fleetlens.common.utils.Utils.validateNotNull;


/**
 * The timestamps and values of one window, copied out of the source series.
 */
public final class WindowData {
  private final TimeWindow _window;
  private final long[] _timestamps;
  private final double[] _values;

  WindowData(TimeWindow window, long[] timestamps, double[] values) {
    _window = validateNotNull(window, "Window cannot be null.");
    _timestamps = timestamps;
    _values = values;
  }

  public TimeWindow window() {
    return _window;
  }

  /**
   * @return A copy of the timestamps of the window.
   */
  public long[] timestamps() {
    return _timestamps.clone();
  }

  /**
   * @return A copy of the values of the window.
   */
  public double[] values() {
    return _values.clone();
  }

  public int size() {
    return _values.length;
  }
}
