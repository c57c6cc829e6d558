/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.detector.classifier;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import static com.linkedin.fleetlens.common.utils.Utils.validateNotNull;


/**
 * Summary statistics of the values of a window, shared by the classification rules.
 */
public final class WindowStatistics {
  private final double[] _values;
  private final double _baseline;
  private final double _observed;
  private final double _standardDeviation;

  /**
   * @param values The values of the window, must not be empty.
   */
  public WindowStatistics(double[] values) {
    validateNotNull(values, "Values cannot be null.");
    if (values.length == 0) {
      throw new IllegalArgumentException("Window statistics require at least one value.");
    }
    _values = values.clone();
    DescriptiveStatistics stats = new DescriptiveStatistics(_values);
    _baseline = stats.getMean();
    _standardDeviation = stats.getStandardDeviation();
    // Ties keep the earliest value.
    double observed = _values[0];
    for (double value : _values) {
      if (Math.abs(value - _baseline) > Math.abs(observed - _baseline)) {
        observed = value;
      }
    }
    _observed = observed;
  }

  public int size() {
    return _values.length;
  }

  public double value(int index) {
    return _values[index];
  }

  /**
   * @return The mean of the window values.
   */
  public double baseline() {
    return _baseline;
  }

  /**
   * @return The value with the largest absolute deviation from the baseline.
   */
  public double observed() {
    return _observed;
  }

  /**
   * @return The sample (bias-corrected) standard deviation of the window values, 0 for a single value.
   */
  public double standardDeviation() {
    return _standardDeviation;
  }

  /**
   * @return Relative deviation of the observed value from the baseline in percent, 0 if the baseline is 0.
   */
  public double deviationPercent() {
    return _baseline == 0.0 ? 0.0 : (_observed - _baseline) / _baseline * 100.0;
  }

  /**
   * @param begin Index of the first value, inclusive.
   * @param length Number of values.
   * @return Mean of the given contiguous range of values.
   */
  public double mean(int begin, int length) {
    return StatUtils.mean(_values, begin, length);
  }
}
