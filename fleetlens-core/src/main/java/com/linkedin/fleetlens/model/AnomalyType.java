/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.model;

import com.linkedin.fleetlens.exception.OutOfRangeValueException;
import java.util.Collections;
import java.util.List;


/**
 * The category of an analyzed window.
 *
 * <ul>
 *   <li>{@link #SPIKE}: A sudden, temporary deviation from the window baseline.</li>
 *   <li>{@link #TREND}: A sustained directional change between the first and second half of the window.</li>
 *   <li>{@link #SEASONAL}: A cyclic pattern that repeatedly crosses the window mean.</li>
 *   <li>{@link #NORMAL}: No anomaly.</li>
 * </ul>
 */
public enum AnomalyType {
  SPIKE("spike"), TREND("trend"), SEASONAL("seasonal"), NORMAL("normal");

  private static final List<AnomalyType> CACHED_VALUES = List.of(values());
  private final String _label;

  AnomalyType(String label) {
    _label = label;
  }

  /**
   * @return The lower case label used in results and dashboards.
   */
  public String label() {
    return _label;
  }

  /**
   * @param label An anomaly label.
   * @return The anomaly type with the given label.
   * @throws OutOfRangeValueException if the label is not one of spike, trend, seasonal, normal.
   */
  public static AnomalyType forLabel(String label) {
    for (AnomalyType type : CACHED_VALUES) {
      if (type._label.equals(label)) {
        return type;
      }
    }
    throw new OutOfRangeValueException("anomalyLabel", label, "must be one of spike, trend, seasonal, normal");
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<AnomalyType> cachedValues() {
    return Collections.unmodifiableList(CACHED_VALUES);
  }

  @Override
  public String toString() {
    return _label;
  }
}
