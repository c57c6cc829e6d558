/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens;

import com.linkedin.fleetlens.exception.OutOfRangeValueException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoUnit;

import static com.linkedin.fleetlens.common.utils.Utils.validateNotNull;

/**
 * Utils class for FleetLens
 */
public final class FleetLensUtils {
  private static final DateTimeFormatter UTC_SECONDS_FORMATTER = new DateTimeFormatterBuilder().appendInstant(0).toFormatter();

  private FleetLensUtils() {

  }

  /**
   * Ensure that the given String value of the given String key is not {@code null} or empty.
   *
   * @param key The key corresponding to the given String value.
   * @param value String value to be checked for being non-empty.
   * @return The given value.
   */
  public static String ensureValidString(String key, String value) {
    validateNotNull(value, () -> key + " cannot be null");
    if (value.isEmpty()) {
      throw new IllegalArgumentException(key + " cannot be empty");
    }
    return value;
  }

  /**
   * Ensure that the given value is within [0, 1].
   *
   * @param key The name of the value, used in the error message.
   * @param value The value to check.
   * @return The given value.
   */
  public static double ensureUnitInterval(String key, double value) {
    if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
      throw new OutOfRangeValueException(key, value, "must be in [0, 1]");
    }
    return value;
  }

  /**
   * @param timeMs Time in milliseconds.
   * @return The date for the given time in ISO 8601 format with date, hour, minute, and seconds.
   */
  public static String utcDateFor(long timeMs) {
    return UTC_SECONDS_FORMATTER.format(Instant.ofEpochMilli(timeMs).truncatedTo(ChronoUnit.SECONDS));
  }
}
