/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.fleetlens.exception;

/**
 * Thrown if a score or magnitude is outside of [0, 1], or an anomaly label is not recognized.
 */
public class OutOfRangeValueException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public OutOfRangeValueException(String message) {
    super(message);
  }

  public OutOfRangeValueException(String name, Object value, String message) {
    super("Invalid value " + value + " for " + name + (message == null ? "" : ": " + message));
  }
}
