/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.exception;

/**
 * Thrown when the input does not carry enough data for the requested analysis, e.g. a series shorter than one
 * window while partial windows are disallowed, or an empty list of scores to aggregate.
 */
public class InsufficientDataException extends FleetLensException {
  public InsufficientDataException(String msg) {
    super(msg);
  }
}
