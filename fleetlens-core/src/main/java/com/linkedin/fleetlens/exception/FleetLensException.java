/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.exception;

public class FleetLensException extends Exception {

  public FleetLensException(String message, Throwable cause) {
    super(message, cause);
  }

  public FleetLensException(String message) {
    super(message);
  }

  public FleetLensException(Throwable cause) {
    super(cause);
  }
}
