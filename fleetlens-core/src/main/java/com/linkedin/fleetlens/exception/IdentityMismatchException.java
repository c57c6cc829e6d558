/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.exception;

/**
 * Thrown when scores that belong to different nodes, clusters or tenants are mixed in a single aggregation call.
 * Scores of different tenants must never be blended.
 */
public class IdentityMismatchException extends FleetLensException {
  public IdentityMismatchException(String msg) {
    super(msg);
  }
}
