/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.model;

import java.util.Objects;

import static com.linkedin.fleetlens.FleetLensUtils.ensureValidString;


/**
 * A tenant, the root of the fleet hierarchy. A tenant owns clusters.
 */
public final class TenantEntity extends Entity<Void> {
  private final String _tenantId;

  public TenantEntity(String tenantId) {
    _tenantId = ensureValidString("tenantId", tenantId);
  }

  @Override
  public String tenantId() {
    return _tenantId;
  }

  /**
   * Tenants do not belong to a group.
   * @return {@code null}
   */
  @Override
  public Void group() {
    return null;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_tenantId);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof TenantEntity)) {
      return false;
    }
    return _tenantId.equals(((TenantEntity) other)._tenantId);
  }

  @Override
  public String toString() {
    return _tenantId;
  }
}
