/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.model;

import java.util.Objects;

import static com.linkedin.fleetlens.FleetLensUtils.ensureValidString;


/**
 * A cluster of a tenant. A cluster owns nodes.
 */
public final class ClusterEntity extends Entity<TenantEntity> {
  private final TenantEntity _tenant;
  private final String _clusterId;

  public ClusterEntity(String tenantId, String clusterId) {
    _tenant = new TenantEntity(tenantId);
    _clusterId = ensureValidString("clusterId", clusterId);
  }

  @Override
  public String tenantId() {
    return _tenant.tenantId();
  }

  public String clusterId() {
    return _clusterId;
  }

  @Override
  public TenantEntity group() {
    return _tenant;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_tenant, _clusterId);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ClusterEntity)) {
      return false;
    }
    ClusterEntity that = (ClusterEntity) other;
    return _tenant.equals(that._tenant) && _clusterId.equals(that._clusterId);
  }

  @Override
  public String toString() {
    return _tenant + "/" + _clusterId;
  }
}
