/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.model;

import java.util.Objects;

import static com.linkedin.fleetlens.FleetLensUtils.ensureValidString;


/**
 * A node (machine) in a cluster. Nodes are the leaves of the fleet hierarchy and own the metric series.
 */
public final class NodeEntity extends Entity<ClusterEntity> {
  private final ClusterEntity _cluster;
  private final String _nodeId;

  public NodeEntity(String tenantId, String clusterId, String nodeId) {
    _cluster = new ClusterEntity(tenantId, clusterId);
    _nodeId = ensureValidString("nodeId", nodeId);
  }

  @Override
  public String tenantId() {
    return _cluster.tenantId();
  }

  public String clusterId() {
    return _cluster.clusterId();
  }

  public String nodeId() {
    return _nodeId;
  }

  @Override
  public ClusterEntity group() {
    return _cluster;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_cluster, _nodeId);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof NodeEntity)) {
      return false;
    }
    NodeEntity that = (NodeEntity) other;
    return _cluster.equals(that._cluster) && _nodeId.equals(that._nodeId);
  }

  @Override
  public String toString() {
    return _cluster + "/" + _nodeId;
  }
}
