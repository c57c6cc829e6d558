/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.model;

/**
 * The abstract class for an entity of the fleet hierarchy. We use abstract class to force implementation of
 * {@link #hashCode()} and {@link #equals(Object)} method.
 *
 * @param <G> the group this entity belongs to, i.e. the entity one level up the hierarchy.
 */
public abstract class Entity<G> {

  /**
   * @return The tenant that owns this entity.
   */
  public abstract String tenantId();

  /**
   * Note that the group will be used as keys of maps. So it should implement equals() and hashCode() if necessary.
   * @return The entity group of this entity, {@code null} at the top of the hierarchy.
   */
  public abstract G group();

  /**
   * The entity will be used as a key of a map. So it should implement hashCode() and equals().
   * {@inheritDoc}
   */
  @Override
  public abstract int hashCode();

  /**
   * The entity will be used as a key of a map. So it should implement hashCode() and equals().
   * {@inheritDoc}
   */
  @Override
  public abstract boolean equals(Object other);
}
