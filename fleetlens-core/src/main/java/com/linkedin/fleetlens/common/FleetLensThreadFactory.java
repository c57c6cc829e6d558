/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.common;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


public class FleetLensThreadFactory implements ThreadFactory {
  private static final Logger LOG = LoggerFactory.getLogger(FleetLensThreadFactory.class);
  private final String _name;
  private final boolean _daemon;
  private final AtomicInteger _id = new AtomicInteger(0);

  public FleetLensThreadFactory(String name) {
    this(name, true);
  }

  public FleetLensThreadFactory(String name, boolean daemon) {
    _name = name;
    _daemon = daemon;
  }

  @Override
  public Thread newThread(Runnable r) {
    Thread t = new Thread(r, _name + "-" + _id.getAndIncrement());
    t.setDaemon(_daemon);
    t.setUncaughtExceptionHandler((t1, e) -> LOG.error("Uncaught exception in " + t1.getName() + ": ", e));
    return t;
  }
}
