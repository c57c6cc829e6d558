/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.fleetlens.common.utils;

import com.linkedin.fleetlens.exception.FleetLensException;
import java.util.function.Supplier;


public final class Utils {

  private Utils() {

  }

  /**
   * Load the named class with the context class loader, falling back to the loader of FleetLens, and instantiate it
   * with its public no-argument constructor.
   *
   * @param className The fully qualified class name.
   * @param base The type the class must implement.
   * @param <T> The instance type.
   * @return The new instance.
   * @throws FleetLensException If the class cannot be found, does not implement the base type or cannot be
   * instantiated.
   */
  public static <T> T newInstance(String className, Class<T> base) throws FleetLensException {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    Class<?> c;
    try {
      c = Class.forName(className, true, loader == null ? Utils.class.getClassLoader() : loader);
    } catch (ClassNotFoundException e) {
      throw new FleetLensException("Class " + className + " cannot be found.", e);
    }
    if (!base.isAssignableFrom(c)) {
      throw new FleetLensException(className + " is not an instance of " + base.getName());
    }
    try {
      return c.asSubclass(base).getDeclaredConstructor().newInstance();
    } catch (NoSuchMethodException e) {
      throw new FleetLensException("Could not find a public no-argument constructor for " + className, e);
    } catch (ReflectiveOperationException | RuntimeException e) {
      throw new FleetLensException("Could not instantiate class " + className, e);
    }
  }

  /**
   * Checks that the specified object reference is not null and throws a customized IllegalArgumentException if it is.
   *
   * @param obj the object reference to check for nullity
   * @param errorMsg message to be used in the event that a IllegalArgumentException is thrown
   * @param <T> the type of the reference
   * @return obj if not null
   */
  public static <T> T validateNotNull(T obj, String errorMsg) {
    if (obj == null) {
      throw new IllegalArgumentException(errorMsg);
    }
    return obj;
  }

  public static <T> T validateNotNull(T obj, Supplier<String> errorMsgSupplier) {
    if (obj == null) {
      throw new IllegalArgumentException(errorMsgSupplier.get());
    }
    return obj;
  }
}
