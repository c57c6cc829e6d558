/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.fleetlens.common.config;

import com.linkedin.fleetlens.common.FleetLensConfigurable;
import com.linkedin.fleetlens.common.utils.Utils;
import com.linkedin.fleetlens.exception.FleetLensException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * The base class of configurations. It keeps the values supplied by the user next to the values parsed by a
 * {@link ConfigDef}, and remembers which configurations were read so that unknown ones can be reported.
 */
public class AbstractConfig {
  private final Logger _log = LoggerFactory.getLogger(getClass());
  private final Map<String, Object> _originals;
  private final Map<String, Object> _values;
  private final Set<String> _used = Collections.synchronizedSet(new HashSet<>());

  public AbstractConfig(ConfigDef definition, Map<?, ?> originals, boolean doLog) {
    _originals = new HashMap<>();
    for (Map.Entry<?, ?> entry : originals.entrySet()) {
      if (!(entry.getKey() instanceof String)) {
        throw new ConfigException(String.valueOf(entry.getKey()), entry.getValue(), "Key must be a string.");
      }
      _originals.put((String) entry.getKey(), entry.getValue());
    }
    _values = definition.parse(_originals);
    if (doLog) {
      _log.info("{} values:{}", getClass().getSimpleName(), describe(_values));
    }
  }

  protected Object get(String key) {
    if (!_values.containsKey(key)) {
      throw new ConfigException(String.format("Unknown configuration '%s'", key));
    }
    _used.add(key);
    return _values.get(key);
  }

  public Integer getInt(String key) {
    return (Integer) get(key);
  }

  public Long getLong(String key) {
    return (Long) get(key);
  }

  public Double getDouble(String key) {
    return (Double) get(key);
  }

  @SuppressWarnings("unchecked")
  public List<String> getList(String key) {
    return (List<String>) get(key);
  }

  public Boolean getBoolean(String key) {
    return (Boolean) get(key);
  }

  public String getString(String key) {
    return (String) get(key);
  }

  /**
   * @return The supplied configurations that have not been read.
   */
  public Set<String> unused() {
    Set<String> keys = new HashSet<>(_originals.keySet());
    keys.removeAll(_used);
    return keys;
  }

  /**
   * Instantiate the classes listed by the given configuration. Instances that are {@link FleetLensConfigurable} are
   * configured with the supplied configurations.
   *
   * @param key The configuration listing class names.
   * @param t The type the classes must implement.
   * @param <T> The type of the instances.
   * @return The instances, in the listed order.
   * @throws FleetLensException If a class cannot be found or instantiated.
   */
  public <T> List<T> getConfiguredInstances(String key, Class<T> t) throws FleetLensException {
    List<String> classNames = getList(key);
    List<T> instances = new ArrayList<>();
    if (classNames == null) {
      return instances;
    }
    for (String className : classNames) {
      T instance = Utils.newInstance(className, t);
      if (instance instanceof FleetLensConfigurable) {
        ((FleetLensConfigurable) instance).configure(Collections.unmodifiableMap(_originals));
      }
      instances.add(instance);
    }
    return instances;
  }

  private static String describe(Map<String, Object> values) {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, Object> entry : new TreeMap<>(values).entrySet()) {
      sb.append(System.lineSeparator()).append('\t').append(entry.getKey()).append(" = ").append(entry.getValue());
    }
    return sb.toString();
  }
}
