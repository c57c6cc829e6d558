/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.fleetlens.common.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * The set of configurations a component accepts. Each configuration has a name, a type, a default value, an optional
 * validator and a documentation string.
 * <pre>
 * ConfigDef defs = new ConfigDef()
 *     .define(&quot;window.size.points&quot;, Type.INT, 100, Range.atLeast(1), &quot;docs&quot;)
 *     .define(&quot;node.aggregation.strategy&quot;, Type.STRING, &quot;max&quot;, &quot;docs&quot;);
 * Map&lt;String, Object&gt; values = defs.parse(Collections.singletonMap(&quot;window.size.points&quot;, &quot;60&quot;));
 * </pre>
 * Values may be given either as strings, as read from a properties file, or already typed. A configuration may
 * default to {@code null}; its validator then has to accept {@code null}.
 */
public class ConfigDef {
  private final Map<String, ConfigKey> _configKeys = new LinkedHashMap<>();

  /**
   * Define a new configuration.
   *
   * @param name The name of the configuration.
   * @param type The type of the configuration.
   * @param defaultValue The value used when the configuration is absent, may be {@code null}.
   * @param validator The validator of the parsed value, {@code null} to accept any value of the right type.
   * @param documentation What the configuration does.
   * @return This ConfigDef so calls can be chained.
   */
  public ConfigDef define(String name, Type type, Object defaultValue, Validator validator, String documentation) {
    if (_configKeys.containsKey(name)) {
      throw new ConfigException("Configuration " + name + " is defined twice.");
    }
    _configKeys.put(name, new ConfigKey(name, type, defaultValue, validator, documentation));
    return this;
  }

  public ConfigDef define(String name, Type type, Object defaultValue, String documentation) {
    return define(name, type, defaultValue, null, documentation);
  }

  /**
   * @param name A configuration name.
   * @return The documentation of the given configuration.
   */
  public String documentation(String name) {
    ConfigKey key = _configKeys.get(name);
    if (key == null) {
      throw new ConfigException(String.format("Unknown configuration '%s'", name));
    }
    return key._documentation;
  }

  /**
   * Parse and validate the given properties. Properties that are not defined are ignored.
   *
   * @param props The properties, keyed by configuration name.
   * @return The parsed value of every defined configuration.
   */
  public Map<String, Object> parse(Map<?, ?> props) {
    Map<String, Object> values = new HashMap<>();
    for (ConfigKey key : _configKeys.values()) {
      Object value = props.containsKey(key._name) ? key._type.convert(key._name, props.get(key._name))
                                                  : key._defaultValue;
      key.validate(value);
      values.put(key._name, value);
    }
    return values;
  }

  /**
   * The config types. A string value is trimmed and parsed into the type; a value of another class is accepted only
   * if it is already of the type, or, for numbers, can be widened to it.
   */
  public enum Type {
    BOOLEAN {
      @Override
      Object fromString(String s) {
        if ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s)) {
          return Boolean.valueOf(s);
        }
        throw new IllegalArgumentException("Expected value to be either true or false");
      }

      @Override
      Object fromObject(Object value) {
        return value instanceof Boolean ? value : null;
      }
    },
    STRING {
      @Override
      Object fromString(String s) {
        return s;
      }

      @Override
      Object fromObject(Object value) {
        return null;
      }
    },
    INT {
      @Override
      Object fromString(String s) {
        return Integer.valueOf(s);
      }

      @Override
      Object fromObject(Object value) {
        return value instanceof Integer ? value : null;
      }
    },
    LONG {
      @Override
      Object fromString(String s) {
        return Long.valueOf(s);
      }

      @Override
      Object fromObject(Object value) {
        return value instanceof Integer || value instanceof Long ? ((Number) value).longValue() : null;
      }
    },
    DOUBLE {
      @Override
      Object fromString(String s) {
        return Double.valueOf(s);
      }

      @Override
      Object fromObject(Object value) {
        return value instanceof Number ? ((Number) value).doubleValue() : null;
      }
    },
    LIST {
      @Override
      Object fromString(String s) {
        return s.isEmpty() ? Collections.emptyList() : Arrays.asList(s.split("\\s*,\\s*", -1));
      }

      @Override
      Object fromObject(Object value) {
        return value instanceof List ? value : null;
      }
    };

    abstract Object fromString(String s);

    abstract Object fromObject(Object value);

    Object convert(String name, Object value) {
      if (value == null) {
        return null;
      }
      if (value instanceof String) {
        try {
          return fromString(((String) value).trim());
        } catch (IllegalArgumentException e) {
          throw new ConfigException(name, value, "Not a valid " + this + ": " + e.getMessage());
        }
      }
      Object converted = fromObject(value);
      if (converted == null) {
        throw new ConfigException(name, value, "Expected a " + this + " but got a " + value.getClass().getName());
      }
      return converted;
    }
  }

  /**
   * Checks a single parsed configuration value.
   */
  public interface Validator {
    /**
     * @param name The name of the configuration.
     * @param value The parsed value.
     * @throws ConfigException If the value is invalid.
     */
    void ensureValid(String name, Object value);
  }

  /**
   * Validation of numeric bounds, both inclusive.
   */
  public static final class Range implements Validator {
    private final Number _min;
    private final Number _max;
    private final boolean _allowUnset;

    private Range(Number min, Number max, boolean allowUnset) {
      _min = min;
      _max = max;
      _allowUnset = allowUnset;
    }

    public static Range atLeast(Number min) {
      return new Range(min, null, false);
    }

    /**
     * @param min The minimum value.
     * @return A range with a lower bound that also accepts an unset value.
     */
    public static Range atLeastOrUnset(Number min) {
      return new Range(min, null, true);
    }

    public static Range between(Number min, Number max) {
      return new Range(min, max, false);
    }

    @Override
    public void ensureValid(String name, Object value) {
      if (value == null) {
        if (!_allowUnset) {
          throw new ConfigException(name, null, "Value must be set");
        }
        return;
      }
      double d = ((Number) value).doubleValue();
      if ((_min != null && d < _min.doubleValue()) || (_max != null && d > _max.doubleValue())) {
        throw new ConfigException(name, value, "Value must be in " + this);
      }
    }

    @Override
    public String toString() {
      return "[" + (_min == null ? "..." : _min) + ", " + (_max == null ? "..." : _max) + "]";
    }
  }

  /**
   * Validation of a string against a fixed set of accepted values.
   */
  public static final class ValidString implements Validator {
    private final List<String> _validStrings;

    private ValidString(List<String> validStrings) {
      _validStrings = validStrings;
    }

    public static ValidString in(String... validStrings) {
      return new ValidString(Arrays.asList(validStrings));
    }

    @Override
    public void ensureValid(String name, Object value) {
      if (!_validStrings.contains(value)) {
        throw new ConfigException(name, value, "String must be one of: " + String.join(", ", _validStrings));
      }
    }

    @Override
    public String toString() {
      return _validStrings.toString();
    }
  }

  private static final class ConfigKey {
    private final String _name;
    private final Type _type;
    private final Object _defaultValue;
    private final Validator _validator;
    private final String _documentation;

    private ConfigKey(String name, Type type, Object defaultValue, Validator validator, String documentation) {
      _name = name;
      _type = type;
      _defaultValue = type.convert(name, defaultValue);
      _validator = validator;
      _documentation = documentation;
      validate(_defaultValue);
    }

    private void validate(Object value) {
      if (_validator != null) {
        _validator.ensureValid(_name, value);
      }
    }
  }
}
