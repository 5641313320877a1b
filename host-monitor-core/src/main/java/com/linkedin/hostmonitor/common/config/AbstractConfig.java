/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.hostmonitor.common.config;

import com.linkedin.hostmonitor.common.HostMonitorConfigurable;
import com.linkedin.hostmonitor.common.utils.Utils;
import com.linkedin.hostmonitor.exception.HostMonitorException;
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
 * A convenient base class for configurations to extend.
 * <p>
 * This class holds both the original configuration that was provided as well as the parsed values.
 */
public class AbstractConfig {

  public static final String NL = System.getProperty("line.separator");

  private final Logger _log = LoggerFactory.getLogger(getClass());

  /* configs for which values have been requested, used to detect unused configs */
  private final Set<String> _used;

  /* the original values passed in by the user */
  private final Map<String, ?> _originals;

  /* the parsed values */
  private final Map<String, Object> _values;

  private final ConfigDef _definition;

  @SuppressWarnings("unchecked")
  public AbstractConfig(ConfigDef definition, Map<?, ?> originals, boolean doLog) {
    for (Map.Entry<?, ?> entry : originals.entrySet()) {
      if (!(entry.getKey() instanceof String)) {
        throw new ConfigException(entry.getKey().toString(), entry.getValue(), "Key must be a string.");
      }
    }
    _originals = (Map<String, ?>) originals;
    _values = definition.parse(_originals);
    _used = Collections.synchronizedSet(new HashSet<>());
    _definition = definition;
    if (doLog) {
      logAll();
    }
  }

  public AbstractConfig(ConfigDef definition, Map<?, ?> originals) {
    this(definition, originals, true);
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

  public Class<?> getClass(String key) {
    return (Class<?>) get(key);
  }

  /**
   * Get the type of the given key.
   *
   * @param key A config key to retrieve the type.
   * @return The type of the given key, or {@code null} for an unknown key.
   */
  public ConfigDef.Type typeOf(String key) {
    ConfigDef.ConfigKey configKey = _definition.configKeys().get(key);
    return configKey == null ? null : configKey.type();
  }

  /**
   * @return Unused configs.
   */
  public Set<String> unused() {
    Set<String> keys = new HashSet<>(_originals.keySet());
    keys.removeAll(_used);
    return keys;
  }

  /**
   * @return A copy of the original configs.
   */
  public Map<String, Object> originals() {
    return new HashMap<>(_originals);
  }

  /**
   * @return A copy of the parsed values.
   */
  public Map<String, ?> values() {
    return new HashMap<>(_values);
  }

  private void logAll() {
    StringBuilder b = new StringBuilder();
    b.append(getClass().getSimpleName());
    b.append(" values: ");
    b.append(NL);

    for (Map.Entry<String, Object> entry : new TreeMap<>(_values).entrySet()) {
      b.append('\t');
      b.append(entry.getKey());
      b.append(" = ");
      b.append(entry.getValue());
      b.append(NL);
    }
    _log.info(b.toString());
  }

  /**
   * Log warnings for any unused configurations
   */
  public void logUnused() {
    for (String key : unused()) {
      _log.warn("The configuration '{}' was supplied but isn't a known config.", key);
    }
  }

  /**
   * Get a list of configured instances of the given class specified by the given configuration key. The configuration
   * may specify an empty list to indicate no configured instances, in which case this method returns an empty list.
   * Instances implementing {@link HostMonitorConfigurable} are configured with the original configs and the overrides.
   *
   * @param key The configuration key for the class list
   * @param t The interface the classes should implement
   * @param configOverrides Configuration overrides to use.
   * @param <T> The type of the configured instances to be returned.
   * @return The list of configured instances
   */
  public <T> List<T> getConfiguredInstances(String key, Class<T> t, Map<String, Object> configOverrides)
      throws HostMonitorException {
    List<String> klasses = getList(key);
    List<T> objects = new ArrayList<>();
    if (klasses == null) {
      return objects;
    }
    Map<String, Object> configPairs = originals();
    configPairs.putAll(configOverrides);
    for (Object klass : klasses) {
      Object o;
      if (klass instanceof String) {
        try {
          o = Utils.newInstance((String) klass, t);
        } catch (ClassNotFoundException e) {
          throw new HostMonitorException(klass + " ClassNotFoundException exception occurred", e);
        }
      } else if (klass instanceof Class<?>) {
        o = Utils.newInstance((Class<?>) klass);
      } else {
        throw new HostMonitorException("List contains element of type " + klass.getClass().getName()
                                       + ", expected String or Class");
      }
      if (!t.isInstance(o)) {
        throw new HostMonitorException(klass + " is not an instance of " + t.getName());
      }
      if (o instanceof HostMonitorConfigurable) {
        ((HostMonitorConfigurable) o).configure(configPairs);
      }
      objects.add(t.cast(o));
    }
    return objects;
  }

  /**
   * Get a list of configured instances, see {@link #getConfiguredInstances(String, Class, Map)}.
   *
   * @param key The configuration key for the class list
   * @param t The interface the classes should implement
   * @param <T> The type of the configured instances to be returned.
   * @return The list of configured instances
   */
  public <T> List<T> getConfiguredInstances(String key, Class<T> t) throws HostMonitorException {
    return getConfiguredInstances(key, t, Collections.emptyMap());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return _originals.equals(((AbstractConfig) o)._originals);
  }

  @Override
  public int hashCode() {
    return _originals.hashCode();
  }
}
