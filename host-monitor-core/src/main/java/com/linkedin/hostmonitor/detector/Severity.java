/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Severity of an anomaly event, in increasing order.
 */
public enum Severity {
  WARNING("warning"), CRITICAL("critical"), EMERGENCY("emergency");

  private static final List<Severity> CACHED_VALUES = Collections.unmodifiableList(Arrays.asList(values()));
  private final String _value;

  Severity(String value) {
    _value = value;
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<Severity> cachedValues() {
    return CACHED_VALUES;
  }

  /**
   * @param value Lower case severity name.
   * @return The severity with the given name.
   */
  public static Severity forValue(String value) {
    for (Severity severity : CACHED_VALUES) {
      if (severity._value.equals(value)) {
        return severity;
      }
    }
    throw new IllegalArgumentException("Unknown severity " + value);
  }

  @Override
  public String toString() {
    return _value;
  }
}
