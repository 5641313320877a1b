/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.model;

import java.util.Objects;

import static com.linkedin.hostmonitor.HostMonitorUtils.utcDateFor;


/**
 * One timestamped numeric observation of a monitored signal, optionally tagged with the key of the entity (process id,
 * device name) it was observed on. Immutable.
 */
public final class Sample {
  private final long _timeMs;
  private final double _value;
  private final String _entityKey;

  public Sample(long timeMs, double value) {
    this(timeMs, value, null);
  }

  public Sample(long timeMs, double value, String entityKey) {
    _timeMs = timeMs;
    _value = value;
    _entityKey = entityKey;
  }

  /**
   * @return Sample time in epoch milliseconds.
   */
  public long timeMs() {
    return _timeMs;
  }

  public double value() {
    return _value;
  }

  /**
   * @return The entity key, or {@code null} for system-wide samples.
   */
  public String entityKey() {
    return _entityKey;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Sample)) {
      return false;
    }
    Sample other = (Sample) o;
    return _timeMs == other._timeMs && Double.compare(_value, other._value) == 0 && Objects.equals(_entityKey, other._entityKey);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_timeMs, _value, _entityKey);
  }

  @Override
  public String toString() {
    return String.format("{time=%s, value=%s%s}", utcDateFor(_timeMs), _value,
                         _entityKey == null ? "" : ", entity=" + _entityKey);
  }
}
