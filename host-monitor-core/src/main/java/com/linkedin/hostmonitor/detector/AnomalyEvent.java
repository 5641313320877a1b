/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import static com.linkedin.hostmonitor.HostMonitorUtils.elapsedSeconds;
import static com.linkedin.hostmonitor.HostMonitorUtils.ensureValidString;
import static com.linkedin.hostmonitor.HostMonitorUtils.utcDateFor;
import static com.linkedin.hostmonitor.common.utils.Utils.validateNotNull;


/**
 * The output unit of a detector: an anomaly window (or a single instant) with its severity, confidence and the numeric
 * evidence that justified it. Immutable; construction fails with {@link IllegalArgumentException} on any invariant
 * violation rather than clamping.
 * <p>
 * Unless set explicitly, the id is derived from the algorithm, kind, entity and time window, so that detecting twice
 * over the same input yields equal events.
 */
public final class AnomalyEvent {
  private final String _id;
  private final long _startTimeMs;
  private final Long _endTimeMs;
  private final Severity _severity;
  private final AnomalyKind _kind;
  private final double _confidence;
  private final Map<String, Double> _metrics;
  private final Double _baseline;
  private final String _algorithm;
  private final String _entity;
  private final Map<String, String> _attributes;

  private AnomalyEvent(Builder builder) {
    _kind = validateNotNull(builder._kind, "Anomaly kind cannot be null.");
    ensureValidString("Algorithm", builder._algorithm);
    _algorithm = builder._algorithm;
    _severity = validateNotNull(builder._severity, "Severity cannot be null.");
    sanityCheckConfidence(builder._confidence);
    _confidence = builder._confidence;
    sanityCheckTimeWindow(builder._startTimeMs, builder._endTimeMs);
    _startTimeMs = builder._startTimeMs;
    _endTimeMs = builder._endTimeMs;
    sanityCheckMetrics(builder._metrics, builder._baseline);
    _metrics = Collections.unmodifiableMap(new LinkedHashMap<>(builder._metrics));
    _baseline = builder._baseline;
    _entity = builder._entity;
    _attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder._attributes));
    _id = builder._id != null ? builder._id : derivedId(_algorithm, _kind, _entity, _startTimeMs, _endTimeMs);
    ensureValidString("Anomaly id", _id);
  }

  static void sanityCheckConfidence(double confidence) {
    if (!(confidence >= 0.0 && confidence <= 1.0)) {
      throw new IllegalArgumentException(String.format("Confidence (%s) must be within [0.0, 1.0].", confidence));
    }
  }

  static void sanityCheckTimeWindow(long startTimeMs, Long endTimeMs) {
    if (endTimeMs != null && endTimeMs < startTimeMs) {
      throw new IllegalArgumentException(String.format("End time %s precedes start time %s.",
                                                       utcDateFor(endTimeMs), utcDateFor(startTimeMs)));
    }
  }

  static void sanityCheckMetrics(Map<String, Double> metrics, Double baseline) {
    for (Map.Entry<String, Double> entry : metrics.entrySet()) {
      ensureValidString("Metric name", entry.getKey());
      Double value = entry.getValue();
      if (value == null || !Double.isFinite(value)) {
        throw new IllegalArgumentException(String.format("Metric %s has non-finite value %s.", entry.getKey(), value));
      }
    }
    if (baseline != null && !Double.isFinite(baseline)) {
      throw new IllegalArgumentException(String.format("Baseline %s must be finite.", baseline));
    }
  }

  private static String derivedId(String algorithm, AnomalyKind kind, String entity, long startTimeMs, Long endTimeMs) {
    String key = String.join("|", algorithm, kind.tag(), String.valueOf(entity), String.valueOf(startTimeMs),
                             String.valueOf(endTimeMs));
    return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
  }

  public String id() {
    return _id;
  }

  public long startTimeMs() {
    return _startTimeMs;
  }

  /**
   * @return End time in epoch milliseconds, or {@code null} if the event has no end.
   */
  public Long endTimeMs() {
    return _endTimeMs;
  }

  /**
   * @return Seconds between start and end, or {@code 0} if the event has no end.
   */
  public double durationSeconds() {
    return _endTimeMs == null ? 0.0 : elapsedSeconds(_startTimeMs, _endTimeMs);
  }

  public Severity severity() {
    return _severity;
  }

  public AnomalyKind kind() {
    return _kind;
  }

  public double confidence() {
    return _confidence;
  }

  /**
   * @return Numeric evidence, in insertion order.
   */
  public Map<String, Double> metrics() {
    return _metrics;
  }

  /**
   * @return The baseline value used to justify the event, or {@code null}.
   */
  public Double baseline() {
    return _baseline;
  }

  public String algorithm() {
    return _algorithm;
  }

  /**
   * @return The key of the entity (pid, device) the event was detected on, or {@code null} for system-wide events.
   */
  public String entity() {
    return _entity;
  }

  /**
   * @return Descriptive, non-numeric metadata such as a process name, in insertion order.
   */
  public Map<String, String> attributes() {
    return _attributes;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AnomalyEvent)) {
      return false;
    }
    AnomalyEvent other = (AnomalyEvent) o;
    return _id.equals(other._id) && _startTimeMs == other._startTimeMs && Objects.equals(_endTimeMs, other._endTimeMs)
           && _severity == other._severity && _kind == other._kind && Double.compare(_confidence, other._confidence) == 0
           && _metrics.equals(other._metrics) && Objects.equals(_baseline, other._baseline)
           && _algorithm.equals(other._algorithm) && Objects.equals(_entity, other._entity)
           && _attributes.equals(other._attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_id, _startTimeMs, _endTimeMs, _severity, _kind, _confidence, _metrics, _baseline, _algorithm,
                        _entity, _attributes);
  }

  @Override
  public String toString() {
    return String.format("%s{id=%s, severity=%s, start=%s, end=%s, confidence=%.2f, entity=%s, metrics=%s}",
                         _kind, _id, _severity, utcDateFor(_startTimeMs), _endTimeMs == null ? null : utcDateFor(_endTimeMs),
                         _confidence, _entity, _metrics);
  }

  public static class Builder {
    // Required
    private final AnomalyKind _kind;
    private final String _algorithm;
    private final long _startTimeMs;
    // Optional
    private String _id;
    private Long _endTimeMs;
    private Severity _severity;
    private double _confidence;
    private Double _baseline;
    private String _entity;
    private final Map<String, Double> _metrics;
    private final Map<String, String> _attributes;

    /**
     * @param kind Kind of the anomaly.
     * @param algorithm Tag of the detection algorithm.
     * @param startTimeMs Start of the anomaly window in epoch milliseconds.
     */
    public Builder(AnomalyKind kind, String algorithm, long startTimeMs) {
      _kind = kind;
      _algorithm = algorithm;
      _startTimeMs = startTimeMs;
      _severity = Severity.WARNING;
      _metrics = new LinkedHashMap<>();
      _attributes = new LinkedHashMap<>();
    }

    /**
     * (Optional) Overrides the derived id.
     * @param id Opaque identifier.
     * @return this builder.
     */
    public Builder id(String id) {
      _id = id;
      return this;
    }

    public Builder endTimeMs(Long endTimeMs) {
      _endTimeMs = endTimeMs;
      return this;
    }

    public Builder severity(Severity severity) {
      _severity = severity;
      return this;
    }

    public Builder confidence(double confidence) {
      _confidence = confidence;
      return this;
    }

    public Builder baseline(Double baseline) {
      _baseline = baseline;
      return this;
    }

    public Builder entity(String entity) {
      _entity = entity;
      return this;
    }

    public Builder metric(String name, double value) {
      _metrics.put(name, value);
      return this;
    }

    public Builder attribute(String name, String value) {
      _attributes.put(name, value);
      return this;
    }

    /**
     * @return A validated anomaly event.
     * @throws IllegalArgumentException if any invariant of the event is violated.
     */
    public AnomalyEvent build() {
      return new AnomalyEvent(this);
    }
  }
}
