/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent.format;

import com.linkedin.hostmonitor.detector.AnomalyEvent;
import com.linkedin.hostmonitor.model.Sample;
import com.linkedin.hostmonitor.model.Samples;
import com.linkedin.hostmonitor.model.Signal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.linkedin.hostmonitor.common.utils.Utils.validateNotNull;


/**
 * A result that formatters know how to render. The set of kinds is closed: a formatter switches on {@link #kind()} and
 * reads the accessor of that kind only.
 */
public final class RenderableResult {
  /**
   * The kinds of renderable results.
   */
  public enum Kind {
    /** Samples of one system-wide signal. */
    METRIC_SERIES,
    /** Samples of one per-entity signal, by entity. */
    PROCESS_SERIES,
    /** Anomaly events. */
    EVENT_SERIES,
    /** Titled sections, each itself a renderable result. */
    COMPOSITE
  }

  private final Kind _kind;
  private final Signal _signal;
  private final List<Sample> _samples;
  private final Map<String, List<Sample>> _samplesByEntity;
  private final List<AnomalyEvent> _events;
  private final Map<String, RenderableResult> _sections;

  private RenderableResult(Kind kind, Signal signal, List<Sample> samples, Map<String, List<Sample>> samplesByEntity,
                           List<AnomalyEvent> events, Map<String, RenderableResult> sections) {
    _kind = kind;
    _signal = signal;
    _samples = samples;
    _samplesByEntity = samplesByEntity;
    _events = events;
    _sections = sections;
  }

  /**
   * @param signal A system-wide signal.
   * @param samples Samples of the signal.
   * @return A {@link Kind#METRIC_SERIES} result with the samples sorted by time.
   */
  public static RenderableResult metricSeries(Signal signal, List<Sample> samples) {
    validateNotNull(signal, "Signal cannot be null.");
    return new RenderableResult(Kind.METRIC_SERIES, signal, Collections.unmodifiableList(Samples.sortedByTime(samples)),
                                null, null, null);
  }

  /**
   * @param signal A per-entity signal.
   * @param samples Samples of the signal.
   * @return A {@link Kind#PROCESS_SERIES} result with the samples grouped by entity, in entity order.
   */
  public static RenderableResult processSeries(Signal signal, List<Sample> samples) {
    validateNotNull(signal, "Signal cannot be null.");
    Map<String, List<Sample>> samplesByEntity = new LinkedHashMap<>();
    Samples.groupByEntity(samples).forEach((entity, group) -> samplesByEntity.put(entity, Collections.unmodifiableList(group)));
    return new RenderableResult(Kind.PROCESS_SERIES, signal, null, Collections.unmodifiableMap(samplesByEntity), null, null);
  }

  /**
   * @param events Anomaly events, in the order to render them.
   * @return An {@link Kind#EVENT_SERIES} result.
   */
  public static RenderableResult eventSeries(List<AnomalyEvent> events) {
    validateNotNull(events, "Events cannot be null.");
    return new RenderableResult(Kind.EVENT_SERIES, null, null, null,
                                Collections.unmodifiableList(new ArrayList<>(events)), null);
  }

  /**
   * @param sections Results by section title, in the order to render them.
   * @return A {@link Kind#COMPOSITE} result.
   */
  public static RenderableResult composite(Map<String, RenderableResult> sections) {
    validateNotNull(sections, "Sections cannot be null.");
    return new RenderableResult(Kind.COMPOSITE, null, null, null, null,
                                Collections.unmodifiableMap(new LinkedHashMap<>(sections)));
  }

  public Kind kind() {
    return _kind;
  }

  /**
   * @return The signal of a {@link Kind#METRIC_SERIES} or {@link Kind#PROCESS_SERIES} result.
   */
  public Signal signal() {
    if (_signal == null) {
      throw new IllegalStateException(_kind + " result has no signal.");
    }
    return _signal;
  }

  public List<Sample> samples() {
    return ensureKind(Kind.METRIC_SERIES, _samples);
  }

  public Map<String, List<Sample>> samplesByEntity() {
    return ensureKind(Kind.PROCESS_SERIES, _samplesByEntity);
  }

  public List<AnomalyEvent> events() {
    return ensureKind(Kind.EVENT_SERIES, _events);
  }

  public Map<String, RenderableResult> sections() {
    return ensureKind(Kind.COMPOSITE, _sections);
  }

  private <T> T ensureKind(Kind expected, T value) {
    if (_kind != expected) {
      throw new IllegalStateException(String.format("Attempt to read %s of a %s result.", expected, _kind));
    }
    return value;
  }

  @Override
  public String toString() {
    return String.format("RenderableResult{kind=%s}", _kind);
  }
}
