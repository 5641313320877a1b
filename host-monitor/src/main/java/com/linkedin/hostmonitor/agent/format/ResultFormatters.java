/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent.format;

import com.linkedin.hostmonitor.detector.AnomalyEvent;
import com.linkedin.hostmonitor.model.Sample;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.linkedin.hostmonitor.HostMonitorUtils.utcDateFor;
import static com.linkedin.hostmonitor.agent.config.constants.MonitorConfig.JSON_FORMAT;
import static com.linkedin.hostmonitor.agent.config.constants.MonitorConfig.STRUCTURED_TEXT_FORMAT;
import static com.linkedin.hostmonitor.agent.config.constants.MonitorConfig.TABLE_FORMAT;


/**
 * Formatter lookup and the plain structure that the structured formatters serialize.
 */
public final class ResultFormatters {
  public static final String SIGNAL = "signal";
  public static final String SAMPLES = "samples";
  public static final String ENTITIES = "entities";
  public static final String EVENTS = "events";
  public static final String TIMESTAMP = "timestamp";
  public static final String VALUE = "value";
  public static final String ID = "id";
  public static final String START_TIME = "start_time";
  public static final String END_TIME = "end_time";
  public static final String SEVERITY = "severity";
  public static final String KIND = "kind";
  public static final String CONFIDENCE = "confidence";
  public static final String METRICS = "metrics";
  public static final String BASELINE = "baseline";
  public static final String ALGORITHM = "algorithm";
  public static final String ENTITY = "entity";
  public static final String ATTRIBUTES = "attributes";

  private ResultFormatters() {

  }

  /**
   * @param name Name of a formatter: {@code table}, {@code json} or {@code structured-text}.
   * @return A new formatter with the given name.
   */
  public static ResultFormatter forName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Formatter name cannot be null.");
    }
    switch (name) {
      case TABLE_FORMAT:
        return new TableFormatter();
      case JSON_FORMAT:
        return new JsonFormatter();
      case STRUCTURED_TEXT_FORMAT:
        return new StructuredTextFormatter();
      default:
        throw new IllegalArgumentException("Unsupported format " + name);
    }
  }

  /**
   * Convert the given result into nested ordered maps, lists, strings and numbers. Timestamps become ISO-8601 UTC
   * strings with millisecond precision.
   *
   * @param result A renderable result.
   * @return The plain structure of the result.
   */
  public static Map<String, Object> toPlainObject(RenderableResult result) {
    Map<String, Object> plain = new LinkedHashMap<>();
    switch (result.kind()) {
      case METRIC_SERIES:
        plain.put(SIGNAL, result.signal().toString());
        plain.put(SAMPLES, plainSamples(result.samples()));
        break;
      case PROCESS_SERIES:
        plain.put(SIGNAL, result.signal().toString());
        Map<String, Object> entities = new LinkedHashMap<>();
        result.samplesByEntity().forEach((entity, samples) -> entities.put(entity, plainSamples(samples)));
        plain.put(ENTITIES, entities);
        break;
      case EVENT_SERIES:
        List<Object> events = new ArrayList<>(result.events().size());
        result.events().forEach(event -> events.add(plainEvent(event)));
        plain.put(EVENTS, events);
        break;
      case COMPOSITE:
        result.sections().forEach((title, section) -> plain.put(title, toPlainObject(section)));
        break;
      default:
        throw new IllegalStateException("Unrecognized result kind " + result.kind());
    }
    return plain;
  }

  /**
   * @param event An anomaly event.
   * @return Every field of the event, in declaration order. Absent optional fields map to {@code null}.
   */
  public static Map<String, Object> plainEvent(AnomalyEvent event) {
    Map<String, Object> plain = new LinkedHashMap<>();
    plain.put(ID, event.id());
    plain.put(START_TIME, utcDateFor(event.startTimeMs()));
    plain.put(END_TIME, event.endTimeMs() == null ? null : utcDateFor(event.endTimeMs()));
    plain.put(SEVERITY, event.severity().toString());
    plain.put(KIND, event.kind().tag());
    plain.put(CONFIDENCE, event.confidence());
    plain.put(METRICS, new LinkedHashMap<>(event.metrics()));
    plain.put(BASELINE, event.baseline());
    plain.put(ALGORITHM, event.algorithm());
    plain.put(ENTITY, event.entity());
    plain.put(ATTRIBUTES, new LinkedHashMap<>(event.attributes()));
    return plain;
  }

  private static List<Object> plainSamples(List<Sample> samples) {
    List<Object> plain = new ArrayList<>(samples.size());
    for (Sample sample : samples) {
      Map<String, Object> record = new LinkedHashMap<>();
      record.put(TIMESTAMP, utcDateFor(sample.timeMs()));
      record.put(VALUE, sample.value());
      plain.add(record);
    }
    return plain;
  }
}
