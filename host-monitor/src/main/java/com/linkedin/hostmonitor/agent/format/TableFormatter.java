/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent.format;

import com.linkedin.hostmonitor.detector.AnomalyEvent;
import com.linkedin.hostmonitor.model.Sample;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

import static com.linkedin.hostmonitor.HostMonitorUtils.utcDateFor;
import static com.linkedin.hostmonitor.agent.config.constants.MonitorConfig.TABLE_FORMAT;


/**
 * Renders results as fixed-width plain text tables.
 */
public class TableFormatter implements ResultFormatter {
  static final String NO_DATA = "No data to display";
  private static final String NONE = "-";

  @Override
  public String name() {
    return TABLE_FORMAT;
  }

  @Override
  public String format(RenderableResult result) {
    StringBuilder sb = new StringBuilder();
    render(result, sb);
    return sb.toString();
  }

  private void render(RenderableResult result, StringBuilder sb) {
    switch (result.kind()) {
      case METRIC_SERIES:
        sb.append(String.format("%s%n", result.signal()));
        renderSamples(result.samples(), sb);
        break;
      case PROCESS_SERIES:
        sb.append(String.format("%s%n", result.signal()));
        if (result.samplesByEntity().isEmpty()) {
          sb.append(String.format("%s%n", NO_DATA));
        }
        for (Map.Entry<String, List<Sample>> entry : result.samplesByEntity().entrySet()) {
          sb.append(String.format("[%s]%n", entry.getKey()));
          renderSamples(entry.getValue(), sb);
        }
        break;
      case EVENT_SERIES:
        renderEvents(result.events(), sb);
        break;
      case COMPOSITE:
        for (Map.Entry<String, RenderableResult> entry : result.sections().entrySet()) {
          sb.append(String.format("== %s ==%n", entry.getKey()));
          render(entry.getValue(), sb);
        }
        break;
      default:
        throw new IllegalStateException("Unrecognized result kind " + result.kind());
    }
  }

  private static void renderSamples(List<Sample> samples, StringBuilder sb) {
    if (samples.isEmpty()) {
      sb.append(String.format("%s%n", NO_DATA));
      return;
    }
    sb.append(String.format("%-26s%16s%n", "TIMESTAMP", "VALUE"));
    for (Sample sample : samples) {
      sb.append(String.format("%-26s%16.3f%n", utcDateFor(sample.timeMs()), sample.value()));
    }
  }

  private static void renderEvents(List<AnomalyEvent> events, StringBuilder sb) {
    if (events.isEmpty()) {
      sb.append(String.format("%s%n", NO_DATA));
      return;
    }
    sb.append(String.format("%-26s%-26s%-11s%-26s%12s%-3s%-16s%-22s%s%n", "START", "END", "SEVERITY", "KIND",
                            "CONFIDENCE", "", "ENTITY", "ALGORITHM", "METRICS"));
    for (AnomalyEvent event : events) {
      StringJoiner metrics = new StringJoiner(", ");
      event.metrics().forEach((name, value) -> metrics.add(String.format("%s=%.3f", name, value)));
      sb.append(String.format("%-26s%-26s%-11s%-26s%12.3f%-3s%-16s%-22s%s%n",
                              utcDateFor(event.startTimeMs()),
                              event.endTimeMs() == null ? NONE : utcDateFor(event.endTimeMs()),
                              event.severity(),
                              event.kind().tag(),
                              event.confidence(),
                              "",
                              event.entity() == null ? NONE : event.entity(),
                              event.algorithm(),
                              metrics));
    }
  }
}
