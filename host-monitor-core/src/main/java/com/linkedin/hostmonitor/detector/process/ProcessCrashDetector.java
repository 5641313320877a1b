/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector.process;

import com.linkedin.hostmonitor.detector.AnomalyEvent;
import com.linkedin.hostmonitor.detector.AnomalyKind;
import com.linkedin.hostmonitor.detector.Severity;
import com.linkedin.hostmonitor.model.Sample;
import com.linkedin.hostmonitor.model.Samples;
import com.linkedin.hostmonitor.model.Signal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.hostmonitor.HostMonitorUtils.elapsedSeconds;


/**
 * Reports processes that were alive on the previous tick and are gone on the current one.
 * <p>
 * A process is alive on a tick if its latest {@link Signal#PROCESS_ALIVE} sample of the tick is positive. A tick
 * without any sample is treated as a failed read rather than as every process crashing: it reports nothing and hands
 * back the previous history unchanged.
 */
public class ProcessCrashDetector implements HistoricalAnomalyDetector {
  private static final Logger LOG = LoggerFactory.getLogger(ProcessCrashDetector.class);
  public static final String ALGORITHM = "crash_detector";
  public static final double CRASH_CONFIDENCE = 0.8;
  public static final String PID_ATTRIBUTE = "pid";

  @Override
  public void configure(Map<String, ?> configs) {
    // Only the latest sample of each process matters, nothing to configure.
  }

  @Override
  public String algorithm() {
    return ALGORITHM;
  }

  @Override
  public Signal signal() {
    return Signal.PROCESS_ALIVE;
  }

  @Override
  public EntityHistory emptyHistory() {
    return EntityHistory.empty(1);
  }

  @Override
  public HistoricalDetection detect(Map<Signal, List<Sample>> samplesBySignal, EntityHistory previous) {
    return detect(samplesBySignal.getOrDefault(Signal.PROCESS_ALIVE, Collections.emptyList()), previous);
  }

  /**
   * @param current {@link Signal#PROCESS_ALIVE} samples of the current tick, keyed by pid.
   * @param previous The history returned by the previous tick.
   * @return One critical event per disappeared process, ordered by pid, and the processes alive on this tick.
   */
  public HistoricalDetection detect(List<Sample> current, EntityHistory previous) {
    List<Sample> samples = Samples.finiteSortedByTime(current);
    if (samples.isEmpty()) {
      LOG.debug("Keeping the history of {} processes over a tick without samples.", previous.entities().size());
      return new HistoricalDetection(Collections.emptyList(), previous);
    }
    List<Sample> alive = new ArrayList<>();
    for (List<Sample> group : Samples.groupByEntity(samples).values()) {
      Sample latest = group.get(group.size() - 1);
      if (latest.entityKey() != null && latest.value() > 0.0) {
        alive.add(latest);
      }
    }
    EntityHistory history = previous.update(alive);
    SortedSet<String> disappeared = new TreeSet<>(previous.entities());
    disappeared.removeAll(history.entities());

    long tickTimeMs = samples.get(samples.size() - 1).timeMs();
    List<AnomalyEvent> events = new ArrayList<>(disappeared.size());
    for (String pid : disappeared) {
      Sample lastSeen = previous.lastSample(pid);
      long endTimeMs = Math.max(tickTimeMs, lastSeen.timeMs());
      events.add(new AnomalyEvent.Builder(AnomalyKind.PROCESS_CRASH, ALGORITHM, lastSeen.timeMs())
                     .endTimeMs(endTimeMs)
                     .severity(Severity.CRITICAL)
                     .confidence(CRASH_CONFIDENCE)
                     .entity(pid)
                     .metric("disappeared_count", disappeared.size())
                     .metric("seconds_since_last_seen", elapsedSeconds(lastSeen.timeMs(), endTimeMs))
                     .attribute(PID_ATTRIBUTE, pid)
                     .build());
    }
    if (!events.isEmpty()) {
      LOG.debug("{} processes disappeared: {}", disappeared.size(), disappeared);
    }
    return new HistoricalDetection(events, history);
  }
}
