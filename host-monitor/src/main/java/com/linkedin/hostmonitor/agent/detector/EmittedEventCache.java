/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent.detector;

import com.linkedin.hostmonitor.detector.AnomalyEvent;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * Remembers the most recently emitted events of one detection loop, so that a window detected again on a later tick
 * is reported once per extent.
 * <ul>
 *   <li>An event is identified by its algorithm, kind, entity and start time.</li>
 *   <li>An identified event is reported again only if its end time or severity differs from the last reported one,
 *   e.g. once a window that was first reported early has grown, closed or escalated.</li>
 *   <li>The oldest entries are evicted beyond the capacity.</li>
 * </ul>
 * This class is not thread-safe: each detection loop owns its cache.
 */
public class EmittedEventCache {
  private final Map<String, String> _extentByEventKey;

  /**
   * @param capacity Maximum number of remembered events.
   */
  public EmittedEventCache(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("Emitted event cache capacity must be positive (Given: " + capacity + ").");
    }
    _extentByEventKey = new LinkedHashMap<>() {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
        return this.size() > capacity;
      }
    };
  }

  /**
   * @param events Candidate events, in emission order.
   * @return The events that have not been emitted yet with their current extent, in the given order, without
   * duplicates.
   */
  public List<AnomalyEvent> unseen(List<AnomalyEvent> events) {
    List<AnomalyEvent> unseen = new ArrayList<>(events.size());
    Set<String> keys = new HashSet<>();
    for (AnomalyEvent event : events) {
      String key = keyOf(event);
      if (!extentOf(event).equals(_extentByEventKey.get(key)) && keys.add(key)) {
        unseen.add(event);
      }
    }
    return unseen;
  }

  /**
   * @param events Events that were emitted.
   */
  public void markEmitted(List<AnomalyEvent> events) {
    for (AnomalyEvent event : events) {
      String key = keyOf(event);
      // Re-insert so that an updated event counts as recently emitted.
      _extentByEventKey.remove(key);
      _extentByEventKey.put(key, extentOf(event));
    }
  }

  public int size() {
    return _extentByEventKey.size();
  }

  private static String keyOf(AnomalyEvent event) {
    return String.join("|", event.algorithm(), event.kind().tag(), String.valueOf(event.entity()),
                       Long.toString(event.startTimeMs()));
  }

  private static String extentOf(AnomalyEvent event) {
    return event.endTimeMs() + "|" + event.severity();
  }
}
