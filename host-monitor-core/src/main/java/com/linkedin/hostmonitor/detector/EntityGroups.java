/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector;

import com.linkedin.hostmonitor.model.Sample;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Runs a per-entity detection over independent entity groups, optionally in parallel. Groups share no mutable state,
 * so each group is analyzed on its own and the results are merged in start-time order.
 */
public final class EntityGroups {
  private static final Logger LOG = LoggerFactory.getLogger(EntityGroups.class);
  public static final Comparator<AnomalyEvent> BY_START_TIME =
      Comparator.comparingLong(AnomalyEvent::startTimeMs)
                .thenComparing(e -> e.entity() == null ? "" : e.entity())
                .thenComparing(e -> e.kind().tag());

  private EntityGroups() {

  }

  /**
   * Detect over each group on the calling thread.
   *
   * @param groups Samples by entity key.
   * @param detection Detection of one entity's samples.
   * @return Events of all groups, ordered by start time.
   */
  public static List<AnomalyEvent> detectSequentially(Map<String, List<Sample>> groups,
                                                      BiFunction<String, List<Sample>, List<AnomalyEvent>> detection) {
    List<AnomalyEvent> events = new ArrayList<>();
    for (Map.Entry<String, List<Sample>> group : groups.entrySet()) {
      events.addAll(detection.apply(group.getKey(), group.getValue()));
    }
    events.sort(BY_START_TIME);
    return events;
  }

  /**
   * Detect over each group on the given executor. A group whose detection fails with an unchecked exception other than
   * an event invariant violation is dropped with a warning and does not fail the other groups.
   *
   * @param groups Samples by entity key.
   * @param detection Detection of one entity's samples.
   * @param executor Executor to run the groups on.
   * @return Events of all groups, ordered by start time.
   * @throws IllegalArgumentException if a group produced an event violating the event invariants. The groups not yet
   * collected are cancelled.
   * @throws InterruptedException if interrupted while waiting for the groups. The groups not yet collected are
   * cancelled.
   */
  public static List<AnomalyEvent> detectInParallel(Map<String, List<Sample>> groups,
                                                    BiFunction<String, List<Sample>, List<AnomalyEvent>> detection,
                                                    ExecutorService executor) throws InterruptedException {
    Map<String, Future<List<AnomalyEvent>>> futures = new LinkedHashMap<>();
    for (Map.Entry<String, List<Sample>> group : groups.entrySet()) {
      futures.put(group.getKey(), executor.submit(() -> detection.apply(group.getKey(), group.getValue())));
    }
    List<AnomalyEvent> events = new ArrayList<>();
    boolean collected = false;
    try {
      for (Map.Entry<String, Future<List<AnomalyEvent>>> entry : futures.entrySet()) {
        try {
          events.addAll(entry.getValue().get());
        } catch (ExecutionException e) {
          if (e.getCause() instanceof IllegalArgumentException) {
            throw (IllegalArgumentException) e.getCause();
          }
          LOG.warn("Skipping entity group {} whose detection failed.", entry.getKey(), e.getCause());
        }
      }
      collected = true;
    } finally {
      if (!collected) {
        futures.values().forEach(future -> future.cancel(true));
      }
    }
    events.sort(BY_START_TIME);
    return events;
  }
}
