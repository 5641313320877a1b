/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;


/**
 * Helpers over sample sequences. None of them mutates its input.
 */
public final class Samples {
  /**
   * Group key of samples that carry no entity key.
   */
  public static final String SYSTEM_ENTITY = "system";
  private static final Comparator<Sample> BY_TIME = Comparator.comparingLong(Sample::timeMs);

  private Samples() {

  }

  /**
   * @param samples Samples, possibly {@code null}.
   * @return A new list with the given samples sorted ascending by time; empty for {@code null}. The sort is stable.
   */
  public static List<Sample> sortedByTime(List<Sample> samples) {
    if (samples == null || samples.isEmpty()) {
      return Collections.emptyList();
    }
    List<Sample> sorted = new ArrayList<>(samples);
    sorted.sort(BY_TIME);
    return sorted;
  }

  /**
   * Group the given samples by entity key, in entity key order, each group sorted ascending by time. Samples without
   * an entity key land in the {@link #SYSTEM_ENTITY} group.
   *
   * @param samples Samples, possibly {@code null}.
   * @return Samples by entity key.
   */
  public static SortedMap<String, List<Sample>> groupByEntity(List<Sample> samples) {
    SortedMap<String, List<Sample>> groups = new TreeMap<>();
    if (samples == null) {
      return groups;
    }
    for (Sample sample : samples) {
      String key = sample.entityKey() == null ? SYSTEM_ENTITY : sample.entityKey();
      groups.computeIfAbsent(key, k -> new ArrayList<>()).add(sample);
    }
    groups.replaceAll((k, v) -> sortedByTime(v));
    return groups;
  }

  /**
   * @param samples Samples.
   * @return The values of the given samples, in order.
   */
  public static double[] values(List<Sample> samples) {
    double[] values = new double[samples.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = samples.get(i).value();
    }
    return values;
  }

  /**
   * @param samples Samples.
   * @return {@code true} if every sample value is finite.
   */
  public static boolean allFinite(List<Sample> samples) {
    for (Sample sample : samples) {
      if (!Double.isFinite(sample.value())) {
        return false;
      }
    }
    return true;
  }

  /**
   * @param samples Samples, possibly {@code null}.
   * @return A new list holding only the samples with finite values, sorted ascending by time.
   */
  public static List<Sample> finiteSortedByTime(List<Sample> samples) {
    List<Sample> sorted = sortedByTime(samples);
    if (allFinite(sorted)) {
      return sorted;
    }
    List<Sample> finite = new ArrayList<>(sorted.size());
    for (Sample sample : sorted) {
      if (Double.isFinite(sample.value())) {
        finite.add(sample);
      }
    }
    return finite;
  }
}
