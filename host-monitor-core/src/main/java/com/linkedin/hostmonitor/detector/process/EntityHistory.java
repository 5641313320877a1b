/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector.process;

import com.linkedin.hostmonitor.model.Sample;
import com.linkedin.hostmonitor.model.Samples;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;


/**
 * The most recent samples of each entity (e.g. each pid) that a {@link HistoricalAnomalyDetector} has seen, handed
 * back and forth between the detector and its caller on every tick. Immutable: {@link #update(List)} returns a new
 * history.
 */
public final class EntityHistory {
  private final SortedMap<String, List<Sample>> _samplesByEntity;
  private final int _maxSamplesPerEntity;

  private EntityHistory(SortedMap<String, List<Sample>> samplesByEntity, int maxSamplesPerEntity) {
    _samplesByEntity = Collections.unmodifiableSortedMap(samplesByEntity);
    _maxSamplesPerEntity = maxSamplesPerEntity;
  }

  /**
   * @param maxSamplesPerEntity Number of most recent samples retained per entity.
   * @return A history without entities.
   */
  public static EntityHistory empty(int maxSamplesPerEntity) {
    if (maxSamplesPerEntity < 1) {
      throw new IllegalArgumentException("Entity history must retain at least one sample, but was "
                                         + maxSamplesPerEntity);
    }
    return new EntityHistory(new TreeMap<>(), maxSamplesPerEntity);
  }

  /**
   * Fold the samples of a new tick into this history. Entities of the tick get its samples appended (samples not newer
   * than the last retained one are ignored) and trimmed to the most recent {@link #maxSamplesPerEntity()}; entities
   * absent from the tick are dropped. Samples without an entity key are ignored.
   *
   * @param current Samples of the new tick.
   * @return The new history.
   */
  public EntityHistory update(List<Sample> current) {
    SortedMap<String, List<Sample>> updated = new TreeMap<>();
    for (Map.Entry<String, List<Sample>> entry : Samples.groupByEntity(current).entrySet()) {
      String entity = entry.getKey();
      if (entry.getValue().get(0).entityKey() == null) {
        continue;
      }
      List<Sample> retained = new ArrayList<>(_samplesByEntity.getOrDefault(entity, Collections.emptyList()));
      for (Sample sample : entry.getValue()) {
        if (retained.isEmpty() || sample.timeMs() > retained.get(retained.size() - 1).timeMs()) {
          retained.add(sample);
        }
      }
      int excess = retained.size() - _maxSamplesPerEntity;
      if (excess > 0) {
        retained = new ArrayList<>(retained.subList(excess, retained.size()));
      }
      updated.put(entity, Collections.unmodifiableList(retained));
    }
    return new EntityHistory(updated, _maxSamplesPerEntity);
  }

  /**
   * @return Keys of the entities in this history, in key order.
   */
  public Set<String> entities() {
    return _samplesByEntity.keySet();
  }

  /**
   * @param entity Entity key.
   * @return Retained samples of the entity, oldest first; empty if the entity is unknown.
   */
  public List<Sample> samples(String entity) {
    return _samplesByEntity.getOrDefault(entity, Collections.emptyList());
  }

  /**
   * @param entity Entity key.
   * @return The most recent sample of the entity, or {@code null} if the entity is unknown.
   */
  public Sample lastSample(String entity) {
    List<Sample> samples = _samplesByEntity.get(entity);
    return samples == null ? null : samples.get(samples.size() - 1);
  }

  public boolean contains(String entity) {
    return _samplesByEntity.containsKey(entity);
  }

  public boolean isEmpty() {
    return _samplesByEntity.isEmpty();
  }

  public int maxSamplesPerEntity() {
    return _maxSamplesPerEntity;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EntityHistory)) {
      return false;
    }
    EntityHistory other = (EntityHistory) o;
    return _maxSamplesPerEntity == other._maxSamplesPerEntity && _samplesByEntity.equals(other._samplesByEntity);
  }

  @Override
  public int hashCode() {
    return 31 * _samplesByEntity.hashCode() + _maxSamplesPerEntity;
  }

  @Override
  public String toString() {
    return String.format("EntityHistory{entities=%d, maxSamplesPerEntity=%d}", _samplesByEntity.size(),
                         _maxSamplesPerEntity);
  }
}
