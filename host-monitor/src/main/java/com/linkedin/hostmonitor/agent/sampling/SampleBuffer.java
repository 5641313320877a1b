/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent.sampling;

import com.linkedin.hostmonitor.common.utils.AutoCloseableLock;
import com.linkedin.hostmonitor.model.Sample;
import com.linkedin.hostmonitor.model.Samples;
import com.linkedin.hostmonitor.model.Signal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * A bounded, in-memory buffer of recent samples per signal, fed by the collector and read by the detectors.
 * <ul>
 *   <li>A sample older than the newest buffered sample of the same signal and entity is dropped.</li>
 *   <li>At most {@code capacityPerEntity} samples are kept per signal and entity; the oldest are evicted first.</li>
 *   <li>Samples older than {@code retentionMs} before the newest sample of their signal are evicted.</li>
 * </ul>
 * The buffer is only ever modified by {@link #append(Map)}, so a tick whose collection failed leaves it untouched.
 */
public class SampleBuffer {
  private static final Logger LOG = LoggerFactory.getLogger(SampleBuffer.class);
  private final int _capacityPerEntity;
  private final long _retentionMs;
  private final Map<Signal, SignalSeries> _seriesBySignal;
  private final ReentrantLock _lock;

  /**
   * @param capacityPerEntity Maximum number of samples kept per signal and entity.
   * @param retentionMs Time window kept per signal, relative to its newest sample.
   */
  public SampleBuffer(int capacityPerEntity, long retentionMs) {
    if (capacityPerEntity < 1) {
      throw new IllegalArgumentException("Buffer capacity must be positive, but was " + capacityPerEntity);
    }
    if (retentionMs <= 0) {
      throw new IllegalArgumentException("Buffer retention must be positive, but was " + retentionMs);
    }
    _capacityPerEntity = capacityPerEntity;
    _retentionMs = retentionMs;
    _seriesBySignal = new EnumMap<>(Signal.class);
    _lock = new ReentrantLock();
  }

  /**
   * Append the samples of one tick.
   *
   * @param samplesBySignal Samples by signal.
   * @return Number of samples accepted.
   */
  public int append(Map<Signal, List<Sample>> samplesBySignal) {
    int numAccepted = 0;
    int numDropped = 0;
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      for (Map.Entry<Signal, List<Sample>> entry : samplesBySignal.entrySet()) {
        if (entry.getKey() == null || entry.getValue() == null) {
          continue;
        }
        SignalSeries series = _seriesBySignal.computeIfAbsent(entry.getKey(), s -> new SignalSeries());
        for (Sample sample : entry.getValue()) {
          if (sample != null && series.add(sample)) {
            numAccepted++;
          } else {
            numDropped++;
          }
        }
        series.evict(_capacityPerEntity, _retentionMs);
      }
    }
    if (numDropped > 0) {
      LOG.debug("Dropped {} out-of-order or malformed samples.", numDropped);
    }
    return numAccepted;
  }

  /**
   * @param signals Signals to read.
   * @return The buffered samples of each given signal, sorted ascending by time. Signals without samples map to an
   * empty list. The returned lists are unmodifiable copies.
   */
  public Map<Signal, List<Sample>> snapshot(Set<Signal> signals) {
    Map<Signal, List<Sample>> snapshot = new EnumMap<>(Signal.class);
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      for (Signal signal : signals) {
        SignalSeries series = _seriesBySignal.get(signal);
        List<Sample> samples = series == null ? Collections.emptyList() : series.samples();
        snapshot.put(signal, Collections.unmodifiableList(Samples.sortedByTime(samples)));
      }
    }
    return snapshot;
  }

  /**
   * @param signal A signal.
   * @return Number of buffered samples of the signal.
   */
  public int size(Signal signal) {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      SignalSeries series = _seriesBySignal.get(signal);
      return series == null ? 0 : series._size;
    }
  }

  /**
   * @return Number of buffered samples of all signals.
   */
  public int size() {
    try (AutoCloseableLock ignored = new AutoCloseableLock(_lock)) {
      int size = 0;
      for (SignalSeries series : _seriesBySignal.values()) {
        size += series._size;
      }
      return size;
    }
  }

  /**
   * The samples of one signal, per entity. Not thread-safe; guarded by the lock of the buffer.
   */
  private static final class SignalSeries {
    private final Map<String, Deque<Sample>> _samplesByEntity = new HashMap<>();
    private int _size = 0;
    private long _newestTimeMs = Long.MIN_VALUE;

    private boolean add(Sample sample) {
      String entity = sample.entityKey() == null ? Samples.SYSTEM_ENTITY : sample.entityKey();
      Deque<Sample> samples = _samplesByEntity.computeIfAbsent(entity, e -> new ArrayDeque<>());
      if (!samples.isEmpty() && sample.timeMs() < samples.peekLast().timeMs()) {
        return false;
      }
      samples.addLast(sample);
      _size++;
      _newestTimeMs = Math.max(_newestTimeMs, sample.timeMs());
      return true;
    }

    private void evict(int capacityPerEntity, long retentionMs) {
      long oldestRetainedMs = _newestTimeMs - retentionMs;
      for (Iterator<Deque<Sample>> it = _samplesByEntity.values().iterator(); it.hasNext(); ) {
        Deque<Sample> samples = it.next();
        while (!samples.isEmpty()
               && (samples.size() > capacityPerEntity || samples.peekFirst().timeMs() < oldestRetainedMs)) {
          samples.pollFirst();
          _size--;
        }
        if (samples.isEmpty()) {
          it.remove();
        }
      }
    }

    private List<Sample> samples() {
      List<Sample> samples = new ArrayList<>(_size);
      _samplesByEntity.values().forEach(samples::addAll);
      return samples;
    }
  }
}
