/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector;

import com.linkedin.hostmonitor.common.HostMonitorConfigurable;
import com.linkedin.hostmonitor.model.Sample;
import com.linkedin.hostmonitor.model.Signal;
import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * An interface for detectors that turn sample sequences into anomaly events.
 * <p>
 * Implementations are pure over their input: they perform no I/O, never block, never mutate the given samples and
 * return an empty list rather than throw on empty or insufficient input. Implementations that are instantiated by
 * class name have a public no-argument constructor and read their parameters in {@link #configure(Map)}.
 */
public interface AnomalyDetector extends HostMonitorConfigurable {

  /**
   * @return The tag of the algorithm this detector implements.
   */
  String algorithm();

  /**
   * @return The signals this detector reads.
   */
  Set<Signal> signals();

  /**
   * Detect anomalies in the given samples.
   *
   * @param samplesBySignal Samples of (at least) the signals returned by {@link #signals()}, each sorted ascending by
   *                        time. Missing signals are treated as empty.
   * @return Detected anomaly events, ordered by start time.
   */
  List<AnomalyEvent> detect(Map<Signal, List<Sample>> samplesBySignal);
}
