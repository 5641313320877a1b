/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector.process;

import com.linkedin.hostmonitor.common.HostMonitorConfigurable;
import com.linkedin.hostmonitor.model.Sample;
import com.linkedin.hostmonitor.model.Signal;
import java.util.List;
import java.util.Map;


/**
 * A detector that compares each tick against the recent samples of the same entities. It holds no state of its own:
 * the caller passes the history returned by the previous tick, starting from {@link #emptyHistory()}, so independent
 * instances and replays are deterministic.
 */
public interface HistoricalAnomalyDetector extends HostMonitorConfigurable {

  /**
   * @return The tag of the algorithm this detector implements.
   */
  String algorithm();

  /**
   * @return The per-entity signal this detector reads.
   */
  Signal signal();

  /**
   * @return The history to pass on the first tick.
   */
  EntityHistory emptyHistory();

  /**
   * @param samplesBySignal Samples of the current tick. A missing signal is treated as a tick without samples.
   * @param previous The history returned by the previous tick.
   * @return The events of this tick and the history to pass on the next one.
   */
  HistoricalDetection detect(Map<Signal, List<Sample>> samplesBySignal, EntityHistory previous);
}
