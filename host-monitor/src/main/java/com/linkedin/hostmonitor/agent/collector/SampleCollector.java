/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent.collector;

import com.linkedin.hostmonitor.common.HostMonitorConfigurable;
import com.linkedin.hostmonitor.model.Sample;
import com.linkedin.hostmonitor.model.Signal;
import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * Reads the operating-system counters of one sampling tick. Implementations wrap the kernel interfaces of a platform
 * and are instantiated by class name, see
 * {@link com.linkedin.hostmonitor.agent.config.constants.MonitorConfig#SAMPLE_COLLECTOR_CLASS_CONFIG}.
 * <p>
 * A collector is called from the detection loops of several signal groups concurrently and must be thread-safe.
 * Collection may block briefly on I/O; the caller bounds it with a timeout.
 */
public interface SampleCollector extends HostMonitorConfigurable {

  /**
   * Collect one tick of samples.
   *
   * @param signals The signals to collect.
   * @return Samples by signal. Samples of per-entity signals carry the entity key, and timestamps are non-decreasing
   * within each entity. Signals that could not be read may be missing.
   * @throws CollectionException if the counters of the tick could not be read.
   */
  Map<Signal, List<Sample>> collect(Set<Signal> signals) throws CollectionException;
}
