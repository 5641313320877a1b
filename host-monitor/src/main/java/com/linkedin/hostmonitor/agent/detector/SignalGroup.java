/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent.detector;

import com.linkedin.hostmonitor.model.Signal;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.linkedin.hostmonitor.agent.config.constants.MonitorConfig.*;


/**
 * The groups of signals sampled and analyzed together by one detection loop. Groups share no state, so their loops
 * run independently.
 */
public enum SignalGroup {
  CPU(CPU_SAMPLING_INTERVAL_MS_CONFIG, CPU_DETECTOR_CLASSES_CONFIG, EnumSet.of(Signal.CPU_PERCENT)),
  MEMORY(MEMORY_SAMPLING_INTERVAL_MS_CONFIG, MEMORY_DETECTOR_CLASSES_CONFIG,
         EnumSet.of(Signal.MEMORY_USED_PERCENT, Signal.SWAP_USED_PERCENT, Signal.PROCESS_RSS_MB)),
  DISK(DISK_SAMPLING_INTERVAL_MS_CONFIG, DISK_DETECTOR_CLASSES_CONFIG,
       EnumSet.of(Signal.DISK_READ_LATENCY_MS, Signal.DISK_WRITE_LATENCY_MS, Signal.DISK_READ_BYTES,
                  Signal.DISK_WRITE_BYTES, Signal.DISK_IO_IN_PROGRESS)),
  PROCESS(PROCESS_SAMPLING_INTERVAL_MS_CONFIG, PROCESS_DETECTOR_CLASSES_CONFIG,
          EnumSet.of(Signal.PROCESS_ALIVE, Signal.PROCESS_OPEN_FDS, Signal.PROCESS_ZOMBIE));

  private static final List<SignalGroup> CACHED_VALUES = Collections.unmodifiableList(Arrays.asList(values()));
  private final String _samplingIntervalConfig;
  private final String _detectorClassesConfig;
  private final Set<Signal> _signals;

  SignalGroup(String samplingIntervalConfig, String detectorClassesConfig, Set<Signal> signals) {
    _samplingIntervalConfig = samplingIntervalConfig;
    _detectorClassesConfig = detectorClassesConfig;
    _signals = Collections.unmodifiableSet(signals);
  }

  /**
   * @return Name of the config holding the sampling interval of this group.
   */
  public String samplingIntervalConfig() {
    return _samplingIntervalConfig;
  }

  /**
   * @return Name of the config listing the detector classes of this group.
   */
  public String detectorClassesConfig() {
    return _detectorClassesConfig;
  }

  public Set<Signal> signals() {
    return _signals;
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<SignalGroup> cachedValues() {
    return CACHED_VALUES;
  }
}
