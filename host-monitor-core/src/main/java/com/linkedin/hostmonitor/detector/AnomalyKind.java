/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The kinds of anomaly the detectors report. The string tag is the external name used in rendered output.
 */
public enum AnomalyKind {
  HIGH_CPU("high_cpu"),
  MEMORY_LEAK("memory_leak"),
  OOM_RISK("oom_risk"),
  SWAP_SUSTAINED_HIGH_USAGE("swap_sustained_high_usage"),
  SWAP_SPIKE("swap_spike"),
  IO_LATENCY_SPIKE_READ("io_latency_spike_read"),
  IO_LATENCY_SPIKE_WRITE("io_latency_spike_write"),
  IO_LATENCY_SUSTAINED_READ("io_latency_sustained_read"),
  IO_LATENCY_SUSTAINED_WRITE("io_latency_sustained_write"),
  THROUGHPUT_DROP_READ("throughput_drop_read"),
  THROUGHPUT_DROP_WRITE("throughput_drop_write"),
  THROUGHPUT_SPIKE_READ("throughput_spike_read"),
  THROUGHPUT_SPIKE_WRITE("throughput_spike_write"),
  IO_QUEUE_CONGESTION("io_queue_congestion"),
  PROCESS_CRASH("process_crash"),
  FD_LEAK("fd_leak"),
  ZOMBIE_PROCESS("zombie_process");

  private static final List<AnomalyKind> CACHED_VALUES = Collections.unmodifiableList(Arrays.asList(values()));
  private final String _tag;

  AnomalyKind(String tag) {
    _tag = tag;
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<AnomalyKind> cachedValues() {
    return CACHED_VALUES;
  }

  public String tag() {
    return _tag;
  }

  @Override
  public String toString() {
    return _tag;
  }
}
