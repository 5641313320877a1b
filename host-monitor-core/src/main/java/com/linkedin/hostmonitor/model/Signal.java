/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The monitored signal types. Samples of per-entity signals carry an entity key (a pid or a device name).
 */
public enum Signal {
  CPU_PERCENT("cpu_percent", false),
  MEMORY_USED_PERCENT("memory_used_percent", false),
  SWAP_USED_PERCENT("swap_used_percent", false),
  PROCESS_RSS_MB("process_rss_mb", true),
  PROCESS_ALIVE("process_alive", true),
  PROCESS_OPEN_FDS("process_open_fds", true),
  PROCESS_ZOMBIE("process_zombie", true),
  DISK_READ_LATENCY_MS("disk_read_latency_ms", true),
  DISK_WRITE_LATENCY_MS("disk_write_latency_ms", true),
  DISK_READ_BYTES("disk_read_bytes", true),
  DISK_WRITE_BYTES("disk_write_bytes", true),
  DISK_IO_IN_PROGRESS("disk_io_in_progress", true);

  private static final List<Signal> CACHED_VALUES = Collections.unmodifiableList(Arrays.asList(values()));
  private final String _name;
  private final boolean _perEntity;

  Signal(String name, boolean perEntity) {
    _name = name;
    _perEntity = perEntity;
  }

  /**
   * @return {@code true} if samples of this signal are keyed by entity.
   */
  public boolean perEntity() {
    return _perEntity;
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<Signal> cachedValues() {
    return CACHED_VALUES;
  }

  /**
   * @param name The external name of a signal, e.g. {@code cpu_percent}.
   * @return The signal with the given name.
   */
  public static Signal forName(String name) {
    for (Signal signal : CACHED_VALUES) {
      if (signal._name.equals(name)) {
        return signal;
      }
    }
    throw new IllegalArgumentException("Unknown signal " + name);
  }

  @Override
  public String toString() {
    return _name;
  }
}
