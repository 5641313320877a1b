/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.config.constants;

import com.linkedin.hostmonitor.common.config.ConfigDef;

import static com.linkedin.hostmonitor.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.hostmonitor.common.config.ConfigDef.Range.greaterThan;


/**
 * A class to keep process state detection configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class ProcessDetectionConfig {

  /**
   * <code>process.history.max.samples</code>
   */
  public static final String PROCESS_HISTORY_MAX_SAMPLES_CONFIG = "process.history.max.samples";
  public static final int DEFAULT_PROCESS_HISTORY_MAX_SAMPLES = 100;
  public static final String PROCESS_HISTORY_MAX_SAMPLES_DOC = "The maximum number of recent samples retained per process "
      + "between detection ticks.";

  /**
   * <code>process.fd.leak.growth.threshold</code>
   */
  public static final String PROCESS_FD_LEAK_GROWTH_THRESHOLD_CONFIG = "process.fd.leak.growth.threshold";
  public static final double DEFAULT_PROCESS_FD_LEAK_GROWTH_THRESHOLD = 100.0;
  public static final String PROCESS_FD_LEAK_GROWTH_THRESHOLD_DOC = "The growth in open file descriptors over the retained "
      + "history above which (strictly) a process is suspected of leaking descriptors.";

  /**
   * <code>process.fd.leak.min.samples</code>
   */
  public static final String PROCESS_FD_LEAK_MIN_SAMPLES_CONFIG = "process.fd.leak.min.samples";
  public static final int DEFAULT_PROCESS_FD_LEAK_MIN_SAMPLES = 10;
  public static final String PROCESS_FD_LEAK_MIN_SAMPLES_DOC = "The minimum number of retained descriptor count samples "
      + "of a process required for detection.";

  private ProcessDetectionConfig() {
  }

  /**
   * Define configs for process state detection.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for process state detection.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(PROCESS_HISTORY_MAX_SAMPLES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_PROCESS_HISTORY_MAX_SAMPLES,
                            atLeast(2),
                            ConfigDef.Importance.LOW,
                            PROCESS_HISTORY_MAX_SAMPLES_DOC)
                    .define(PROCESS_FD_LEAK_GROWTH_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_PROCESS_FD_LEAK_GROWTH_THRESHOLD,
                            greaterThan(0.0),
                            ConfigDef.Importance.MEDIUM,
                            PROCESS_FD_LEAK_GROWTH_THRESHOLD_DOC)
                    .define(PROCESS_FD_LEAK_MIN_SAMPLES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_PROCESS_FD_LEAK_MIN_SAMPLES,
                            atLeast(2),
                            ConfigDef.Importance.LOW,
                            PROCESS_FD_LEAK_MIN_SAMPLES_DOC);
  }
}
