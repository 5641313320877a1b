/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.config.constants;

import com.linkedin.hostmonitor.common.config.ConfigDef;

import static com.linkedin.hostmonitor.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.hostmonitor.common.config.ConfigDef.Range.between;
import static com.linkedin.hostmonitor.common.config.ConfigDef.Range.greaterThan;


/**
 * A class to keep CPU detection configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class CpuDetectionConfig {

  /**
   * <code>cpu.threshold.percent</code>
   */
  public static final String CPU_THRESHOLD_PERCENT_CONFIG = "cpu.threshold.percent";
  public static final double DEFAULT_CPU_THRESHOLD_PERCENT = 80.0;
  public static final String CPU_THRESHOLD_PERCENT_DOC = "The CPU utilization in percent above which (strictly) a sample "
      + "counts towards a high CPU window.";

  /**
   * <code>cpu.threshold.duration.seconds</code>
   */
  public static final String CPU_THRESHOLD_DURATION_SECONDS_CONFIG = "cpu.threshold.duration.seconds";
  public static final long DEFAULT_CPU_THRESHOLD_DURATION_SECONDS = 300L;
  public static final String CPU_THRESHOLD_DURATION_SECONDS_DOC = "The nominal minimum duration of a high CPU window. "
      + "A window that lasts at least the smaller of this duration (in seconds) and the consecutive periods is reported.";

  /**
   * <code>cpu.threshold.consecutive.periods</code>
   */
  public static final String CPU_THRESHOLD_CONSECUTIVE_PERIODS_CONFIG = "cpu.threshold.consecutive.periods";
  public static final int DEFAULT_CPU_THRESHOLD_CONSECUTIVE_PERIODS = 3;
  public static final String CPU_THRESHOLD_CONSECUTIVE_PERIODS_DOC = "The number of consecutive samples above the "
      + "threshold needed to open a high CPU window, and the number of consecutive samples at or below it needed to close it.";

  /**
   * <code>cpu.baseline.std.multiplier</code>
   */
  public static final String CPU_BASELINE_STD_MULTIPLIER_CONFIG = "cpu.baseline.std.multiplier";
  public static final double DEFAULT_CPU_BASELINE_STD_MULTIPLIER = 2.0;
  public static final String CPU_BASELINE_STD_MULTIPLIER_DOC = "The number of standard deviations above the historical "
      + "mean at which a CPU sample is reported as a baseline deviation.";

  /**
   * <code>cpu.baseline.window.days</code>
   */
  public static final String CPU_BASELINE_WINDOW_DAYS_CONFIG = "cpu.baseline.window.days";
  public static final int DEFAULT_CPU_BASELINE_WINDOW_DAYS = 7;
  public static final String CPU_BASELINE_WINDOW_DAYS_DOC = "The number of days of CPU history retained for computing "
      + "the baseline.";

  private CpuDetectionConfig() {
  }

  /**
   * Define configs for CPU detection.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for CPU detection.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(CPU_THRESHOLD_PERCENT_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_CPU_THRESHOLD_PERCENT,
                            between(0.0, 100.0),
                            ConfigDef.Importance.HIGH,
                            CPU_THRESHOLD_PERCENT_DOC)
                    .define(CPU_THRESHOLD_DURATION_SECONDS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_CPU_THRESHOLD_DURATION_SECONDS,
                            greaterThan(0),
                            ConfigDef.Importance.MEDIUM,
                            CPU_THRESHOLD_DURATION_SECONDS_DOC)
                    .define(CPU_THRESHOLD_CONSECUTIVE_PERIODS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_CPU_THRESHOLD_CONSECUTIVE_PERIODS,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            CPU_THRESHOLD_CONSECUTIVE_PERIODS_DOC)
                    .define(CPU_BASELINE_STD_MULTIPLIER_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_CPU_BASELINE_STD_MULTIPLIER,
                            greaterThan(0.0),
                            ConfigDef.Importance.MEDIUM,
                            CPU_BASELINE_STD_MULTIPLIER_DOC)
                    .define(CPU_BASELINE_WINDOW_DAYS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_CPU_BASELINE_WINDOW_DAYS,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            CPU_BASELINE_WINDOW_DAYS_DOC);
  }
}
