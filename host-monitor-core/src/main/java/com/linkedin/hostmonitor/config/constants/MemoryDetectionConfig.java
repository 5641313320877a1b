/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.config.constants;

import com.linkedin.hostmonitor.common.config.ConfigDef;

import static com.linkedin.hostmonitor.common.config.ConfigDef.Range.aboveAndAtMost;
import static com.linkedin.hostmonitor.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.hostmonitor.common.config.ConfigDef.Range.between;
import static com.linkedin.hostmonitor.common.config.ConfigDef.Range.greaterThan;


/**
 * A class to keep memory and swap detection configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class MemoryDetectionConfig {

  /**
   * <code>memory.leak.min.samples</code>
   */
  public static final String MEMORY_LEAK_MIN_SAMPLES_CONFIG = "memory.leak.min.samples";
  public static final int DEFAULT_MEMORY_LEAK_MIN_SAMPLES = 100;
  public static final String MEMORY_LEAK_MIN_SAMPLES_DOC = "The minimum number of resident size samples of a process "
      + "required before its growth trend is evaluated.";

  /**
   * <code>memory.leak.growth.threshold.mb.per.hour</code>
   */
  public static final String MEMORY_LEAK_GROWTH_THRESHOLD_CONFIG = "memory.leak.growth.threshold.mb.per.hour";
  public static final double DEFAULT_MEMORY_LEAK_GROWTH_THRESHOLD = 50.0;
  public static final String MEMORY_LEAK_GROWTH_THRESHOLD_DOC = "The resident size growth rate in MB per hour above "
      + "which a process is suspected of leaking memory.";

  /**
   * <code>memory.leak.confidence.threshold</code>
   */
  public static final String MEMORY_LEAK_CONFIDENCE_THRESHOLD_CONFIG = "memory.leak.confidence.threshold";
  public static final double DEFAULT_MEMORY_LEAK_CONFIDENCE_THRESHOLD = 0.8;
  public static final String MEMORY_LEAK_CONFIDENCE_THRESHOLD_DOC = "The R-squared of the growth trend above which "
      + "(strictly) the trend is trusted for extrapolation.";

  /**
   * <code>memory.leak.capacity.limit.mb</code>
   */
  public static final String MEMORY_LEAK_CAPACITY_LIMIT_MB_CONFIG = "memory.leak.capacity.limit.mb";
  public static final double DEFAULT_MEMORY_LEAK_CAPACITY_LIMIT_MB = 16 * 1024.0;
  public static final String MEMORY_LEAK_CAPACITY_LIMIT_MB_DOC = "The assumed resident size ceiling of a process in MB.";

  /**
   * <code>memory.leak.prediction.window.hours</code>
   */
  public static final String MEMORY_LEAK_PREDICTION_WINDOW_HOURS_CONFIG = "memory.leak.prediction.window.hours";
  public static final double DEFAULT_MEMORY_LEAK_PREDICTION_WINDOW_HOURS = 168.0;
  public static final String MEMORY_LEAK_PREDICTION_WINDOW_HOURS_DOC = "A leak is reported only if the process is "
      + "predicted to reach its ceiling within this many hours.";

  /**
   * <code>memory.oom.min.samples</code>
   */
  public static final String MEMORY_OOM_MIN_SAMPLES_CONFIG = "memory.oom.min.samples";
  public static final int DEFAULT_MEMORY_OOM_MIN_SAMPLES = 30;
  public static final String MEMORY_OOM_MIN_SAMPLES_DOC = "The minimum number of system memory usage samples required "
      + "before exhaustion is predicted.";

  /**
   * <code>memory.oom.growth.threshold.percent.per.hour</code>
   */
  public static final String MEMORY_OOM_GROWTH_THRESHOLD_CONFIG = "memory.oom.growth.threshold.percent.per.hour";
  public static final double DEFAULT_MEMORY_OOM_GROWTH_THRESHOLD = 0.0;
  public static final String MEMORY_OOM_GROWTH_THRESHOLD_DOC = "The memory usage growth rate in percentage points per "
      + "hour above which (strictly) exhaustion is predicted.";

  /**
   * <code>memory.oom.confidence.threshold</code>
   */
  public static final String MEMORY_OOM_CONFIDENCE_THRESHOLD_CONFIG = "memory.oom.confidence.threshold";
  public static final double DEFAULT_MEMORY_OOM_CONFIDENCE_THRESHOLD = 0.5;
  public static final String MEMORY_OOM_CONFIDENCE_THRESHOLD_DOC = "The R-squared of the usage trend above which "
      + "(strictly) the trend is trusted for extrapolation.";

  /**
   * <code>memory.oom.risk.threshold.percent</code>
   */
  public static final String MEMORY_OOM_RISK_THRESHOLD_PERCENT_CONFIG = "memory.oom.risk.threshold.percent";
  public static final double DEFAULT_MEMORY_OOM_RISK_THRESHOLD_PERCENT = 90.0;
  public static final String MEMORY_OOM_RISK_THRESHOLD_PERCENT_DOC = "The memory usage percentage treated as exhaustion.";

  /**
   * <code>memory.oom.prediction.window.hours</code>
   */
  public static final String MEMORY_OOM_PREDICTION_WINDOW_HOURS_CONFIG = "memory.oom.prediction.window.hours";
  public static final double DEFAULT_MEMORY_OOM_PREDICTION_WINDOW_HOURS = 24.0;
  public static final String MEMORY_OOM_PREDICTION_WINDOW_HOURS_DOC = "Exhaustion is reported only if it is predicted "
      + "within this many hours.";

  /**
   * <code>memory.swap.threshold.percent</code>
   */
  public static final String MEMORY_SWAP_THRESHOLD_PERCENT_CONFIG = "memory.swap.threshold.percent";
  public static final double DEFAULT_MEMORY_SWAP_THRESHOLD_PERCENT = 10.0;
  public static final String MEMORY_SWAP_THRESHOLD_PERCENT_DOC = "The swap usage in percent above which (strictly) a "
      + "sample counts towards sustained high swap usage.";

  /**
   * <code>memory.swap.spike.multiplier</code>
   */
  public static final String MEMORY_SWAP_SPIKE_MULTIPLIER_CONFIG = "memory.swap.spike.multiplier";
  public static final double DEFAULT_MEMORY_SWAP_SPIKE_MULTIPLIER = 2.0;
  public static final String MEMORY_SWAP_SPIKE_MULTIPLIER_DOC = "A swap usage sample above this multiple of the mean "
      + "usage over the first half of the window is reported as a spike.";

  /**
   * <code>memory.swap.sustained.ratio</code>
   */
  public static final String MEMORY_SWAP_SUSTAINED_RATIO_CONFIG = "memory.swap.sustained.ratio";
  public static final double DEFAULT_MEMORY_SWAP_SUSTAINED_RATIO = 0.2;
  public static final String MEMORY_SWAP_SUSTAINED_RATIO_DOC = "The minimum fraction of the window that a run of high "
      + "swap usage must cover to be reported.";

  /**
   * <code>memory.swap.min.samples</code>
   */
  public static final String MEMORY_SWAP_MIN_SAMPLES_CONFIG = "memory.swap.min.samples";
  public static final int DEFAULT_MEMORY_SWAP_MIN_SAMPLES = 10;
  public static final String MEMORY_SWAP_MIN_SAMPLES_DOC = "The minimum number of swap usage samples required for detection.";

  private MemoryDetectionConfig() {
  }

  /**
   * Define configs for memory detection.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for memory detection.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(MEMORY_LEAK_MIN_SAMPLES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_MEMORY_LEAK_MIN_SAMPLES,
                            atLeast(2),
                            ConfigDef.Importance.MEDIUM,
                            MEMORY_LEAK_MIN_SAMPLES_DOC)
                    .define(MEMORY_LEAK_GROWTH_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_MEMORY_LEAK_GROWTH_THRESHOLD,
                            atLeast(0.0),
                            ConfigDef.Importance.HIGH,
                            MEMORY_LEAK_GROWTH_THRESHOLD_DOC)
                    .define(MEMORY_LEAK_CONFIDENCE_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_MEMORY_LEAK_CONFIDENCE_THRESHOLD,
                            between(0.0, 1.0),
                            ConfigDef.Importance.MEDIUM,
                            MEMORY_LEAK_CONFIDENCE_THRESHOLD_DOC)
                    .define(MEMORY_LEAK_CAPACITY_LIMIT_MB_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_MEMORY_LEAK_CAPACITY_LIMIT_MB,
                            greaterThan(0.0),
                            ConfigDef.Importance.MEDIUM,
                            MEMORY_LEAK_CAPACITY_LIMIT_MB_DOC)
                    .define(MEMORY_LEAK_PREDICTION_WINDOW_HOURS_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_MEMORY_LEAK_PREDICTION_WINDOW_HOURS,
                            greaterThan(0.0),
                            ConfigDef.Importance.MEDIUM,
                            MEMORY_LEAK_PREDICTION_WINDOW_HOURS_DOC)
                    .define(MEMORY_OOM_MIN_SAMPLES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_MEMORY_OOM_MIN_SAMPLES,
                            atLeast(2),
                            ConfigDef.Importance.MEDIUM,
                            MEMORY_OOM_MIN_SAMPLES_DOC)
                    .define(MEMORY_OOM_GROWTH_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_MEMORY_OOM_GROWTH_THRESHOLD,
                            atLeast(0.0),
                            ConfigDef.Importance.MEDIUM,
                            MEMORY_OOM_GROWTH_THRESHOLD_DOC)
                    .define(MEMORY_OOM_CONFIDENCE_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_MEMORY_OOM_CONFIDENCE_THRESHOLD,
                            between(0.0, 1.0),
                            ConfigDef.Importance.MEDIUM,
                            MEMORY_OOM_CONFIDENCE_THRESHOLD_DOC)
                    .define(MEMORY_OOM_RISK_THRESHOLD_PERCENT_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_MEMORY_OOM_RISK_THRESHOLD_PERCENT,
                            aboveAndAtMost(0.0, 100.0),
                            ConfigDef.Importance.HIGH,
                            MEMORY_OOM_RISK_THRESHOLD_PERCENT_DOC)
                    .define(MEMORY_OOM_PREDICTION_WINDOW_HOURS_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_MEMORY_OOM_PREDICTION_WINDOW_HOURS,
                            greaterThan(0.0),
                            ConfigDef.Importance.MEDIUM,
                            MEMORY_OOM_PREDICTION_WINDOW_HOURS_DOC)
                    .define(MEMORY_SWAP_THRESHOLD_PERCENT_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_MEMORY_SWAP_THRESHOLD_PERCENT,
                            between(0.0, 100.0),
                            ConfigDef.Importance.HIGH,
                            MEMORY_SWAP_THRESHOLD_PERCENT_DOC)
                    .define(MEMORY_SWAP_SPIKE_MULTIPLIER_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_MEMORY_SWAP_SPIKE_MULTIPLIER,
                            greaterThan(0.0),
                            ConfigDef.Importance.MEDIUM,
                            MEMORY_SWAP_SPIKE_MULTIPLIER_DOC)
                    .define(MEMORY_SWAP_SUSTAINED_RATIO_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_MEMORY_SWAP_SUSTAINED_RATIO,
                            aboveAndAtMost(0.0, 1.0),
                            ConfigDef.Importance.MEDIUM,
                            MEMORY_SWAP_SUSTAINED_RATIO_DOC)
                    .define(MEMORY_SWAP_MIN_SAMPLES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_MEMORY_SWAP_MIN_SAMPLES,
                            atLeast(2),
                            ConfigDef.Importance.LOW,
                            MEMORY_SWAP_MIN_SAMPLES_DOC);
  }
}
