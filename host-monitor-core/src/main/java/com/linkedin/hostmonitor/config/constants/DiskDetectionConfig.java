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
 * A class to keep disk I/O detection configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class DiskDetectionConfig {

  /**
   * <code>disk.latency.threshold.ms</code>
   */
  public static final String DISK_LATENCY_THRESHOLD_MS_CONFIG = "disk.latency.threshold.ms";
  public static final double DEFAULT_DISK_LATENCY_THRESHOLD_MS = 100.0;
  public static final String DISK_LATENCY_THRESHOLD_MS_DOC = "The absolute I/O latency in milliseconds above which a "
      + "sample counts as slow. It is also the floor of the spike limit.";

  /**
   * <code>disk.latency.spike.multiplier</code>
   */
  public static final String DISK_LATENCY_SPIKE_MULTIPLIER_CONFIG = "disk.latency.spike.multiplier";
  public static final double DEFAULT_DISK_LATENCY_SPIKE_MULTIPLIER = 3.0;
  public static final String DISK_LATENCY_SPIKE_MULTIPLIER_DOC = "A latency sample above this multiple of the calm "
      + "latency (the median of the lower half of the samples) is reported as a spike.";

  /**
   * <code>disk.latency.sustained.ratio</code>
   */
  public static final String DISK_LATENCY_SUSTAINED_RATIO_CONFIG = "disk.latency.sustained.ratio";
  public static final double DEFAULT_DISK_LATENCY_SUSTAINED_RATIO = 0.3;
  public static final String DISK_LATENCY_SUSTAINED_RATIO_DOC = "The minimum fraction of the window that a run of slow "
      + "I/O must cover to be reported.";

  /**
   * <code>disk.latency.min.samples</code>
   */
  public static final String DISK_LATENCY_MIN_SAMPLES_CONFIG = "disk.latency.min.samples";
  public static final int DEFAULT_DISK_LATENCY_MIN_SAMPLES = 10;
  public static final String DISK_LATENCY_MIN_SAMPLES_DOC = "The minimum number of latency samples of a device required "
      + "for detection.";

  /**
   * <code>disk.latency.confidence.threshold</code>
   */
  public static final String DISK_LATENCY_CONFIDENCE_THRESHOLD_CONFIG = "disk.latency.confidence.threshold";
  public static final double DEFAULT_DISK_LATENCY_CONFIDENCE_THRESHOLD = 0.7;
  public static final String DISK_LATENCY_CONFIDENCE_THRESHOLD_DOC = "Latency events with a lower confidence are dropped.";

  /**
   * <code>disk.throughput.drop.percent</code>
   */
  public static final String DISK_THROUGHPUT_DROP_PERCENT_CONFIG = "disk.throughput.drop.percent";
  public static final double DEFAULT_DISK_THROUGHPUT_DROP_PERCENT = 50.0;
  public static final String DISK_THROUGHPUT_DROP_PERCENT_DOC = "A throughput sample more than this percentage below the "
      + "normal throughput (the median of the upper half of the samples) counts towards a drop.";

  /**
   * <code>disk.throughput.spike.multiplier</code>
   */
  public static final String DISK_THROUGHPUT_SPIKE_MULTIPLIER_CONFIG = "disk.throughput.spike.multiplier";
  public static final double DEFAULT_DISK_THROUGHPUT_SPIKE_MULTIPLIER = 3.0;
  public static final String DISK_THROUGHPUT_SPIKE_MULTIPLIER_DOC = "A throughput sample above this multiple of the "
      + "median throughput is reported as a spike.";

  /**
   * <code>disk.throughput.sustained.ratio</code>
   */
  public static final String DISK_THROUGHPUT_SUSTAINED_RATIO_CONFIG = "disk.throughput.sustained.ratio";
  public static final double DEFAULT_DISK_THROUGHPUT_SUSTAINED_RATIO = 0.3;
  public static final String DISK_THROUGHPUT_SUSTAINED_RATIO_DOC = "The minimum fraction of the window that a run of "
      + "dropped throughput must cover to be reported.";

  /**
   * <code>disk.throughput.min.samples</code>
   */
  public static final String DISK_THROUGHPUT_MIN_SAMPLES_CONFIG = "disk.throughput.min.samples";
  public static final int DEFAULT_DISK_THROUGHPUT_MIN_SAMPLES = 10;
  public static final String DISK_THROUGHPUT_MIN_SAMPLES_DOC = "The minimum number of throughput samples of a device "
      + "required for detection.";

  /**
   * <code>disk.throughput.confidence.threshold</code>
   */
  public static final String DISK_THROUGHPUT_CONFIDENCE_THRESHOLD_CONFIG = "disk.throughput.confidence.threshold";
  public static final double DEFAULT_DISK_THROUGHPUT_CONFIDENCE_THRESHOLD = 0.7;
  public static final String DISK_THROUGHPUT_CONFIDENCE_THRESHOLD_DOC = "Throughput events with a lower confidence are dropped.";

  /**
   * <code>disk.queue.depth.threshold</code>
   */
  public static final String DISK_QUEUE_DEPTH_THRESHOLD_CONFIG = "disk.queue.depth.threshold";
  public static final double DEFAULT_DISK_QUEUE_DEPTH_THRESHOLD = 10.0;
  public static final String DISK_QUEUE_DEPTH_THRESHOLD_DOC = "The number of in-flight I/O requests above which "
      + "(strictly) a device counts as congested.";

  /**
   * <code>disk.queue.sustained.ratio</code>
   */
  public static final String DISK_QUEUE_SUSTAINED_RATIO_CONFIG = "disk.queue.sustained.ratio";
  public static final double DEFAULT_DISK_QUEUE_SUSTAINED_RATIO = 0.3;
  public static final String DISK_QUEUE_SUSTAINED_RATIO_DOC = "The minimum fraction of the window that a run of "
      + "congestion must cover to be reported.";

  /**
   * <code>disk.queue.min.samples</code>
   */
  public static final String DISK_QUEUE_MIN_SAMPLES_CONFIG = "disk.queue.min.samples";
  public static final int DEFAULT_DISK_QUEUE_MIN_SAMPLES = 10;
  public static final String DISK_QUEUE_MIN_SAMPLES_DOC = "The minimum number of queue depth samples of a device "
      + "required for detection.";

  /**
   * <code>disk.queue.confidence.threshold</code>
   */
  public static final String DISK_QUEUE_CONFIDENCE_THRESHOLD_CONFIG = "disk.queue.confidence.threshold";
  public static final double DEFAULT_DISK_QUEUE_CONFIDENCE_THRESHOLD = 0.7;
  public static final String DISK_QUEUE_CONFIDENCE_THRESHOLD_DOC = "Congestion events with a lower confidence are dropped.";

  private DiskDetectionConfig() {
  }

  /**
   * Define configs for disk I/O detection.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for disk I/O detection.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(DISK_LATENCY_THRESHOLD_MS_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_DISK_LATENCY_THRESHOLD_MS,
                            greaterThan(0.0),
                            ConfigDef.Importance.HIGH,
                            DISK_LATENCY_THRESHOLD_MS_DOC)
                    .define(DISK_LATENCY_SPIKE_MULTIPLIER_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_DISK_LATENCY_SPIKE_MULTIPLIER,
                            greaterThan(0.0),
                            ConfigDef.Importance.MEDIUM,
                            DISK_LATENCY_SPIKE_MULTIPLIER_DOC)
                    .define(DISK_LATENCY_SUSTAINED_RATIO_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_DISK_LATENCY_SUSTAINED_RATIO,
                            aboveAndAtMost(0.0, 1.0),
                            ConfigDef.Importance.MEDIUM,
                            DISK_LATENCY_SUSTAINED_RATIO_DOC)
                    .define(DISK_LATENCY_MIN_SAMPLES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_DISK_LATENCY_MIN_SAMPLES,
                            atLeast(2),
                            ConfigDef.Importance.LOW,
                            DISK_LATENCY_MIN_SAMPLES_DOC)
                    .define(DISK_LATENCY_CONFIDENCE_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_DISK_LATENCY_CONFIDENCE_THRESHOLD,
                            between(0.0, 1.0),
                            ConfigDef.Importance.MEDIUM,
                            DISK_LATENCY_CONFIDENCE_THRESHOLD_DOC)
                    .define(DISK_THROUGHPUT_DROP_PERCENT_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_DISK_THROUGHPUT_DROP_PERCENT,
                            aboveAndAtMost(0.0, 100.0),
                            ConfigDef.Importance.HIGH,
                            DISK_THROUGHPUT_DROP_PERCENT_DOC)
                    .define(DISK_THROUGHPUT_SPIKE_MULTIPLIER_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_DISK_THROUGHPUT_SPIKE_MULTIPLIER,
                            greaterThan(0.0),
                            ConfigDef.Importance.MEDIUM,
                            DISK_THROUGHPUT_SPIKE_MULTIPLIER_DOC)
                    .define(DISK_THROUGHPUT_SUSTAINED_RATIO_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_DISK_THROUGHPUT_SUSTAINED_RATIO,
                            aboveAndAtMost(0.0, 1.0),
                            ConfigDef.Importance.MEDIUM,
                            DISK_THROUGHPUT_SUSTAINED_RATIO_DOC)
                    .define(DISK_THROUGHPUT_MIN_SAMPLES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_DISK_THROUGHPUT_MIN_SAMPLES,
                            atLeast(2),
                            ConfigDef.Importance.LOW,
                            DISK_THROUGHPUT_MIN_SAMPLES_DOC)
                    .define(DISK_THROUGHPUT_CONFIDENCE_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_DISK_THROUGHPUT_CONFIDENCE_THRESHOLD,
                            between(0.0, 1.0),
                            ConfigDef.Importance.MEDIUM,
                            DISK_THROUGHPUT_CONFIDENCE_THRESHOLD_DOC)
                    .define(DISK_QUEUE_DEPTH_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_DISK_QUEUE_DEPTH_THRESHOLD,
                            greaterThan(0.0),
                            ConfigDef.Importance.HIGH,
                            DISK_QUEUE_DEPTH_THRESHOLD_DOC)
                    .define(DISK_QUEUE_SUSTAINED_RATIO_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_DISK_QUEUE_SUSTAINED_RATIO,
                            aboveAndAtMost(0.0, 1.0),
                            ConfigDef.Importance.MEDIUM,
                            DISK_QUEUE_SUSTAINED_RATIO_DOC)
                    .define(DISK_QUEUE_MIN_SAMPLES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_DISK_QUEUE_MIN_SAMPLES,
                            atLeast(2),
                            ConfigDef.Importance.LOW,
                            DISK_QUEUE_MIN_SAMPLES_DOC)
                    .define(DISK_QUEUE_CONFIDENCE_THRESHOLD_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_DISK_QUEUE_CONFIDENCE_THRESHOLD,
                            between(0.0, 1.0),
                            ConfigDef.Importance.MEDIUM,
                            DISK_QUEUE_CONFIDENCE_THRESHOLD_DOC);
  }
}
