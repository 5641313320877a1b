/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent.config.constants;

import com.linkedin.hostmonitor.common.config.ConfigDef;
import com.linkedin.hostmonitor.detector.baseline.BaselineDetector;
import com.linkedin.hostmonitor.detector.deviation.DiskLatencyDetector;
import com.linkedin.hostmonitor.detector.deviation.DiskThroughputDetector;
import com.linkedin.hostmonitor.detector.deviation.QueueDepthDetector;
import com.linkedin.hostmonitor.detector.deviation.SwapUsageDetector;
import com.linkedin.hostmonitor.detector.process.DescriptorLeakDetector;
import com.linkedin.hostmonitor.detector.process.ProcessCrashDetector;
import com.linkedin.hostmonitor.detector.process.ZombieProcessDetector;
import com.linkedin.hostmonitor.detector.threshold.ThresholdCrossingDetector;
import com.linkedin.hostmonitor.detector.trend.MemoryLeakDetector;
import com.linkedin.hostmonitor.detector.trend.OomRiskDetector;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;

import static com.linkedin.hostmonitor.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.hostmonitor.common.config.ConfigDef.Range.greaterThan;


/**
 * A class to keep the configs of the sampling and detection loops of the host monitor agent.
 */
public final class MonitorConfig {
  public static final String TABLE_FORMAT = "table";
  public static final String JSON_FORMAT = "json";
  public static final String STRUCTURED_TEXT_FORMAT = "structured-text";

  /**
   * <code>sample.collector.class</code>
   */
  public static final String SAMPLE_COLLECTOR_CLASS_CONFIG = "sample.collector.class";
  public static final String DEFAULT_SAMPLE_COLLECTOR_CLASS = null;
  public static final String SAMPLE_COLLECTOR_CLASS_DOC = "The class implementing SampleCollector that reads the "
      + "operating-system counters of one tick.";

  /**
   * <code>cpu.sampling.interval.ms</code>
   */
  public static final String CPU_SAMPLING_INTERVAL_MS_CONFIG = "cpu.sampling.interval.ms";
  public static final long DEFAULT_CPU_SAMPLING_INTERVAL_MS = TimeUnit.SECONDS.toMillis(1);
  public static final String CPU_SAMPLING_INTERVAL_MS_DOC = "The interval in milliseconds between two ticks of the CPU "
      + "detection loop.";

  /**
   * <code>memory.sampling.interval.ms</code>
   */
  public static final String MEMORY_SAMPLING_INTERVAL_MS_CONFIG = "memory.sampling.interval.ms";
  public static final long DEFAULT_MEMORY_SAMPLING_INTERVAL_MS = TimeUnit.SECONDS.toMillis(1);
  public static final String MEMORY_SAMPLING_INTERVAL_MS_DOC = "The interval in milliseconds between two ticks of the "
      + "memory detection loop.";

  /**
   * <code>disk.sampling.interval.ms</code>
   */
  public static final String DISK_SAMPLING_INTERVAL_MS_CONFIG = "disk.sampling.interval.ms";
  public static final long DEFAULT_DISK_SAMPLING_INTERVAL_MS = TimeUnit.SECONDS.toMillis(5);
  public static final String DISK_SAMPLING_INTERVAL_MS_DOC = "The interval in milliseconds between two ticks of the disk "
      + "detection loop.";

  /**
   * <code>process.sampling.interval.ms</code>
   */
  public static final String PROCESS_SAMPLING_INTERVAL_MS_CONFIG = "process.sampling.interval.ms";
  public static final long DEFAULT_PROCESS_SAMPLING_INTERVAL_MS = TimeUnit.SECONDS.toMillis(5);
  public static final String PROCESS_SAMPLING_INTERVAL_MS_DOC = "The interval in milliseconds between two ticks of the "
      + "process detection loop.";

  /**
   * <code>collection.timeout.ms</code>
   */
  public static final String COLLECTION_TIMEOUT_MS_CONFIG = "collection.timeout.ms";
  public static final long DEFAULT_COLLECTION_TIMEOUT_MS = 800L;
  public static final String COLLECTION_TIMEOUT_MS_DOC = "The maximum time in milliseconds a single collection may take. "
      + "A tick whose collection does not complete in time is skipped.";

  /**
   * <code>sample.buffer.capacity.per.entity</code>
   */
  public static final String SAMPLE_BUFFER_CAPACITY_PER_ENTITY_CONFIG = "sample.buffer.capacity.per.entity";
  public static final int DEFAULT_SAMPLE_BUFFER_CAPACITY_PER_ENTITY = 3600;
  public static final String SAMPLE_BUFFER_CAPACITY_PER_ENTITY_DOC = "The maximum number of samples buffered per "
      + "signal and entity, e.g. per process or per disk device. The oldest samples of the entity are evicted first.";

  /**
   * <code>sample.buffer.retention.ms</code>
   */
  public static final String SAMPLE_BUFFER_RETENTION_MS_CONFIG = "sample.buffer.retention.ms";
  public static final long DEFAULT_SAMPLE_BUFFER_RETENTION_MS = TimeUnit.HOURS.toMillis(1);
  public static final String SAMPLE_BUFFER_RETENTION_MS_DOC = "Samples older than this many milliseconds before the newest "
      + "buffered sample of their signal are evicted.";

  /**
   * <code>emitted.event.cache.size</code>
   */
  public static final String EMITTED_EVENT_CACHE_SIZE_CONFIG = "emitted.event.cache.size";
  public static final int DEFAULT_EMITTED_EVENT_CACHE_SIZE = 10000;
  public static final String EMITTED_EVENT_CACHE_SIZE_DOC = "The number of recently emitted events remembered per detection "
      + "loop, so that an anomaly detected again over the buffered window is reported once.";

  /**
   * <code>output.format</code>
   */
  public static final String OUTPUT_FORMAT_CONFIG = "output.format";
  public static final String DEFAULT_OUTPUT_FORMAT = TABLE_FORMAT;
  public static final String OUTPUT_FORMAT_DOC = "The format anomaly events are rendered in: " + TABLE_FORMAT + ", "
      + JSON_FORMAT + " or " + STRUCTURED_TEXT_FORMAT + ".";

  /**
   * <code>output.file</code>
   */
  public static final String OUTPUT_FILE_CONFIG = "output.file";
  public static final String DEFAULT_OUTPUT_FILE = "";
  public static final String OUTPUT_FILE_DOC = "The file rendered anomaly events are appended to. Events are printed to "
      + "the standard output if empty.";

  /**
   * <code>cpu.detector.classes</code>
   */
  public static final String CPU_DETECTOR_CLASSES_CONFIG = "cpu.detector.classes";
  public static final String DEFAULT_CPU_DETECTOR_CLASSES = classNames(ThresholdCrossingDetector.class,
                                                                       BaselineDetector.class);
  public static final String CPU_DETECTOR_CLASSES_DOC = "The detector classes run by the CPU detection loop.";

  /**
   * <code>memory.detector.classes</code>
   */
  public static final String MEMORY_DETECTOR_CLASSES_CONFIG = "memory.detector.classes";
  public static final String DEFAULT_MEMORY_DETECTOR_CLASSES = classNames(MemoryLeakDetector.class, OomRiskDetector.class,
                                                                          SwapUsageDetector.class);
  public static final String MEMORY_DETECTOR_CLASSES_DOC = "The detector classes run by the memory detection loop.";

  /**
   * <code>disk.detector.classes</code>
   */
  public static final String DISK_DETECTOR_CLASSES_CONFIG = "disk.detector.classes";
  public static final String DEFAULT_DISK_DETECTOR_CLASSES = classNames(DiskLatencyDetector.class,
                                                                        DiskThroughputDetector.class,
                                                                        QueueDepthDetector.class);
  public static final String DISK_DETECTOR_CLASSES_DOC = "The detector classes run by the disk detection loop.";

  /**
   * <code>process.detector.classes</code>
   */
  public static final String PROCESS_DETECTOR_CLASSES_CONFIG = "process.detector.classes";
  public static final String DEFAULT_PROCESS_DETECTOR_CLASSES = classNames(ProcessCrashDetector.class,
                                                                           DescriptorLeakDetector.class,
                                                                           ZombieProcessDetector.class);
  public static final String PROCESS_DETECTOR_CLASSES_DOC = "The detector classes run by the process detection loop. "
      + "History-carrying detectors receive the samples of the current tick only, the others the buffered samples.";

  private MonitorConfig() {
  }

  private static String classNames(Class<?>... classes) {
    StringJoiner joiner = new StringJoiner(",");
    for (Class<?> klass : classes) {
      joiner.add(klass.getName());
    }
    return joiner.toString();
  }

  /**
   * Define configs for the agent.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the agent.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(SAMPLE_COLLECTOR_CLASS_CONFIG,
                            ConfigDef.Type.CLASS,
                            DEFAULT_SAMPLE_COLLECTOR_CLASS,
                            ConfigDef.Importance.HIGH,
                            SAMPLE_COLLECTOR_CLASS_DOC)
                    .define(CPU_SAMPLING_INTERVAL_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_CPU_SAMPLING_INTERVAL_MS,
                            greaterThan(0),
                            ConfigDef.Importance.HIGH,
                            CPU_SAMPLING_INTERVAL_MS_DOC)
                    .define(MEMORY_SAMPLING_INTERVAL_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_MEMORY_SAMPLING_INTERVAL_MS,
                            greaterThan(0),
                            ConfigDef.Importance.HIGH,
                            MEMORY_SAMPLING_INTERVAL_MS_DOC)
                    .define(DISK_SAMPLING_INTERVAL_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_DISK_SAMPLING_INTERVAL_MS,
                            greaterThan(0),
                            ConfigDef.Importance.HIGH,
                            DISK_SAMPLING_INTERVAL_MS_DOC)
                    .define(PROCESS_SAMPLING_INTERVAL_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_PROCESS_SAMPLING_INTERVAL_MS,
                            greaterThan(0),
                            ConfigDef.Importance.HIGH,
                            PROCESS_SAMPLING_INTERVAL_MS_DOC)
                    .define(COLLECTION_TIMEOUT_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_COLLECTION_TIMEOUT_MS,
                            greaterThan(0),
                            ConfigDef.Importance.MEDIUM,
                            COLLECTION_TIMEOUT_MS_DOC)
                    .define(SAMPLE_BUFFER_CAPACITY_PER_ENTITY_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_SAMPLE_BUFFER_CAPACITY_PER_ENTITY,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            SAMPLE_BUFFER_CAPACITY_PER_ENTITY_DOC)
                    .define(SAMPLE_BUFFER_RETENTION_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_SAMPLE_BUFFER_RETENTION_MS,
                            greaterThan(0),
                            ConfigDef.Importance.MEDIUM,
                            SAMPLE_BUFFER_RETENTION_MS_DOC)
                    .define(EMITTED_EVENT_CACHE_SIZE_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_EMITTED_EVENT_CACHE_SIZE,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            EMITTED_EVENT_CACHE_SIZE_DOC)
                    .define(OUTPUT_FORMAT_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_OUTPUT_FORMAT,
                            ConfigDef.ValidString.in(TABLE_FORMAT, JSON_FORMAT, STRUCTURED_TEXT_FORMAT),
                            ConfigDef.Importance.MEDIUM,
                            OUTPUT_FORMAT_DOC)
                    .define(OUTPUT_FILE_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_OUTPUT_FILE,
                            ConfigDef.Importance.MEDIUM,
                            OUTPUT_FILE_DOC)
                    .define(CPU_DETECTOR_CLASSES_CONFIG,
                            ConfigDef.Type.LIST,
                            DEFAULT_CPU_DETECTOR_CLASSES,
                            ConfigDef.Importance.MEDIUM,
                            CPU_DETECTOR_CLASSES_DOC)
                    .define(MEMORY_DETECTOR_CLASSES_CONFIG,
                            ConfigDef.Type.LIST,
                            DEFAULT_MEMORY_DETECTOR_CLASSES,
                            ConfigDef.Importance.MEDIUM,
                            MEMORY_DETECTOR_CLASSES_DOC)
                    .define(DISK_DETECTOR_CLASSES_CONFIG,
                            ConfigDef.Type.LIST,
                            DEFAULT_DISK_DETECTOR_CLASSES,
                            ConfigDef.Importance.MEDIUM,
                            DISK_DETECTOR_CLASSES_DOC)
                    .define(PROCESS_DETECTOR_CLASSES_CONFIG,
                            ConfigDef.Type.LIST,
                            DEFAULT_PROCESS_DETECTOR_CLASSES,
                            ConfigDef.Importance.MEDIUM,
                            PROCESS_DETECTOR_CLASSES_DOC);
  }
}
