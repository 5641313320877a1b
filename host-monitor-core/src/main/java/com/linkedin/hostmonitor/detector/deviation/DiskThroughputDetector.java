/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector.deviation;

import com.linkedin.hostmonitor.config.DetectionConfig;
import com.linkedin.hostmonitor.detector.AnomalyKind;
import com.linkedin.hostmonitor.model.Signal;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.linkedin.hostmonitor.config.constants.DiskDetectionConfig.*;


/**
 * Detects read and write throughput per device that drops below a fraction of its normal level (the median of the
 * upper half) for a sustained run, and throughput spikes above a multiple of the median.
 */
public class DiskThroughputDetector extends SpikeOrSustainedDeviationDetector {
  public static final String ALGORITHM = "statistical_threshold";

  public DiskThroughputDetector() {
    this(DEFAULT_DISK_THROUGHPUT_DROP_PERCENT, DEFAULT_DISK_THROUGHPUT_SPIKE_MULTIPLIER,
         DEFAULT_DISK_THROUGHPUT_SUSTAINED_RATIO, DEFAULT_DISK_THROUGHPUT_MIN_SAMPLES,
         DEFAULT_DISK_THROUGHPUT_CONFIDENCE_THRESHOLD);
  }

  /**
   * @param dropPercent Percentage below the normal level at which throughput counts as dropped.
   * @param spikeMultiplier A sample is a spike above this multiple of the median.
   * @param sustainedRatio Fraction of the samples a drop must cover.
   * @param minSamples Minimum number of samples per device.
   * @param confidenceThreshold Events below this confidence are dropped.
   */
  public DiskThroughputDetector(double dropPercent,
                                double spikeMultiplier,
                                double sustainedRatio,
                                int minSamples,
                                double confidenceThreshold) {
    super(ALGORITHM, profiles(dropPercent, spikeMultiplier, sustainedRatio, minSamples, confidenceThreshold));
  }

  static Map<Signal, DeviationProfile> profiles(double dropPercent,
                                                double spikeMultiplier,
                                                double sustainedRatio,
                                                int minSamples,
                                                double confidenceThreshold) {
    Map<Signal, DeviationProfile> profiles = new LinkedHashMap<>();
    profiles.put(Signal.DISK_READ_BYTES,
                 profile("read", AnomalyKind.THROUGHPUT_DROP_READ, AnomalyKind.THROUGHPUT_SPIKE_READ, dropPercent,
                         spikeMultiplier, sustainedRatio, minSamples, confidenceThreshold));
    profiles.put(Signal.DISK_WRITE_BYTES,
                 profile("write", AnomalyKind.THROUGHPUT_DROP_WRITE, AnomalyKind.THROUGHPUT_SPIKE_WRITE, dropPercent,
                         spikeMultiplier, sustainedRatio, minSamples, confidenceThreshold));
    return profiles;
  }

  private static DeviationProfile profile(String ioType,
                                          AnomalyKind dropKind,
                                          AnomalyKind spikeKind,
                                          double dropPercent,
                                          double spikeMultiplier,
                                          double sustainedRatio,
                                          int minSamples,
                                          double confidenceThreshold) {
    return new DeviationProfile.Builder(ioType + "_throughput_bytes", minSamples)
        .minConfidence(confidenceThreshold)
        .entityAttribute(DiskLatencyDetector.DEVICE_ATTRIBUTE)
        .attribute(DiskLatencyDetector.IO_TYPE_ATTRIBUTE, ioType)
        .sustainedDrop(dropKind, ALGORITHM, dropPercent / 100.0)
        .sustainedBaseline(BaselineMethod.UPPER_HALF_MEDIAN)
        .sustainedRatio(sustainedRatio)
        .spike(spikeKind, ALGORITHM, BaselineMethod.MEDIAN, spikeMultiplier)
        .build();
  }

  @Override
  public void configure(Map<String, ?> configs) {
    DetectionConfig config = new DetectionConfig(configs);
    setProfiles(profiles(config.getDouble(DISK_THROUGHPUT_DROP_PERCENT_CONFIG),
                         config.getDouble(DISK_THROUGHPUT_SPIKE_MULTIPLIER_CONFIG),
                         config.getDouble(DISK_THROUGHPUT_SUSTAINED_RATIO_CONFIG),
                         config.getInt(DISK_THROUGHPUT_MIN_SAMPLES_CONFIG),
                         config.getDouble(DISK_THROUGHPUT_CONFIDENCE_THRESHOLD_CONFIG)));
  }
}
