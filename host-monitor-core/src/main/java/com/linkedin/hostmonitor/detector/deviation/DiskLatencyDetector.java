/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector.deviation;

import com.linkedin.hostmonitor.config.DetectionConfig;
import com.linkedin.hostmonitor.detector.AnomalyKind;
import com.linkedin.hostmonitor.detector.DeviationDirection;
import com.linkedin.hostmonitor.model.Signal;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.linkedin.hostmonitor.config.constants.DiskDetectionConfig.*;


/**
 * Detects read and write latency spikes per device, relative to the calm level (the median of the lower half) of the
 * device, and latency that stays above a fixed limit.
 */
public class DiskLatencyDetector extends SpikeOrSustainedDeviationDetector {
  public static final String ALGORITHM = "threshold_statistical";
  public static final String DEVICE_ATTRIBUTE = "device";
  public static final String IO_TYPE_ATTRIBUTE = "io_type";

  public DiskLatencyDetector() {
    this(DEFAULT_DISK_LATENCY_THRESHOLD_MS, DEFAULT_DISK_LATENCY_SPIKE_MULTIPLIER, DEFAULT_DISK_LATENCY_SUSTAINED_RATIO,
         DEFAULT_DISK_LATENCY_MIN_SAMPLES, DEFAULT_DISK_LATENCY_CONFIDENCE_THRESHOLD);
  }

  /**
   * @param thresholdMs Latency above which samples count towards sustained latency; also the lowest spike limit.
   * @param spikeMultiplier A sample is a spike above this multiple of the calm latency.
   * @param sustainedRatio Fraction of the samples a sustained run must cover.
   * @param minSamples Minimum number of samples per device.
   * @param confidenceThreshold Events below this confidence are dropped.
   */
  public DiskLatencyDetector(double thresholdMs,
                             double spikeMultiplier,
                             double sustainedRatio,
                             int minSamples,
                             double confidenceThreshold) {
    super(ALGORITHM, profiles(thresholdMs, spikeMultiplier, sustainedRatio, minSamples, confidenceThreshold));
  }

  static Map<Signal, DeviationProfile> profiles(double thresholdMs,
                                                double spikeMultiplier,
                                                double sustainedRatio,
                                                int minSamples,
                                                double confidenceThreshold) {
    Map<Signal, DeviationProfile> profiles = new LinkedHashMap<>();
    profiles.put(Signal.DISK_READ_LATENCY_MS,
                 profile("read", AnomalyKind.IO_LATENCY_SUSTAINED_READ, AnomalyKind.IO_LATENCY_SPIKE_READ, thresholdMs,
                         spikeMultiplier, sustainedRatio, minSamples, confidenceThreshold));
    profiles.put(Signal.DISK_WRITE_LATENCY_MS,
                 profile("write", AnomalyKind.IO_LATENCY_SUSTAINED_WRITE, AnomalyKind.IO_LATENCY_SPIKE_WRITE, thresholdMs,
                         spikeMultiplier, sustainedRatio, minSamples, confidenceThreshold));
    return profiles;
  }

  private static DeviationProfile profile(String ioType,
                                          AnomalyKind sustainedKind,
                                          AnomalyKind spikeKind,
                                          double thresholdMs,
                                          double spikeMultiplier,
                                          double sustainedRatio,
                                          int minSamples,
                                          double confidenceThreshold) {
    return new DeviationProfile.Builder(ioType + "_latency_ms", minSamples)
        .minConfidence(confidenceThreshold)
        .entityAttribute(DEVICE_ATTRIBUTE)
        .attribute(IO_TYPE_ATTRIBUTE, ioType)
        .sustainedBeyond(sustainedKind, ALGORITHM, DeviationDirection.ABOVE, thresholdMs)
        .sustainedBaseline(BaselineMethod.LOWER_HALF_MEDIAN)
        .sustainedRatio(sustainedRatio)
        .spike(spikeKind, ALGORITHM, BaselineMethod.LOWER_HALF_MEDIAN, spikeMultiplier)
        .spikeFloor(thresholdMs)
        .build();
  }

  @Override
  public void configure(Map<String, ?> configs) {
    DetectionConfig config = new DetectionConfig(configs);
    setProfiles(profiles(config.getDouble(DISK_LATENCY_THRESHOLD_MS_CONFIG),
                         config.getDouble(DISK_LATENCY_SPIKE_MULTIPLIER_CONFIG),
                         config.getDouble(DISK_LATENCY_SUSTAINED_RATIO_CONFIG),
                         config.getInt(DISK_LATENCY_MIN_SAMPLES_CONFIG),
                         config.getDouble(DISK_LATENCY_CONFIDENCE_THRESHOLD_CONFIG)));
  }
}
