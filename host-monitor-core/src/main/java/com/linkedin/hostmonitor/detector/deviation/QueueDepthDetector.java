/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector.deviation;

import com.linkedin.hostmonitor.config.DetectionConfig;
import com.linkedin.hostmonitor.detector.AnomalyKind;
import com.linkedin.hostmonitor.detector.DeviationDirection;
import com.linkedin.hostmonitor.model.Signal;
import java.util.Collections;
import java.util.Map;

import static com.linkedin.hostmonitor.config.constants.DiskDetectionConfig.*;


/**
 * Detects devices whose number of in-flight I/O requests stays above a fixed depth.
 */
public class QueueDepthDetector extends SpikeOrSustainedDeviationDetector {
  public static final String ALGORITHM = "threshold_sustained";

  public QueueDepthDetector() {
    this(DEFAULT_DISK_QUEUE_DEPTH_THRESHOLD, DEFAULT_DISK_QUEUE_SUSTAINED_RATIO, DEFAULT_DISK_QUEUE_MIN_SAMPLES,
         DEFAULT_DISK_QUEUE_CONFIDENCE_THRESHOLD);
  }

  public QueueDepthDetector(double depthThreshold, double sustainedRatio, int minSamples, double confidenceThreshold) {
    super(ALGORITHM, profiles(depthThreshold, sustainedRatio, minSamples, confidenceThreshold));
  }

  static Map<Signal, DeviationProfile> profiles(double depthThreshold,
                                                double sustainedRatio,
                                                int minSamples,
                                                double confidenceThreshold) {
    DeviationProfile profile = new DeviationProfile.Builder("queue_depth", minSamples)
        .minConfidence(confidenceThreshold)
        .entityAttribute(DiskLatencyDetector.DEVICE_ATTRIBUTE)
        .sustainedBeyond(AnomalyKind.IO_QUEUE_CONGESTION, ALGORITHM, DeviationDirection.ABOVE, depthThreshold)
        .sustainedBaseline(BaselineMethod.MEDIAN)
        .sustainedRatio(sustainedRatio)
        .build();
    return Collections.singletonMap(Signal.DISK_IO_IN_PROGRESS, profile);
  }

  @Override
  public void configure(Map<String, ?> configs) {
    DetectionConfig config = new DetectionConfig(configs);
    setProfiles(profiles(config.getDouble(DISK_QUEUE_DEPTH_THRESHOLD_CONFIG),
                         config.getDouble(DISK_QUEUE_SUSTAINED_RATIO_CONFIG),
                         config.getInt(DISK_QUEUE_MIN_SAMPLES_CONFIG),
                         config.getDouble(DISK_QUEUE_CONFIDENCE_THRESHOLD_CONFIG)));
  }
}
