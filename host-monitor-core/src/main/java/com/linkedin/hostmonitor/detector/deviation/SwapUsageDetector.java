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

import static com.linkedin.hostmonitor.config.constants.MemoryDetectionConfig.*;


/**
 * Detects swap usage that stays above a fixed percentage, and sudden swap usage spikes relative to the mean of the
 * first half of the samples.
 */
public class SwapUsageDetector extends SpikeOrSustainedDeviationDetector {
  public static final String ALGORITHM = "swap_anomaly";
  public static final String SUSTAINED_ALGORITHM = "swap_sustained_usage";
  public static final String SPIKE_ALGORITHM = "swap_spike_detection";
  public static final int MIN_RUN_LENGTH = 3;

  public SwapUsageDetector() {
    this(DEFAULT_MEMORY_SWAP_THRESHOLD_PERCENT, DEFAULT_MEMORY_SWAP_SPIKE_MULTIPLIER,
         DEFAULT_MEMORY_SWAP_SUSTAINED_RATIO, DEFAULT_MEMORY_SWAP_MIN_SAMPLES);
  }

  /**
   * @param thresholdPercent Swap usage above which samples count towards sustained usage.
   * @param spikeMultiplier A sample is a spike above this multiple of the first-half mean.
   * @param sustainedRatio Fraction of the samples a sustained run must cover.
   * @param minSamples Minimum number of samples.
   */
  public SwapUsageDetector(double thresholdPercent, double spikeMultiplier, double sustainedRatio, int minSamples) {
    super(ALGORITHM, profiles(thresholdPercent, spikeMultiplier, sustainedRatio, minSamples));
  }

  static Map<Signal, DeviationProfile> profiles(double thresholdPercent,
                                                double spikeMultiplier,
                                                double sustainedRatio,
                                                int minSamples) {
    DeviationProfile profile = new DeviationProfile.Builder("swap_percent", minSamples)
        .sustainedBeyond(AnomalyKind.SWAP_SUSTAINED_HIGH_USAGE, SUSTAINED_ALGORITHM, DeviationDirection.ABOVE,
                         thresholdPercent)
        .sustainedBaseline(BaselineMethod.MEDIAN)
        .sustainedRatio(sustainedRatio)
        .minRunLength(MIN_RUN_LENGTH)
        .spike(AnomalyKind.SWAP_SPIKE, SPIKE_ALGORITHM, BaselineMethod.FIRST_HALF_MEAN, spikeMultiplier)
        .build();
    return Collections.singletonMap(Signal.SWAP_USED_PERCENT, profile);
  }

  @Override
  public void configure(Map<String, ?> configs) {
    DetectionConfig config = new DetectionConfig(configs);
    setProfiles(profiles(config.getDouble(MEMORY_SWAP_THRESHOLD_PERCENT_CONFIG),
                         config.getDouble(MEMORY_SWAP_SPIKE_MULTIPLIER_CONFIG),
                         config.getDouble(MEMORY_SWAP_SUSTAINED_RATIO_CONFIG),
                         config.getInt(MEMORY_SWAP_MIN_SAMPLES_CONFIG)));
  }
}
