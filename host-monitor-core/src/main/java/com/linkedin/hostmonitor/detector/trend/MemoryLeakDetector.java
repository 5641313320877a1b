/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector.trend;

import com.linkedin.hostmonitor.config.DetectionConfig;
import com.linkedin.hostmonitor.detector.AnomalyKind;
import com.linkedin.hostmonitor.detector.EntityMetadataProvider;
import com.linkedin.hostmonitor.model.Signal;
import java.util.Map;

import static com.linkedin.hostmonitor.config.DetectionConfig.ENTITY_METADATA_PROVIDER_OBJECT_CONFIG;
import static com.linkedin.hostmonitor.config.constants.MemoryDetectionConfig.*;


/**
 * Flags processes whose resident size grows steadily towards an assumed per-process ceiling. One trend is fitted per
 * process (entity key = pid).
 */
public class MemoryLeakDetector extends TrendExtrapolationDetector {
  public static final String ALGORITHM = "memory_leak_linear_regression";

  public MemoryLeakDetector() {
    this(DEFAULT_MEMORY_LEAK_MIN_SAMPLES, DEFAULT_MEMORY_LEAK_GROWTH_THRESHOLD, DEFAULT_MEMORY_LEAK_CONFIDENCE_THRESHOLD,
         DEFAULT_MEMORY_LEAK_CAPACITY_LIMIT_MB, DEFAULT_MEMORY_LEAK_PREDICTION_WINDOW_HOURS);
  }

  public MemoryLeakDetector(int minSamples,
                            double growthThresholdMbPerHour,
                            double confidenceThreshold,
                            double capacityLimitMb,
                            double predictionWindowHours) {
    super(Signal.PROCESS_RSS_MB, AnomalyKind.MEMORY_LEAK, ALGORITHM, true, minSamples, growthThresholdMbPerHour,
          confidenceThreshold, capacityLimitMb, predictionWindowHours);
  }

  @Override
  public void configure(Map<String, ?> configs) {
    DetectionConfig config = new DetectionConfig(configs);
    setParameters(config.getInt(MEMORY_LEAK_MIN_SAMPLES_CONFIG),
                  config.getDouble(MEMORY_LEAK_GROWTH_THRESHOLD_CONFIG),
                  config.getDouble(MEMORY_LEAK_CONFIDENCE_THRESHOLD_CONFIG),
                  config.getDouble(MEMORY_LEAK_CAPACITY_LIMIT_MB_CONFIG),
                  config.getDouble(MEMORY_LEAK_PREDICTION_WINDOW_HOURS_CONFIG));
    Object metadataProvider = configs.get(ENTITY_METADATA_PROVIDER_OBJECT_CONFIG);
    if (metadataProvider instanceof EntityMetadataProvider) {
      setMetadataProvider((EntityMetadataProvider) metadataProvider);
    }
  }
}
