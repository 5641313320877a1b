/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector.trend;

import com.linkedin.hostmonitor.config.DetectionConfig;
import com.linkedin.hostmonitor.detector.AnomalyKind;
import com.linkedin.hostmonitor.model.Signal;
import java.util.Map;

import static com.linkedin.hostmonitor.config.constants.MemoryDetectionConfig.*;


/**
 * Predicts system-wide memory exhaustion: the time at which the memory usage percentage reaches the risk threshold.
 */
public class OomRiskDetector extends TrendExtrapolationDetector {
  public static final String ALGORITHM = "oom_risk_prediction";

  public OomRiskDetector() {
    this(DEFAULT_MEMORY_OOM_MIN_SAMPLES, DEFAULT_MEMORY_OOM_GROWTH_THRESHOLD, DEFAULT_MEMORY_OOM_CONFIDENCE_THRESHOLD,
         DEFAULT_MEMORY_OOM_RISK_THRESHOLD_PERCENT, DEFAULT_MEMORY_OOM_PREDICTION_WINDOW_HOURS);
  }

  public OomRiskDetector(int minSamples,
                         double growthThresholdPercentPerHour,
                         double confidenceThreshold,
                         double riskThresholdPercent,
                         double predictionWindowHours) {
    super(Signal.MEMORY_USED_PERCENT, AnomalyKind.OOM_RISK, ALGORITHM, false, minSamples, growthThresholdPercentPerHour,
          confidenceThreshold, riskThresholdPercent, predictionWindowHours);
  }

  @Override
  public void configure(Map<String, ?> configs) {
    DetectionConfig config = new DetectionConfig(configs);
    setParameters(config.getInt(MEMORY_OOM_MIN_SAMPLES_CONFIG),
                  config.getDouble(MEMORY_OOM_GROWTH_THRESHOLD_CONFIG),
                  config.getDouble(MEMORY_OOM_CONFIDENCE_THRESHOLD_CONFIG),
                  config.getDouble(MEMORY_OOM_RISK_THRESHOLD_PERCENT_CONFIG),
                  config.getDouble(MEMORY_OOM_PREDICTION_WINDOW_HOURS_CONFIG));
  }
}
