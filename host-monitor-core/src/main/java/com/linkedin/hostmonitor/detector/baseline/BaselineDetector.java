/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector.baseline;

import com.linkedin.hostmonitor.config.DetectionConfig;
import com.linkedin.hostmonitor.detector.AnomalyDetector;
import com.linkedin.hostmonitor.detector.AnomalyEvent;
import com.linkedin.hostmonitor.detector.AnomalyKind;
import com.linkedin.hostmonitor.model.Sample;
import com.linkedin.hostmonitor.model.Samples;
import com.linkedin.hostmonitor.model.Signal;
import com.linkedin.hostmonitor.stats.Baseline;
import com.linkedin.hostmonitor.stats.BaselineStatistics;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.hostmonitor.config.constants.CpuDetectionConfig.CPU_BASELINE_STD_MULTIPLIER_CONFIG;
import static com.linkedin.hostmonitor.config.constants.CpuDetectionConfig.CPU_BASELINE_WINDOW_DAYS_CONFIG;
import static com.linkedin.hostmonitor.config.constants.CpuDetectionConfig.DEFAULT_CPU_BASELINE_STD_MULTIPLIER;
import static com.linkedin.hostmonitor.config.constants.CpuDetectionConfig.DEFAULT_CPU_BASELINE_WINDOW_DAYS;
import static com.linkedin.hostmonitor.detector.AnomalyScoring.zScoreConfidence;
import static com.linkedin.hostmonitor.detector.AnomalyScoring.zScoreSeverity;


/**
 * Detects samples that exceed an adaptive limit derived from history.
 * <p>
 * The first 90% of the samples form the historical window from which a {@link Baseline} is computed; each sample of the
 * remaining 10% above {@code mean + stdDev * stdMultiplier} is reported as its own event. At least
 * {@link #MIN_HISTORICAL_SAMPLES} historical samples are required. The baseline is recomputed from scratch on every
 * call and the latest one is exposed through {@link #baseline()}.
 */
public class BaselineDetector implements AnomalyDetector {
  private static final Logger LOG = LoggerFactory.getLogger(BaselineDetector.class);
  public static final String ALGORITHM = "dynamic_baseline";
  public static final int MIN_HISTORICAL_SAMPLES = 10;
  public static final double HISTORICAL_FRACTION = 0.9;
  private final Signal _signal;
  private final AnomalyKind _kind;
  private double _stdMultiplier;
  private int _windowDays;
  private volatile Baseline _baseline;

  /**
   * A CPU baseline detector with default parameters, to be configured by {@link #configure(Map)}.
   */
  public BaselineDetector() {
    this(Signal.CPU_PERCENT, AnomalyKind.HIGH_CPU, DEFAULT_CPU_BASELINE_STD_MULTIPLIER, DEFAULT_CPU_BASELINE_WINDOW_DAYS);
  }

  /**
   * @param signal The signal to read.
   * @param kind The kind of events to report.
   * @param stdMultiplier Number of standard deviations above the mean at which a sample is anomalous.
   * @param windowDays Days of history the caller retains for the baseline; reported with the baseline only.
   */
  public BaselineDetector(Signal signal, AnomalyKind kind, double stdMultiplier, int windowDays) {
    _signal = signal;
    _kind = kind;
    _stdMultiplier = stdMultiplier;
    _windowDays = windowDays;
    _baseline = null;
  }

  @Override
  public void configure(Map<String, ?> configs) {
    DetectionConfig config = new DetectionConfig(configs);
    _stdMultiplier = config.getDouble(CPU_BASELINE_STD_MULTIPLIER_CONFIG);
    _windowDays = config.getInt(CPU_BASELINE_WINDOW_DAYS_CONFIG);
  }

  /**
   * @return The baseline computed by the latest call that had enough history, or {@code null}.
   */
  public Baseline baseline() {
    return _baseline;
  }

  public int windowDays() {
    return _windowDays;
  }

  @Override
  public String algorithm() {
    return ALGORITHM;
  }

  @Override
  public Set<Signal> signals() {
    return Collections.singleton(_signal);
  }

  @Override
  public List<AnomalyEvent> detect(Map<Signal, List<Sample>> samplesBySignal) {
    return detect(samplesBySignal.getOrDefault(_signal, Collections.emptyList()));
  }

  /**
   * @param samples Samples of the signal, sorted ascending by time.
   * @return One event per anomalous test sample, in time order.
   */
  public List<AnomalyEvent> detect(List<Sample> samples) {
    List<Sample> sorted = Samples.finiteSortedByTime(samples);
    int split = (int) (sorted.size() * HISTORICAL_FRACTION);
    if (split < MIN_HISTORICAL_SAMPLES) {
      LOG.debug("Skipping {} baseline detection with only {} historical samples.", _signal, split);
      return Collections.emptyList();
    }
    Baseline baseline = BaselineStatistics.baselineOf(sorted.subList(0, split));
    _baseline = baseline;
    double threshold = baseline.threshold(_stdMultiplier);
    String label = _signal.toString();

    List<AnomalyEvent> events = new ArrayList<>();
    for (Sample sample : sorted.subList(split, sorted.size())) {
      if (sample.value() <= threshold) {
        continue;
      }
      double zScore = baseline.zScore(sample.value());
      events.add(new AnomalyEvent.Builder(_kind, ALGORITHM, sample.timeMs())
                     .endTimeMs(sample.timeMs())
                     .severity(zScoreSeverity(zScore))
                     .confidence(zScoreConfidence(zScore))
                     .baseline(baseline.mean())
                     .entity(sample.entityKey())
                     .metric("avg_" + label, sample.value())
                     .metric("baseline_" + label, baseline.mean())
                     .metric("threshold_" + label, threshold)
                     .metric("z_score", zScore)
                     .build());
    }
    return events;
  }
}
