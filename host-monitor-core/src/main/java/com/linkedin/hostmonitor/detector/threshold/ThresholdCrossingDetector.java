/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector.threshold;

import com.linkedin.hostmonitor.config.DetectionConfig;
import com.linkedin.hostmonitor.detector.AnomalyDetector;
import com.linkedin.hostmonitor.detector.AnomalyEvent;
import com.linkedin.hostmonitor.detector.AnomalyKind;
import com.linkedin.hostmonitor.model.Sample;
import com.linkedin.hostmonitor.model.Samples;
import com.linkedin.hostmonitor.model.Signal;
import com.linkedin.hostmonitor.stats.BaselineStatistics;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.hostmonitor.HostMonitorUtils.elapsedSeconds;
import static com.linkedin.hostmonitor.config.constants.CpuDetectionConfig.CPU_THRESHOLD_CONSECUTIVE_PERIODS_CONFIG;
import static com.linkedin.hostmonitor.config.constants.CpuDetectionConfig.CPU_THRESHOLD_DURATION_SECONDS_CONFIG;
import static com.linkedin.hostmonitor.config.constants.CpuDetectionConfig.CPU_THRESHOLD_PERCENT_CONFIG;
import static com.linkedin.hostmonitor.config.constants.CpuDetectionConfig.DEFAULT_CPU_THRESHOLD_CONSECUTIVE_PERIODS;
import static com.linkedin.hostmonitor.config.constants.CpuDetectionConfig.DEFAULT_CPU_THRESHOLD_DURATION_SECONDS;
import static com.linkedin.hostmonitor.config.constants.CpuDetectionConfig.DEFAULT_CPU_THRESHOLD_PERCENT;
import static com.linkedin.hostmonitor.detector.AnomalyScoring.levelSeverity;
import static com.linkedin.hostmonitor.detector.AnomalyScoring.thresholdConfidence;


/**
 * Detects windows in which a signal stays above a static threshold, with hysteresis on both edges.
 * <ul>
 *   <li>A window opens once {@code consecutivePeriods} consecutive samples are strictly above the threshold, and starts
 *   at the first of them.</li>
 *   <li>An open window tolerates samples at or below the threshold, and closes only after {@code consecutivePeriods}
 *   consecutive such samples. It then ends at the last sample that was above the threshold.</li>
 *   <li>A window still open at the end of the input is closed at its last above-threshold sample and reported, so that
 *   each call returns a bounded list of completed events.</li>
 *   <li>A closed window is reported if its duration in seconds or its sample count reaches
 *   {@code min(minDurationSeconds, consecutivePeriods)}.</li>
 * </ul>
 */
public class ThresholdCrossingDetector implements AnomalyDetector {
  private static final Logger LOG = LoggerFactory.getLogger(ThresholdCrossingDetector.class);
  public static final String ALGORITHM = "static_threshold";
  private final Signal _signal;
  private final AnomalyKind _kind;
  private double _threshold;
  private int _consecutivePeriods;
  private long _minDurationSeconds;

  /**
   * A high CPU detector with default parameters, to be configured by {@link #configure(Map)}.
   */
  public ThresholdCrossingDetector() {
    this(Signal.CPU_PERCENT, AnomalyKind.HIGH_CPU, DEFAULT_CPU_THRESHOLD_PERCENT, DEFAULT_CPU_THRESHOLD_CONSECUTIVE_PERIODS,
         DEFAULT_CPU_THRESHOLD_DURATION_SECONDS);
  }

  /**
   * @param signal The signal to read.
   * @param kind The kind of events to report.
   * @param threshold The value a sample must strictly exceed to count as above.
   * @param consecutivePeriods The number of consecutive samples that open and close a window.
   * @param minDurationSeconds The nominal minimum duration of a reported window.
   */
  public ThresholdCrossingDetector(Signal signal, AnomalyKind kind, double threshold, int consecutivePeriods,
                                   long minDurationSeconds) {
    _signal = signal;
    _kind = kind;
    setParameters(threshold, consecutivePeriods, minDurationSeconds);
  }

  private void setParameters(double threshold, int consecutivePeriods, long minDurationSeconds) {
    if (consecutivePeriods < 1) {
      throw new IllegalArgumentException("Consecutive periods must be positive, but was " + consecutivePeriods);
    }
    if (minDurationSeconds < 0) {
      throw new IllegalArgumentException("Minimum duration cannot be negative, but was " + minDurationSeconds);
    }
    _threshold = threshold;
    _consecutivePeriods = consecutivePeriods;
    _minDurationSeconds = minDurationSeconds;
  }

  @Override
  public void configure(Map<String, ?> configs) {
    DetectionConfig config = new DetectionConfig(configs);
    setParameters(config.getDouble(CPU_THRESHOLD_PERCENT_CONFIG),
                  config.getInt(CPU_THRESHOLD_CONSECUTIVE_PERIODS_CONFIG),
                  config.getLong(CPU_THRESHOLD_DURATION_SECONDS_CONFIG));
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
   * @return One event per reported window, in time order.
   */
  public List<AnomalyEvent> detect(List<Sample> samples) {
    List<Sample> sorted = Samples.finiteSortedByTime(samples);
    List<AnomalyEvent> events = new ArrayList<>();
    Window window = new Window();
    for (int i = 0; i < sorted.size(); i++) {
      if (window.advance(i, sorted.get(i).value() > _threshold)) {
        maybeReport(sorted, window, events);
        window = new Window();
      }
    }
    if (window.isOpen()) {
      LOG.trace("Flushing {} window still open at the end of the input.", _kind);
      maybeReport(sorted, window, events);
    }
    return events;
  }

  private void maybeReport(List<Sample> samples, Window window, List<AnomalyEvent> events) {
    Sample first = samples.get(window._start);
    Sample last = samples.get(window._lastAbove);
    double durationSeconds = elapsedSeconds(first.timeMs(), last.timeMs());
    int sampleCount = window._lastAbove - window._start + 1;
    long required = Math.min(_minDurationSeconds, _consecutivePeriods);
    if (durationSeconds < required && sampleCount < required) {
      LOG.debug("Dropping {} window of {} samples lasting {}s.", _kind, sampleCount, durationSeconds);
      return;
    }
    double[] values = Samples.values(samples.subList(window._start, window._lastAbove + 1));
    double average = BaselineStatistics.mean(values);
    String label = _signal.toString();
    events.add(new AnomalyEvent.Builder(_kind, ALGORITHM, first.timeMs())
                   .endTimeMs(last.timeMs())
                   .severity(levelSeverity(average))
                   .confidence(thresholdConfidence(average, _threshold))
                   .entity(first.entityKey())
                   .metric("avg_" + label, average)
                   .metric("max_" + label, BaselineStatistics.max(values))
                   .metric("min_" + label, BaselineStatistics.min(values))
                   .metric("threshold", _threshold)
                   .metric("sample_count", sampleCount)
                   .metric("duration_seconds", durationSeconds)
                   .build());
  }

  /**
   * The hysteresis state machine over sample indices: closed, candidate (counting consecutive above samples) and open
   * (counting consecutive samples at or below the threshold).
   */
  private final class Window {
    private int _start = -1;
    private int _lastAbove = -1;
    private int _consecutiveAbove = 0;
    private int _consecutiveBelow = 0;
    private boolean _open = false;

    /**
     * @param index Index of the next sample.
     * @param above Whether the sample is strictly above the threshold.
     * @return {@code true} if this sample closed the window.
     */
    boolean advance(int index, boolean above) {
      if (!_open) {
        if (!above) {
          _consecutiveAbove = 0;
          return false;
        }
        if (_consecutiveAbove == 0) {
          _start = index;
        }
        _consecutiveAbove++;
        _lastAbove = index;
        _open = _consecutiveAbove >= _consecutivePeriods;
        return false;
      }
      if (above) {
        _lastAbove = index;
        _consecutiveBelow = 0;
        return false;
      }
      _consecutiveBelow++;
      return _consecutiveBelow >= _consecutivePeriods;
    }

    boolean isOpen() {
      return _open;
    }
  }
}
