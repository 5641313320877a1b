/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector.process;

import com.linkedin.hostmonitor.config.DetectionConfig;
import com.linkedin.hostmonitor.detector.AnomalyEvent;
import com.linkedin.hostmonitor.detector.AnomalyKind;
import com.linkedin.hostmonitor.detector.EntityGroups;
import com.linkedin.hostmonitor.detector.EntityMetadataProvider;
import com.linkedin.hostmonitor.detector.Severity;
import com.linkedin.hostmonitor.exception.MetadataUnavailableException;
import com.linkedin.hostmonitor.model.Sample;
import com.linkedin.hostmonitor.model.Samples;
import com.linkedin.hostmonitor.model.Signal;
import com.linkedin.hostmonitor.stats.TrendFit;
import com.linkedin.hostmonitor.stats.TrendModel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.hostmonitor.HostMonitorUtils.SECONDS_PER_HOUR;
import static com.linkedin.hostmonitor.common.utils.Utils.validateNotNull;
import static com.linkedin.hostmonitor.config.DetectionConfig.ENTITY_METADATA_PROVIDER_OBJECT_CONFIG;
import static com.linkedin.hostmonitor.config.constants.ProcessDetectionConfig.*;
import static com.linkedin.hostmonitor.detector.AnomalyScoring.trendConfidence;


/**
 * Reports processes whose number of open file descriptors grew by more than a threshold between the oldest and the
 * newest retained sample. The confidence is the goodness of fit of the descriptor count against time, so steady growth
 * scores higher than a single jump.
 */
public class DescriptorLeakDetector implements HistoricalAnomalyDetector {
  private static final Logger LOG = LoggerFactory.getLogger(DescriptorLeakDetector.class);
  public static final String ALGORITHM = "resource_leak_detector";
  private double _growthThreshold;
  private int _minSamples;
  private int _maxSamples;
  private EntityMetadataProvider _metadataProvider;

  public DescriptorLeakDetector() {
    this(DEFAULT_PROCESS_FD_LEAK_GROWTH_THRESHOLD, DEFAULT_PROCESS_FD_LEAK_MIN_SAMPLES,
         DEFAULT_PROCESS_HISTORY_MAX_SAMPLES);
  }

  /**
   * @param growthThreshold Growth of the descriptor count that must be exceeded.
   * @param minSamples Minimum number of retained samples of a process.
   * @param maxSamples Number of most recent samples retained per process.
   */
  public DescriptorLeakDetector(double growthThreshold, int minSamples, int maxSamples) {
    setParameters(growthThreshold, minSamples, maxSamples);
    _metadataProvider = EntityMetadataProvider.NONE;
  }

  private void setParameters(double growthThreshold, int minSamples, int maxSamples) {
    if (minSamples < 2 || minSamples > maxSamples) {
      throw new IllegalArgumentException(String.format("Minimum samples (%d) must be within [2, %d].", minSamples,
                                                       maxSamples));
    }
    _growthThreshold = growthThreshold;
    _minSamples = minSamples;
    _maxSamples = maxSamples;
  }

  public void setMetadataProvider(EntityMetadataProvider metadataProvider) {
    _metadataProvider = validateNotNull(metadataProvider, "Metadata provider cannot be null.");
  }

  @Override
  public void configure(Map<String, ?> configs) {
    DetectionConfig config = new DetectionConfig(configs);
    setParameters(config.getDouble(PROCESS_FD_LEAK_GROWTH_THRESHOLD_CONFIG),
                  config.getInt(PROCESS_FD_LEAK_MIN_SAMPLES_CONFIG),
                  config.getInt(PROCESS_HISTORY_MAX_SAMPLES_CONFIG));
    Object metadataProvider = configs.get(ENTITY_METADATA_PROVIDER_OBJECT_CONFIG);
    if (metadataProvider instanceof EntityMetadataProvider) {
      setMetadataProvider((EntityMetadataProvider) metadataProvider);
    }
  }

  @Override
  public String algorithm() {
    return ALGORITHM;
  }

  @Override
  public Signal signal() {
    return Signal.PROCESS_OPEN_FDS;
  }

  @Override
  public EntityHistory emptyHistory() {
    return EntityHistory.empty(_maxSamples);
  }

  @Override
  public HistoricalDetection detect(Map<Signal, List<Sample>> samplesBySignal, EntityHistory previous) {
    return detect(samplesBySignal.getOrDefault(Signal.PROCESS_OPEN_FDS, Collections.emptyList()), previous);
  }

  /**
   * @param current {@link Signal#PROCESS_OPEN_FDS} samples of the current tick, keyed by pid.
   * @param previous The history returned by the previous tick.
   * @return One warning per leaking process, ordered by start time, and the updated history.
   */
  public HistoricalDetection detect(List<Sample> current, EntityHistory previous) {
    List<Sample> samples = Samples.finiteSortedByTime(current);
    if (samples.isEmpty()) {
      return new HistoricalDetection(Collections.emptyList(), previous);
    }
    EntityHistory history = previous.update(samples);
    List<AnomalyEvent> events = new ArrayList<>();
    for (String pid : history.entities()) {
      List<Sample> retained = history.samples(pid);
      if (retained.size() < _minSamples) {
        continue;
      }
      Sample first = retained.get(0);
      Sample last = retained.get(retained.size() - 1);
      double growth = last.value() - first.value();
      if (!(growth > _growthThreshold)) {
        continue;
      }
      TrendFit fit = TrendModel.fit(retained);
      AnomalyEvent.Builder builder = new AnomalyEvent.Builder(AnomalyKind.FD_LEAK, ALGORITHM, first.timeMs())
          .endTimeMs(last.timeMs())
          .severity(Severity.WARNING)
          .confidence(trendConfidence(fit.rSquared()))
          .baseline(first.value())
          .entity(pid)
          .metric("initial_fds", first.value())
          .metric("current_fds", last.value())
          .metric("fd_growth", growth)
          .metric("growth_threshold", _growthThreshold)
          .metric("growth_rate_per_hour", fit.slopePerSecond() * SECONDS_PER_HOUR)
          .metric("r_squared", fit.rSquared())
          .metric("samples", retained.size())
          .attribute(ProcessCrashDetector.PID_ATTRIBUTE, pid);
      try {
        _metadataProvider.metadataFor(pid).forEach(builder::attribute);
      } catch (MetadataUnavailableException e) {
        LOG.warn("Reporting descriptor leak of {} without metadata: {}", pid, e.getMessage());
      }
      events.add(builder.build());
    }
    events.sort(EntityGroups.BY_START_TIME);
    return new HistoricalDetection(events, history);
  }
}
