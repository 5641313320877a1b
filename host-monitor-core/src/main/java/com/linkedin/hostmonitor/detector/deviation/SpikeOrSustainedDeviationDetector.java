/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector.deviation;

import com.linkedin.hostmonitor.detector.AnomalyDetector;
import com.linkedin.hostmonitor.detector.AnomalyEvent;
import com.linkedin.hostmonitor.detector.AnomalyKind;
import com.linkedin.hostmonitor.detector.DeviationDirection;
import com.linkedin.hostmonitor.detector.EntityGroups;
import com.linkedin.hostmonitor.model.Sample;
import com.linkedin.hostmonitor.model.Samples;
import com.linkedin.hostmonitor.model.Signal;
import com.linkedin.hostmonitor.stats.BaselineStatistics;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.hostmonitor.HostMonitorUtils.elapsedSeconds;
import static com.linkedin.hostmonitor.detector.AnomalyScoring.deviationConfidence;
import static com.linkedin.hostmonitor.detector.AnomalyScoring.deviationSeverity;
import static com.linkedin.hostmonitor.detector.AnomalyScoring.magnitudeRatio;
import static com.linkedin.hostmonitor.detector.AnomalyScoring.magnitudeTerm;


/**
 * Runs two independent tests over each entity group of a signal, as configured by the {@link DeviationProfile} of the
 * signal.
 * <ul>
 *   <li>Sustained test: every maximal run of consecutive samples beyond the sustained limit that is at least
 *   {@link DeviationProfile#minRunLength()} samples long and covers at least {@link DeviationProfile#sustainedRatio()}
 *   of the group is reported as one event. The limit is either a fixed threshold or a fraction of the baseline.</li>
 *   <li>Spike test: every tested sample above {@code max(spikeFloor, baseline * spikeMultiplier)} is reported as its own
 *   event. It does not run when the baseline is not positive.</li>
 * </ul>
 * Groups with fewer than {@link DeviationProfile#minSamples()} samples are not tested, and events whose confidence is
 * below {@link DeviationProfile#minConfidence()} are dropped.
 */
public class SpikeOrSustainedDeviationDetector implements AnomalyDetector {
  private static final Logger LOG = LoggerFactory.getLogger(SpikeOrSustainedDeviationDetector.class);
  static final double SUSTAINED_MAGNITUDE_SCALE = 2.0;
  static final double SPIKE_MAGNITUDE_SCALE = 10.0;
  private final String _algorithm;
  private volatile Map<Signal, DeviationProfile> _profiles;

  /**
   * @param algorithm Name of this detector.
   * @param profiles The profile of each signal to test.
   */
  public SpikeOrSustainedDeviationDetector(String algorithm, Map<Signal, DeviationProfile> profiles) {
    _algorithm = algorithm;
    setProfiles(profiles);
  }

  protected void setProfiles(Map<Signal, DeviationProfile> profiles) {
    if (profiles.isEmpty()) {
      throw new IllegalArgumentException("At least one signal profile is required.");
    }
    _profiles = Collections.unmodifiableMap(new LinkedHashMap<>(profiles));
  }

  /**
   * @param signal A signal tested by this detector.
   * @return The profile of the signal, or {@code null} if it is not tested.
   */
  public DeviationProfile profile(Signal signal) {
    return _profiles.get(signal);
  }

  @Override
  public void configure(Map<String, ?> configs) {
    // Profiles are given to the constructor; subclasses instantiated by class name rebuild them here.
  }

  @Override
  public String algorithm() {
    return _algorithm;
  }

  @Override
  public Set<Signal> signals() {
    return _profiles.keySet();
  }

  @Override
  public List<AnomalyEvent> detect(Map<Signal, List<Sample>> samplesBySignal) {
    List<AnomalyEvent> events = new ArrayList<>();
    for (Signal signal : _profiles.keySet()) {
      events.addAll(detect(signal, samplesBySignal.getOrDefault(signal, Collections.emptyList())));
    }
    events.sort(EntityGroups.BY_START_TIME);
    return events;
  }

  /**
   * @param signal The signal the samples belong to.
   * @param samples Samples of the signal, sorted ascending by time within each entity.
   * @return Events of all entity groups, ordered by start time; empty if the signal is not tested by this detector.
   */
  public List<AnomalyEvent> detect(Signal signal, List<Sample> samples) {
    DeviationProfile profile = _profiles.get(signal);
    if (profile == null) {
      return Collections.emptyList();
    }
    return EntityGroups.detectSequentially(Samples.groupByEntity(Samples.finiteSortedByTime(samples)),
                                           (entity, group) -> detectGroup(profile, entity, group));
  }

  /**
   * Same as {@link #detect(Signal, List)}, with the entity groups tested in parallel on the given executor.
   *
   * @param signal The signal the samples belong to.
   * @param samples Samples of the signal, sorted ascending by time within each entity.
   * @param executor Executor to run the groups on.
   * @return Events of all entity groups, ordered by start time.
   */
  public List<AnomalyEvent> detect(Signal signal, List<Sample> samples, ExecutorService executor)
      throws InterruptedException {
    DeviationProfile profile = _profiles.get(signal);
    if (profile == null) {
      return Collections.emptyList();
    }
    return EntityGroups.detectInParallel(Samples.groupByEntity(Samples.finiteSortedByTime(samples)),
                                         (entity, group) -> detectGroup(profile, entity, group), executor);
  }

  private List<AnomalyEvent> detectGroup(DeviationProfile profile, String entity, List<Sample> samples) {
    if (samples.size() < profile.minSamples()) {
      LOG.trace("Skipping {} of {} with {} samples.", profile.metricLabel(), entity, samples.size());
      return Collections.emptyList();
    }
    double[] values = Samples.values(samples);
    List<AnomalyEvent> events = new ArrayList<>();
    if (profile.hasSustainedTest()) {
      detectSustained(profile, samples, values, events);
    }
    if (profile.hasSpikeTest()) {
      detectSpikes(profile, samples, values, events);
    }
    return events;
  }

  private void detectSustained(DeviationProfile profile, List<Sample> samples, double[] values,
                               List<AnomalyEvent> events) {
    double baseline = profile.sustainedBaseline().baselineOf(values);
    double limit;
    if (profile.absoluteThreshold() != null) {
      limit = profile.absoluteThreshold();
    } else if (baseline > 0.0) {
      limit = baseline * (1.0 - profile.dropFraction());
    } else {
      LOG.trace("Skipping sustained {} test without a positive baseline.", profile.metricLabel());
      return;
    }
    // Fixed limits are the reference of their own deviations, relative limits deviate from the baseline.
    double reference = profile.absoluteThreshold() != null ? limit : baseline;
    DeviationDirection direction = profile.sustainedDirection();
    String label = profile.metricLabel();

    int i = 0;
    while (i < values.length) {
      if (!direction.isBeyond(values[i], limit)) {
        i++;
        continue;
      }
      int end = i;
      while (end < values.length && direction.isBeyond(values[end], limit)) {
        end++;
      }
      int runLength = end - i;
      double ratio = (double) runLength / values.length;
      if (runLength >= profile.minRunLength() && ratio >= profile.sustainedRatio()) {
        double[] run = Arrays.copyOfRange(values, i, end);
        double extreme = direction == DeviationDirection.ABOVE ? BaselineStatistics.max(run) : BaselineStatistics.min(run);
        double confidence = deviationConfidence(ratio, magnitudeTerm(extreme, reference, direction,
                                                                     SUSTAINED_MAGNITUDE_SCALE));
        double magnitude = magnitudeRatio(extreme, reference, direction);
        Sample first = samples.get(i);
        Sample last = samples.get(end - 1);
        AnomalyEvent.Builder builder = newBuilder(profile, profile.sustainedKind(), profile.sustainedAlgorithm(), first)
            .endTimeMs(last.timeMs())
            .severity(deviationSeverity(magnitude, ratio))
            .confidence(confidence)
            .baseline(baseline)
            .metric("avg_" + label, BaselineStatistics.mean(run))
            .metric("max_" + label, BaselineStatistics.max(run))
            .metric("min_" + label, BaselineStatistics.min(run))
            .metric("baseline_" + label, baseline)
            .metric("limit", limit)
            .metric("sample_count", runLength)
            .metric("run_ratio", ratio)
            .metric("magnitude_ratio", magnitude)
            .metric("duration_seconds", elapsedSeconds(first.timeMs(), last.timeMs()));
        addIfConfident(profile, builder, confidence, events);
      }
      i = end;
    }
  }

  private void detectSpikes(DeviationProfile profile, List<Sample> samples, double[] values,
                            List<AnomalyEvent> events) {
    BaselineMethod method = profile.spikeBaseline();
    double baseline = method.baselineOf(values);
    if (!(baseline > 0.0)) {
      LOG.trace("Skipping {} spike test without a positive baseline.", profile.metricLabel());
      return;
    }
    double limit = Math.max(profile.spikeFloor(), baseline * profile.spikeMultiplier());
    int firstTested = method.firstTestedIndex(values.length);
    int tested = values.length - firstTested;
    int spikes = 0;
    for (int i = firstTested; i < values.length; i++) {
      if (values[i] > limit) {
        spikes++;
      }
    }
    if (spikes == 0) {
      return;
    }
    double spikeRatio = (double) spikes / tested;
    String label = profile.metricLabel();
    for (int i = firstTested; i < values.length; i++) {
      if (!(values[i] > limit)) {
        continue;
      }
      double magnitude = magnitudeRatio(values[i], baseline, DeviationDirection.ABOVE);
      double confidence = deviationConfidence(spikeRatio, magnitudeTerm(values[i], baseline, DeviationDirection.ABOVE,
                                                                        SPIKE_MAGNITUDE_SCALE));
      Sample sample = samples.get(i);
      AnomalyEvent.Builder builder = newBuilder(profile, profile.spikeKind(), profile.spikeAlgorithm(), sample)
          .endTimeMs(sample.timeMs())
          .severity(deviationSeverity(magnitude, spikeRatio))
          .confidence(confidence)
          .baseline(baseline)
          .metric(label, values[i])
          .metric("baseline_" + label, baseline)
          .metric("spike_threshold", limit)
          .metric("spike_count", spikes)
          .metric("spike_ratio", spikeRatio)
          .metric("magnitude_ratio", magnitude);
      addIfConfident(profile, builder, confidence, events);
    }
  }

  private static AnomalyEvent.Builder newBuilder(DeviationProfile profile, AnomalyKind kind, String algorithm,
                                                 Sample first) {
    AnomalyEvent.Builder builder = new AnomalyEvent.Builder(kind, algorithm, first.timeMs()).entity(first.entityKey());
    if (profile.entityAttribute() != null && first.entityKey() != null) {
      builder.attribute(profile.entityAttribute(), first.entityKey());
    }
    profile.attributes().forEach(builder::attribute);
    return builder;
  }

  private static void addIfConfident(DeviationProfile profile, AnomalyEvent.Builder builder, double confidence,
                                     List<AnomalyEvent> events) {
    if (confidence < profile.minConfidence()) {
      LOG.debug("Dropping {} deviation with confidence {} below {}.", profile.metricLabel(), confidence,
                profile.minConfidence());
      return;
    }
    events.add(builder.build());
  }
}
