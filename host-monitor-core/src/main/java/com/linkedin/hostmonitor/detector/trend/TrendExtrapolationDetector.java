/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector.trend;

import com.linkedin.hostmonitor.detector.AnomalyDetector;
import com.linkedin.hostmonitor.detector.AnomalyEvent;
import com.linkedin.hostmonitor.detector.AnomalyKind;
import com.linkedin.hostmonitor.detector.EntityGroups;
import com.linkedin.hostmonitor.detector.EntityMetadataProvider;
import com.linkedin.hostmonitor.exception.MetadataUnavailableException;
import com.linkedin.hostmonitor.model.Sample;
import com.linkedin.hostmonitor.model.Samples;
import com.linkedin.hostmonitor.model.Signal;
import com.linkedin.hostmonitor.stats.BaselineStatistics;
import com.linkedin.hostmonitor.stats.TrendFit;
import com.linkedin.hostmonitor.stats.TrendModel;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.hostmonitor.HostMonitorUtils.SECONDS_PER_HOUR;
import static com.linkedin.hostmonitor.HostMonitorUtils.SEC_TO_MS;
import static com.linkedin.hostmonitor.HostMonitorUtils.elapsedSeconds;
import static com.linkedin.hostmonitor.HostMonitorUtils.utcDateFor;
import static com.linkedin.hostmonitor.common.utils.Utils.validateNotNull;
import static com.linkedin.hostmonitor.detector.AnomalyScoring.timeToImpactSeverity;
import static com.linkedin.hostmonitor.detector.AnomalyScoring.trendConfidence;


/**
 * Predicts when a growing signal will reach a capacity limit by extrapolating a least-squares trend line.
 * <p>
 * For each group (each entity, or the whole system), the trend is extrapolated only if the group has at least
 * {@code minSamples} samples, grows faster than {@code growthThresholdPerHour} and its R-squared is strictly above
 * {@code confidenceThreshold}. An event is reported only if the trend line reaches {@code capacityLimit} within
 * {@code predictionWindowHours} of the last sample; if the fitted value at the last sample is already at the limit,
 * the time to breach is zero. Severity follows the time to breach and the confidence is the R-squared.
 */
public class TrendExtrapolationDetector implements AnomalyDetector {
  private static final Logger LOG = LoggerFactory.getLogger(TrendExtrapolationDetector.class);
  private final Signal _signal;
  private final AnomalyKind _kind;
  private final String _algorithm;
  private final boolean _perEntity;
  protected int _minSamples;
  protected double _growthThresholdPerHour;
  protected double _confidenceThreshold;
  protected double _capacityLimit;
  protected double _predictionWindowHours;
  protected EntityMetadataProvider _metadataProvider;

  /**
   * @param signal The signal to read.
   * @param kind The kind of events to report.
   * @param algorithm The algorithm tag of reported events.
   * @param perEntity {@code true} to fit one trend per entity key, {@code false} to fit the whole system.
   * @param minSamples Minimum number of samples per group.
   * @param growthThresholdPerHour Growth per hour that the trend must strictly exceed.
   * @param confidenceThreshold R-squared that the trend must strictly exceed.
   * @param capacityLimit The value whose breach is predicted.
   * @param predictionWindowHours Breaches further in the future are not reported.
   */
  public TrendExtrapolationDetector(Signal signal,
                                    AnomalyKind kind,
                                    String algorithm,
                                    boolean perEntity,
                                    int minSamples,
                                    double growthThresholdPerHour,
                                    double confidenceThreshold,
                                    double capacityLimit,
                                    double predictionWindowHours) {
    _signal = validateNotNull(signal, "Signal cannot be null.");
    _kind = validateNotNull(kind, "Anomaly kind cannot be null.");
    _algorithm = algorithm;
    _perEntity = perEntity;
    _metadataProvider = EntityMetadataProvider.NONE;
    setParameters(minSamples, growthThresholdPerHour, confidenceThreshold, capacityLimit, predictionWindowHours);
  }

  protected void setParameters(int minSamples,
                               double growthThresholdPerHour,
                               double confidenceThreshold,
                               double capacityLimit,
                               double predictionWindowHours) {
    if (minSamples < 2) {
      throw new IllegalArgumentException("A trend needs at least two samples, but minimum samples was " + minSamples);
    }
    if (predictionWindowHours <= 0.0) {
      throw new IllegalArgumentException("Prediction window must be positive, but was " + predictionWindowHours);
    }
    _minSamples = minSamples;
    _growthThresholdPerHour = growthThresholdPerHour;
    _confidenceThreshold = confidenceThreshold;
    _capacityLimit = capacityLimit;
    _predictionWindowHours = predictionWindowHours;
  }

  /**
   * @param metadataProvider Provider of descriptive metadata attached to per-entity events.
   */
  public void setMetadataProvider(EntityMetadataProvider metadataProvider) {
    _metadataProvider = validateNotNull(metadataProvider, "Metadata provider cannot be null.");
  }

  @Override
  public void configure(Map<String, ?> configs) {
    // Parameters are given to the constructor; subclasses instantiated by class name read them here.
  }

  @Override
  public String algorithm() {
    return _algorithm;
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
   * @param samples Samples of the signal, sorted ascending by time within each entity.
   * @return At most one event per group, ordered by start time.
   */
  public List<AnomalyEvent> detect(List<Sample> samples) {
    return EntityGroups.detectSequentially(groups(samples), this::detectGroup);
  }

  /**
   * Same as {@link #detect(List)}, with the groups analyzed in parallel on the given executor.
   *
   * @param samples Samples of the signal, sorted ascending by time within each entity.
   * @param executor Executor to run the groups on.
   * @return At most one event per group, ordered by start time.
   */
  public List<AnomalyEvent> detect(List<Sample> samples, ExecutorService executor) throws InterruptedException {
    return EntityGroups.detectInParallel(groups(samples), this::detectGroup, executor);
  }

  private SortedMap<String, List<Sample>> groups(List<Sample> samples) {
    if (_perEntity) {
      return Samples.groupByEntity(Samples.finiteSortedByTime(samples));
    }
    SortedMap<String, List<Sample>> groups = new TreeMap<>();
    groups.put(Samples.SYSTEM_ENTITY, Samples.finiteSortedByTime(samples));
    return groups;
  }

  private List<AnomalyEvent> detectGroup(String groupKey, List<Sample> samples) {
    if (samples.size() < _minSamples) {
      LOG.trace("Skipping {} trend of {} with {} samples.", _kind, groupKey, samples.size());
      return Collections.emptyList();
    }
    TrendFit fit = TrendModel.fit(samples);
    double growthPerHour = fit.slopePerSecond() * SECONDS_PER_HOUR;
    if (!(growthPerHour > _growthThresholdPerHour) || !(fit.rSquared() > _confidenceThreshold)) {
      return Collections.emptyList();
    }
    Sample first = samples.get(0);
    Sample last = samples.get(samples.size() - 1);
    double lastElapsedSeconds = elapsedSeconds(fit.originMs(), last.timeMs());
    double fittedNow = fit.valueAt(lastElapsedSeconds);
    double hoursToBreach = fittedNow >= _capacityLimit
                           ? 0.0 : (fit.secondsToReach(_capacityLimit) - lastElapsedSeconds) / SECONDS_PER_HOUR;
    if (!Double.isFinite(hoursToBreach) || hoursToBreach > _predictionWindowHours) {
      LOG.debug("{} of {} grows {}/h but is not predicted to reach {} within {}h.", _kind, groupKey, growthPerHour,
                _capacityLimit, _predictionWindowHours);
      return Collections.emptyList();
    }
    long predictedBreachMs = last.timeMs() + Math.round(hoursToBreach * SECONDS_PER_HOUR * SEC_TO_MS);
    double[] values = Samples.values(samples);
    String label = _signal.toString();
    String entity = _perEntity ? groupKey : null;

    AnomalyEvent.Builder builder = new AnomalyEvent.Builder(_kind, _algorithm, first.timeMs())
        .endTimeMs(last.timeMs())
        .severity(timeToImpactSeverity(hoursToBreach))
        .confidence(trendConfidence(fit.rSquared()))
        .baseline(_capacityLimit)
        .entity(entity)
        .metric("initial_" + label, first.value())
        .metric("current_" + label, last.value())
        .metric("avg_" + label, BaselineStatistics.mean(values))
        .metric("max_" + label, BaselineStatistics.max(values))
        .metric("total_growth", last.value() - first.value())
        .metric("growth_rate_per_hour", growthPerHour)
        .metric("predicted_" + label, fit.valueAt(lastElapsedSeconds + _predictionWindowHours * SECONDS_PER_HOUR))
        .metric("capacity_limit", _capacityLimit)
        .metric("r_squared", fit.rSquared())
        .metric("time_to_breach_hours", hoursToBreach)
        .attribute("predicted_breach_time", utcDateFor(predictedBreachMs));
    if (entity != null) {
      attachMetadata(builder, entity);
    }
    return Collections.singletonList(builder.build());
  }

  private void attachMetadata(AnomalyEvent.Builder builder, String entity) {
    try {
      _metadataProvider.metadataFor(entity).forEach(builder::attribute);
    } catch (MetadataUnavailableException e) {
      LOG.warn("Reporting {} of {} without metadata: {}", _kind, entity, e.getMessage());
    }
  }
}
