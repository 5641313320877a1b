/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent.detector;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.linkedin.hostmonitor.agent.collector.SampleCollector;
import com.linkedin.hostmonitor.agent.format.RenderableResult;
import com.linkedin.hostmonitor.agent.format.ResultFormatter;
import com.linkedin.hostmonitor.agent.sampling.SampleBuffer;
import com.linkedin.hostmonitor.agent.sink.EventSink;
import com.linkedin.hostmonitor.detector.AnomalyDetector;
import com.linkedin.hostmonitor.detector.AnomalyEvent;
import com.linkedin.hostmonitor.detector.process.EntityHistory;
import com.linkedin.hostmonitor.detector.process.HistoricalAnomalyDetector;
import com.linkedin.hostmonitor.detector.process.HistoricalDetection;
import com.linkedin.hostmonitor.model.Sample;
import com.linkedin.hostmonitor.model.Signal;
import java.io.IOException;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.hostmonitor.agent.HostMonitorAgentUtils.DETECTION_SENSOR;
import static com.linkedin.hostmonitor.detector.EntityGroups.BY_START_TIME;


/**
 * One tick of the detection loop of a signal group. Each run:
 * <ol>
 *   <li>collects the signals of the group under a bounded timeout, skipping the tick if the collection fails or
 *   times out,</li>
 *   <li>appends the collected samples to the shared sample buffer,</li>
 *   <li>runs the detectors of the group over the buffered window, and the history-carrying detectors over the
 *   collected tick,</li>
 *   <li>formats the events that were not emitted before and writes them to the sink.</li>
 * </ol>
 * An invalid event aborts the cycle: nothing is emitted and the histories of the history-carrying detectors are kept
 * as they were before the cycle.
 *
 * Runs of the same loop must not overlap, which {@link java.util.concurrent.ScheduledExecutorService#scheduleAtFixedRate}
 * guarantees.
 */
public class DetectionLoop implements Runnable {
  private static final Logger LOG = LoggerFactory.getLogger(DetectionLoop.class);
  private final SignalGroup _group;
  private final SampleCollector _collector;
  private final ExecutorService _collectionExecutor;
  private final long _collectionTimeoutMs;
  private final SampleBuffer _buffer;
  private final List<AnomalyDetector> _detectors;
  private final Map<HistoricalAnomalyDetector, EntityHistory> _historyByDetector;
  private final ResultFormatter _formatter;
  private final EventSink _sink;
  private final EmittedEventCache _emittedEvents;
  private final Timer _detectionTimer;
  private final Meter _skippedTicks;
  private final Meter _abortedCycles;
  private final Meter _emittedEventRate;

  /**
   * @param group The signal group of this loop.
   * @param collector Collector of the samples of each tick.
   * @param collectionExecutor Executor to run collections on, so that they can be timed out.
   * @param collectionTimeoutMs Maximum time to wait for the collection of a tick.
   * @param buffer Sample buffer shared by all loops.
   * @param detectors Detectors that analyze the buffered window of the group.
   * @param historicalDetectors Detectors that compare each tick against the previous ones.
   * @param formatter Formatter of the emitted events.
   * @param sink Destination of the formatted events.
   * @param emittedEventCacheSize Number of emitted events to remember.
   * @param dropwizardMetricRegistry The metric registry that holds the sensors of the agent.
   */
  public DetectionLoop(SignalGroup group,
                       SampleCollector collector,
                       ExecutorService collectionExecutor,
                       long collectionTimeoutMs,
                       SampleBuffer buffer,
                       List<AnomalyDetector> detectors,
                       List<HistoricalAnomalyDetector> historicalDetectors,
                       ResultFormatter formatter,
                       EventSink sink,
                       int emittedEventCacheSize,
                       MetricRegistry dropwizardMetricRegistry) {
    _group = group;
    _collector = collector;
    _collectionExecutor = collectionExecutor;
    _collectionTimeoutMs = collectionTimeoutMs;
    _buffer = buffer;
    _detectors = detectors;
    _historyByDetector = new IdentityHashMap<>();
    historicalDetectors.forEach(detector -> _historyByDetector.put(detector, detector.emptyHistory()));
    _formatter = formatter;
    _sink = sink;
    _emittedEvents = new EmittedEventCache(emittedEventCacheSize);
    String prefix = _group.name().toLowerCase();
    _detectionTimer = dropwizardMetricRegistry.timer(MetricRegistry.name(DETECTION_SENSOR, prefix + "-detection-timer"));
    _skippedTicks = dropwizardMetricRegistry.meter(MetricRegistry.name(DETECTION_SENSOR, prefix + "-skipped-tick-rate"));
    _abortedCycles = dropwizardMetricRegistry.meter(MetricRegistry.name(DETECTION_SENSOR, prefix + "-aborted-cycle-rate"));
    _emittedEventRate = dropwizardMetricRegistry.meter(MetricRegistry.name(DETECTION_SENSOR, prefix + "-emitted-event-rate"));
  }

  public SignalGroup group() {
    return _group;
  }

  /**
   * @return Number of detectors run by this loop, including the history-carrying ones.
   */
  public int numDetectors() {
    return _detectors.size() + _historyByDetector.size();
  }

  @Override
  public void run() {
    try {
      runOnce();
    } catch (RuntimeException e) {
      // An exception escaping a periodic task would cancel its future executions.
      LOG.error("Unexpected failure in the {} detection loop.", _group, e);
    }
  }

  /**
   * Run a single detection cycle.
   *
   * @return Number of events emitted by this cycle.
   */
  int runOnce() {
    final Timer.Context ctx = _detectionTimer.time();
    try {
      Map<Signal, List<Sample>> tick = collect();
      if (tick == null) {
        _skippedTicks.mark();
        return 0;
      }
      int numAppended = _buffer.append(tick);
      LOG.trace("Appended {} {} samples to the sample buffer.", numAppended, _group);

      Map<HistoricalAnomalyDetector, EntityHistory> stagedHistories = new IdentityHashMap<>();
      List<AnomalyEvent> events;
      try {
        events = detect(tick, stagedHistories);
      } catch (IllegalArgumentException e) {
        LOG.error("Aborting the {} detection cycle due to an invalid anomaly event.", _group, e);
        _abortedCycles.mark();
        return 0;
      }
      _historyByDetector.putAll(stagedHistories);

      events.sort(BY_START_TIME);
      List<AnomalyEvent> unseen = _emittedEvents.unseen(events);
      if (unseen.isEmpty()) {
        return 0;
      }
      return emit(unseen) ? unseen.size() : 0;
    } finally {
      ctx.stop();
    }
  }

  /**
   * @return The samples of this tick, or {@code null} if the collection failed or timed out.
   */
  private Map<Signal, List<Sample>> collect() {
    Future<Map<Signal, List<Sample>>> future = _collectionExecutor.submit(() -> _collector.collect(_group.signals()));
    try {
      Map<Signal, List<Sample>> tick = future.get(_collectionTimeoutMs, TimeUnit.MILLISECONDS);
      if (tick == null) {
        LOG.warn("Skipping the {} tick because the collector returned no samples.", _group);
      }
      return tick;
    } catch (TimeoutException e) {
      future.cancel(true);
      LOG.warn("Skipping the {} tick because the collection did not finish in {} ms.", _group, _collectionTimeoutMs);
    } catch (ExecutionException e) {
      LOG.warn("Skipping the {} tick because the collection failed.", _group, e.getCause());
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      LOG.warn("Interrupted while collecting the {} tick.", _group);
    }
    return null;
  }

  private List<AnomalyEvent> detect(Map<Signal, List<Sample>> tick,
                                    Map<HistoricalAnomalyDetector, EntityHistory> stagedHistories) {
    List<AnomalyEvent> events = new ArrayList<>();
    Map<Signal, List<Sample>> window = _buffer.snapshot(_group.signals());
    for (AnomalyDetector detector : _detectors) {
      List<AnomalyEvent> detected = detector.detect(window);
      LOG.debug("{} detected {} events over the {} window.", detector.algorithm(), detected.size(), _group);
      events.addAll(detected);
    }
    for (Map.Entry<HistoricalAnomalyDetector, EntityHistory> entry : _historyByDetector.entrySet()) {
      HistoricalDetection detection = entry.getKey().detect(tick, entry.getValue());
      LOG.debug("{} detected {} events in the {} tick.", entry.getKey().algorithm(), detection.events().size(), _group);
      events.addAll(detection.events());
      stagedHistories.put(entry.getKey(), detection.history());
    }
    return events;
  }

  private boolean emit(List<AnomalyEvent> events) {
    String formatted = _formatter.format(RenderableResult.eventSeries(events));
    try {
      _sink.write(formatted);
    } catch (IOException e) {
      LOG.warn("Failed to write {} {} events to the sink.", events.size(), _group, e);
      return false;
    }
    _emittedEvents.markEmitted(events);
    _emittedEventRate.mark(events.size());
    return true;
  }
}
