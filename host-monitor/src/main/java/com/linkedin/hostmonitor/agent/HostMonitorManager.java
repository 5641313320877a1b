/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.linkedin.hostmonitor.agent.collector.SampleCollector;
import com.linkedin.hostmonitor.agent.common.HostMonitorThreadFactory;
import com.linkedin.hostmonitor.agent.config.HostMonitorConfig;
import com.linkedin.hostmonitor.agent.detector.DetectionLoop;
import com.linkedin.hostmonitor.agent.detector.SignalGroup;
import com.linkedin.hostmonitor.agent.format.ResultFormatter;
import com.linkedin.hostmonitor.agent.format.ResultFormatters;
import com.linkedin.hostmonitor.agent.sampling.SampleBuffer;
import com.linkedin.hostmonitor.agent.sink.EventSink;
import com.linkedin.hostmonitor.common.HostMonitorConfigurable;
import com.linkedin.hostmonitor.detector.AnomalyDetector;
import com.linkedin.hostmonitor.detector.EntityMetadataProvider;
import com.linkedin.hostmonitor.detector.process.HistoricalAnomalyDetector;
import com.linkedin.hostmonitor.exception.HostMonitorException;
import com.linkedin.hostmonitor.model.Signal;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.hostmonitor.agent.HostMonitorAgentUtils.DETECTION_SENSOR;
import static com.linkedin.hostmonitor.agent.config.constants.MonitorConfig.*;
import static com.linkedin.hostmonitor.config.DetectionConfig.ENTITY_METADATA_PROVIDER_OBJECT_CONFIG;


/**
 * The manager of the host monitor agent. It runs one detection loop per signal group that has detectors configured,
 * each at the sampling interval of its group. All loops share the collector, the sample buffer and the sink.
 */
public class HostMonitorManager {
  static final String METRIC_REGISTRY_NAME = "HostMonitorDetector";
  private static final long SCHEDULER_SHUTDOWN_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(5);
  private static final Logger LOG = LoggerFactory.getLogger(HostMonitorManager.class);
  private final Map<SignalGroup, DetectionLoop> _loopByGroup;
  private final Map<SignalGroup, Long> _samplingIntervalMsByGroup;
  private final ScheduledExecutorService _detectorScheduler;
  private final ExecutorService _collectionExecutor;
  private final EventSink _sink;
  private final Object _shutdownLock;
  private volatile boolean _started;
  private volatile boolean _shutdown;

  /**
   * @param config The agent configuration.
   * @param collector Collector of the samples of every signal group. If it also implements
   *                  {@link EntityMetadataProvider}, detectors that enrich their events use it.
   * @param sink Destination of the formatted events. It is closed on {@link #shutdown()}.
   * @param dropwizardMetricRegistry The metric registry that holds the sensors of the agent.
   */
  public HostMonitorManager(HostMonitorConfig config,
                            SampleCollector collector,
                            EventSink sink,
                            MetricRegistry dropwizardMetricRegistry) throws HostMonitorException {
    SampleBuffer buffer = new SampleBuffer(config.getInt(SAMPLE_BUFFER_CAPACITY_PER_ENTITY_CONFIG),
                                           config.getLong(SAMPLE_BUFFER_RETENTION_MS_CONFIG));
    ResultFormatter formatter = ResultFormatters.forName(config.getString(OUTPUT_FORMAT_CONFIG));
    long collectionTimeoutMs = config.getLong(COLLECTION_TIMEOUT_MS_CONFIG);
    int emittedEventCacheSize = config.getInt(EMITTED_EVENT_CACHE_SIZE_CONFIG);
    Map<String, Object> overrides = collector instanceof EntityMetadataProvider
                                    ? Collections.<String, Object>singletonMap(ENTITY_METADATA_PROVIDER_OBJECT_CONFIG, collector)
                                    : Collections.emptyMap();

    _collectionExecutor = Executors.newCachedThreadPool(new HostMonitorThreadFactory("SampleCollector"));
    _loopByGroup = new EnumMap<>(SignalGroup.class);
    _samplingIntervalMsByGroup = new EnumMap<>(SignalGroup.class);
    for (SignalGroup group : SignalGroup.cachedValues()) {
      List<AnomalyDetector> detectors = new ArrayList<>();
      List<HistoricalAnomalyDetector> historicalDetectors = new ArrayList<>();
      for (HostMonitorConfigurable detector : config.getConfiguredInstances(group.detectorClassesConfig(),
                                                                             HostMonitorConfigurable.class,
                                                                             overrides)) {
        if (detector instanceof AnomalyDetector) {
          detectors.add((AnomalyDetector) detector);
        } else if (detector instanceof HistoricalAnomalyDetector) {
          historicalDetectors.add((HistoricalAnomalyDetector) detector);
        } else {
          throw new HostMonitorException(String.format("%s in %s is not a detector.", detector.getClass().getName(),
                                                       group.detectorClassesConfig()));
        }
      }
      if (detectors.isEmpty() && historicalDetectors.isEmpty()) {
        LOG.info("No detectors are configured for {} signals.", group);
        continue;
      }
      _loopByGroup.put(group, new DetectionLoop(group, collector, _collectionExecutor, collectionTimeoutMs, buffer,
                                                detectors, historicalDetectors, formatter, sink, emittedEventCacheSize,
                                                dropwizardMetricRegistry));
      _samplingIntervalMsByGroup.put(group, config.samplingIntervalMs(group));
    }
    _detectorScheduler = Executors.newScheduledThreadPool(Math.max(1, _loopByGroup.size()),
                                                          new HostMonitorThreadFactory(METRIC_REGISTRY_NAME, false, LOG,
                                                                                       null));
    _sink = sink;
    _shutdownLock = new Object();
    _started = false;
    _shutdown = false;
    registerGaugeSensors(dropwizardMetricRegistry, buffer);
  }

  /**
   * Package private constructor for unit test.
   */
  HostMonitorManager(Map<SignalGroup, DetectionLoop> loopByGroup,
                     Map<SignalGroup, Long> samplingIntervalMsByGroup,
                     ScheduledExecutorService detectorScheduler,
                     ExecutorService collectionExecutor,
                     EventSink sink) {
    _loopByGroup = loopByGroup;
    _samplingIntervalMsByGroup = samplingIntervalMsByGroup;
    _detectorScheduler = detectorScheduler;
    _collectionExecutor = collectionExecutor;
    _sink = sink;
    _shutdownLock = new Object();
    _started = false;
    _shutdown = false;
  }

  /**
   * Register gauge sensors.
   * @param dropwizardMetricRegistry The metric registry that holds the sensors of the agent.
   * @param buffer The sample buffer shared by the loops.
   */
  private void registerGaugeSensors(MetricRegistry dropwizardMetricRegistry, SampleBuffer buffer) {
    dropwizardMetricRegistry.register(MetricRegistry.name(DETECTION_SENSOR, "buffered-samples"),
                                      (Gauge<Integer>) buffer::size);
    for (Signal signal : Signal.cachedValues()) {
      dropwizardMetricRegistry.register(MetricRegistry.name(DETECTION_SENSOR, String.format("%s-buffered-samples", signal)),
                                        (Gauge<Integer>) () -> buffer.size(signal));
    }
    dropwizardMetricRegistry.register(MetricRegistry.name(DETECTION_SENSOR, "num-detection-loops"),
                                      (Gauge<Integer>) _loopByGroup::size);
  }

  /**
   * @return The signal groups that have a detection loop.
   */
  public List<SignalGroup> groups() {
    return new ArrayList<>(_loopByGroup.keySet());
  }

  /**
   * Start the detection loop of each signal group with detectors. The first tick of each loop runs after one
   * sampling interval.
   */
  public void startDetection() {
    synchronized (_shutdownLock) {
      if (_shutdown) {
        throw new IllegalStateException("Cannot start detection after shutdown.");
      }
      if (_started) {
        LOG.warn("Detection has already been started.");
        return;
      }
      _started = true;
      for (Map.Entry<SignalGroup, DetectionLoop> entry : _loopByGroup.entrySet()) {
        long samplingIntervalMs = _samplingIntervalMsByGroup.get(entry.getKey());
        LOG.info("Starting {} detection with {} detectors every {} ms.", entry.getKey(), entry.getValue().numDetectors(),
                 samplingIntervalMs);
        _detectorScheduler.scheduleAtFixedRate(entry.getValue(), samplingIntervalMs, samplingIntervalMs,
                                               TimeUnit.MILLISECONDS);
      }
    }
  }

  /**
   * Shutdown the detection loops. A cycle in progress is given a bounded time to complete; no cycle starts afterwards.
   */
  public void shutdown() {
    LOG.info("Shutting down host monitor.");
    synchronized (_shutdownLock) {
      if (_shutdown) {
        return;
      }
      _shutdown = true;
    }
    _detectorScheduler.shutdown();
    try {
      _detectorScheduler.awaitTermination(SCHEDULER_SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
      if (!_detectorScheduler.isTerminated()) {
        LOG.warn("The detection scheduler failed to shutdown in {} ms.", SCHEDULER_SHUTDOWN_TIMEOUT_MS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.warn("Interrupted while waiting for the detection loops to shutdown.");
    }
    _collectionExecutor.shutdownNow();
    try {
      _sink.close();
    } catch (IOException e) {
      LOG.warn("Failed to close the event sink.", e);
    }
    LOG.info("Host monitor shutdown completed.");
  }
}
