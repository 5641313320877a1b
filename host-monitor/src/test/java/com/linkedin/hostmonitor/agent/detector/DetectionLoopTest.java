/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.hostmonitor.agent.detector;

import com.codahale.metrics.MetricRegistry;
import com.linkedin.hostmonitor.agent.collector.CollectionException;
import com.linkedin.hostmonitor.agent.collector.SampleCollector;
import com.linkedin.hostmonitor.agent.format.ResultFormatters;
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
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.easymock.Capture;
import org.easymock.EasyMock;
import org.junit.After;
import org.junit.Test;

import static com.linkedin.hostmonitor.agent.HostMonitorAgentUnitTestUtils.ONE_SECOND_MS;
import static com.linkedin.hostmonitor.agent.HostMonitorAgentUnitTestUtils.START_TIME_MS;
import static com.linkedin.hostmonitor.agent.HostMonitorAgentUnitTestUtils.TEST_ALGORITHM;
import static com.linkedin.hostmonitor.agent.HostMonitorAgentUnitTestUtils.event;
import static com.linkedin.hostmonitor.agent.HostMonitorAgentUnitTestUtils.tick;
import static com.linkedin.hostmonitor.agent.HostMonitorAgentUtils.DETECTION_SENSOR;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class DetectionLoopTest {
  private static final long COLLECTION_TIMEOUT_MS = 2000L;
  private static final int CACHE_SIZE = 100;
  private final ExecutorService _collectionExecutor = Executors.newCachedThreadPool();
  private final MetricRegistry _registry = new MetricRegistry();

  @After
  public void tearDown() {
    _collectionExecutor.shutdownNow();
  }

  private DetectionLoop loop(SignalGroup group,
                             SampleCollector collector,
                             long collectionTimeoutMs,
                             SampleBuffer buffer,
                             List<AnomalyDetector> detectors,
                             List<HistoricalAnomalyDetector> historicalDetectors,
                             EventSink sink) {
    return new DetectionLoop(group, collector, _collectionExecutor, collectionTimeoutMs, buffer, detectors,
                             historicalDetectors, ResultFormatters.forName("json"), sink, CACHE_SIZE, _registry);
  }

  private long meterCount(String name) {
    return _registry.meter(MetricRegistry.name(DETECTION_SENSOR, name)).getCount();
  }

  private static AnomalyDetector detector() {
    AnomalyDetector detector = EasyMock.mock(AnomalyDetector.class);
    EasyMock.expect(detector.algorithm()).andReturn(TEST_ALGORITHM).anyTimes();
    return detector;
  }

  @Test
  public void testFailedCollectionSkipsTick() throws Exception {
    SampleCollector collector = EasyMock.mock(SampleCollector.class);
    EasyMock.expect(collector.collect(SignalGroup.CPU.signals()))
            .andThrow(new CollectionException("Cannot read /proc/stat"));
    AnomalyDetector detector = detector();
    EventSink sink = EasyMock.mock(EventSink.class);
    EasyMock.replay(collector, detector, sink);

    SampleBuffer buffer = new SampleBuffer(100, 60 * ONE_SECOND_MS);
    buffer.append(tick(Signal.CPU_PERCENT, START_TIME_MS, 10.0));
    DetectionLoop loop = loop(SignalGroup.CPU, collector, COLLECTION_TIMEOUT_MS, buffer,
                              Collections.singletonList(detector), Collections.emptyList(), sink);
    assertEquals(0, loop.runOnce());
    assertEquals(1, buffer.size());
    assertEquals(1, meterCount("cpu-skipped-tick-rate"));
    EasyMock.verify(collector, detector, sink);
  }

  @Test
  public void testTimedOutCollectionSkipsTick() throws Exception {
    SampleCollector collector = EasyMock.mock(SampleCollector.class);
    EasyMock.expect(collector.collect(SignalGroup.MEMORY.signals())).andAnswer(() -> {
      Thread.sleep(10 * ONE_SECOND_MS);
      return tick(Signal.MEMORY_USED_PERCENT, START_TIME_MS, 50.0);
    }).anyTimes();
    AnomalyDetector detector = detector();
    EventSink sink = EasyMock.mock(EventSink.class);
    EasyMock.replay(collector, detector, sink);

    SampleBuffer buffer = new SampleBuffer(100, 60 * ONE_SECOND_MS);
    DetectionLoop loop = loop(SignalGroup.MEMORY, collector, 50L, buffer, Collections.singletonList(detector),
                              Collections.emptyList(), sink);
    assertEquals(0, loop.runOnce());
    assertEquals(0, buffer.size());
    assertEquals(1, meterCount("memory-skipped-tick-rate"));
    EasyMock.verify(detector, sink);
  }

  @Test
  public void testMissingTickSkipsTick() throws Exception {
    SampleCollector collector = EasyMock.mock(SampleCollector.class);
    EasyMock.expect(collector.collect(SignalGroup.CPU.signals())).andReturn(null);
    EventSink sink = EasyMock.mock(EventSink.class);
    EasyMock.replay(collector, sink);

    DetectionLoop loop = loop(SignalGroup.CPU, collector, COLLECTION_TIMEOUT_MS, new SampleBuffer(100, 60 * ONE_SECOND_MS),
                              Collections.emptyList(), Collections.emptyList(), sink);
    assertEquals(0, loop.runOnce());
    assertEquals(1, meterCount("cpu-skipped-tick-rate"));
    EasyMock.verify(collector, sink);
  }

  @Test
  public void testEventsAreEmittedOnce() throws Exception {
    SampleCollector collector = EasyMock.mock(SampleCollector.class);
    EasyMock.expect(collector.collect(SignalGroup.CPU.signals()))
            .andReturn(tick(Signal.CPU_PERCENT, START_TIME_MS, 90.0))
            .andReturn(tick(Signal.CPU_PERCENT, START_TIME_MS + ONE_SECOND_MS, 95.0));
    AnomalyEvent event = event(START_TIME_MS, null);
    AnomalyDetector detector = detector();
    Capture<Map<Signal, List<Sample>>> window = EasyMock.newCapture();
    EasyMock.expect(detector.detect(EasyMock.capture(window))).andReturn(Collections.singletonList(event)).times(2);
    EventSink sink = EasyMock.mock(EventSink.class);
    Capture<String> written = EasyMock.newCapture();
    sink.write(EasyMock.capture(written));
    EasyMock.expectLastCall().once();
    EasyMock.replay(collector, detector, sink);

    SampleBuffer buffer = new SampleBuffer(100, 60 * ONE_SECOND_MS);
    DetectionLoop loop = loop(SignalGroup.CPU, collector, COLLECTION_TIMEOUT_MS, buffer,
                              Collections.singletonList(detector), Collections.emptyList(), sink);
    assertEquals(1, loop.runOnce());
    assertEquals(0, loop.runOnce());

    // Detectors see the buffered window, not only the last tick.
    assertEquals(2, window.getValue().get(Signal.CPU_PERCENT).size());
    assertTrue(written.getValue().contains(event.id()));
    assertEquals(2, buffer.size(Signal.CPU_PERCENT));
    assertEquals(1, meterCount("cpu-emitted-event-rate"));
    EasyMock.verify(collector, detector, sink);
  }

  @Test
  public void testInvalidEventAbortsCycle() throws Exception {
    SampleCollector collector = EasyMock.mock(SampleCollector.class);
    EasyMock.expect(collector.collect(SignalGroup.PROCESS.signals()))
            .andReturn(tick(Signal.PROCESS_ALIVE, START_TIME_MS, 1.0))
            .andReturn(tick(Signal.PROCESS_ALIVE, START_TIME_MS + ONE_SECOND_MS, 1.0))
            .andReturn(tick(Signal.PROCESS_ALIVE, START_TIME_MS + 2 * ONE_SECOND_MS, 1.0));
    AnomalyDetector detector = detector();
    EasyMock.expect(detector.detect(EasyMock.anyObject()))
            .andThrow(new IllegalArgumentException("Confidence must be within [0, 1]"))
            .andReturn(Collections.emptyList())
            .times(2);
    EntityHistory initial = EntityHistory.empty(10);
    EntityHistory next = initial.update(Collections.singletonList(new Sample(START_TIME_MS, 1.0, "42")));
    HistoricalAnomalyDetector historical = EasyMock.mock(HistoricalAnomalyDetector.class);
    EasyMock.expect(historical.algorithm()).andReturn(TEST_ALGORITHM).anyTimes();
    EasyMock.expect(historical.emptyHistory()).andReturn(initial);
    EasyMock.expect(historical.detect(EasyMock.anyObject(), EasyMock.same(initial)))
            .andReturn(new HistoricalDetection(Collections.emptyList(), next));
    EasyMock.expect(historical.detect(EasyMock.anyObject(), EasyMock.same(next)))
            .andReturn(new HistoricalDetection(Collections.emptyList(), next));
    EventSink sink = EasyMock.mock(EventSink.class);
    EasyMock.replay(collector, detector, historical, sink);

    SampleBuffer buffer = new SampleBuffer(100, 60 * ONE_SECOND_MS);
    DetectionLoop loop = loop(SignalGroup.PROCESS, collector, COLLECTION_TIMEOUT_MS, buffer,
                              Collections.singletonList(detector), Collections.singletonList(historical), sink);
    assertEquals(0, loop.runOnce());
    assertEquals(1, meterCount("process-aborted-cycle-rate"));
    assertEquals(0, loop.runOnce());
    assertEquals(0, loop.runOnce());
    assertEquals(1, meterCount("process-aborted-cycle-rate"));
    assertEquals(3, buffer.size(Signal.PROCESS_ALIVE));
    EasyMock.verify(collector, detector, historical, sink);
  }

  @Test
  public void testFailedWriteIsRetried() throws Exception {
    SampleCollector collector = EasyMock.mock(SampleCollector.class);
    EasyMock.expect(collector.collect(SignalGroup.DISK.signals()))
            .andReturn(tick(Signal.DISK_IO_IN_PROGRESS, START_TIME_MS, 20.0))
            .andReturn(tick(Signal.DISK_IO_IN_PROGRESS, START_TIME_MS + ONE_SECOND_MS, 20.0));
    AnomalyDetector detector = detector();
    EasyMock.expect(detector.detect(EasyMock.anyObject()))
            .andReturn(Collections.singletonList(event(START_TIME_MS, "sda"))).times(2);
    EventSink sink = EasyMock.mock(EventSink.class);
    sink.write(EasyMock.anyString());
    EasyMock.expectLastCall().andThrow(new IOException("No space left on device"));
    sink.write(EasyMock.anyString());
    EasyMock.expectLastCall();
    EasyMock.replay(collector, detector, sink);

    DetectionLoop loop = loop(SignalGroup.DISK, collector, COLLECTION_TIMEOUT_MS, new SampleBuffer(100, 60 * ONE_SECOND_MS),
                              Collections.singletonList(detector), Collections.emptyList(), sink);
    assertEquals(0, loop.runOnce());
    assertEquals(1, loop.runOnce());
    EasyMock.verify(collector, detector, sink);
  }

  @Test
  public void testUnexpectedFailureDoesNotEscape() throws Exception {
    SampleCollector collector = EasyMock.mock(SampleCollector.class);
    EasyMock.expect(collector.collect(SignalGroup.CPU.signals())).andReturn(tick(Signal.CPU_PERCENT, START_TIME_MS, 1.0));
    AnomalyDetector detector = detector();
    EasyMock.expect(detector.detect(EasyMock.anyObject())).andThrow(new IllegalStateException("Baseline is stale"));
    EventSink sink = EasyMock.mock(EventSink.class);
    EasyMock.replay(collector, detector, sink);

    loop(SignalGroup.CPU, collector, COLLECTION_TIMEOUT_MS, new SampleBuffer(100, 60 * ONE_SECOND_MS),
         Collections.singletonList(detector), Collections.emptyList(), sink).run();
    EasyMock.verify(collector, detector, sink);
  }
}
