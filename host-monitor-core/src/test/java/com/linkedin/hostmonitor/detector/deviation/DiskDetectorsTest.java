/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.hostmonitor.detector.deviation;

import com.linkedin.hostmonitor.detector.AnomalyEvent;
import com.linkedin.hostmonitor.detector.AnomalyKind;
import com.linkedin.hostmonitor.detector.Severity;
import com.linkedin.hostmonitor.model.Sample;
import com.linkedin.hostmonitor.model.Signal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.Test;

import static com.linkedin.hostmonitor.HostMonitorUnitTestUtils.ONE_SECOND_MS;
import static com.linkedin.hostmonitor.HostMonitorUnitTestUtils.concat;
import static com.linkedin.hostmonitor.HostMonitorUnitTestUtils.constant;
import static com.linkedin.hostmonitor.HostMonitorUnitTestUtils.ofKind;
import static com.linkedin.hostmonitor.HostMonitorUnitTestUtils.samples;
import static com.linkedin.hostmonitor.HostMonitorUnitTestUtils.timeOf;
import static com.linkedin.hostmonitor.config.constants.DiskDetectionConfig.DISK_QUEUE_DEPTH_THRESHOLD_CONFIG;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;


public class DiskDetectorsTest {
  private static final double DELTA = 1e-9;

  @Test
  public void testQueueCongestionPerDevice() {
    List<Sample> samples = concat(samples("sda", ONE_SECOND_MS, 2, 2, 2, 15, 16, 18, 20, 2, 2, 2),
                                  samples("sdb", ONE_SECOND_MS, constant(10, 2.0)));
    List<AnomalyEvent> events = new QueueDepthDetector().detect(Signal.DISK_IO_IN_PROGRESS, samples);
    assertEquals(1, events.size());
    AnomalyEvent event = events.get(0);
    assertEquals(AnomalyKind.IO_QUEUE_CONGESTION, event.kind());
    assertEquals(QueueDepthDetector.ALGORITHM, event.algorithm());
    assertEquals("sda", event.entity());
    assertEquals("sda", event.attributes().get(DiskLatencyDetector.DEVICE_ATTRIBUTE));
    assertEquals(timeOf(3, ONE_SECOND_MS), event.startTimeMs());
    assertEquals(Long.valueOf(timeOf(6, ONE_SECOND_MS)), event.endTimeMs());
    assertEquals(0.82, event.confidence(), DELTA);
    assertEquals(Severity.WARNING, event.severity());
    assertEquals(2.0, event.baseline(), DELTA);
  }

  @Test
  public void testQueueCongestionBelowMinimumConfidenceIsDropped() {
    // A single sample above the limit with a sustained ratio of 0.1 scores 0.5 + 0.03 + 0.11.
    QueueDepthDetector detector = new QueueDepthDetector(10.0, 0.1, 10, 0.7);
    assertTrue(detector.detect(Signal.DISK_IO_IN_PROGRESS,
                               samples("sda", ONE_SECOND_MS, 2, 2, 2, 11, 2, 2, 2, 2, 2, 2)).isEmpty());
  }

  @Test
  public void testThroughputDrop() {
    List<Sample> samples = samples("sda", ONE_SECOND_MS, 100, 100, 100, 100, 100, 100, 10, 10, 10, 100);
    List<AnomalyEvent> events = new DiskThroughputDetector().detect(Signal.DISK_READ_BYTES, samples);
    assertEquals(1, events.size());
    AnomalyEvent event = events.get(0);
    assertEquals(AnomalyKind.THROUGHPUT_DROP_READ, event.kind());
    assertEquals(DiskThroughputDetector.ALGORITHM, event.algorithm());
    assertEquals("read", event.attributes().get(DiskLatencyDetector.IO_TYPE_ATTRIBUTE));
    assertEquals(100.0, event.baseline(), DELTA);
    assertEquals(50.0, event.metrics().get("limit"), DELTA);
    assertEquals(10.0, event.metrics().get("magnitude_ratio"), DELTA);
    assertEquals(Severity.CRITICAL, event.severity());
    // 0.5 + 0.3 * 0.3 + 0.9 * 0.2
    assertEquals(0.77, event.confidence(), DELTA);
  }

  @Test
  public void testThroughputSpikeOnWrites() {
    List<Sample> samples = samples("nvme0n1", ONE_SECOND_MS, 100, 100, 100, 100, 100, 100, 100, 100, 100, 1000);
    List<AnomalyEvent> events = new DiskThroughputDetector().detect(Signal.DISK_WRITE_BYTES, samples);
    assertEquals(1, events.size());
    assertEquals(AnomalyKind.THROUGHPUT_SPIKE_WRITE, events.get(0).kind());
    assertEquals("write", events.get(0).attributes().get(DiskLatencyDetector.IO_TYPE_ATTRIBUTE));
    assertEquals(timeOf(9, ONE_SECOND_MS), events.get(0).startTimeMs());
  }

  @Test
  public void testLatencySpikeAgainstCalmLevel() {
    Map<Signal, List<Sample>> samplesBySignal = new HashMap<>();
    samplesBySignal.put(Signal.DISK_WRITE_LATENCY_MS, samples("sda", ONE_SECOND_MS, 5, 5, 5, 5, 5, 5, 5, 5, 5, 400));
    samplesBySignal.put(Signal.DISK_READ_LATENCY_MS, samples("sda", ONE_SECOND_MS, constant(10, 5.0)));
    List<AnomalyEvent> events = new DiskLatencyDetector().detect(samplesBySignal);
    assertEquals(1, events.size());
    AnomalyEvent event = events.get(0);
    assertEquals(AnomalyKind.IO_LATENCY_SPIKE_WRITE, event.kind());
    assertEquals(DiskLatencyDetector.ALGORITHM, event.algorithm());
    assertEquals(5.0, event.baseline(), DELTA);
    assertEquals(100.0, event.metrics().get("spike_threshold"), DELTA);
    assertEquals(Severity.CRITICAL, event.severity());
    // 0.5 + 0.1 * 0.3 + 1.0 * 0.2
    assertEquals(0.73, event.confidence(), DELTA);
  }

  @Test
  public void testSustainedLatency() {
    List<Sample> samples = samples("sdb", ONE_SECOND_MS, 5, 5, 5, 5, 5, 150, 150, 150, 150, 150);
    List<AnomalyEvent> events = new DiskLatencyDetector().detect(Signal.DISK_READ_LATENCY_MS, samples);
    // Each sample of the run is also a spike against the calm level of 5 ms.
    assertEquals(5, ofKind(events, AnomalyKind.IO_LATENCY_SPIKE_READ).size());
    List<AnomalyEvent> sustained = ofKind(events, AnomalyKind.IO_LATENCY_SUSTAINED_READ);
    assertEquals(1, sustained.size());
    assertEquals(timeOf(5, ONE_SECOND_MS), sustained.get(0).startTimeMs());
    assertEquals(Long.valueOf(timeOf(9, ONE_SECOND_MS)), sustained.get(0).endTimeMs());
  }

  @Test
  public void testParallelGroupsMatchSequentialGroups() throws InterruptedException {
    List<Sample> samples = concat(samples("sda", ONE_SECOND_MS, 2, 2, 2, 15, 16, 18, 20, 2, 2, 2),
                                  samples("sdb", ONE_SECOND_MS, 2, 30, 30, 30, 30, 30, 30, 30, 2, 2),
                                  samples("sdc", ONE_SECOND_MS, constant(10, 2.0)));
    QueueDepthDetector detector = new QueueDepthDetector();
    ExecutorService executor = Executors.newFixedThreadPool(3);
    try {
      List<AnomalyEvent> sequential = detector.detect(Signal.DISK_IO_IN_PROGRESS, samples);
      assertEquals(2, sequential.size());
      assertEquals(sequential, detector.detect(Signal.DISK_IO_IN_PROGRESS, samples, executor));
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  public void testConfigure() {
    QueueDepthDetector detector = new QueueDepthDetector();
    Map<String, Object> configs = new HashMap<>();
    configs.put(DISK_QUEUE_DEPTH_THRESHOLD_CONFIG, "25");
    detector.configure(configs);
    assertTrue(detector.detect(Signal.DISK_IO_IN_PROGRESS,
                               samples("sda", ONE_SECOND_MS, 2, 2, 2, 15, 16, 18, 20, 2, 2, 2)).isEmpty());
  }
}
