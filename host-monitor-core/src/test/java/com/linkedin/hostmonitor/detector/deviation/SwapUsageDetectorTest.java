/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.hostmonitor.detector.deviation;

import com.linkedin.hostmonitor.detector.AnomalyEvent;
import com.linkedin.hostmonitor.detector.AnomalyKind;
import com.linkedin.hostmonitor.detector.Severity;
import com.linkedin.hostmonitor.model.Sample;
import com.linkedin.hostmonitor.model.Signal;
import java.util.Collections;
import java.util.List;
import org.junit.Test;

import static com.linkedin.hostmonitor.HostMonitorUnitTestUtils.ONE_SECOND_MS;
import static com.linkedin.hostmonitor.HostMonitorUnitTestUtils.ofKind;
import static com.linkedin.hostmonitor.HostMonitorUnitTestUtils.samples;
import static com.linkedin.hostmonitor.HostMonitorUnitTestUtils.timeOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;


public class SwapUsageDetectorTest {
  private static final double DELTA = 1e-9;

  @Test
  public void testSpikeAgainstCalmFirstHalf() {
    // A sustained limit of 100% keeps the sustained test quiet.
    SwapUsageDetector detector = new SwapUsageDetector(100.0, 2.0, 0.2, 10);
    List<Sample> samples = samples(ONE_SECOND_MS, 10, 10, 10, 10, 10, 10, 25, 10, 15, 10);
    List<AnomalyEvent> events = detector.detect(Signal.SWAP_USED_PERCENT, samples);
    assertEquals(1, events.size());
    AnomalyEvent spike = events.get(0);
    assertEquals(AnomalyKind.SWAP_SPIKE, spike.kind());
    assertEquals(SwapUsageDetector.SPIKE_ALGORITHM, spike.algorithm());
    assertEquals(timeOf(6, ONE_SECOND_MS), spike.startTimeMs());
    assertEquals(Long.valueOf(spike.startTimeMs()), spike.endTimeMs());
    assertEquals(10.0, spike.baseline(), DELTA);
    assertEquals(20.0, spike.metrics().get("spike_threshold"), DELTA);
    assertEquals(0.2, spike.metrics().get("spike_ratio"), DELTA);
    // 0.5 + 0.2 * 0.3 + (25 / (10 * 10)) * 0.2
    assertEquals(0.61, spike.confidence(), DELTA);
    assertEquals(Severity.WARNING, spike.severity());
  }

  @Test
  public void testSustainedHighUsage() {
    List<AnomalyEvent> events =
        new SwapUsageDetector().detect(Collections.singletonMap(Signal.SWAP_USED_PERCENT,
                                                                samples(ONE_SECOND_MS, 5, 5, 5, 5, 20, 30, 40, 50, 5, 5)));
    List<AnomalyEvent> sustained = ofKind(events, AnomalyKind.SWAP_SUSTAINED_HIGH_USAGE);
    assertEquals(1, sustained.size());
    AnomalyEvent event = sustained.get(0);
    assertEquals(SwapUsageDetector.SUSTAINED_ALGORITHM, event.algorithm());
    assertEquals(timeOf(4, ONE_SECOND_MS), event.startTimeMs());
    assertEquals(Long.valueOf(timeOf(7, ONE_SECOND_MS)), event.endTimeMs());
    assertEquals(0.4, event.metrics().get("run_ratio"), DELTA);
    assertEquals(35.0, event.metrics().get("avg_swap_percent"), DELTA);
    // Five times the limit.
    assertEquals(Severity.CRITICAL, event.severity());
    assertEquals(0.82, event.confidence(), DELTA);
    // The first half averages 8%, so 30%, 40% and 50% are also spikes.
    assertEquals(3, ofKind(events, AnomalyKind.SWAP_SPIKE).size());
  }

  @Test
  public void testRunShorterThanMinimumLengthIsNotSustained() {
    List<AnomalyEvent> events =
        new SwapUsageDetector().detect(Signal.SWAP_USED_PERCENT, samples(ONE_SECOND_MS, 5, 5, 5, 5, 5, 5, 20, 30, 5, 5));
    assertTrue(ofKind(events, AnomalyKind.SWAP_SUSTAINED_HIGH_USAGE).isEmpty());
  }

  @Test
  public void testZeroBaselineSkipsSpikeTest() {
    List<AnomalyEvent> events =
        new SwapUsageDetector().detect(Signal.SWAP_USED_PERCENT, samples(ONE_SECOND_MS, 0, 0, 0, 0, 0, 0, 0, 0, 0, 9));
    assertTrue(events.isEmpty());
  }

  @Test
  public void testInsufficientSamples() {
    assertTrue(new SwapUsageDetector().detect(Signal.SWAP_USED_PERCENT, samples(ONE_SECOND_MS, 50, 50, 50)).isEmpty());
    assertTrue(new SwapUsageDetector().detect(Signal.SWAP_USED_PERCENT, Collections.<Sample>emptyList()).isEmpty());
  }

  @Test
  public void testDetectIsIdempotent() {
    SwapUsageDetector detector = new SwapUsageDetector();
    List<Sample> samples = samples(ONE_SECOND_MS, 5, 5, 5, 5, 20, 30, 40, 50, 5, 5);
    assertEquals(detector.detect(Signal.SWAP_USED_PERCENT, samples), detector.detect(Signal.SWAP_USED_PERCENT, samples));
  }
}
