/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.hostmonitor.agent.sampling;

import com.linkedin.hostmonitor.detector.AnomalyEvent;
import com.linkedin.hostmonitor.detector.trend.MemoryLeakDetector;
import com.linkedin.hostmonitor.model.Sample;
import com.linkedin.hostmonitor.model.Signal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;

import static com.linkedin.hostmonitor.agent.HostMonitorAgentUnitTestUtils.ONE_SECOND_MS;
import static com.linkedin.hostmonitor.agent.HostMonitorAgentUnitTestUtils.START_TIME_MS;
import static com.linkedin.hostmonitor.agent.HostMonitorAgentUnitTestUtils.tick;
import static com.linkedin.hostmonitor.agent.config.constants.MonitorConfig.DEFAULT_SAMPLE_BUFFER_CAPACITY_PER_ENTITY;
import static com.linkedin.hostmonitor.agent.config.constants.MonitorConfig.DEFAULT_SAMPLE_BUFFER_RETENTION_MS;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class SampleBufferTest {
  private static final long ONE_HOUR_MS = 3600 * ONE_SECOND_MS;

  @Test
  public void testSamplesOlderThanNewestAreDropped() {
    SampleBuffer buffer = new SampleBuffer(100, ONE_HOUR_MS);
    List<Sample> samples = Arrays.asList(new Sample(START_TIME_MS + 2 * ONE_SECOND_MS, 1.0),
                                         new Sample(START_TIME_MS + ONE_SECOND_MS, 2.0),
                                         new Sample(START_TIME_MS + 3 * ONE_SECOND_MS, 3.0));
    assertEquals(2, buffer.append(Collections.singletonMap(Signal.CPU_PERCENT, samples)));
    // A later tick cannot rewrite history either.
    assertEquals(0, buffer.append(tick(Signal.CPU_PERCENT, START_TIME_MS, 4.0)));

    List<Sample> buffered = buffer.snapshot(EnumSet.of(Signal.CPU_PERCENT)).get(Signal.CPU_PERCENT);
    assertEquals(2, buffered.size());
    assertEquals(1.0, buffered.get(0).value(), 0.0);
    assertEquals(3.0, buffered.get(1).value(), 0.0);
  }

  @Test
  public void testOrderingIsPerEntity() {
    SampleBuffer buffer = new SampleBuffer(100, ONE_HOUR_MS);
    buffer.append(Collections.singletonMap(Signal.PROCESS_OPEN_FDS,
                                           Collections.singletonList(new Sample(START_TIME_MS + 5 * ONE_SECOND_MS, 10, "1"))));
    assertEquals(1, buffer.append(Collections.singletonMap(Signal.PROCESS_OPEN_FDS,
                                                           Collections.singletonList(new Sample(START_TIME_MS, 20, "2")))));

    List<Sample> buffered = buffer.snapshot(EnumSet.of(Signal.PROCESS_OPEN_FDS)).get(Signal.PROCESS_OPEN_FDS);
    assertEquals(2, buffered.size());
    assertEquals("2", buffered.get(0).entityKey());
    assertEquals("1", buffered.get(1).entityKey());
  }

  @Test
  public void testCapacityEvictsOldestSamples() {
    SampleBuffer buffer = new SampleBuffer(3, ONE_HOUR_MS);
    buffer.append(tick(Signal.CPU_PERCENT, START_TIME_MS, 0, 1, 2, 3, 4));
    buffer.append(tick(Signal.MEMORY_USED_PERCENT, START_TIME_MS, 50));

    List<Sample> buffered = buffer.snapshot(EnumSet.of(Signal.CPU_PERCENT)).get(Signal.CPU_PERCENT);
    assertEquals(3, buffer.size(Signal.CPU_PERCENT));
    assertEquals(4, buffer.size());
    for (int i = 0; i < buffered.size(); i++) {
      assertEquals(i + 2, buffered.get(i).value(), 0.0);
    }
  }

  @Test
  public void testCapacityIsPerEntity() {
    SampleBuffer buffer = new SampleBuffer(3, ONE_HOUR_MS);
    List<Sample> samples = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      samples.add(new Sample(START_TIME_MS + i * ONE_SECOND_MS, i, "1"));
      samples.add(new Sample(START_TIME_MS + i * ONE_SECOND_MS, 10 + i, "2"));
    }
    samples.add(new Sample(START_TIME_MS, 100, "3"));
    buffer.append(Collections.singletonMap(Signal.PROCESS_OPEN_FDS, samples));

    List<Sample> buffered = buffer.snapshot(EnumSet.of(Signal.PROCESS_OPEN_FDS)).get(Signal.PROCESS_OPEN_FDS);
    assertEquals(7, buffered.size());
    assertEquals(1, buffered.stream().filter(s -> "3".equals(s.entityKey())).count());
    for (Sample sample : buffered) {
      if (!"3".equals(sample.entityKey())) {
        assertTrue(sample.timeMs() >= START_TIME_MS + 2 * ONE_SECOND_MS);
      }
    }
  }

  @Test
  public void testManyProcessesKeepEnoughHistoryForLeakDetection() {
    int numProcesses = 60;
    int numTicks = 150;
    SampleBuffer buffer = new SampleBuffer(DEFAULT_SAMPLE_BUFFER_CAPACITY_PER_ENTITY, DEFAULT_SAMPLE_BUFFER_RETENTION_MS);
    for (int t = 0; t < numTicks; t++) {
      List<Sample> rss = new ArrayList<>(numProcesses);
      for (int pid = 0; pid < numProcesses; pid++) {
        // 1 MB per second.
        rss.add(new Sample(START_TIME_MS + t * ONE_SECOND_MS, 1000.0 + t, Integer.toString(pid)));
      }
      buffer.append(Collections.singletonMap(Signal.PROCESS_RSS_MB, rss));
    }
    assertEquals(numProcesses * numTicks, buffer.size(Signal.PROCESS_RSS_MB));

    List<Sample> buffered = buffer.snapshot(EnumSet.of(Signal.PROCESS_RSS_MB)).get(Signal.PROCESS_RSS_MB);
    List<AnomalyEvent> events = new MemoryLeakDetector().detect(buffered);
    assertEquals(numProcesses, events.size());
  }

  @Test
  public void testRetentionIsRelativeToNewestSample() {
    SampleBuffer buffer = new SampleBuffer(100, 10 * ONE_SECOND_MS);
    buffer.append(tick(Signal.CPU_PERCENT, START_TIME_MS, 1.0));
    buffer.append(tick(Signal.CPU_PERCENT, START_TIME_MS + 5 * ONE_SECOND_MS, 2.0));
    assertEquals(2, buffer.size(Signal.CPU_PERCENT));

    buffer.append(tick(Signal.CPU_PERCENT, START_TIME_MS + 20 * ONE_SECOND_MS, 3.0));
    List<Sample> buffered = buffer.snapshot(EnumSet.of(Signal.CPU_PERCENT)).get(Signal.CPU_PERCENT);
    assertEquals(1, buffered.size());
    assertEquals(3.0, buffered.get(0).value(), 0.0);
  }

  @Test
  public void testSnapshotOfMissingSignalIsEmpty() {
    SampleBuffer buffer = new SampleBuffer(100, ONE_HOUR_MS);
    Map<Signal, List<Sample>> snapshot = buffer.snapshot(EnumSet.of(Signal.SWAP_USED_PERCENT, Signal.CPU_PERCENT));
    assertEquals(2, snapshot.size());
    assertTrue(snapshot.get(Signal.SWAP_USED_PERCENT).isEmpty());
    assertTrue(snapshot.get(Signal.CPU_PERCENT).isEmpty());
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testSnapshotIsUnmodifiable() {
    SampleBuffer buffer = new SampleBuffer(100, ONE_HOUR_MS);
    buffer.append(tick(Signal.CPU_PERCENT, START_TIME_MS, 1.0));
    buffer.snapshot(EnumSet.of(Signal.CPU_PERCENT)).get(Signal.CPU_PERCENT).add(new Sample(START_TIME_MS, 2.0));
  }

  @Test
  public void testMissingSamplesAreSkipped() {
    SampleBuffer buffer = new SampleBuffer(100, ONE_HOUR_MS);
    Map<Signal, List<Sample>> samples = new HashMap<>();
    samples.put(Signal.CPU_PERCENT, null);
    samples.put(Signal.MEMORY_USED_PERCENT, Arrays.asList(null, new Sample(START_TIME_MS, 1.0)));
    assertEquals(1, buffer.append(samples));
    assertEquals(0, buffer.size(Signal.CPU_PERCENT));
    assertEquals(1, buffer.size(Signal.MEMORY_USED_PERCENT));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveCapacity() {
    new SampleBuffer(0, ONE_HOUR_MS);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveRetention() {
    new SampleBuffer(10, 0L);
  }
}
