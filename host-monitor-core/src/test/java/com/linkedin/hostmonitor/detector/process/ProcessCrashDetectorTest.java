/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.hostmonitor.detector.process;

import com.linkedin.hostmonitor.detector.AnomalyEvent;
import com.linkedin.hostmonitor.detector.AnomalyKind;
import com.linkedin.hostmonitor.detector.Severity;
import com.linkedin.hostmonitor.model.Sample;
import com.linkedin.hostmonitor.model.Signal;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;

import static com.linkedin.hostmonitor.HostMonitorUnitTestUtils.ONE_SECOND_MS;
import static com.linkedin.hostmonitor.HostMonitorUnitTestUtils.START_TIME_MS;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;


public class ProcessCrashDetectorTest {

  private static List<Sample> tick(int tick, double alive, String... pids) {
    Sample[] samples = new Sample[pids.length];
    for (int i = 0; i < pids.length; i++) {
      samples[i] = new Sample(START_TIME_MS + tick * ONE_SECOND_MS, alive, pids[i]);
    }
    return Arrays.asList(samples);
  }

  @Test
  public void testDisappearedProcessIsReported() {
    ProcessCrashDetector detector = new ProcessCrashDetector();
    HistoricalDetection first = detector.detect(tick(0, 1.0, "1", "2", "3"), detector.emptyHistory());
    assertTrue(first.events().isEmpty());
    assertEquals(3, first.history().entities().size());

    HistoricalDetection second = detector.detect(tick(1, 1.0, "1", "3"), first.history());
    assertEquals(1, second.events().size());
    AnomalyEvent crash = second.events().get(0);
    assertEquals(AnomalyKind.PROCESS_CRASH, crash.kind());
    assertEquals(ProcessCrashDetector.ALGORITHM, crash.algorithm());
    assertEquals(Severity.CRITICAL, crash.severity());
    assertEquals(ProcessCrashDetector.CRASH_CONFIDENCE, crash.confidence(), 1e-9);
    assertEquals("2", crash.entity());
    assertEquals(START_TIME_MS, crash.startTimeMs());
    assertEquals(Long.valueOf(START_TIME_MS + ONE_SECOND_MS), crash.endTimeMs());
    assertEquals(1.0, crash.metrics().get("disappeared_count"), 1e-9);
    assertEquals(Arrays.asList("1", "3"), Arrays.asList(second.history().entities().toArray()));
  }

  @Test
  public void testTickWithoutSamplesKeepsHistory() {
    ProcessCrashDetector detector = new ProcessCrashDetector();
    EntityHistory history = detector.detect(tick(0, 1.0, "1", "2"), detector.emptyHistory()).history();
    HistoricalDetection empty = detector.detect(Collections.<Sample>emptyList(), history);
    assertTrue(empty.events().isEmpty());
    assertSame(history, empty.history());
    HistoricalDetection missingSignal = detector.detect(Collections.<Signal, List<Sample>>emptyMap(), history);
    assertSame(history, missingSignal.history());
  }

  @Test
  public void testProcessReportedDeadIsCrashed() {
    ProcessCrashDetector detector = new ProcessCrashDetector();
    EntityHistory history = detector.detect(tick(0, 1.0, "1", "2"), detector.emptyHistory()).history();
    List<Sample> current = Arrays.asList(new Sample(START_TIME_MS + ONE_SECOND_MS, 1.0, "1"),
                                         new Sample(START_TIME_MS + ONE_SECOND_MS, 0.0, "2"));
    HistoricalDetection detection = detector.detect(current, history);
    assertEquals(1, detection.events().size());
    assertEquals("2", detection.events().get(0).entity());
  }

  @Test
  public void testIndependentInstancesDoNotShareState() {
    ProcessCrashDetector first = new ProcessCrashDetector();
    ProcessCrashDetector second = new ProcessCrashDetector();
    EntityHistory history = first.detect(tick(0, 1.0, "1", "2"), first.emptyHistory()).history();
    // The second instance has seen nothing, so nothing can disappear.
    assertTrue(second.detect(tick(1, 1.0, "1"), second.emptyHistory()).events().isEmpty());
    assertEquals(1, first.detect(tick(1, 1.0, "1"), history).events().size());
  }
}
