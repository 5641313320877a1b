/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.hostmonitor.agent.detector;

import com.linkedin.hostmonitor.detector.AnomalyEvent;
import com.linkedin.hostmonitor.detector.Severity;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;

import static com.linkedin.hostmonitor.agent.HostMonitorAgentUnitTestUtils.ONE_SECOND_MS;
import static com.linkedin.hostmonitor.agent.HostMonitorAgentUnitTestUtils.START_TIME_MS;
import static com.linkedin.hostmonitor.agent.HostMonitorAgentUnitTestUtils.event;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class EmittedEventCacheTest {

  @Test
  public void testEmittedEventsAreFilteredOut() {
    EmittedEventCache cache = new EmittedEventCache(10);
    AnomalyEvent first = event(START_TIME_MS, "sda");
    AnomalyEvent second = event(START_TIME_MS, "sdb");
    assertEquals(Arrays.asList(first, second), cache.unseen(Arrays.asList(first, second)));

    cache.markEmitted(Collections.singletonList(first));
    assertEquals(Collections.singletonList(second), cache.unseen(Arrays.asList(first, second)));
  }

  @Test
  public void testGrownWindowIsReportedAgain() {
    EmittedEventCache cache = new EmittedEventCache(10);
    AnomalyEvent early = event(START_TIME_MS, null);
    cache.markEmitted(Collections.singletonList(early));
    assertTrue(cache.unseen(Collections.singletonList(event(START_TIME_MS, null))).isEmpty());

    AnomalyEvent longer = new AnomalyEvent.Builder(early.kind(), early.algorithm(), START_TIME_MS)
        .endTimeMs(START_TIME_MS + 600 * ONE_SECOND_MS)
        .severity(early.severity())
        .build();
    assertEquals(Collections.singletonList(longer), cache.unseen(Collections.singletonList(longer)));
    cache.markEmitted(Collections.singletonList(longer));
    assertTrue(cache.unseen(Collections.singletonList(longer)).isEmpty());
    assertEquals(1, cache.size());
    assertEquals(1, cache.unseen(Collections.singletonList(event(START_TIME_MS + ONE_SECOND_MS, null))).size());
  }

  @Test
  public void testEscalatedEventIsReportedAgain() {
    EmittedEventCache cache = new EmittedEventCache(10);
    AnomalyEvent warning = event(START_TIME_MS, "1");
    cache.markEmitted(Collections.singletonList(warning));
    AnomalyEvent critical = new AnomalyEvent.Builder(warning.kind(), warning.algorithm(), START_TIME_MS)
        .endTimeMs(warning.endTimeMs())
        .severity(Severity.CRITICAL)
        .entity("1")
        .build();
    assertEquals(1, cache.unseen(Collections.singletonList(critical)).size());
  }

  @Test
  public void testReportedAgainEventIsRecent() {
    EmittedEventCache cache = new EmittedEventCache(2);
    AnomalyEvent first = event(START_TIME_MS, "1");
    cache.markEmitted(Arrays.asList(first, event(START_TIME_MS, "2")));
    AnomalyEvent firstGrown = new AnomalyEvent.Builder(first.kind(), first.algorithm(), START_TIME_MS)
        .endTimeMs(first.endTimeMs() + ONE_SECOND_MS)
        .entity("1")
        .build();
    cache.markEmitted(Collections.singletonList(firstGrown));
    // Evicts "2", the eldest entry.
    cache.markEmitted(Collections.singletonList(event(START_TIME_MS, "3")));
    assertTrue(cache.unseen(Collections.singletonList(firstGrown)).isEmpty());
    assertEquals(1, cache.unseen(Collections.singletonList(event(START_TIME_MS, "2"))).size());
  }

  @Test
  public void testDuplicatesWithinOneBatch() {
    EmittedEventCache cache = new EmittedEventCache(10);
    List<AnomalyEvent> unseen = cache.unseen(Arrays.asList(event(START_TIME_MS, "1"), event(START_TIME_MS, "1")));
    assertEquals(1, unseen.size());
  }

  @Test
  public void testOldestEntriesAreEvicted() {
    EmittedEventCache cache = new EmittedEventCache(2);
    for (int i = 0; i < 3; i++) {
      cache.markEmitted(Collections.singletonList(event(START_TIME_MS + i * ONE_SECOND_MS, null)));
    }
    assertEquals(2, cache.size());
    assertEquals(1, cache.unseen(Collections.singletonList(event(START_TIME_MS, null))).size());
    assertTrue(cache.unseen(Collections.singletonList(event(START_TIME_MS + 2 * ONE_SECOND_MS, null))).isEmpty());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveCapacity() {
    new EmittedEventCache(0);
  }
}
