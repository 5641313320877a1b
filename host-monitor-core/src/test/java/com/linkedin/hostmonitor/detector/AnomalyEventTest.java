/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.hostmonitor.detector;

import org.junit.Test;

import static com.linkedin.hostmonitor.HostMonitorUnitTestUtils.ONE_MINUTE_MS;
import static com.linkedin.hostmonitor.HostMonitorUnitTestUtils.START_TIME_MS;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;


public class AnomalyEventTest {

  private static AnomalyEvent.Builder builder() {
    return new AnomalyEvent.Builder(AnomalyKind.HIGH_CPU, "static_threshold", START_TIME_MS)
        .endTimeMs(START_TIME_MS + 5 * ONE_MINUTE_MS)
        .severity(Severity.CRITICAL)
        .confidence(0.9)
        .metric("avg_cpu", 92.0)
        .baseline(80.0);
  }

  @Test
  public void testDerivedIdIsStable() {
    AnomalyEvent first = builder().build();
    AnomalyEvent second = builder().build();
    assertEquals(first.id(), second.id());
    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    assertEquals(300.0, first.durationSeconds(), 1e-9);
    assertNull(first.entity());
  }

  @Test
  public void testIdDependsOnEntityAndWindow() {
    AnomalyEvent systemWide = builder().build();
    assertNotEquals(systemWide.id(), builder().entity("42").build().id());
    assertNotEquals(systemWide.id(), builder().endTimeMs(START_TIME_MS + ONE_MINUTE_MS).build().id());
    assertEquals("explicit", builder().id("explicit").build().id());
  }

  @Test
  public void testOpenEndedEventHasNoDuration() {
    AnomalyEvent event = builder().endTimeMs(null).build();
    assertNull(event.endTimeMs());
    assertEquals(0.0, event.durationSeconds(), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testConfidenceAboveOne() {
    builder().confidence(1.01).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNaNConfidence() {
    builder().confidence(Double.NaN).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEndBeforeStart() {
    builder().endTimeMs(START_TIME_MS - 1).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonFiniteMetric() {
    builder().metric("z_score", Double.POSITIVE_INFINITY).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonFiniteBaseline() {
    builder().baseline(Double.NaN).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingSeverity() {
    builder().severity(null).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyAlgorithm() {
    new AnomalyEvent.Builder(AnomalyKind.HIGH_CPU, "", START_TIME_MS).build();
  }
}
