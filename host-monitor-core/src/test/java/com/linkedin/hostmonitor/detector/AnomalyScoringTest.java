/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.hostmonitor.detector;

import org.junit.Test;

import static com.linkedin.hostmonitor.detector.AnomalyScoring.deviationConfidence;
import static com.linkedin.hostmonitor.detector.AnomalyScoring.deviationSeverity;
import static com.linkedin.hostmonitor.detector.AnomalyScoring.levelSeverity;
import static com.linkedin.hostmonitor.detector.AnomalyScoring.magnitudeRatio;
import static com.linkedin.hostmonitor.detector.AnomalyScoring.magnitudeTerm;
import static com.linkedin.hostmonitor.detector.AnomalyScoring.thresholdConfidence;
import static com.linkedin.hostmonitor.detector.AnomalyScoring.timeToImpactSeverity;
import static com.linkedin.hostmonitor.detector.AnomalyScoring.zScoreConfidence;
import static com.linkedin.hostmonitor.detector.AnomalyScoring.zScoreSeverity;
import static org.junit.Assert.assertEquals;


public class AnomalyScoringTest {
  private static final double DELTA = 1e-9;

  @Test
  public void testSeverityBoundaries() {
    assertEquals(Severity.WARNING, levelSeverity(90.0));
    assertEquals(Severity.CRITICAL, levelSeverity(90.1));
    assertEquals(Severity.CRITICAL, levelSeverity(95.0));
    assertEquals(Severity.EMERGENCY, levelSeverity(95.1));

    assertEquals(Severity.WARNING, zScoreSeverity(3.0));
    assertEquals(Severity.CRITICAL, zScoreSeverity(4.0));
    assertEquals(Severity.EMERGENCY, zScoreSeverity(11.0));

    assertEquals(Severity.EMERGENCY, timeToImpactSeverity(0.0));
    assertEquals(Severity.CRITICAL, timeToImpactSeverity(1.0));
    assertEquals(Severity.WARNING, timeToImpactSeverity(6.0));
  }

  @Test
  public void testDeviationSeverity() {
    assertEquals(Severity.WARNING, deviationSeverity(2.0, 0.1));
    assertEquals(Severity.CRITICAL, deviationSeverity(5.0, 0.1));
    assertEquals(Severity.CRITICAL, deviationSeverity(1.0, 0.7));
    assertEquals(Severity.CRITICAL, deviationSeverity(20.0, 0.5));
    assertEquals(Severity.EMERGENCY, deviationSeverity(10.0, 0.7));
  }

  @Test
  public void testConfidenceIsClamped() {
    assertEquals(0.0, thresholdConfidence(0.0, 80.0), DELTA);
    assertEquals(1.0, thresholdConfidence(100.0, 80.0), DELTA);
    assertEquals(0.75, zScoreConfidence(2.5), DELTA);
    assertEquals(0.0, zScoreConfidence(-10.0), DELTA);
    assertEquals(1.0, deviationConfidence(5.0, 5.0), DELTA);
    assertEquals(0.5, deviationConfidence(-1.0, Double.NaN), DELTA);
  }

  @Test
  public void testMagnitudeGuardsItsDenominators() {
    assertEquals(0.0, magnitudeRatio(50.0, 0.0, DeviationDirection.ABOVE), DELTA);
    assertEquals(AnomalyScoring.MAGNITUDE_RATIO_EMERGENCY, magnitudeRatio(0.0, 100.0, DeviationDirection.BELOW), DELTA);
    assertEquals(4.0, magnitudeRatio(25.0, 100.0, DeviationDirection.BELOW), DELTA);
    assertEquals(0.0, magnitudeTerm(50.0, 0.0, DeviationDirection.ABOVE, 10.0), DELTA);
    assertEquals(0.25, magnitudeTerm(25.0, 10.0, DeviationDirection.ABOVE, 10.0), DELTA);
    assertEquals(0.75, magnitudeTerm(25.0, 100.0, DeviationDirection.BELOW, 1.0), DELTA);
  }
}
