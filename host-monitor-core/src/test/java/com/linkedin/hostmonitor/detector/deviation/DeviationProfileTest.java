/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.hostmonitor.detector.deviation;

import com.linkedin.hostmonitor.detector.AnomalyKind;
import com.linkedin.hostmonitor.detector.DeviationDirection;
import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;


public class DeviationProfileTest {

  @Test(expected = IllegalArgumentException.class)
  public void testAtLeastOneTestIsRequired() {
    new DeviationProfile.Builder("queue_depth", 10).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSustainedRatioMustBePositive() {
    new DeviationProfile.Builder("queue_depth", 10)
        .sustainedBeyond(AnomalyKind.IO_QUEUE_CONGESTION, "threshold_sustained", DeviationDirection.ABOVE, 10.0)
        .sustainedRatio(0.0)
        .build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMinimumConfidenceWithinUnitInterval() {
    new DeviationProfile.Builder("swap_percent", 10)
        .minConfidence(1.5)
        .spike(AnomalyKind.SWAP_SPIKE, "swap_spike_detection", BaselineMethod.FIRST_HALF_MEAN, 2.0)
        .build();
  }

  @Test
  public void testSpikeOnlyProfile() {
    DeviationProfile profile = new DeviationProfile.Builder("swap_percent", 10)
        .spike(AnomalyKind.SWAP_SPIKE, "swap_spike_detection", BaselineMethod.FIRST_HALF_MEAN, 2.0)
        .build();
    assertTrue(profile.hasSpikeTest());
    assertFalse(profile.hasSustainedTest());
    assertNull(profile.absoluteThreshold());
  }
}
