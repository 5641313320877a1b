/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector.deviation;

import com.linkedin.hostmonitor.stats.BaselineStatistics;
import java.util.Arrays;


/**
 * How the reference level of a group of samples is computed before testing it for deviations.
 */
public enum BaselineMethod {
  /** Median of all samples, for level-style signals. */
  MEDIAN,
  /** Median of the lower half of the sorted samples: the calm level of a signal that spikes upwards. */
  LOWER_HALF_MEDIAN,
  /** Median of the upper half of the sorted samples: the normal level of a signal that drops. */
  UPPER_HALF_MEDIAN,
  /** Mean of the first half of the samples in time order; only the second half is then tested. */
  FIRST_HALF_MEAN;

  private static final BaselineMethod[] CACHED_VALUES = values();

  public static BaselineMethod[] cachedValues() {
    return CACHED_VALUES.clone();
  }

  /**
   * @param values Sample values in time order.
   * @return The baseline of the given values, or {@code 0} if there are none to compute it from.
   */
  public double baselineOf(double[] values) {
    switch (this) {
      case MEDIAN:
        return values.length == 0 ? 0.0 : BaselineStatistics.median(values);
      case LOWER_HALF_MEDIAN:
        return BaselineStatistics.lowerHalfMedian(values);
      case UPPER_HALF_MEDIAN:
        return BaselineStatistics.upperHalfMedian(values);
      case FIRST_HALF_MEAN:
        int half = values.length / 2;
        return half == 0 ? 0.0 : BaselineStatistics.mean(Arrays.copyOfRange(values, 0, half));
      default:
        throw new IllegalStateException("Unknown baseline method " + this);
    }
  }

  /**
   * @param size Number of samples in the group.
   * @return Index of the first sample that may be tested against this baseline.
   */
  public int firstTestedIndex(int size) {
    return this == FIRST_HALF_MEAN ? size / 2 : 0;
  }
}
