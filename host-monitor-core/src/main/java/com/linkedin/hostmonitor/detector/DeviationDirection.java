/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector;

/**
 * The direction in which a sample must go beyond a limit to count as deviating.
 */
public enum DeviationDirection {
  ABOVE, BELOW;

  /**
   * @param value A sample value.
   * @param limit The limit.
   * @return {@code true} if the value is strictly beyond the limit in this direction.
   */
  public boolean isBeyond(double value, double limit) {
    return this == ABOVE ? value > limit : value < limit;
  }
}
