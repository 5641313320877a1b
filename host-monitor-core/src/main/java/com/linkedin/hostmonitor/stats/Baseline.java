/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.stats;

import java.util.Objects;


/**
 * Summary statistics of a historical sample window, used as the adaptive reference for "normal".
 */
public final class Baseline {
  private final double _mean;
  private final double _stdDev;
  private final double _min;
  private final double _max;
  private final double _percentile95;
  private final int _windowSize;
  private final long _computedAtMs;

  public Baseline(double mean, double stdDev, double min, double max, double percentile95, int windowSize, long computedAtMs) {
    _mean = mean;
    _stdDev = stdDev;
    _min = min;
    _max = max;
    _percentile95 = percentile95;
    _windowSize = windowSize;
    _computedAtMs = computedAtMs;
  }

  /**
   * @param stdMultiplier Number of standard deviations above the mean.
   * @return {@code mean + stdDev * stdMultiplier}.
   */
  public double threshold(double stdMultiplier) {
    return _mean + _stdDev * stdMultiplier;
  }

  /**
   * @param value A value.
   * @return The z-score of the value, or {@code 0} if the standard deviation is zero.
   */
  public double zScore(double value) {
    return _stdDev == 0.0 ? 0.0 : (value - _mean) / _stdDev;
  }

  public double mean() {
    return _mean;
  }

  public double stdDev() {
    return _stdDev;
  }

  public double min() {
    return _min;
  }

  public double max() {
    return _max;
  }

  public double percentile95() {
    return _percentile95;
  }

  public int windowSize() {
    return _windowSize;
  }

  public long computedAtMs() {
    return _computedAtMs;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Baseline)) {
      return false;
    }
    Baseline other = (Baseline) o;
    return Double.compare(_mean, other._mean) == 0 && Double.compare(_stdDev, other._stdDev) == 0
           && Double.compare(_min, other._min) == 0 && Double.compare(_max, other._max) == 0
           && Double.compare(_percentile95, other._percentile95) == 0 && _windowSize == other._windowSize
           && _computedAtMs == other._computedAtMs;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_mean, _stdDev, _min, _max, _percentile95, _windowSize, _computedAtMs);
  }

  @Override
  public String toString() {
    return String.format("{mean=%.2f, stdDev=%.2f, min=%.2f, max=%.2f, p95=%.2f, windowSize=%d}",
                         _mean, _stdDev, _min, _max, _percentile95, _windowSize);
  }
}
