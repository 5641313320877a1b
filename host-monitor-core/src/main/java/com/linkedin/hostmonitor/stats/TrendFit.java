/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.stats;

/**
 * A least-squares line of sample values against seconds elapsed since the first sample.
 */
public final class TrendFit {
  /**
   * The fit of degenerate input: no slope and no explanatory power.
   */
  public static final TrendFit NONE = new TrendFit(0.0, 0.0, 0.0, 0L);
  private final double _slopePerSecond;
  private final double _intercept;
  private final double _rSquared;
  private final long _originMs;

  public TrendFit(double slopePerSecond, double intercept, double rSquared, long originMs) {
    if (!(rSquared >= 0.0 && rSquared <= 1.0)) {
      throw new IllegalArgumentException("R-squared " + rSquared + " must be within [0, 1].");
    }
    _slopePerSecond = slopePerSecond;
    _intercept = intercept;
    _rSquared = rSquared;
    _originMs = originMs;
  }

  public double slopePerSecond() {
    return _slopePerSecond;
  }

  public double intercept() {
    return _intercept;
  }

  public double rSquared() {
    return _rSquared;
  }

  /**
   * @return Time in epoch milliseconds of elapsed second zero.
   */
  public long originMs() {
    return _originMs;
  }

  /**
   * @param minRSquared The minimum goodness of fit.
   * @return {@code true} if this fit explains the data well enough to extrapolate.
   */
  public boolean isUsable(double minRSquared) {
    return _rSquared >= minRSquared;
  }

  /**
   * @param elapsedSeconds Seconds since the origin.
   * @return The value of the trend line at the given elapsed time.
   */
  public double valueAt(double elapsedSeconds) {
    return _slopePerSecond * elapsedSeconds + _intercept;
  }

  /**
   * @param limit A capacity limit.
   * @return Elapsed seconds since the origin at which the trend line reaches the limit, or {@link Double#NaN} if the
   * trend is not rising.
   */
  public double secondsToReach(double limit) {
    if (_slopePerSecond <= 0.0) {
      return Double.NaN;
    }
    return (limit - _intercept) / _slopePerSecond;
  }

  @Override
  public String toString() {
    return String.format("{slopePerSecond=%s, intercept=%s, rSquared=%.4f}", _slopePerSecond, _intercept, _rSquared);
  }
}
