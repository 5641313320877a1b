/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.stats;

import com.linkedin.hostmonitor.model.Sample;
import java.util.List;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import static com.linkedin.hostmonitor.HostMonitorUtils.elapsedSeconds;


/**
 * Ordinary least squares regression of a sample stream against elapsed seconds.
 */
public final class TrendModel {

  private TrendModel() {

  }

  /**
   * Fit a trend line to the given samples.
   *
   * Fewer than two samples, a zero time span or non-finite regression output yield {@link TrendFit#NONE}. Constant
   * values yield a flat line with an R-squared of zero.
   *
   * @param samples Samples sorted ascending by time.
   * @return The trend fit.
   */
  public static TrendFit fit(List<Sample> samples) {
    if (samples == null || samples.size() < 2) {
      return TrendFit.NONE;
    }
    long originMs = samples.get(0).timeMs();
    if (samples.get(samples.size() - 1).timeMs() == originMs) {
      return TrendFit.NONE;
    }
    SimpleRegression regression = new SimpleRegression(true);
    for (Sample sample : samples) {
      regression.addData(elapsedSeconds(originMs, sample.timeMs()), sample.value());
    }
    double slope = regression.getSlope();
    double intercept = regression.getIntercept();
    if (!Double.isFinite(slope) || !Double.isFinite(intercept)) {
      return TrendFit.NONE;
    }
    // A zero total sum of squares (constant values) leaves R-squared undefined.
    double rSquared = regression.getTotalSumSquares() == 0.0 ? 0.0 : regression.getRSquare();
    if (!Double.isFinite(rSquared)) {
      rSquared = 0.0;
    }
    return new TrendFit(slope, intercept, Math.max(0.0, Math.min(1.0, rSquared)), originMs);
  }
}
