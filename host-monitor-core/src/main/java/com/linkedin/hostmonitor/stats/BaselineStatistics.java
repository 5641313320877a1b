/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.stats;

import com.linkedin.hostmonitor.model.Sample;
import com.linkedin.hostmonitor.model.Samples;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Max;
import org.apache.commons.math3.stat.descriptive.rank.Min;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import static org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType.R_7;


/**
 * Pure summary statistics over sample values. Every function returns {@code 0.0} for an empty input rather than
 * {@code NaN}, and the standard deviation is the population one.
 * <p>
 * Percentiles interpolate linearly between the closest ranks.
 */
public final class BaselineStatistics {

  private BaselineStatistics() {

  }

  public static double mean(double[] values) {
    return values.length == 0 ? 0.0 : new Mean().evaluate(values);
  }

  public static double stdDev(double[] values) {
    return values.length == 0 ? 0.0 : new StandardDeviation(false).evaluate(values);
  }

  public static double min(double[] values) {
    return values.length == 0 ? 0.0 : new Min().evaluate(values);
  }

  public static double max(double[] values) {
    return values.length == 0 ? 0.0 : new Max().evaluate(values);
  }

  /**
   * @param values Values.
   * @param percentile Percentile in {@code (0, 100]}.
   * @return The given percentile of the values.
   */
  public static double percentile(double[] values, double percentile) {
    if (values.length == 0) {
      return 0.0;
    }
    return new Percentile().withEstimationType(R_7).evaluate(values, percentile);
  }

  public static double median(double[] values) {
    return percentile(values, 50.0);
  }

  /**
   * @param values Values.
   * @return The median of the lower half of the sorted values, i.e. the calm level of a signal that spikes upwards.
   */
  public static double lowerHalfMedian(double[] values) {
    if (values.length == 0) {
      return 0.0;
    }
    double[] sorted = sortedCopy(values);
    return median(Arrays.copyOfRange(sorted, 0, Math.max(1, sorted.length / 2)));
  }

  /**
   * @param values Values.
   * @return The median of the upper half of the sorted values, i.e. the calm level of a signal that drops.
   */
  public static double upperHalfMedian(double[] values) {
    if (values.length == 0) {
      return 0.0;
    }
    double[] sorted = sortedCopy(values);
    return median(Arrays.copyOfRange(sorted, sorted.length / 2, sorted.length));
  }

  /**
   * Compute a baseline over the given historical window.
   *
   * @param window Historical samples, sorted ascending by time.
   * @return The baseline of the window, stamped with the time of its last sample.
   */
  public static Baseline baselineOf(List<Sample> window) {
    double[] values = Samples.values(window);
    long computedAtMs = window.isEmpty() ? 0L : window.get(window.size() - 1).timeMs();
    return new Baseline(mean(values), stdDev(values), min(values), max(values), percentile(values, 95.0),
                        values.length, computedAtMs);
  }

  private static double[] sortedCopy(double[] values) {
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    return sorted;
  }
}
