/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector;

import static com.linkedin.hostmonitor.common.utils.Utils.clamp;
import static com.linkedin.hostmonitor.common.utils.Utils.safeDivide;


/**
 * Severity and confidence formulas shared by all detectors. Every result is finite, every confidence lies in
 * {@code [0, 1]}, and undefined ratios contribute nothing.
 */
public final class AnomalyScoring {
  public static final double LEVEL_CRITICAL_ABOVE = 90.0;
  public static final double LEVEL_EMERGENCY_ABOVE = 95.0;
  public static final double Z_SCORE_CRITICAL_ABOVE = 3.0;
  public static final double Z_SCORE_EMERGENCY_ABOVE = 4.0;
  public static final double HOURS_TO_IMPACT_CRITICAL_BELOW = 6.0;
  public static final double HOURS_TO_IMPACT_EMERGENCY_BELOW = 1.0;
  public static final double MAGNITUDE_RATIO_CRITICAL = 5.0;
  public static final double MAGNITUDE_RATIO_EMERGENCY = 10.0;
  public static final double INVOLVED_RATIO_SEVERE = 0.7;
  // Spread of the excess over a threshold that takes confidence from 0.5 to 1.0.
  static final double THRESHOLD_CONFIDENCE_SPAN = 20.0;
  // Spread of the z-score that takes confidence from 0.5 to 1.0.
  static final double Z_SCORE_CONFIDENCE_SPAN = 10.0;

  private AnomalyScoring() {

  }

  /**
   * @param level A utilization level in percent.
   * @return Emergency above 95, critical above 90, otherwise warning.
   */
  public static Severity levelSeverity(double level) {
    if (level > LEVEL_EMERGENCY_ABOVE) {
      return Severity.EMERGENCY;
    }
    return level > LEVEL_CRITICAL_ABOVE ? Severity.CRITICAL : Severity.WARNING;
  }

  /**
   * @param zScore A z-score.
   * @return Emergency above 4, critical above 3, otherwise warning.
   */
  public static Severity zScoreSeverity(double zScore) {
    if (zScore > Z_SCORE_EMERGENCY_ABOVE) {
      return Severity.EMERGENCY;
    }
    return zScore > Z_SCORE_CRITICAL_ABOVE ? Severity.CRITICAL : Severity.WARNING;
  }

  /**
   * @param hoursToImpact Predicted hours until a capacity limit is reached.
   * @return Emergency below one hour, critical below six hours, otherwise warning.
   */
  public static Severity timeToImpactSeverity(double hoursToImpact) {
    if (hoursToImpact < HOURS_TO_IMPACT_EMERGENCY_BELOW) {
      return Severity.EMERGENCY;
    }
    return hoursToImpact < HOURS_TO_IMPACT_CRITICAL_BELOW ? Severity.CRITICAL : Severity.WARNING;
  }

  /**
   * Severity of a deviation from a baseline, scaled by how far it goes and by how much of the window it covers.
   *
   * @param magnitudeRatio How many times further than the baseline the extreme value went (see {@link #magnitudeRatio}).
   * @param involvedRatio Fraction of the samples involved in the deviation.
   * @return Emergency if both far and long, critical if either far or long, otherwise warning.
   */
  public static Severity deviationSeverity(double magnitudeRatio, double involvedRatio) {
    boolean far = magnitudeRatio >= MAGNITUDE_RATIO_CRITICAL;
    boolean sustained = involvedRatio >= INVOLVED_RATIO_SEVERE;
    if (magnitudeRatio >= MAGNITUDE_RATIO_EMERGENCY && sustained) {
      return Severity.EMERGENCY;
    }
    return far || sustained ? Severity.CRITICAL : Severity.WARNING;
  }

  /**
   * @param average Average value of an anomaly window.
   * @param threshold The static threshold that was crossed.
   * @return {@code min(1, 0.5 + (average - threshold) / 20)}, floored at 0.
   */
  public static double thresholdConfidence(double average, double threshold) {
    return clamp(0.5 + (average - threshold) / THRESHOLD_CONFIDENCE_SPAN, 0.0, 1.0);
  }

  /**
   * @param zScore A z-score.
   * @return {@code min(1, 0.5 + z / 10)}, floored at 0.
   */
  public static double zScoreConfidence(double zScore) {
    return clamp(0.5 + zScore / Z_SCORE_CONFIDENCE_SPAN, 0.0, 1.0);
  }

  /**
   * @param rSquared Goodness of fit of a trend.
   * @return The goodness of fit, clamped to {@code [0, 1]}.
   */
  public static double trendConfidence(double rSquared) {
    return clamp(rSquared, 0.0, 1.0);
  }

  /**
   * @param ratioTerm Fraction of samples involved; clamped to {@code [0, 1]}.
   * @param magnitudeTerm Capped magnitude of the deviation; clamped to {@code [0, 1]}.
   * @return {@code min(1, 0.5 + ratioTerm * 0.3 + magnitudeTerm * 0.2)}.
   */
  public static double deviationConfidence(double ratioTerm, double magnitudeTerm) {
    return Math.min(1.0, 0.5 + clamp(ratioTerm, 0.0, 1.0) * 0.3 + clamp(magnitudeTerm, 0.0, 1.0) * 0.2);
  }

  /**
   * How many times further than the reference the extreme value went, in the direction of the deviation.
   *
   * @param extreme The extreme value of the deviation.
   * @param reference The baseline or threshold it deviates from.
   * @param direction The direction of the deviation.
   * @return {@code extreme / reference} for upward deviations, {@code reference / extreme} for drops; 0 if undefined.
   */
  public static double magnitudeRatio(double extreme, double reference, DeviationDirection direction) {
    if (reference <= 0.0) {
      return 0.0;
    }
    if (direction == DeviationDirection.ABOVE) {
      return Math.max(0.0, safeDivide(extreme, reference, 0.0));
    }
    // A drop to zero is as far as a drop can go.
    return extreme <= 0.0 ? MAGNITUDE_RATIO_EMERGENCY : Math.max(0.0, safeDivide(reference, extreme, 0.0));
  }

  /**
   * Capped magnitude of a deviation for {@link #deviationConfidence}.
   *
   * @param extreme The extreme value of the deviation.
   * @param reference The baseline or threshold it deviates from.
   * @param direction The direction of the deviation.
   * @param scale For upward deviations, the ratio {@code extreme / reference} that counts as a full magnitude.
   * @return A term in {@code [0, 1]}: {@code min(1, extreme / reference / scale)} upwards, the relative drop
   * {@code (reference - extreme) / reference} downwards; 0 if the reference is not positive.
   */
  public static double magnitudeTerm(double extreme, double reference, DeviationDirection direction, double scale) {
    if (reference <= 0.0) {
      return 0.0;
    }
    if (direction == DeviationDirection.ABOVE) {
      return clamp(safeDivide(extreme, reference * scale, 0.0), 0.0, 1.0);
    }
    return clamp(safeDivide(reference - extreme, reference, 0.0), 0.0, 1.0);
  }
}
