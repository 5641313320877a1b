/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalUnit;

import static com.linkedin.hostmonitor.common.utils.Utils.validateNotNull;

/**
 * Utils class for the host monitor.
 */
public final class HostMonitorUtils {
  public static final long SEC_TO_MS = 1000L;
  public static final double SECONDS_PER_HOUR = 3600.0;

  private HostMonitorUtils() {

  }

  /**
   * Ensure that the given String value of the given String key is not {@code null} or empty.
   *
   * @param key The key corresponding to the given String value.
   * @param value String value to be checked for being non-empty.
   */
  public static void ensureValidString(String key, String value) {
    validateNotNull(value, () -> key + " cannot be null");
    if (value.isEmpty()) {
      throw new IllegalArgumentException(key + " cannot be empty");
    }
  }

  /**
   * @param timeMs Time in milliseconds.
   * @return The date for the given time in ISO 8601 format with millisecond precision, e.g.
   * {@code 2024-01-01T00:00:00.000Z}.
   */
  public static String utcDateFor(long timeMs) {
    return utcDateFor(timeMs, 3, ChronoUnit.MILLIS);
  }

  /**
   * @param timeMs Time in milliseconds.
   * @param precision requested time precision used in {@link DateTimeFormatterBuilder#appendInstant()}
   *        i.e: 0 for seconds precision, 3 for milliseconds, 6 for microseconds etc...
   * @param roundTo round the provided time to the provided {@link TemporalUnit}
   * @return The date for the given time in ISO 8601 format with provided precision (not truncated even if 0)
   */
  public static String utcDateFor(long timeMs, int precision, TemporalUnit roundTo) {
    DateTimeFormatter formatter = new DateTimeFormatterBuilder().appendInstant(precision).toFormatter();
    return formatter.format(Instant.ofEpochMilli(timeMs).truncatedTo(roundTo));
  }

  /**
   * @param fromMs Start time in milliseconds.
   * @param toMs End time in milliseconds.
   * @return Elapsed seconds between the two times.
   */
  public static double elapsedSeconds(long fromMs, long toMs) {
    return (toMs - fromMs) / (double) SEC_TO_MS;
  }
}
