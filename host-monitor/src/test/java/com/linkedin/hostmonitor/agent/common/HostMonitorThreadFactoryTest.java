/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.hostmonitor.agent.common;

import com.codahale.metrics.Meter;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class HostMonitorThreadFactoryTest {

  @Test
  public void testThreadNames() {
    HostMonitorThreadFactory factory = new HostMonitorThreadFactory("SampleCollector");
    Thread first = factory.newThread(() -> { });
    Thread second = factory.newThread(() -> { });
    assertEquals("SampleCollector-0", first.getName());
    assertEquals("SampleCollector-1", second.getName());
    assertTrue(first.isDaemon());
  }

  @Test
  public void testUncaughtExceptionsAreCounted() throws InterruptedException {
    Meter uncaughtExceptions = new Meter();
    HostMonitorThreadFactory factory =
        new HostMonitorThreadFactory("HostMonitorDetector", false, LoggerFactory.getLogger(getClass()), uncaughtExceptions);
    Thread thread = factory.newThread(() -> {
      throw new IllegalStateException("Detector failure");
    });
    assertFalse(thread.isDaemon());
    thread.start();
    thread.join();
    assertEquals(1, uncaughtExceptions.getCount());
  }
}
