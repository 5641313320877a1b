/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.hostmonitor.detector.process;

import com.linkedin.hostmonitor.model.Sample;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;


public class EntityHistoryTest {

  @Test
  public void testUpdateAppendsTrimsAndDropsAbsentEntities() {
    EntityHistory history = EntityHistory.empty(2)
        .update(Arrays.asList(new Sample(1000L, 1.0, "a"), new Sample(1000L, 1.0, "b")))
        .update(Arrays.asList(new Sample(2000L, 2.0, "a"), new Sample(3000L, 3.0, "a")));
    assertFalse(history.contains("b"));
    assertEquals(Arrays.asList(new Sample(2000L, 2.0, "a"), new Sample(3000L, 3.0, "a")), history.samples("a"));
    assertEquals(new Sample(3000L, 3.0, "a"), history.lastSample("a"));
    assertNull(history.lastSample("b"));
  }

  @Test
  public void testStaleAndAnonymousSamplesAreIgnored() {
    EntityHistory history = EntityHistory.empty(5)
        .update(Collections.singletonList(new Sample(2000L, 2.0, "a")))
        .update(Arrays.asList(new Sample(1000L, 1.0, "a"), new Sample(2000L, 5.0, null)));
    assertEquals(Collections.singletonList(new Sample(2000L, 2.0, "a")), history.samples("a"));
    assertEquals(1, history.entities().size());
  }

  @Test
  public void testUpdateDoesNotChangeThePreviousHistory() {
    EntityHistory previous = EntityHistory.empty(5).update(Collections.singletonList(new Sample(1000L, 1.0, "a")));
    previous.update(Collections.singletonList(new Sample(2000L, 2.0, "a")));
    assertEquals(1, previous.samples("a").size());
    assertTrue(EntityHistory.empty(5).update(Collections.emptyList()).isEmpty());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAtLeastOneSampleIsRetained() {
    EntityHistory.empty(0);
  }
}
