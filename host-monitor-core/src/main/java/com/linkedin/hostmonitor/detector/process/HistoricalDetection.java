/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector.process;

import com.linkedin.hostmonitor.detector.AnomalyEvent;
import java.util.Collections;
import java.util.List;

import static com.linkedin.hostmonitor.common.utils.Utils.validateNotNull;


/**
 * The result of one tick of a {@link HistoricalAnomalyDetector}: the detected events and the history to hand back on
 * the next tick.
 */
public final class HistoricalDetection {
  private final List<AnomalyEvent> _events;
  private final EntityHistory _history;

  public HistoricalDetection(List<AnomalyEvent> events, EntityHistory history) {
    _events = Collections.unmodifiableList(validateNotNull(events, "Events cannot be null."));
    _history = validateNotNull(history, "History cannot be null.");
  }

  public List<AnomalyEvent> events() {
    return _events;
  }

  public EntityHistory history() {
    return _history;
  }

  @Override
  public String toString() {
    return String.format("HistoricalDetection{events=%d, history=%s}", _events.size(), _history);
  }
}
