/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent.collector;

import com.linkedin.hostmonitor.exception.HostMonitorException;


/**
 * Thrown when the operating-system counters of a tick cannot be read.
 */
public class CollectionException extends HostMonitorException {

  public CollectionException(String message, Throwable cause) {
    super(message, cause);
  }

  public CollectionException(String message) {
    super(message);
  }
}
