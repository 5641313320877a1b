/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.exception;

/**
 * Thrown when descriptive metadata (e.g. the name of a process) for an entity cannot be looked up.
 */
public class MetadataUnavailableException extends HostMonitorException {

  public MetadataUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  public MetadataUnavailableException(String message) {
    super(message);
  }
}
