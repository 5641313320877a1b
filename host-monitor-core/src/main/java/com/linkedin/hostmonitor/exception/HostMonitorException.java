/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.exception;

/**
 * The parent exception for all the checked host monitor exceptions.
 */
public class HostMonitorException extends Exception {

  public HostMonitorException(String message, Throwable cause) {
    super(message, cause);
  }

  public HostMonitorException(String message) {
    super(message);
  }

  public HostMonitorException(Throwable cause) {
    super(cause);
  }
}
