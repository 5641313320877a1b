/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent.common;

import com.codahale.metrics.Meter;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Names the threads of the agent after their pool, and logs (and optionally counts) exceptions that escape them.
 */
public class HostMonitorThreadFactory implements ThreadFactory {
  private static final Logger LOG = LoggerFactory.getLogger(HostMonitorThreadFactory.class);
  private final String _poolName;
  private final boolean _daemon;
  private final AtomicInteger _nextThreadId;
  private final Logger _logger;
  private final Meter _uncaughtExceptions;

  public HostMonitorThreadFactory(String poolName) {
    this(poolName, true, null, null);
  }

  /**
   * @param poolName Prefix of the thread names.
   * @param daemon {@code true} to create daemon threads.
   * @param logger Logger of uncaught exceptions, or {@code null} to use the logger of this class.
   * @param uncaughtExceptions Meter marked on each uncaught exception, or {@code null}.
   */
  public HostMonitorThreadFactory(String poolName, boolean daemon, Logger logger, Meter uncaughtExceptions) {
    _poolName = poolName;
    _daemon = daemon;
    _nextThreadId = new AtomicInteger(0);
    _logger = logger == null ? LOG : logger;
    _uncaughtExceptions = uncaughtExceptions;
  }

  @Override
  public Thread newThread(Runnable r) {
    Thread thread = new Thread(r, String.format("%s-%d", _poolName, _nextThreadId.getAndIncrement()));
    thread.setDaemon(_daemon);
    thread.setUncaughtExceptionHandler((t, e) -> {
      _logger.error("Uncaught exception in {}.", t.getName(), e);
      if (_uncaughtExceptions != null) {
        _uncaughtExceptions.mark();
      }
    });
    return thread;
  }
}
