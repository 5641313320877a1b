/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent;

import com.linkedin.hostmonitor.agent.config.HostMonitorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.hostmonitor.agent.HostMonitorAgentUtils.readConfig;


/**
 * The main class to run the host monitor agent.
 */
public final class HostMonitorMain {
  private static final Logger LOG = LoggerFactory.getLogger(HostMonitorMain.class);

  private HostMonitorMain() { }

  /**
   * The main function to run the host monitor agent.
   * @param args Arguments passed while starting the agent.
   */
  public static void main(String[] args) throws Exception {
    if (args.length == 0) {
      throw new IllegalArgumentException(String.format("USAGE: java %s host-monitor.properties",
                                                       HostMonitorMain.class.getSimpleName()));
    }

    Thread.setDefaultUncaughtExceptionHandler((t, e) -> LOG.error("Uncaught exception on thread {}", t, e));

    HostMonitorConfig config = readConfig(args[0]);
    HostMonitorApp app = new HostMonitorApp(config);
    app.registerShutdownHook();
    app.start();
  }
}
