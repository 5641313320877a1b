/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import com.linkedin.hostmonitor.agent.config.HostMonitorConfig;
import com.linkedin.hostmonitor.exception.HostMonitorException;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.hostmonitor.agent.HostMonitorAgentUtils.createCollector;
import static com.linkedin.hostmonitor.agent.HostMonitorAgentUtils.createSink;


/**
 * The host monitor agent: a {@link HostMonitorManager} whose sensors are reported over JMX.
 */
public class HostMonitorApp {
  private static final Logger LOG = LoggerFactory.getLogger(HostMonitorApp.class);
  static final String METRIC_DOMAIN = "host.monitor";
  private final MetricRegistry _metricRegistry;
  private final JmxReporter _jmxReporter;
  private final HostMonitorManager _hostMonitorManager;

  HostMonitorApp(HostMonitorConfig config) throws HostMonitorException, IOException {
    _metricRegistry = new MetricRegistry();
    _jmxReporter = JmxReporter.forRegistry(_metricRegistry).inDomain(METRIC_DOMAIN).build();
    _hostMonitorManager = new HostMonitorManager(config, createCollector(config), createSink(config), _metricRegistry);
  }

  void registerShutdownHook() {
    Runtime.getRuntime().addShutdownHook(new Thread(this::stop, "HostMonitorShutdownHook"));
  }

  /**
   * Start reporting sensors and run the detection loops.
   */
  public void start() {
    _jmxReporter.start();
    _hostMonitorManager.startDetection();
    LOG.info("Host monitor started with detection loops for {}.", _hostMonitorManager.groups());
  }

  /**
   * Stop the detection loops and the sensor reporter.
   */
  public void stop() {
    _hostMonitorManager.shutdown();
    _jmxReporter.close();
  }
}
