/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent;

import com.linkedin.hostmonitor.agent.collector.SampleCollector;
import com.linkedin.hostmonitor.agent.config.HostMonitorConfig;
import com.linkedin.hostmonitor.agent.sink.EventSink;
import com.linkedin.hostmonitor.agent.sink.FileEventSink;
import com.linkedin.hostmonitor.agent.sink.PrintStreamEventSink;
import com.linkedin.hostmonitor.common.utils.Utils;
import com.linkedin.hostmonitor.exception.HostMonitorException;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Paths;
import java.util.Properties;

import static com.linkedin.hostmonitor.agent.config.constants.MonitorConfig.OUTPUT_FILE_CONFIG;
import static com.linkedin.hostmonitor.agent.config.constants.MonitorConfig.SAMPLE_COLLECTOR_CLASS_CONFIG;


/**
 * Util class for the host monitor agent.
 */
public final class HostMonitorAgentUtils {
  public static final String DETECTION_SENSOR = "HostMonitorDetector";

  private HostMonitorAgentUtils() {

  }

  /**
   * Read the agent configuration from the given properties file.
   *
   * @param propertiesFile Path of the properties file.
   * @return The validated agent configuration.
   */
  public static HostMonitorConfig readConfig(String propertiesFile) throws IOException {
    Properties props = new Properties();
    try (InputStream propStream = new FileInputStream(propertiesFile)) {
      props.load(propStream);
    }
    return new HostMonitorConfig(props);
  }

  /**
   * @param config The agent configuration.
   * @return The configured sample collector.
   */
  public static SampleCollector createCollector(HostMonitorConfig config) throws HostMonitorException {
    Class<?> collectorClass = config.getClass(SAMPLE_COLLECTOR_CLASS_CONFIG);
    if (collectorClass == null) {
      throw new HostMonitorException(String.format("%s must name the collector of this platform.",
                                                   SAMPLE_COLLECTOR_CLASS_CONFIG));
    }
    Object collector = Utils.newInstance(collectorClass);
    if (!(collector instanceof SampleCollector)) {
      throw new HostMonitorException(collectorClass.getName() + " is not an instance of "
                                     + SampleCollector.class.getName());
    }
    ((SampleCollector) collector).configure(config.originals());
    return (SampleCollector) collector;
  }

  /**
   * @param config The agent configuration.
   * @return A sink appending to the configured output file, or printing to standard output if there is none.
   */
  public static EventSink createSink(HostMonitorConfig config) throws IOException {
    String outputFile = config.getString(OUTPUT_FILE_CONFIG);
    if (outputFile == null || outputFile.isEmpty()) {
      return new PrintStreamEventSink(System.out);
    }
    return new FileEventSink(Paths.get(outputFile));
  }
}
