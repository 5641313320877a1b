/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.hostmonitor.agent;

import com.linkedin.hostmonitor.agent.collector.SampleCollector;
import com.linkedin.hostmonitor.agent.config.HostMonitorConfig;
import com.linkedin.hostmonitor.agent.sink.EventSink;
import com.linkedin.hostmonitor.agent.sink.FileEventSink;
import com.linkedin.hostmonitor.agent.sink.PrintStreamEventSink;
import com.linkedin.hostmonitor.exception.HostMonitorException;
import com.linkedin.hostmonitor.model.Sample;
import com.linkedin.hostmonitor.model.Signal;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static com.linkedin.hostmonitor.agent.config.constants.MonitorConfig.*;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class HostMonitorAgentUtilsTest {
  @Rule
  public TemporaryFolder _folder = new TemporaryFolder();

  /**
   * A collector that returns no samples.
   */
  public static class NoopSampleCollector implements SampleCollector {
    private Map<String, ?> _configs;

    @Override
    public void configure(Map<String, ?> configs) {
      _configs = configs;
    }

    @Override
    public Map<Signal, List<Sample>> collect(Set<Signal> signals) {
      return Collections.emptyMap();
    }
  }

  @Test
  public void testReadConfig() throws IOException {
    File propertiesFile = _folder.newFile("host-monitor.properties");
    Files.write(propertiesFile.toPath(),
                String.format("%s=%s%n%s=2000%n", OUTPUT_FORMAT_CONFIG, JSON_FORMAT, CPU_SAMPLING_INTERVAL_MS_CONFIG)
                      .getBytes(StandardCharsets.UTF_8));
    HostMonitorConfig config = HostMonitorAgentUtils.readConfig(propertiesFile.getPath());
    assertEquals(JSON_FORMAT, config.getString(OUTPUT_FORMAT_CONFIG));
    assertEquals(2000L, config.getLong(CPU_SAMPLING_INTERVAL_MS_CONFIG).longValue());
  }

  @Test(expected = IOException.class)
  public void testReadMissingConfig() throws IOException {
    HostMonitorAgentUtils.readConfig(new File(_folder.getRoot(), "missing.properties").getPath());
  }

  @Test
  public void testCreateCollector() throws HostMonitorException {
    HostMonitorConfig config = new HostMonitorConfig(
        Collections.singletonMap(SAMPLE_COLLECTOR_CLASS_CONFIG, NoopSampleCollector.class.getName()), false);
    SampleCollector collector = HostMonitorAgentUtils.createCollector(config);
    assertTrue(collector instanceof NoopSampleCollector);
    assertEquals(NoopSampleCollector.class.getName(),
                 ((NoopSampleCollector) collector)._configs.get(SAMPLE_COLLECTOR_CLASS_CONFIG));
  }

  @Test(expected = HostMonitorException.class)
  public void testMissingCollector() throws HostMonitorException {
    HostMonitorAgentUtils.createCollector(new HostMonitorConfig(Collections.emptyMap(), false));
  }

  @Test(expected = HostMonitorException.class)
  public void testCollectorOfWrongType() throws HostMonitorException {
    HostMonitorAgentUtils.createCollector(
        new HostMonitorConfig(Collections.singletonMap(SAMPLE_COLLECTOR_CLASS_CONFIG, Object.class.getName()), false));
  }

  @Test
  public void testCreateSink() throws IOException {
    try (EventSink sink = HostMonitorAgentUtils.createSink(new HostMonitorConfig(Collections.emptyMap(), false))) {
      assertTrue(sink instanceof PrintStreamEventSink);
    }
    String outputFile = new File(_folder.getRoot(), "events.json").getPath();
    try (EventSink sink = HostMonitorAgentUtils.createSink(
        new HostMonitorConfig(Collections.singletonMap(OUTPUT_FILE_CONFIG, outputFile), false))) {
      assertTrue(sink instanceof FileEventSink);
    }
    assertTrue(new File(outputFile).exists());
  }
}
