/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent.config;

import com.linkedin.hostmonitor.agent.config.constants.MonitorConfig;
import com.linkedin.hostmonitor.agent.detector.SignalGroup;
import com.linkedin.hostmonitor.common.config.AbstractConfig;
import com.linkedin.hostmonitor.common.config.ConfigDef;
import com.linkedin.hostmonitor.common.config.ConfigException;
import com.linkedin.hostmonitor.config.DetectionConfig;
import java.util.Map;

import static com.linkedin.hostmonitor.agent.config.constants.MonitorConfig.COLLECTION_TIMEOUT_MS_CONFIG;
import static com.linkedin.hostmonitor.agent.config.constants.MonitorConfig.SAMPLE_BUFFER_RETENTION_MS_CONFIG;


/**
 * The configuration class of the host monitor agent.
 *
 * To avoid having a huge monolithic class that mixes unrelated configs, config names, their defaults, and definitions
 * reside in {@link MonitorConfig} and in the detection config classes under
 * {@link com.linkedin.hostmonitor.config.constants}.
 */
public class HostMonitorConfig extends AbstractConfig {
  private static final ConfigDef CONFIG = MonitorConfig.define(DetectionConfig.define(new ConfigDef()));

  public HostMonitorConfig(Map<?, ?> originals) {
    this(originals, true);
  }

  public HostMonitorConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
    sanityCheckCollectionTimeout();
    sanityCheckRetention();
  }

  /**
   * @param group A signal group.
   * @return The sampling interval of the given group in milliseconds.
   */
  public long samplingIntervalMs(SignalGroup group) {
    return getLong(group.samplingIntervalConfig());
  }

  /**
   * Sanity check that a collection cannot outlast the tick of any detection loop.
   */
  void sanityCheckCollectionTimeout() {
    long collectionTimeoutMs = getLong(COLLECTION_TIMEOUT_MS_CONFIG);
    for (SignalGroup group : SignalGroup.cachedValues()) {
      if (collectionTimeoutMs > samplingIntervalMs(group)) {
        throw new ConfigException(String.format("Attempt to configure %s (%d ms) above %s (%d ms).",
                                                COLLECTION_TIMEOUT_MS_CONFIG, collectionTimeoutMs,
                                                group.samplingIntervalConfig(), samplingIntervalMs(group)));
      }
    }
  }

  /**
   * Sanity check that the buffer retains at least one tick of every detection loop.
   */
  void sanityCheckRetention() {
    long retentionMs = getLong(SAMPLE_BUFFER_RETENTION_MS_CONFIG);
    for (SignalGroup group : SignalGroup.cachedValues()) {
      if (retentionMs < samplingIntervalMs(group)) {
        throw new ConfigException(String.format("Attempt to configure %s (%d ms) below %s (%d ms).",
                                                SAMPLE_BUFFER_RETENTION_MS_CONFIG, retentionMs,
                                                group.samplingIntervalConfig(), samplingIntervalMs(group)));
      }
    }
  }
}
