/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.config;

import com.linkedin.hostmonitor.common.config.AbstractConfig;
import com.linkedin.hostmonitor.common.config.ConfigDef;
import com.linkedin.hostmonitor.config.constants.CpuDetectionConfig;
import com.linkedin.hostmonitor.config.constants.DiskDetectionConfig;
import com.linkedin.hostmonitor.config.constants.MemoryDetectionConfig;
import com.linkedin.hostmonitor.config.constants.ProcessDetectionConfig;
import java.util.Map;


/**
 * The configuration of all detectors. Detectors instantiated by class name parse their parameters from the original
 * configs through this class.
 */
public class DetectionConfig extends AbstractConfig {
  /**
   * Key under which an {@link com.linkedin.hostmonitor.detector.EntityMetadataProvider} object may be passed to
   * configurable detectors. It is an object, not a parsed config.
   */
  public static final String ENTITY_METADATA_PROVIDER_OBJECT_CONFIG = "entity.metadata.provider.object";

  private static final ConfigDef CONFIG = define(new ConfigDef());

  public DetectionConfig(Map<?, ?> originals) {
    this(originals, false);
  }

  public DetectionConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
  }

  /**
   * Define the configs of all detectors.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs of all detectors.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return ProcessDetectionConfig.define(DiskDetectionConfig.define(MemoryDetectionConfig.define(
        CpuDetectionConfig.define(configDef))));
  }
}
