/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent.format;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import static com.linkedin.hostmonitor.agent.config.constants.MonitorConfig.STRUCTURED_TEXT_FORMAT;


/**
 * Renders results as block-style YAML.
 */
public class StructuredTextFormatter implements ResultFormatter {
  private final Yaml _yaml;

  public StructuredTextFormatter() {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    _yaml = new Yaml(options);
  }

  @Override
  public String name() {
    return STRUCTURED_TEXT_FORMAT;
  }

  @Override
  public String format(RenderableResult result) {
    return _yaml.dump(ResultFormatters.toPlainObject(result));
  }
}
