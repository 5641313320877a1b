/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent.format;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import static com.linkedin.hostmonitor.agent.config.constants.MonitorConfig.JSON_FORMAT;


/**
 * Renders results as pretty-printed JSON. Absent optional fields are written as {@code null}.
 */
public class JsonFormatter implements ResultFormatter {
  private final Gson _gson;

  public JsonFormatter() {
    _gson = new GsonBuilder().serializeNulls().setPrettyPrinting().create();
  }

  @Override
  public String name() {
    return JSON_FORMAT;
  }

  @Override
  public String format(RenderableResult result) {
    return _gson.toJson(ResultFormatters.toPlainObject(result)) + System.lineSeparator();
  }
}
