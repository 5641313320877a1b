/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent.format;

/**
 * Renders a {@link RenderableResult} as text.
 */
public interface ResultFormatter {

  /**
   * @return The name this formatter is selected by.
   */
  String name();

  /**
   * @param result The result to render.
   * @return The rendered text, terminated by a line separator.
   */
  String format(RenderableResult result);
}
