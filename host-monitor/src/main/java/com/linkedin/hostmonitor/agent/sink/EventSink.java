/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent.sink;

import java.io.Closeable;
import java.io.IOException;


/**
 * Destination of formatted detection output. Implementations must be safe to call from the detection threads
 * of every signal group.
 */
public interface EventSink extends Closeable {

  /**
   * Write the given formatted text as-is.
   *
   * @param formatted Formatted output.
   */
  void write(String formatted) throws IOException;
}
