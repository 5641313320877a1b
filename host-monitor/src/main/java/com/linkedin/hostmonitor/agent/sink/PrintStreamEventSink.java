/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent.sink;

import java.io.IOException;
import java.io.PrintStream;


/**
 * Writes output to a print stream, typically standard output. Closing the sink flushes but does not close the stream.
 */
public class PrintStreamEventSink implements EventSink {
  private final PrintStream _out;

  public PrintStreamEventSink(PrintStream out) {
    _out = out;
  }

  @Override
  public synchronized void write(String formatted) throws IOException {
    _out.print(formatted);
    _out.flush();
    if (_out.checkError()) {
      throw new IOException("Failed to write to the output stream.");
    }
  }

  @Override
  public void close() {
    _out.flush();
  }
}
