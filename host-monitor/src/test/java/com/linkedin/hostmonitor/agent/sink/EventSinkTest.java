/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.hostmonitor.agent.sink;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;

public class EventSinkTest {
  @Rule
  public TemporaryFolder _folder = new TemporaryFolder();

  @Test
  public void testFileSinkAppends() throws IOException {
    File output = new File(_folder.getRoot(), "events.log");
    try (EventSink sink = new FileEventSink(output.toPath())) {
      sink.write("first\n");
    }
    try (EventSink sink = new FileEventSink(output.toPath())) {
      sink.write("second\n");
    }
    assertEquals("first\nsecond\n", new String(Files.readAllBytes(output.toPath()), StandardCharsets.UTF_8));
  }

  @Test(expected = IOException.class)
  public void testFileSinkFailsOnMissingDirectory() throws IOException {
    new FileEventSink(new File(_folder.getRoot(), "missing/events.log").toPath());
  }

  @Test
  public void testPrintStreamSink() throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    EventSink sink = new PrintStreamEventSink(new PrintStream(out, true, StandardCharsets.UTF_8.name()));
    sink.write("event\n");
    sink.close();
    assertEquals("event\n", out.toString(StandardCharsets.UTF_8.name()));
  }

  @Test(expected = IOException.class)
  public void testPrintStreamSinkReportsErrors() throws IOException {
    OutputStream broken = new OutputStream() {
      @Override
      public void write(int b) throws IOException {
        throw new IOException("Broken pipe");
      }
    };
    new PrintStreamEventSink(new PrintStream(broken)).write("event\n");
  }
}
