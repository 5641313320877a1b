/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.agent.sink;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Appends output to a file, creating it if needed.
 */
public class FileEventSink implements EventSink {
  private static final Logger LOG = LoggerFactory.getLogger(FileEventSink.class);
  private final Path _path;
  private final Writer _writer;

  public FileEventSink(Path path) throws IOException {
    _path = path;
    _writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
                                      StandardOpenOption.APPEND, StandardOpenOption.WRITE);
    LOG.info("Writing detection output to {}.", path.toAbsolutePath());
  }

  @Override
  public synchronized void write(String formatted) throws IOException {
    _writer.write(formatted);
    _writer.flush();
  }

  @Override
  public synchronized void close() throws IOException {
    LOG.debug("Closing output file {}.", _path);
    _writer.close();
  }
}
