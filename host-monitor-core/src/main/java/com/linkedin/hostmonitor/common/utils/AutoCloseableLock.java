/*
 * Copyright 2020 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.common.utils;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;


/**
 * Acquires the given lock on construction and releases it on {@link #close()}, so that buffers can guard their
 * critical sections with try-with-resources.
 */
public class AutoCloseableLock implements AutoCloseable {

  private final Lock _lock;
  private final AtomicBoolean _closed;

  public AutoCloseableLock(Lock lock) {
    _lock = Utils.validateNotNull(lock, "Lock cannot be null");
    _closed = new AtomicBoolean(false);
    _lock.lock();
  }

  @Override
  public void close() {
    if (_closed.compareAndSet(false, true)) {
      _lock.unlock();
    }
  }

  boolean isClosed() {
    return _closed.get();
  }
}
