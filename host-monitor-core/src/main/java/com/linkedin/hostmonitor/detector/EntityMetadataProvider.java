/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector;

import com.linkedin.hostmonitor.exception.MetadataUnavailableException;
import java.util.Collections;
import java.util.Map;


/**
 * Looks up descriptive metadata (e.g. the name of a process) for an entity key. Lookups are expected to be served
 * from memory; an unavailable entity is reported by exception.
 */
public interface EntityMetadataProvider {

  /**
   * An entity metadata provider that knows nothing.
   */
  EntityMetadataProvider NONE = entityKey -> Collections.emptyMap();

  /**
   * @param entityKey The entity key.
   * @return Metadata attributes by name, possibly empty.
   * @throws MetadataUnavailableException if the metadata of the entity cannot be looked up.
   */
  Map<String, String> metadataFor(String entityKey) throws MetadataUnavailableException;
}
