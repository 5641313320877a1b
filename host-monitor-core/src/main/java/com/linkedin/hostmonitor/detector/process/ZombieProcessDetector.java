/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector.process;

import com.linkedin.hostmonitor.detector.AnomalyDetector;
import com.linkedin.hostmonitor.detector.AnomalyEvent;
import com.linkedin.hostmonitor.detector.AnomalyKind;
import com.linkedin.hostmonitor.detector.EntityMetadataProvider;
import com.linkedin.hostmonitor.detector.Severity;
import com.linkedin.hostmonitor.exception.MetadataUnavailableException;
import com.linkedin.hostmonitor.model.Sample;
import com.linkedin.hostmonitor.model.Samples;
import com.linkedin.hostmonitor.model.Signal;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.StringJoiner;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.hostmonitor.common.utils.Utils.validateNotNull;
import static com.linkedin.hostmonitor.config.DetectionConfig.ENTITY_METADATA_PROVIDER_OBJECT_CONFIG;


/**
 * Reports the zombie processes of the latest process table read as a single host-level warning.
 * <p>
 * A {@link Signal#PROCESS_ZOMBIE} sample is keyed by pid and is positive if the process is a zombie. The collector
 * stamps all samples of one process table read with the same time, and only the samples stamped with the newest time
 * of the input are considered, so zombies reaped since then are not reported again. Process names and parent pids
 * are looked up through the {@link EntityMetadataProvider} under {@link #PROCESS_NAME_METADATA} and
 * {@link #PARENT_PID_METADATA}.
 */
public class ZombieProcessDetector implements AnomalyDetector {
  private static final Logger LOG = LoggerFactory.getLogger(ZombieProcessDetector.class);
  public static final String ALGORITHM = "zombie_detector";
  public static final String PROCESS_NAME_METADATA = "process_name";
  public static final String PARENT_PID_METADATA = "parent_pid";
  public static final String ZOMBIE_COUNT_METRIC = "zombie_count";
  public static final String ZOMBIE_PIDS_ATTRIBUTE = "zombie_pids";
  public static final String ZOMBIE_NAMES_ATTRIBUTE = "zombie_names";
  public static final String PARENT_PIDS_ATTRIBUTE = "parent_pids";
  static final String UNKNOWN = "unknown";
  private EntityMetadataProvider _metadataProvider;

  public ZombieProcessDetector() {
    _metadataProvider = EntityMetadataProvider.NONE;
  }

  public void setMetadataProvider(EntityMetadataProvider metadataProvider) {
    _metadataProvider = validateNotNull(metadataProvider, "Metadata provider cannot be null.");
  }

  @Override
  public void configure(Map<String, ?> configs) {
    Object metadataProvider = configs.get(ENTITY_METADATA_PROVIDER_OBJECT_CONFIG);
    if (metadataProvider instanceof EntityMetadataProvider) {
      setMetadataProvider((EntityMetadataProvider) metadataProvider);
    }
  }

  @Override
  public String algorithm() {
    return ALGORITHM;
  }

  @Override
  public Set<Signal> signals() {
    return Collections.singleton(Signal.PROCESS_ZOMBIE);
  }

  @Override
  public List<AnomalyEvent> detect(Map<Signal, List<Sample>> samplesBySignal) {
    return detect(samplesBySignal.getOrDefault(Signal.PROCESS_ZOMBIE, Collections.emptyList()));
  }

  /**
   * @param samples {@link Signal#PROCESS_ZOMBIE} samples, keyed by pid.
   * @return A single warning listing the zombies of the latest read, or an empty list if there are none.
   */
  public List<AnomalyEvent> detect(List<Sample> samples) {
    List<Sample> finite = Samples.finiteSortedByTime(samples);
    if (finite.isEmpty()) {
      return Collections.emptyList();
    }
    long readTimeMs = finite.get(finite.size() - 1).timeMs();
    // The last sample of a pid within the read wins.
    SortedMap<String, Boolean> zombieByPid = new TreeMap<>();
    for (Sample sample : finite) {
      if (sample.timeMs() == readTimeMs && sample.entityKey() != null) {
        zombieByPid.put(sample.entityKey(), sample.value() > 0.0);
      }
    }
    zombieByPid.values().removeIf(zombie -> !zombie);
    if (zombieByPid.isEmpty()) {
      return Collections.emptyList();
    }

    StringJoiner pids = new StringJoiner(",");
    StringJoiner names = new StringJoiner(",");
    StringJoiner parentPids = new StringJoiner(",");
    for (String pid : zombieByPid.keySet()) {
      Map<String, String> metadata = metadataFor(pid);
      pids.add(pid);
      names.add(metadata.getOrDefault(PROCESS_NAME_METADATA, UNKNOWN));
      parentPids.add(metadata.getOrDefault(PARENT_PID_METADATA, UNKNOWN));
    }
    LOG.debug("Found {} zombie processes: {}", zombieByPid.size(), pids);
    return Collections.singletonList(new AnomalyEvent.Builder(AnomalyKind.ZOMBIE_PROCESS, ALGORITHM, readTimeMs)
                                         .severity(Severity.WARNING)
                                         .confidence(1.0)
                                         .metric(ZOMBIE_COUNT_METRIC, zombieByPid.size())
                                         .attribute(ZOMBIE_PIDS_ATTRIBUTE, pids.toString())
                                         .attribute(ZOMBIE_NAMES_ATTRIBUTE, names.toString())
                                         .attribute(PARENT_PIDS_ATTRIBUTE, parentPids.toString())
                                         .build());
  }

  private Map<String, String> metadataFor(String pid) {
    try {
      return _metadataProvider.metadataFor(pid);
    } catch (MetadataUnavailableException e) {
      LOG.warn("Reporting zombie process {} without metadata: {}", pid, e.getMessage());
      return Collections.emptyMap();
    }
  }
}
