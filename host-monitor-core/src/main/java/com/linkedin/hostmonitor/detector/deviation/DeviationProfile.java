/*
 * Copyright 2018 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.hostmonitor.detector.deviation;

import com.linkedin.hostmonitor.detector.AnomalyKind;
import com.linkedin.hostmonitor.detector.DeviationDirection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.linkedin.hostmonitor.common.utils.Utils.validateNotNull;


/**
 * The parameters of a {@link SpikeOrSustainedDeviationDetector} for one signal: which of the sustained and the spike
 * tests run, the limits they test against and the events they report. A test whose kind is not set does not run.
 */
public final class DeviationProfile {
  private final String _metricLabel;
  private final int _minSamples;
  private final double _minConfidence;
  private final String _entityAttribute;
  private final Map<String, String> _attributes;
  // Sustained test
  private final AnomalyKind _sustainedKind;
  private final String _sustainedAlgorithm;
  private final DeviationDirection _sustainedDirection;
  private final BaselineMethod _sustainedBaseline;
  private final Double _absoluteThreshold;
  private final Double _dropFraction;
  private final double _sustainedRatio;
  private final int _minRunLength;
  // Spike test
  private final AnomalyKind _spikeKind;
  private final String _spikeAlgorithm;
  private final BaselineMethod _spikeBaseline;
  private final double _spikeMultiplier;
  private final double _spikeFloor;

  private DeviationProfile(Builder builder) {
    _metricLabel = validateNotNull(builder._metricLabel, "Metric label cannot be null.");
    if (builder._minSamples < 1) {
      throw new IllegalArgumentException("Minimum samples must be positive, but was " + builder._minSamples);
    }
    if (!(builder._minConfidence >= 0.0 && builder._minConfidence <= 1.0)) {
      throw new IllegalArgumentException("Minimum confidence must be within [0, 1], but was " + builder._minConfidence);
    }
    if (builder._sustainedKind == null && builder._spikeKind == null) {
      throw new IllegalArgumentException("At least one of the sustained and the spike tests must be enabled.");
    }
    if (builder._sustainedKind != null) {
      validateNotNull(builder._sustainedAlgorithm, "Sustained test algorithm cannot be null.");
      if ((builder._absoluteThreshold == null) == (builder._dropFraction == null)) {
        throw new IllegalArgumentException("The sustained test needs exactly one of an absolute threshold and a drop "
                                           + "fraction.");
      }
      if (builder._dropFraction != null && !(builder._dropFraction > 0.0 && builder._dropFraction <= 1.0)) {
        throw new IllegalArgumentException("Drop fraction must be within (0, 1], but was " + builder._dropFraction);
      }
      if (!(builder._sustainedRatio > 0.0 && builder._sustainedRatio <= 1.0)) {
        throw new IllegalArgumentException("Sustained ratio must be within (0, 1], but was " + builder._sustainedRatio);
      }
      if (builder._minRunLength < 1) {
        throw new IllegalArgumentException("Minimum run length must be positive, but was " + builder._minRunLength);
      }
    }
    if (builder._spikeKind != null) {
      validateNotNull(builder._spikeAlgorithm, "Spike test algorithm cannot be null.");
      if (!(builder._spikeMultiplier > 0.0)) {
        throw new IllegalArgumentException("Spike multiplier must be positive, but was " + builder._spikeMultiplier);
      }
    }
    _minSamples = builder._minSamples;
    _minConfidence = builder._minConfidence;
    _entityAttribute = builder._entityAttribute;
    _attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder._attributes));
    _sustainedKind = builder._sustainedKind;
    _sustainedAlgorithm = builder._sustainedAlgorithm;
    _sustainedDirection = builder._sustainedDirection;
    _sustainedBaseline = builder._sustainedBaseline;
    _absoluteThreshold = builder._absoluteThreshold;
    _dropFraction = builder._dropFraction;
    _sustainedRatio = builder._sustainedRatio;
    _minRunLength = builder._minRunLength;
    _spikeKind = builder._spikeKind;
    _spikeAlgorithm = builder._spikeAlgorithm;
    _spikeBaseline = builder._spikeBaseline;
    _spikeMultiplier = builder._spikeMultiplier;
    _spikeFloor = builder._spikeFloor;
  }

  /**
   * @return Label used in the names of the reported metrics, e.g. {@code read_latency_ms}.
   */
  public String metricLabel() {
    return _metricLabel;
  }

  public int minSamples() {
    return _minSamples;
  }

  public double minConfidence() {
    return _minConfidence;
  }

  /**
   * @return Name of the attribute that carries the entity key (e.g. {@code device}), or {@code null}.
   */
  public String entityAttribute() {
    return _entityAttribute;
  }

  /**
   * @return Fixed attributes attached to every reported event.
   */
  public Map<String, String> attributes() {
    return _attributes;
  }

  public boolean hasSustainedTest() {
    return _sustainedKind != null;
  }

  public AnomalyKind sustainedKind() {
    return _sustainedKind;
  }

  public String sustainedAlgorithm() {
    return _sustainedAlgorithm;
  }

  public DeviationDirection sustainedDirection() {
    return _sustainedDirection;
  }

  public BaselineMethod sustainedBaseline() {
    return _sustainedBaseline;
  }

  /**
   * @return The fixed limit of the sustained test, or {@code null} for relative drop profiles.
   */
  public Double absoluteThreshold() {
    return _absoluteThreshold;
  }

  /**
   * @return Fraction of the baseline below which a sample counts as dropped, or {@code null} for absolute profiles.
   */
  public Double dropFraction() {
    return _dropFraction;
  }

  public double sustainedRatio() {
    return _sustainedRatio;
  }

  public int minRunLength() {
    return _minRunLength;
  }

  public boolean hasSpikeTest() {
    return _spikeKind != null;
  }

  public AnomalyKind spikeKind() {
    return _spikeKind;
  }

  public String spikeAlgorithm() {
    return _spikeAlgorithm;
  }

  public BaselineMethod spikeBaseline() {
    return _spikeBaseline;
  }

  public double spikeMultiplier() {
    return _spikeMultiplier;
  }

  /**
   * @return The spike limit never goes below this value.
   */
  public double spikeFloor() {
    return _spikeFloor;
  }

  @Override
  public String toString() {
    return String.format("DeviationProfile{%s, sustained=%s, spike=%s, minSamples=%d}", _metricLabel, _sustainedKind,
                         _spikeKind, _minSamples);
  }

  public static class Builder {
    // Required
    private final String _metricLabel;
    private final int _minSamples;
    // Optional
    private double _minConfidence;
    private String _entityAttribute;
    private final Map<String, String> _attributes;
    private AnomalyKind _sustainedKind;
    private String _sustainedAlgorithm;
    private DeviationDirection _sustainedDirection;
    private BaselineMethod _sustainedBaseline;
    private Double _absoluteThreshold;
    private Double _dropFraction;
    private double _sustainedRatio;
    private int _minRunLength;
    private AnomalyKind _spikeKind;
    private String _spikeAlgorithm;
    private BaselineMethod _spikeBaseline;
    private double _spikeMultiplier;
    private double _spikeFloor;

    /**
     * @param metricLabel Label used in the names of the reported metrics.
     * @param minSamples Groups with fewer samples are not tested.
     */
    public Builder(String metricLabel, int minSamples) {
      _metricLabel = metricLabel;
      _minSamples = minSamples;
      _minConfidence = 0.0;
      _attributes = new LinkedHashMap<>();
      _sustainedDirection = DeviationDirection.ABOVE;
      _sustainedBaseline = BaselineMethod.MEDIAN;
      _sustainedRatio = 1.0;
      _minRunLength = 1;
      _spikeBaseline = BaselineMethod.MEDIAN;
      _spikeFloor = 0.0;
    }

    /**
     * (Optional) Events below this confidence are dropped.
     * @param minConfidence Minimum confidence in {@code [0, 1]}.
     * @return this builder.
     */
    public Builder minConfidence(double minConfidence) {
      _minConfidence = minConfidence;
      return this;
    }

    public Builder entityAttribute(String entityAttribute) {
      _entityAttribute = entityAttribute;
      return this;
    }

    public Builder attribute(String name, String value) {
      _attributes.put(name, value);
      return this;
    }

    /**
     * Enable a sustained test against a fixed limit.
     *
     * @param kind Kind of the reported events.
     * @param algorithm Algorithm tag of the reported events.
     * @param direction Direction in which samples must go beyond the limit.
     * @param absoluteThreshold The limit.
     * @return this builder.
     */
    public Builder sustainedBeyond(AnomalyKind kind, String algorithm, DeviationDirection direction,
                                   double absoluteThreshold) {
      _sustainedKind = kind;
      _sustainedAlgorithm = algorithm;
      _sustainedDirection = direction;
      _absoluteThreshold = absoluteThreshold;
      return this;
    }

    /**
     * Enable a sustained test for samples that drop below a fraction of the baseline.
     *
     * @param kind Kind of the reported events.
     * @param algorithm Algorithm tag of the reported events.
     * @param dropFraction A sample counts as dropped below {@code baseline * (1 - dropFraction)}.
     * @return this builder.
     */
    public Builder sustainedDrop(AnomalyKind kind, String algorithm, double dropFraction) {
      _sustainedKind = kind;
      _sustainedAlgorithm = algorithm;
      _sustainedDirection = DeviationDirection.BELOW;
      _dropFraction = dropFraction;
      return this;
    }

    public Builder sustainedBaseline(BaselineMethod sustainedBaseline) {
      _sustainedBaseline = sustainedBaseline;
      return this;
    }

    public Builder sustainedRatio(double sustainedRatio) {
      _sustainedRatio = sustainedRatio;
      return this;
    }

    public Builder minRunLength(int minRunLength) {
      _minRunLength = minRunLength;
      return this;
    }

    /**
     * Enable a spike test.
     *
     * @param kind Kind of the reported events.
     * @param algorithm Algorithm tag of the reported events.
     * @param baselineMethod How the spike baseline is computed.
     * @param spikeMultiplier A sample is a spike above {@code baseline * spikeMultiplier}.
     * @return this builder.
     */
    public Builder spike(AnomalyKind kind, String algorithm, BaselineMethod baselineMethod, double spikeMultiplier) {
      _spikeKind = kind;
      _spikeAlgorithm = algorithm;
      _spikeBaseline = baselineMethod;
      _spikeMultiplier = spikeMultiplier;
      return this;
    }

    public Builder spikeFloor(double spikeFloor) {
      _spikeFloor = spikeFloor;
      return this;
    }

    /**
     * @return A validated profile.
     * @throws IllegalArgumentException if the parameters are inconsistent.
     */
    public DeviationProfile build() {
      return new DeviationProfile(this);
    }
  }
}
