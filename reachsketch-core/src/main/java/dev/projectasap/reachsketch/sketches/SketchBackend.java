/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.sketches;

import com.google.common.base.Preconditions;
import dev.projectasap.reachsketch.datamodel.CardinalitySketch;
import dev.projectasap.reachsketch.datamodel.SketchFactory;
import dev.projectasap.reachsketch.datamodel.SketchOperator;
import dev.projectasap.reachsketch.sketches.baseline.ExactMultiSet;
import dev.projectasap.reachsketch.sketches.baseline.ExactMultiSetOperator;
import dev.projectasap.reachsketch.sketches.custom.BloomFilterOperator;
import dev.projectasap.reachsketch.sketches.custom.BloomFilterSketch;
import dev.projectasap.reachsketch.sketches.datasketches.ThetaCardinalitySketch;
import dev.projectasap.reachsketch.sketches.datasketches.ThetaSketchOperator;
import dev.projectasap.reachsketch.stratified.PairwiseEstimator;
import dev.projectasap.reachsketch.stratified.SequentialEstimator;
import java.io.Serializable;
import java.util.Map;

/**
 * A concrete bucket sketch type: the factory that creates it together with the operator that
 * combines it.
 */
public final class SketchBackend<S extends CardinalitySketch<S>> implements Serializable {
  private static final long serialVersionUID = 1L;

  public static final String EXACT = "exact";
  public static final String BLOOM_FILTER = "bloom_filter";
  public static final String THETA = "theta";

  private final String sketchType;
  private final SketchFactory<S> sketchFactory;
  private final SketchOperator<S> sketchOperator;

  public SketchBackend(
      String sketchType, SketchFactory<S> sketchFactory, SketchOperator<S> sketchOperator) {
    this.sketchType = Preconditions.checkNotNull(sketchType, "sketchType");
    this.sketchFactory = Preconditions.checkNotNull(sketchFactory, "sketchFactory");
    this.sketchOperator = Preconditions.checkNotNull(sketchOperator, "sketchOperator");
  }

  public static SketchBackend<ExactMultiSet> exact() {
    return new SketchBackend<>(EXACT, ExactMultiSet.factory(), new ExactMultiSetOperator());
  }

  public static SketchBackend<BloomFilterSketch> bloomFilter(Map<String, String> parameters) {
    return new SketchBackend<>(
        BLOOM_FILTER, BloomFilterSketch.factory(parameters), new BloomFilterOperator());
  }

  public static SketchBackend<ThetaCardinalitySketch> theta(Map<String, String> parameters) {
    return new SketchBackend<>(
        THETA, ThetaCardinalitySketch.factory(parameters), new ThetaSketchOperator());
  }

  /**
   * Instantiates the backend named by a sketch type.
   *
   * @param sketchType one of "exact", "bloom_filter", "theta"
   * @param parameters type-specific parameters
   * @throws IllegalArgumentException for an unknown type or missing parameters
   */
  public static SketchBackend<?> forType(String sketchType, Map<String, String> parameters) {
    Preconditions.checkNotNull(sketchType, "sketchType");
    Preconditions.checkNotNull(parameters, "parameters");
    switch (sketchType) {
      case EXACT:
        return exact();
      case BLOOM_FILTER:
        return bloomFilter(parameters);
      case THETA:
        return theta(parameters);
      default:
        throw new IllegalArgumentException("Unknown sketch type: " + sketchType);
    }
  }

  public String getSketchType() {
    return sketchType;
  }

  public SketchFactory<S> getSketchFactory() {
    return sketchFactory;
  }

  public SketchOperator<S> getSketchOperator() {
    return sketchOperator;
  }

  public PairwiseEstimator<S> pairwiseEstimator() {
    return new PairwiseEstimator<>(sketchOperator);
  }

  /** Sequential estimator that answers an empty input with an empty sketch of these settings. */
  public SequentialEstimator<S> sequentialEstimator(int maxFreq, long randomSeed) {
    return new SequentialEstimator<>(sketchOperator, maxFreq, sketchFactory, randomSeed);
  }
}
