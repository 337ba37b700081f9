/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.aggregation;

import com.google.common.base.Preconditions;
import dev.projectasap.reachsketch.datamodel.CardinalitySketch;
import dev.projectasap.reachsketch.datamodel.Exposure;
import dev.projectasap.reachsketch.datamodel.SketchFactory;
import dev.projectasap.reachsketch.sketches.SketchBackend;
import dev.projectasap.reachsketch.sketches.baseline.ExactMultiSet;
import dev.projectasap.reachsketch.stratified.StratifiedSketch;
import dev.projectasap.reachsketch.utils.StratificationConfig;
import java.util.Map;
import org.apache.flink.api.common.functions.AggregateFunction;

/**
 * Aggregate function that builds one stratified sketch from a stream of exposures. The accumulator
 * counts ids exactly; stratification into the configured sketch type happens once, in {@link
 * #getResult}.
 */
public class StratifiedSketchAggregate<S extends CardinalitySketch<S>>
    implements AggregateFunction<Exposure, ExactMultiSet, StratifiedSketch<S>> {
  private static final long serialVersionUID = 1L;

  private final int maxFreq;
  private final long randomSeed;
  private final SketchFactory<S> sketchFactory;

  /**
   * Constructs a StratifiedSketchAggregate.
   *
   * @param maxFreq highest tracked frequency
   * @param sketchFactory produces the bucket sketches
   * @param randomSeed seed handed to the factory for every bucket
   */
  public StratifiedSketchAggregate(int maxFreq, SketchFactory<S> sketchFactory, long randomSeed) {
    if (maxFreq < 1) {
      throw new IllegalArgumentException("Max frequency (" + maxFreq + ") must be positive");
    }
    this.maxFreq = maxFreq;
    this.randomSeed = randomSeed;
    this.sketchFactory = Preconditions.checkNotNull(sketchFactory, "sketchFactory");
  }

  public StratifiedSketchAggregate(int maxFreq, SketchBackend<S> backend, long randomSeed) {
    this(maxFreq, backend.getSketchFactory(), randomSeed);
  }

  /**
   * Constructs the aggregate from string parameters.
   *
   * @param parameters configuration parameters including "maxFrequency", "randomSeed" and
   *     "sketchType", plus whatever the sketch type needs
   */
  public static StratifiedSketchAggregate<?> fromParameters(Map<String, String> parameters) {
    if (!parameters.containsKey("maxFrequency")
        || !parameters.containsKey("randomSeed")
        || !parameters.containsKey("sketchType")) {
      throw new IllegalArgumentException(
          "Missing required parameters 'maxFrequency', 'randomSeed' and/or 'sketchType'");
    }
    int maxFreq = Integer.parseInt(parameters.get("maxFrequency"));
    long randomSeed = Long.parseLong(parameters.get("randomSeed"));
    SketchBackend<?> backend = SketchBackend.forType(parameters.get("sketchType"), parameters);
    return create(maxFreq, backend, randomSeed);
  }

  public static StratifiedSketchAggregate<?> fromConfig(StratificationConfig config) {
    return create(config.maxFrequency, config.getSketchBackend(), config.randomSeed);
  }

  private static <S extends CardinalitySketch<S>> StratifiedSketchAggregate<S> create(
      int maxFreq, SketchBackend<S> backend, long randomSeed) {
    return new StratifiedSketchAggregate<>(maxFreq, backend, randomSeed);
  }

  @Override
  public ExactMultiSet createAccumulator() {
    return new ExactMultiSet();
  }

  @Override
  public ExactMultiSet add(Exposure value, ExactMultiSet acc) {
    acc.add(value.id);
    return acc;
  }

  @Override
  public ExactMultiSet merge(ExactMultiSet a, ExactMultiSet b) {
    return a.mergeCounts(b);
  }

  @Override
  public StratifiedSketch<S> getResult(ExactMultiSet acc) {
    return StratifiedSketch.fromExactMultiSet(maxFreq, acc, sketchFactory, randomSeed);
  }
}
