/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.stratified;

import com.google.common.base.Preconditions;
import dev.projectasap.reachsketch.datamodel.CardinalitySketch;
import dev.projectasap.reachsketch.datamodel.SketchFactory;
import dev.projectasap.reachsketch.datamodel.SketchOperator;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges N stratified sketches at once. Gives the same buckets as folding {@link
 * PairwiseEstimator} over the list.
 *
 * <p>When the bucket sketches retain their ids, every id's bucket keys are summed with saturation
 * across all inputs in one traversal and each result bucket is filled once, with no sketch
 * operator calls. Other sketch types cannot list their ids, so their frequency buckets are folded
 * through the bucket algebra input by input, which costs as many operator calls as the pairwise
 * fold. That path still skips the N-1 intermediate stratified sketches.
 */
public class SequentialEstimator<S extends CardinalitySketch<S>>
    extends AbstractStratifiedEstimator<S> {
  private static final long serialVersionUID = 1L;
  private static final Logger LOG = LoggerFactory.getLogger(SequentialEstimator.class);

  private final int defaultMaxFreq;
  private final SketchFactory<S> defaultFactory;
  private final long defaultSeed;

  /** Estimator that rejects an empty input list. */
  public SequentialEstimator(SketchOperator<S> sketchOperator) {
    super(sketchOperator);
    this.defaultMaxFreq = 0;
    this.defaultFactory = null;
    this.defaultSeed = 0L;
  }

  /**
   * Estimator that answers an empty input list with an empty stratified sketch.
   *
   * @param sketchOperator combine rules for the bucket sketches
   * @param defaultMaxFreq max frequency of the empty result
   * @param defaultFactory bucket factory for the empty result
   * @param defaultSeed random seed of the empty result
   */
  public SequentialEstimator(
      SketchOperator<S> sketchOperator,
      int defaultMaxFreq,
      SketchFactory<S> defaultFactory,
      long defaultSeed) {
    super(sketchOperator);
    SaturatingSum.checkMaxFreq(defaultMaxFreq);
    this.defaultMaxFreq = defaultMaxFreq;
    this.defaultFactory = Preconditions.checkNotNull(defaultFactory, "defaultFactory");
    this.defaultSeed = defaultSeed;
  }

  /**
   * Merge all sketches into a new one. Inputs are not modified.
   *
   * @param sketches sketches to merge, all compatible with the first one
   * @return the stratified sketch of the union; a copy for a single input
   * @throws IncompatibleSketchesException if any sketch differs from the first in max frequency or
   *     seed
   * @throws IllegalArgumentException if the list is empty and no defaults were configured
   */
  public StratifiedSketch<S> mergeSketches(List<StratifiedSketch<S>> sketches) {
    Preconditions.checkNotNull(sketches, "sketches");
    if (sketches.isEmpty()) {
      if (defaultFactory == null) {
        throw new IllegalArgumentException(
            "Cannot merge an empty list of sketches without a default max frequency and seed");
      }
      return StratifiedSketch.empty(defaultMaxFreq, defaultFactory, defaultSeed);
    }

    StratifiedSketch<S> first = sketches.get(0);
    for (StratifiedSketch<S> sketch : sketches) {
      first.assertCompatible(sketch);
    }
    if (sketches.size() == 1) {
      return first.copy();
    }

    int maxFreq = first.getMaxFreq();
    if (allRetainIds(sketches)) {
      LOG.debug("Merging {} id-retaining sketches in one pass", sketches.size());
      return mergeByIds(sketches, maxFreq);
    }

    LOG.debug("Merging {} stratified sketches with maxFreq={}", sketches.size(), maxFreq);
    List<S> buckets = first.frequencyBuckets();
    S any = first.any();
    for (int i = 1; i < sketches.size(); i++) {
      StratifiedSketch<S> next = sketches.get(i);
      buckets =
          mergeFrequencyBuckets(maxFreq, buckets, any, next.frequencyBuckets(), next.any());
      any = mergeAny(any, next.any());
    }
    return new StratifiedSketch<>(maxFreq, first.getRandomSeed(), buckets, any);
  }

  private boolean allRetainIds(List<StratifiedSketch<S>> sketches) {
    for (StratifiedSketch<S> sketch : sketches) {
      if (!sketch.any().retainsIds()) {
        return false;
      }
      for (S bucket : sketch.frequencyBuckets()) {
        if (!bucket.retainsIds()) {
          return false;
        }
      }
    }
    return true;
  }

  private StratifiedSketch<S> mergeByIds(List<StratifiedSketch<S>> sketches, int maxFreq) {
    // Partition holds per input, so each id meets at most one bucket key per sketch
    Map<Long, Integer> keys = new HashMap<>();
    for (StratifiedSketch<S> sketch : sketches) {
      for (int k = 1; k <= maxFreq; k++) {
        for (Long id : sketch.frequencyBucket(k).materialize().keySet()) {
          keys.merge(id, k, (left, right) -> SaturatingSum.add(left, right, maxFreq));
        }
      }
    }

    S template = sketches.get(0).any();
    List<S> buckets = new ArrayList<>(maxFreq);
    for (int k = 1; k <= maxFreq; k++) {
      buckets.add(template.newEmpty());
    }
    S any = template.newEmpty();
    for (Map.Entry<Long, Integer> entry : keys.entrySet()) {
      buckets.get(entry.getValue() - 1).add(entry.getKey());
      any.add(entry.getKey());
    }
    return new StratifiedSketch<>(maxFreq, sketches.get(0).getRandomSeed(), buckets, any);
  }

  @Override
  public StratifiedSketch<S> mergeAll(List<StratifiedSketch<S>> sketches) {
    return mergeSketches(sketches);
  }
}
