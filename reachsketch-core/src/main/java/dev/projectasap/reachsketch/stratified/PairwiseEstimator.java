/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.stratified;

import com.google.common.base.Preconditions;
import dev.projectasap.reachsketch.datamodel.CardinalitySketch;
import dev.projectasap.reachsketch.datamodel.SketchOperator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Merges two stratified sketches, the natural primitive when summaries arrive one at a time. */
public class PairwiseEstimator<S extends CardinalitySketch<S>>
    extends AbstractStratifiedEstimator<S> {
  private static final long serialVersionUID = 1L;
  private static final Logger LOG = LoggerFactory.getLogger(PairwiseEstimator.class);

  public PairwiseEstimator(SketchOperator<S> sketchOperator) {
    super(sketchOperator);
  }

  /**
   * Merge two stratified sketches into a new one. Neither input is modified.
   *
   * @param left first sketch; its max frequency and seed carry over to the result
   * @param right second sketch
   * @return the stratified sketch of the union
   * @throws IncompatibleSketchesException if max frequency or seed differ
   */
  public StratifiedSketch<S> mergeSketches(StratifiedSketch<S> left, StratifiedSketch<S> right) {
    Preconditions.checkNotNull(left, "left");
    Preconditions.checkNotNull(right, "right");
    left.assertCompatible(right);

    int maxFreq = left.getMaxFreq();
    LOG.debug("Merging two stratified sketches with maxFreq={}", maxFreq);
    List<S> buckets =
        mergeFrequencyBuckets(
            maxFreq,
            left.frequencyBuckets(),
            left.any(),
            right.frequencyBuckets(),
            right.any());
    S any = mergeAny(left.any(), right.any());
    return new StratifiedSketch<>(maxFreq, left.getRandomSeed(), buckets, any);
  }

  /** Left fold of {@link #mergeSketches} over a non-empty list. */
  @Override
  public StratifiedSketch<S> mergeAll(List<StratifiedSketch<S>> sketches) {
    Preconditions.checkNotNull(sketches, "sketches");
    Preconditions.checkArgument(!sketches.isEmpty(), "Cannot merge an empty list of sketches");
    StratifiedSketch<S> first = sketches.get(0);
    for (StratifiedSketch<S> sketch : sketches) {
      first.assertCompatible(sketch);
    }
    StratifiedSketch<S> merged = first.copy();
    for (int i = 1; i < sketches.size(); i++) {
      merged = mergeSketches(merged, sketches.get(i));
    }
    return merged;
  }
}
