/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.stratified;

import com.google.common.base.Preconditions;
import dev.projectasap.reachsketch.datamodel.CardinalitySketch;
import dev.projectasap.reachsketch.datamodel.SketchOperator;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared merge logic for stratified sketches. Combining is expressed as bucket algebra through the
 * supplied {@link SketchOperator}, so it applies to any sketch type the operator understands.
 *
 * <p>An id with bucket key {@code i} on the left and {@code j} on the right (0 when absent) belongs
 * in bucket {@code min(i + j, maxFreq)} of the result. The ids with keys {@code (i, j)} are:
 *
 * <ul>
 *   <li>{@code left[i] ∩ right[j]} when both keys are at least 1;
 *   <li>{@code left[i] \ right.any} when {@code j = 0};
 *   <li>{@code right[j] \ left.any} when {@code i = 0}.
 * </ul>
 */
public abstract class AbstractStratifiedEstimator<S extends CardinalitySketch<S>>
    implements Serializable {
  private static final long serialVersionUID = 1L;

  protected final SketchOperator<S> sketchOperator;

  protected AbstractStratifiedEstimator(SketchOperator<S> sketchOperator) {
    this.sketchOperator = Preconditions.checkNotNull(sketchOperator, "sketchOperator");
  }

  public SketchOperator<S> getSketchOperator() {
    return sketchOperator;
  }

  /**
   * Merge a list of compatible stratified sketches into one.
   *
   * @throws IncompatibleSketchesException if max frequency or seed differ
   */
  public abstract StratifiedSketch<S> mergeAll(List<StratifiedSketch<S>> sketches);

  /**
   * Merge the sketches and report "k+ reach" of the union.
   *
   * @return index {@code k - 1} holds the estimated number of ids seen at least k times
   */
  public double[] estimateCumulativeReach(List<StratifiedSketch<S>> sketches) {
    return mergeAll(sketches).estimateCumulativeReach();
  }

  /** Frequency buckets {@code 1..maxFreq} of the union of two bucket sets. Inputs are untouched. */
  protected List<S> mergeFrequencyBuckets(
      int maxFreq, List<S> left, S leftAny, List<S> right, S rightAny) {
    List<S> merged = new ArrayList<>(maxFreq);
    for (int k = 0; k < maxFreq; k++) {
      merged.add(null);
    }

    for (int i = 0; i <= maxFreq; i++) {
      for (int j = 0; j <= maxFreq; j++) {
        if (i == 0 && j == 0) {
          continue;
        }
        S part;
        if (j == 0) {
          part = sketchOperator.difference(left.get(i - 1), rightAny);
        } else if (i == 0) {
          part = sketchOperator.difference(right.get(j - 1), leftAny);
        } else {
          part = sketchOperator.intersection(left.get(i - 1), right.get(j - 1));
        }
        int target = SaturatingSum.add(i, j, maxFreq) - 1;
        S current = merged.get(target);
        merged.set(target, current == null ? part : sketchOperator.union(current, part));
      }
    }
    // Every bucket k received at least the (k, 0) term, so no entry is left null
    return merged;
  }

  protected S mergeAny(S leftAny, S rightAny) {
    return sketchOperator.union(leftAny, rightAny);
  }
}
