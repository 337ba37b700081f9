/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.sketches.datasketches;

import dev.projectasap.reachsketch.datamodel.SketchOperator;
import org.apache.datasketches.theta.CompactSketch;
import org.apache.datasketches.theta.Intersection;
import org.apache.datasketches.theta.SetOperation;
import org.apache.datasketches.theta.Union;

/** Combine rules for Theta sketches, delegating to DataSketches set operations. */
public class ThetaSketchOperator implements SketchOperator<ThetaCardinalitySketch> {
  private static final long serialVersionUID = 1L;

  @Override
  public ThetaCardinalitySketch union(ThetaCardinalitySketch a, ThetaCardinalitySketch b) {
    checkCompatible(a, b);
    Union union =
        SetOperation.builder().setNominalEntries(a.nominalEntries).setSeed(a.seed).buildUnion();
    union.union(a.sketch());
    union.union(b.sketch());
    return new ThetaCardinalitySketch(a.nominalEntries, a.seed, union.getResult());
  }

  @Override
  public ThetaCardinalitySketch intersection(ThetaCardinalitySketch a, ThetaCardinalitySketch b) {
    checkCompatible(a, b);
    Intersection intersection = SetOperation.builder().setSeed(a.seed).buildIntersection();
    CompactSketch result = intersection.intersect(a.sketch(), b.sketch());
    return new ThetaCardinalitySketch(a.nominalEntries, a.seed, result);
  }

  @Override
  public ThetaCardinalitySketch difference(ThetaCardinalitySketch a, ThetaCardinalitySketch b) {
    checkCompatible(a, b);
    CompactSketch result =
        SetOperation.builder().setSeed(a.seed).buildANotB().aNotB(a.sketch(), b.sketch());
    return new ThetaCardinalitySketch(a.nominalEntries, a.seed, result);
  }

  private static void checkCompatible(ThetaCardinalitySketch a, ThetaCardinalitySketch b) {
    if (a.nominalEntries != b.nominalEntries) {
      throw new IllegalArgumentException("Cannot combine: nominal entries mismatch!");
    }
    if (a.seed != b.seed) {
      throw new IllegalArgumentException(
          "Cannot combine: seed mismatch (" + a.seed + " vs " + b.seed + ")");
    }
  }
}
