/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.stratified;

import static dev.projectasap.reachsketch.stratified.StratifiedSketchFixtures.exact;
import static dev.projectasap.reachsketch.stratified.StratifiedSketchFixtures.randomMultiSet;
import static dev.projectasap.reachsketch.stratified.StratifiedSketchFixtures.sourceA;
import static dev.projectasap.reachsketch.stratified.StratifiedSketchFixtures.sourceB;
import static dev.projectasap.reachsketch.stratified.StratifiedSketchFixtures.stratify;
import static dev.projectasap.reachsketch.stratified.StratifiedSketchFixtures.summedFrequencies;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.projectasap.reachsketch.sketches.SketchBackend;
import dev.projectasap.reachsketch.sketches.baseline.ExactMultiSet;
import dev.projectasap.reachsketch.sketches.baseline.ExactMultiSetOperator;
import dev.projectasap.reachsketch.sketches.custom.BloomFilterOperator;
import dev.projectasap.reachsketch.sketches.custom.BloomFilterSketch;
import dev.projectasap.reachsketch.sketches.datasketches.ThetaCardinalitySketch;
import dev.projectasap.reachsketch.sketches.datasketches.ThetaSketchOperator;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class TestPairwiseEstimator {
  private final PairwiseEstimator<ExactMultiSet> estimator =
      new PairwiseEstimator<>(new ExactMultiSetOperator());

  @Test
  public void testMergeSketches() {
    StratifiedSketch<ExactMultiSet> merged =
        estimator.mergeSketches(exact(3, sourceA()), exact(3, sourceB()));

    assertThat(merged.getMaxFreq()).isEqualTo(3);
    assertThat(merged.getRandomSeed()).isEqualTo(StratifiedSketchFixtures.SEED);
    assertThat(merged.materializedAny())
        .containsOnlyKeys(1L, 2L, 3L, 4L, 5L)
        .containsValues(1);
    assertThat(merged.materializedBucket(1)).containsOnlyKeys(5L).containsEntry(5L, 1);
    assertThat(merged.materializedBucket(2)).containsOnlyKeys(3L);
    assertThat(merged.materializedBucket(3)).containsOnlyKeys(1L, 2L, 4L);
  }

  @Test
  public void testMergeIsCommutative() {
    StratifiedSketch<ExactMultiSet> ab =
        estimator.mergeSketches(exact(3, sourceA()), exact(3, sourceB()));
    StratifiedSketch<ExactMultiSet> ba =
        estimator.mergeSketches(exact(3, sourceB()), exact(3, sourceA()));

    for (int k = 1; k <= 3; k++) {
      assertThat(ab.materializedBucket(k)).isEqualTo(ba.materializedBucket(k));
    }
    assertThat(ab.materializedAny()).isEqualTo(ba.materializedAny());
  }

  @Test
  public void testMergeDoesNotMutateInputs() {
    StratifiedSketch<ExactMultiSet> left = exact(3, sourceA());
    StratifiedSketch<ExactMultiSet> right = exact(3, sourceB());
    Map<Long, Integer> leftBucketOne = left.materializedBucket(1);
    Map<Long, Integer> rightAny = right.materializedAny();

    StratifiedSketch<ExactMultiSet> merged = estimator.mergeSketches(left, right);

    assertThat(left.materializedBucket(1)).isEqualTo(leftBucketOne);
    assertThat(right.materializedAny()).isEqualTo(rightAny);
    assertThat(merged.anyBucket()).isNotSameAs(left.anyBucket()).isNotSameAs(right.anyBucket());
  }

  @Test
  public void testMergeMatchesSaturatedTrueFrequencies() {
    Random random = new Random(5);
    for (int trial = 0; trial < 25; trial++) {
      int maxFreq = 1 + random.nextInt(5);
      ExactMultiSet a = randomMultiSet(random, 60, 120);
      ExactMultiSet b = randomMultiSet(random, 60, 120);

      StratifiedSketch<ExactMultiSet> merged =
          estimator.mergeSketches(exact(maxFreq, a), exact(maxFreq, b));

      for (Map.Entry<Long, Integer> entry : summedFrequencies(a, b).entrySet()) {
        int bucket = SaturatingSum.cap(entry.getValue(), maxFreq);
        assertThat(merged.materializedBucket(bucket)).containsKey(entry.getKey());
      }
      assertAnyIsUnionOfBuckets(merged);
    }
  }

  @Test
  public void testSaturatedFrequencyStaysSaturated() {
    // Both sides hold the id at the cap; the merge cannot tell 2 + 2 from 5 + 9
    StratifiedSketch<ExactMultiSet> left =
        exact(2, StratifiedSketchFixtures.multiSet(StratifiedSketchFixtures.id(1, 5)));
    StratifiedSketch<ExactMultiSet> right =
        exact(2, StratifiedSketchFixtures.multiSet(StratifiedSketchFixtures.id(1, 9)));

    StratifiedSketch<ExactMultiSet> merged = estimator.mergeSketches(left, right);

    assertThat(merged.materializedBucket(1)).isEmpty();
    assertThat(merged.materializedBucket(2)).containsOnlyKeys(1L);
    assertThat(merged.estimateCumulativeReach()).containsExactly(1.0, 1.0);
  }

  @Test
  public void testIncompatibleSketchesRejected() {
    StratifiedSketch<ExactMultiSet> base = exact(3, sourceA());
    StratifiedSketch<ExactMultiSet> otherMaxFreq = exact(2, sourceB());
    StratifiedSketch<ExactMultiSet> otherSeed =
        StratifiedSketch.fromExactMultiSet(3, sourceB(), ExactMultiSet.factory(), 99L);

    assertThatThrownBy(() -> estimator.mergeSketches(base, otherMaxFreq))
        .isInstanceOf(IncompatibleSketchesException.class)
        .hasMessageContaining("Max frequency");
    assertThatThrownBy(() -> estimator.mergeSketches(otherSeed, base))
        .isInstanceOf(IncompatibleSketchesException.class)
        .hasMessageContaining("Random seed");
  }

  @Test
  public void testMergeAllFoldsLeftToRight() {
    StratifiedSketch<ExactMultiSet> folded =
        estimator.mergeAll(Arrays.asList(exact(3, sourceA()), exact(3, sourceB())));
    assertThat(folded.materializedBucket(3)).containsOnlyKeys(1L, 2L, 4L);

    assertThatThrownBy(() -> estimator.mergeAll(Arrays.asList()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void testEstimateCumulativeReach() {
    double[] reach =
        estimator.estimateCumulativeReach(Arrays.asList(exact(3, sourceA()), exact(3, sourceB())));
    assertThat(reach).containsExactly(5.0, 4.0, 3.0);
  }

  @Test
  public void testThetaBackendMatchesExactScenario() {
    SketchBackend<ThetaCardinalitySketch> backend = SketchBackend.theta(thetaParameters());
    PairwiseEstimator<ThetaCardinalitySketch> thetaEstimator =
        new PairwiseEstimator<>(new ThetaSketchOperator());

    StratifiedSketch<ThetaCardinalitySketch> merged =
        thetaEstimator.mergeSketches(
            stratify(3, sourceA(), backend.getSketchFactory()),
            stratify(3, sourceB(), backend.getSketchFactory()));

    assertThat(merged.estimateBucketCardinalities()).containsExactly(1.0, 1.0, 3.0);
    assertThat(merged.anyBucket().estimateCardinality()).isEqualTo(5.0);
    assertThat(merged.bucket(1).contains(5L)).isTrue();
    assertThat(merged.bucket(2).contains(3L)).isTrue();
    assertThat(merged.bucket(3).contains(4L)).isTrue();
    assertThat(merged.bucket(3).contains(5L)).isFalse();
  }

  @Test
  public void testBloomFilterBackendMatchesExactScenario() {
    PairwiseEstimator<BloomFilterSketch> bloomEstimator =
        new PairwiseEstimator<>(new BloomFilterOperator());
    StratifiedSketch<BloomFilterSketch> merged =
        bloomEstimator.mergeSketches(
            stratify(3, sourceA(), BloomFilterSketch.factory(1 << 20, 3)),
            stratify(3, sourceB(), BloomFilterSketch.factory(1 << 20, 3)));

    Map<Long, Integer> expectedBucket = new HashMap<>();
    expectedBucket.put(1L, 3);
    expectedBucket.put(2L, 3);
    expectedBucket.put(3L, 2);
    expectedBucket.put(4L, 3);
    expectedBucket.put(5L, 1);
    for (Map.Entry<Long, Integer> entry : expectedBucket.entrySet()) {
      assertThat(merged.anyBucket().contains(entry.getKey())).isTrue();
      for (int k = 1; k <= 3; k++) {
        assertThat(merged.bucket(k).contains(entry.getKey()))
            .as("id %s in bucket %s", entry.getKey(), k)
            .isEqualTo(k == entry.getValue());
      }
    }
  }

  @Test
  public void testApproximateBackendSeedMismatchRejected() {
    SketchBackend<ThetaCardinalitySketch> backend = SketchBackend.theta(thetaParameters());
    StratifiedSketch<ThetaCardinalitySketch> left =
        StratifiedSketch.fromExactMultiSet(3, sourceA(), backend.getSketchFactory(), 1L);
    StratifiedSketch<ThetaCardinalitySketch> right =
        StratifiedSketch.fromExactMultiSet(3, sourceB(), backend.getSketchFactory(), 2L);

    assertThatThrownBy(() -> backend.pairwiseEstimator().mergeSketches(left, right))
        .isInstanceOf(IncompatibleSketchesException.class);
  }

  static void assertAnyIsUnionOfBuckets(StratifiedSketch<ExactMultiSet> sketch) {
    Set<Long> union = new HashSet<>();
    for (int k = 1; k <= sketch.getMaxFreq(); k++) {
      for (Long id : sketch.materializedBucket(k).keySet()) {
        assertThat(union.add(id)).as("id %s in more than one bucket", id).isTrue();
      }
    }
    assertThat(sketch.materializedAny().keySet()).isEqualTo(union);
  }

  private static Map<String, String> thetaParameters() {
    Map<String, String> parameters = new HashMap<>();
    parameters.put("nominalEntries", "4096");
    return parameters;
  }
}
