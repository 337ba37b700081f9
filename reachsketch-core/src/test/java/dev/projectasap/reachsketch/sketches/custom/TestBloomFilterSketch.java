/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.sketches.custom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.google.common.collect.ImmutableMap;
import dev.projectasap.reachsketch.datamodel.SketchFactory;
import org.junit.jupiter.api.Test;

public class TestBloomFilterSketch {
  private static final int LENGTH = 1 << 16;
  private static final int NUM_HASHES = 3;

  private final SketchFactory<BloomFilterSketch> factory =
      BloomFilterSketch.factory(LENGTH, NUM_HASHES);
  private final BloomFilterOperator operator = new BloomFilterOperator();

  @Test
  public void testNoFalseNegatives() {
    BloomFilterSketch sketch = factory.create(1L);
    for (long id = 0; id < 1000; id++) {
      sketch.add(id);
    }
    for (long id = 0; id < 1000; id++) {
      assertThat(sketch.contains(id)).isTrue();
    }
  }

  @Test
  public void testEmptyFilter() {
    BloomFilterSketch sketch = factory.create(1L);
    assertThat(sketch.contains(42L)).isFalse();
    assertThat(sketch.estimateCardinality()).isZero();
    assertThat(sketch.countSetBits()).isZero();
  }

  @Test
  public void testEstimateCloseToTrueCardinality() {
    BloomFilterSketch sketch = factory.create(7L);
    for (long id = 0; id < 2000; id++) {
      sketch.add(id);
      sketch.add(id);
    }
    assertThat(sketch.estimateCardinality()).isCloseTo(2000.0, within(100.0));
  }

  @Test
  public void testSeedChangesHashing() {
    BloomFilterSketch first = factory.create(1L);
    BloomFilterSketch second = factory.create(2L);
    first.add(12345L);
    second.add(12345L);

    assertThat(first.serializeToJson().get("words"))
        .isNotEqualTo(second.serializeToJson().get("words"));
  }

  @Test
  public void testUnionContainsBothSides() {
    BloomFilterSketch a = factory.create(3L);
    BloomFilterSketch b = factory.create(3L);
    for (long id = 0; id < 100; id++) {
      a.add(id);
      b.add(id + 1000);
    }

    BloomFilterSketch union = operator.union(a, b);
    for (long id = 0; id < 100; id++) {
      assertThat(union.contains(id)).isTrue();
      assertThat(union.contains(id + 1000)).isTrue();
    }
    assertThat(a.contains(1000L)).isFalse();
  }

  @Test
  public void testIntersectionAndDifference() {
    BloomFilterSketch a = factory.create(3L);
    BloomFilterSketch b = factory.create(3L);
    a.add(1L);
    a.add(2L);
    b.add(2L);
    b.add(3L);

    BloomFilterSketch intersection = operator.intersection(a, b);
    assertThat(intersection.contains(2L)).isTrue();
    assertThat(intersection.contains(1L)).isFalse();
    assertThat(intersection.contains(3L)).isFalse();

    BloomFilterSketch difference = operator.difference(a, b);
    assertThat(difference.contains(1L)).isTrue();
    assertThat(difference.contains(2L)).isFalse();
  }

  @Test
  public void testCombineRejectsMismatchedFilters() {
    BloomFilterSketch a = factory.create(1L);
    assertThatThrownBy(() -> operator.union(a, factory.create(2L)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("seed mismatch");
    assertThatThrownBy(() -> operator.union(a, new BloomFilterSketch(LENGTH / 2, NUM_HASHES, 1L)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("dimension mismatch");
  }

  @Test
  public void testFactoryFromParameters() {
    BloomFilterSketch sketch =
        BloomFilterSketch.factory(ImmutableMap.of("length", "128", "numHashes", "2")).create(5L);
    assertThat(sketch.length).isEqualTo(128);
    assertThat(sketch.numHashes).isEqualTo(2);
    assertThat(sketch.seed).isEqualTo(5L);
    assertThat(sketch.get_memory()).isEqualTo(2 * Long.BYTES);

    assertThatThrownBy(() -> BloomFilterSketch.factory(ImmutableMap.of("length", "128")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("numHashes");
  }

  @Test
  public void testMaterializeUnsupported() {
    assertThatThrownBy(() -> factory.create(1L).materialize())
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
