/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.sketches.baseline;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TestExactMultiSetOperator {
  private final ExactMultiSetOperator operator = new ExactMultiSetOperator();
  private ExactMultiSet left;
  private ExactMultiSet right;

  @BeforeEach
  public void before() {
    left = new ExactMultiSet();
    left.addAll(Arrays.asList(1L, 1L, 2L, 3L));
    right = new ExactMultiSet();
    right.addAll(Arrays.asList(3L, 3L, 4L));
  }

  @Test
  public void testUnionRecordsPresence() {
    ExactMultiSet union = operator.union(left, right);
    assertThat(union.materialize())
        .containsEntry(1L, 1)
        .containsEntry(2L, 1)
        .containsEntry(3L, 1)
        .containsEntry(4L, 1)
        .hasSize(4);
  }

  @Test
  public void testIntersection() {
    assertThat(operator.intersection(left, right).materialize()).containsOnlyKeys(3L);
    assertThat(operator.intersection(right, left).materialize()).containsOnlyKeys(3L);
  }

  @Test
  public void testDifference() {
    assertThat(operator.difference(left, right).materialize()).containsOnlyKeys(1L, 2L);
    assertThat(operator.difference(right, left).materialize()).containsOnlyKeys(4L);
  }

  @Test
  public void testInputsUntouched() {
    operator.union(left, right);
    operator.intersection(left, right);
    operator.difference(left, right);

    assertThat(left.materialize()).containsEntry(1L, 2).hasSize(3);
    assertThat(right.materialize()).containsEntry(3L, 2).hasSize(2);
  }
}
