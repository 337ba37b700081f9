/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.stratified;

/**
 * Addition capped at a maximum frequency. Together with 0 it forms a commutative monoid, which is
 * why merge results do not depend on merge order or grouping.
 */
public final class SaturatingSum {

  private SaturatingSum() {}

  /**
   * @param value a non-negative frequency
   * @param maxFreq the cap, at least 1
   * @return {@code min(value, maxFreq)}
   */
  public static int cap(int value, int maxFreq) {
    checkMaxFreq(maxFreq);
    checkFrequency(value);
    return Math.min(value, maxFreq);
  }

  /**
   * @return {@code min(a + b, maxFreq)}, without overflowing for large inputs
   */
  public static int add(int a, int b, int maxFreq) {
    checkMaxFreq(maxFreq);
    checkFrequency(a);
    checkFrequency(b);
    return (int) Math.min((long) a + b, maxFreq);
  }

  static void checkMaxFreq(int maxFreq) {
    if (maxFreq < 1) {
      throw new IllegalArgumentException("Max frequency (" + maxFreq + ") must be positive");
    }
  }

  private static void checkFrequency(int frequency) {
    if (frequency < 0) {
      throw new IllegalArgumentException("Frequency (" + frequency + ") must not be negative");
    }
  }
}
