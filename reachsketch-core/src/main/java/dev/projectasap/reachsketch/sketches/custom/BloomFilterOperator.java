/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.sketches.custom;

import dev.projectasap.reachsketch.datamodel.SketchOperator;

/**
 * Bitwise combine rules for Bloom filters. Union is exact with respect to the filters; intersection
 * and difference are approximations of the set operations on the underlying ids.
 */
public class BloomFilterOperator implements SketchOperator<BloomFilterSketch> {
  private static final long serialVersionUID = 1L;

  @Override
  public BloomFilterSketch union(BloomFilterSketch a, BloomFilterSketch b) {
    a.checkCompatible(b);
    BloomFilterSketch result = a.copy();
    for (int i = 0; i < result.words.length; i++) {
      result.words[i] |= b.words[i];
    }
    return result;
  }

  @Override
  public BloomFilterSketch intersection(BloomFilterSketch a, BloomFilterSketch b) {
    a.checkCompatible(b);
    BloomFilterSketch result = a.copy();
    for (int i = 0; i < result.words.length; i++) {
      result.words[i] &= b.words[i];
    }
    return result;
  }

  @Override
  public BloomFilterSketch difference(BloomFilterSketch a, BloomFilterSketch b) {
    a.checkCompatible(b);
    BloomFilterSketch result = a.copy();
    for (int i = 0; i < result.words.length; i++) {
      result.words[i] &= ~b.words[i];
    }
    return result;
  }
}
