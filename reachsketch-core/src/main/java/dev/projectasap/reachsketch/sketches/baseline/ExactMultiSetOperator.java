/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.sketches.baseline;

import dev.projectasap.reachsketch.datamodel.SketchOperator;

/**
 * Set algebra over exact multisets. Results record presence only: every id in a result has count
 * 1, since a bucket holds an id at most once.
 */
public class ExactMultiSetOperator implements SketchOperator<ExactMultiSet> {
  private static final long serialVersionUID = 1L;

  @Override
  public ExactMultiSet union(ExactMultiSet a, ExactMultiSet b) {
    ExactMultiSet result = new ExactMultiSet();
    for (Long id : a.ids()) {
      result.markPresent(id);
    }
    for (Long id : b.ids()) {
      result.markPresent(id);
    }
    return result;
  }

  @Override
  public ExactMultiSet intersection(ExactMultiSet a, ExactMultiSet b) {
    ExactMultiSet smaller = a.size() <= b.size() ? a : b;
    ExactMultiSet larger = smaller == a ? b : a;
    ExactMultiSet result = new ExactMultiSet();
    for (Long id : smaller.ids()) {
      if (larger.contains(id)) {
        result.markPresent(id);
      }
    }
    return result;
  }

  @Override
  public ExactMultiSet difference(ExactMultiSet a, ExactMultiSet b) {
    ExactMultiSet result = new ExactMultiSet();
    for (Long id : a.ids()) {
      if (!b.contains(id)) {
        result.markPresent(id);
      }
    }
    return result;
  }
}
