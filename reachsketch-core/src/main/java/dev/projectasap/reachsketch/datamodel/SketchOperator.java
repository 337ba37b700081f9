/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.datamodel;

import java.io.Serializable;

/**
 * Stateless combine rules for two sketches of the same concrete type. Every operation returns a new
 * sketch and leaves both inputs untouched.
 *
 * <p>{@link #union} is the combine operation proper. Intersection and difference let the
 * stratified merge be written as bucket algebra, so it also works for sketches that cannot list
 * their ids.
 */
public interface SketchOperator<S extends CardinalitySketch<S>> extends Serializable {

  /** Ids present in either sketch. */
  S union(S a, S b);

  /** Ids present in both sketches. */
  S intersection(S a, S b);

  /** Ids present in {@code a} but not in {@code b}. */
  S difference(S a, S b);
}
