/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.datamodel;

import java.io.Serializable;

/**
 * Produces fresh, empty sketches of one concrete type. Two sketches created from the same factory
 * and seed hash ids identically, which is what makes them combinable.
 */
@FunctionalInterface
public interface SketchFactory<S extends CardinalitySketch<S>> extends Serializable {
  S create(long seed);
}
