/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.datamodel;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.Serializable;
import java.util.Map;

/**
 * Capability every sketch held in a frequency bucket must offer. Uses self-referential generic type
 * S so that factories and operators stay bound to one concrete sketch type.
 *
 * <p>A sketch never merges itself with another one: combining is the job of a {@link
 * SketchOperator} supplied by the caller.
 *
 * <p>Each bucket sketch can be written out as bytes or as JSON for reporting.
 */
public interface CardinalitySketch<S extends CardinalitySketch<S>> extends Serializable {

  /**
   * Insert one occurrence of an id.
   *
   * @param id the identifier
   */
  void add(long id);

  /**
   * Insert a sequence of occurrences. Equivalent to calling {@link #add(long)} for each id.
   *
   * @param ids the identifiers, repeats meaningful
   */
  default void addAll(Iterable<Long> ids) {
    for (Long id : ids) {
      add(id);
    }
  }

  /**
   * Membership test. Exact or approximate depending on the concrete type.
   *
   * @param id the identifier
   * @return true if the sketch (probably) holds the id
   */
  boolean contains(long id);

  /**
   * Read-only snapshot of id to count (or to 1 for presence-only sketches).
   *
   * @return immutable id to count view
   * @throws UnsupportedOperationException if the sketch does not retain ids
   */
  Map<Long, Integer> materialize();

  /**
   * @return true if {@link #materialize()} lists the ids instead of throwing
   */
  default boolean retainsIds() {
    return false;
  }

  /**
   * @return number of distinct ids, exact or estimated
   */
  double estimateCardinality();

  /**
   * @return a deep copy sharing no mutable state with this sketch
   */
  S copy();

  /**
   * @return an empty sketch with the same dimensions and seed, so it combines with this one
   */
  S newEmpty();

  byte[] serializeToBytes();

  JsonNode serializeToJson();

  default String serializeToString() {
    return serializeToJson().toString();
  }

  /**
   * Get the memory footprint of this sketch in bytes, without JVM object overhead.
   *
   * @return Memory usage in bytes
   */
  long get_memory();
}
