/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.sketches.baseline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;
import dev.projectasap.reachsketch.datamodel.CardinalitySketch;
import dev.projectasap.reachsketch.datamodel.SketchFactory;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Exact frequency counter. Serves as ground truth, as the counting structure used while building
 * stratified sketches, and as the reference bucket type.
 */
public class ExactMultiSet implements CardinalitySketch<ExactMultiSet> {
  private static final long serialVersionUID = 1L;

  private final Map<Long, Integer> counts;

  public ExactMultiSet() {
    this.counts = new HashMap<>();
  }

  /**
   * Factory for exact sketches. The seed is ignored since no hashing is involved.
   *
   * @return factory producing empty multisets
   */
  public static SketchFactory<ExactMultiSet> factory() {
    return seed -> new ExactMultiSet();
  }

  @Override
  public void add(long id) {
    counts.merge(id, 1, ExactMultiSet::addCounts);
  }

  /**
   * Insert {@code count} occurrences of an id at once. A count of zero leaves the set unchanged.
   *
   * @param id the identifier
   * @param count number of occurrences
   * @throws IllegalArgumentException if count is negative
   * @throws ArithmeticException if the summed count overflows an int
   */
  public void add(long id, int count) {
    if (count < 0) {
      throw new IllegalArgumentException(
          "Frequency of id " + id + " must not be negative, got " + count);
    }
    if (count > 0) {
      counts.merge(id, count, ExactMultiSet::addCounts);
    }
  }

  /** Record an id as present without adding to its count. */
  void markPresent(long id) {
    counts.putIfAbsent(id, 1);
  }

  @Override
  public boolean contains(long id) {
    return counts.containsKey(id);
  }

  /**
   * @return occurrences recorded for the id, 0 if absent
   */
  public int frequency(long id) {
    return counts.getOrDefault(id, 0);
  }

  @Override
  public Map<Long, Integer> materialize() {
    return ImmutableMap.copyOf(counts);
  }

  @Override
  public boolean retainsIds() {
    return true;
  }

  /**
   * @return read-only live view of the distinct ids
   */
  public Set<Long> ids() {
    return Collections.unmodifiableSet(counts.keySet());
  }

  /**
   * Sum the counts of two multisets into a new one. Used to combine partial counts while
   * constructing, not as a bucket combine rule.
   *
   * @param other the multiset to add
   * @return a new multiset holding the summed counts
   * @throws ArithmeticException if a summed count overflows an int
   */
  public ExactMultiSet mergeCounts(ExactMultiSet other) {
    ExactMultiSet merged = copy();
    for (Map.Entry<Long, Integer> entry : other.counts.entrySet()) {
      merged.counts.merge(entry.getKey(), entry.getValue(), ExactMultiSet::addCounts);
    }
    return merged;
  }

  private static Integer addCounts(Integer current, Integer added) {
    return Math.addExact(current, added);
  }

  @Override
  public double estimateCardinality() {
    return counts.size();
  }

  public int size() {
    return counts.size();
  }

  @Override
  public ExactMultiSet newEmpty() {
    return new ExactMultiSet();
  }

  @Override
  public ExactMultiSet copy() {
    ExactMultiSet copy = new ExactMultiSet();
    copy.counts.putAll(counts);
    return copy;
  }

  @Override
  public byte[] serializeToBytes() {
    ByteBuffer buffer =
        ByteBuffer.allocate(Integer.BYTES + counts.size() * (Long.BYTES + Integer.BYTES))
            .order(ByteOrder.LITTLE_ENDIAN);
    buffer.putInt(counts.size());
    for (Map.Entry<Long, Integer> entry : counts.entrySet()) {
      buffer.putLong(entry.getKey());
      buffer.putInt(entry.getValue());
    }
    return buffer.array();
  }

  @Override
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode jsonNode = objectMapper.createObjectNode();
    ObjectNode ids = objectMapper.createObjectNode();
    for (Map.Entry<Long, Integer> entry : counts.entrySet()) {
      ids.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    jsonNode.set("ids", ids);
    return jsonNode;
  }

  @Override
  public long get_memory() {
    return (long) counts.size() * (Long.BYTES + Integer.BYTES);
  }

  @Override
  public String toString() {
    return "ExactMultiSet" + counts;
  }
}
