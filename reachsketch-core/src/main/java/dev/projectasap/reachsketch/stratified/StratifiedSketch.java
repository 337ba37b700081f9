/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.stratified;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import dev.projectasap.reachsketch.datamodel.CardinalitySketch;
import dev.projectasap.reachsketch.datamodel.SketchFactory;
import dev.projectasap.reachsketch.sketches.baseline.ExactMultiSet;
import java.io.Serializable;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Per-frequency summary of one or more data sources. Holds one sketch per frequency bucket {@code
 * 1..maxFreq} plus an "any" bucket with every id regardless of frequency.
 *
 * <p>Invariants, established at construction and preserved by the estimators:
 *
 * <ul>
 *   <li>buckets {@code 1..maxFreq} are pairwise disjoint;
 *   <li>the any bucket is the union of buckets {@code 1..maxFreq};
 *   <li>an id in bucket {@code k < maxFreq} has frequency exactly {@code k}, an id in bucket {@code
 *       maxFreq} has frequency of at least {@code maxFreq}.
 * </ul>
 *
 * <p>Instances are immutable once built. {@link #bucket(int)} and {@link #anyBucket()} hand out
 * copies, so the bucket sketches held here are never reachable from outside the package.
 */
public final class StratifiedSketch<S extends CardinalitySketch<S>> implements Serializable {
  private static final long serialVersionUID = 1L;

  public static final String ANY_BUCKET = "any";

  private final int maxFreq;
  private final long randomSeed;
  // Plain ArrayList: Flink's Kryo serializer rebuilds collections through add()
  private final ArrayList<S> frequencyBuckets;
  private final S any;

  StratifiedSketch(int maxFreq, long randomSeed, List<S> frequencyBuckets, S any) {
    SaturatingSum.checkMaxFreq(maxFreq);
    Preconditions.checkArgument(
        frequencyBuckets.size() == maxFreq,
        "Expected %s frequency buckets, got %s",
        maxFreq,
        frequencyBuckets.size());
    this.maxFreq = maxFreq;
    this.randomSeed = randomSeed;
    this.frequencyBuckets = new ArrayList<>(frequencyBuckets);
    this.any = Preconditions.checkNotNull(any, "any bucket");
  }

  /**
   * Stratified sketch with every bucket empty.
   *
   * @param maxFreq highest tracked frequency, at least 1
   * @param sketchFactory produces the bucket sketches
   * @param randomSeed seed handed to the factory for every bucket
   */
  public static <S extends CardinalitySketch<S>> StratifiedSketch<S> empty(
      int maxFreq, SketchFactory<S> sketchFactory, long randomSeed) {
    SaturatingSum.checkMaxFreq(maxFreq);
    Preconditions.checkNotNull(sketchFactory, "sketchFactory");
    return new StratifiedSketch<>(
        maxFreq,
        randomSeed,
        newBuckets(maxFreq, sketchFactory, randomSeed),
        sketchFactory.create(randomSeed));
  }

  /**
   * Build from true per-id frequencies. Ids with frequency 0 are treated as absent.
   *
   * @param maxFreq highest tracked frequency; higher frequencies land in bucket {@code maxFreq}
   * @param frequencies id to true frequency
   * @param sketchFactory produces the bucket sketches
   * @param randomSeed seed handed to the factory for every bucket
   * @throws IllegalArgumentException if maxFreq is not positive or any frequency is negative
   */
  public static <S extends CardinalitySketch<S>> StratifiedSketch<S> fromFrequencies(
      int maxFreq,
      Map<Long, Integer> frequencies,
      SketchFactory<S> sketchFactory,
      long randomSeed) {
    SaturatingSum.checkMaxFreq(maxFreq);
    Preconditions.checkNotNull(frequencies, "frequencies");
    Preconditions.checkNotNull(sketchFactory, "sketchFactory");
    for (Map.Entry<Long, Integer> entry : frequencies.entrySet()) {
      if (entry.getValue() < 0) {
        throw new IllegalArgumentException(
            "Frequency of id " + entry.getKey() + " must not be negative, got " + entry.getValue());
      }
    }

    List<S> buckets = newBuckets(maxFreq, sketchFactory, randomSeed);
    S any = sketchFactory.create(randomSeed);
    for (Map.Entry<Long, Integer> entry : frequencies.entrySet()) {
      int frequency = entry.getValue();
      if (frequency == 0) {
        continue;
      }
      long id = entry.getKey();
      buckets.get(SaturatingSum.cap(frequency, maxFreq) - 1).add(id);
      any.add(id);
    }
    return new StratifiedSketch<>(maxFreq, randomSeed, buckets, any);
  }

  /** Build from an exact multiset whose counts are the true frequencies. */
  public static <S extends CardinalitySketch<S>> StratifiedSketch<S> fromExactMultiSet(
      int maxFreq, ExactMultiSet multiSet, SketchFactory<S> sketchFactory, long randomSeed) {
    Preconditions.checkNotNull(multiSet, "multiSet");
    return fromFrequencies(maxFreq, multiSet.materialize(), sketchFactory, randomSeed);
  }

  /**
   * Build from a sequence of sets, one per source. Repeats of an id inside a set count as repeat
   * exposures. The sequence is consumed exactly once.
   */
  public static <S extends CardinalitySketch<S>> StratifiedSketch<S> fromSets(
      int maxFreq,
      Iterable<? extends Iterable<Long>> sets,
      SketchFactory<S> sketchFactory,
      long randomSeed) {
    SaturatingSum.checkMaxFreq(maxFreq);
    Preconditions.checkNotNull(sets, "sets");
    Preconditions.checkNotNull(sketchFactory, "sketchFactory");
    ExactMultiSet counts = new ExactMultiSet();
    for (Iterable<Long> set : sets) {
      counts.addAll(set);
    }
    return fromExactMultiSet(maxFreq, counts, sketchFactory, randomSeed);
  }

  private static <S extends CardinalitySketch<S>> List<S> newBuckets(
      int maxFreq, SketchFactory<S> sketchFactory, long randomSeed) {
    List<S> buckets = new ArrayList<>(maxFreq);
    for (int k = 1; k <= maxFreq; k++) {
      buckets.add(sketchFactory.create(randomSeed));
    }
    return buckets;
  }

  /**
   * Check that another sketch was built with the same max frequency and random seed.
   *
   * @throws IncompatibleSketchesException if either differs
   */
  public void assertCompatible(StratifiedSketch<?> other) {
    Preconditions.checkNotNull(other, "other");
    if (maxFreq != other.maxFreq) {
      throw new IncompatibleSketchesException(
          "Max frequency mismatch: " + maxFreq + " vs " + other.maxFreq);
    }
    if (randomSeed != other.randomSeed) {
      throw new IncompatibleSketchesException(
          "Random seed mismatch: " + randomSeed + " vs " + other.randomSeed);
    }
  }

  public int getMaxFreq() {
    return maxFreq;
  }

  public long getRandomSeed() {
    return randomSeed;
  }

  /**
   * @param frequency bucket key in {@code 1..maxFreq}
   * @return a copy of the sketch holding ids of that (capped) frequency
   */
  public S bucket(int frequency) {
    return frequencyBucket(frequency).copy();
  }

  /**
   * @return a copy of the sketch holding every id
   */
  public S anyBucket() {
    return any.copy();
  }

  S frequencyBucket(int frequency) {
    if (frequency < 1 || frequency > maxFreq) {
      throw new IndexOutOfBoundsException(
          "Frequency bucket " + frequency + " outside 1.." + maxFreq);
    }
    return frequencyBuckets.get(frequency - 1);
  }

  List<S> frequencyBuckets() {
    return Collections.unmodifiableList(frequencyBuckets);
  }

  S any() {
    return any;
  }

  public Map<Long, Integer> materializedBucket(int frequency) {
    return frequencyBucket(frequency).materialize();
  }

  public Map<Long, Integer> materializedAny() {
    return any.materialize();
  }

  /** Deep copy; the copy shares no bucket sketch with this instance. */
  public StratifiedSketch<S> copy() {
    List<S> buckets = new ArrayList<>(maxFreq);
    for (S bucket : frequencyBuckets) {
      buckets.add(bucket.copy());
    }
    return new StratifiedSketch<>(maxFreq, randomSeed, buckets, any.copy());
  }

  /**
   * @return estimated cardinality of buckets {@code 1..maxFreq}, index {@code k - 1} for bucket k
   */
  public double[] estimateBucketCardinalities() {
    double[] estimates = new double[maxFreq];
    for (int k = 1; k <= maxFreq; k++) {
      estimates[k - 1] = frequencyBucket(k).estimateCardinality();
    }
    return estimates;
  }

  /**
   * Estimated "k+ reach": index {@code k - 1} holds the number of ids seen at least k times. Index
   * 0 is the any bucket estimate.
   */
  public double[] estimateCumulativeReach() {
    double[] bucketEstimates = estimateBucketCardinalities();
    double[] reach = new double[maxFreq];
    double runningTotal = 0;
    for (int k = maxFreq; k >= 2; k--) {
      runningTotal += bucketEstimates[k - 1];
      reach[k - 1] = runningTotal;
    }
    reach[0] = any.estimateCardinality();
    return reach;
  }

  /**
   * Estimate bucket cardinalities.
   *
   * @param params {"bucket": k} or {"bucket": "any"} for one bucket, null or {} for all of them
   * @return bucket key to estimated cardinality
   */
  public JsonNode query(JsonNode params) {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode queryResult = objectMapper.createObjectNode();

    if (params != null && params.has("bucket")) {
      JsonNode requested = params.get("bucket");
      if (ANY_BUCKET.equals(requested.asText())) {
        queryResult.put(ANY_BUCKET, any.estimateCardinality());
      } else if (requested.canConvertToInt()) {
        int frequency = requested.asInt();
        queryResult.put(
            String.valueOf(frequency), frequencyBucket(frequency).estimateCardinality());
      } else {
        throw new IllegalArgumentException("Invalid bucket: " + requested);
      }
      return queryResult;
    }

    for (int k = 1; k <= maxFreq; k++) {
      queryResult.put(String.valueOf(k), frequencyBucket(k).estimateCardinality());
    }
    queryResult.put(ANY_BUCKET, any.estimateCardinality());
    return queryResult;
  }

  public byte[] serializeToBytes() {
    List<byte[]> serializedBuckets = new ArrayList<>(maxFreq + 1);
    int totalSize = Integer.BYTES + Long.BYTES;
    for (S bucket : frequencyBuckets) {
      serializedBuckets.add(bucket.serializeToBytes());
    }
    serializedBuckets.add(any.serializeToBytes());
    for (byte[] bytes : serializedBuckets) {
      totalSize += Integer.BYTES + bytes.length;
    }

    ByteBuffer buffer = ByteBuffer.allocate(totalSize).order(ByteOrder.LITTLE_ENDIAN);
    buffer.putInt(maxFreq);
    buffer.putLong(randomSeed);
    // Buckets 1..maxFreq first, any bucket last
    for (byte[] bytes : serializedBuckets) {
      buffer.putInt(bytes.length);
      buffer.put(bytes);
    }
    return buffer.array();
  }

  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode jsonNode = objectMapper.createObjectNode();
    jsonNode.put("max_freq", maxFreq);
    jsonNode.put("random_seed", randomSeed);

    ObjectNode buckets = objectMapper.createObjectNode();
    for (int k = 1; k <= maxFreq; k++) {
      buckets.set(String.valueOf(k), frequencyBucket(k).serializeToJson());
    }
    buckets.set(ANY_BUCKET, any.serializeToJson());
    jsonNode.set("buckets", buckets);
    return jsonNode;
  }

  /**
   * @return summed memory footprint of all buckets in bytes
   */
  public long get_memory() {
    long total = any.get_memory();
    for (S bucket : frequencyBuckets) {
      total += bucket.get_memory();
    }
    return total;
  }

  @Override
  public String toString() {
    return "StratifiedSketch{maxFreq=" + maxFreq + ", randomSeed=" + randomSeed + "}";
  }
}
