/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.sketches.custom;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.primitives.Longs;
import dev.projectasap.reachsketch.datamodel.CardinalitySketch;
import dev.projectasap.reachsketch.datamodel.SketchFactory;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Map;
import org.apache.commons.codec.digest.XXHash32;

/**
 * Bloom filter over ids. Each id sets {@code numHashes} bits chosen by XXHash32 functions derived
 * from the random seed, so two filters built with the same seed and dimensions can be combined
 * bitwise.
 */
public class BloomFilterSketch implements CardinalitySketch<BloomFilterSketch> {
  private static final long serialVersionUID = 1L;

  public final int length;
  public final int numHashes;
  public final long seed;
  final long[] words;
  private transient XXHash32[] hashFunctions;

  /**
   * Constructs an empty BloomFilterSketch.
   *
   * @param length number of bits
   * @param numHashes number of hash functions
   * @param seed random seed the hash functions are derived from
   */
  public BloomFilterSketch(int length, int numHashes, long seed) {
    if (length <= 0 || numHashes <= 0) {
      throw new IllegalArgumentException(
          "Length (" + length + ") and number of hashes (" + numHashes + ") must be positive");
    }
    this.length = length;
    this.numHashes = numHashes;
    this.seed = seed;
    this.words = new long[(length + Long.SIZE - 1) / Long.SIZE];
  }

  /**
   * Constructs a sketch factory from string parameters.
   *
   * @param parameters configuration parameters including "length" and "numHashes"
   * @return factory producing empty filters of the configured dimensions
   */
  public static SketchFactory<BloomFilterSketch> factory(Map<String, String> parameters) {
    if (!parameters.containsKey("length") || !parameters.containsKey("numHashes")) {
      throw new IllegalArgumentException("Missing required parameters 'length' and/or 'numHashes'");
    }
    int length = Integer.parseInt(parameters.get("length"));
    int numHashes = Integer.parseInt(parameters.get("numHashes"));
    return factory(length, numHashes);
  }

  public static SketchFactory<BloomFilterSketch> factory(int length, int numHashes) {
    if (length <= 0 || numHashes <= 0) {
      throw new IllegalArgumentException(
          "Length (" + length + ") and number of hashes (" + numHashes + ") must be positive");
    }
    return seed -> new BloomFilterSketch(length, numHashes, seed);
  }

  @Override
  public void add(long id) {
    byte[] idBytes = Longs.toByteArray(id);
    for (int i = 0; i < numHashes; i++) {
      setBit(bitIndex(i, idBytes));
    }
  }

  @Override
  public boolean contains(long id) {
    byte[] idBytes = Longs.toByteArray(id);
    for (int i = 0; i < numHashes; i++) {
      if (!getBit(bitIndex(i, idBytes))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public Map<Long, Integer> materialize() {
    throw new UnsupportedOperationException("Bloom filters do not retain ids");
  }

  /** Linear counting estimate from the number of set bits. */
  @Override
  public double estimateCardinality() {
    int setBits = countSetBits();
    if (setBits == 0) {
      return 0.0;
    }
    // A full filter has no finite estimate; treat it as one bit short of full
    int zeroBits = Math.max(length - setBits, 1);
    return -((double) length / numHashes) * Math.log((double) zeroBits / length);
  }

  public int countSetBits() {
    int total = 0;
    for (long word : words) {
      total += Long.bitCount(word);
    }
    return total;
  }

  /**
   * Check that two filters share dimensions and seed.
   *
   * @throws IllegalArgumentException if they differ
   */
  public void checkCompatible(BloomFilterSketch other) {
    if (length != other.length || numHashes != other.numHashes) {
      throw new IllegalArgumentException("Cannot combine: dimension mismatch!");
    }
    if (seed != other.seed) {
      throw new IllegalArgumentException(
          "Cannot combine: seed mismatch (" + seed + " vs " + other.seed + ")");
    }
  }

  @Override
  public BloomFilterSketch newEmpty() {
    return new BloomFilterSketch(length, numHashes, seed);
  }

  @Override
  public BloomFilterSketch copy() {
    BloomFilterSketch copy = new BloomFilterSketch(length, numHashes, seed);
    System.arraycopy(words, 0, copy.words, 0, words.length);
    return copy;
  }

  @Override
  public byte[] serializeToBytes() {
    ByteBuffer buffer =
        ByteBuffer.allocate(Integer.BYTES + Integer.BYTES + Long.BYTES + Long.BYTES * words.length)
            .order(ByteOrder.LITTLE_ENDIAN);
    buffer.putInt(length);
    buffer.putInt(numHashes);
    buffer.putLong(seed);
    for (long word : words) {
      buffer.putLong(word);
    }
    return buffer.array();
  }

  @Override
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode jsonNode = objectMapper.createObjectNode();
    jsonNode.put("length", length);
    jsonNode.put("numHashes", numHashes);
    jsonNode.put("seed", seed);

    ArrayNode wordArray = objectMapper.createArrayNode();
    for (long word : words) {
      wordArray.add(word);
    }
    jsonNode.set("words", wordArray);
    return jsonNode;
  }

  @Override
  public long get_memory() {
    return (long) words.length * Long.BYTES;
  }

  private int bitIndex(int hashIndex, byte[] idBytes) {
    XXHash32 hash = hashFunctions()[hashIndex];
    hash.reset();
    hash.update(idBytes, 0, idBytes.length);
    return Integer.remainderUnsigned((int) hash.getValue(), length);
  }

  private XXHash32[] hashFunctions() {
    if (hashFunctions == null) {
      XXHash32[] functions = new XXHash32[numHashes];
      int baseSeed = (int) (seed ^ (seed >>> 32));
      for (int i = 0; i < numHashes; i++) {
        // Hash function i is seeded from the sketch seed offset by its index
        functions[i] = new XXHash32(baseSeed * 31 + i);
      }
      hashFunctions = functions;
    }
    return hashFunctions;
  }

  private void setBit(int index) {
    words[index >>> 6] |= 1L << (index & 63);
  }

  private boolean getBit(int index) {
    return (words[index >>> 6] & (1L << (index & 63))) != 0;
  }
}
