/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.sketches.datasketches;

import com.esotericsoftware.kryo.DefaultSerializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.reachsketch.datamodel.CardinalitySketch;
import dev.projectasap.reachsketch.datamodel.SketchFactory;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.Map;
import org.apache.datasketches.hash.MurmurHash3;
import org.apache.datasketches.memory.Memory;
import org.apache.datasketches.theta.CompactSketch;
import org.apache.datasketches.theta.HashIterator;
import org.apache.datasketches.theta.Sketch;
import org.apache.datasketches.theta.UpdateSketch;

/**
 * Wrapper around an Apache DataSketches Theta sketch. The random seed is used as the DataSketches
 * hash seed, so sketches built with different seeds cannot be combined.
 *
 * <p>A freshly created sketch is updatable. Results of set operations are compact and read-only.
 * Java serialization and Flink's Kryo serialization both carry the DataSketches image.
 */
@DefaultSerializer(ThetaSketchKryoSerializer.class)
public class ThetaCardinalitySketch implements CardinalitySketch<ThetaCardinalitySketch> {
  private static final long serialVersionUID = 1L;

  public final int nominalEntries;
  public final long seed;
  private transient Sketch sketch;

  public ThetaCardinalitySketch(int nominalEntries, long seed) {
    this(
        nominalEntries,
        seed,
        UpdateSketch.builder().setNominalEntries(nominalEntries).setSeed(seed).build());
  }

  ThetaCardinalitySketch(int nominalEntries, long seed, Sketch sketch) {
    this.nominalEntries = nominalEntries;
    this.seed = seed;
    this.sketch = sketch;
  }

  /**
   * Constructs a sketch factory from string parameters.
   *
   * @param parameters configuration parameters including "nominalEntries"
   * @return factory producing empty updatable sketches
   */
  public static SketchFactory<ThetaCardinalitySketch> factory(Map<String, String> parameters) {
    if (!parameters.containsKey("nominalEntries")) {
      throw new IllegalArgumentException("Missing required parameter 'nominalEntries'");
    }
    return factory(Integer.parseInt(parameters.get("nominalEntries")));
  }

  public static SketchFactory<ThetaCardinalitySketch> factory(int nominalEntries) {
    if (nominalEntries <= 0) {
      throw new IllegalArgumentException(
          "Nominal entries (" + nominalEntries + ") must be positive");
    }
    return seed -> new ThetaCardinalitySketch(nominalEntries, seed);
  }

  /** Rebuild a sketch from the image written by {@link Sketch#toByteArray()}. */
  static ThetaCardinalitySketch fromImage(
      int nominalEntries, long seed, boolean updatable, byte[] image) {
    Memory memory = Memory.wrap(image);
    Sketch sketch =
        updatable ? UpdateSketch.heapify(memory, seed) : CompactSketch.heapify(memory, seed);
    return new ThetaCardinalitySketch(nominalEntries, seed, sketch);
  }

  Sketch sketch() {
    return sketch;
  }

  public boolean isUpdatable() {
    return sketch instanceof UpdateSketch;
  }

  @Override
  public void add(long id) {
    if (!isUpdatable()) {
      throw new IllegalStateException("Theta sketch produced by a set operation is read-only");
    }
    ((UpdateSketch) sketch).update(id);
  }

  /**
   * Approximate membership: true only if the id's hash is among the retained hashes. Ids whose hash
   * fell above theta are reported absent.
   */
  @Override
  public boolean contains(long id) {
    long hash = MurmurHash3.hash(new long[] {id}, seed)[0] >>> 1;
    if (hash >= sketch.getThetaLong()) {
      return false;
    }
    HashIterator iterator = sketch.iterator();
    while (iterator.next()) {
      if (iterator.get() == hash) {
        return true;
      }
    }
    return false;
  }

  @Override
  public Map<Long, Integer> materialize() {
    throw new UnsupportedOperationException("Theta sketches retain hashes, not ids");
  }

  @Override
  public double estimateCardinality() {
    return sketch.getEstimate();
  }

  @Override
  public ThetaCardinalitySketch newEmpty() {
    return new ThetaCardinalitySketch(nominalEntries, seed);
  }

  @Override
  public ThetaCardinalitySketch copy() {
    if (isUpdatable()) {
      UpdateSketch copied = UpdateSketch.heapify(Memory.wrap(sketch.toByteArray()), seed);
      return new ThetaCardinalitySketch(nominalEntries, seed, copied);
    }
    // Compact sketches are immutable and can be shared
    return new ThetaCardinalitySketch(nominalEntries, seed, sketch);
  }

  @Override
  public byte[] serializeToBytes() {
    return sketch.compact().toByteArray();
  }

  @Override
  public String serializeToString() {
    return sketch.toString();
  }

  @Override
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode rootNode = objectMapper.createObjectNode();
    rootNode.put("nominalEntries", nominalEntries);
    rootNode.put("seed", seed);
    rootNode.put("retainedEntries", sketch.getRetainedEntries());
    rootNode.put("theta", sketch.getTheta());
    rootNode.put("estimate", sketch.getEstimate());
    return rootNode;
  }

  @Override
  public long get_memory() {
    return sketch.getCurrentBytes();
  }

  private void writeObject(ObjectOutputStream out) throws IOException {
    out.defaultWriteObject();
    out.writeBoolean(isUpdatable());
    byte[] bytes = sketch.toByteArray();
    out.writeInt(bytes.length);
    out.write(bytes);
  }

  private void readObject(ObjectInputStream in) throws IOException, ClassNotFoundException {
    in.defaultReadObject();
    boolean updatable = in.readBoolean();
    byte[] bytes = new byte[in.readInt()];
    in.readFully(bytes);
    this.sketch = fromImage(nominalEntries, seed, updatable, bytes).sketch;
  }
}
