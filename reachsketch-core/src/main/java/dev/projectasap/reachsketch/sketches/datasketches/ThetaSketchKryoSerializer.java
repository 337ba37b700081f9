/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.sketches.datasketches;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.Serializer;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

/**
 * Kryo serializer used when Flink ships a {@link ThetaCardinalitySketch} between operators. Writes
 * the DataSketches image of the wrapped sketch, since Kryo's field serializer skips it.
 */
public class ThetaSketchKryoSerializer extends Serializer<ThetaCardinalitySketch> {

  @Override
  public void write(Kryo kryo, Output output, ThetaCardinalitySketch object) {
    output.writeInt(object.nominalEntries);
    output.writeLong(object.seed);
    output.writeBoolean(object.isUpdatable());
    byte[] image = object.sketch().toByteArray();
    output.writeInt(image.length);
    output.writeBytes(image);
  }

  @Override
  public ThetaCardinalitySketch read(Kryo kryo, Input input, Class<ThetaCardinalitySketch> type) {
    int nominalEntries = input.readInt();
    long seed = input.readLong();
    boolean updatable = input.readBoolean();
    byte[] image = input.readBytes(input.readInt());
    return ThetaCardinalitySketch.fromImage(nominalEntries, seed, updatable, image);
  }

  @Override
  public ThetaCardinalitySketch copy(Kryo kryo, ThetaCardinalitySketch original) {
    return original.copy();
  }
}
