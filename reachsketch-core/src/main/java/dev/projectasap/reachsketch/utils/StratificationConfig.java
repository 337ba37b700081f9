/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.reachsketch.sketches.SketchBackend;
import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;

/**
 * Settings shared by every stratified sketch that is meant to be merged: the frequency cap, the
 * random seed, and the bucket sketch type with its parameters.
 */
public class StratificationConfig implements Serializable {
  private static final long serialVersionUID = 1L;

  public int maxFrequency;
  public long randomSeed;
  public String sketchType;
  public Map<String, String> parameters;

  public StratificationConfig() {
    this.maxFrequency = 1;
    this.randomSeed = 0L;
    this.sketchType = SketchBackend.EXACT;
    this.parameters = new HashMap<>();
  }

  public StratificationConfig(
      int maxFrequency, long randomSeed, String sketchType, Map<String, String> parameters) {
    this.maxFrequency = maxFrequency;
    this.randomSeed = randomSeed;
    this.sketchType = sketchType;
    this.parameters = new HashMap<>(parameters);
  }

  /**
   * Instantiates the bucket sketch backend named by the configuration.
   *
   * @return the backend
   * @throws IllegalArgumentException for an unknown type or missing parameters
   */
  public SketchBackend<?> getSketchBackend() {
    return SketchBackend.forType(sketchType, parameters);
  }

  /**
   * Serializes the configuration to JSON.
   *
   * @return JsonNode containing the configuration details
   */
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode jsonNode = objectMapper.createObjectNode();

    jsonNode.put("maxFrequency", maxFrequency);
    jsonNode.put("randomSeed", randomSeed);
    jsonNode.put("sketchType", sketchType);
    jsonNode.putPOJO("parameters", parameters);
    return jsonNode;
  }

  @Override
  public String toString() {
    return serializeToJson().toString();
  }
}
