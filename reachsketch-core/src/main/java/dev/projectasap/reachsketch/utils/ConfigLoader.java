/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.io.Resources;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utility class for loading stratification settings from YAML files. */
public class ConfigLoader {
  private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

  /**
   * Loads stratification configuration from a YAML file.
   *
   * @param configFilePath path to the YAML configuration file
   * @return parsed stratification configuration
   * @throws IOException if file reading or parsing fails
   * @throws IllegalArgumentException if a required setting is missing or invalid
   */
  public static StratificationConfig loadConfig(String configFilePath) throws IOException {
    String yamlContent =
        new String(Files.readAllBytes(Paths.get(configFilePath)), StandardCharsets.UTF_8);
    StratificationConfig config = parseConfig(yamlContent);
    LOG.info("Loaded stratification config from {}: {}", configFilePath, config);
    return config;
  }

  /**
   * Loads stratification configuration from a YAML file on the classpath.
   *
   * @param resourceName classpath resource name, without a leading slash
   * @return parsed stratification configuration
   * @throws IOException if the resource cannot be read or parsed
   * @throws IllegalArgumentException if the resource is missing or a required setting is invalid
   */
  public static StratificationConfig loadConfigResource(String resourceName) throws IOException {
    String yamlContent =
        Resources.toString(Resources.getResource(resourceName), StandardCharsets.UTF_8);
    StratificationConfig config = parseConfig(yamlContent);
    LOG.info("Loaded stratification config from classpath:{}: {}", resourceName, config);
    return config;
  }

  /**
   * Parses stratification configuration from YAML text.
   *
   * @param yamlContent YAML document with a top-level "stratification" section
   * @return parsed stratification configuration
   * @throws IOException if the text is not valid YAML
   */
  public static StratificationConfig parseConfig(String yamlContent) throws IOException {
    ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    ObjectNode rootNode = mapper.readValue(yamlContent, ObjectNode.class);

    JsonNode node = rootNode.get("stratification");
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException("Missing required section 'stratification'");
    }

    StratificationConfig config = new StratificationConfig();
    config.maxFrequency = requireField(node, "maxFrequency").asInt();
    if (config.maxFrequency < 1) {
      throw new IllegalArgumentException(
          "maxFrequency (" + config.maxFrequency + ") must be positive");
    }
    config.randomSeed = requireField(node, "randomSeed").asLong();
    config.sketchType = requireField(node, "sketchType").asText();

    Map<String, String> parameters = new HashMap<>();
    JsonNode parametersNode = node.get("parameters");
    if (parametersNode != null) {
      parametersNode
          .fields()
          .forEachRemaining(
              entry -> {
                parameters.put(entry.getKey(), entry.getValue().asText());
              });
    }
    config.parameters = parameters;

    // Unknown sketch types and missing sketch parameters fail here
    config.getSketchBackend();
    return config;
  }

  private static JsonNode requireField(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException("Missing required setting '" + field + "'");
    }
    return value;
  }
}
