/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.examples.basic;

import dev.projectasap.reachsketch.sketches.SketchBackend;
import dev.projectasap.reachsketch.sketches.datasketches.ThetaCardinalitySketch;
import dev.projectasap.reachsketch.stratified.SequentialEstimator;
import dev.projectasap.reachsketch.stratified.StratifiedSketch;
import dev.projectasap.reachsketch.utils.ConfigLoader;
import dev.projectasap.reachsketch.utils.StratificationConfig;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds Theta-backed stratified sketches for several publishers with overlapping audiences and
 * merges them in one pass. Takes an optional YAML config path; without it the bundled
 * theta-stratification.yaml is used.
 */
public class SequentialMergeExample {
  private static final Logger LOG = LoggerFactory.getLogger(SequentialMergeExample.class);

  public static void main(String[] args) throws Exception {
    StratificationConfig config =
        args.length > 0
            ? ConfigLoader.loadConfig(args[0])
            : ConfigLoader.loadConfigResource("theta-stratification.yaml");
    if (!SketchBackend.THETA.equals(config.sketchType)) {
      throw new IllegalArgumentException("This example needs sketchType 'theta'");
    }
    SketchBackend<ThetaCardinalitySketch> backend = SketchBackend.theta(config.parameters);

    // Each publisher reaches 2000 ids out of a shared universe, a few of them repeatedly
    Random random = new Random(config.randomSeed);
    List<StratifiedSketch<ThetaCardinalitySketch>> publisherSketches = new ArrayList<>();
    for (int publisher = 0; publisher < 4; publisher++) {
      List<Long> exposures = new ArrayList<>();
      for (int i = 0; i < 2000; i++) {
        long id = random.nextInt(10000);
        int repeats = 1 + random.nextInt(3);
        for (int r = 0; r < repeats; r++) {
          exposures.add(id);
        }
      }
      publisherSketches.add(
          StratifiedSketch.fromSets(
              config.maxFrequency,
              Collections.singletonList(exposures),
              backend.getSketchFactory(),
              config.randomSeed));
    }

    SequentialEstimator<ThetaCardinalitySketch> estimator =
        backend.sequentialEstimator(config.maxFrequency, config.randomSeed);
    StratifiedSketch<ThetaCardinalitySketch> merged = estimator.mergeSketches(publisherSketches);

    LOG.info("Per-bucket estimates: {}", merged.query(null));
    LOG.info("k+ reach: {}", Arrays.toString(merged.estimateCumulativeReach()));
  }
}
