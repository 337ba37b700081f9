/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.examples.quickstart;

import dev.projectasap.reachsketch.aggregation.StratifiedSketchAggregate;
import dev.projectasap.reachsketch.datamodel.Exposure;
import dev.projectasap.reachsketch.sketches.SketchBackend;
import dev.projectasap.reachsketch.sketches.baseline.ExactMultiSet;
import dev.projectasap.reachsketch.stratified.PairwiseEstimator;
import dev.projectasap.reachsketch.stratified.StratifiedSketch;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.functions.ReduceFunction;
import org.apache.flink.api.common.typeinfo.TypeHint;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.streaming.api.windowing.assigners.TumblingEventTimeWindows;
import org.apache.flink.streaming.api.windowing.time.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Quick start example: one stratified sketch per publisher and window, merged across publishers
 * into reach per frequency bucket.
 */
public class QuickStart {
  private static final Logger LOG = LoggerFactory.getLogger(QuickStart.class);
  private static final int MAX_FREQUENCY = 3;
  private static final long RANDOM_SEED = 1L;

  public static void main(String[] args) throws Exception {
    // Set up the streaming execution environment
    StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();

    // Publisher A sees id1 twice, id2 three times, id3 once; publisher B sees id1, id3, id5
    // once and id4 five times
    DataStream<Exposure> exposures =
        env.fromElements(
            new Exposure(1L, "publisherA", 1L),
            new Exposure(2L, "publisherA", 1L),
            new Exposure(3L, "publisherA", 2L),
            new Exposure(4L, "publisherA", 2L),
            new Exposure(5L, "publisherA", 2L),
            new Exposure(6L, "publisherA", 3L),
            new Exposure(7L, "publisherB", 1L),
            new Exposure(8L, "publisherB", 3L),
            new Exposure(9L, "publisherB", 4L),
            new Exposure(10L, "publisherB", 4L),
            new Exposure(11L, "publisherB", 4L),
            new Exposure(12L, "publisherB", 4L),
            new Exposure(13L, "publisherB", 4L),
            new Exposure(14L, "publisherB", 5L));

    // Assign timestamps for windowing
    exposures =
        exposures.assignTimestampsAndWatermarks(
            WatermarkStrategy.<Exposure>forMonotonousTimestamps()
                .withTimestampAssigner((event, timestamp) -> event.timestamp));

    SketchBackend<ExactMultiSet> backend = SketchBackend.exact();
    TypeInformation<StratifiedSketch<ExactMultiSet>> sketchType =
        TypeInformation.of(new TypeHint<StratifiedSketch<ExactMultiSet>>() {});

    // Build one stratified sketch per publisher
    DataStream<StratifiedSketch<ExactMultiSet>> perPublisher =
        exposures
            .keyBy(exposure -> exposure.publisher)
            .window(TumblingEventTimeWindows.of(Time.seconds(5)))
            .aggregate(
                new StratifiedSketchAggregate<>(MAX_FREQUENCY, backend, RANDOM_SEED),
                TypeInformation.of(ExactMultiSet.class),
                sketchType);

    // Merge the publisher sketches of each window
    DataStream<StratifiedSketch<ExactMultiSet>> merged =
        perPublisher
            .windowAll(TumblingEventTimeWindows.of(Time.seconds(5)))
            .reduce(new MergeStratifiedSketches(backend.pairwiseEstimator()));

    merged
        .map(sketch -> "Reach per frequency bucket: " + sketch.query(null))
        .returns(String.class)
        .print();

    LOG.info("Starting quick start job with maxFrequency={}", MAX_FREQUENCY);
    env.execute("Quick Start - Reach and Frequency with Stratified Sketches");
  }

  /** Reduce function merging stratified sketches with a pairwise estimator. */
  private static class MergeStratifiedSketches
      implements ReduceFunction<StratifiedSketch<ExactMultiSet>> {
    private final PairwiseEstimator<ExactMultiSet> estimator;

    MergeStratifiedSketches(PairwiseEstimator<ExactMultiSet> estimator) {
      this.estimator = estimator;
    }

    @Override
    public StratifiedSketch<ExactMultiSet> reduce(
        StratifiedSketch<ExactMultiSet> left, StratifiedSketch<ExactMultiSet> right) {
      return estimator.mergeSketches(left, right);
    }
  }
}
