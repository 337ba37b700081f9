/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.datamodel;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A single observation of an id at a publisher. Used as the input unit when stratified sketches are
 * built from a stream.
 */
@JsonPropertyOrder({"timestamp", "publisher", "id"})
public class Exposure {
  public Long timestamp;
  public String publisher;
  public Long id;

  /** Default constructor initializing all fields to default values. */
  public Exposure() {
    this.timestamp = 0L;
    this.publisher = "";
    this.id = 0L;
  }

  /**
   * Constructs an Exposure with specified values.
   *
   * @param timestamp the event timestamp
   * @param publisher the source that observed the id
   * @param id the observed identifier
   */
  public Exposure(Long timestamp, String publisher, Long id) {
    this.timestamp = timestamp;
    this.publisher = publisher;
    this.id = id;
  }

  @Override
  public String toString() {
    return "Exposure{"
        + "timestamp="
        + timestamp
        + ", publisher='"
        + publisher
        + '\''
        + ", id="
        + id
        + '}';
  }
}
