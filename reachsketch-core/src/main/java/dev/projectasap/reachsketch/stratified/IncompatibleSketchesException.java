/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.reachsketch.stratified;

/**
 * Thrown when stratified sketches that were built with a different max frequency or random seed
 * are about to be merged.
 */
public class IncompatibleSketchesException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public IncompatibleSketchesException(String message) {
    super(message);
  }
}
