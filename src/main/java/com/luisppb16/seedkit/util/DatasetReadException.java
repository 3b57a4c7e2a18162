/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.util;

import lombok.Getter;

/**
 * Exception thrown when a dataset file exists but cannot be read or parsed, or does not hold the
 * JSON shape the caller expects.
 */
@Getter
public class DatasetReadException extends RuntimeException {

  private final String path;

  public DatasetReadException(String path, String message) {
    super(message + ": " + path);
    this.path = path;
  }

  public DatasetReadException(String path, Throwable cause) {
    super("Unable to read dataset " + path + ": " + cause.getMessage(), cause);
    this.path = path;
  }
}
