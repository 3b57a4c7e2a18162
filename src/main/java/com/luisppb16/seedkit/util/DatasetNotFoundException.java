/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.util;

import lombok.Getter;

@Getter
public class DatasetNotFoundException extends RuntimeException {

  private final String path;

  public DatasetNotFoundException(String path) {
    super("Dataset not found: " + path);
    this.path = path;
  }
}
