/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.util;

import lombok.Getter;

/**
 * Exception thrown when an item cannot be resolved against an enum type, either because no member
 * matches it or because the target type is not an enum at all.
 */
@Getter
public class EnumResolutionException extends RuntimeException {

  private final transient Object item;
  private final String enumName;

  public EnumResolutionException(Object item, String enumName) {
    super("'" + item + "' not found in " + enumName);
    this.item = item;
    this.enumName = enumName;
  }
}
