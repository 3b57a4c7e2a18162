/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.util;

/**
 * Exception thrown when a value of the wrong type or shape is supplied, such as a random source
 * that is not a {@link com.luisppb16.seedkit.random.SeededRandom} or a dataset patch that is not
 * a mapping.
 */
public class TypeMismatchException extends RuntimeException {

  public TypeMismatchException(String message) {
    super(message);
  }
}
