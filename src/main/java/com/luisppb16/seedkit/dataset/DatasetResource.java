/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.dataset;

import java.util.Optional;

/**
 * Backing key-value resource datasets are read from.
 *
 * <p>Files are addressed by a namespace, either a locale tag such as {@code en-gb} or {@link
 * #GLOBAL_NAMESPACE}, and a file name such as {@code person.json}. Values are JSON trees made of
 * maps, lists, strings, numbers, booleans and {@code null}.
 */
public interface DatasetResource {

  String GLOBAL_NAMESPACE = "global";

  /**
   * Reads a file.
   *
   * @return the parsed content, or empty if the file does not exist. The returned tree belongs to
   *     the caller and may be mutated.
   * @throws com.luisppb16.seedkit.util.DatasetReadException if the file exists but cannot be read
   */
  Optional<Object> read(String namespace, String fileName);

  /** Human-readable location of a file, used in error messages. */
  String locate(String namespace, String fileName);
}
