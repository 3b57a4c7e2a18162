/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.dataset;

import com.luisppb16.seedkit.util.DatasetReadException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Dataset resource holding its files in memory. Useful for embedding generated datasets and for
 * tests. Stored trees are copied on the way in and on the way out.
 */
public class InMemoryDatasetResource implements DatasetResource {

  private final Map<String, Object> files = new LinkedHashMap<>();

  public InMemoryDatasetResource put(
      final String namespace, final String fileName, final Object content) {
    files.put(locate(namespace, fileName), DatasetMerger.deepCopy(content));
    return this;
  }

  @Override
  public Optional<Object> read(final String namespace, final String fileName) {
    final String key = locate(namespace, fileName);
    if (!files.containsKey(key)) {
      return Optional.empty();
    }
    final Object content = files.get(key);
    if (content == null) {
      throw new DatasetReadException(key, "Dataset holds JSON null");
    }
    return Optional.of(DatasetMerger.deepCopy(content));
  }

  @Override
  public String locate(final String namespace, final String fileName) {
    return "memory:" + namespace + "/" + fileName;
  }
}
