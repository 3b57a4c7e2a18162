/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.dataset;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.luisppb16.seedkit.util.DatasetReadException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/** Dataset resource reading {@code <root>/<namespace>/<fileName>} from a directory, uncached. */
@Slf4j
public class FileSystemDatasetResource implements DatasetResource {

  @Getter private final Path root;
  private final ObjectMapper mapper = new ObjectMapper();

  public FileSystemDatasetResource(final Path root) {
    this.root = Objects.requireNonNull(root, "Dataset root cannot be null");
  }

  @Override
  public Optional<Object> read(final String namespace, final String fileName) {
    final Path file = resolve(namespace, fileName);
    if (!Files.isRegularFile(file)) {
      log.debug("No dataset at {}", file);
      return Optional.empty();
    }
    final Object tree;
    try {
      tree = mapper.readValue(file.toFile(), new TypeReference<Object>() {});
    } catch (final IOException e) {
      throw new DatasetReadException(file.toString(), e);
    }
    if (tree == null) {
      throw new DatasetReadException(file.toString(), "Dataset holds JSON null");
    }
    return Optional.of(tree);
  }

  @Override
  public String locate(final String namespace, final String fileName) {
    return resolve(namespace, fileName).toString();
  }

  private Path resolve(final String namespace, final String fileName) {
    return root.resolve(namespace).resolve(fileName);
  }
}
