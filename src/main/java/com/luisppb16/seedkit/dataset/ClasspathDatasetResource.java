/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.dataset;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.luisppb16.seedkit.util.DatasetReadException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Dataset resource backed by files on the classpath.
 *
 * <p>Files live under a root directory, {@value #DEFAULT_ROOT} unless another one is given, laid
 * out as {@code <root>/<namespace>/<fileName>}. Parsed files are cached per path, including
 * misses, and every read hands out a deep copy so callers can mutate what they get.
 */
@Slf4j
public class ClasspathDatasetResource implements DatasetResource {

  public static final String DEFAULT_ROOT = "/datasets";

  private static final ClasspathDatasetResource DEFAULT = new ClasspathDatasetResource();

  @Getter private final String root;
  private final ObjectMapper mapper = new ObjectMapper();
  private final Map<String, Optional<Object>> cache = new ConcurrentHashMap<>();

  public ClasspathDatasetResource() {
    this(DEFAULT_ROOT);
  }

  public ClasspathDatasetResource(final String root) {
    Objects.requireNonNull(root, "Dataset root cannot be null");
    final String withSlash = root.startsWith("/") ? root : "/" + root;
    this.root =
        withSlash.endsWith("/") ? withSlash.substring(0, withSlash.length() - 1) : withSlash;
  }

  /** Shared instance reading from {@value #DEFAULT_ROOT}. */
  public static ClasspathDatasetResource defaultResource() {
    return DEFAULT;
  }

  @Override
  public Optional<Object> read(final String namespace, final String fileName) {
    final String path = locate(namespace, fileName);
    return cache.computeIfAbsent(path, this::parse).map(DatasetMerger::deepCopy);
  }

  @Override
  public String locate(final String namespace, final String fileName) {
    return root + "/" + namespace + "/" + fileName;
  }

  private Optional<Object> parse(final String path) {
    try (final InputStream in = ClasspathDatasetResource.class.getResourceAsStream(path)) {
      if (Objects.isNull(in)) {
        log.debug("No dataset at {}", path);
        return Optional.empty();
      }
      final Object tree = mapper.readValue(in, new TypeReference<Object>() {});
      if (tree == null) {
        throw new DatasetReadException(path, "Dataset holds JSON null");
      }
      log.debug("Parsed dataset {}", path);
      return Optional.of(tree);
    } catch (final IOException e) {
      throw new DatasetReadException(path, e);
    }
  }
}
