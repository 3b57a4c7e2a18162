/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.dataset;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.luisppb16.seedkit.model.Locale;
import com.luisppb16.seedkit.util.DatasetNotFoundException;
import com.luisppb16.seedkit.util.DatasetReadException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads locale datasets and global resources from a {@link DatasetResource}.
 *
 * <p>Key responsibilities include:
 *
 * <ul>
 *   <li>Resolving {@code <locale>/<providerKey>.json} against the backing resource
 *   <li>Falling back to the root locale for composite locales such as {@code en-gb}
 *   <li>Composing root and exact-locale files with top-level key replacement
 *   <li>Reading locale-independent files from the {@code global} namespace
 * </ul>
 *
 * <p>A load either returns a fully composed dataset or throws; nothing is handed out half built.
 */
@Slf4j
public class DatasetStore {

  public static final String FILE_EXTENSION = ".json";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  @Getter private final DatasetResource resource;

  public DatasetStore(final DatasetResource resource) {
    this.resource = Objects.requireNonNull(resource, "Dataset resource cannot be null");
  }

  /**
   * Loads the dataset of {@code providerKey} for {@code locale}.
   *
   * @throws DatasetNotFoundException if neither the exact-locale file nor, for a composite locale,
   *     the root-locale file exists
   * @throws DatasetReadException if a file exists but is not a JSON object
   */
  public Map<String, Object> load(final Locale locale, final String providerKey) {
    final String fileName = providerKey + FILE_EXTENSION;
    final Map<String, Object> data = new LinkedHashMap<>();
    boolean found = false;

    if (locale.isComposite()) {
      final Optional<Map<String, Object>> base = readMapping(locale.getRoot(), fileName);
      if (base.isPresent()) {
        data.putAll(base.get());
        found = true;
      } else {
        log.warn("No {} dataset for root locale {}", providerKey, locale.getRoot());
      }
    }

    final Optional<Map<String, Object>> exact = readMapping(locale.getValue(), fileName);
    if (exact.isPresent()) {
      data.putAll(exact.get());
      found = true;
    } else if (found) {
      log.debug("No {} dataset for {}, using {}", providerKey, locale, locale.getRoot());
    }

    if (!found) {
      throw new DatasetNotFoundException(resource.locate(locale.getValue(), fileName));
    }
    log.debug("Loaded {} dataset for {} ({} keys)", providerKey, locale, data.size());
    return data;
  }

  /**
   * Reads a file from the {@code global} namespace.
   *
   * @throws DatasetNotFoundException if the file does not exist
   */
  public Object readGlobal(final String fileName) {
    return resource
        .read(DatasetResource.GLOBAL_NAMESPACE, fileName)
        .orElseThrow(
            () ->
                new DatasetNotFoundException(
                    resource.locate(DatasetResource.GLOBAL_NAMESPACE, fileName)));
  }

  /** Reads a global file and binds it to {@code type} through Jackson. */
  public <T> T readGlobal(final String fileName, final Class<T> type) {
    final Object tree = readGlobal(fileName);
    try {
      return MAPPER.convertValue(tree, type);
    } catch (final IllegalArgumentException e) {
      throw new DatasetReadException(
          resource.locate(DatasetResource.GLOBAL_NAMESPACE, fileName), e);
    }
  }

  @SuppressWarnings("unchecked")
  private Optional<Map<String, Object>> readMapping(final String namespace, final String fileName) {
    final Optional<Object> content = resource.read(namespace, fileName);
    if (content.isEmpty()) {
      return Optional.empty();
    }
    if (!(content.get() instanceof Map<?, ?> map)) {
      throw new DatasetReadException(
          resource.locate(namespace, fileName), "Dataset must be a JSON object");
    }
    return Optional.of((Map<String, Object>) map);
  }
}
